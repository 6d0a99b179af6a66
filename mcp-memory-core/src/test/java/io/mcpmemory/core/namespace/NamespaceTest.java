package io.mcpmemory.core.namespace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NamespaceTest {

    @Test
    void shouldRenderProviderModelAndDimension() {
        assertThat(new Namespace("openai", "text-embedding-3-small", 1536).toString())
            .isEqualTo("openai:text-embedding-3-small:1536");
    }

    @Test
    void shouldParseModelContainingColons() {
        Namespace namespace = Namespace.parse("ollama:nomic-embed-text:latest:768");

        assertThat(namespace.provider()).isEqualTo("ollama");
        assertThat(namespace.model()).isEqualTo("nomic-embed-text:latest");
        assertThat(namespace.dimension()).isEqualTo(768);
    }

    @Test
    void shouldRejectMalformedNamespaces() {
        assertThatThrownBy(() -> Namespace.parse("openai:1536")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Namespace.parse("openai:model:abc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Namespace.parse("openai:model:-1")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldTrackWhetherDimensionIsKnown() {
        Namespace unknown = new Namespace("openai", "m", 0);

        assertThat(unknown.dimensionKnown()).isFalse();
        assertThat(unknown.withDimension(3).dimensionKnown()).isTrue();
    }

    @Test
    void shouldSanitizeCollectionNames() {
        assertThat(Namespace.collectionName("ollama:nomic-embed-text:latest:768"))
            .isEqualTo("ollama_003anomic-embed-text_003alatest_003a768");
        assertThat(Namespace.collectionName("openai:a/b c:3")).isEqualTo("openai_003aa_002fb_0020c_003a3");
        assertThat(Namespace.collectionName("local:e5_small:384")).isEqualTo("local_003ae5__small_003a384");
    }

    @Test
    void shouldKeepCollectionNamesDistinctForDistinctNamespaces() {
        assertThat(Namespace.collectionName("a:b_c:3")).isNotEqualTo(Namespace.collectionName("a:b:c:3"));
        assertThat(Namespace.collectionName("a:b_c:3")).isNotEqualTo(Namespace.collectionName("a:b/c:3"));
        assertThat(Namespace.collectionName("a:b:3_groups"))
            .isNotEqualTo(Namespace.collectionName("a:b:3") + "_groups");
    }
}
