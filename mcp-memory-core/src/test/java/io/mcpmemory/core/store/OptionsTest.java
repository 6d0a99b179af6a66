package io.mcpmemory.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class OptionsTest {

    @Test
    void shouldRequirePositiveBounds() {
        assertThatThrownBy(() -> SearchOptions.forProject("/p", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ListOptions.forProject("/p", -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRequireProject() {
        assertThatThrownBy(() -> SearchOptions.forProject(" ", 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ListOptions.forProject(null, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldApplyDefaultBounds() {
        assertThat(SearchOptions.forProject("/p").topK()).isEqualTo(5);
        assertThat(ListOptions.forProject("/p").limit()).isEqualTo(10);
        assertThat(ListOptions.forProject("/p").groupId()).isNull();
    }

    @Test
    void shouldDefaultTagsToEmpty() {
        SearchOptions options = new SearchOptions("/p", null, null, null, null, 3);

        assertThat(options.tags()).isEmpty();
        assertThat(options.hasTimeRange()).isFalse();
    }
}
