package io.mcpmemory.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PathsConfig(
    @JsonAlias({"data_dir"}) String dataDir
) {

    public static PathsConfig defaults() {
        return new PathsConfig("~/.mcp-memory/data");
    }
}
