package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LocalStorageConfig(
    @JsonAlias({"input_root"}) String inputRoot,
    @JsonAlias({"output_root"}) String outputRoot
) {

    public static LocalStorageConfig defaults() {
        return new LocalStorageConfig("inputs", "outputs");
    }
}
