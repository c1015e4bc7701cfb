package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record S3Config(
    String region,
    String endpoint,
    @JsonAlias({"access_key_id"}) String accessKeyId,
    @JsonAlias({"secret_access_key"}) String secretAccessKey,
    @JsonAlias({"session_token"}) String sessionToken,
    String profile,
    @JsonAlias({"path_style"}) boolean pathStyle
) {

    public static S3Config defaults() {
        return new S3Config("", "", "", "", "", "", false);
    }

    public S3Config withRegion(String value) {
        return new S3Config(value, endpoint, accessKeyId, secretAccessKey, sessionToken, profile, pathStyle);
    }
}
