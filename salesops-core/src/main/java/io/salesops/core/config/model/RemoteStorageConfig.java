package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteStorageConfig(
    String backend,
    @JsonAlias({"input_bucket"}) String inputBucket,
    @JsonAlias({"output_bucket"}) String outputBucket,
    SupabaseConfig supabase,
    S3Config s3
) {

    public static RemoteStorageConfig defaults() {
        return new RemoteStorageConfig("supabase", "sales-logs", "sales-reports", SupabaseConfig.defaults(), S3Config.defaults());
    }

    public RemoteStorageConfig withSupabase(SupabaseConfig value) {
        return new RemoteStorageConfig(backend, inputBucket, outputBucket, value, s3);
    }

    public RemoteStorageConfig withS3(S3Config value) {
        return new RemoteStorageConfig(backend, inputBucket, outputBucket, supabase, value);
    }
}
