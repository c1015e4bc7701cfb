package io.salesops.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(LocalStorageConfig local, RemoteStorageConfig remote) {

    public static StorageConfig defaults() {
        return new StorageConfig(LocalStorageConfig.defaults(), RemoteStorageConfig.defaults());
    }

    public StorageConfig withRemote(RemoteStorageConfig value) {
        return new StorageConfig(local, value);
    }
}
