package io.salesops.core.storage;

import io.salesops.core.config.model.S3Config;
import java.net.URI;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

public final class S3Clients {
    private S3Clients() {
    }

    public static S3Client create(S3Config config) {
        String region = firstNonBlank(config.region(), System.getenv("AWS_REGION"), System.getenv("AWS_DEFAULT_REGION"));
        if (region == null) {
            throw new IllegalArgumentException("missing AWS region for S3 storage");
        }

        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(region))
            .credentialsProvider(credentials(config))
            .forcePathStyle(config.pathStyle());

        if (config.endpoint() != null && !config.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(config.endpoint()));
        }
        return builder.build();
    }

    static AwsCredentialsProvider credentials(S3Config config) {
        String accessKeyId = config.accessKeyId();
        String secretAccessKey = config.secretAccessKey();
        if (notBlank(accessKeyId) && notBlank(secretAccessKey)) {
            if (notBlank(config.sessionToken())) {
                return StaticCredentialsProvider.create(
                    AwsSessionCredentials.create(accessKeyId, secretAccessKey, config.sessionToken())
                );
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
        }
        if (notBlank(config.profile())) {
            return ProfileCredentialsProvider.create(config.profile());
        }
        return DefaultCredentialsProvider.create();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (notBlank(value)) {
                return value;
            }
        }
        return null;
    }
}
