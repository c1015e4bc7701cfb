package io.salesops.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.salesops.core.config.model.ProviderConfig;
import io.salesops.core.config.model.ProvidersConfig;
import io.salesops.core.config.model.RemoteStorageConfig;
import io.salesops.core.config.model.SalesOpsConfig;
import io.salesops.core.config.model.SupabaseConfig;
import io.salesops.core.config.model.WatchConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the JSON configuration file merged over {@link SalesOpsConfig#defaults()}, then applies
 * environment overrides so secrets can stay out of the file.
 */
public final class ConfigService {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public SalesOpsConfig load(Path configPath) throws IOException {
        return applyEnvironment(loadFile(configPath));
    }

    public void save(Path configPath, SalesOpsConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Writes the file (refreshing it with new defaults, or resetting it when {@code overwrite}) and
     * creates the local input and output roots. Environment overrides are never persisted.
     */
    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        SalesOpsConfig config;
        if (created || overwrite) {
            config = SalesOpsConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = loadFile(configPath);
        }

        save(configPath, config);

        Path inputRoot = ConfigPaths.resolve(config.storage().local().inputRoot());
        Path outputRoot = ConfigPaths.resolve(config.storage().local().outputRoot());
        Files.createDirectories(inputRoot);
        Files.createDirectories(outputRoot);
        return new OnboardResult(configPath, inputRoot, outputRoot, created, overwritten);
    }

    public String toPrettyJson(SalesOpsConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    SalesOpsConfig applyEnvironment(SalesOpsConfig config) {
        SalesOpsConfig result = config;

        WatchConfig watch = result.watch();
        String mode = env("SALESOPS_MODE");
        if (mode != null) {
            watch = watch.withMode(mode);
        }
        Integer poll = intEnv("SALESOPS_POLL_SECONDS");
        if (poll != null) {
            watch = watch.withPollIntervalSeconds(poll);
        }
        Integer backoff = intEnv("SALESOPS_BACKOFF_SECONDS");
        if (backoff != null) {
            watch = watch.withBackoffSeconds(backoff);
        }
        result = result.withWatch(watch);

        ProvidersConfig providers = result.providers();
        providers = new ProvidersConfig(
            overrideKey(providers.deepseek(), "DEEPSEEK_API_KEY"),
            overrideKey(providers.openai(), "OPENAI_API_KEY"),
            overrideKey(providers.openrouter(), "OPENROUTER_API_KEY")
        );
        result = result.withProviders(providers);

        RemoteStorageConfig remote = result.storage().remote();
        String supabaseUrl = env("SUPABASE_URL");
        String supabaseKey = env("SUPABASE_KEY");
        if (supabaseUrl != null || supabaseKey != null) {
            SupabaseConfig current = remote.supabase();
            remote = remote.withSupabase(new SupabaseConfig(
                supabaseUrl != null ? supabaseUrl : current.url(),
                supabaseKey != null ? supabaseKey : current.key()
            ));
        }
        String region = env("AWS_REGION");
        if (region != null && (remote.s3().region() == null || remote.s3().region().isBlank())) {
            remote = remote.withS3(remote.s3().withRegion(region));
        }
        result = result.withStorage(result.storage().withRemote(remote));

        Integer port = intEnv("PORT");
        if (port != null) {
            result = result.withServer(result.server().withPort(port));
        }
        return result;
    }

    private SalesOpsConfig loadFile(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return SalesOpsConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(SalesOpsConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, SalesOpsConfig.class);
    }

    private ProviderConfig overrideKey(ProviderConfig provider, String key) {
        String value = env(key);
        return value == null ? provider : provider.withApiKey(value);
    }

    private String env(String key) {
        String value = environment.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private Integer intEnv(String key) {
        String value = env(key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric environment value {}={}", key, value);
            return null;
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
