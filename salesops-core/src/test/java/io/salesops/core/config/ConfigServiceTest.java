package io.salesops.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.salesops.core.config.model.SalesOpsConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService(Map.of());

        SalesOpsConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.watch().normalizedMode()).isEqualTo("local");
        assertThat(config.watch().pollInterval()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.watch().backoff()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.storage().remote().inputBucket()).isEqualTo("sales-logs");
        assertThat(config.storage().remote().outputBucket()).isEqualTo("sales-reports");
        assertThat(config.ledger().table()).isEqualTo("sales_memory");
        assertThat(config.analyzer().model()).isEqualTo("deepseek-chat");
        assertThat(config.providers().deepseek().configured()).isFalse();
    }

    @Test
    void shouldMergeFileOverDefaults() throws Exception {
        ConfigService service = new ConfigService(Map.of());
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "watch": { "mode": "remote", "pollIntervalSeconds": 5 },
              "storage": { "remote": { "inputBucket": "logs-test" } },
              "providers": { "openai": { "apiKey": "sk-file" } },
              "unknownSection": true
            }
            """);

        SalesOpsConfig config = service.load(configPath);

        assertThat(config.watch().remote()).isTrue();
        assertThat(config.watch().pollIntervalSeconds()).isEqualTo(5);
        assertThat(config.watch().backoffSeconds()).isEqualTo(30);
        assertThat(config.watch().ownerPrefix()).isEqualTo("Vendedor_");
        assertThat(config.storage().remote().inputBucket()).isEqualTo("logs-test");
        assertThat(config.storage().remote().outputBucket()).isEqualTo("sales-reports");
        assertThat(config.providers().openai().apiKey()).isEqualTo("sk-file");
        assertThat(config.providers().deepseek().apiKey()).isEqualTo("");
    }

    @Test
    void shouldApplyEnvironmentOverrides() throws Exception {
        ConfigService service = new ConfigService(Map.of(
            "DEEPSEEK_API_KEY", "sk-env",
            "SUPABASE_URL", "https://project.supabase.co",
            "SUPABASE_KEY", "service-key",
            "SALESOPS_MODE", "remote",
            "SALESOPS_POLL_SECONDS", "15",
            "SALESOPS_BACKOFF_SECONDS", "not-a-number",
            "PORT", "8080",
            "AWS_REGION", "sa-east-1"
        ));

        SalesOpsConfig config = service.load(tempDir.resolve("missing.json"));

        assertThat(config.providers().deepseek().apiKey()).isEqualTo("sk-env");
        assertThat(config.storage().remote().supabase().configured()).isTrue();
        assertThat(config.storage().remote().supabase().url()).isEqualTo("https://project.supabase.co");
        assertThat(config.watch().remote()).isTrue();
        assertThat(config.watch().pollIntervalSeconds()).isEqualTo(15);
        assertThat(config.watch().backoffSeconds()).isEqualTo(30);
        assertThat(config.server().port()).isEqualTo(8080);
        assertThat(config.storage().remote().s3().region()).isEqualTo("sa-east-1");
    }

    @Test
    void shouldRejectUnknownMode() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{ \"watch\": { \"mode\": \"ftp\" } }");

        SalesOpsConfig config = new ConfigService(Map.of()).load(configPath);

        assertThatThrownBy(() -> config.watch().normalizedMode())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ftp");
    }

    @Test
    void onboardShouldCreateConfigAndLocalFolders() throws Exception {
        ConfigService service = new ConfigService(Map.of("DEEPSEEK_API_KEY", "sk-secret"));
        Path configPath = tempDir.resolve(".salesops/config.json");
        Files.createDirectories(configPath.getParent());
        Path inputs = tempDir.resolve("inputs");
        Path outputs = tempDir.resolve("outputs");
        Files.writeString(configPath, """
            { "storage": { "local": { "inputRoot": "%s", "outputRoot": "%s" } } }
            """.formatted(json(inputs), json(outputs)));

        OnboardResult result = service.onboard(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(Files.isDirectory(inputs)).isTrue();
        assertThat(Files.isDirectory(outputs)).isTrue();
        String written = Files.readString(configPath);
        assertThat(written).contains("\"pollIntervalSeconds\"");
        assertThat(written).doesNotContain("sk-secret");
    }

    @Test
    void resolveShouldExpandHomeDirectory() {
        Path resolved = ConfigPaths.resolve("~/.salesops/ledger.db");

        assertThat(resolved).isEqualTo(Path.of(System.getProperty("user.home"), ".salesops", "ledger.db"));
        assertThatThrownBy(() -> ConfigPaths.resolve(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    private static String json(Path path) {
        return path.toString().replace("\\", "\\\\");
    }
}
