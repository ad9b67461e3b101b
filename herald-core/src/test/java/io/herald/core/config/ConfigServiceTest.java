package io.herald.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.SchedulerConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        HeraldConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.scheduler().maxIdleSeconds()).isEqualTo(60);
        assertThat(config.scheduler().firingThreads()).isEqualTo(4);
        assertThat(config.scheduler().sessionTimeoutSeconds()).isEqualTo(300);
        assertThat(config.scheduler().zone()).isEqualTo(ZoneId.systemDefault());
        assertThat(config.channels().defaultChannel()).isEqualTo("console");
        assertThat(config.channels().webhook().enabled()).isFalse();
        assertThat(config.store().path()).isEqualTo("~/.herald/jobs.json");
    }

    @Test
    void shouldMergePartialConfigOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "scheduler": {
                "firingThreads": 8,
                "defaultTimezone": "Asia/Tokyo"
              },
              "channels": {
                "webhook": {
                  "url": "https://hooks.example.com/herald",
                  "headers": { "Authorization": "Bearer t" }
                }
              }
            }
            """);

        HeraldConfig config = service.load(configPath);

        assertThat(config.scheduler().firingThreads()).isEqualTo(8);
        assertThat(config.scheduler().maxIdleSeconds()).isEqualTo(60);
        assertThat(config.scheduler().zone()).isEqualTo(ZoneId.of("Asia/Tokyo"));
        assertThat(config.channels().defaultChannel()).isEqualTo("console");
        assertThat(config.channels().webhook().enabled()).isTrue();
        assertThat(config.channels().webhook().headers()).containsEntry("Authorization", "Bearer t");
    }

    @Test
    void initShouldCreateThenRefreshConfig() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".herald/config.json");

        InitResult created = service.init(configPath, false);
        InitResult refreshed = service.init(configPath, false);
        InitResult overwritten = service.init(configPath, true);

        assertThat(created.createdConfig()).isTrue();
        assertThat(Files.exists(configPath)).isTrue();
        assertThat(refreshed.createdConfig()).isFalse();
        assertThat(refreshed.overwrittenConfig()).isFalse();
        assertThat(overwritten.overwrittenConfig()).isTrue();
        assertThat(service.load(configPath)).isEqualTo(HeraldConfig.defaults());
    }

    @Test
    void shouldTreatNullValuesAsDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "scheduler": { "maxIdleSeconds": null, "firingThreads": 2 }, "channels": null }
            """);

        HeraldConfig config = service.load(configPath);

        assertThat(config.scheduler().maxIdleSeconds()).isEqualTo(60);
        assertThat(config.scheduler().firingThreads()).isEqualTo(2);
        assertThat(config.channels().defaultChannel()).isEqualTo("console");
    }

    @Test
    void shouldRejectValuesTheSchedulerCannotRunWith() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "scheduler": { "firingThreads": 0, "defaultTimezone": "Mars/Olympus" },
              "channels": { "defaultChannel": "webhook", "webhook": { "url": "" } }
            }
            """);

        assertThatThrownBy(() -> service.load(configPath))
            .isInstanceOf(InvalidConfigException.class)
            .satisfies(e -> assertThat(((InvalidConfigException) e).problems()).containsExactly(
                "scheduler.firingThreads must be at least 1",
                "scheduler.defaultTimezone is not a valid zone: Mars/Olympus",
                "channels.defaultChannel is webhook but channels.webhook.url is not set"
            ));
    }

    @Test
    void shouldRefuseToSaveInvalidConfig() {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        HeraldConfig invalid = new HeraldConfig(null, new SchedulerConfig(60, 4, 0, ""), null);

        assertThatThrownBy(() -> service.save(configPath, invalid))
            .isInstanceOf(InvalidConfigException.class)
            .hasMessageContaining("scheduler.sessionTimeoutSeconds must be at least 1");
        assertThat(Files.exists(configPath)).isFalse();
    }

    @Test
    void shouldRejectNonObjectConfig() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "[1, 2]");

        assertThatThrownBy(() -> new ConfigService().load(configPath))
            .isInstanceOf(InvalidConfigException.class)
            .hasMessageContaining("top level must be a JSON object");
    }
}
