package io.herald.core.job.bulk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.herald.core.job.JobValidationException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BulkCodecTest {
    private final BulkCodec codec = new BulkCodec();

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteYamlWithSnakeCaseScheduleFields() throws Exception {
        JobsDocument document = new JobsDocument(List.of(new JobEntry(
            "a1b2c3d4", "morning", "Summarize overnight alerts", true,
            new ScheduleEntry("0 8 * * *", "UTC", null, null), "auto", "console", "ops"
        )));

        String yaml = codec.write(document, BulkFormat.YAML);

        assertThat(yaml).doesNotStartWith("---");
        assertThat(yaml).contains("cron_expr:").contains("tz:").contains("deliver: \"auto\"");
        assertThat(yaml).doesNotContain("every_seconds");
    }

    @Test
    void shouldReadYamlWithAliases() throws Exception {
        JobsDocument document = codec.read("""
            jobs:
              - message: ping
                schedule:
                  every_seconds: 30
              - message: report
                deliver: never
                schedule:
                  cron: "0 9 * * *"
                  timezone: Europe/Paris
            """, BulkFormat.YAML);

        assertThat(document.jobs()).hasSize(2);
        assertThat(document.jobs().get(0).schedule().everySeconds()).isEqualTo(30L);
        assertThat(document.jobs().get(1).schedule().cronExpr()).isEqualTo("0 9 * * *");
        assertThat(document.jobs().get(1).schedule().tz()).isEqualTo("Europe/Paris");
        assertThat(document.jobs().get(1).deliver()).isEqualTo("never");
    }

    @Test
    void shouldPickFormatFromFileExtension() throws Exception {
        JobsDocument document = new JobsDocument(List.of(new JobEntry(
            null, null, "ping", null, new ScheduleEntry(null, null, 60L, null), null, null, null
        )));
        Path yamlFile = tempDir.resolve("jobs.yml");

        codec.write(document, yamlFile);

        assertThat(java.nio.file.Files.readString(yamlFile)).contains("every_seconds: 60");
        assertThat(codec.read(yamlFile)).isEqualTo(document);
    }

    @Test
    void shouldRejectMalformedDocuments() {
        assertThatThrownBy(() -> codec.read("{\"jobs\": [", BulkFormat.JSON))
            .isInstanceOf(JobValidationException.class)
            .hasMessageContaining("malformed bulk document");
        assertThatThrownBy(() -> codec.read("", BulkFormat.JSON))
            .isInstanceOf(JobValidationException.class);
    }

    @Test
    void shouldNameEntryAndFieldWhenValueHasWrongType() {
        String yaml = """
            jobs:
              - message: ok
                schedule:
                  every_seconds: 60
              - message: broken
                schedule:
                  every_seconds: abc
            """;
        String json = "{\"jobs\": [{\"message\": \"broken\", \"enabled\": \"x\", \"schedule\": {\"every_seconds\": 60}}]}";

        assertThatThrownBy(() -> codec.read(yaml, BulkFormat.YAML))
            .isInstanceOf(JobValidationException.class)
            .hasMessageStartingWith("jobs[1]: invalid value for 'every_seconds'")
            .extracting(e -> ((JobValidationException) e).entry())
            .isEqualTo("jobs[1]");
        assertThatThrownBy(() -> codec.read(json, BulkFormat.JSON))
            .isInstanceOf(JobValidationException.class)
            .hasMessageStartingWith("jobs[0]: invalid value for 'enabled'");
    }
}
