package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import io.herald.core.job.bulk.BulkFormat;
import io.herald.core.job.bulk.JobsDocument;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "export", description = "Export jobs as a JSON or YAML bulk document")
public final class JobsExportCommand extends AbstractJobCommand {

    @Option(names = "--id", description = "Export only these jobs (repeatable)")
    List<String> ids;

    @Option(names = "--include-disabled", description = "Also export disabled jobs")
    boolean includeDisabled;

    @Option(names = "--format", description = "json or yaml (default: from --output extension, else json)")
    String format;

    @Option(names = "--output", description = "Write to this file instead of stdout")
    Path output;

    public JobsExportCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int execute() throws Exception {
        JobsDocument document = context.jobService().export(
            ids == null ? null : new LinkedHashSet<>(ids),
            includeDisabled
        );
        BulkFormat resolved = format != null ? BulkFormat.of(format)
            : output != null ? BulkFormat.forPath(output) : BulkFormat.JSON;
        String content = context.bulkCodec().write(document, resolved);
        if (output == null) {
            System.out.print(content);
            return 0;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, content);
        System.out.println("Exported " + document.jobs().size() + " jobs to " + output);
        return 0;
    }
}
