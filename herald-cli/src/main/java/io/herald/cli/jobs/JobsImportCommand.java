package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import io.herald.core.job.bulk.BulkFormat;
import io.herald.core.job.bulk.JobsDocument;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "import", description = "Import jobs from a bulk document; nothing is stored if any entry is invalid")
public final class JobsImportCommand extends AbstractJobCommand {

    @Parameters(index = "0", paramLabel = "FILE", description = "JSON or YAML bulk document")
    Path file;

    @Option(names = "--format", description = "json or yaml (default: from the file extension)")
    String format;

    public JobsImportCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int execute() throws Exception {
        BulkFormat resolved = format == null ? BulkFormat.forPath(file) : BulkFormat.of(format);
        JobsDocument document = context.bulkCodec().read(Files.readString(file), resolved);
        List<String> ids = context.jobService().importJobs(document);
        System.out.println("Imported " + ids.size() + " jobs");
        ids.forEach(System.out::println);
        return 0;
    }
}
