package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import io.herald.core.job.bulk.BulkFormat;
import io.herald.core.job.bulk.JobsDocument;
import java.util.LinkedHashSet;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "get", description = "Print jobs as a bulk document")
public final class JobsGetCommand extends AbstractJobCommand {

    @Parameters(arity = "1..*", paramLabel = "ID", description = "Job ids")
    List<String> ids;

    @Option(names = "--format", defaultValue = "json", description = "json or yaml")
    String format;

    public JobsGetCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int execute() throws Exception {
        JobsDocument document = context.jobService().export(new LinkedHashSet<>(ids), true);
        System.out.print(context.bulkCodec().write(document, BulkFormat.of(format)));
        return 0;
    }
}
