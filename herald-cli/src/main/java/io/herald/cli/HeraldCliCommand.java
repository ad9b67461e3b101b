package io.herald.cli;

import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(name = "herald", mixinStandardHelpOptions = true, description = "Herald scheduled job engine")
public final class HeraldCliCommand implements Runnable {

    @Spec
    CommandSpec spec;

    // Read before the command tree is built; declared here so picocli accepts it.
    @Option(names = "--config", description = "Config file (default: ~/.herald/config.json)")
    Path config;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
