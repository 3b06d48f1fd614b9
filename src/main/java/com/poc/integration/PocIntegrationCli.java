package com.poc.integration;

import ch.qos.logback.classic.Level;
import com.poc.integration.command.CleanCommand;
import com.poc.integration.command.GetCommand;
import com.poc.integration.command.IngestCommand;
import com.poc.integration.command.SearchCommand;
import com.poc.integration.command.SetupEncryptionCommand;
import com.poc.integration.command.VirtualSearchCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "poc-integration",
    mixinStandardHelpOptions = true,
    version = "poc-integration 1.0.0",
    description = "Encrypted customer search across a MongoDB search store and an AlloyDB record store",
    subcommands = {
        SetupEncryptionCommand.class,
        IngestCommand.class,
        SearchCommand.class,
        GetCommand.class,
        VirtualSearchCommand.class,
        CleanCommand.class
    }
)
public class PocIntegrationCli implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging")
    boolean verbose;

    public static void main(String[] args) {
        PocIntegrationCli cli = new PocIntegrationCli();
        int exitCode = new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(parseResult -> {
                if (cli.verbose) {
                    enableDebugLogging();
                }
                return new CommandLine.RunLast().execute(parseResult);
            })
            .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }

    private static void enableDebugLogging() {
        ch.qos.logback.classic.Logger logger =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.poc.integration");
        logger.setLevel(Level.DEBUG);
    }
}
