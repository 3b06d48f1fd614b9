package com.poc.integration.command;

import com.poc.integration.IntegrationRuntime;
import com.poc.integration.config.IntegrationConfig;
import com.poc.integration.encryption.FieldEncryptionSpec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "setup-encryption",
    description = "Create data keys, the encrypted customers collection and the record store schema",
    mixinStandardHelpOptions = true
)
public class SetupEncryptionCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions options;

    @Option(names = {"-D", "--drop-existing"}, description = "Drop the encrypted collection before creating it",
        defaultValue = "false")
    private boolean dropExisting;

    @Override
    public Integer call() {
        try {
            IntegrationConfig config = options.buildConfig();

            System.out.println("Encrypted fields:");
            for (FieldEncryptionSpec spec : config.getFields().specs()) {
                System.out.printf("  %-12s %-24s %s%n", spec.field(), spec.path(), spec.algorithms());
            }
            System.out.println();

            try (IntegrationRuntime runtime = IntegrationRuntime.connect(config)) {
                runtime.setupStores(dropExisting);
            }

            System.out.printf("Encrypted collection %s ready.%n", config.getSearchStore().getNamespace());
            System.out.printf("Record store schema ready at %s.%n", config.getRecordStore().getJdbcUrl());
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
