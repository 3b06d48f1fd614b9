package com.poc.integration.command;

import com.poc.integration.IntegrationRuntime;
import com.poc.integration.config.IntegrationConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.Scanner;
import java.util.concurrent.Callable;

@Command(
    name = "clean",
    description = "Delete every customer from both stores",
    mixinStandardHelpOptions = true
)
public class CleanCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions options;

    @Option(names = {"-y", "--yes"}, description = "Skip confirmation prompt", defaultValue = "false")
    private boolean skipConfirmation;

    @Override
    public Integer call() {
        try {
            IntegrationConfig config = options.buildConfig();

            if (!skipConfirmation) {
                System.out.println("WARNING: This will delete every customer from both stores.");
                System.out.printf("Search Store: %s%n", config.getSearchStore().getNamespace());
                System.out.printf("Record Store: %s%n", config.getRecordStore().getJdbcUrl());

                System.out.print("\nAre you sure? (yes/no): ");
                Scanner scanner = new Scanner(System.in);
                String response = scanner.nextLine().trim().toLowerCase();

                if (!response.equals("yes") && !response.equals("y")) {
                    System.out.println("Aborted.");
                    return 0;
                }
            }

            try (IntegrationRuntime runtime = IntegrationRuntime.connect(config)) {
                IntegrationRuntime.StoreCounts before = runtime.countStores();
                runtime.clearStores();
                System.out.printf("Removed %,d search store and %,d record store customers.%n",
                    before.searchStore(), before.recordStore());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
