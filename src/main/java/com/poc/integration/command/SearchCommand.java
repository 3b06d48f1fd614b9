package com.poc.integration.command;

import com.poc.integration.IntegrationRuntime;
import com.poc.integration.config.IntegrationConfig;
import com.poc.integration.encryption.QueryKind;
import com.poc.integration.model.OperatingMode;
import com.poc.integration.report.ConsoleReporter;
import com.poc.integration.search.SearchResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(
    name = "search",
    description = "Search customers by an encrypted field",
    mixinStandardHelpOptions = true
)
public class SearchCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions options;

    @Parameters(index = "0", description = "Field to search: name, email, phone, category, status")
    private String field;

    @Parameters(index = "1", description = "Search value")
    private String value;

    @Option(names = {"-m", "--mode"}, description = "HYBRID or SEARCH_STORE_ONLY", defaultValue = "HYBRID")
    private OperatingMode mode;

    @Option(names = {"-k", "--kind"},
        description = "EQUALITY, PREFIX, SUFFIX or SUBSTRING (default: the field's registered operator)")
    private QueryKind kind;

    @Option(names = {"-l", "--limit"}, description = "Maximum number of results")
    private Integer limit;

    @Option(names = {"-q", "--quiet"}, description = "Only print the result summary", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            IntegrationConfig config = options.buildConfig();

            try (IntegrationRuntime runtime = IntegrationRuntime.connect(config)) {
                int effectiveLimit = limit != null ? limit : config.getDefaultLimit();
                SearchResult result = kind == null
                    ? runtime.search(field, value, mode, effectiveLimit)
                    : runtime.search(field, kind, value, mode, effectiveLimit);
                new ConsoleReporter(quiet).printSearchResult(result);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
