package com.poc.integration.command;

import com.poc.integration.IntegrationRuntime;
import com.poc.integration.config.IntegrationConfig;
import com.poc.integration.gate.AdmissionPolicy;
import com.poc.integration.model.OperatingMode;
import com.poc.integration.report.ConsoleReporter;
import com.poc.integration.virtualization.VirtualQuery;
import com.poc.integration.virtualization.VirtualizationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Command(
    name = "virtual-search",
    description = "Query the virtualization server through the license gate",
    mixinStandardHelpOptions = true
)
public class VirtualSearchCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions options;

    @Parameters(index = "0",
        description = "Field to search: email, name, phone, category, status, customer_id")
    private String field;

    @Parameters(index = "1", description = "Search value")
    private String value;

    @Option(names = {"-m", "--mode"}, description = "HYBRID or SEARCH_STORE_ONLY", defaultValue = "HYBRID")
    private OperatingMode mode;

    @Option(names = {"--policy"}, description = "Admission policy when all license slots are busy: BLOCK or REJECT")
    private AdmissionPolicy policy;

    @Option(names = {"--ceiling"}, description = "Concurrent license ceiling")
    private Integer ceiling;

    @Option(names = {"-r", "--requests"}, description = "Number of identical requests to issue concurrently",
        defaultValue = "1")
    private int requests;

    @Option(names = {"--base-url"}, description = "Virtualization server base URL")
    private String baseUrl;

    @Override
    public Integer call() {
        try {
            IntegrationConfig config = options.buildConfig();
            if (policy != null) {
                config.setAdmissionPolicy(policy);
            }
            if (ceiling != null) {
                config.setLicenseCeiling(ceiling);
            }
            if (baseUrl != null) {
                config.getVirtualization().setBaseUrl(baseUrl);
            }
            if (requests < 1) {
                throw new IllegalArgumentException("--requests must be at least 1, got " + requests);
            }
            config.validate();

            String view = VirtualQuery.forField(field).viewFor(mode);

            try (IntegrationRuntime runtime = IntegrationRuntime.connect(config)) {
                List<VirtualizationResult> results = execute(runtime);
                ConsoleReporter reporter = new ConsoleReporter(false);

                VirtualizationResult first = results.get(0);
                reporter.printVirtualizationResult(view, first, runtime.licenseStats());

                if (results.size() > 1) {
                    long throttled = results.stream().filter(VirtualizationResult::throttled).count();
                    System.out.printf("%nRequests issued: %d, served: %d, throttled: %d%n",
                        results.size(), results.size() - throttled, throttled);
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private List<VirtualizationResult> execute(IntegrationRuntime runtime) throws Exception {
        if (requests == 1) {
            return List.of(issue(runtime));
        }

        ExecutorService executor = Executors.newFixedThreadPool(requests);
        try {
            List<Future<VirtualizationResult>> futures = new ArrayList<>();
            for (int i = 0; i < requests; i++) {
                futures.add(executor.submit(() -> issue(runtime)));
            }
            List<VirtualizationResult> results = new ArrayList<>();
            for (Future<VirtualizationResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private VirtualizationResult issue(IntegrationRuntime runtime) {
        return "customer_id".equals(field)
            ? runtime.virtualGet(value)
            : runtime.virtualSearch(field, value, mode);
    }
}
