package com.poc.integration.command;

import com.poc.integration.IntegrationRuntime;
import com.poc.integration.model.CustomerProjection;
import com.poc.integration.report.ConsoleReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "get",
    description = "Fetch one customer from the record store by identifier",
    mixinStandardHelpOptions = true
)
public class GetCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions options;

    @Parameters(index = "0", description = "Customer identifier")
    private String customerId;

    @Override
    public Integer call() {
        try (IntegrationRuntime runtime = IntegrationRuntime.connect(options.buildConfig())) {
            Optional<CustomerProjection> customer = runtime.findById(customerId);
            if (customer.isEmpty()) {
                System.out.printf("Customer %s not found.%n", customerId);
                return 3;
            }
            new ConsoleReporter(false).printProjection(customer.get());
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }
}
