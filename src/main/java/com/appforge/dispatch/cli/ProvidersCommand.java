package com.appforge.dispatch.cli;

import com.appforge.core.provider.ProviderHealthRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: appforge providers
 * <p>
 * Lists configured providers in priority order with their circuit state and budget.
 */
@Command(name = "providers", mixinStandardHelpOptions = true, description = "List LLM providers and their health")
@Component
public class ProvidersCommand implements Runnable {

    private final ProviderHealthRegistry providerHealth;

    public ProvidersCommand(ProviderHealthRegistry providerHealth) {
        this.providerHealth = providerHealth;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var snapshots = providerHealth.snapshots();
        if (snapshots.isEmpty()) {
            ConsoleOutput.error("No LLM providers configured");
            return;
        }
        ConsoleOutput.info("Providers (" + snapshots.size() + ", highest priority first):");
        snapshots.forEach(ConsoleOutput::providerHealth);
    }
}
