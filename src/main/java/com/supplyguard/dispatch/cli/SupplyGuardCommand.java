package com.supplyguard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for SupplyGuard.
 * Routes to subcommands: analyze, country, agents, health, serve.
 */
@Command(
        name = "supplyguard",
        mixinStandardHelpOptions = true,
        version = "SupplyGuard 0.1.0",
        description = "Supply chain risk analysis with routed multi-agent pipelines",
        subcommands = {
                AnalyzeCommand.class,
                CountryCommand.class,
                AgentsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SupplyGuardCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
