package com.supplyguard.dispatch.cli;

import com.supplyguard.core.agents.AgentRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: supplyguard agents
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List the analysis agents and what they do")
@Component
public class AgentsCommand implements Runnable {

    private final AgentRegistry registry;

    public AgentsCommand(AgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        for (var capability : registry.capabilities()) {
            ConsoleOutput.agent(capability.agentName(), capability.description());
            for (String c : capability.capabilities()) {
                System.out.println("    * " + c);
            }
            for (String q : capability.exampleQueries()) {
                System.out.println("    e.g. \"" + q + "\"");
            }
        }
    }
}
