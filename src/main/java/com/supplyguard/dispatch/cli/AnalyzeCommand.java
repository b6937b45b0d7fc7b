package com.supplyguard.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.supplyguard.core.engine.PipelineFailedException;
import com.supplyguard.core.engine.RiskAnalysisEngine;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.AnalysisResult;
import com.supplyguard.core.model.ConversationThread;
import com.supplyguard.core.model.Query;
import com.supplyguard.core.model.QueryContext;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * CLI command: supplyguard analyze "&lt;query&gt;"
 * <p>
 * Runs one query through the agent pipeline and prints the result, either as
 * a colored report or as the JSON payload the REST API returns. With
 * {@code --agent} the query goes straight to that agent and the question may
 * be omitted.
 */
@Command(name = "analyze", mixinStandardHelpOptions = true, description = "Analyze supply chain risk for a query")
@Component
public class AnalyzeCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Natural language risk question")
    private String query;

    @Option(names = {"--agent", "-a"}, description = "Skip routing and ask one agent, e.g. scheduler or tariff")
    private String agent;

    @Option(names = {"--country", "-c"}, description = "Country to focus the analysis on")
    private String country;

    @Option(names = "--counterpart-country", description = "Other end of a route or trade pair")
    private String counterpartCountry;

    @Option(names = {"--equipment-type", "-e"}, description = "Equipment category, e.g. robot or medical")
    private String equipmentType;

    @Option(names = "--equipment-id", description = "Single piece of equipment to analyze")
    private String equipmentId;

    @Option(names = {"--window-days", "-w"}, description = "Only consider data from the last N days")
    private Integer windowDays;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    private final RiskAnalysisEngine engine;
    private final ObjectMapper objectMapper;

    public AnalyzeCommand(RiskAnalysisEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        AgentRole role = null;
        try {
            if (agent != null) {
                role = AgentRole.fromName(agent);
            } else if (query == null || query.isBlank()) {
                ConsoleOutput.error("A query is required");
                return 1;
            }
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info(role == null ? "Analyzing: " + query
                    : "Asking " + role.agentName() + (query == null ? "" : ": " + query));
        }
        var request = new Query(query,
                new QueryContext(country, equipmentType, windowDays, counterpartCountry, equipmentId));
        var direct = role;
        return render(() -> direct == null ? engine.analyze(request) : engine.analyzeWith(direct, request),
                json, objectMapper);
    }

    /**
     * Runs the analysis and prints it. Returns 0 on success, 1 for rejected
     * input and 2 when the pipeline failed.
     */
    static int render(Supplier<ConversationThread> analysis, boolean json, ObjectMapper objectMapper) {
        AnalysisResult result;
        try {
            result = AnalysisResult.from(analysis.get());
        } catch (PipelineFailedException e) {
            ConsoleOutput.error("Analysis failed: " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (json) {
            try {
                System.out.println(objectMapper.copy()
                        .enable(SerializationFeature.INDENT_OUTPUT)
                        .writeValueAsString(result));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not render result as JSON: " + e.getOriginalMessage());
                return 1;
            }
        } else {
            ConsoleOutput.result(result);
        }
        return 0;
    }
}
