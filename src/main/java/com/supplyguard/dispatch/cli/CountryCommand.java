package com.supplyguard.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplyguard.core.engine.RiskAnalysisEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: supplyguard country &lt;name&gt;
 * <p>
 * Political, logistics and tariff risk profile for one country.
 */
@Command(name = "country", mixinStandardHelpOptions = true, description = "Risk profile for one country")
@Component
public class CountryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Country name, e.g. Taiwan or 中國")
    private String country;

    @Option(names = {"--window-days", "-w"}, description = "Only consider data from the last N days")
    private Integer windowDays;

    @Option(names = "--json", description = "Print the result as JSON")
    private boolean json;

    private final RiskAnalysisEngine engine;
    private final ObjectMapper objectMapper;

    public CountryCommand(RiskAnalysisEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Country profile: " + country);
        }
        return AnalyzeCommand.render(() -> engine.analyzeCountry(country, windowDays), json, objectMapper);
    }
}
