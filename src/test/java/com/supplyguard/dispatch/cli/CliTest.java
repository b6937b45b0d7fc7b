package com.supplyguard.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplyguard.core.agents.AgentCapability;
import com.supplyguard.core.agents.AgentRegistry;
import com.supplyguard.core.engine.PipelineFailedException;
import com.supplyguard.core.engine.RiskAnalysisEngine;
import com.supplyguard.core.health.HealthCheckService;
import com.supplyguard.core.health.HealthStatus;
import com.supplyguard.core.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static ConversationThread thread() {
        var score = new RiskScore(RiskDimension.OVERALL, 43.95, RiskLevel.MEDIUM,
                "Political risk is medium across 2 countries",
                List.of("Monitor sanctions announcements for Russia"),
                Provenance.TRADITIONAL_FALLBACK, 0.8, Set.of(RiskCondition.AI_UNAVAILABLE), Agreement.FULL_AGREEMENT,
                Map.of("affected_equipment", List.of("CT Scanner Revolution"),
                       "recent_events", List.of("New sanctions announced")));
        var political = new AgentInvocation(AgentRole.POLITICAL, 0, Map.of(), InvocationStatus.SUCCEEDED,
                RiskScore.of(RiskDimension.POLITICAL, 43.95, RiskLevel.MEDIUM, "medium"), null, 12);
        var reporting = new AgentInvocation(AgentRole.REPORTING, 1, Map.of(), InvocationStatus.SUCCEEDED,
                score, null, 2);
        var intent = new Intent(List.of(RiskDimension.POLITICAL), Map.of(RiskDimension.POLITICAL, 1),
                new ExtractedEntities(List.of("russia"), List.of(), null), 0.3,
                List.of(AgentRole.POLITICAL, AgentRole.REPORTING));
        return new ConversationThread("SG-2026-0042", Query.of("Political risk in Russia?"), intent,
                List.of(political, reporting), score, ThreadStatus.CLOSED, false, List.of(),
                Instant.EPOCH, Instant.EPOCH);
    }

    private static HealthCheckService health(HealthStatus... checks) {
        var service = mock(HealthCheckService.class);
        when(service.checkAll()).thenReturn(List.of(checks));
        return service;
    }

    private CommandLine.IFactory createFactory(RiskAnalysisEngine engine, HealthCheckService health,
                                               AgentRegistry registry) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AnalyzeCommand.class) {
                    return (K) new AnalyzeCommand(engine, new ObjectMapper());
                }
                if (cls == CountryCommand.class) {
                    return (K) new CountryCommand(engine, new ObjectMapper());
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == AgentsCommand.class) {
                    return (K) new AgentsCommand(registry);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(RiskAnalysisEngine.class), health(), mock(AgentRegistry.class), args);
    }

    private CliResult execute(RiskAnalysisEngine engine, HealthCheckService health, AgentRegistry registry,
                              String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            var commandLine = new CommandLine(new SupplyGuardCommand(), createFactory(engine, health, registry));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // -- Help ---------------------------------------------------------------

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("analyze", "country", "agents", "health", "serve", "help")) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
            assertTrue(result.output().contains("Supply chain risk analysis"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SupplyGuard 0.1.0"));
        }

        @Test
        @DisplayName("analyze --help shows the context options")
        void analyzeHelp() {
            CliResult result = execute("analyze", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--country"));
            assertTrue(result.output().contains("--equipment-type"));
            assertTrue(result.output().contains("--window-days"));
            assertTrue(result.output().contains("--json"));
            assertTrue(result.output().contains("--agent"));
            assertTrue(result.output().contains("--counterpart-country"));
            assertTrue(result.output().contains("--equipment-id"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SUPPLYGUARD v0.1.0"));
            assertTrue(result.output().contains("Usage:"));
        }
    }

    // -- analyze ------------------------------------------------------------

    @Nested
    @DisplayName("analyze")
    class AnalyzeTests {

        @Test
        @DisplayName("prints the report and passes context options through")
        void printsReport() {
            var engine = mock(RiskAnalysisEngine.class);
            when(engine.analyze(any(Query.class))).thenReturn(thread());

            CliResult result = execute(engine, health(), mock(AgentRegistry.class),
                    "analyze", "Political risk in Russia?", "-c", "Russia", "-e", "medical", "-w", "14");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("SUPPLYGUARD v0.1.0"));
            assertTrue(output.contains("THREAD SG-2026-0042  [political]"));
            assertTrue(output.contains("POLITICAL_RISK_AGENT"));
            assertTrue(output.contains("MEDIUM"));
            assertTrue(output.contains("Monitor sanctions announcements for Russia"));
            assertTrue(output.contains("CT Scanner Revolution"));

            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            verify(engine).analyze(captor.capture());
            assertEquals("Political risk in Russia?", captor.getValue().text());
            assertEquals(new QueryContext("Russia", "medical", 14), captor.getValue().context());
        }

        @Test
        @DisplayName("--json prints the API payload without the banner")
        void jsonOutput() throws Exception {
            var engine = mock(RiskAnalysisEngine.class);
            when(engine.analyze(any(Query.class))).thenReturn(thread());

            CliResult result = execute(engine, health(), mock(AgentRegistry.class),
                    "analyze", "--json", "Political risk in Russia?");

            assertEquals(0, result.exitCode());
            assertFalse(result.output().contains("SUPPLYGUARD v0.1.0"));
            var json = new ObjectMapper().readTree(result.output());
            assertEquals("SG-2026-0042", json.get("thread_id").asText());
            assertEquals("political", json.get("analysis_type").asText());
            assertEquals("traditional-fallback", json.get("provenance").asText());
            assertEquals(43.95, json.get("risk_score").asDouble(), 1e-9);
        }

        @Test
        @DisplayName("pipeline failure exits with 2")
        void pipelineFailure() {
            var engine = mock(RiskAnalysisEngine.class);
            when(engine.analyze(any(Query.class)))
                    .thenThrow(new PipelineFailedException("SG-2026-0043", "news store offline"));

            CliResult result = execute(engine, health(), mock(AgentRegistry.class), "analyze", "tariff risk");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Analysis failed: news store offline"));
        }

        @Test
        @DisplayName("blank query exits with 1 without running the engine")
        void blankQuery() {
            var engine = mock(RiskAnalysisEngine.class);

            CliResult result = execute(engine, health(), mock(AgentRegistry.class), "analyze", " ");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("A query is required"));
            verify(engine, never()).analyze(any(Query.class));
        }

        @Test
        @DisplayName("missing query without an agent exits with 1")
        void missingQuery() {
            var engine = mock(RiskAnalysisEngine.class);
            CliResult result = execute(engine, health(), mock(AgentRegistry.class), "analyze");

            assertEquals(1, result.exitCode());
            verify(engine, never()).analyze(any(Query.class));
        }

        @Test
        @DisplayName("--agent skips routing and passes the route context")
        void directAgent() {
            var engine = mock(RiskAnalysisEngine.class);
            when(engine.analyzeWith(eq(AgentRole.LOGISTICS), any(Query.class))).thenReturn(thread());

            CliResult result = execute(engine, health(), mock(AgentRegistry.class),
                    "analyze", "--agent", "logistics", "-c", "China", "--counterpart-country", "Germany");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Asking LOGISTICS_AGENT"));
            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            verify(engine).analyzeWith(eq(AgentRole.LOGISTICS), captor.capture());
            assertEquals("", captor.getValue().text());
            assertEquals(new QueryContext("China", null, null, "Germany", null), captor.getValue().context());
            verify(engine, never()).analyze(any(Query.class));
        }

        @Test
        @DisplayName("--agent with an equipment id reaches the scheduler")
        void directSchedulerWithEquipment() {
            var engine = mock(RiskAnalysisEngine.class);
            when(engine.analyzeWith(eq(AgentRole.SCHEDULER), any(Query.class))).thenReturn(thread());

            CliResult result = execute(engine, health(), mock(AgentRegistry.class),
                    "analyze", "-a", "SCHEDULER_AGENT", "--equipment-id", "EQ-0007", "Is this order late?");

            assertEquals(0, result.exitCode());
            ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
            verify(engine).analyzeWith(eq(AgentRole.SCHEDULER), captor.capture());
            assertEquals("Is this order late?", captor.getValue().text());
            assertEquals("EQ-0007", captor.getValue().context().equipmentId());
        }

        @Test
        @DisplayName("unknown agent exits with 1")
        void unknownAgent() {
            var engine = mock(RiskAnalysisEngine.class);

            CliResult result = execute(engine, health(), mock(AgentRegistry.class), "analyze", "-a", "weather");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Unknown agent: weather"));
            verify(engine, never()).analyzeWith(any(), any());
        }
    }

    // -- country ------------------------------------------------------------

    @Nested
    @DisplayName("country")
    class CountryTests {

        @Test
        @DisplayName("prints the country profile")
        void countryProfile() {
            var engine = mock(RiskAnalysisEngine.class);
            when(engine.analyzeCountry("Russia", 30)).thenReturn(thread());

            CliResult result = execute(engine, health(), mock(AgentRegistry.class), "country", "Russia", "-w", "30");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Country profile: Russia"));
            assertTrue(result.output().contains("THREAD SG-2026-0042"));
            verify(engine).analyzeCountry("Russia", 30);
        }

        @Test
        @DisplayName("rejected country exits with 1")
        void rejectedCountry() {
            var engine = mock(RiskAnalysisEngine.class);
            when(engine.analyzeCountry(" ", null)).thenThrow(new IllegalArgumentException("country is required"));

            CliResult result = execute(engine, health(), mock(AgentRegistry.class), "country", " ");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("country is required"));
        }
    }

    // -- health / agents ----------------------------------------------------

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("a down component exits with 1")
        void downComponent() {
            var service = health(
                    new HealthStatus("graph", HealthStatus.Status.UP, "Graph compiled", Map.of()),
                    new HealthStatus("storage", HealthStatus.Status.DOWN, "Repository unreachable", Map.of()));

            CliResult result = execute(mock(RiskAnalysisEngine.class), service, mock(AgentRegistry.class), "health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("storage: Repository unreachable"));
            assertTrue(result.output().contains("one or more components down"));
        }

        @Test
        @DisplayName("a degraded component is reported but passes")
        void degradedComponent() {
            var service = health(
                    new HealthStatus("graph", HealthStatus.Status.UP, "Graph compiled", Map.of()),
                    new HealthStatus("ai", HealthStatus.Status.DEGRADED, "AI analysis disabled", Map.of()));

            CliResult result = execute(mock(RiskAnalysisEngine.class), service, mock(AgentRegistry.class), "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("operational with degraded components"));
        }

        @Test
        @DisplayName("all components up")
        void allUp() {
            var service = health(new HealthStatus("graph", HealthStatus.Status.UP, "Graph compiled", Map.of()));

            CliResult result = execute(mock(RiskAnalysisEngine.class), service, mock(AgentRegistry.class), "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("all systems operational"));
        }
    }

    @Test
    @DisplayName("agents lists capabilities and example queries")
    void agentsCommand() {
        var registry = mock(AgentRegistry.class);
        when(registry.capabilities()).thenReturn(List.of(
                new AgentCapability("LOGISTICS", "LOGISTICS_AGENT", "Scores shipping routes",
                        List.of("port congestion"), List.of("Are there shipping delays through Singapore?"))));

        CliResult result = execute(mock(RiskAnalysisEngine.class), health(), registry, "agents");

        assertEquals(0, result.exitCode());
        assertTrue(result.output().contains("[LOGISTICS_AGENT] Scores shipping routes"));
        assertTrue(result.output().contains("* port congestion"));
        assertTrue(result.output().contains("e.g. \"Are there shipping delays through Singapore?\""));
    }
}
