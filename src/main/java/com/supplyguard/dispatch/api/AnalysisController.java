package com.supplyguard.dispatch.api;

import com.supplyguard.core.agents.AgentCapability;
import com.supplyguard.core.agents.AgentRegistry;
import com.supplyguard.core.engine.RiskAnalysisEngine;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.AnalysisResult;
import com.supplyguard.core.model.Query;
import com.supplyguard.core.model.QueryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for risk analysis queries. Each request runs one
 * conversation thread synchronously and returns its result.
 */
@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final RiskAnalysisEngine engine;
    private final AgentRegistry registry;
    private final SseStreamingService sseStreamingService;

    public AnalysisController(RiskAnalysisEngine engine, AgentRegistry registry,
                              SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.registry = registry;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/analysis: analyze one query.
     */
    @PostMapping
    public ResponseEntity<?> analyze(@RequestBody AnalysisRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "query is required"));
        }
        if (request.timeWindowDays() != null && request.timeWindowDays() <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "time_window_days must be positive"));
        }
        var query = new Query(request.query(),
                new QueryContext(request.country(), request.equipmentType(), request.timeWindowDays()));
        var thread = request.threadId() == null || request.threadId().isBlank()
                ? engine.analyze(query)
                : engine.analyze(request.threadId(), query);
        log.info("Analysis {} answered by {}", thread.threadId(), thread.pipeline());
        return ResponseEntity.ok(AnalysisResult.from(thread));
    }

    /**
     * POST /api/v1/analysis/agents/{agent}: run a single agent without keyword
     * routing or the report.
     */
    @PostMapping("/agents/{agent}")
    public ResponseEntity<?> analyzeWithAgent(@PathVariable("agent") String agent,
                                              @RequestBody(required = false) AgentAnalysisRequest request) {
        AgentRole role;
        try {
            role = AgentRole.fromName(agent);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
        if (!registry.has(role)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No agent registered for " + agent));
        }
        var body = request != null ? request : new AgentAnalysisRequest(null, null, null, null, null, null);
        if (body.timeWindowDays() != null && body.timeWindowDays() <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "time_window_days must be positive"));
        }
        var thread = engine.analyzeWith(role, new Query(body.query(), body.context()));
        log.info("Analysis {} answered directly by {}", thread.threadId(), role.agentName());
        return ResponseEntity.ok(AnalysisResult.from(thread));
    }

    /**
     * POST /api/v1/analysis/country/{country}: political, logistics and tariff
     * risk for one country.
     */
    @PostMapping("/country/{country}")
    public ResponseEntity<?> analyzeCountry(@PathVariable("country") String country,
                                            @RequestParam(name = "time_window_days", required = false)
                                            Integer timeWindowDays) {
        if (timeWindowDays != null && timeWindowDays <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "time_window_days must be positive"));
        }
        var thread = engine.analyzeCountry(country, timeWindowDays);
        log.info("Country analysis {} for {} answered by {}", thread.threadId(), country, thread.pipeline());
        return ResponseEntity.ok(AnalysisResult.from(thread));
    }

    /**
     * GET /api/v1/analysis/events: SSE stream of every thread's events.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamAllEvents() {
        return sseStreamingService.createEmitter();
    }

    /**
     * GET /api/v1/analysis/{threadId}/events: SSE stream for one thread. Open it
     * before posting the query with the same {@code thread_id}.
     */
    @GetMapping(value = "/{threadId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamThreadEvents(@PathVariable("threadId") String threadId) {
        return sseStreamingService.createEmitter(threadId);
    }

    /**
     * GET /api/v1/analysis/agents: what each agent can answer.
     */
    @GetMapping("/agents")
    public List<AgentCapability> agents() {
        return registry.capabilities();
    }
}
