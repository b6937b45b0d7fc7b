package com.supplyguard.core.state;

import com.supplyguard.core.model.AgentInvocation;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.Intent;
import com.supplyguard.core.model.Query;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.routing.PipelinePlan;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one conversation thread.
 * <p>
 * {@code invocations} and {@code transitions} are replaced wholesale by the
 * node that extends them, so their order is exactly the order nodes produced them.
 */
public class AnalysisState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("threadId",        Channels.base(() -> "")),
        Map.entry("query",           Channels.base((Reducer<Query>) null)),
        Map.entry("status",          Channels.base(() -> ThreadStatus.STARTED.name())),
        Map.entry("intent",          Channels.base((Reducer<Intent>) null)),
        Map.entry("plan",            Channels.base((Reducer<PipelinePlan>) null)),
        Map.entry("tierIndex",       Channels.base(() -> 0)),
        Map.entry("deadlineEpochMs", Channels.base(() -> Long.MAX_VALUE)),
        Map.entry("truncated",       Channels.base(() -> false)),
        Map.entry("finalScore",      Channels.base((Reducer<RiskScore>) null)),
        Map.entry("fatalError",      Channels.base(() -> "")),
        Map.entry("targetRole",      Channels.base(() -> "")),
        Map.entry("targetDomains",   Channels.base((Supplier<List<String>>) List::of)),

        Map.entry("invocations",     Channels.base((Supplier<List<AgentInvocation>>) List::of)),
        Map.entry("transitions",     Channels.base((Supplier<List<String>>) List::of))
    );

    public AnalysisState(Map<String, Object> initData) {
        super(initData);
    }

    public String threadId() {
        return this.<String>value("threadId").orElse("");
    }

    public Query query() {
        return this.<Query>value("query").orElse(Query.of(""));
    }

    public ThreadStatus status() {
        String raw = this.<String>value("status").orElse(ThreadStatus.STARTED.name());
        return ThreadStatus.valueOf(raw);
    }

    public Optional<Intent> intent() {
        return value("intent");
    }

    public Optional<PipelinePlan> plan() {
        return value("plan");
    }

    public int tierIndex() {
        return this.<Integer>value("tierIndex").orElse(0);
    }

    public long deadlineEpochMs() {
        return this.<Number>value("deadlineEpochMs").map(Number::longValue).orElse(Long.MAX_VALUE);
    }

    public boolean truncated() {
        return this.<Boolean>value("truncated").orElse(false);
    }

    public Optional<RiskScore> finalScore() {
        return value("finalScore");
    }

    public String fatalError() {
        return this.<String>value("fatalError").orElse("");
    }

    /**
     * Agent the caller asked for directly, bypassing keyword routing.
     */
    public Optional<AgentRole> targetRole() {
        String raw = this.<String>value("targetRole").orElse("");
        return raw.isEmpty() ? Optional.empty() : Optional.of(AgentRole.valueOf(raw));
    }

    /**
     * Domains the caller asked for directly; empty when keyword routing applies.
     */
    public List<RiskDimension> targetDomains() {
        return this.<List<String>>value("targetDomains").orElse(List.of()).stream()
                .map(RiskDimension::valueOf)
                .toList();
    }

    public List<AgentInvocation> invocations() {
        return this.<List<AgentInvocation>>value("invocations").orElse(List.of());
    }

    public List<String> transitions() {
        return this.<List<String>>value("transitions").orElse(List.of());
    }

    /**
     * True when the plan has tiers left to run.
     */
    public boolean hasMoreTiers() {
        return plan().map(p -> tierIndex() < p.tierCount()).orElse(false);
    }

    /**
     * Transition log extended with {@code entries}, for a node's update map.
     */
    public List<String> transitionsWith(String... entries) {
        var list = new ArrayList<>(transitions());
        list.addAll(List.of(entries));
        return list;
    }

    public List<AgentInvocation> invocationsWith(List<AgentInvocation> added) {
        var list = new ArrayList<>(invocations());
        list.addAll(added);
        return list;
    }
}
