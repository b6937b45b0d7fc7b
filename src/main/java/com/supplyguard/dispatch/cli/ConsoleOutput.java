package com.supplyguard.dispatch.cli;

import com.supplyguard.core.model.AnalysisResult;
import picocli.CommandLine;

import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the SupplyGuard CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SUPPLYGUARD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SUPPLYGUARD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String name, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + name + "]|@ " + message));
    }

    public static void riskLevel(String level, double score, double confidence) {
        String color = switch (level) {
            case "critical" -> "fg(red),bold";
            case "high" -> "fg(red)";
            case "medium" -> "fg(yellow)";
            default -> "fg(green)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "Risk: @|%s %s|@ (score %.1f, confidence %.2f)", color, level.toUpperCase(Locale.ROOT), score, confidence)));
    }

    public static void result(AnalysisResult result) {
        System.out.println();
        System.out.println("THREAD " + result.threadId() + "  [" + result.analysisType() + "]");
        for (var inv : result.invocations()) {
            String status = "succeeded".equals(inv.status())
                    ? "@|fg(green) " + inv.status() + "|@"
                    : "@|fg(red) " + inv.status() + "|@";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  %-22s %s %5.1f %s (%s)", inv.agentName(), status, inv.riskScore(),
                    inv.provenance(), formatDuration(inv.elapsedMs()))));
        }
        System.out.println();
        riskLevel(result.riskLevel(), result.riskScore(), result.confidence());
        System.out.println(result.summary());
        if (result.truncated()) {
            error("Pipeline truncated by a timeout; partial result");
        }
        list("Recommendations", result.recommendations());
        list("Affected equipment", result.affectedEquipment());
        list("Recent events", result.recentEvents());
    }

    private static void list(String title, List<String> items) {
        if (items.isEmpty()) return;
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
        for (String item : items) {
            System.out.println("  - " + item);
        }
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
