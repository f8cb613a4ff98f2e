package com.taskforest.dispatch.cli;

import com.taskforest.core.events.ReconstructionEvent;
import com.taskforest.core.model.ReconstructionStats;
import com.taskforest.core.model.Resolution;
import com.taskforest.core.model.Skeleton;
import picocli.CommandLine;

import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * ANSI-colored terminal output utilities for the taskforest CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKFOREST v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKFOREST]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /** One line per audited decision, e.g. {@code edge.resolved C -> P (prefixLength=64)}. */
    public static void auditLine(ReconstructionEvent event) {
        Map<String, Object> payload = new TreeMap<>(event.payload());
        Object parentId = payload.remove("parentId");
        var line = new StringBuilder("  ").append(event.eventType()).append(' ')
                .append(event.taskId() != null ? event.taskId() : "-");
        if (parentId != null) {
            line.append(" -> ").append(parentId);
        }
        if (!payload.isEmpty()) {
            var details = new StringJoiner(", ", " (", ")");
            payload.forEach((k, v) -> details.add(k + "=" + v));
            line.append(details);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|faint " + line + "|@"));
    }

    public static void stats(ReconstructionStats s) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Reconstruction Stats|@"));
        System.out.println("  Records:     " + s.totalRecords() + " read, " + s.malformedRecords() + " malformed"
                + (s.filteredOut() > 0 ? ", " + s.filteredOut() + " filtered out" : ""));
        System.out.println("  Skeletons:   " + s.totalSkeletons() + " (" + s.indexedPrefixes() + " index keys)");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Declared:    " + s.declaredEdges() + " edges, @|fg(green) " + s.declaredEdgesRetained()
                        + " retained|@, @|fg(red) " + s.declaredEdgesInvalidated() + " invalidated|@"
                        + formatCounts(s.invalidatedByReason())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Resolved:    @|fg(green) " + s.resolvedEdges() + "|@ of " + s.phase3Candidates()
                        + " parentless" + formatCounts(s.resolvedByPrefixLength())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Unresolved:  @|fg(yellow) " + s.unresolved() + "|@ (" + s.ambiguous() + " ambiguous)"));
        System.out.println("  Forest:      " + s.rootCount() + " root(s), max depth " + s.maxDepth());
        System.out.println("  Duration:    " + formatDuration(s.durationMs()));
    }

    public static void treeLine(Skeleton skeleton, int indent) {
        String color = switch (skeleton.getResolution()) {
            case DECLARED -> "fg(green)";
            case RECONSTRUCTED -> "fg(cyan)";
            case AMBIGUOUS, INVALIDATED -> "fg(yellow)";
            default -> "fg(white)";
        };
        String instruction = abbreviate(skeleton.getTruncatedInstruction(), 60);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  ".repeat(indent + 1) + "@|bold " + skeleton.getTaskId() + "|@ @|" + color + " "
                        + label(skeleton.getResolution()) + "|@"
                        + (instruction.isEmpty() ? "" : " " + instruction)));
    }

    public static void malformed(String recordId, String reason) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) [MALFORMED]|@ " + (recordId != null ? recordId : "<no id>") + ": " + reason));
    }

    static String label(Resolution resolution) {
        return "[" + resolution.name().toLowerCase() + "]";
    }

    static String abbreviate(String text, int max) {
        if (text == null) return "";
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }

    private static String formatCounts(Map<?, Integer> counts) {
        if (counts == null || counts.isEmpty()) return "";
        var sb = new StringBuilder(" {");
        counts.forEach((k, v) -> sb.append(sb.length() > 2 ? ", " : "").append(k).append('=').append(v));
        return sb.append('}').toString();
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
