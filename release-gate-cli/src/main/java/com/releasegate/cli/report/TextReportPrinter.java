package com.releasegate.cli.report;

import com.releasegate.core.model.AnalysisResult;
import com.releasegate.core.model.FileRiskDetail;
import com.releasegate.core.model.GateCounts;
import com.releasegate.core.model.GateDecision;
import com.releasegate.core.model.RiskFinding;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Map;

/**
 * Prints a console summary of an {@link AnalysisResult}.
 */
public class TextReportPrinter {

    private static final int MAX_COMPONENTS_SHOWN = 10;

    public void print(AnalysisResult result, PrintWriter out) {
        out.println("Release Gate Report");
        out.println("===================");
        out.println("Repository: " + result.repositoryRoot());
        out.println("Analyzed:   " + result.timestamp());
        if (!result.complete()) {
            out.println("⚠ Analysis incomplete: deadline elapsed before all files finished");
        }
        out.println();

        printSummary(result, out);
        printFindings(result, out);
        printFiles(result, out);

        if (!result.skippedFiles().isEmpty()) {
            out.println("Skipped files:");
            result.skippedFiles().forEach(path -> out.println("  - " + path));
            out.println();
        }

        out.println("Overall gate: " + result.overallGate());
        out.flush();
    }

    private void printSummary(AnalysisResult result, PrintWriter out) {
        GateCounts counts = result.gateCounts();
        out.println("Summary:");
        out.printf(Locale.ROOT, "  Files:          %d (PASS %d, WARN %d, BLOCK %d)%n",
            result.totalFiles(), counts.passed(), counts.warned(), counts.blocked());
        out.println("  Languages:      " + formatLanguages(result.languages()));
        out.printf(Locale.ROOT, "  Components:     %d%n", result.totalComponents());
        out.printf(Locale.ROOT, "  Dependencies:   %d%n", result.dependencies().size());
        out.printf(Locale.ROOT, "  Complexity:     avg %.2f, max %.2f%n",
            result.complexity().average(), result.complexity().max());
        out.printf(Locale.ROOT, "  Changed files:  %d%n", result.changes().total());
        if (result.changes().note() != null) {
            out.println("                  (" + result.changes().note() + ")");
        }
        out.printf(Locale.ROOT, "  Risk score:     %.2f / 10 (%s)%n", result.riskScore(), result.riskLevel());
        out.println();

        if (!result.components().isEmpty()) {
            out.println("Components (first " + Math.min(MAX_COMPONENTS_SHOWN, result.components().size()) + "):");
            result.components().stream()
                .limit(MAX_COMPONENTS_SHOWN)
                .forEach(c -> out.println("  • " + c.name() + " [" + c.kind() + "]"));
            out.println();
        }
    }

    private void printFindings(AnalysisResult result, PrintWriter out) {
        if (result.riskFindings().isEmpty()) {
            out.println("No repository risk findings.");
            out.println();
            return;
        }
        out.println("Risk findings:");
        for (RiskFinding finding : result.riskFindings()) {
            out.println("  [" + finding.priority() + "] " + finding.title());
            out.println("      " + finding.description());
            out.println("      → " + finding.mitigation());
        }
        out.println();
    }

    private void printFiles(AnalysisResult result, PrintWriter out) {
        out.println("Files:");
        for (FileRiskDetail detail : result.fileDetails()) {
            out.printf(Locale.ROOT, "  %s %-5s %6.2f  %s (%s)%n",
                marker(detail.gateDecision()), detail.gateDecision(), detail.riskScore(),
                detail.path(), detail.language());
            if (detail.gateDecision() != GateDecision.PASS) {
                detail.recommendations().forEach(r -> out.println("            - " + r));
            }
        }
        out.println();
    }

    private static String marker(GateDecision decision) {
        return switch (decision) {
            case PASS -> "✓";
            case WARN -> "⚠";
            case BLOCK -> "✗";
        };
    }

    private static String formatLanguages(Map<String, Integer> languages) {
        if (languages.isEmpty()) {
            return "-";
        }
        StringBuilder sb = new StringBuilder();
        languages.forEach((language, count) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(language).append(" ").append(count);
        });
        return sb.toString();
    }
}
