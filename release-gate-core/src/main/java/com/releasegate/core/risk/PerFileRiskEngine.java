package com.releasegate.core.risk;

import com.releasegate.core.model.AnalysisMode;
import com.releasegate.core.model.ChangeSignal;
import com.releasegate.core.model.FileAnalysis;
import com.releasegate.core.model.FileChange;
import com.releasegate.core.model.FileChangeStats;
import com.releasegate.core.model.FileRecord;
import com.releasegate.core.model.FileRiskDetail;
import com.releasegate.core.model.GateDecision;
import com.releasegate.core.model.Issue;
import com.releasegate.core.model.RiskBreakdown;
import com.releasegate.core.model.SecretLocation;
import com.releasegate.core.model.SecuritySignal;
import com.releasegate.core.model.Severity;
import com.releasegate.core.model.Vulnerability;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Computes the 0-100 risk score and PASS/WARN/BLOCK gate of a single file.
 *
 * <p><b>Score:</b> sum of four contributions, each capped before summation:
 * <ul>
 *   <li>complexity: {@code min(complexity / 10 * 50, 50)}</li>
 *   <li>change volume: {@code min(changedLines / 500 * 25, 25)}</li>
 *   <li>critical function: classifier output, capped at 15</li>
 *   <li>issue severity: CRITICAL 15, HIGH 10, MEDIUM 5, LOW 2 per issue, capped at 30</li>
 * </ul>
 * The total is capped at {@value RiskBreakdown#MAX_SCORE}. The gate is derived from the
 * unrounded total; the reported score is rounded to two decimals.
 *
 * <p>Stateless apart from its classifier; safe to share between worker threads.
 */
public class PerFileRiskEngine {

    public static final double COMPLEXITY_CAP = 50.0;
    public static final double CHANGE_VOLUME_CAP = 25.0;
    public static final double CRITICAL_FUNCTION_CAP = 15.0;
    public static final double ISSUE_SEVERITY_CAP = 30.0;

    static final double CHANGED_LINES_FOR_CAP = 500.0;
    static final double COMPLEXITY_FOR_CAP_UNIT = 10.0;

    private final CriticalPathClassifier classifier;

    public PerFileRiskEngine() {
        this(CriticalPathClassifier.none());
    }

    public PerFileRiskEngine(CriticalPathClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Assesses one analyzed file against the batch-wide signals.
     *
     * @param analysis analyzed file
     * @param security security signal for the batch
     * @param changes change signal for the batch
     * @return per-file risk detail
     */
    public FileRiskDetail assess(FileAnalysis analysis, SecuritySignal security, ChangeSignal changes) {
        FileRecord file = analysis.file();
        double complexity = analysis.facts().complexity();
        List<Issue> issues = issuesFor(file, security != null ? security : SecuritySignal.none());
        FileChangeStats changeStats = changesFor(file, changes != null ? changes : ChangeSignal.none());

        RiskBreakdown breakdown = new RiskBreakdown(
            complexityContribution(complexity),
            changeVolumeContribution(changeStats.total()),
            Math.min(classifier.classify(analysis), CRITICAL_FUNCTION_CAP),
            issueSeverityContribution(issues)
        );
        double score = breakdown.total();
        GateDecision gate = GateDecision.forScore(score);

        return new FileRiskDetail(
            file.name(),
            file.path(),
            file.language(),
            file.lineCount(),
            analysis.mode(),
            complexity,
            maintainability(complexity),
            round(score),
            gate,
            breakdown,
            issues,
            changeStats,
            recommendations(gate, complexity, issues, analysis.mode())
        );
    }

    static double complexityContribution(double complexity) {
        return Math.min(complexity / COMPLEXITY_FOR_CAP_UNIT * COMPLEXITY_CAP, COMPLEXITY_CAP);
    }

    static double changeVolumeContribution(int changedLines) {
        return Math.min(changedLines / CHANGED_LINES_FOR_CAP * CHANGE_VOLUME_CAP, CHANGE_VOLUME_CAP);
    }

    static double issueSeverityContribution(List<Issue> issues) {
        double total = 0;
        for (Issue issue : issues) {
            total += weight(issue.severity());
        }
        return Math.min(total, ISSUE_SEVERITY_CAP);
    }

    static double maintainability(double complexity) {
        return Math.max(100 - complexity * 5, 0);
    }

    private static double weight(Severity severity) {
        return switch (severity) {
            case CRITICAL -> 15.0;
            case HIGH -> 10.0;
            case MEDIUM -> 5.0;
            case LOW -> 2.0;
        };
    }

    private List<Issue> issuesFor(FileRecord file, SecuritySignal security) {
        List<Issue> issues = new ArrayList<>();
        for (Vulnerability vulnerability : security.vulnerabilities()) {
            if (refersTo(vulnerability.file(), file)) {
                issues.add(new Issue(vulnerability.line(), vulnerability.description(), vulnerability.severity()));
            }
        }
        for (SecretLocation secret : security.secrets()) {
            if (refersTo(secret.file(), file)) {
                issues.add(new Issue(secret.line(), "Potential hardcoded secret", Severity.CRITICAL));
            }
        }
        return issues;
    }

    private FileChangeStats changesFor(FileRecord file, ChangeSignal changes) {
        for (FileChange change : changes.fileChanges()) {
            if (refersTo(change.path(), file)) {
                return FileChangeStats.of(change.linesAdded(), change.linesDeleted());
            }
        }
        return FileChangeStats.none();
    }

    /**
     * Matches a collaborator-reported path against a file: exact path, path suffix in either
     * direction (collaborators may report relative or absolute paths), or bare file name.
     */
    static boolean refersTo(String reported, FileRecord file) {
        if (reported == null || reported.isBlank()) {
            return false;
        }
        String candidate = normalize(reported);
        String path = normalize(file.path());
        if (candidate.equals(path) || candidate.equals(file.name())) {
            return true;
        }
        return path.endsWith("/" + candidate) || candidate.endsWith("/" + path);
    }

    private static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        return normalized.startsWith("./") ? normalized.substring(2) : normalized;
    }

    private static List<String> recommendations(GateDecision gate, double complexity, List<Issue> issues,
                                                AnalysisMode mode) {
        List<String> recommendations = new ArrayList<>();
        if (gate == GateDecision.BLOCK) {
            recommendations.add("Blocking risk: resolve the findings below or split the change before release");
        } else if (gate == GateDecision.WARN) {
            recommendations.add("Elevated risk: request an additional reviewer for this file");
        }
        if (complexity > COMPLEXITY_FOR_CAP_UNIT) {
            recommendations.add("Reduce complexity (" + formatNumber(complexity) + ") by extracting smaller functions");
        }
        long severe = issues.stream()
            .filter(i -> i.severity() == Severity.CRITICAL || i.severity() == Severity.HIGH)
            .count();
        if (severe > 0) {
            recommendations.add("Fix " + severe + " critical/high severity issue(s) before deployment");
        }
        if (mode == AnalysisMode.PARSE_FAILED || mode == AnalysisMode.FAILED) {
            recommendations.add("Structure could not be analyzed; review this file manually");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Review changes before deployment");
        }
        return recommendations;
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
