package com.releasegate.core.risk;

import com.releasegate.core.model.ChangeSignal;
import com.releasegate.core.model.ComplexitySummary;
import com.releasegate.core.model.RiskAssessment;
import com.releasegate.core.model.RiskFinding;
import com.releasegate.core.model.RiskLevel;
import com.releasegate.core.model.RiskPriority;
import com.releasegate.core.model.SecuritySignal;
import com.releasegate.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Combines security, complexity and change signals into a 0-10 repository risk score.
 *
 * <p><b>Rules</b> (all independent, summed, then capped at {@value #MAX_SCORE}):
 * <table>
 *   <caption>Risk rules</caption>
 *   <tr><th>Condition</th><th>Priority</th><th>Points</th></tr>
 *   <tr><td>any CRITICAL vulnerability</td><td>CRITICAL</td><td>3.0</td></tr>
 *   <tr><td>any HIGH vulnerability</td><td>HIGH</td><td>2.0</td></tr>
 *   <tr><td>any detected secret</td><td>CRITICAL</td><td>2.5</td></tr>
 *   <tr><td>max complexity &gt; 20</td><td>HIGH</td><td>1.5</td></tr>
 *   <tr><td>average complexity &gt; 10</td><td>MEDIUM</td><td>1.0</td></tr>
 *   <tr><td>changed files &gt; 100</td><td>MEDIUM</td><td>1.0</td></tr>
 * </table>
 *
 * <p>Findings are sorted by priority; findings of equal priority keep their discovery order.
 */
public class RiskAssessor {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessor.class);

    public static final double MAX_SCORE = 10.0;

    static final double MAX_COMPLEXITY_THRESHOLD = 20.0;
    static final double AVERAGE_COMPLEXITY_THRESHOLD = 10.0;
    static final int CHANGED_FILES_THRESHOLD = 100;

    /**
     * Assesses repository-level risk.
     *
     * @param complexity aggregate complexity over files with a sample
     * @param security security signal, {@link SecuritySignal#none()} when absent
     * @param changes change signal, {@link ChangeSignal#none()} when absent
     * @return risk assessment
     */
    public RiskAssessment assess(ComplexitySummary complexity, SecuritySignal security, ChangeSignal changes) {
        ComplexitySummary summary = complexity != null ? complexity : ComplexitySummary.empty();
        SecuritySignal securitySignal = security != null ? security : SecuritySignal.none();
        ChangeSignal changeSignal = changes != null ? changes : ChangeSignal.none();

        List<RiskFinding> findings = new ArrayList<>();
        double score = 0;
        score += assessSecurity(securitySignal, findings);
        score += assessComplexity(summary, findings);
        score += assessChanges(changeSignal, findings);

        score = Math.min(score, MAX_SCORE);
        findings.sort(Comparator.comparing(RiskFinding::priority));

        double rounded = PerFileRiskEngine.round(score);
        RiskLevel level = RiskLevel.forScore(score);
        log.info("Repository risk score {} ({}), {} findings", rounded, level, findings.size());
        return new RiskAssessment(rounded, level, findings);
    }

    private double assessSecurity(SecuritySignal security, List<RiskFinding> findings) {
        double score = 0;

        long critical = security.count(Severity.CRITICAL);
        if (critical > 0) {
            findings.add(new RiskFinding(
                RiskPriority.CRITICAL,
                critical + " Critical Security Vulnerabilities",
                "Critical security vulnerabilities must be fixed before release",
                "Review and fix all critical vulnerabilities immediately"));
            score += 3.0;
        }

        long high = security.count(Severity.HIGH);
        if (high > 0) {
            findings.add(new RiskFinding(
                RiskPriority.HIGH,
                high + " High Severity Vulnerabilities",
                "High severity security issues detected",
                "Address high severity issues before release"));
            score += 2.0;
        }

        int secrets = security.secrets().size();
        if (secrets > 0) {
            findings.add(new RiskFinding(
                RiskPriority.CRITICAL,
                secrets + " Potential Secrets Detected",
                "Hardcoded secrets found in code",
                "Remove all secrets and use environment variables or secret management"));
            score += 2.5;
        }

        return score;
    }

    private double assessComplexity(ComplexitySummary complexity, List<RiskFinding> findings) {
        double score = 0;

        if (complexity.max() > MAX_COMPLEXITY_THRESHOLD) {
            findings.add(new RiskFinding(
                RiskPriority.HIGH,
                "High Code Complexity Detected",
                "Maximum complexity score of " + PerFileRiskEngine.formatNumber(complexity.max())
                    + " indicates potential maintainability issues",
                "Refactor complex functions to improve maintainability"));
            score += 1.5;
        }

        if (complexity.average() > AVERAGE_COMPLEXITY_THRESHOLD) {
            findings.add(new RiskFinding(
                RiskPriority.MEDIUM,
                "Above Average Code Complexity",
                "Average complexity of " + PerFileRiskEngine.formatNumber(complexity.average())
                    + " may impact long-term maintenance",
                "Consider simplifying code structure where possible"));
            score += 1.0;
        }

        return score;
    }

    private double assessChanges(ChangeSignal changes, List<RiskFinding> findings) {
        if (changes.total() > CHANGED_FILES_THRESHOLD) {
            findings.add(new RiskFinding(
                RiskPriority.MEDIUM,
                "Large Number of Changes",
                changes.total() + " files changed - increases testing scope",
                "Ensure comprehensive testing coverage for all changes"));
            return 1.0;
        }
        return 0;
    }
}
