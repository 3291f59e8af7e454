package com.vidnyan.configguard.adapter.out.report;

import com.vidnyan.configguard.domain.rule.Finding;
import com.vidnyan.configguard.domain.rule.RuleDefinition.Severity;
import com.vidnyan.configguard.domain.scan.ScanResult;
import com.vidnyan.configguard.domain.scan.ScoringPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link ScanResult} as a human-readable report.
 * Issues are listed most severe first; within a severity the scan order is kept.
 */
@Component
@RequiredArgsConstructor
public class SecurityReportFormatter {

    private static final String RULE = "=".repeat(70);
    private static final String THIN_RULE = "-".repeat(70);

    private final ScoringPolicy scoringPolicy;

    public String format(ScanResult result) {
        StringBuilder report = new StringBuilder();
        report.append(RULE).append('\n');
        report.append("SECURITY VALIDATION REPORT\n");
        report.append(RULE).append("\n\n");

        report.append("Total Issues: ").append(result.totalIssues()).append('\n');
        for (Severity severity : Severity.values()) {
            report.append(String.format(Locale.ROOT, "  %-9s %d\n", label(severity) + ":", result.count(severity)));
        }
        report.append('\n');
        report.append("Risk Score: ").append(result.riskScore()).append('/').append(scoringPolicy.maxScore()).append('\n');
        report.append("Status: ").append(result.status()).append("\n\n");

        if (result.isProductionReady()) {
            report.append("PRODUCTION READY\n\n");
        } else {
            report.append("NOT PRODUCTION READY\n");
            if (!result.compliance().missingRequirements().isEmpty()) {
                report.append("Missing requirements:\n");
                result.compliance().missingRequirements()
                        .forEach(req -> report.append("  - ").append(req).append('\n'));
            }
            report.append('\n');
        }

        if (!result.findings().isEmpty()) {
            report.append("ISSUES FOUND:\n");
            report.append(THIN_RULE).append("\n\n");
            for (Finding finding : bySeverity(result.findings())) {
                appendFinding(report, finding);
            }
        }

        report.append("RECOMMENDATIONS:\n");
        report.append(THIN_RULE).append('\n');
        result.recommendations().forEach(rec -> report.append("* ").append(rec).append('\n'));
        report.append('\n').append(RULE).append('\n');

        return report.toString();
    }

    private void appendFinding(StringBuilder report, Finding finding) {
        report.append(finding.severity()).append(" [").append(finding.ruleId()).append("]: ")
                .append(finding.message()).append('\n');
        report.append("   Location: ").append(finding.formattedLocation()).append('\n');
        if (finding.matched() != null) {
            report.append("   Matched:  ").append(finding.matched()).append('\n');
        }
        if (finding.fix() != null) {
            report.append("   Fix:      ").append(finding.fix()).append('\n');
        }
        report.append('\n');
    }

    private static List<Finding> bySeverity(List<Finding> findings) {
        return findings.stream()
                .sorted(Comparator.comparing(Finding::severity))
                .toList();
    }

    private static String label(Severity severity) {
        String name = severity.name();
        return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
    }
}
