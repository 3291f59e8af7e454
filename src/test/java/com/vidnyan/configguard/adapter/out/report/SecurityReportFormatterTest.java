package com.vidnyan.configguard.adapter.out.report;

import com.vidnyan.configguard.domain.rule.Finding;
import com.vidnyan.configguard.domain.rule.RuleDefinition.Severity;
import com.vidnyan.configguard.domain.scan.FindingAggregator;
import com.vidnyan.configguard.domain.scan.ScanResult;
import com.vidnyan.configguard.domain.scan.ScoringPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class SecurityReportFormatterTest {

    private final SecurityReportFormatter formatter = new SecurityReportFormatter(ScoringPolicy.defaults());
    private final FindingAggregator aggregator = new FindingAggregator(ScoringPolicy.defaults());

    @Test
    void cleanResult_ShouldReportProductionReady() {
        String report = formatter.format(aggregator.aggregate(List.of()));

        assertTrue(report.contains("SECURITY VALIDATION REPORT"));
        assertTrue(report.contains("Total Issues: 0"));
        assertTrue(report.contains("Risk Score: 0/100"));
        assertTrue(report.contains("Status: APPROVED"));
        assertTrue(report.contains("PRODUCTION READY"));
        assertFalse(report.contains("NOT PRODUCTION READY"));
        assertFalse(report.contains("ISSUES FOUND:"));
    }

    @Test
    void issues_ShouldBeListedMostSevereFirstWithLocationAndFix() {
        Finding low = Finding.builder()
                .ruleId("FULL-BASE-IMAGE-001").severity(Severity.LOW).message("Full base image")
                .artifactKind("dockerfile").line(1).matched("FROM python:3.11").fix("Use slim")
                .build();
        Finding critical = Finding.builder()
                .ruleId("ROOT-USER-001").severity(Severity.CRITICAL).message("No non-root USER")
                .artifactKind("dockerfile").fix("Add USER appuser")
                .build();

        ScanResult result = aggregator.aggregate(List.of(low, critical));
        String report = formatter.format(result);

        assertTrue(report.contains("Status: BLOCKED"));
        assertTrue(report.contains("NOT PRODUCTION READY"));
        assertTrue(report.contains("  - Non-root user"));
        assertTrue(report.indexOf("CRITICAL [ROOT-USER-001]") < report.indexOf("LOW [FULL-BASE-IMAGE-001]"));
        assertTrue(report.contains("Location: dockerfile:1"));
        assertTrue(report.contains("Matched:  FROM python:3.11"));
        assertTrue(report.contains("Fix:      Add USER appuser"));
        assertTrue(report.contains("* Add non-root user to Dockerfile"));
    }

    @Test
    void riskScore_ShouldBeShownAgainstConfiguredMaximum() {
        ScoringPolicy strict = new ScoringPolicy(ScoringPolicy.defaults().weights(), 50, 20);
        SecurityReportFormatter strictFormatter = new SecurityReportFormatter(strict);
        Finding high = Finding.builder()
                .ruleId("LATEST-TAG-001").severity(Severity.HIGH).message("Using :latest")
                .artifactKind("dockerfile").line(1)
                .build();

        String report = strictFormatter.format(new FindingAggregator(strict).aggregate(List.of(high)));

        assertTrue(report.contains("Risk Score: 10/50"), report);
    }

    @Test
    void severityLabels_ShouldNotDependOnDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            String report = formatter.format(aggregator.aggregate(List.of()));

            assertTrue(report.contains("Critical:"), report);
            assertFalse(report.contains("\r"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
