package com.vidnyan.configguard.application.service;

import com.vidnyan.configguard.application.port.in.ScanConfigurationUseCase;
import com.vidnyan.configguard.application.port.out.FixAdvisor;
import com.vidnyan.configguard.domain.artifact.ArtifactSet;
import com.vidnyan.configguard.domain.rule.EvaluationEngine;
import com.vidnyan.configguard.domain.rule.Finding;
import com.vidnyan.configguard.domain.rule.RuleDefinition;
import com.vidnyan.configguard.domain.rule.RuleSet;
import com.vidnyan.configguard.domain.scan.FindingAggregator;
import com.vidnyan.configguard.domain.scan.ScanResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Orchestrates a scan: evaluate rules, annotate findings with fixes, aggregate the verdict.
 * Holds no per-scan state, so concurrent scans need no locking.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfigScanService implements ScanConfigurationUseCase {

    private final RuleSet ruleSet;
    private final EvaluationEngine evaluationEngine;
    private final FindingAggregator findingAggregator;
    private final FixAdvisor fixAdvisor;

    @Override
    public ScanResult scan(ArtifactSet artifacts) {
        return scan(ruleSet, artifacts);
    }

    @Override
    public ScanResult scan(RuleSet rules, ArtifactSet artifacts) {
        Instant startTime = Instant.now();
        log.info("Scanning {} artifacts {} against {} rules", artifacts.size(), artifacts.kinds(), rules.size());

        List<Finding> findings = evaluationEngine.evaluate(rules, artifacts);

        Map<String, RuleDefinition> byId = rules.rules().stream()
                .collect(Collectors.toMap(RuleDefinition::id, Function.identity()));
        List<Finding> annotated = findings.stream()
                .map(f -> f.withFix(fixFor(byId.get(f.ruleId()))))
                .toList();

        ScanResult result = findingAggregator.aggregate(annotated);

        log.info("Scan complete: {} issues, risk score {}, status {} in {}ms",
                result.totalIssues(), result.riskScore(), result.status(),
                Duration.between(startTime, Instant.now()).toMillis());
        return result;
    }

    @Override
    public RuleSet activeRules() {
        return ruleSet;
    }

    /**
     * Rule document hint first, catalog advice otherwise.
     */
    private String fixFor(RuleDefinition rule) {
        return rule.remediationHint().orElseGet(() -> fixAdvisor.fixFor(rule.id()));
    }
}
