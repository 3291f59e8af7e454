package com.vidnyan.configguard.adapter.in.web;

import com.vidnyan.configguard.adapter.out.report.SecurityReportFormatter;
import com.vidnyan.configguard.application.port.in.ScanConfigurationUseCase;
import com.vidnyan.configguard.application.port.out.RuleRepository;
import com.vidnyan.configguard.domain.artifact.ArtifactSet;
import com.vidnyan.configguard.domain.rule.RuleDefinition;
import com.vidnyan.configguard.domain.rule.RuleSet;
import com.vidnyan.configguard.domain.scan.ScanResult;
import com.vidnyan.configguard.exception.RuleLoadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * REST API for scanning generated artifacts.
 * Request body: artifact kind to raw text, e.g. {"dockerfile": "...", "kubernetes": "..."}.
 */
@Slf4j
@RestController
@RequestMapping("/api/scan")
@RequiredArgsConstructor
public class ScanController {

    private final ScanConfigurationUseCase scanUseCase;
    private final RuleRepository ruleRepository;
    private final SecurityReportFormatter reportFormatter;

    @PostMapping
    public ScanResult scan(@RequestBody Map<String, String> artifacts) {
        log.info("Received scan request for {}", artifacts.keySet());
        return scanUseCase.scan(ArtifactSet.of(artifacts));
    }

    @PostMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String report(@RequestBody Map<String, String> artifacts) {
        log.info("Received report request for {}", artifacts.keySet());
        return reportFormatter.format(scanUseCase.scan(ArtifactSet.of(artifacts)));
    }

    /**
     * Scan against a rule document supplied in the request, for trying out policy changes.
     */
    @PostMapping("/custom")
    public ScanResult scanWithRules(@RequestBody CustomScanRequest request) {
        if (request.rules() == null || request.rules().isBlank()) {
            throw new IllegalArgumentException("'rules' must contain a rule document");
        }
        RuleSet rules = ruleRepository.load(new ByteArrayResource(
                request.rules().getBytes(StandardCharsets.UTF_8), "request rule document"));
        return scanUseCase.scan(rules, ArtifactSet.of(request.artifacts()));
    }

    @GetMapping("/rules")
    public List<RuleSummary> rules() {
        return scanUseCase.activeRules().rules().stream()
                .map(RuleSummary::from)
                .toList();
    }

    @GetMapping("/health")
    public String health() {
        return "OK - ConfigGuard (" + scanUseCase.activeRules().size() + " rules)";
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse badRequest(Exception e) {
        log.warn("Rejected scan request: {}", e.getMessage());
        return new ErrorResponse("INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler(RuleLoadException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse ruleLoadFailed(RuleLoadException e) {
        log.warn("Rejected rule document ({}): {}", e.getSource(), e.getMessage());
        return new ErrorResponse("RULE_LOAD_ERROR", e.getMessage());
    }

    public record RuleSummary(
        String id,
        RuleDefinition.Severity severity,
        RuleDefinition.CheckKind check,
        String description,
        List<String> patterns,
        String predicate,
        List<String> appliesTo
    ) {
        static RuleSummary from(RuleDefinition rule) {
            return new RuleSummary(rule.id(), rule.severity(), rule.checkKind(), rule.findingMessage(),
                    rule.patternSources(), rule.predicate(), rule.appliesTo());
        }
    }

    public record CustomScanRequest(
        String rules,
        Map<String, String> artifacts
    ) {}

    public record ErrorResponse(
        String error,
        String message
    ) {}
}
