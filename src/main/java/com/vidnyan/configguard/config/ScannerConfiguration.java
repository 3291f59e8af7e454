package com.vidnyan.configguard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.configguard.application.port.out.RuleRepository;
import com.vidnyan.configguard.domain.rule.ArtifactPredicate;
import com.vidnyan.configguard.domain.rule.EvaluationEngine;
import com.vidnyan.configguard.domain.rule.PredicateRegistry;
import com.vidnyan.configguard.domain.rule.RuleEvaluator;
import com.vidnyan.configguard.domain.rule.RuleSet;
import com.vidnyan.configguard.domain.scan.FindingAggregator;
import com.vidnyan.configguard.domain.scan.ScoringPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.List;

/**
 * Spring configuration for ConfigGuard components.
 * Wires the pure domain services to the Spring-managed adapters.
 */
@Slf4j
@Configuration
public class ScannerConfiguration {

    /**
     * ObjectMapper for JSON output.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public PredicateRegistry predicateRegistry(List<ArtifactPredicate> predicates) {
        PredicateRegistry registry = new PredicateRegistry(predicates);
        log.info("Registered {} predicates: {}", registry.names().size(), registry.names());
        return registry;
    }

    @Bean
    public EvaluationEngine evaluationEngine(List<RuleEvaluator> evaluators) {
        log.info("Registered {} rule evaluators:", evaluators.size());
        evaluators.forEach(e -> log.info("  - {} ({})", e.getName(), e.checkKind()));
        return new EvaluationEngine(evaluators);
    }

    @Bean
    public ScoringPolicy scoringPolicy(ScannerProperties properties) {
        ScoringPolicy policy = properties.toScoringPolicy();
        log.info("Scoring policy: weights={}, maxScore={}, reviewThreshold={}",
                policy.weights(), policy.maxScore(), policy.reviewThreshold());
        return policy;
    }

    @Bean
    public FindingAggregator findingAggregator(ScoringPolicy scoringPolicy) {
        return new FindingAggregator(scoringPolicy);
    }

    /**
     * Rule set loaded once and shared read-only by every scan. A load failure stops startup.
     */
    @Bean
    public RuleSet ruleSet(RuleRepository ruleRepository, ResourceLoader resourceLoader,
                           ScannerProperties properties) {
        return ruleRepository.load(resourceLoader.getResource(properties.getRulesLocation()));
    }
}
