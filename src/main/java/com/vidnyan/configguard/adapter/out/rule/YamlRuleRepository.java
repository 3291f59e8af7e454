package com.vidnyan.configguard.adapter.out.rule;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vidnyan.configguard.application.port.out.RuleRepository;
import com.vidnyan.configguard.domain.rule.PredicateRegistry;
import com.vidnyan.configguard.domain.rule.RuleDefinition;
import com.vidnyan.configguard.domain.rule.RuleSet;
import com.vidnyan.configguard.exception.RuleLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads rules from a YAML (or JSON) rule document.
 * <p>
 * Strict about required fields, severities, check kinds, expressions and predicate names;
 * tolerant of unknown and optional fields. Any invalid entry fails the whole load.
 */
@Slf4j
@Component
public class YamlRuleRepository implements RuleRepository {

    static final String RULES_KEY = "security_rules";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private final PredicateRegistry predicateRegistry;

    public YamlRuleRepository(PredicateRegistry predicateRegistry) {
        this.predicateRegistry = predicateRegistry;
    }

    @Override
    public RuleSet load(Resource source) {
        String sourceName = source.getDescription();
        RuleDocumentDto document = read(source, sourceName);

        if (document == null || document.rules == null) {
            throw new RuleLoadException(sourceName, "document has no '" + RULES_KEY + "' list");
        }
        if (document.rules.isEmpty()) {
            throw new RuleLoadException(sourceName, "'" + RULES_KEY + "' list is empty");
        }

        List<RuleDefinition> rules = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < document.rules.size(); i++) {
            RuleDefinition rule = mapToRule(document.rules.get(i), i + 1, sourceName);
            if (!seenIds.add(rule.id())) {
                throw new RuleLoadException(sourceName, "duplicate rule id '" + rule.id() + "'");
            }
            if (!rule.enabled()) {
                log.info("Skipping disabled rule: {}", rule.id());
                continue;
            }
            rules.add(rule);
            log.debug("Loaded rule: {} [{} {}] applies to {}",
                    rule.id(), rule.severity(), rule.checkKind(), rule.appliesTo());
        }

        if (rules.isEmpty()) {
            log.warn("Every rule in {} is disabled; scans will approve everything", sourceName);
        }
        log.info("Loaded {} rules from {}", rules.size(), sourceName);
        return RuleSet.of(sourceName, rules);
    }

    private RuleDocumentDto read(Resource source, String sourceName) {
        if (!source.exists()) {
            throw new RuleLoadException(sourceName, "rule document not found");
        }
        try (InputStream in = source.getInputStream()) {
            return yamlMapper.readValue(in, RuleDocumentDto.class);
        } catch (IOException e) {
            throw new RuleLoadException(sourceName, "rule document is unreadable or malformed: " + e.getMessage(), e);
        }
    }

    private RuleDefinition mapToRule(RuleDto dto, int position, String sourceName) {
        if (dto == null) {
            throw new RuleLoadException(sourceName, "rule #" + position + " is empty");
        }
        String label = "rule #" + position + (isBlank(dto.id) ? "" : " (" + dto.id + ")");

        String id = required(dto.id, "id", label, sourceName);
        RuleDefinition.Severity severity = mapSeverity(required(dto.severity, "severity", label, sourceName),
                label, sourceName);
        RuleDefinition.CheckKind checkKind = mapCheckKind(required(dto.check, "check", label, sourceName),
                label, sourceName);
        List<String> appliesTo = mapAppliesTo(dto.appliesTo, label, sourceName);

        RuleDefinition.Builder builder = RuleDefinition.builder()
                .id(id)
                .description(dto.description)
                .message(dto.message)
                .severity(severity)
                .checkKind(checkKind)
                .appliesTo(appliesTo)
                .remediation(dto.fix)
                .enabled(dto.enabled == null || dto.enabled);

        switch (checkKind) {
            case PATTERN -> builder.patterns(mapPatterns(dto, label, sourceName));
            case LOGIC -> builder.predicate(mapPredicate(dto, label, sourceName));
        }

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new RuleLoadException(sourceName, label + ": " + e.getMessage(), e);
        }
    }

    private RuleDefinition.Severity mapSeverity(String severity, String label, String sourceName) {
        try {
            return RuleDefinition.Severity.valueOf(severity.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleLoadException(sourceName, label + ": unknown severity '" + severity
                    + "', expected one of CRITICAL, HIGH, MEDIUM, LOW", e);
        }
    }

    private RuleDefinition.CheckKind mapCheckKind(String check, String label, String sourceName) {
        try {
            return RuleDefinition.CheckKind.valueOf(check.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleLoadException(sourceName, label + ": unknown check kind '" + check
                    + "', expected PATTERN or LOGIC", e);
        }
    }

    private List<String> mapAppliesTo(List<String> appliesTo, String label, String sourceName) {
        if (appliesTo == null || appliesTo.stream().allMatch(YamlRuleRepository::isBlank)) {
            throw new RuleLoadException(sourceName, label + ": missing required field 'applies_to'");
        }
        return appliesTo.stream()
                .filter(kind -> !isBlank(kind))
                .map(String::trim)
                .distinct()
                .toList();
    }

    private List<Pattern> mapPatterns(RuleDto dto, String label, String sourceName) {
        if (!isBlank(dto.predicate)) {
            throw new RuleLoadException(sourceName, label + ": PATTERN rule must not name a predicate");
        }
        List<String> expressions = new ArrayList<>();
        if (!isBlank(dto.pattern)) {
            expressions.add(dto.pattern);
        }
        if (dto.patterns != null) {
            dto.patterns.stream().filter(p -> !isBlank(p)).forEach(expressions::add);
        }
        if (expressions.isEmpty()) {
            throw new RuleLoadException(sourceName, label + ": missing required field 'patterns'");
        }

        List<Pattern> compiled = new ArrayList<>();
        for (String expression : expressions) {
            try {
                compiled.add(Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new RuleLoadException(sourceName, label + ": invalid pattern '" + expression + "'", e);
            }
        }
        return compiled;
    }

    private String mapPredicate(RuleDto dto, String label, String sourceName) {
        if (!isBlank(dto.pattern) || (dto.patterns != null && !dto.patterns.isEmpty())) {
            throw new RuleLoadException(sourceName, label + ": LOGIC rule must not declare patterns");
        }
        String predicate = required(dto.predicate, "predicate", label, sourceName).trim();
        if (!predicateRegistry.contains(predicate)) {
            throw new RuleLoadException(sourceName, label + ": unknown predicate '" + predicate
                    + "', known predicates are " + predicateRegistry.names());
        }
        return predicate;
    }

    private static String required(String value, String field, String label, String sourceName) {
        if (isBlank(value)) {
            throw new RuleLoadException(sourceName, label + ": missing required field '" + field + "'");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // DTO classes for YAML deserialization
    static class RuleDocumentDto {
        @JsonProperty(RULES_KEY)
        @JsonAlias("rules")
        public List<RuleDto> rules;
    }

    static class RuleDto {
        @JsonAlias("rule_id")
        public String id;
        public String description;
        public String message;
        public String severity;
        public String check;
        public String pattern;
        public List<String> patterns;
        public String predicate;
        @JsonProperty("applies_to")
        @JsonAlias("appliesTo")
        public List<String> appliesTo;
        @JsonAlias({"fix_suggestion", "remediation"})
        public String fix;
        public Boolean enabled;
    }
}
