package com.vidnyan.configguard;

import com.vidnyan.configguard.exception.RuleLoadException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConfigGuardApplicationTest {

    @Test
    void missingRuleDocument_ShouldFailStartupWithRuleLoadCause() {
        SpringApplicationBuilder app = new SpringApplicationBuilder(ConfigGuardApplication.class)
                .web(WebApplicationType.NONE)
                .properties("configguard.scanner.rules-location=classpath:rules/does-not-exist.yaml");

        RuntimeException failure = assertThrows(RuntimeException.class, () -> app.run());

        Optional<RuleLoadException> cause = ConfigGuardApplication.ruleLoadFailure(failure);
        assertTrue(cause.isPresent(), "startup failure should carry the rule load error");
        assertTrue(cause.get().getSource().contains("does-not-exist.yaml"), cause.get().getSource());
    }

    @Test
    void ruleLoadFailure_ShouldBeFoundThroughWrappingExceptions() {
        RuleLoadException rootCause = new RuleLoadException("rules.yaml", "'security_rules' list is empty");
        BeanCreationException wrapped = new BeanCreationException("ruleSet", "creation failed",
                new IllegalStateException("factory method failed", rootCause));

        assertSame(rootCause, ConfigGuardApplication.ruleLoadFailure(wrapped).orElseThrow());
    }

    @Test
    void unrelatedStartupFailure_ShouldNotBeTreatedAsRuleError() {
        assertTrue(ConfigGuardApplication.ruleLoadFailure(new IllegalStateException("port in use")).isEmpty());
    }
}
