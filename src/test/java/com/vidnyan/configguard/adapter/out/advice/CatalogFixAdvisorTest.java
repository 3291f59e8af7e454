package com.vidnyan.configguard.adapter.out.advice;

import com.vidnyan.configguard.TestFixtures;
import com.vidnyan.configguard.domain.rule.RuleDefinition;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CatalogFixAdvisorTest {

    private final CatalogFixAdvisor advisor = new CatalogFixAdvisor();

    @Test
    void everyBundledRule_ShouldHaveSpecificAdvice() {
        for (RuleDefinition rule : TestFixtures.bundledRules().rules()) {
            assertNotEquals(CatalogFixAdvisor.GENERIC_FIX, advisor.fixFor(rule.id()), rule.id());
        }
    }

    @Test
    void unknownOrMissingId_ShouldGetGenericAdvice() {
        assertEquals(CatalogFixAdvisor.GENERIC_FIX, advisor.fixFor("CUSTOM-999"));
        assertEquals(CatalogFixAdvisor.GENERIC_FIX, advisor.fixFor(null));
    }

    @Test
    void advice_ShouldBeStableAcrossCalls() {
        assertEquals(advisor.fixFor("ROOT-USER-001"), advisor.fixFor("ROOT-USER-001"));
    }
}
