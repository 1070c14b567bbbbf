package io.github.cyfko.prereq.core.config;

import io.github.cyfko.prereq.core.parsing.GroupingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the policy records.
 */
@DisplayName("Policy Tests")
class ParserPolicyTest {

    @Test
    @DisplayName("Should expose the documented presets")
    void testPresets() {
        ParserPolicy defaults = ParserPolicy.defaults();
        assertEquals(5000, defaults.maxInputLength());
        assertEquals(10, defaults.maxNestingDepth());
        assertFalse(defaults.tolerateLexErrors());
        assertSame(GroupingPolicy.LEFT_TO_RIGHT, defaults.groupingPolicy());

        assertEquals(5, ParserPolicy.strict().maxNestingDepth());
        assertTrue(ParserPolicy.relaxed().tolerateLexErrors());
    }

    @Test
    @DisplayName("Builder should start from the defaults under a custom name")
    void testBuilder() {
        ParserPolicy policy = ParserPolicy.builder()
                .maxNestingDepth(4)
                .groupingPolicy(GroupingPolicy.AND_BINDS_TIGHTER)
                .build();

        assertEquals(ParserPolicy.PolicyName.CUSTOM_POLICY.name(), policy.policyName());
        assertEquals(4, policy.maxNestingDepth());
        assertEquals(5000, policy.maxInputLength());
        assertSame(GroupingPolicy.AND_BINDS_TIGHTER, policy.groupingPolicy());
    }

    @Test
    @DisplayName("Should reject invalid parser limits")
    void testParserValidation() {
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxInputLength(0).build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().maxNestingDepth(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().policyName(" ").build());
        assertThrows(IllegalArgumentException.class, () -> ParserPolicy.builder().groupingPolicy(null).build());
    }

    @Test
    @DisplayName("Should validate evaluation and cache policies")
    void testOtherPolicies() {
        assertFalse(EvaluationPolicy.defaults().countPlannedAsPending());
        assertTrue(EvaluationPolicy.planning().countPlannedAsPending());
        assertThrows(IllegalArgumentException.class, () -> new EvaluationPolicy(0, false));

        assertTrue(CachePolicy.defaults().cacheEnabled());
        assertFalse(CachePolicy.none().cacheEnabled());
        assertEquals(42, CachePolicy.custom(42).cacheSize());
        assertThrows(IllegalArgumentException.class, () -> CachePolicy.custom(0));
    }
}
