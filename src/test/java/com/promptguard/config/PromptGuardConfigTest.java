package com.promptguard.config;

import com.promptguard.detection.RuleSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptGuardConfigTest {

    @Test
    void securityPropertiesBecomeValidatedConfig() {
        PromptGuardProperties.SecurityProperties security = new PromptGuardProperties.SecurityProperties();
        security.setLevel("high");
        security.setRateLimitPerMinute(3);
        security.setBlacklist(List.of("forbidden"));
        security.setCustomBlacklistPatterns("legacy one, legacy two");

        SecurityConfig config = PromptGuardConfig.toSecurityConfig(security);

        assertEquals(SecurityLevel.HIGH, config.getLevel());
        assertEquals(3, config.getRateLimitPerMinute());
        assertEquals(3, config.getBlacklist().size());
        assertTrue(config.getBlacklist().matches("this has LEGACY TWO inside"));
    }

    @Test
    void invalidSecurityPropertiesFailFast() {
        PromptGuardProperties.SecurityProperties security = new PromptGuardProperties.SecurityProperties();
        security.setLevel("EXTREME");

        assertThrows(ConfigurationException.class, () -> PromptGuardConfig.toSecurityConfig(security));
    }

    @Test
    void customRulesAreAppendedToDefaults() {
        PromptGuardProperties.DetectionProperties detection = new PromptGuardProperties.DetectionProperties();
        detection.setCustomRules(List.of(rule("custom.sudo", "command-injection", "high", "\\bsudo\\b")));

        RuleSet rules = PromptGuardConfig.toRuleSet(detection);

        assertEquals(RuleSet.defaults().size() + 1, rules.size());
        assertEquals("custom.sudo", rules.rules().get(rules.size() - 1).id());
    }

    @Test
    void defaultRulesCanBeLeftOut() {
        PromptGuardProperties.DetectionProperties detection = new PromptGuardProperties.DetectionProperties();
        detection.setIncludeDefaultRules(false);
        detection.setCustomRules(List.of(rule("only", "prompt-leak", "LOW", "leak")));

        assertEquals(1, PromptGuardConfig.toRuleSet(detection).size());
    }

    @Test
    void invalidCustomRulesFailFast() {
        PromptGuardProperties.DetectionProperties detection = new PromptGuardProperties.DetectionProperties();

        detection.setCustomRules(List.of(rule("bad-level", "prompt-leak", "SEVERE", "x")));
        assertThrows(ConfigurationException.class, () -> PromptGuardConfig.toRuleSet(detection));

        detection.setCustomRules(List.of(rule("bad-category", "spam", "LOW", "x")));
        assertThrows(ConfigurationException.class, () -> PromptGuardConfig.toRuleSet(detection));

        detection.setCustomRules(List.of(rule("bad-regex", "prompt-leak", "LOW", "(")));
        assertThrows(ConfigurationException.class, () -> PromptGuardConfig.toRuleSet(detection));

        detection.setCustomRules(List.of(rule(null, "prompt-leak", "LOW", "x")));
        assertThrows(ConfigurationException.class, () -> PromptGuardConfig.toRuleSet(detection));
    }

    @Test
    void duplicateRuleIdsAreConfigurationErrors() {
        PromptGuardProperties.DetectionProperties detection = new PromptGuardProperties.DetectionProperties();
        detection.setCustomRules(List.of(rule("override.ignore-previous", "prompt-leak", "LOW", "x")));

        ConfigurationException clash = assertThrows(ConfigurationException.class,
                () -> PromptGuardConfig.toRuleSet(detection));
        assertTrue(clash.getMessage().contains("override.ignore-previous"));

        detection.setIncludeDefaultRules(false);
        detection.setCustomRules(List.of(
                rule("custom.twice", "prompt-leak", "LOW", "one"),
                rule("custom.twice", "prompt-leak", "HIGH", "two")));
        assertThrows(ConfigurationException.class, () -> PromptGuardConfig.toRuleSet(detection));
    }

    private static PromptGuardProperties.RuleProperties rule(String id, String category, String level, String pattern) {
        PromptGuardProperties.RuleProperties rule = new PromptGuardProperties.RuleProperties();
        rule.setId(id);
        rule.setCategory(category);
        rule.setLevel(level);
        rule.setPattern(pattern);
        return rule;
    }
}
