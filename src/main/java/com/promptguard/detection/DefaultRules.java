package com.promptguard.detection;

import java.util.List;

import static com.promptguard.detection.ThreatCategory.*;
import static com.promptguard.detection.ThreatLevel.*;

/**
 * Built-in rule corpus. Patterns run against case-folded text.
 */
final class DefaultRules {

    private static final List<InjectionRule> RULES = List.of(
            // Direct instruction override
            InjectionRule.of("override.ignore-previous", INSTRUCTION_OVERRIDE, CRITICAL,
                    "\\bignore\\s+(all\\s+)?(the\\s+)?(previous|prior|above|earlier)\\s+(instructions?|prompts?|commands?|rules?)\\b"),
            InjectionRule.of("override.disregard-previous", INSTRUCTION_OVERRIDE, CRITICAL,
                    "\\bdisregard\\s+(all\\s+)?(the\\s+)?(previous|prior|above|earlier)\\s+(instructions?|prompts?|commands?|rules?)\\b"),
            InjectionRule.of("override.forget-previous", INSTRUCTION_OVERRIDE, CRITICAL,
                    "\\bforget\\s+(all\\s+|everything\\s+)?(previous|prior|above|earlier)\\b"),
            InjectionRule.of("override.bypass-safety", INSTRUCTION_OVERRIDE, CRITICAL,
                    "\\bbypass\\s+(all\\s+)?(the\\s+)?(safety|security|filters?|guardrails?)\\b"),
            InjectionRule.of("override.new-instructions", INSTRUCTION_OVERRIDE, HIGH,
                    "\\b(your\\s+new\\s+instructions?|new\\s+system\\s+prompt)\\b"),
            InjectionRule.of("override.no-restrictions", INSTRUCTION_OVERRIDE, MEDIUM,
                    "\\bwithout\\s+(any\\s+)?(restrictions?|limitations?|filters?)\\b"),

            // Role manipulation
            InjectionRule.of("role.you-are-now", ROLE_MANIPULATION, HIGH,
                    "\\byou\\s+are\\s+now\\s+(a|an)\\s+\\w+"),
            InjectionRule.of("role.from-now-on", ROLE_MANIPULATION, HIGH,
                    "\\bfrom\\s+now\\s+on,?\\s+you\\s+(are|will)\\b"),
            InjectionRule.of("role.jailbreak-persona", ROLE_MANIPULATION, HIGH,
                    "\\b(dan\\s+(mode|prompt)|do\\s+anything\\s+now|developer\\s+mode|god\\s+mode|jailbreak(ed)?)\\b"),
            InjectionRule.of("role.act-as", ROLE_MANIPULATION, MEDIUM,
                    "\\bact\\s+as\\s+(a|an)\\s+\\w+"),
            InjectionRule.of("role.pretend", ROLE_MANIPULATION, MEDIUM,
                    "\\bpretend\\s+(to\\s+be|you\\s+are)\\s+(a|an)\\s+\\w+"),

            // Command injection and delimiter attacks
            InjectionRule.of("command.execute-following", COMMAND_INJECTION, HIGH,
                    "\\bexecute\\s+the\\s+following\\b"),
            InjectionRule.of("command.run-this", COMMAND_INJECTION, HIGH,
                    "\\brun\\s+this\\s+(command|code|script)\\b"),
            InjectionRule.of("command.fake-delimiter", COMMAND_INJECTION, HIGH,
                    "-{3,}\\s*(new|system|assistant|user)\\s*(prompt|message|instructions?)"),
            InjectionRule.of("command.role-header", COMMAND_INJECTION, MEDIUM,
                    "(###\\s*(new|system|assistant|user)\\b|\\[(system|assistant|user|inst)\\]|<\\s*/?\\s*system\\s*>)"),
            InjectionRule.of("command.template-substitution", COMMAND_INJECTION, MEDIUM,
                    "\\$\\{[^}]{0,200}\\}"),
            InjectionRule.of("command.inline-code", COMMAND_INJECTION, LOW,
                    "`[^`]{1,500}`"),

            // Prompt leaking
            InjectionRule.of("leak.reveal-system-prompt", PROMPT_LEAK, HIGH,
                    "\\b(reveal|show|print|display|output)\\s+(me\\s+)?(your\\s+(system\\s+)?|the\\s+system\\s+)(prompt|instructions?)\\b"),
            InjectionRule.of("leak.ask-system-prompt", PROMPT_LEAK, HIGH,
                    "\\bwhat\\s+(is|are|was|were)\\s+(your|the)\\s+system\\s+(prompt|instructions?)\\b"),
            InjectionRule.of("leak.describe-system-prompt", PROMPT_LEAK, HIGH,
                    "\\b(your|the)\\s+system\\s+prompt\\s+(is|was|should)\\b"),
            InjectionRule.of("leak.repeat-above", PROMPT_LEAK, HIGH,
                    "\\brepeat\\s+(everything|all)\\s+(above|before)\\b")
    );

    private DefaultRules() {}

    static List<InjectionRule> all() {
        return RULES;
    }
}
