package com.raditha.formscope.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;

/**
 * A rule attached to a form: a condition and the actions it triggers.
 *
 * @param name      Rule name
 * @param condition Condition expression, may be null for unconditional rules
 * @param enabled   Whether the rule is active
 * @param actions   Actions run when the condition holds
 */
public record FormRule(
        String name,
        String condition,
        @JsonAlias("isEnabled") Boolean enabled,
        List<FormRuleAction> actions) {

    public FormRule {
        enabled = enabled == null ? Boolean.TRUE : enabled;
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * Check if this rule has a non-blank condition.
     */
    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }
}
