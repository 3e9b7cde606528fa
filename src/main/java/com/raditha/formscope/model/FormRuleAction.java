package com.raditha.formscope.model;

/**
 * An action fired by a form rule.
 *
 * @param type       Action type, e.g. "setValue", "switchView"
 * @param target     Target field or view
 * @param expression Value expression, may be null
 */
public record FormRuleAction(String type, String target, String expression) {
}
