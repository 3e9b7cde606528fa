package com.raditha.formscope.expression;

import com.raditha.formscope.model.ValueType;

import java.util.List;

/**
 * Metadata of an expression function.
 *
 * @param name        Function name as written in expressions
 * @param description Short description
 * @param returnType  Declared return type
 * @param signatures  Accepted argument lists, e.g. "(date, number)"
 */
public record XPathFunction(
        String name,
        String description,
        ValueType returnType,
        List<String> signatures) {

    public XPathFunction {
        signatures = signatures == null ? List.of() : List.copyOf(signatures);
    }

    /**
     * Placeholder metadata for a function the catalog does not know.
     */
    public static XPathFunction unknown(String name) {
        return new XPathFunction(name, "Unknown function", ValueType.UNKNOWN, List.of("(...)"));
    }
}
