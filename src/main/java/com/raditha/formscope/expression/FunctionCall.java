package com.raditha.formscope.expression;

import java.util.List;

/**
 * A function invocation found in an expression.
 *
 * @param name         Function name
 * @param arguments    Top-level arguments, trimmed
 * @param originalCall Matched call text
 * @param function     Catalog metadata, or placeholder metadata when unknown
 * @param knownFunction Whether the catalog recognizes the function
 * @param end          Index just past the closing parenthesis, or the
 *                     expression length when the call is unbalanced
 */
public record FunctionCall(
        String name,
        List<String> arguments,
        String originalCall,
        XPathFunction function,
        boolean knownFunction,
        int end) {

    public FunctionCall {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
