package com.raditha.formscope.expression;

import com.raditha.formscope.model.ExpressionType;

import java.util.List;

/**
 * Turns a raw expression string into structured facts.
 * The expression analyzer depends only on this interface.
 */
public interface ExpressionParser {

    /**
     * Classify the expression.
     */
    ExpressionType determineExpressionType(String expression);

    /**
     * Field references in first-seen order, without duplicates.
     */
    List<String> extractFieldReferences(String expression);

    /**
     * Function calls in source order.
     */
    List<FunctionCall> extractFunctionCalls(String expression);

    /**
     * Hints for translating the expression to another platform.
     */
    List<String> getTranslationHints(String expression);

    /**
     * Syntactically simplified form of the expression.
     */
    String simplifyExpression(String expression);
}
