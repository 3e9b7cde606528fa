package com.raditha.formscope.model;

/**
 * Syntactic classification of a rule or calculation expression.
 */
public enum ExpressionType {
    /** Static values */
    STATIC,
    /** Simple field reference */
    FIELD_REFERENCE,
    /** Mathematical operations */
    CALCULATION,
    /** String concatenation */
    CONCATENATION,
    /** If-then-else logic */
    CONDITIONAL,
    /** Data lookups */
    LOOKUP,
    /** Date/time functions */
    DATE_FUNCTION,
    /** String manipulation */
    STRING_FUNCTION,
    /** Sum, count, average */
    AGGREGATION,
    /** Custom functions */
    CUSTOM_FUNCTION
}
