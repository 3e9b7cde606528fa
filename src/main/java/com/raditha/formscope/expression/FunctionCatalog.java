package com.raditha.formscope.expression;

import com.raditha.formscope.model.ValueType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of the expression functions the parser recognizes.
 * Lookups are case-sensitive, as in the source expression language.
 */
public class FunctionCatalog {

    private final Map<String, XPathFunction> functions;

    /**
     * Create the standard InfoPath function catalog.
     */
    public FunctionCatalog() {
        this(standardFunctions());
    }

    /**
     * Create a catalog over a custom set of functions.
     *
     * @param functions Functions keyed by name
     */
    public FunctionCatalog(Map<String, XPathFunction> functions) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
    }

    public Optional<XPathFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public int size() {
        return functions.size();
    }

    private static Map<String, XPathFunction> standardFunctions() {
        Map<String, XPathFunction> map = new LinkedHashMap<>();

        // Date/Time
        add(map, "today", "Returns current date", ValueType.DATE, "()");
        add(map, "now", "Returns current date and time", ValueType.DATE_TIME, "()");
        add(map, "addDays", "Adds days to a date", ValueType.DATE, "(date, number)");
        add(map, "addMonths", "Adds months to a date", ValueType.DATE, "(date, number)");
        add(map, "addYears", "Adds years to a date", ValueType.DATE, "(date, number)");
        add(map, "formatDate", "Formats a date", ValueType.STRING, "(date, format)");

        // String
        add(map, "concat", "Concatenates strings", ValueType.STRING, "(string, string, ...)");
        add(map, "substring", "Extracts substring", ValueType.STRING, "(string, start)", "(string, start, length)");
        add(map, "substring-before", "String before separator", ValueType.STRING, "(string, separator)");
        add(map, "substring-after", "String after separator", ValueType.STRING, "(string, separator)");
        add(map, "string-length", "Length of string", ValueType.NUMBER, "(string)");
        add(map, "normalize-space", "Normalizes whitespace", ValueType.STRING, "(string)");
        add(map, "translate", "Translates characters", ValueType.STRING, "(string, from, to)");
        add(map, "contains", "Checks if string contains substring", ValueType.BOOLEAN, "(string, substring)");
        add(map, "starts-with", "Checks if string starts with prefix", ValueType.BOOLEAN, "(string, prefix)");
        add(map, "ends-with", "Checks if string ends with suffix", ValueType.BOOLEAN, "(string, suffix)");

        // Math
        add(map, "sum", "Sum of nodes", ValueType.NUMBER, "(nodeset)");
        add(map, "count", "Count of nodes", ValueType.NUMBER, "(nodeset)");
        add(map, "avg", "Average of nodes", ValueType.NUMBER, "(nodeset)");
        add(map, "min", "Minimum value", ValueType.NUMBER, "(nodeset)");
        add(map, "max", "Maximum value", ValueType.NUMBER, "(nodeset)");
        add(map, "round", "Rounds number", ValueType.NUMBER, "(number)");
        add(map, "ceiling", "Rounds up", ValueType.NUMBER, "(number)");
        add(map, "floor", "Rounds down", ValueType.NUMBER, "(number)");
        add(map, "abs", "Absolute value", ValueType.NUMBER, "(number)");

        // Logical
        add(map, "not", "Logical NOT", ValueType.BOOLEAN, "(boolean)");
        add(map, "true", "Boolean true", ValueType.BOOLEAN, "()");
        add(map, "false", "Boolean false", ValueType.BOOLEAN, "()");

        // Node
        add(map, "position", "Current position", ValueType.NUMBER, "()");
        add(map, "last", "Last position", ValueType.NUMBER, "()");
        add(map, "node-set", "Creates node set", ValueType.NODESET, "(object)");

        // User context
        add(map, "user", "Current user info", ValueType.STRING, "()");
        add(map, "userName", "Current user name", ValueType.STRING, "()");
        add(map, "userEmail", "Current user email", ValueType.STRING, "()");
        add(map, "role", "User role", ValueType.STRING, "(roleName)");

        // Conversion
        add(map, "number", "Converts to number", ValueType.NUMBER, "(object)");
        add(map, "string", "Converts to string", ValueType.STRING, "(object)");
        add(map, "boolean", "Converts to boolean", ValueType.BOOLEAN, "(object)");

        return map;
    }

    private static void add(Map<String, XPathFunction> map, String name, String description,
            ValueType returnType, String... signatures) {
        map.put(name, new XPathFunction(name, description, returnType, List.of(signatures)));
    }
}
