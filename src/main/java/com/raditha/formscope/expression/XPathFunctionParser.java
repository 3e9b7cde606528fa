package com.raditha.formscope.expression;

import com.raditha.formscope.model.ExpressionType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default expression parser for InfoPath-style XPath expressions.
 * Field references use the {@code my:} namespace prefix; functions are
 * looked up in a {@link FunctionCatalog}.
 */
public class XPathFunctionParser implements ExpressionParser {

    private static final String FIELD_PREFIX = "my:";

    // my:field, my:section/field, my:section/my:field
    private static final Pattern FIELD_PATTERN = Pattern.compile(
            "my:([A-Za-z_]\\w*(?:/(?:my:)?[A-Za-z_]\\w*)*)");

    // Function names may contain hyphens (string-length, starts-with)
    private static final Pattern FUNCTION_NAME_PATTERN = Pattern.compile(
            "(?<![\\w:/-])([A-Za-z_][\\w-]*)\\s*\\(");

    private static final Pattern HYPHENATED_NAME = Pattern.compile("[A-Za-z_]\\w*(?:-\\w+)+");
    private static final Pattern ARITHMETIC_OPERATOR = Pattern.compile("[+\\-*/]");
    private static final Pattern COMPARISON_OPERATOR = Pattern.compile("[<>=!]");
    private static final Pattern LITERAL_ARITHMETIC = Pattern.compile("\\b\\d+\\s*[+\\-*/]\\s*\\d+\\b");
    // Applied after field references are masked as F
    private static final Pattern FIELD_ARITHMETIC = Pattern.compile("\\bF\\s*[+\\-*/]\\s*(?:F\\b|\\d+)");

    private static final List<Pattern> CALCULATED_FIELD_PATTERNS = List.of(
            Pattern.compile("my:[\\w/]*(?:total|sum|subtotal|amount|cost|price|value|calculated)[\\w/]*",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("my:[\\w/]*(?:qty|quantity|count|number)[\\w/]*\\s*\\*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("my:[\\w/]+/my:(?:total|sum|subtotal|amount|cost|price|value|calculated)[\\w/]*",
                    Pattern.CASE_INSENSITIVE));

    private static final Set<String> OPERATOR_KEYWORDS = Set.of("and", "or", "div", "mod");

    private static final List<String> CALCULATION_FUNCTIONS = List.of(
            "sum", "count", "avg", "min", "max", "round", "ceiling", "floor", "abs", "mod", "div");
    private static final List<String> NUMERIC_FUNCTIONS = List.of(
            "number(", "format-number(", "ceiling(", "floor(", "round(");
    private static final List<String> DATE_FUNCTIONS = List.of(
            "today", "now", "addDays", "addMonths", "addYears", "formatDate");
    private static final List<String> STRING_FUNCTIONS = List.of(
            "concat", "substring", "string-length", "normalize-space", "translate", "contains", "starts-with");
    private static final List<String> AGGREGATION_FUNCTIONS = List.of("sum", "count", "avg", "min", "max");

    private final FunctionCatalog catalog;

    public XPathFunctionParser() {
        this(new FunctionCatalog());
    }

    public XPathFunctionParser(FunctionCatalog catalog) {
        this.catalog = catalog;
    }

    public FunctionCatalog getCatalog() {
        return catalog;
    }

    @Override
    public List<FunctionCall> extractFunctionCalls(String expression) {
        List<FunctionCall> calls = new ArrayList<>();
        if (expression == null || expression.isEmpty()) {
            return calls;
        }

        Matcher matcher = FUNCTION_NAME_PATTERN.matcher(expression);
        while (matcher.find()) {
            String name = matcher.group(1);
            if (OPERATOR_KEYWORDS.contains(name)) {
                continue;
            }

            int open = matcher.end() - 1;
            int close = findClosingParen(expression, open);
            int end = close < 0 ? expression.length() : close + 1;
            String arguments = expression.substring(open + 1, close < 0 ? expression.length() : close);
            String originalCall = expression.substring(matcher.start(1), end);

            calls.add(catalog.lookup(name)
                    .map(fn -> new FunctionCall(name, parseArguments(arguments), originalCall, fn, true, end))
                    .orElseGet(() -> new FunctionCall(name, parseArguments(arguments), originalCall,
                            XPathFunction.unknown(name), false, end)));
        }

        return calls;
    }

    @Override
    public List<String> extractFieldReferences(String expression) {
        Set<String> fields = new LinkedHashSet<>();
        if (expression == null || expression.isEmpty()) {
            return new ArrayList<>();
        }

        Matcher matcher = FIELD_PATTERN.matcher(expression);
        while (matcher.find()) {
            fields.add(matcher.group(1));
        }

        return new ArrayList<>(fields);
    }

    @Override
    public ExpressionType determineExpressionType(String expression) {
        if (expression == null || expression.isEmpty()) {
            return ExpressionType.STATIC;
        }

        if (expression.contains("concat(")) {
            return ExpressionType.CONCATENATION;
        }
        if (isCalculationExpression(expression)) {
            return ExpressionType.CALCULATION;
        }
        if (expression.contains("if(") || expression.contains("choose(")) {
            return ExpressionType.CONDITIONAL;
        }
        if (containsCall(expression, DATE_FUNCTIONS)) {
            return ExpressionType.DATE_FUNCTION;
        }
        if (containsCall(expression, STRING_FUNCTIONS)) {
            return ExpressionType.STRING_FUNCTION;
        }
        if (containsCall(expression, AGGREGATION_FUNCTIONS)) {
            return ExpressionType.AGGREGATION;
        }
        if (expression.startsWith(FIELD_PREFIX) && !expression.contains("(")) {
            return ExpressionType.FIELD_REFERENCE;
        }

        return ExpressionType.STATIC;
    }

    /**
     * Check whether an expression computes a value rather than testing one.
     */
    public boolean isCalculationExpression(String expression) {
        if (expression == null || expression.isEmpty()) {
            return false;
        }

        // Path separators and hyphenated function names are not operators
        String operators = FIELD_PATTERN.matcher(expression.replace("../", "")).replaceAll("F");
        operators = HYPHENATED_NAME.matcher(operators).replaceAll("fn");
        if (ARITHMETIC_OPERATOR.matcher(operators).find() && !COMPARISON_OPERATOR.matcher(operators).find()) {
            return true;
        }

        if (LITERAL_ARITHMETIC.matcher(expression).find() || FIELD_ARITHMETIC.matcher(operators).find()) {
            return true;
        }

        if (containsCall(expression, CALCULATION_FUNCTIONS)) {
            return true;
        }

        if (NUMERIC_FUNCTIONS.stream().anyMatch(expression::contains)) {
            return true;
        }

        if (expression.contains("number(my:") && (expression.contains("+") || expression.contains("*"))) {
            return true;
        }

        return isCalculatedFieldReference(expression);
    }

    private boolean isCalculatedFieldReference(String expression) {
        for (Pattern pattern : CALCULATED_FIELD_PATTERNS) {
            if (pattern.matcher(expression).find()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String simplifyExpression(String expression) {
        if (expression == null || expression.isEmpty()) {
            return expression;
        }

        String simplified = expression
                .replace(FIELD_PREFIX, "")
                .replace("../", "parent/");

        simplified = simplified.replaceAll("string-length\\(([^)]+)\\)\\s*>\\s*0", "$1 is not empty");
        simplified = simplified.replaceAll("string-length\\(([^)]+)\\)\\s*=\\s*0", "$1 is empty");
        simplified = simplified.replaceAll("count\\(([^)]+)\\)\\s*>\\s*0", "$1 has items");
        simplified = simplified.replaceAll("not\\(([^)]+)\\)", "NOT $1");

        return simplified.trim();
    }

    @Override
    public List<String> getTranslationHints(String expression) {
        List<String> hints = new ArrayList<>();

        for (FunctionCall call : extractFunctionCalls(expression)) {
            if (!call.knownFunction()) {
                hints.add(String.format("Unknown function '%s' - may need custom implementation", call.name()));
                continue;
            }

            switch (call.name().toLowerCase(Locale.ROOT)) {
                case "today", "now" -> hints.add(String.format(
                        "Date function '%s' - use current date/time functions in target platform", call.name()));
                case "user", "username", "useremail" -> hints.add(String.format(
                        "User context function '%s' - implement user context service", call.name()));
                case "sum", "count", "avg" -> hints.add(String.format(
                        "Aggregation function '%s' - may need database aggregation or client-side calculation",
                        call.name()));
                case "concat" -> hints.add("String concatenation - use string interpolation or concatenation operators");
                default -> hints.add(String.format(
                        "Standard function '%s' - should be available in most platforms", call.name()));
            }
        }

        return hints;
    }

    /**
     * Split an argument list on top-level commas, respecting quotes and
     * nested parentheses.
     */
    static List<String> parseArguments(String argumentString) {
        List<String> arguments = new ArrayList<>();
        if (argumentString == null || argumentString.isBlank()) {
            return arguments;
        }

        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean inQuotes = false;
        char quoteChar = '"';

        for (int i = 0; i < argumentString.length(); i++) {
            char c = argumentString.charAt(i);

            if (!inQuotes && (c == '"' || c == '\'')) {
                inQuotes = true;
                quoteChar = c;
            } else if (inQuotes && c == quoteChar) {
                inQuotes = false;
            } else if (!inQuotes && c == '(') {
                depth++;
            } else if (!inQuotes && c == ')') {
                depth--;
            } else if (!inQuotes && c == ',' && depth == 0) {
                arguments.add(current.toString().trim());
                current.setLength(0);
                continue;
            }

            current.append(c);
        }

        if (!current.toString().isBlank()) {
            arguments.add(current.toString().trim());
        }

        return arguments;
    }

    /**
     * Find the parenthesis closing the one at {@code open}.
     *
     * @return index of the closing parenthesis, or -1 if unbalanced
     */
    private static int findClosingParen(String expression, int open) {
        int depth = 0;
        boolean inQuotes = false;
        char quoteChar = '"';

        for (int i = open; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (!inQuotes && (c == '"' || c == '\'')) {
                inQuotes = true;
                quoteChar = c;
            } else if (inQuotes && c == quoteChar) {
                inQuotes = false;
            } else if (!inQuotes && c == '(') {
                depth++;
            } else if (!inQuotes && c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean containsCall(String expression, List<String> functionNames) {
        for (String name : functionNames) {
            if (expression.contains(name + "(")) {
                return true;
            }
        }
        return false;
    }
}
