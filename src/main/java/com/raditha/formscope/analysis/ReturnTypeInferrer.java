package com.raditha.formscope.analysis;

import com.raditha.formscope.expression.FunctionCall;
import com.raditha.formscope.model.ValueType;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Infers the value type an expression produces.
 * The declared type of the known function call that closes last wins, so a
 * call wrapping others decides over the calls nested inside it. Otherwise the
 * expression text is scanned for boolean, numeric and date markers in that
 * order.
 */
public class ReturnTypeInferrer {

    private static final List<String> BOOLEAN_MARKERS = List.of("=", "!=", ">", "<", "and", "or", "not(");
    private static final List<String> NUMBER_MARKERS = List.of("+", "-", "*", "/", "sum(", "count(", "avg(");
    private static final List<String> DATE_MARKERS = List.of("today(", "now(", "adddays(");

    public ValueType infer(String expression, List<FunctionCall> functionCalls) {
        Optional<FunctionCall> last = functionCalls.stream()
                .filter(FunctionCall::knownFunction)
                .max(Comparator.comparingInt(FunctionCall::end));
        if (last.isPresent()) {
            return last.get().function().returnType();
        }

        String expr = expression.toLowerCase(Locale.ROOT);

        if (containsAny(expr, BOOLEAN_MARKERS)) {
            return ValueType.BOOLEAN;
        }
        if (containsAny(expr, NUMBER_MARKERS)) {
            return ValueType.NUMBER;
        }
        if (containsAny(expr, DATE_MARKERS)) {
            return ValueType.DATE;
        }

        return ValueType.STRING;
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
