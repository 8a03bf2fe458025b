package com.chatcoach.infrastructure.ai.extraction;

import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Ordered steps of the extraction pipeline. Every repair step is a total string transform;
 * {@link #PARSE} is the terminal strict parse with its bracket-matching fallback.
 */
public enum RepairStep {
    STRIP_CODE_FENCE(JsonRepairs::stripCodeFence),
    BALANCE_QUOTES(JsonRepairs::balanceQuotes),
    CLOSE_DELIMITERS(JsonRepairs::closeDelimiters),
    REMOVE_TRAILING_COMMAS(JsonRepairs::removeTrailingCommas),
    QUOTE_SINGLE_QUOTED_KEYS(JsonRepairs::quoteSingleQuotedKeys),
    STRIP_COMMENTS(JsonRepairs::stripComments),
    REMOVE_INVALID_ESCAPES(JsonRepairs::removeInvalidEscapes),
    PARSE(null);

    private static final List<RepairStep> REPAIRS = Arrays.stream(values())
            .filter(step -> step.transform != null)
            .toList();

    private final UnaryOperator<String> transform;

    RepairStep(UnaryOperator<String> transform) {
        this.transform = transform;
    }

    public String apply(String text) {
        return transform == null ? text : transform.apply(text);
    }

    /**
     * The text-rewriting steps, in application order.
     */
    public static List<RepairStep> repairs() {
        return REPAIRS;
    }
}
