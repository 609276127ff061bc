package io.relaybus.deadletter;

import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;

/**
 * Substring heuristics that map an error message to an {@link ErrorCategory}. Rules are checked in order,
 * so "Connection timeout" is a timeout, not a transient connection failure.
 */
@UtilityClass
public class ErrorClassifier {

    private final List<Rule> RULES = List.of(
            new Rule(ErrorCategory.TIMEOUT, List.of("timeout", "timed out")),
            new Rule(ErrorCategory.CAPACITY, List.of("capacity", "full", "limit")),
            new Rule(ErrorCategory.VALIDATION, List.of("validation", "invalid", "required")),
            new Rule(ErrorCategory.TRANSIENT, List.of("connection", "unavailable", "retry")),
            new Rule(ErrorCategory.PERMANENT, List.of("permission", "forbidden", "unauthorized"))
    );

    public ErrorCategory classify(final String errorMessage) {
        if (errorMessage == null || errorMessage.isEmpty()) {
            return ErrorCategory.UNKNOWN;
        }

        final String lower = errorMessage.toLowerCase(Locale.ROOT);
        for (final Rule rule : RULES) {
            for (final String needle : rule.needles()) {
                if (lower.contains(needle)) return rule.category();
            }
        }
        return ErrorCategory.UNKNOWN;
    }

    private record Rule(ErrorCategory category, List<String> needles) {
    }
}
