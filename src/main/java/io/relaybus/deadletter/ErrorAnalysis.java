package io.relaybus.deadletter;

import java.util.List;
import java.util.Map;

/**
 * @param topPatterns the five most frequent patterns, most frequent first
 */
public record ErrorAnalysis(long totalMessages,
                            Map<ErrorCategory, Long> byCategory,
                            Map<String, Long> byService,
                            int patternsCount,
                            List<ErrorPattern.Summary> topPatterns) {
}
