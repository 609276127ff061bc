package io.relaybus.deadletter;

public record RetrySummary(int success, int failed) {
    public static final RetrySummary EMPTY = new RetrySummary(0, 0);

    public int attempted() {
        return success + failed;
    }
}
