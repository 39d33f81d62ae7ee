package com.vcc.llmgateway.store;

/**
 * Result of {@link StateStore#adjustField}.
 *
 * @param outcome what happened
 * @param value   the field value after the call (unchanged unless APPLIED)
 */
public record FieldAdjustment(Outcome outcome, long value) {

    public enum Outcome {
        APPLIED,
        REJECTED,
        MISSING
    }

    public static FieldAdjustment applied(long value) {
        return new FieldAdjustment(Outcome.APPLIED, value);
    }

    public static FieldAdjustment rejected(long value) {
        return new FieldAdjustment(Outcome.REJECTED, value);
    }

    public static FieldAdjustment missing() {
        return new FieldAdjustment(Outcome.MISSING, 0);
    }

    /**
     * Parse the {@code OUTCOME:value} reply of the adjustment script.
     */
    public static FieldAdjustment parse(String reply) {
        int sep = reply.indexOf(':');
        if (sep < 0) {
            throw new IllegalArgumentException("Unexpected adjustment reply: " + reply);
        }
        Outcome outcome = Outcome.valueOf(reply.substring(0, sep));
        // Lua may render integral doubles as e.g. "1e+15"
        long value = (long) Double.parseDouble(reply.substring(sep + 1));
        return new FieldAdjustment(outcome, value);
    }

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }
}
