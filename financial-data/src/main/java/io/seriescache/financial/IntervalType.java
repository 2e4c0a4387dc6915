package io.seriescache.financial;

/** Bar interval unit; {@link #code()} is the suffix used in interval tags such as {@code 60_s}. */
public enum IntervalType {
    SECONDS("s"),
    DAILY("d"),
    WEEKLY("w"),
    MONTHLY("m");

    private final String code;

    IntervalType(String code) { this.code = code; }

    public String code() { return code; }

    public static IntervalType fromCode(String code) {
        for (IntervalType t : values()) {
            if (t.code.equalsIgnoreCase(code)) return t;
        }
        throw new IllegalArgumentException("unknown interval type: " + code);
    }
}
