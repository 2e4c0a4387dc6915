package io.seriescache.financial;

public enum AdjustmentType {
    SPLIT("split"),
    DIVIDEND("dividend");

    private final String code;

    AdjustmentType(String code) { this.code = code; }

    public String code() { return code; }

    public static AdjustmentType fromCode(String code) {
        for (AdjustmentType t : values()) {
            if (t.code.equalsIgnoreCase(code)) return t;
        }
        throw new IllegalArgumentException("unknown adjustment type: " + code);
    }
}
