package com.optionsterminal.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Option type. The broker's REST surface spells it "Call"/"Put"; cache keys and
 * option-chain rows use the exchange codes "CE"/"PE".
 */
public enum OptionRight {
    CALL("Call", "CE"),
    PUT("Put", "PE");

    private final String brokerName;
    private final String code;

    OptionRight(String brokerName, String code) {
        this.brokerName = brokerName;
        this.code = code;
    }

    public String brokerName() {
        return brokerName;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parses any of "Call", "call", "CE", "C", "Put", "PE", "P".
     *
     * @throws IllegalArgumentException if the value is blank or names neither right
     */
    @JsonCreator
    public static OptionRight parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Option right is blank");
        }
        String upper = raw.trim().toUpperCase();
        if (upper.startsWith("C")) {
            return CALL;
        }
        if (upper.startsWith("P")) {
            return PUT;
        }
        throw new IllegalArgumentException("Unknown option right: " + raw);
    }
}
