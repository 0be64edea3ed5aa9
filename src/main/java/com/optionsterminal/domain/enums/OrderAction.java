package com.optionsterminal.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderAction {
    BUY,
    SELL;

    public OrderAction opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Lower-case form the broker expects. */
    @JsonValue
    public String brokerValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static OrderAction parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Order action is blank");
        }
        String upper = raw.trim().toUpperCase();
        for (OrderAction action : values()) {
            if (action.name().equals(upper)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown order action: " + raw);
    }
}
