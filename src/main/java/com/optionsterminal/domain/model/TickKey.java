package com.optionsterminal.domain.model;

import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.exception.MalformedKeyException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identity of one market-data record: an option contract (symbol, strike, right and,
 * when known, expiry) or the spot level of an underlying (symbol only).
 *
 * <p>The colon-separated wire form ({@code NIFTY:21500:CE}, {@code NIFTY:21500:CE:28-Oct-2025},
 * {@code NIFTY:SPOT}) exists only at boundaries; everything inside the gateway keys on
 * this value type.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TickKey {

    public static final String SPOT_MARKER = "SPOT";

    private static final String SEPARATOR = ":";

    String symbol;

    /** Null for spot keys. */
    Integer strike;

    /** Null for spot keys. */
    OptionRight right;

    /** Null when the contract's expiry is not part of the identity. */
    String expiry;

    public static TickKey option(String symbol, int strike, OptionRight right) {
        return option(symbol, strike, right, null);
    }

    public static TickKey option(String symbol, int strike, OptionRight right, String expiry) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Tick key symbol is blank");
        }
        if (right == null) {
            throw new IllegalArgumentException("Tick key right is null");
        }
        return new TickKey(symbol.trim().toUpperCase(), strike, right, blankToNull(expiry));
    }

    public static TickKey spot(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Tick key symbol is blank");
        }
        return new TickKey(symbol.trim().toUpperCase(), null, null, null);
    }

    public boolean isSpot() {
        return right == null;
    }

    public String toWireKey() {
        if (isSpot()) {
            return symbol + SEPARATOR + SPOT_MARKER;
        }
        String base = symbol + SEPARATOR + strike + SEPARATOR + right.code();
        return expiry == null ? base : base + SEPARATOR + expiry;
    }

    /**
     * Parses the wire form. Strikes written as decimals ("21500.0") are truncated to an
     * integer.
     *
     * @throws MalformedKeyException if the key has the wrong shape
     */
    public static TickKey parse(String wireKey) {
        if (wireKey == null) {
            throw new MalformedKeyException("null");
        }
        String[] parts = wireKey.split(SEPARATOR, -1);
        try {
            if (parts.length == 2 && SPOT_MARKER.equalsIgnoreCase(parts[1])) {
                return spot(parts[0]);
            }
            if (parts.length == 3 || parts.length == 4) {
                return option(
                        parts[0], parseStrike(parts[1]), OptionRight.parse(parts[2]), parts.length == 4 ? parts[3] : null);
            }
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException(wireKey);
        }
        throw new MalformedKeyException(wireKey);
    }

    /**
     * Converts a strike in any of the broker's spellings ("21500", "21500.0", 21500.0)
     * to an integer, truncating through a floating-point conversion.
     *
     * @throws NumberFormatException if the value is not numeric
     */
    public static int parseStrike(Object raw) {
        if (raw == null) {
            throw new NumberFormatException("strike is null");
        }
        if (raw instanceof Number number) {
            return (int) number.doubleValue();
        }
        return (int) Double.parseDouble(raw.toString().trim());
    }

    @Override
    public String toString() {
        return toWireKey();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
