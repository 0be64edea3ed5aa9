package com.optionsterminal.marketdata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Ordered list of accepted payload keys per logical field, for one payload family.
 *
 * <p>The broker has shipped several spellings of the same field across SDK releases
 * ({@code last_traded_price} vs {@code ltp}, {@code open_interest} vs {@code open-interest}).
 * Each alias is tagged with the payload shape it came from, and candidates are tried in
 * order: an absent, blank or unparsable value falls through to the next one. Zero is a
 * real reading (a flat change, an emptied book side) and resolves like any other number.
 */
public final class FieldAliasTable {

    /** Push-feed tick payloads. */
    public static final FieldAliasTable FEED_TICK = builder("feed-tick", 2)
            .alias(TickField.SYMBOL, "stock_code", "v2")
            .alias(TickField.SYMBOL, "symbol", "v1")
            .alias(TickField.STRIKE, "strike_price", "v2")
            .alias(TickField.STRIKE, "strike", "v1")
            .alias(TickField.RIGHT, "right", "v2")
            .alias(TickField.RIGHT, "option_type", "v1")
            .alias(TickField.LTP, "last_traded_price", "v2")
            .alias(TickField.LTP, "ltp", "v1")
            .alias(TickField.OPEN_INTEREST, "open_interest", "v2")
            .alias(TickField.OPEN_INTEREST, "oi", "v1")
            .alias(TickField.VOLUME, "total_quantity_traded", "v2")
            .alias(TickField.VOLUME, "volume", "v1")
            .alias(TickField.IMPLIED_VOLATILITY, "implied_volatility", "v2")
            .alias(TickField.IMPLIED_VOLATILITY, "iv", "v1")
            .alias(TickField.BID, "best_bid_price", "v2")
            .alias(TickField.BID, "bid_price", "v1")
            .alias(TickField.ASK, "best_offer_price", "v2")
            .alias(TickField.ASK, "ask_price", "v1")
            .alias(TickField.CHANGE_PERCENT, "change_percent", "v2")
            .alias(TickField.CHANGE_PERCENT, "change_pct", "v1")
            .alias(TickField.FEED_TIME, "exchange_feed_time", "v2")
            .alias(TickField.UNDERLYING, "index_close_price", "v2")
            .alias(TickField.UNDERLYING, "UnderlyingValue", "v1")
            .alias(TickField.UNDERLYING, "underlying_value", "v2")
            .alias(TickField.UNDERLYING, "close_price", "v2")
            .alias(TickField.UNDERLYING, "index_price", "v1")
            .alias(TickField.UNDERLYING, "underlying_spot_price", "v1")
            .build();

    /** Rows returned by the option-chain snapshot call. */
    public static final FieldAliasTable OPTION_CHAIN_ROW = builder("option-chain-row", 2)
            .alias(TickField.STRIKE, "strike_price", "snake")
            .alias(TickField.STRIKE, "strike-price", "hyphen")
            .alias(TickField.LTP, "ltp", "snake")
            .alias(TickField.LTP, "last_traded_price", "snake")
            .alias(TickField.OPEN_INTEREST, "open_interest", "snake")
            .alias(TickField.OPEN_INTEREST, "open-interest", "hyphen")
            .alias(TickField.VOLUME, "total_quantity_traded", "snake")
            .alias(TickField.VOLUME, "total-quantity-traded", "hyphen")
            .alias(TickField.IMPLIED_VOLATILITY, "implied_volatility", "snake")
            .alias(TickField.IMPLIED_VOLATILITY, "implied-volatility", "hyphen")
            .alias(TickField.BID, "best_bid_price", "snake")
            .alias(TickField.BID, "best-bid-price", "hyphen")
            .alias(TickField.ASK, "best_offer_price", "snake")
            .alias(TickField.ASK, "best-offer-price", "hyphen")
            .alias(TickField.CHANGE_PERCENT, "ltp_percent_change", "snake")
            .alias(TickField.CHANGE_PERCENT, "change_percent", "snake")
            .build();

    /** Rows returned by the single-instrument quote call, used for the spot fallback. */
    public static final FieldAliasTable QUOTE_ROW = builder("quote-row", 1)
            .alias(TickField.LTP, "ltp", "snake")
            .alias(TickField.LTP, "last_traded_price", "snake")
            .alias(TickField.LTP, "close", "snake")
            .alias(TickField.LTP, "last_price", "snake")
            .alias(TickField.LTP, "LastPrice", "pascal")
            .build();

    private final String name;
    private final int version;
    private final Map<TickField, List<Alias>> aliases;

    private FieldAliasTable(String name, int version, Map<TickField, List<Alias>> aliases) {
        this.name = name;
        this.version = version;
        this.aliases = aliases;
    }

    public static Builder builder(String name, int version) {
        return new Builder(name, version);
    }

    /** First candidate whose value is a non-blank string (or any non-null non-string). */
    public Optional<String> text(Map<String, ?> payload, TickField field) {
        for (Alias alias : candidates(field)) {
            Object value = payload.get(alias.key());
            if (value == null) {
                continue;
            }
            String text = value.toString().trim();
            if (!text.isEmpty()) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    /** First candidate whose value parses to a number, zero included. */
    public OptionalDouble number(Map<String, ?> payload, TickField field) {
        for (Alias alias : candidates(field)) {
            Double value = toDouble(payload.get(alias.key()));
            if (value != null) {
                return OptionalDouble.of(value);
            }
        }
        return OptionalDouble.empty();
    }

    /** Same as {@link #number} but boxed, null when no candidate resolves. */
    public Double numberOrNull(Map<String, ?> payload, TickField field) {
        OptionalDouble value = number(payload, field);
        return value.isPresent() ? value.getAsDouble() : null;
    }

    /**
     * Every candidate value for {@code field} that parses to a positive number, in alias
     * order.
     */
    public List<Double> positiveNumbers(Map<String, ?> payload, TickField field) {
        List<Double> values = new ArrayList<>();
        for (Alias alias : candidates(field)) {
            Double value = toDouble(payload.get(alias.key()));
            if (value != null && value > 0) {
                values.add(value);
            }
        }
        return values;
    }

    public List<String> keysFor(TickField field) {
        return candidates(field).stream().map(Alias::key).toList();
    }

    public String getName() {
        return name;
    }

    public int getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return name + "@v" + version;
    }

    private List<Alias> candidates(TickField field) {
        return aliases.getOrDefault(field, List.of());
    }

    static Double toDouble(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            return number.doubleValue();
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** One accepted payload key and the payload shape it belongs to. */
    public record Alias(String key, String shape) {}

    public static final class Builder {

        private final String name;
        private final int version;
        private final Map<TickField, List<Alias>> aliases = new EnumMap<>(TickField.class);

        private Builder(String name, int version) {
            this.name = name;
            this.version = version;
        }

        public Builder alias(TickField field, String key, String shape) {
            aliases.computeIfAbsent(field, f -> new ArrayList<>()).add(new Alias(key, shape));
            return this;
        }

        public FieldAliasTable build() {
            Map<TickField, List<Alias>> frozen = new EnumMap<>(TickField.class);
            aliases.forEach((field, list) -> frozen.put(field, List.copyOf(list)));
            return new FieldAliasTable(name, version, Collections.unmodifiableMap(frozen));
        }
    }
}
