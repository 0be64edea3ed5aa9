package com.optionsterminal.marketdata;

import com.optionsterminal.domain.model.OptionChainRow;
import com.optionsterminal.domain.model.TickKey;
import com.optionsterminal.domain.model.TickRecord;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Value;

/** Immutable copy of the tick cache at one version. */
@Value
public class TickCacheSnapshot {

    private static final Comparator<Map.Entry<TickKey, TickRecord>> ROW_ORDER = Comparator.comparing(
                    (Map.Entry<TickKey, TickRecord> e) -> e.getKey().getSymbol())
            .thenComparing(e -> e.getKey().getStrike())
            .thenComparing(e -> e.getKey().getRight());

    Map<TickKey, TickRecord> records;
    long version;

    /** Option records flattened to rows, spot records excluded, ordered by symbol, strike and right. */
    public List<OptionChainRow> optionChainRows() {
        return records.entrySet().stream()
                .filter(e -> !e.getKey().isSpot())
                .sorted(ROW_ORDER)
                .map(e -> OptionChainRow.of(e.getKey(), e.getValue()))
                .toList();
    }

    /** Symbol to spot level, only for spot records with a positive price. */
    public Map<String, Double> spotPrices() {
        Map<String, Double> spots = new LinkedHashMap<>();
        records.forEach((key, record) -> {
            if (key.isSpot() && record.getLtp() != null && record.getLtp() > 0) {
                spots.put(key.getSymbol(), record.getLtp());
            }
        });
        return spots;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
