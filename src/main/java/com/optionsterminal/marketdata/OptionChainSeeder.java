package com.optionsterminal.marketdata;

import com.optionsterminal.domain.enums.OptionRight;
import com.optionsterminal.domain.model.TickKey;
import com.optionsterminal.domain.model.TickUpdate;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seeds the tick cache from a REST option-chain snapshot so observers have prices before
 * the push feed delivers its first tick for each strike. Rows without a usable strike are
 * skipped.
 */
public class OptionChainSeeder {

    private static final Logger log = LoggerFactory.getLogger(OptionChainSeeder.class);

    private final TickCache tickCache;
    private final FieldAliasTable aliases;

    public OptionChainSeeder(TickCache tickCache) {
        this(tickCache, FieldAliasTable.OPTION_CHAIN_ROW);
    }

    public OptionChainSeeder(TickCache tickCache, FieldAliasTable aliases) {
        this.tickCache = tickCache;
        this.aliases = aliases;
    }

    /** @return number of rows merged into the cache */
    public int seed(String stockCode, OptionRight right, List<Map<String, Object>> rows) {
        int seeded = 0;
        for (Map<String, Object> row : rows) {
            Integer strike = strikeOf(row);
            if (strike == null || strike <= 0) {
                log.debug("Skipping option-chain row without strike: {}", row);
                continue;
            }
            TickUpdate update = TickUpdate.builder()
                    .ltp(aliases.numberOrNull(row, TickField.LTP))
                    .oi(aliases.numberOrNull(row, TickField.OPEN_INTEREST))
                    .volume(aliases.numberOrNull(row, TickField.VOLUME))
                    .iv(aliases.numberOrNull(row, TickField.IMPLIED_VOLATILITY))
                    .bid(aliases.numberOrNull(row, TickField.BID))
                    .ask(aliases.numberOrNull(row, TickField.ASK))
                    .changePct(aliases.numberOrNull(row, TickField.CHANGE_PERCENT))
                    .build();
            tickCache.update(TickKey.option(stockCode, strike, right), update);
            seeded++;
        }
        log.info("Seeded {} {} {} strikes from option-chain snapshot", seeded, stockCode, right.code());
        return seeded;
    }

    private Integer strikeOf(Map<String, Object> row) {
        return aliases.text(row, TickField.STRIKE)
                .map(raw -> {
                    try {
                        return TickKey.parseStrike(raw);
                    } catch (NumberFormatException e) {
                        return null;
                    }
                })
                .orElse(null);
    }
}
