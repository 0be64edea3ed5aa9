package com.optionsterminal.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A partial market-data update. Null fields were not present in the incoming payload
 * and leave the cached value untouched.
 */
@Value
@Builder
public class TickUpdate {

    Double ltp;
    Double oi;
    Double volume;
    Double iv;
    Double bid;
    Double ask;
    Double changePct;
    String feedTime;

    /** Where the value came from ("feed", "rest"); only set for spot records. */
    String source;

    public boolean isEmpty() {
        return ltp == null
                && oi == null
                && volume == null
                && iv == null
                && bid == null
                && ask == null
                && changePct == null
                && feedTime == null
                && source == null;
    }
}
