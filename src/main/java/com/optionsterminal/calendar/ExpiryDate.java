package com.optionsterminal.calendar;

import lombok.Builder;
import lombok.Value;

/** One upcoming weekly expiry, formatted the way the broker and the terminal expect it. */
@Value
@Builder
public class ExpiryDate {

    /** Broker format, e.g. {@code 28-Oct-2025}. */
    String date;

    /** Display label, e.g. {@code 28 Oct 25}. */
    String label;

    long daysAway;

    String weekday;

    /** ISO date, e.g. {@code 2025-10-28}. */
    String timestamp;
}
