package com.optionsterminal.calendar;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

/**
 * Lists upcoming weekly option expiries.
 *
 * <p>BSE index contracts (SENSEX, BSESEN) expire on Thursdays; everything else on
 * Tuesdays. Today counts as an expiry only until 10:00 UTC, after which the contract is
 * treated as already settled. Holidays are not adjusted for.
 */
@Service
public class ExpiryCalendarService {

    public static final int DEFAULT_COUNT = 5;

    static final int SCAN_DAYS = 60;
    static final int SAME_DAY_CUTOFF_HOUR_UTC = 10;

    private static final DateTimeFormatter BROKER_FORMAT = DateTimeFormatter.ofPattern("dd-MMM-yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("dd MMM yy", Locale.ENGLISH);

    private final Clock clock;

    public ExpiryCalendarService(Clock clock) {
        this.clock = clock;
    }

    public List<ExpiryDate> weeklyExpiries(String stockCode) {
        return weeklyExpiries(stockCode, DEFAULT_COUNT);
    }

    /** The next {@code count} weekly expiries within the scan window, nearest first. */
    public List<ExpiryDate> weeklyExpiries(String stockCode, int count) {
        ZonedDateTime nowUtc = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        LocalDate today = nowUtc.toLocalDate();
        DayOfWeek expiryDay = expiryDayOf(stockCode);
        boolean todayExpired = nowUtc.getHour() >= SAME_DAY_CUTOFF_HOUR_UTC;

        List<ExpiryDate> expiries = new ArrayList<>();
        for (int offset = 0; offset < SCAN_DAYS && expiries.size() < count; offset++) {
            LocalDate day = today.plusDays(offset);
            if (day.getDayOfWeek() != expiryDay) {
                continue;
            }
            if (offset == 0 && todayExpired) {
                continue;
            }
            expiries.add(ExpiryDate.builder()
                    .date(day.format(BROKER_FORMAT))
                    .label(day.format(LABEL_FORMAT))
                    .daysAway(ChronoUnit.DAYS.between(today, day))
                    .weekday(day.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                    .timestamp(day.toString())
                    .build());
        }
        return expiries;
    }

    /** Thursday for BSE index contracts, Tuesday otherwise. */
    public DayOfWeek expiryDayOf(String stockCode) {
        String upper = stockCode == null ? "" : stockCode.toUpperCase(Locale.ROOT);
        if (upper.contains("SENSEX") || upper.contains("BSESEN")) {
            return DayOfWeek.THURSDAY;
        }
        return DayOfWeek.TUESDAY;
    }
}
