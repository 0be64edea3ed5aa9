package com.optionsterminal.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Last known state of one instrument. Immutable; the cache replaces it with a merged
 * copy on every update.
 */
@Value
@Builder(toBuilder = true)
public class TickRecord {

    Double ltp;
    Double oi;
    Double volume;
    Double iv;
    Double bid;
    Double ask;
    Double changePct;

    /** Exchange time as reported by the feed, verbatim. */
    String feedTime;

    String source;

    /** Local update time, epoch seconds. */
    double updatedAt;

    public static TickRecord empty() {
        return TickRecord.builder().build();
    }

    /** Overlays the non-null fields of {@code update} and stamps the update time. */
    public TickRecord merge(TickUpdate update, double updatedAtEpochSeconds) {
        TickRecordBuilder merged = toBuilder().updatedAt(updatedAtEpochSeconds);
        if (update.getLtp() != null) {
            merged.ltp(update.getLtp());
        }
        if (update.getOi() != null) {
            merged.oi(update.getOi());
        }
        if (update.getVolume() != null) {
            merged.volume(update.getVolume());
        }
        if (update.getIv() != null) {
            merged.iv(update.getIv());
        }
        if (update.getBid() != null) {
            merged.bid(update.getBid());
        }
        if (update.getAsk() != null) {
            merged.ask(update.getAsk());
        }
        if (update.getChangePct() != null) {
            merged.changePct(update.getChangePct());
        }
        if (update.getFeedTime() != null) {
            merged.feedTime(update.getFeedTime());
        }
        if (update.getSource() != null) {
            merged.source(update.getSource());
        }
        return merged.build();
    }
}
