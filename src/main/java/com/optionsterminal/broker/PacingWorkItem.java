package com.optionsterminal.broker;

import com.optionsterminal.domain.enums.WorkKind;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import lombok.Getter;

/**
 * One unit of work waiting in a {@link PacingQueue}, together with the future its
 * submitter is blocked on.
 *
 * <p>The sequence number is assigned at admission and only used for diagnostics; FIFO
 * order comes from the queue itself.
 */
@Getter
public class PacingWorkItem<T> {

    private final Callable<T> work;
    private final WorkKind kind;
    private final String description;
    private final long sequenceNumber;
    private final long enqueuedAt;
    private final CompletableFuture<T> result = new CompletableFuture<>();

    PacingWorkItem(Callable<T> work, WorkKind kind, String description, long sequenceNumber) {
        this.work = work;
        this.kind = kind;
        this.description = description;
        this.sequenceNumber = sequenceNumber;
        this.enqueuedAt = System.currentTimeMillis();
    }

    /** Runs the work and settles the future. Never throws. */
    void execute() {
        try {
            result.complete(work.call());
        } catch (Throwable t) {
            result.completeExceptionally(t);
        }
    }

    void fail(RuntimeException cause) {
        result.completeExceptionally(cause);
    }

    boolean isEvictable() {
        return kind == WorkKind.READ;
    }
}
