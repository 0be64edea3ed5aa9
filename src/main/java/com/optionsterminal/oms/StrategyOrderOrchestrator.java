package com.optionsterminal.oms;

import com.optionsterminal.config.GatewayProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Submits the legs of a multi-leg strategy concurrently and reports one result per leg.
 *
 * <p>Every leg runs as its own unit on the leg executor. The units still reach the broker
 * one at a time because each submission goes through the session's pacing lane. A leg's
 * failure, whether a broker rejection, an exception or a missing field, is confined to that
 * leg's result. There is no rollback: legs that succeeded stay placed.
 *
 * <p>The orchestrator waits for all units up to the configured join timeout, measured from
 * the moment the units were started. A unit still running at that point is reported as
 * timed out; it is not cancelled and its order may still reach the broker later.
 */
@Component
public class StrategyOrderOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StrategyOrderOrchestrator.class);

    private final Executor legExecutor;
    private final long legJoinTimeoutMs;

    @Autowired
    public StrategyOrderOrchestrator(@Qualifier("legExecutor") Executor legExecutor, GatewayProperties properties) {
        this(legExecutor, properties.getOrders().getLegJoinTimeoutMs());
    }

    public StrategyOrderOrchestrator(Executor legExecutor, long legJoinTimeoutMs) {
        this.legExecutor = legExecutor;
        this.legJoinTimeoutMs = legJoinTimeoutMs;
    }

    /**
     * Submits all legs and returns their results ordered by leg index (position in
     * {@code legs}). An empty list yields an empty result.
     */
    public List<LegResult> execute(List<OrderLeg> legs, LegSubmitter submitter) {
        if (legs == null || legs.isEmpty()) {
            return List.of();
        }
        log.info("Submitting strategy of {} legs", legs.size());

        List<CompletableFuture<LegResult>> futures = new ArrayList<>(legs.size());
        for (int i = 0; i < legs.size(); i++) {
            final int legIndex = i;
            final OrderLeg leg = legs.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> submitLeg(legIndex, leg, submitter), legExecutor));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(legJoinTimeoutMs);
        List<LegResult> results = new ArrayList<>(legs.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(join(i, futures.get(i), deadline));
        }
        results.sort(Comparator.comparingInt(LegResult::getLegIndex));

        long succeeded = results.stream().filter(LegResult::isSuccess).count();
        if (succeeded == results.size()) {
            log.info("Strategy complete: all {} legs placed", results.size());
        } else {
            log.warn("Strategy partially placed: {}/{} legs succeeded", succeeded, results.size());
        }
        return results;
    }

    private LegResult submitLeg(int legIndex, OrderLeg leg, LegSubmitter submitter) {
        try {
            LegResult result = LegResult.fromResponse(legIndex, submitter.submit(leg));
            if (result.isSuccess()) {
                log.info("Leg {} placed: orderId={}", legIndex, result.getOrderId());
            } else {
                log.warn("Leg {} rejected by broker: {}", legIndex, result.getError());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Leg {} failed: {}", legIndex, describe(e));
            return LegResult.failed(legIndex, describe(e));
        }
    }

    private LegResult join(int legIndex, CompletableFuture<LegResult> future, long deadlineNanos) {
        long remainingNanos = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Leg {} did not complete within {}ms", legIndex, legJoinTimeoutMs);
            return LegResult.failed(legIndex, "Leg timed out after " + legJoinTimeoutMs + "ms; order may still be placed");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return LegResult.failed(legIndex, describe(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LegResult.failed(legIndex, "Interrupted while waiting for leg");
        }
    }

    /** Exception message, or its type when it carries none, so a failed leg always reports a reason. */
    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.toString();
    }
}
