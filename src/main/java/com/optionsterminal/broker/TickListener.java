package com.optionsterminal.broker;

import java.util.List;
import java.util.Map;

/** Receives raw push-feed payloads, in whatever field naming the feed currently uses. */
@FunctionalInterface
public interface TickListener {

    void onTicks(List<Map<String, Object>> ticks);
}
