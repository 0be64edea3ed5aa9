package com.optionsterminal.service;

import com.optionsterminal.api.dto.response.TickPollResponse;
import com.optionsterminal.domain.model.TickDelta;
import com.optionsterminal.domain.model.VersionStamp;
import com.optionsterminal.marketdata.TickCacheSnapshot;
import com.optionsterminal.session.BrokerSession;
import com.optionsterminal.session.BrokerSessionManager;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Builds delta payloads for relay observers and pull clients from the current session's
 * tick cache. Each delta comes from one atomic snapshot, so its rows always match its
 * version. With no open session the delta is empty at version 0.
 */
@Service
public class TickDeltaService {

    private final BrokerSessionManager brokerSessionManager;

    public TickDeltaService(BrokerSessionManager brokerSessionManager) {
        this.brokerSessionManager = brokerSessionManager;
    }

    /** Cheap read of the current change-detection token. */
    public VersionStamp currentStamp() {
        return brokerSessionManager
                .currentSession()
                .map(session -> new VersionStamp(session.getSessionId(), session.getTickCache().version()))
                .orElse(VersionStamp.NO_SESSION);
    }

    public TickDelta currentDelta() {
        Optional<BrokerSession> current = brokerSessionManager.currentSession();
        if (current.isEmpty()) {
            return TickDelta.empty();
        }
        BrokerSession session = current.get();
        TickCacheSnapshot snapshot = session.getTickCache().snapshot();
        return TickDelta.builder()
                .sessionId(session.getSessionId())
                .version(snapshot.getVersion())
                .ticks(snapshot.optionChainRows())
                .spotPrices(snapshot.spotPrices())
                .feedLive(session.isFeedLive())
                .build();
    }

    /**
     * Pull query. Answers "unchanged" when {@code sinceVersion} equals the current version,
     * otherwise the full delta.
     */
    public TickPollResponse poll(long sinceVersion) {
        VersionStamp stamp = currentStamp();
        if (stamp.version() == sinceVersion) {
            return TickPollResponse.unchanged(stamp.version());
        }
        return TickPollResponse.changed(currentDelta());
    }

    public boolean isFeedLive() {
        return brokerSessionManager.currentSession().map(BrokerSession::isFeedLive).orElse(false);
    }
}
