package com.optionsterminal.domain.model;

/**
 * Change-detection token for observers: the cache version qualified by the session that
 * owns the cache, so a reconnect is seen as a change even when versions coincide.
 * {@code sessionId} is null when no session is open.
 */
public record VersionStamp(String sessionId, long version) {

    public static final VersionStamp NO_SESSION = new VersionStamp(null, 0);
}
