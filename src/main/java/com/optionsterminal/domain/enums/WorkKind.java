package com.optionsterminal.domain.enums;

/**
 * Classifies a paced broker call for overflow handling. READ calls may be evicted from
 * a full queue; ORDER calls mutate broker-side state and are never evicted.
 */
public enum WorkKind {
    READ,
    ORDER
}
