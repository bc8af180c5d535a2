package com.launchradar.ingestion.listener;

/**
 * Lifecycle of one chain's real-time listener.
 */
public enum ListenerState {
    IDLE,
    CONNECTING,
    SUBSCRIBED,
    RECONNECT_SCHEDULED,
    /** Stopped on purpose: shutdown or a normal socket closure. */
    STOPPED,
    /** Reconnect attempts exhausted; needs a restart. */
    ABANDONED
}
