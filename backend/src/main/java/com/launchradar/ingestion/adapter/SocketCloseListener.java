package com.launchradar.ingestion.adapter;

/**
 * Called once when a socket connection ends. {@code error} is non-null when the connection failed rather than
 * receiving a close frame; {@code code} is then {@link SocketConnection#ABNORMAL_CLOSURE}.
 */
@FunctionalInterface
public interface SocketCloseListener {

    void onClose(int code, String reason, Throwable error);
}
