package com.launchradar.ingestion.event;

/**
 * A decoded bonding-curve contract event.
 */
public interface CurveEvent {

    String tokenAddress();

    /** topic0 of the log this event was decoded from. */
    String topic();
}
