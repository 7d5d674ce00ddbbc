package com.creatorradar.ledger;

import java.time.Instant;

/**
 * Out-of-order guard that complements the ledger: the ledger stops duplicate application, this stops an older
 * event from being applied after a newer one.
 */
public final class EventStaleness {

    private EventStaleness() {
    }

    /**
     * True when the event happened strictly before the last applied event. Never stale without a previous event.
     */
    public static boolean isEventStale(Instant eventTimestamp, Instant lastProcessedTimestamp) {
        if (lastProcessedTimestamp == null || eventTimestamp == null) {
            return false;
        }
        return eventTimestamp.isBefore(lastProcessedTimestamp);
    }

    /**
     * Variant for producers that stamp events in Unix seconds.
     */
    public static boolean isEventStale(long eventEpochSeconds, Instant lastProcessedTimestamp) {
        return isEventStale(Instant.ofEpochSecond(eventEpochSeconds), lastProcessedTimestamp);
    }
}
