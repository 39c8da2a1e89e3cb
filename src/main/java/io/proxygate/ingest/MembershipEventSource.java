package io.proxygate.ingest;

import io.proxygate.model.MembershipEvent;

import java.io.IOException;
import java.util.Optional;

/**
 * Pull-style feed of membership changes. Delivery is at-least-once and may be out of order.
 */
public interface MembershipEventSource extends AutoCloseable {
    /**
     * Blocks until the next relevant event; empty once the feed is exhausted.
     */
    Optional<MembershipEvent> next() throws IOException;

    @Override
    void close() throws IOException;
}
