package io.trading.marketsync.connection;

import io.trading.marketsync.protocol.api.Subscription;
import io.trading.marketsync.protocol.model.BookUpdate;

/**
 * Requests from the public API, executed in order on the connection loop.
 */
interface Command {

    record Send(String text) implements Command {
    }

    record Subscribe(Subscription subscription) implements Command {
    }

    record Unsubscribe(Subscription subscription) implements Command {
    }

    record Ping() implements Command {
    }

    record Disconnect() implements Command {
    }

    record ApplyBookSnapshot(BookUpdate snapshot) implements Command {
    }
}
