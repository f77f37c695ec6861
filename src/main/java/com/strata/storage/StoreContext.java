package com.strata.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Request scoped execution context: server settings attached to each
 * statement plus a cancellation flag shared by every derived context.
 */
public class StoreContext {
    private static final Logger log = LoggerFactory.getLogger(StoreContext.class);

    private final Map<String, Object> settings;
    private final Cancellation cancellation;

    private StoreContext(Map<String, Object> settings, Cancellation cancellation) {
        this.settings = Collections.unmodifiableMap(settings);
        this.cancellation = cancellation;
    }

    public static StoreContext create() {
        return new StoreContext(new LinkedHashMap<>(), new Cancellation());
    }

    /**
     * Returns a context carrying one more setting. Cancelling either context
     * cancels both.
     */
    public StoreContext withSetting(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(settings);
        copy.put(name, value);
        return new StoreContext(copy, cancellation);
    }

    public Map<String, Object> getSettings() {
        return settings;
    }

    public boolean isCancelled() {
        return cancellation.cancelled.get();
    }

    /**
     * Marks the request cancelled and aborts the statement in flight, if any.
     */
    public void cancel() {
        cancellation.cancelled.set(true);
        Statement statement = cancellation.inFlight.get();
        if (statement != null) {
            try {
                statement.cancel();
            } catch (SQLException e) {
                log.warn("Failed to cancel in-flight statement", e);
            }
        }
    }

    void register(Statement statement) {
        cancellation.inFlight.set(statement);
    }

    void unregister(Statement statement) {
        cancellation.inFlight.compareAndSet(statement, null);
    }

    private static final class Cancellation {
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final AtomicReference<Statement> inFlight = new AtomicReference<>();
    }
}
