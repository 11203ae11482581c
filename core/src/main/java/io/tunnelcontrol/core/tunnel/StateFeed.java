package io.tunnelcontrol.core.tunnel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish/subscribe channel for {@link ConnectionState} changes.
 *
 * <p>
 * Listeners are invoked synchronously on the publishing thread in subscription order. Once a
 * {@link Subscription} is closed its listener sees no further notifications, including ones
 * already being delivered to other listeners.
 */
public final class StateFeed {

    private static final Logger LOG = LoggerFactory.getLogger(StateFeed.class);

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    /** Handle returned by {@link #subscribe}; closing it is idempotent. */
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }

    public Subscription subscribe(StateListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        Registration registration = new Registration(listener);
        registrations.add(registration);
        return registration;
    }

    public void publish(ConnectionState state) {
        for (Registration registration : registrations) {
            if (!registration.active.get()) {
                continue;
            }
            try {
                registration.listener.onStateChanged(state);
            } catch (Exception e) {
                LOG.warn("StateListener.onStateChanged failed for state {}", state, e);
            }
        }
    }

    /** Number of live subscriptions. */
    public int subscriberCount() {
        return registrations.size();
    }

    private final class Registration implements Subscription {
        private final StateListener listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private Registration(StateListener listener) {
            this.listener = listener;
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                registrations.remove(this);
            }
        }
    }
}
