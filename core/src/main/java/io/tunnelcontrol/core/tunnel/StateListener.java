package io.tunnelcontrol.core.tunnel;

/**
 * Receives connection state changes from a {@link StateFeed}.
 *
 * <p>
 * Called on the session controller's worker thread; implementations must not block. An exception
 * thrown here is logged by the feed and does not reach other listeners.
 */
@FunctionalInterface
public interface StateListener {

    void onStateChanged(ConnectionState state);
}
