package com.lpzapper.session;

/**
 * Receives watcher output for delivery to the session's front end.
 */
public interface PositionUpdateListener {

    void onUpdate(PositionUpdate update);

    /**
     * The session's watcher was stopped by the user or ended after its position closed.
     */
    default void onWatchEnded(String sessionId) {
    }
}
