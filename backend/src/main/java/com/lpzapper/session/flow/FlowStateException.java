package com.lpzapper.session.flow;

/**
 * A flow command does not apply to the session's current flow state.
 */
public class FlowStateException extends RuntimeException {

    public FlowStateException(String message) {
        super(message);
    }
}
