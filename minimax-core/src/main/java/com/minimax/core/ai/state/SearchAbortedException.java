package com.minimax.core.ai.state;

/**
 * Unwinds a running search once its deadline has passed or a stop was requested.
 */
public final class SearchAbortedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    SearchAbortedException(String message) {
        super(message, null, false, false);
    }
}
