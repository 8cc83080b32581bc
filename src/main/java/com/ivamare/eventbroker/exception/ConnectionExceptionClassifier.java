package com.ivamare.eventbroker.exception;

import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies exceptions raised by broker backends to decide whether they signal
 * a lost connection (and so deserve a reconnect-and-retry) or a real failure.
 *
 * <p>Connection errors include:
 * <ul>
 *   <li>{@link BrokerConnectionException} raised by a backend</li>
 *   <li>Socket level failures ({@link ConnectException}, {@link SocketException}, ...)</li>
 *   <li>Timeouts</li>
 *   <li>Known connection message patterns</li>
 * </ul>
 *
 * <p>Anything else (invalid data, permission problems, missing files) is not retried.
 */
public final class ConnectionExceptionClassifier {

    private ConnectionExceptionClassifier() {
        // Utility class - no instantiation
    }

    /**
     * Message patterns that indicate connection problems.
     * These are checked case-insensitively against exception messages.
     */
    private static final String[] CONNECTION_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection closed",
        "connection lost",
        "connection error",
        "connectionerror",
        "connection timed out",
        "timeout",
        "timed out",
        "timeouterror",
        "network unreachable",
        "network is unreachable",
        "host is unreachable",
        "no route to host",
        "reset by peer",
        "broken pipe",
        "socket"
    };

    /**
     * Determine if the exception signals a broken broker connection.
     *
     * @param ex the exception to classify
     * @return true if a reconnect should be attempted
     */
    public static boolean isConnectionError(Throwable ex) {
        return getConnectionReason(ex) != null;
    }

    /**
     * Get a brief description of why the exception was classified as a connection error.
     * Useful for logging.
     *
     * @param ex the exception to describe
     * @return the matched reason, or null if this is not a connection error
     */
    public static String getConnectionReason(Throwable ex) {
        if (ex == null) {
            return null;
        }

        if (ex instanceof BrokerConnectionException) {
            return "BrokerConnectionException";
        }
        // Subclasses of SocketException first
        if (ex instanceof ConnectException || ex instanceof NoRouteToHostException) {
            return ex.getClass().getSimpleName();
        }
        if (ex instanceof SocketException || ex instanceof SocketTimeoutException) {
            return ex.getClass().getSimpleName();
        }
        if (ex instanceof TimeoutException || ex instanceof ClosedChannelException) {
            return ex.getClass().getSimpleName();
        }

        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            for (String pattern : CONNECTION_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return "Message pattern: " + pattern;
                }
            }
        }

        Throwable cause = ex instanceof UncheckedIOException unchecked ? unchecked.getCause() : ex.getCause();
        if (cause != null && cause != ex) {
            return getConnectionReason(cause);
        }

        return null;
    }
}
