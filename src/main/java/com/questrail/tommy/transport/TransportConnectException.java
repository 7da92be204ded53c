package com.questrail.tommy.transport;

/**
 * Indicates that the initial broker connection could not be attempted at all,
 * for example because the host name does not resolve.
 *
 * <p>Failures after a connection attempt has started are never raised; they
 * are reported and retried with backoff.</p>
 */
public final class TransportConnectException extends RuntimeException
{
    public TransportConnectException(String message) {
        super(message);
    }

    public TransportConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
