package com.questrail.tommy.internal.decode;

/**
 * Indicates that a JSON payload does not have the zone-state shape.
 *
 * <p>Raised internally by {@link ZoneStateDecoder} and converted into a
 * dropped-message decode event; it never leaves the decoder.</p>
 */
final class ZoneDecodeException extends RuntimeException
{
    ZoneDecodeException(String message) {
        super(message);
    }
}
