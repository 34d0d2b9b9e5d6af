package org.abstractica.messaging;

/**
 * State of a stream connection.
 */
public enum ConnectionState
{
    /**
     * Constructed, not yet connected or accepted.
     */
    IDLE,

    /**
     * Socket is usable; a receive loop may run.
     */
    ACTIVE,

    /**
     * Close requested, receive loop draining.
     */
    CLOSING,

    /**
     * Socket released. Terminal.
     */
    CLOSED
}
