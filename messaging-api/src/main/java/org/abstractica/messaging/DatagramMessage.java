package org.abstractica.messaging;

import java.util.Objects;

/**
 * A message received on a datagram endpoint, tagged with its sender.
 *
 * @param message the decoded text payload
 * @param sender  the address the datagram came from
 */
public record DatagramMessage(String message, Peer sender)
{
    public DatagramMessage
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(sender, "sender");
    }
}
