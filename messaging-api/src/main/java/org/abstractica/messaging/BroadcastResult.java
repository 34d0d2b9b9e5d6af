package org.abstractica.messaging;

import org.abstractica.messaging.errors.SendException;

import java.util.Map;
import java.util.Set;

/**
 * Outcome of sending one message to every registered peer.
 *
 * @param delivered peers the message was written to
 * @param failures  peers whose send failed, with the failure
 */
public record BroadcastResult(Set<Peer> delivered, Map<Peer, SendException> failures)
{
    public BroadcastResult
    {
        delivered = Set.copyOf(delivered);
        failures = Map.copyOf(failures);
    }

    /**
     * Returns the peers whose send failed.
     *
     * @return failed peers, empty if every send succeeded
     */
    public Set<Peer> failedPeers()
    {
        return failures.keySet();
    }

    /**
     * Returns whether every send succeeded.
     *
     * @return true if there were no failures
     */
    public boolean isSuccess()
    {
        return failures.isEmpty();
    }
}
