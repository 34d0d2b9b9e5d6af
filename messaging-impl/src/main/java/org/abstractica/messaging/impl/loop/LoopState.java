package org.abstractica.messaging.impl.loop;

/**
 * State of a {@link PollingLoop}.
 */
public enum LoopState
{
    /**
     * Never started.
     */
    IDLE,

    /**
     * Thread running the loop body.
     */
    RUNNING,

    /**
     * Stop requested, thread not yet exited.
     */
    STOPPING,

    /**
     * Thread exited. The loop may be started again.
     */
    STOPPED
}
