package org.abstractica.messaging.impl.connection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of received items, handed from a receive loop to the application.
 *
 * <p>One receive loop produces, the application consumes. Draining never
 * blocks and preserves arrival order.</p>
 *
 * @param <T> the item type
 */
public final class InboundQueue<T>
{
    private final BlockingQueue<T> items = new LinkedBlockingQueue<>();

    /**
     * Appends an item.
     *
     * @param item the received item
     */
    public void add(T item)
    {
        items.add(Objects.requireNonNull(item, "item"));
    }

    /**
     * Removes and returns everything queued so far.
     *
     * @return queued items in arrival order, possibly empty
     */
    public List<T> drain()
    {
        List<T> drained = new ArrayList<>(items.size());
        items.drainTo(drained);
        return drained;
    }

    public int size()
    {
        return items.size();
    }

    public boolean isEmpty()
    {
        return items.isEmpty();
    }
}
