package org.abstractica.messaging.impl.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Runs a polling body on a dedicated thread until stopped.
 *
 * <p>The body is expected to block for at most one poll timeout per call. The
 * stop flag is checked between calls, so the poll timeout is the cancellation
 * granularity. {@link #stop()} joins the thread; no thread outlives it.</p>
 *
 * <p>Starting a running loop or stopping a stopped one does nothing.</p>
 */
public final class PollingLoop
{
    private static final Logger LOG = LoggerFactory.getLogger(PollingLoop.class);

    /**
     * One iteration of a loop.
     */
    @FunctionalInterface
    public interface Body
    {
        /**
         * Polls once, blocking at most one poll timeout.
         *
         * @return false to end the loop
         * @throws Exception to end the loop with a failure
         */
        boolean poll() throws Exception;
    }

    private final String name;
    private final Body body;
    private final Consumer<Exception> failureHandler;

    private volatile LoopState state = LoopState.IDLE;
    private volatile boolean stopRequested;
    private volatile Thread thread;

    /**
     * Creates a loop.
     *
     * @param name           thread name
     * @param body           the body to run
     * @param failureHandler called on the loop thread if the body throws
     */
    public PollingLoop(String name, Body body, Consumer<Exception> failureHandler)
    {
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    /**
     * Starts the loop thread unless it is already running.
     *
     * @return true if a thread was started
     */
    public synchronized boolean start()
    {
        if (thread != null && thread.isAlive())
        {
            return false;
        }

        stopRequested = false;
        state = LoopState.RUNNING;
        thread = new Thread(this::run, name);
        thread.setDaemon(true);
        thread.start();

        LOG.debug("Loop {} started", name);
        return true;
    }

    /**
     * Requests the loop to stop without waiting for it.
     *
     * <p>Lets a caller signal many loops before joining any of them.</p>
     */
    public void requestStop()
    {
        Thread current = thread;
        if (current == null)
        {
            return;
        }
        stopRequested = true;
        if (current.isAlive())
        {
            state = LoopState.STOPPING;
        }
    }

    /**
     * Requests the loop to stop and waits for its thread to exit.
     *
     * <p>Called from the loop thread itself, only the flag is set.</p>
     */
    public synchronized void stop()
    {
        if (thread == null)
        {
            return;
        }

        requestStop();
        if (Thread.currentThread() == thread)
        {
            return;
        }

        try
        {
            thread.join();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for loop {} to stop", name);
            return;
        }
        state = LoopState.STOPPED;
    }

    /**
     * Returns whether a stop has been requested since the last start.
     *
     * <p>Bodies that wait in several steps check this between steps.</p>
     *
     * @return true once {@link #stop()} was called
     */
    public boolean isStopRequested()
    {
        return stopRequested;
    }

    /**
     * Returns whether the loop thread is running.
     *
     * @return true while the body is being polled
     */
    public boolean isRunning()
    {
        Thread current = thread;
        return current != null && current.isAlive();
    }

    public LoopState getState()
    {
        LoopState current = state;
        if (current == LoopState.STOPPING && !isRunning())
        {
            return LoopState.STOPPED;
        }
        return current;
    }

    public String getName()
    {
        return name;
    }

    private void run()
    {
        try
        {
            while (!stopRequested)
            {
                if (!body.poll())
                {
                    break;
                }
            }
        }
        catch (Exception e)
        {
            LOG.debug("Loop {} ended with {}", name, e.toString());
            try
            {
                failureHandler.accept(e);
            }
            catch (RuntimeException handlerError)
            {
                LOG.error("Failure handler of loop {} threw", name, handlerError);
            }
        }
        finally
        {
            state = LoopState.STOPPED;
            LOG.debug("Loop {} exited", name);
        }
    }
}
