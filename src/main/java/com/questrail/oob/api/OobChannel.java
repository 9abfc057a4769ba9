package com.questrail.oob.api;

/**
 * OobChannel
 * -----------------------------------------------------------------------------
 * Consumer-facing surface of an out-of-band verification channel.
 *
 * <p>An activation accepts exactly one peer connection, reads one framed
 * verification token from it and reports the outcome through the installed
 * {@link OobChannelCallback}. The blocking work runs on an execution context
 * owned by the implementation, never on the thread calling {@link #start()}.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   setCallback(...)  → install the outcome sink
 *   start()           → begin one activation (only valid while idle)
 *   stop()            → cancel the activation, if any (idempotent)
 * </pre>
 *
 * <p>A channel may be started again once the previous activation has
 * completed or finished cancelling.</p>
 */
public interface OobChannel
{
    /**
     * Begin a new activation.
     *
     * @throws IllegalStateException if an activation is already in progress
     */
    void start();

    /**
     * Cancel the current activation and release its transport resources.
     *
     * <p>A cancelled activation never invokes the callback. Calling this
     * method while idle, or more than once, has no effect.</p>
     */
    void stop();

    /**
     * Install the callback that receives the outcome of each activation.
     *
     * <p>May be {@code null}, in which case outcomes are discarded.</p>
     */
    void setCallback(OobChannelCallback callback);
}
