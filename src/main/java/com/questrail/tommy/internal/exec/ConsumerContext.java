package com.questrail.tommy.internal.exec;

/**
 * ConsumerContext
 * -----------------------------------------------------------------------------
 * The single, serialized execution context in which all zone logic runs.
 *
 * <h2>Role in the architecture</h2>
 * The transport's network thread never calls zone logic directly. It posts
 * work here, and the context runs tasks one at a time in submission order.
 * Decoder, reconciler, and router therefore need no locking.
 *
 * <p>{@link #execute(Runnable)} is the only cross-thread hand-off in the
 * bridge and must be safe to call from any thread.</p>
 */
public interface ConsumerContext
{
    /**
     * Enqueue a task for serialized execution.
     *
     * <p>Tasks submitted after the context has stopped are discarded.</p>
     */
    void execute(Runnable task);
}
