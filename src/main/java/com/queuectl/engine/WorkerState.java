package com.queuectl.engine;

/**
 * Lifecycle of a single {@link Worker}.
 *
 * <ul>
 *   <li>POLLING → EXECUTING → POLLING: normal cycle</li>
 *   <li>POLLING/EXECUTING → DRAINING: shutdown requested, no new job will be acquired</li>
 *   <li>DRAINING → STOPPED: in-flight job reported, store closed</li>
 * </ul>
 */
public enum WorkerState {
    POLLING,
    EXECUTING,
    DRAINING,
    STOPPED
}
