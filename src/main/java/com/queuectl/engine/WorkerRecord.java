package com.queuectl.engine;

/**
 * One entry of the fleet sidecar file: the OS process id of a worker and its worker id.
 * Serialised by Gson as {@code {"pid": 123, "workerId": "worker-..."}}.
 */
public class WorkerRecord {
    private long pid;
    private String workerId;

    public WorkerRecord() {
    }

    public WorkerRecord(long pid, String workerId) {
        this.pid = pid;
        this.workerId = workerId;
    }

    public long getPid() { return pid; }
    public String getWorkerId() { return workerId; }

    @Override
    public String toString() {
        return workerId + " (PID: " + pid + ")";
    }
}
