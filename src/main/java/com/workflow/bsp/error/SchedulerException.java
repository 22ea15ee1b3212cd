package com.workflow.bsp.error;

/** Failures raised by the work-stealing scheduler or by a task it ran. */
public class SchedulerException extends BspException {

    public enum Kind {
        QUEUE_FULL,
        TASK_TIMEOUT,
        TASK_PANIC
    }

    private final Kind kind;

    public SchedulerException(Kind kind, String message, long superstep, String nodeName, Throwable cause) {
        super(kind + ": " + message, superstep, nodeName, cause);
        this.kind = kind;
    }

    public SchedulerException(Kind kind, String message) {
        this(kind, message, NO_SUPERSTEP, null, null);
    }

    public Kind kind() {
        return kind;
    }
}
