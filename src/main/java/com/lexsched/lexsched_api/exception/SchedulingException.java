package com.lexsched.lexsched_api.exception;

/**
 * Root of every failure the scheduler reports. {@code problemId} is set once the failure
 * has been recorded against a run.
 */
public class SchedulingException extends RuntimeException {

    private String problemId;

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getProblemId() {
        return problemId;
    }

    public void setProblemId(String problemId) {
        this.problemId = problemId;
    }
}
