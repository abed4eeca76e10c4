package com.lexsched.lexsched_api.model;

public enum RunStatus {
    SOLVING,
    DONE,
    FAILED
}
