package com.harmoniq.app.entity;

public enum FlowRunStatus {
    SUCCESS,    // playlist written
    EMPTY,      // nothing matched, playlist left as it was
    FAILED
}
