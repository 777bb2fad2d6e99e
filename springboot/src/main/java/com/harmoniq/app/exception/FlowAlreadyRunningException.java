package com.harmoniq.app.exception;

public class FlowAlreadyRunningException extends RuntimeException {

    public FlowAlreadyRunningException(String playlistName) {
        super("A flow run for '" + playlistName + "' is already in progress");
    }
}
