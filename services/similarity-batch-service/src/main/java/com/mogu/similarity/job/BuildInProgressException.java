package com.mogu.similarity.job;

public class BuildInProgressException extends RuntimeException {
    public BuildInProgressException() {
        super("similarity build already running");
    }
}
