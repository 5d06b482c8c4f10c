package com.example.dbjobs.exception;

public class JobAlreadyRunningException extends RuntimeException {
    public JobAlreadyRunningException(Long jobId) {
        super("Job is already running: " + jobId);
    }
}
