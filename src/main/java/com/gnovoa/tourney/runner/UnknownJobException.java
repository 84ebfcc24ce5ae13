package com.gnovoa.tourney.runner;

public class UnknownJobException extends RuntimeException {
    public UnknownJobException(String jobId) {
        super("Unknown optimization job " + jobId);
    }
}
