package com.byterox.sentinel.exception;

/**
 * A job timer was replaced by something other than the holder of the job lock.
 * Indicates a programming error; it is never expected at run time.
 */
public class TimerRaceException extends SentinelException {

    public TimerRaceException(String jobId) {
        super("Timer handle for job " + jobId + " changed outside the job lock");
    }
}
