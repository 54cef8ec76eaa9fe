package com.energyweather.recon.runner;

/**
 * Fatal pipeline failure: a snapshot or output could not be written, or the run was misconfigured.
 */
public class PipelineException extends Exception {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
