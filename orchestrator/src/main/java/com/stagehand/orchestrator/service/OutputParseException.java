package com.stagehand.orchestrator.service;

import com.stagehand.orchestrator.model.OutputFormat;

/**
 * Agent output does not match the structure its stage's format requires.
 */
public class OutputParseException extends RuntimeException {

    private final OutputFormat format;

    public OutputParseException(OutputFormat format, String message, Throwable cause) {
        super(message, cause);
        this.format = format;
    }

    public OutputFormat getFormat() { return format; }
}
