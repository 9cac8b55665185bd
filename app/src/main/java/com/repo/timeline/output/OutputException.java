package com.repo.timeline.output;

import java.io.IOException;

/**
 * The log destination (file or pipe) cannot be written.
 */
public class OutputException extends IOException {

    public OutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
