package org.entitybrowser.core.loader;

import java.io.IOException;

/**
 * Thrown when a dataset file is readable but does not have the expected {@code build_number}/{@code data} layout.
 */
public class DatasetFormatException extends IOException {
    public DatasetFormatException(String message) {
        super(message);
    }

    public DatasetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
