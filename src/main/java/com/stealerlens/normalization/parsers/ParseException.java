package com.stealerlens.normalization.parsers;

/**
 * Exception thrown when a system information file cannot be parsed.
 * Carries the detected stealer tag and the file name for the batch error list.
 */
public class ParseException extends RuntimeException {

    private final String stealerType;
    private final String fileName;

    public ParseException(String message) {
        super(message);
        this.stealerType = null;
        this.fileName = null;
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
        this.stealerType = null;
        this.fileName = null;
    }

    public ParseException(String message, String stealerType, String fileName) {
        super(message);
        this.stealerType = stealerType;
        this.fileName = fileName;
    }

    public ParseException(String message, Throwable cause, String stealerType, String fileName) {
        super(message, cause);
        this.stealerType = stealerType;
        this.fileName = fileName;
    }

    public String getStealerType() {
        return stealerType;
    }

    public String getFileName() {
        return fileName;
    }
}
