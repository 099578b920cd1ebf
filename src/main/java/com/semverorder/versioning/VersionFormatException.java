package com.semverorder.versioning;

public abstract class VersionFormatException extends IllegalArgumentException {
    private final String input;

    protected VersionFormatException(String message, String input) {
        super(message);
        this.input = input;
    }

    protected VersionFormatException(String message, String input, Throwable cause) {
        super(message, cause);
        this.input = input;
    }

    public String input() {
        return input;
    }
}
