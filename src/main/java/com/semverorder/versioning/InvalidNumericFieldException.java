package com.semverorder.versioning;

public class InvalidNumericFieldException extends VersionFormatException {
    private final String field;

    public InvalidNumericFieldException(String field, String input, NumberFormatException cause) {
        super("Invalid version number: " + field + " of '" + input + "' is not a valid integer", input, cause);
        this.field = field;
    }

    public String field() {
        return field;
    }
}
