package com.semverorder.versioning;

public class MalformedVersionException extends VersionFormatException {

    public MalformedVersionException(String input) {
        super("Malformed version: '" + input + "'", input);
    }
}
