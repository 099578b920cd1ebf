package com.semverorder.versioning;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// The dash before the pre-release is optional, so 1.0.1b reads as 1.0.1 with pre-release b.
// A dash right after the core is always the separator: 1.0.0- and 1.0.0-+build are rejected.
public final class VersionGrammar {
    private static final String NUMERIC_ID = "0|[1-9]\\d*";
    private static final String PRE_RELEASE_ID = "(?:" + NUMERIC_ID + "|\\d*[A-Za-z-][0-9A-Za-z-]*)";
    private static final String BUILD_ID = "[0-9A-Za-z-]+";

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "(?<major>" + NUMERIC_ID + ")"
                    + "\\.(?<minor>" + NUMERIC_ID + ")"
                    + "\\.(?<patch>" + NUMERIC_ID + ")"
                    // possessive: a leading '-' is never part of the pre-release itself
                    + "(?:-?+(?<preRelease>" + PRE_RELEASE_ID + "(?:\\." + PRE_RELEASE_ID + ")*))?"
                    + "(?:\\+(?<buildMetadata>" + BUILD_ID + "(?:\\." + BUILD_ID + ")*))?");

    private VersionGrammar() {
    }

    public static VersionFields parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        Matcher matcher = VERSION_PATTERN.matcher(raw);
        if (!matcher.matches()) {
            throw new MalformedVersionException(raw);
        }
        return toFields(matcher);
    }

    public static Optional<VersionFields> tryParse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = VERSION_PATTERN.matcher(raw);
        return matcher.matches() ? Optional.of(toFields(matcher)) : Optional.empty();
    }

    public static boolean matches(String raw) {
        return raw != null && VERSION_PATTERN.matcher(raw).matches();
    }

    private static VersionFields toFields(Matcher matcher) {
        return new VersionFields(
                matcher.group("major"),
                matcher.group("minor"),
                matcher.group("patch"),
                Optional.ofNullable(matcher.group("preRelease")),
                Optional.ofNullable(matcher.group("buildMetadata")));
    }
}
