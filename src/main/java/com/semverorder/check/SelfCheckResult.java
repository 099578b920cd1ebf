package com.semverorder.check;

import java.util.List;

public record SelfCheckResult(
        String checkId,
        List<String> versions,
        List<String> failureReasons) {

    public boolean passed() {
        return failureReasons.isEmpty();
    }
}
