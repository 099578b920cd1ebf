package com.semverorder.check;

import java.util.List;

public record SelfCheckReport(List<SelfCheckResult> results) {

    public boolean passed() {
        return results.stream().allMatch(SelfCheckResult::passed);
    }

    public long failedCount() {
        return results.stream().filter(result -> !result.passed()).count();
    }

    public List<String> failures() {
        return results.stream()
                .filter(result -> !result.passed())
                .map(result -> "Check " + result.checkId() + " failed: " + String.join("; ", result.failureReasons()))
                .toList();
    }
}
