package com.mockhttp.core.reporting;

/**
 * Channel through which matchers, the dispatcher and the verification pass report
 * test failures. Reporting never stops the caller: failures accumulate so that a
 * single test run surfaces every violation.
 */
@FunctionalInterface
public interface FailureReporter {

    void report(String message);

    default void report(String format, Object... args) {
        report(String.format(format, args));
    }
}
