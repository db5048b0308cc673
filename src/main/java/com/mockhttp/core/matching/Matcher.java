package com.mockhttp.core.matching;

import com.mockhttp.core.reporting.FailureReporter;

/**
 * Validates a live request. Mismatches are reported through the given
 * {@link FailureReporter}; a matcher never throws and never aborts the request.
 */
@FunctionalInterface
public interface Matcher {

    void match(FailureReporter failures, MockRequest request);
}
