package com.mockhttp.core.reporting;

import org.opentest4j.AssertionFailedError;
import org.opentest4j.MultipleFailuresError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe accumulating {@link FailureReporter}.
 * Matchers report from listener worker threads while the test thread reads.
 */
public class FailureCollector implements FailureReporter {

    private static final Logger logger = LoggerFactory.getLogger(FailureCollector.class);

    private final List<String> failures = new CopyOnWriteArrayList<>();

    @Override
    public void report(String message) {
        logger.debug("Recorded failure: {}", message);
        failures.add(message);
    }

    public boolean failed() {
        return !failures.isEmpty();
    }

    public List<String> failures() {
        return List.copyOf(failures);
    }

    public void clear() {
        failures.clear();
    }

    /**
     * Raises every collected failure as a single assertion error.
     *
     * @throws AssertionFailedError  if exactly one failure was collected
     * @throws MultipleFailuresError if more than one failure was collected
     */
    public void assertNoFailures() {
        List<String> snapshot = failures();
        if (snapshot.isEmpty()) {
            return;
        }
        if (snapshot.size() == 1) {
            throw new AssertionFailedError(snapshot.get(0));
        }
        List<Throwable> errors = new ArrayList<>();
        for (String message : snapshot) {
            errors.add(new AssertionFailedError(message));
        }
        throw new MultipleFailuresError("mock server expectations failed", errors);
    }
}
