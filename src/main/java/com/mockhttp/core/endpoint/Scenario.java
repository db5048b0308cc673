package com.mockhttp.core.endpoint;

import com.mockhttp.core.matching.Matcher;
import com.mockhttp.core.matching.MockRequest;
import com.mockhttp.core.reporting.FailureReporter;
import com.mockhttp.core.response.Responder;
import com.mockhttp.core.response.ResponseRecorder;
import com.mockhttp.core.response.ResponseWriter;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One mocked case of an {@link Endpoint}: the matchers a request must satisfy, the
 * responders that build its response and how many times it is expected to be called.
 * <p>
 * {@link #times(int)} and {@link #respond(Responder...)} are setup calls; once the
 * owning endpoint starts serving they throw. {@link #match} and {@link #timesCalled()}
 * are safe to call from concurrent request threads.
 */
public class Scenario {

    private final List<Matcher> matchers;
    private volatile List<Responder> responders = List.of();
    private volatile int times = 1;
    private volatile boolean frozen;
    private final AtomicInteger calls = new AtomicInteger();

    public Scenario(List<Matcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    /**
     * Sets how many requests this scenario is expected to receive.
     *
     * @param n expected call count, at least 1
     */
    public Scenario times(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("times must be >= 1, got " + n);
        }
        checkNotFrozen();
        this.times = n;
        return this;
    }

    public Scenario respond(Responder... responders) {
        checkNotFrozen();
        this.responders = List.of(responders);
        return this;
    }

    public int times() {
        return times;
    }

    public int timesCalled() {
        return calls.get();
    }

    /**
     * Counts the call, then runs every matcher against the request. Matcher failures are
     * reported, never thrown, so a response is always produced afterwards.
     */
    public void match(FailureReporter failures, MockRequest request) {
        calls.incrementAndGet();
        for (Matcher matcher : matchers) {
            matcher.match(failures, request);
        }
    }

    public void writeTo(ResponseWriter writer) {
        ResponseRecorder recorder = new ResponseRecorder();
        for (Responder responder : responders) {
            responder.respond(recorder);
        }
        recorder.flushTo(writer);
    }

    void freeze() {
        frozen = true;
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Scenario cannot be changed after the mock server has started");
        }
    }
}
