package com.mockhttp.core.endpoint;

import com.mockhttp.core.matching.MockRequest;
import com.mockhttp.core.reporting.FailureReporter;
import com.mockhttp.core.response.ResponseWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * An HTTP method + path serving an ordered list of {@link Scenario}s.
 * <p>
 * Lifecycle: {@link State#REGISTERING} while the test declares scenarios,
 * {@link State#SERVING} once the listener starts and {@link State#VERIFIED} after the
 * call counts have been checked.
 * <p>
 * When serving starts the scenarios form a response plan: each scenario repeated
 * {@code times} times, in declaration order. The plan is kept as the cumulative call
 * bound of each scenario; the Nth request is served by the scenario owning slot
 * {@code min(N, total - 1)}, so once the plan is used up every further request goes to
 * the last scenario.
 */
public class Endpoint {

    private static final Logger logger = LoggerFactory.getLogger(Endpoint.class);

    public enum State {
        REGISTERING,
        SERVING,
        VERIFIED
    }

    private final EndpointKey key;
    private final List<Scenario> scenarios = new ArrayList<>();
    private final AtomicLong requests = new AtomicLong();
    private volatile State state = State.REGISTERING;
    private volatile Scenario[] planScenarios;
    private volatile long[] planBounds;

    public Endpoint(EndpointKey key) {
        this.key = key;
    }

    public EndpointKey key() {
        return key;
    }

    public State state() {
        return state;
    }

    public synchronized Scenario addScenario(Scenario scenario) {
        requireState(State.REGISTERING, "add a scenario");
        scenarios.add(scenario);
        return scenario;
    }

    public synchronized List<Scenario> scenarios() {
        return List.copyOf(scenarios);
    }

    /**
     * Freezes the scenarios and computes the response plan.
     */
    public synchronized void start() {
        requireState(State.REGISTERING, "start serving");
        if (scenarios.isEmpty()) {
            throw new IllegalStateException("Endpoint " + key + " has no scenarios");
        }

        Scenario[] ordered = scenarios.toArray(new Scenario[0]);
        long[] bounds = new long[ordered.length];
        long total = 0;
        for (int i = 0; i < ordered.length; i++) {
            ordered[i].freeze();
            total += ordered[i].times();
            bounds[i] = total;
        }
        planBounds = bounds;
        planScenarios = ordered;
        state = State.SERVING;
        logger.debug("Endpoint {} serving {} scenario(s) over a plan of {} call(s)", key, ordered.length, total);
    }

    /**
     * Serves one request: picks the scenario for this call index, runs its matchers and
     * renders its response into {@code writer}.
     */
    public void handle(MockRequest request, ResponseWriter writer, FailureReporter failures) {
        if (state != State.SERVING) {
            throw new IllegalStateException("Endpoint " + key + " is not serving (state " + state + ")");
        }
        long index = requests.getAndIncrement();
        int position = scenarioIndexFor(index);
        Scenario scenario = planScenarios[position];
        logger.debug("{} call #{} served by scenario {}", key, index + 1, position + 1);

        scenario.match(failures, request);
        scenario.writeTo(writer);
    }

    /**
     * @return the position of the scenario owning plan slot {@code min(index, total - 1)}
     */
    int scenarioIndexFor(long index) {
        long[] bounds = planBounds;
        long slot = Math.min(index, bounds[bounds.length - 1] - 1);
        int low = 0;
        int high = bounds.length - 1;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (bounds[mid] > slot) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    public long timesCalled() {
        return requests.get();
    }

    /**
     * Reports one failure for every scenario whose call count differs from its expected count.
     * Only the first call reports; later calls are no-ops.
     */
    public synchronized void verify(FailureReporter failures) {
        if (state == State.VERIFIED) {
            return;
        }
        if (state == State.REGISTERING) {
            // never started: every scenario is treated as not called
            for (Scenario scenario : scenarios) {
                scenario.freeze();
            }
        }
        state = State.VERIFIED;

        for (int i = 0; i < scenarios.size(); i++) {
            Scenario scenario = scenarios.get(i);
            int called = scenario.timesCalled();
            if (called == scenario.times()) {
                continue;
            }
            String name = describe(i);
            if (called == 0) {
                failures.report("expected endpoint was not called: %s", name);
            } else {
                failures.report("endpoint %s was called %d times, expected %d", name, called, scenario.times());
            }
        }
    }

    private String describe(int scenarioIndex) {
        if (scenarios.size() == 1) {
            return key.toString();
        }
        return key + " (scenario " + (scenarioIndex + 1) + " of " + scenarios.size() + ")";
    }

    private void requireState(State expected, String action) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + action + " on endpoint " + key + " in state " + state);
        }
    }
}
