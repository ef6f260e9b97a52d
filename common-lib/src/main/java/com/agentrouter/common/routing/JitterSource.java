package com.agentrouter.common.routing;

import java.util.Random;

/**
 * Randomness used only for the displayed confidence of an agent score. Ranking and
 * eligibility never read it, so swapping the source cannot change which agents run.
 */
@FunctionalInterface
public interface JitterSource {

    double MAX_JITTER = 10.0;

    /** @return a value in [0, {@value #MAX_JITTER}) */
    double next();

    static JitterSource none() {
        return () -> 0.0;
    }

    static JitterSource random(Random random) {
        return () -> random.nextDouble() * MAX_JITTER;
    }
}
