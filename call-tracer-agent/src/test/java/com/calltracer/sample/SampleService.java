package com.calltracer.sample;

/**
 * Instrumentation target for the agent tests; lives outside the tracer's packages.
 */
public class SampleService {

    public SampleService() {}

    public int outer() {
        return inner() + 1;
    }

    public int inner() {
        return 41;
    }
}
