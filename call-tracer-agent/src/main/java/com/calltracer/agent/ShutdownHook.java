package com.calltracer.agent;

import com.calltracer.core.Telemetry;

import java.io.PrintStream;

/**
 * Prints the call tree collected so far when the JVM shuts down.
 * Registered via Runtime.getRuntime().addShutdownHook() when the agent runs with dump=true.
 */
public class ShutdownHook implements Runnable {

    private final Telemetry telemetry;
    private final PrintStream out;

    public ShutdownHook(Telemetry telemetry) {
        this(telemetry, System.err);
    }

    ShutdownHook(Telemetry telemetry, PrintStream out) {
        this.telemetry = telemetry;
        this.out = out;
    }

    @Override
    public void run() {
        try {
            out.println("[call-tracer-agent] call tree: " + telemetry.exportJson());
        } catch (Exception e) {
            System.err.println("[call-tracer-agent] ERROR dumping call tree: " + e.getMessage());
        }
    }
}
