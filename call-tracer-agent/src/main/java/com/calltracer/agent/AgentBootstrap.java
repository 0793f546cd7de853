package com.calltracer.agent;

import com.calltracer.core.Telemetry;
import com.calltracer.core.Tracing;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the target application JVM via:
 *   java -javaagent:call-tracer-agent.jar=namespace=com.myapp,dump=true -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   namespace: class name prefix to instrument, e.g. "com.company" (default: "com.")
 *   root:      name of the tree's root node (default: "main()")
 *   enabled:   "true"/"false", start with tracing enabled (default: true)
 *   dump:      "true"/"false", print the call tree to stderr on JVM shutdown (default: false)
 *
 * Every instrumented method becomes a traced call; the calling context travels in
 * {@link com.calltracer.core.ContextHolder}, so work handed to other threads joins the tree
 * only when the host wraps it with {@code ContextHolder.wrap}.
 */
public class AgentBootstrap {

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        AgentConfig config = parseArgs(agentArgs);
        System.err.println("[call-tracer-agent] attaching to namespace: " + config.namespace());
        System.err.println("[call-tracer-agent] root=" + config.rootName()
            + " enabled=" + config.enabled() + " dump=" + config.dump());

        Telemetry telemetry = Tracing.instance();
        if (config.enabled()) {
            telemetry.enable(config.rootName());
        }

        // Register shutdown hook first so it fires even if instrumentation fails
        if (config.dump()) {
            Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(telemetry)));
        }

        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[call-tracer-agent] TRANSFORM ERROR for " + typeName
                        + ": " + throwable);
                }
            })
            .type(typeMatcher(config.namespace()))
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                builder.method(methodMatcher()).intercept(Advice.to(MethodAdvice.class))
            )
            .installOn(instrumentation);

        System.err.println("[call-tracer-agent] instrumentation installed");
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    // -----------------------------------------------------------------------
    // Matchers
    // -----------------------------------------------------------------------

    /**
     * App classes in the target namespace, minus proxies, generated classes and the tracer
     * itself (instrumenting the tracer would recurse into it).
     */
    static ElementMatcher.Junction<TypeDescription> typeMatcher(String namespace) {
        return nameStartsWith(namespace)
            .and(not(nameStartsWith("com.calltracer.core.")))
            .and(not(nameStartsWith("com.calltracer.agent.")))
            .and(not(nameContains("$$EnhancerBySpring")))
            .and(not(nameContains("$Proxy")))
            .and(not(nameContains("CGLIB")))
            .and(not(nameContains("$$Lambda")));
    }

    static ElementMatcher.Junction<MethodDescription> methodMatcher() {
        return isMethod()
            .and(not(isConstructor()))
            .and(not(isAbstract()))
            .and(not(isNative()))
            .and(not(isSynthetic()));
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static AgentConfig parseArgs(String agentArgs) {
        String namespace = "com.";
        String rootName = "main()";
        boolean enabled = true;
        boolean dump = false;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length == 2) {
                    String value = kv[1].trim();
                    switch (kv[0].trim()) {
                        case "namespace" -> namespace = value;
                        case "root"      -> rootName  = value.isEmpty() ? rootName : value;
                        case "enabled"   -> enabled   = !"false".equalsIgnoreCase(value);
                        case "dump"      -> dump      = "true".equalsIgnoreCase(value);
                        default -> System.err.println("[call-tracer-agent] ignoring unknown arg: " + kv[0].trim());
                    }
                }
            }
        }
        return new AgentConfig(namespace, rootName, enabled, dump);
    }

    record AgentConfig(
        String namespace,
        String rootName,
        boolean enabled,
        boolean dump
    ) {}
}
