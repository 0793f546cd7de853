package com.calltracer.agent;

import com.calltracer.core.CallContext;
import com.calltracer.core.ContextHolder;
import com.calltracer.core.Span;
import com.calltracer.core.Tracing;
import net.bytebuddy.asm.Advice;

import java.lang.reflect.Method;

/**
 * ByteBuddy Advice class that turns every instrumented method into a traced call.
 *
 * Function name format: {@code <fully-qualified-class-name>.<method-name>()}
 *
 * onEnter derives the call's context from the one attached to the current thread (or from a
 * seed context for the outermost call), starts a {@link Span} and attaches the new context.
 * onExit runs on normal and exceptional exits alike, detaches the context and closes the span.
 *
 * Everything referenced here is public: the advice is inlined into instrumented classes that
 * live in other packages and class loaders.
 */
public class MethodAdvice {

    /**
     * Entry advice.
     *
     * Returns null when tracing is disabled, otherwise Object[] containing:
     *   [0] = Span                the running measurement
     *   [1] = ContextHolder.Scope restores the caller's context
     */
    @Advice.OnMethodEnter
    public static Object[] onEnter(@Advice.Origin Method method) {
        if (!Tracing.isEnabled()) {
            return null;
        }
        CallContext parent = ContextHolder.current();
        if (parent == null) {
            parent = Tracing.seed();
        }
        Span span = Tracing.start(parent, functionName(method));
        ContextHolder.Scope scope = ContextHolder.attach(span.context());
        return new Object[]{ span, scope };
    }

    @Advice.OnMethodExit(onThrowable = Throwable.class)
    public static void onExit(@Advice.Enter Object[] enterData) {
        if (enterData == null) return;
        ((ContextHolder.Scope) enterData[1]).close();
        ((Span) enterData[0]).close();
    }

    public static String functionName(Method method) {
        return method.getDeclaringClass().getName() + "." + method.getName() + "()";
    }
}
