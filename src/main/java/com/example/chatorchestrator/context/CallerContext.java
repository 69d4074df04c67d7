package com.example.chatorchestrator.context;

import com.example.chatorchestrator.exception.UnauthenticatedException;
import lombok.Setter;

import java.util.function.Supplier;

/**
 * Identity of the user on whose behalf the current thread is acting.
 * <p>
 * Set by the entry points (controller, tools) and cleared when the call returns.
 * <pre>
 * CallerContext.runAs("u1", () -> orchestrator.sendMessage("s1", "hi", null, null));
 * </pre>
 */
@Setter
public class CallerContext {

    private static final ThreadLocal<CallerContext> CONTEXT = new ThreadLocal<>();

    private String userId;
    private String displayName;

    public static void set(CallerContext context) {
        CONTEXT.set(context);
    }

    public static CallerContext get() {
        return CONTEXT.get();
    }

    /**
     * @return the current user id, or {@code null} when no caller is set
     */
    public static String getUserId() {
        CallerContext ctx = CONTEXT.get();
        return ctx != null ? ctx.userId : null;
    }

    public static String getDisplayName() {
        CallerContext ctx = CONTEXT.get();
        return ctx != null ? ctx.displayName : null;
    }

    public static String requireUserId() {
        String userId = getUserId();
        if (userId == null || userId.isBlank()) {
            throw new UnauthenticatedException();
        }
        return userId;
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /**
     * Runs {@code action} as {@code userId}, restoring whatever context was set before.
     */
    public static <T> T runAs(String userId, Supplier<T> action) {
        CallerContext previous = CONTEXT.get();
        CallerContext ctx = new CallerContext();
        ctx.setUserId(userId);
        CONTEXT.set(ctx);
        try {
            return action.get();
        } finally {
            if (previous != null) {
                CONTEXT.set(previous);
            } else {
                CONTEXT.remove();
            }
        }
    }

    public static void doAs(String userId, Runnable action) {
        runAs(userId, (Supplier<Void>) () -> {
            action.run();
            return null;
        });
    }
}
