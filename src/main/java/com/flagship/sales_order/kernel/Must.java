package com.flagship.sales_order.kernel;

import com.flagship.sales_order.kernel.error.DomainViolationException;

import java.util.function.Supplier;

/**
 * Startup helper for values that cannot legitimately fail to build.
 *
 * Only call this from static or bean initialization. A violation here is a
 * programming error and aborts initialization with an {@link IllegalStateException};
 * it must never be used on an operation path, where violations are reported
 * to the caller instead.
 */
public final class Must {

    private Must() {
        // Utility class
    }

    public static <T> T succeed(Supplier<T> initializer) {
        try {
            return initializer.get();
        } catch (DomainViolationException e) {
            throw new IllegalStateException("Initialization failed: " + e.getMessage(), e);
        }
    }
}
