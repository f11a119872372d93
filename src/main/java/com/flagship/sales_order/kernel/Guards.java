package com.flagship.sales_order.kernel;

import com.flagship.sales_order.kernel.error.DomainError;
import com.flagship.sales_order.kernel.error.DomainViolationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Composable validation predicates.
 *
 * Each guard returns the given error when its rule is violated and an empty
 * Optional otherwise. Guards have no side effects and never throw on null input.
 * Combine them with {@link #enforce(Optional[])}, which evaluates every check
 * before reporting.
 */
public final class Guards {

    private Guards() {
        // Utility class
    }

    /**
     * Fails when the value is null, empty, or whitespace only.
     */
    public static Optional<DomainError> notBlank(String value, DomainError error) {
        return failWhen(value == null || value.isBlank(), error);
    }

    /**
     * Fails when the value is null, zero, or negative.
     */
    public static Optional<DomainError> positive(BigDecimal value, DomainError error) {
        return failWhen(value == null || value.signum() <= 0, error);
    }

    /**
     * Fails when the value is null or does not fully match the pattern.
     */
    public static Optional<DomainError> matchesPattern(String value, Pattern pattern, DomainError error) {
        return failWhen(value == null || !pattern.matcher(value).matches(), error);
    }

    public static Optional<DomainError> notAbsent(Object value, DomainError error) {
        return failWhen(isAbsent(value), error);
    }

    public static Optional<DomainError> isAbsent(Object value, DomainError error) {
        return failWhen(!isAbsent(value), error);
    }

    /**
     * Collects the failures of all checks into one exception, or nothing when every check passed.
     */
    @SafeVarargs
    public static Optional<DomainViolationException> join(Optional<DomainError>... checks) {
        List<DomainError> failures = new ArrayList<>();
        for (Optional<DomainError> check : checks) {
            check.ifPresent(failures::add);
        }
        if (failures.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DomainViolationException(failures));
    }

    /**
     * Throws a {@link DomainViolationException} carrying every failed check.
     */
    @SafeVarargs
    public static void enforce(Optional<DomainError>... checks) {
        Optional<DomainViolationException> violation = join(checks);
        if (violation.isPresent()) {
            throw violation.get();
        }
    }

    private static Optional<DomainError> failWhen(boolean violated, DomainError error) {
        return violated ? Optional.of(error) : Optional.empty();
    }

    // Absent: null, an empty Optional, or an empty collection/map
    private static boolean isAbsent(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }
}
