package com.flagship.sales_order.kernel.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when one operation violates one or more domain rules.
 *
 * All violations detected by the operation are reported together, in the
 * order the checks were declared, so a caller sees every failed precondition
 * from a single call.
 */
public class DomainViolationException extends RuntimeException {

    private final List<DomainError> errors;

    public DomainViolationException(List<DomainError> errors) {
        super(errors.stream().map(Throwable::getMessage).collect(Collectors.joining("\n")));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("At least one domain error is required");
        }
        this.errors = List.copyOf(errors);
    }

    public List<DomainError> getErrors() {
        return errors;
    }

    public List<String> getCodes() {
        return errors.stream()
            .map(error -> error.getCode().getValue())
            .toList();
    }

    /**
     * Checks whether an error with the sentinel's code is among (or wrapped by) the violations.
     */
    public boolean contains(DomainError sentinel) {
        return sentinel.matches(this);
    }
}
