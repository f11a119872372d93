package com.flagship.sales_order.kernel.error;

import com.flagship.sales_order.kernel.Must;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A business rule or domain invariant violation.
 *
 * Instances are meant to be declared once as constants (one per failure case)
 * and compared by {@link ErrorCode} only: message text, identity and wrapped
 * cause never take part in equality. They carry no stack trace; the
 * {@link DomainViolationException} that reports them does.
 */
public class DomainError extends RuntimeException {

    private final ErrorCode code;
    private final String description;

    DomainError(ErrorCode code, String description, Throwable cause) {
        super(render(code, description, cause), cause, false, false);
        this.code = code;
        this.description = description;
    }

    /**
     * Defines a sentinel error with no cause.
     *
     * A malformed code is a programming error and fails class initialization.
     */
    public static DomainError of(String code, String description) {
        return new DomainError(Must.succeed(() -> ErrorCode.parse(code)), description, null);
    }

    /**
     * Builds an error that carries a lower-level cause.
     *
     * May be called while an operation runs, so a malformed code is reported
     * to the caller rather than treated as an initialization failure.
     *
     * @throws DomainViolationException if {@code code} is blank or malformed
     */
    public static DomainError wrap(String code, String description, Throwable cause) {
        return new DomainError(ErrorCode.parse(code), description, cause);
    }

    /**
     * Returns a copy of this error with {@code cause} attached. This instance is not modified.
     */
    public DomainError wrap(Throwable cause) {
        return new DomainError(code, description, cause);
    }

    public ErrorCode getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public Optional<Throwable> findCause() {
        return Optional.ofNullable(getCause());
    }

    /**
     * Tells whether {@code target} is, wraps, or joins an error with this error's code.
     *
     * The cause chain is followed to its end, and every member of a
     * {@link DomainViolationException} met on the way is inspected as well.
     */
    public boolean matches(Throwable target) {
        return matches(target, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private boolean matches(Throwable target, Set<Throwable> visited) {
        Throwable current = target;
        while (current != null && visited.add(current)) {
            if (current instanceof DomainError other && code.equals(other.code)) {
                return true;
            }
            if (current instanceof DomainViolationException violation) {
                for (DomainError member : violation.getErrors()) {
                    if (matches(member, visited)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DomainError other)) {
            return false;
        }
        return code.equals(other.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code);
    }

    private static String render(ErrorCode code, String description, Throwable cause) {
        String base = "[" + code + "] " + description;
        if (cause == null) {
            return base;
        }
        String causeMessage = cause.getMessage() != null ? cause.getMessage() : cause.toString();
        return base + ": " + causeMessage;
    }
}
