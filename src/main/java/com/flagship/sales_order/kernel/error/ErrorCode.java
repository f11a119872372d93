package com.flagship.sales_order.kernel.error;

import com.flagship.sales_order.kernel.Guards;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.regex.Pattern;

/**
 * Identifier of a domain failure.
 *
 * Codes follow the "AGGREGATE.REASON" convention in upper snake case,
 * e.g. {@code PAYMENT.NOT_PENDING}. The code is the only thing two
 * {@link DomainError}s are compared on.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCode {

    static final Pattern FORMAT = Pattern.compile("^[A-Z][A-Z0-9_]*(\\.[A-Z][A-Z0-9_]*)+$");

    static final DomainError BLANK =
        new DomainError(new ErrorCode("ERROR_CODE.BLANK"), "error code cannot be null or whitespace", null);

    static final DomainError INVALID_FORMAT =
        new DomainError(new ErrorCode("ERROR_CODE.INVALID_FORMAT"), "error code must follow the AGGREGATE.REASON convention", null);

    private final String value;

    /**
     * Parses and validates an error code.
     *
     * @throws DomainViolationException carrying every violated rule
     */
    public static ErrorCode parse(String value) {
        Guards.enforce(
            Guards.notBlank(value, BLANK),
            Guards.matchesPattern(value, FORMAT, INVALID_FORMAT)
        );
        return new ErrorCode(value);
    }

    /**
     * The aggregate part of the code, e.g. {@code PAYMENT}.
     */
    public String getAggregate() {
        return value.substring(0, value.indexOf('.'));
    }

    @Override
    public String toString() {
        return value;
    }
}
