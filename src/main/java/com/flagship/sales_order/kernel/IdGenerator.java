package com.flagship.sales_order.kernel;

/**
 * Source of entity identifiers.
 */
@FunctionalInterface
public interface IdGenerator {

    /**
     * Returns a new identifier, unique across the process and across restarts.
     */
    String generate();
}
