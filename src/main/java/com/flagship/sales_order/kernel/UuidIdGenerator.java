package com.flagship.sales_order.kernel;

import java.util.UUID;

/**
 * Random (version 4) UUID identifiers.
 */
public class UuidIdGenerator implements IdGenerator {

    @Override
    public String generate() {
        return UUID.randomUUID().toString();
    }
}
