package com.flagship.pos_engine.sale;

/**
 * What happens to earlier lines of a checkout when a later line fails.
 */
public enum CheckoutPolicy {
    /**
     * The checkout is one unit of work. A failed line rolls back every earlier
     * line and the transaction itself.
     */
    ALL_OR_NOTHING,

    /**
     * Every line commits on its own. Earlier lines stay committed when a later
     * line fails.
     */
    PER_LINE
}
