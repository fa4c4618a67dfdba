package com.flagship.pos_engine.sale;

import java.util.function.Supplier;

/**
 * Atomic boundary around a sale.
 *
 * Row locks taken through the stores inside {@link #execute} are held until it
 * returns. If the work throws, everything it wrote is rolled back and the
 * exception is rethrown. Nested calls on the same thread join the outer unit.
 */
public interface SaleUnitOfWork {

    <T> T execute(Supplier<T> work);

    /**
     * Runs the action once the enclosing unit of work commits, and never if it rolls back.
     * Outside a unit of work the action runs immediately.
     */
    void afterCommit(Runnable action);
}
