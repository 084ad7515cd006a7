package io.elephant.core.database;

import org.jdbi.v3.core.Handle;

/**
 * Binds a database transaction to the current thread.
 *
 * Store methods get the handle through {@link #getHandle()}, so they run in
 * whatever transaction the caller opened with begin or autoCommit.
 */
public interface TransactionManager
{
    /**
     * Return the handle of the current transaction.
     *
     * @throws IllegalStateException if neither begin nor autoCommit is running on this thread
     */
    Handle getHandle();

    /**
     * Run func in a new transaction. Commits if func returns, rolls back if it throws.
     */
    <T> T begin(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func);

    <T, E1 extends Exception> T begin(
            SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
        throws E1;

    <T, E1 extends Exception, E2 extends Exception> T begin(
            SupplierInTransaction<T, E1, E2, RuntimeException> func, Class<E1> e1, Class<E2> e2)
        throws E1, E2;

    <T, E1 extends Exception, E2 extends Exception, E3 extends Exception> T begin(
            SupplierInTransaction<T, E1, E2, E3> func, Class<E1> e1, Class<E2> e2, Class<E3> e3)
        throws E1, E2, E3;

    /**
     * Run func in the current transaction if exists. Otherwise, each statement
     * of func is committed immediately.
     */
    <T> T autoCommit(SupplierInTransaction<T, RuntimeException, RuntimeException, RuntimeException> func);

    <T, E1 extends Exception> T autoCommit(
            SupplierInTransaction<T, E1, RuntimeException, RuntimeException> func, Class<E1> e1)
        throws E1;

    <T, E1 extends Exception, E2 extends Exception> T autoCommit(
            SupplierInTransaction<T, E1, E2, RuntimeException> func, Class<E1> e1, Class<E2> e2)
        throws E1, E2;

    @FunctionalInterface
    interface SupplierInTransaction<T, E1 extends Exception, E2 extends Exception, E3 extends Exception>
    {
        T get()
                throws E1, E2, E3;
    }
}
