package com.phoenixdash.gateway.recurring;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable store for recurring payments, their contacts, execution history and
 * payment metadata. Returned objects are snapshots; changes go through the
 * save/commit methods.
 *
 * <p>
 * Every method may throw {@link LedgerException}.
 */
public interface ExecutionLedger {

    /**
     * Active schedules with {@code nextRunAt <= now} that are bound to
     * {@code connectionId} or to no connection, ordered by due time. A
     * schedule whose contact no longer exists comes back with a null contact.
     */
    List<DuePayment> findDue(Instant now, String connectionId);

    /** Current state of one schedule; the contact is null when it was deleted. */
    Optional<DuePayment> findForExecution(String recurringPaymentId);

    Optional<RecurringPayment> findRecurringPayment(String id);

    /**
     * @param status       null for any status
     * @param contactId    null for any contact
     * @param connectionId when non-null, only schedules bound to it or to no connection
     */
    List<RecurringPayment> listRecurringPayments(RecurringStatus status, String contactId, String connectionId);

    RecurringPayment saveRecurringPayment(RecurringPayment payment);

    /**
     * Apply {@code edit} to the stored schedule and persist the result, with no
     * commit able to land in between. Exceptions thrown by {@code edit} leave the
     * schedule untouched.
     *
     * @return the updated schedule, or empty if it does not exist
     */
    Optional<RecurringPayment> updateRecurringPayment(String id, UnaryOperator<RecurringPayment> edit);

    boolean deleteRecurringPayment(String id);

    Optional<Contact> findContact(String id);

    List<Contact> listContacts();

    Contact saveContact(Contact contact);

    /**
     * Apply all writes of one execution atomically. Committing a record id that
     * is already present is a no-op.
     */
    void commit(ExecutionCommit commit);

    /** Newest first. */
    List<ExecutionRecord> listExecutions(String recurringPaymentId, int limit, int offset);

    Optional<PaymentMetadata> findPaymentMetadata(String paymentId);
}
