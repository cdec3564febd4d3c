package com.phoenixdash.gateway.recurring;

import com.phoenixdash.gateway.events.PaymentEvent;
import com.phoenixdash.gateway.events.PaymentEventNotifier;
import com.phoenixdash.gateway.lnurl.LightningAddressFallback;
import com.phoenixdash.gateway.phoenixd.GatewayException;
import com.phoenixdash.gateway.phoenixd.PaymentGateway;
import com.phoenixdash.gateway.phoenixd.PaymentResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Executes one due recurring payment: pays it, records the outcome, reschedules
 * it and publishes a notification.
 *
 * <p>
 * Payment failures never escape; they come back as a failed
 * {@link ExecutionResult}. A {@link LedgerException} does escape, since the
 * outcome could not be recorded.
 */
@Slf4j
public class RecurringPaymentExecutor {

    static final String ADDRESS_NOT_FOUND = "Address not found on contact";
    static final String CONTACT_NOT_FOUND = "Contact not found";

    private final ExecutionLedger ledger;
    private final LightningAddressFallback fallback;
    private final PaymentEventNotifier notifier;
    private final Clock clock;
    private final Supplier<String> executionIds;
    private final boolean notifyOnFailure;

    public RecurringPaymentExecutor(ExecutionLedger ledger, LightningAddressFallback fallback,
            PaymentEventNotifier notifier, boolean notifyOnFailure) {
        this(ledger, fallback, notifier, notifyOnFailure, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public RecurringPaymentExecutor(ExecutionLedger ledger, LightningAddressFallback fallback,
            PaymentEventNotifier notifier, boolean notifyOnFailure, Clock clock, Supplier<String> executionIds) {
        this.ledger = ledger;
        this.fallback = fallback;
        this.notifier = notifier;
        this.notifyOnFailure = notifyOnFailure;
        this.clock = clock;
        this.executionIds = executionIds;
    }

    public ExecutionResult execute(DuePayment due, PaymentGateway gateway) {
        RecurringPayment schedule = due.schedule();
        Contact contact = due.contact();
        String executionId = executionIds.get();

        if (contact == null) {
            return recordMisconfigured(executionId, schedule, null, CONTACT_NOT_FOUND);
        }
        Optional<ContactAddress> address = contact.findAddress(schedule.getAddressId());
        if (address.isEmpty()) {
            return recordMisconfigured(executionId, schedule, contact, ADDRESS_NOT_FOUND);
        }
        try {
            ScheduleCalculator.nextRunAt(schedule, clock.instant());
        } catch (IllegalArgumentException e) {
            // cannot be rescheduled, so do not pay
            return recordMisconfigured(executionId, schedule, contact, "Invalid schedule: " + e.getMessage());
        }

        String message = paymentMessage(schedule, contact);
        PaymentResult payment;
        try {
            payment = pay(gateway, address.get(), schedule.getAmountSat(), message);
        } catch (RuntimeException e) {
            String error = describe(e);
            Instant now = clock.instant();
            ledger.commit(new ExecutionCommit(
                    failedRecord(executionId, schedule, error, now),
                    ScheduleUpdate.failed(error, reschedule(schedule, now)),
                    null));
            log.error("Recurring payment failed for {}: {}", contact.getName(), error);
            notifyFailure(schedule, contact, error);
            return ExecutionResult.failed(executionId, error);
        }

        Instant now = clock.instant();
        ExecutionRecord record = ExecutionRecord.builder()
                .id(executionId)
                .recurringPaymentId(schedule.getId())
                .status(ExecutionStatus.SUCCESS)
                .amountSat(schedule.getAmountSat())
                .paymentId(payment.paymentId())
                .paymentHash(payment.paymentHash())
                .executedAt(now)
                .build();
        Set<String> categories = new LinkedHashSet<>();
        if (schedule.getCategoryId() != null) {
            categories.add(schedule.getCategoryId());
        }
        PaymentMetadata metadata = PaymentMetadata.builder()
                .paymentId(payment.paymentId())
                .contactId(contact.getId())
                .note(message)
                .categoryIds(categories)
                .updatedAt(now)
                .build();
        ledger.commit(new ExecutionCommit(record,
                ScheduleUpdate.succeeded(now, reschedule(schedule, now), schedule.getAmountSat()),
                metadata));

        log.info("Recurring payment executed: {} sats to {} ({})",
                schedule.getAmountSat(), contact.getName(), payment.paymentId());

        Map<String, Object> event = basePayload(schedule, contact);
        event.put("paymentId", payment.paymentId());
        event.put("paymentHash", payment.paymentHash());
        event.put("timestamp", now.toEpochMilli());
        notifier.publish(PaymentEvent.RECURRING_PAYMENT_EXECUTED, event);

        return ExecutionResult.succeeded(executionId, payment.paymentId(), payment.paymentHash(),
                schedule.getAmountSat());
    }

    private ExecutionResult recordMisconfigured(String executionId, RecurringPayment schedule, Contact contact,
            String error) {
        log.warn("Recurring payment {} for {}: {}", schedule.getId(),
                contact != null ? contact.getName() : schedule.getContactId(), error);
        ledger.commit(new ExecutionCommit(
                failedRecord(executionId, schedule, error, clock.instant()),
                ScheduleUpdate.misconfigured(error),
                null));
        notifyFailure(schedule, contact, error);
        return ExecutionResult.failed(executionId, error);
    }

    private PaymentResult pay(PaymentGateway gateway, ContactAddress address, long amountSat, String message) {
        AddressType type = address.getType();
        if (type == AddressType.LIGHTNING_ADDRESS) {
            return payLightningAddress(gateway, address.getAddress(), amountSat, message);
        }
        if (type == AddressType.BOLT12_OFFER) {
            return gateway.payOffer(address.getAddress(), amountSat, message);
        }
        throw new ScheduleConfigurationException(
                "Unsupported address type: " + (type != null ? type.key() : "unknown"));
    }

    private PaymentResult payLightningAddress(PaymentGateway gateway, String address, long amountSat,
            String message) {
        try {
            return gateway.payToAddress(address, amountSat, message);
        } catch (GatewayException e) {
            if (!e.getKind().allowsLnurlFallback()) {
                throw e;
            }
            log.info("Node cannot reach {} ({}), trying local LNURL resolution", address, e.getMessage());
        }
        return fallback.pay(gateway, address, amountSat, message);
    }

    /**
     * Anchored on the later of now and the current due time, so a run ahead of
     * schedule still moves nextRunAt forward.
     */
    static Instant reschedule(RecurringPayment schedule, Instant now) {
        Instant due = schedule.getNextRunAt();
        Instant anchor = due != null && due.isAfter(now) ? due : now;
        return ScheduleCalculator.nextRunAt(schedule, anchor);
    }

    static String paymentMessage(RecurringPayment schedule, Contact contact) {
        String note = schedule.getNote();
        return note != null && !note.isBlank() ? note : "Recurring payment to " + contact.getName();
    }

    private static ExecutionRecord failedRecord(String executionId, RecurringPayment schedule, String error,
            Instant at) {
        return ExecutionRecord.builder()
                .id(executionId)
                .recurringPaymentId(schedule.getId())
                .status(ExecutionStatus.FAILED)
                .amountSat(schedule.getAmountSat())
                .errorMessage(error)
                .executedAt(at)
                .build();
    }

    private void notifyFailure(RecurringPayment schedule, Contact contact, String error) {
        if (!notifyOnFailure) {
            return;
        }
        Map<String, Object> event = basePayload(schedule, contact);
        event.put("error", error);
        event.put("timestamp", clock.millis());
        notifier.publish(PaymentEvent.RECURRING_PAYMENT_FAILED, event);
    }

    private static Map<String, Object> basePayload(RecurringPayment schedule, Contact contact) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("recurringPaymentId", schedule.getId());
        payload.put("contactId", schedule.getContactId());
        payload.put("contactName", contact != null ? contact.getName() : null);
        payload.put("amountSat", schedule.getAmountSat());
        return payload;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
