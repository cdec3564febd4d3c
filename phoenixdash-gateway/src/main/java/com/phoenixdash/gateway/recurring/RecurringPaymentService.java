package com.phoenixdash.gateway.recurring;

import com.phoenixdash.gateway.node.NodeConnection;
import com.phoenixdash.gateway.node.NodeConnectionRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Management operations for recurring payments: validation, CRUD and history.
 */
@Slf4j
public class RecurringPaymentService {

    static final int DEFAULT_EXECUTION_LIMIT = 50;

    private final ExecutionLedger ledger;
    private final NodeConnectionRegistry connections;
    private final Clock clock;

    public RecurringPaymentService(ExecutionLedger ledger, NodeConnectionRegistry connections) {
        this(ledger, connections, Clock.systemUTC());
    }

    public RecurringPaymentService(ExecutionLedger ledger, NodeConnectionRegistry connections, Clock clock) {
        this.ledger = ledger;
        this.connections = connections;
        this.clock = clock;
    }

    // --- Queries ---

    /**
     * @param status  null or a status key
     * @param showAll when false, only schedules of the active connection and unbound ones
     */
    public List<RecurringPayment> list(String status, String contactId, boolean showAll) {
        RecurringStatus parsed = status != null ? parseStatus(status) : null;
        String connectionId = showAll ? null
                : connections.getActiveConnection().map(NodeConnection::getId).orElse(null);
        return ledger.listRecurringPayments(parsed, contactId, connectionId);
    }

    public RecurringPayment get(String id) {
        return ledger.findRecurringPayment(id).orElseThrow(() -> new RecurringPaymentNotFoundException(id));
    }

    public List<ExecutionRecord> listExecutions(String id, Integer limit, Integer offset) {
        get(id);
        int effectiveLimit = limit != null ? limit : DEFAULT_EXECUTION_LIMIT;
        int effectiveOffset = offset != null ? offset : 0;
        if (effectiveLimit < 0 || effectiveOffset < 0) {
            throw new RecurringPaymentValidationException("limit and offset must not be negative");
        }
        return ledger.listExecutions(id, effectiveLimit, effectiveOffset);
    }

    // --- Mutations ---

    public RecurringPayment create(RecurringPaymentRequest request) {
        if (isBlank(request.getContactId())) {
            throw new RecurringPaymentValidationException("Contact ID is required");
        }
        if (isBlank(request.getAddressId())) {
            throw new RecurringPaymentValidationException("Address ID is required");
        }
        long amountSat = requirePositiveAmount(request.getAmountSat());
        Frequency frequency = parseFrequency(request.getFrequency());

        Contact contact = ledger.findContact(request.getContactId())
                .orElseThrow(() -> new ContactNotFoundException(request.getContactId()));
        requirePayableAddress(contact, request.getAddressId());

        String timeOfDay = request.getTimeOfDay() != null ? request.getTimeOfDay()
                : ScheduleCalculator.DEFAULT_TIME_OF_DAY;
        Integer dayOfWeek = frequency == Frequency.WEEKLY
                ? orDefault(request.getDayOfWeek(), ScheduleCalculator.DEFAULT_DAY_OF_WEEK)
                : null;
        Integer dayOfMonth = frequency == Frequency.MONTHLY
                ? orDefault(request.getDayOfMonth(), ScheduleCalculator.DEFAULT_DAY_OF_MONTH)
                : null;
        validateCadence(timeOfDay, dayOfWeek, dayOfMonth);

        Instant now = clock.instant();
        RecurringPayment payment = RecurringPayment.builder()
                .contactId(contact.getId())
                .addressId(request.getAddressId())
                .connectionId(connections.getActiveConnection().map(NodeConnection::getId).orElse(null))
                .amountSat(amountSat)
                .frequency(frequency)
                .timeOfDay(timeOfDay)
                .dayOfWeek(dayOfWeek)
                .dayOfMonth(dayOfMonth)
                .note(emptyToNull(request.getNote()))
                .categoryId(emptyToNull(request.getCategoryId()))
                .status(RecurringStatus.ACTIVE)
                .nextRunAt(ScheduleCalculator.nextRunAt(frequency, timeOfDay, dayOfWeek, dayOfMonth, now))
                .createdAt(now)
                .updatedAt(now)
                .build();

        RecurringPayment saved = ledger.saveRecurringPayment(payment);
        log.info("Created recurring payment {}: {} sats {} to {} (next run {})",
                saved.getId(), amountSat, frequency.key(), contact.getName(), saved.getNextRunAt());
        return saved;
    }

    /**
     * Apply the non-null request fields. The edit runs against the stored row
     * inside the ledger, so run state written by a concurrent execution is kept.
     */
    public RecurringPayment update(String id, RecurringPaymentRequest request) {
        RecurringPayment existing = get(id);

        // contactId never changes, so the address can be checked up front
        if (request.getAddressId() != null && !request.getAddressId().equals(existing.getAddressId())) {
            Contact contact = ledger.findContact(existing.getContactId())
                    .orElseThrow(() -> new ContactNotFoundException(existing.getContactId()));
            requirePayableAddress(contact, request.getAddressId());
        }
        Long amountSat = request.getAmountSat() != null ? requirePositiveAmount(request.getAmountSat()) : null;
        RecurringStatus status = request.getStatus() != null ? parseStatus(request.getStatus()) : null;
        Frequency requestedFrequency = request.getFrequency() != null ? parseFrequency(request.getFrequency()) : null;
        boolean cadenceChanged = requestedFrequency != null || request.getTimeOfDay() != null
                || request.getDayOfWeek() != null || request.getDayOfMonth() != null;
        Instant now = clock.instant();

        RecurringPayment saved = ledger.updateRecurringPayment(id, current -> {
            if (request.getAddressId() != null) {
                current.setAddressId(request.getAddressId());
            }
            if (amountSat != null) {
                current.setAmountSat(amountSat);
            }
            if (request.getNote() != null) {
                current.setNote(emptyToNull(request.getNote()));
            }
            if (request.getCategoryId() != null) {
                current.setCategoryId(emptyToNull(request.getCategoryId()));
            }
            if (status != null) {
                current.setStatus(status);
            }
            if (cadenceChanged) {
                applyCadence(current, request, requestedFrequency, now);
            }
            current.setUpdatedAt(now);
            return current;
        }).orElseThrow(() -> new RecurringPaymentNotFoundException(id));

        log.info("Updated recurring payment {} (status {}, next run {})",
                saved.getId(), saved.getStatus().key(), saved.getNextRunAt());
        return saved;
    }

    private static void applyCadence(RecurringPayment current, RecurringPaymentRequest request,
            Frequency requestedFrequency, Instant now) {
        Frequency frequency = requestedFrequency != null ? requestedFrequency : current.getFrequency();
        String timeOfDay = request.getTimeOfDay() != null ? request.getTimeOfDay() : current.getTimeOfDay();
        Integer dayOfWeek = frequency == Frequency.WEEKLY
                ? firstNonNull(request.getDayOfWeek(), current.getDayOfWeek(), ScheduleCalculator.DEFAULT_DAY_OF_WEEK)
                : null;
        Integer dayOfMonth = frequency == Frequency.MONTHLY
                ? firstNonNull(request.getDayOfMonth(), current.getDayOfMonth(),
                        ScheduleCalculator.DEFAULT_DAY_OF_MONTH)
                : null;
        validateCadence(timeOfDay, dayOfWeek, dayOfMonth);
        current.setFrequency(frequency);
        current.setTimeOfDay(timeOfDay);
        current.setDayOfWeek(dayOfWeek);
        current.setDayOfMonth(dayOfMonth);
        current.setNextRunAt(ScheduleCalculator.nextRunAt(frequency, timeOfDay, dayOfWeek, dayOfMonth, now));
    }

    public void delete(String id) {
        if (!ledger.deleteRecurringPayment(id)) {
            throw new RecurringPaymentNotFoundException(id);
        }
        log.info("Deleted recurring payment {}", id);
    }

    // --- Validation ---

    private static void requirePayableAddress(Contact contact, String addressId) {
        ContactAddress address = contact.findAddress(addressId)
                .orElseThrow(() -> new RecurringPaymentValidationException("Address does not belong to contact"));
        if (address.getType() == null || !address.getType().supportsRecurring()) {
            throw new RecurringPaymentValidationException(
                    "Only Lightning Address or BOLT12 Offer can be used for recurring payments");
        }
    }

    private static long requirePositiveAmount(Long amountSat) {
        if (amountSat == null || amountSat <= 0) {
            throw new RecurringPaymentValidationException("Amount must be greater than 0");
        }
        return amountSat;
    }

    private static Frequency parseFrequency(String key) {
        Frequency frequency = Frequency.fromKey(key);
        if (frequency == null) {
            throw new RecurringPaymentValidationException("Invalid frequency");
        }
        return frequency;
    }

    private static RecurringStatus parseStatus(String key) {
        RecurringStatus status = RecurringStatus.fromKey(key);
        if (status == null) {
            throw new RecurringPaymentValidationException("Status must be active, paused, or cancelled");
        }
        return status;
    }

    private static void validateCadence(String timeOfDay, Integer dayOfWeek, Integer dayOfMonth) {
        try {
            ScheduleCalculator.parseTimeOfDay(timeOfDay);
        } catch (IllegalArgumentException e) {
            throw new RecurringPaymentValidationException("Time of day must be HH:mm");
        }
        if (dayOfWeek != null && (dayOfWeek < 0 || dayOfWeek > 6)) {
            throw new RecurringPaymentValidationException("Day of week must be between 0 and 6");
        }
        if (dayOfMonth != null && (dayOfMonth < 1 || dayOfMonth > 31)) {
            throw new RecurringPaymentValidationException("Day of month must be between 1 and 31");
        }
    }

    private static Integer orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static Integer firstNonNull(Integer first, Integer second, int fallback) {
        if (first != null)
            return first;
        return second != null ? second : fallback;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
