package com.phoenixdash.gateway.recurring;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * {@link ExecutionLedger} kept in memory and persisted as one JSON document.
 * Each mutation rewrites the file through a temp file and an atomic rename, so
 * the writes of one execution land together or not at all. A failed write rolls
 * the in-memory state back.
 */
@Slf4j
public class JsonFileExecutionLedger implements ExecutionLedger {

    static final String STORE_VERSION = "1";

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Null keeps everything in memory. */
    private final Path storePath;
    private StoreFile state;

    /**
     * Store file schema.
     */
    @Data
    static class StoreFile {
        private String version = STORE_VERSION;
        private Instant savedAt;
        private Map<String, Contact> contacts = new LinkedHashMap<>();
        private Map<String, RecurringPayment> recurringPayments = new LinkedHashMap<>();
        private List<ExecutionRecord> executions = new ArrayList<>();
        private Map<String, PaymentMetadata> paymentMetadata = new LinkedHashMap<>();
    }

    public JsonFileExecutionLedger(Path storePath) {
        this.storePath = storePath;
        this.state = load();
    }

    public static JsonFileExecutionLedger inMemory() {
        return new JsonFileExecutionLedger(null);
    }

    // --- Queries ---

    @Override
    public synchronized List<DuePayment> findDue(Instant now, String connectionId) {
        return state.recurringPayments.values().stream()
                .filter(p -> p.getStatus() == RecurringStatus.ACTIVE)
                .filter(p -> p.getNextRunAt() != null && !p.getNextRunAt().isAfter(now))
                .filter(p -> p.getConnectionId() == null || p.getConnectionId().equals(connectionId))
                .sorted(Comparator.comparing(RecurringPayment::getNextRunAt))
                .map(this::toDuePayment)
                .toList();
    }

    @Override
    public synchronized Optional<DuePayment> findForExecution(String recurringPaymentId) {
        return Optional.ofNullable(state.recurringPayments.get(recurringPaymentId))
                .map(this::toDuePayment);
    }

    private DuePayment toDuePayment(RecurringPayment payment) {
        Contact contact = state.contacts.get(payment.getContactId());
        return new DuePayment(copy(payment, RecurringPayment.class),
                contact != null ? copy(contact, Contact.class) : null);
    }

    @Override
    public synchronized Optional<RecurringPayment> findRecurringPayment(String id) {
        return Optional.ofNullable(state.recurringPayments.get(id)).map(p -> copy(p, RecurringPayment.class));
    }

    @Override
    public synchronized List<RecurringPayment> listRecurringPayments(RecurringStatus status, String contactId,
            String connectionId) {
        return state.recurringPayments.values().stream()
                .filter(p -> status == null || p.getStatus() == status)
                .filter(p -> contactId == null || contactId.equals(p.getContactId()))
                .filter(p -> connectionId == null || p.getConnectionId() == null
                        || connectionId.equals(p.getConnectionId()))
                .sorted(Comparator.comparing(RecurringPayment::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .map(p -> copy(p, RecurringPayment.class))
                .toList();
    }

    @Override
    public synchronized Optional<Contact> findContact(String id) {
        return Optional.ofNullable(state.contacts.get(id)).map(c -> copy(c, Contact.class));
    }

    @Override
    public synchronized List<Contact> listContacts() {
        return state.contacts.values().stream()
                .map(c -> copy(c, Contact.class))
                .sorted(Comparator.comparing(Contact::getName, Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER)))
                .toList();
    }

    @Override
    public synchronized List<ExecutionRecord> listExecutions(String recurringPaymentId, int limit, int offset) {
        return state.executions.stream()
                .filter(e -> e.getRecurringPaymentId().equals(recurringPaymentId))
                .sorted(Comparator.comparing(ExecutionRecord::getExecutedAt).reversed())
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .map(e -> copy(e, ExecutionRecord.class))
                .toList();
    }

    @Override
    public synchronized Optional<PaymentMetadata> findPaymentMetadata(String paymentId) {
        return Optional.ofNullable(state.paymentMetadata.get(paymentId)).map(m -> copy(m, PaymentMetadata.class));
    }

    // --- Mutations ---

    @Override
    public synchronized RecurringPayment saveRecurringPayment(RecurringPayment payment) {
        RecurringPayment stored = copy(payment, RecurringPayment.class);
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        mutate(s -> s.recurringPayments.put(stored.getId(), stored));
        return copy(stored, RecurringPayment.class);
    }

    @Override
    public synchronized Optional<RecurringPayment> updateRecurringPayment(String id,
            UnaryOperator<RecurringPayment> edit) {
        RecurringPayment current = state.recurringPayments.get(id);
        if (current == null) {
            return Optional.empty();
        }
        RecurringPayment edited = copy(edit.apply(copy(current, RecurringPayment.class)), RecurringPayment.class);
        edited.setId(id);
        mutate(s -> s.recurringPayments.put(id, edited));
        return Optional.of(copy(edited, RecurringPayment.class));
    }

    @Override
    public synchronized boolean deleteRecurringPayment(String id) {
        if (!state.recurringPayments.containsKey(id)) {
            return false;
        }
        mutate(s -> {
            s.recurringPayments.remove(id);
            s.executions.removeIf(e -> e.getRecurringPaymentId().equals(id));
        });
        return true;
    }

    @Override
    public synchronized Contact saveContact(Contact contact) {
        Contact stored = copy(contact, Contact.class);
        if (stored.getId() == null) {
            stored.setId(UUID.randomUUID().toString());
        }
        for (ContactAddress address : stored.getAddresses()) {
            if (address.getId() == null) {
                address.setId(UUID.randomUUID().toString());
            }
        }
        mutate(s -> s.contacts.put(stored.getId(), stored));
        return copy(stored, Contact.class);
    }

    @Override
    public synchronized void commit(ExecutionCommit commit) {
        ExecutionRecord record = commit.record();
        boolean replay = state.executions.stream().anyMatch(e -> e.getId().equals(record.getId()));
        if (replay) {
            log.debug("Execution {} already committed, skipping", record.getId());
            return;
        }

        mutate(s -> {
            s.executions.add(copy(record, ExecutionRecord.class));

            RecurringPayment payment = s.recurringPayments.get(record.getRecurringPaymentId());
            if (payment != null) {
                applyUpdate(payment, commit.update(), record.getExecutedAt());
            }

            PaymentMetadata link = commit.metadata();
            if (link != null) {
                upsertMetadata(s, link);
            }
        });
    }

    private static void applyUpdate(RecurringPayment payment, ScheduleUpdate update, Instant at) {
        if (update.nextRunAt() != null) {
            payment.setNextRunAt(update.nextRunAt());
        }
        if (update.lastRunAt() != null) {
            payment.setLastRunAt(update.lastRunAt());
        }
        payment.setLastError(update.lastError());
        payment.setTotalPaid(payment.getTotalPaid() + update.paidDelta());
        payment.setPaymentCount(payment.getPaymentCount() + update.countDelta());
        payment.setUpdatedAt(at);
    }

    private void upsertMetadata(StoreFile s, PaymentMetadata link) {
        PaymentMetadata existing = s.paymentMetadata.get(link.getPaymentId());
        if (existing == null) {
            s.paymentMetadata.put(link.getPaymentId(), copy(link, PaymentMetadata.class));
            return;
        }
        existing.setContactId(link.getContactId());
        existing.setNote(link.getNote());
        existing.getCategoryIds().addAll(link.getCategoryIds());
        existing.setUpdatedAt(link.getUpdatedAt());
    }

    // --- Persistence ---

    private void mutate(Consumer<StoreFile> change) {
        StoreFile snapshot = copy(state, StoreFile.class);
        change.accept(state);
        try {
            persist();
        } catch (IOException e) {
            state = snapshot;
            throw new LedgerException("Failed to write recurring payment store " + storePath, e);
        }
    }

    private void persist() throws IOException {
        if (storePath == null) {
            return;
        }
        Path parent = storePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        state.setSavedAt(Instant.now());
        Path tmp = storePath.resolveSibling(storePath.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), state);
        try {
            Files.move(tmp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, storePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private StoreFile load() {
        if (storePath == null || !Files.exists(storePath)) {
            return new StoreFile();
        }
        try {
            String content = Files.readString(storePath);
            if (content.isBlank()) {
                return new StoreFile();
            }
            StoreFile loaded = mapper.readValue(content, StoreFile.class);
            log.info("Loaded {} recurring payment(s) and {} execution(s) from {}",
                    loaded.recurringPayments.size(), loaded.executions.size(), storePath);
            return loaded;
        } catch (IOException e) {
            throw new LedgerException("Failed to read recurring payment store " + storePath, e);
        }
    }

    private <T> T copy(Object value, Class<T> type) {
        return mapper.convertValue(value, type);
    }
}
