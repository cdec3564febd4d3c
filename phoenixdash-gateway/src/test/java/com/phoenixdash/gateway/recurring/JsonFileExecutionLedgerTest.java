package com.phoenixdash.gateway.recurring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileExecutionLedgerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T10:00:00Z");

    private JsonFileExecutionLedger ledger;
    private Contact alice;

    @BeforeEach
    void setUp() {
        ledger = JsonFileExecutionLedger.inMemory();
        alice = ledger.saveContact(Contact.builder()
                .name("Alice")
                .addresses(List.of(ContactAddress.builder()
                        .address("alice@example.com")
                        .type(AddressType.LIGHTNING_ADDRESS)
                        .build()))
                .build());
    }

    private RecurringPayment schedule(RecurringStatus status, String connectionId, Instant nextRunAt) {
        return ledger.saveRecurringPayment(RecurringPayment.builder()
                .contactId(alice.getId())
                .addressId(alice.getAddresses().get(0).getId())
                .connectionId(connectionId)
                .amountSat(1000)
                .frequency(Frequency.DAILY)
                .status(status)
                .nextRunAt(nextRunAt)
                .createdAt(NOW)
                .build());
    }

    private static ExecutionRecord record(String id, String scheduleId, ExecutionStatus status, Instant at) {
        return ExecutionRecord.builder()
                .id(id)
                .recurringPaymentId(scheduleId)
                .status(status)
                .amountSat(1000)
                .executedAt(at)
                .build();
    }

    @Test
    void saveContactAssignsIds() {
        assertNotNull(alice.getId());
        assertNotNull(alice.getAddresses().get(0).getId());
        assertEquals("Alice", ledger.findContact(alice.getId()).orElseThrow().getName());
    }

    @Nested
    class DueQuery {
        @Test
        void pausedAndCancelledAreNeverDue() {
            schedule(RecurringStatus.PAUSED, null, NOW.minusSeconds(86_400));
            schedule(RecurringStatus.CANCELLED, null, NOW.minusSeconds(60));

            assertTrue(ledger.findDue(NOW, "conn-a").isEmpty());
        }

        @Test
        void futureSchedulesAreNotDue() {
            schedule(RecurringStatus.ACTIVE, null, NOW.plusSeconds(1));
            assertTrue(ledger.findDue(NOW, "conn-a").isEmpty());
        }

        @Test
        void dueAtExactlyNow() {
            RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);
            assertEquals(List.of(p.getId()), ids(ledger.findDue(NOW, "conn-a")));
        }

        @Test
        void affinityToOtherConnectionIsExcluded() {
            schedule(RecurringStatus.ACTIVE, "conn-a", NOW.minusSeconds(3_600));
            RecurringPayment unbound = schedule(RecurringStatus.ACTIVE, null, NOW.minusSeconds(60));
            RecurringPayment bound = schedule(RecurringStatus.ACTIVE, "conn-b", NOW.minusSeconds(120));

            assertEquals(List.of(bound.getId(), unbound.getId()), ids(ledger.findDue(NOW, "conn-b")));
        }

        @Test
        void orderedByDueTime() {
            RecurringPayment later = schedule(RecurringStatus.ACTIVE, null, NOW.minusSeconds(10));
            RecurringPayment earlier = schedule(RecurringStatus.ACTIVE, null, NOW.minusSeconds(500));

            assertEquals(List.of(earlier.getId(), later.getId()), ids(ledger.findDue(NOW, "conn-a")));
        }

        @Test
        void dueItemsCarryTheirContact() {
            schedule(RecurringStatus.ACTIVE, null, NOW);
            DuePayment due = ledger.findDue(NOW, "conn-a").get(0);
            assertEquals("Alice", due.contact().getName());
        }

        @Test
        void scheduleOfDeletedContactIsStillDue() {
            RecurringPayment orphan = ledger.saveRecurringPayment(RecurringPayment.builder()
                    .contactId("deleted-contact")
                    .addressId("ln")
                    .amountSat(1000)
                    .frequency(Frequency.DAILY)
                    .status(RecurringStatus.ACTIVE)
                    .nextRunAt(NOW)
                    .build());

            List<DuePayment> due = ledger.findDue(NOW, "conn-a");

            assertEquals(List.of(orphan.getId()), ids(due));
            assertNull(due.get(0).contact());
            assertNull(ledger.findForExecution(orphan.getId()).orElseThrow().contact());
        }

        private List<String> ids(List<DuePayment> due) {
            return due.stream().map(d -> d.schedule().getId()).toList();
        }
    }

    @Nested
    class Commit {
        @Test
        void appliesRecordUpdateAndMetadataTogether() {
            RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);
            Instant next = NOW.plusSeconds(86_400);
            ExecutionRecord rec = record("exec-1", p.getId(), ExecutionStatus.SUCCESS, NOW);
            rec.setPaymentId("pay-1");
            PaymentMetadata meta = PaymentMetadata.builder()
                    .paymentId("pay-1")
                    .contactId(alice.getId())
                    .note("rent")
                    .categoryIds(Set.of("cat-1"))
                    .updatedAt(NOW)
                    .build();

            ledger.commit(new ExecutionCommit(rec, ScheduleUpdate.succeeded(NOW, next, 1000), meta));

            RecurringPayment stored = ledger.findRecurringPayment(p.getId()).orElseThrow();
            assertEquals(next, stored.getNextRunAt());
            assertEquals(NOW, stored.getLastRunAt());
            assertEquals(1000, stored.getTotalPaid());
            assertEquals(1, stored.getPaymentCount());
            assertNull(stored.getLastError());
            assertEquals(1, ledger.listExecutions(p.getId(), 50, 0).size());
            assertEquals(Set.of("cat-1"), ledger.findPaymentMetadata("pay-1").orElseThrow().getCategoryIds());
        }

        @Test
        void replayedRecordIdIsNoOp() {
            RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);
            ExecutionCommit commit = new ExecutionCommit(record("exec-1", p.getId(), ExecutionStatus.SUCCESS, NOW),
                    ScheduleUpdate.succeeded(NOW, NOW.plusSeconds(60), 1000), null);

            ledger.commit(commit);
            ledger.commit(commit);

            RecurringPayment stored = ledger.findRecurringPayment(p.getId()).orElseThrow();
            assertEquals(1, stored.getPaymentCount());
            assertEquals(1000, stored.getTotalPaid());
            assertEquals(1, ledger.listExecutions(p.getId(), 50, 0).size());
        }

        @Test
        void misconfiguredUpdateKeepsNextRunAt() {
            RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);
            ledger.commit(new ExecutionCommit(record("exec-1", p.getId(), ExecutionStatus.FAILED, NOW),
                    ScheduleUpdate.misconfigured("Address not found on contact"), null));

            RecurringPayment stored = ledger.findRecurringPayment(p.getId()).orElseThrow();
            assertEquals(NOW, stored.getNextRunAt());
            assertEquals("Address not found on contact", stored.getLastError());
        }

        @Test
        void metadataUpsertMergesCategories() {
            PaymentMetadata first = PaymentMetadata.builder().paymentId("pay-1").contactId("c")
                    .categoryIds(Set.of("a")).build();
            PaymentMetadata second = PaymentMetadata.builder().paymentId("pay-1").contactId("c")
                    .note("again").categoryIds(Set.of("b")).build();
            RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);

            ledger.commit(new ExecutionCommit(record("e1", p.getId(), ExecutionStatus.SUCCESS, NOW),
                    ScheduleUpdate.succeeded(NOW, NOW.plusSeconds(60), 1), first));
            ledger.commit(new ExecutionCommit(record("e2", p.getId(), ExecutionStatus.SUCCESS, NOW),
                    ScheduleUpdate.succeeded(NOW, NOW.plusSeconds(120), 1), second));

            PaymentMetadata merged = ledger.findPaymentMetadata("pay-1").orElseThrow();
            assertEquals(Set.of("a", "b"), merged.getCategoryIds());
            assertEquals("again", merged.getNote());
        }
    }

    @Test
    void executionsAreNewestFirstWithPaging() {
        RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);
        for (int i = 0; i < 5; i++) {
            ledger.commit(new ExecutionCommit(record("e" + i, p.getId(), ExecutionStatus.FAILED, NOW.plusSeconds(i)),
                    ScheduleUpdate.failed("boom", NOW.plusSeconds(100 + i)), null));
        }

        List<ExecutionRecord> page = ledger.listExecutions(p.getId(), 2, 1);
        assertEquals(List.of("e3", "e2"), page.stream().map(ExecutionRecord::getId).toList());
    }

    @Test
    void returnedObjectsAreSnapshots() {
        RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);
        p.setAmountSat(999_999);
        assertEquals(1000, ledger.findRecurringPayment(p.getId()).orElseThrow().getAmountSat());
    }

    @Test
    void updateEditsCurrentRow() {
        RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);
        Instant next = NOW.plusSeconds(86_400);
        ledger.commit(new ExecutionCommit(record("e1", p.getId(), ExecutionStatus.SUCCESS, NOW),
                ScheduleUpdate.succeeded(NOW, next, 1000), null));

        RecurringPayment updated = ledger.updateRecurringPayment(p.getId(), current -> {
            current.setNote("rent");
            current.setId("ignored");
            return current;
        }).orElseThrow();

        assertEquals(p.getId(), updated.getId());
        assertEquals("rent", updated.getNote());
        assertEquals(1, updated.getPaymentCount());
        assertEquals(next, ledger.findRecurringPayment(p.getId()).orElseThrow().getNextRunAt());
        assertTrue(ledger.findRecurringPayment("ignored").isEmpty());
    }

    @Test
    void failedUpdateLeavesRowUnchanged() {
        RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);

        assertThrows(IllegalStateException.class, () -> ledger.updateRecurringPayment(p.getId(), current -> {
            current.setAmountSat(5);
            throw new IllegalStateException("rejected");
        }));

        assertEquals(1000, ledger.findRecurringPayment(p.getId()).orElseThrow().getAmountSat());
        assertTrue(ledger.updateRecurringPayment("missing", current -> current).isEmpty());
    }

    @Test
    void deleteRemovesScheduleAndHistory() {
        RecurringPayment p = schedule(RecurringStatus.ACTIVE, null, NOW);
        ledger.commit(new ExecutionCommit(record("e1", p.getId(), ExecutionStatus.FAILED, NOW),
                ScheduleUpdate.failed("x", NOW.plusSeconds(60)), null));

        assertTrue(ledger.deleteRecurringPayment(p.getId()));
        assertFalse(ledger.deleteRecurringPayment(p.getId()));
        assertTrue(ledger.findRecurringPayment(p.getId()).isEmpty());
        assertTrue(ledger.listExecutions(p.getId(), 50, 0).isEmpty());
    }

    @Test
    void listFiltersByStatusContactAndConnection() {
        schedule(RecurringStatus.ACTIVE, "conn-a", NOW);
        schedule(RecurringStatus.PAUSED, null, NOW);
        schedule(RecurringStatus.ACTIVE, "conn-b", NOW);

        assertEquals(2, ledger.listRecurringPayments(RecurringStatus.ACTIVE, null, null).size());
        assertEquals(2, ledger.listRecurringPayments(null, null, "conn-a").size());
        assertEquals(3, ledger.listRecurringPayments(null, alice.getId(), null).size());
        assertEquals(0, ledger.listRecurringPayments(null, "someone-else", null).size());
    }

    @Nested
    class Persistence {
        @TempDir
        Path tempDir;

        @Test
        void stateSurvivesReload() throws Exception {
            Path store = tempDir.resolve("state/recurring-store.json");
            JsonFileExecutionLedger first = new JsonFileExecutionLedger(store);
            Contact bob = first.saveContact(Contact.builder().name("Bob").build());
            RecurringPayment p = first.saveRecurringPayment(RecurringPayment.builder()
                    .contactId(bob.getId())
                    .amountSat(21)
                    .frequency(Frequency.WEEKLY)
                    .dayOfWeek(3)
                    .nextRunAt(NOW)
                    .build());
            first.commit(new ExecutionCommit(record("e1", p.getId(), ExecutionStatus.SUCCESS, NOW),
                    ScheduleUpdate.succeeded(NOW, NOW.plusSeconds(604_800), 21), null));

            assertTrue(Files.exists(store));
            assertFalse(Files.exists(store.resolveSibling("recurring-store.json.tmp")));

            JsonFileExecutionLedger reloaded = new JsonFileExecutionLedger(store);
            RecurringPayment stored = reloaded.findRecurringPayment(p.getId()).orElseThrow();
            assertEquals(Frequency.WEEKLY, stored.getFrequency());
            assertEquals(3, stored.getDayOfWeek());
            assertEquals(21, stored.getTotalPaid());
            assertEquals(NOW.plusSeconds(604_800), stored.getNextRunAt());
            assertEquals(1, reloaded.listExecutions(p.getId(), 10, 0).size());
            assertEquals("Bob", reloaded.findContact(bob.getId()).orElseThrow().getName());
        }

        @Test
        void storeUsesStringKeys() throws Exception {
            Path store = tempDir.resolve("store.json");
            JsonFileExecutionLedger l = new JsonFileExecutionLedger(store);
            Contact c = l.saveContact(Contact.builder().name("Carol").build());
            l.saveRecurringPayment(RecurringPayment.builder().contactId(c.getId()).amountSat(5)
                    .frequency(Frequency.EVERY_5_MINUTES).build());

            String json = Files.readString(store);
            assertTrue(json.contains("\"every_5_minutes\""));
            assertTrue(json.contains("\"active\""));
            assertTrue(json.contains("\"version\" : \"1\""));
        }

        @Test
        void unreadableStoreFails() throws Exception {
            Path store = tempDir.resolve("broken.json");
            Files.writeString(store, "{not json");
            assertThrows(LedgerException.class, () -> new JsonFileExecutionLedger(store));
        }

        @Test
        void failedWriteRollsBack() throws Exception {
            // a directory where the store file should be makes the rename fail
            Path store = tempDir.resolve("store.json");
            JsonFileExecutionLedger l = new JsonFileExecutionLedger(store);
            Contact c = l.saveContact(Contact.builder().name("Dave").build());
            Files.delete(store);
            Files.createDirectories(store.resolve("blocker"));

            assertThrows(LedgerException.class, () -> l.saveRecurringPayment(RecurringPayment.builder()
                    .contactId(c.getId()).amountSat(5).frequency(Frequency.HOURLY).build()));
            assertTrue(l.listRecurringPayments(null, null, null).isEmpty());
        }
    }
}
