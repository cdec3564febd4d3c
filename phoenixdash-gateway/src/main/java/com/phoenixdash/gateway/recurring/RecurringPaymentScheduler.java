package com.phoenixdash.gateway.recurring;

import com.phoenixdash.gateway.node.NodeConnection;
import com.phoenixdash.gateway.node.NodeConnectionRegistry;
import com.phoenixdash.gateway.phoenixd.PaymentGateway;
import com.phoenixdash.gateway.phoenixd.PaymentGatewayFactory;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the ledger for due recurring payments on a single daemon thread and
 * runs them one after another against the active node connection.
 */
@Slf4j
public class RecurringPaymentScheduler {

    private final ExecutionLedger ledger;
    private final NodeConnectionRegistry connections;
    private final PaymentGatewayFactory gateways;
    private final RecurringPaymentExecutor executor;
    private final ScheduleLocks locks;
    private final Clock clock;
    private final long itemDelayMs;

    private ScheduledExecutorService timer;
    private volatile Instant lastTickAt;

    public RecurringPaymentScheduler(ExecutionLedger ledger, NodeConnectionRegistry connections,
            PaymentGatewayFactory gateways, RecurringPaymentExecutor executor, long itemDelayMs) {
        this(ledger, connections, gateways, executor, new ScheduleLocks(), Clock.systemUTC(), itemDelayMs);
    }

    public RecurringPaymentScheduler(ExecutionLedger ledger, NodeConnectionRegistry connections,
            PaymentGatewayFactory gateways, RecurringPaymentExecutor executor, ScheduleLocks locks,
            Clock clock, long itemDelayMs) {
        this.ledger = ledger;
        this.connections = connections;
        this.gateways = gateways;
        this.executor = executor;
        this.locks = locks;
        this.clock = clock;
        this.itemDelayMs = itemDelayMs;
    }

    // --- Lifecycle ---

    /**
     * Start polling. The first tick runs immediately.
     */
    public synchronized void start(long intervalMs) {
        if (timer != null) {
            log.info("Recurring payment scheduler already running");
            return;
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Scheduler interval must be positive: " + intervalMs);
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recurring-scheduler");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleWithFixedDelay(this::tick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Recurring payment scheduler started (checking every {}s)", intervalMs / 1000.0);
    }

    /**
     * Stop polling. A tick in progress is allowed to finish; the wait happens
     * outside the monitor so {@link #isRunning()} answers meanwhile.
     */
    public void stop() {
        ScheduledExecutorService stopping;
        synchronized (this) {
            if (timer == null) {
                return;
            }
            stopping = timer;
            timer = null;
        }
        stopping.shutdown();
        try {
            if (!stopping.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Recurring payment tick still running after 30s, leaving it to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Recurring payment scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return timer != null;
    }

    public Optional<Instant> getLastTickAt() {
        return Optional.ofNullable(lastTickAt);
    }

    // --- Polling ---

    private void tick() {
        try {
            processDuePayments();
        } catch (Exception e) {
            // a throwing task would cancel the periodic schedule
            log.error("Error processing due recurring payments", e);
        }
    }

    /**
     * Run one polling pass.
     *
     * @return number of schedules handed to the executor
     */
    public int processDuePayments() {
        Instant now = clock.instant();
        lastTickAt = now;

        Optional<NodeConnection> active = connections.getActiveConnection();
        if (active.isEmpty()) {
            log.info("No active phoenixd connection, skipping recurring payment processing");
            return 0;
        }
        NodeConnection connection = active.get();

        List<DuePayment> due = ledger.findDue(now, connection.getId());
        if (due.isEmpty()) {
            return 0;
        }
        log.info("Processing {} due recurring payment(s) for connection: {}", due.size(), connection.getName());

        PaymentGateway gateway = gateways.forConnection(connection);
        int executed = 0;
        for (int i = 0; i < due.size(); i++) {
            if (i > 0 && !pause()) {
                log.info("Recurring payment tick interrupted, {} payment(s) left for the next tick",
                        due.size() - i);
                break;
            }
            DuePayment item = due.get(i);
            if (runLocked(item.schedule().getId(), now, gateway).isPresent()) {
                executed++;
            }
        }
        return executed;
    }

    private Optional<ExecutionResult> runLocked(String id, Instant now, PaymentGateway gateway) {
        if (!locks.tryAcquire(id)) {
            log.info("Recurring payment {} is already executing, skipping", id);
            return Optional.empty();
        }
        try {
            // the due list may be stale by now: re-read under the lock
            Optional<DuePayment> current = ledger.findForExecution(id).filter(d -> isStillDue(d.schedule(), now));
            if (current.isEmpty()) {
                log.info("Recurring payment {} changed since the due query, skipping", id);
                return Optional.empty();
            }
            DuePayment item = current.get();
            log.info("Executing recurring payment {} for {} ({} sats)", id,
                    item.contact() != null ? item.contact().getName() : item.schedule().getContactId(),
                    item.schedule().getAmountSat());
            return Optional.of(executor.execute(item, gateway));
        } catch (Exception e) {
            log.error("Error executing recurring payment {}", id, e);
            return Optional.of(ExecutionResult.rejected(e.getMessage()));
        } finally {
            locks.release(id);
        }
    }

    private static boolean isStillDue(RecurringPayment schedule, Instant now) {
        return schedule.getStatus() == RecurringStatus.ACTIVE
                && schedule.getNextRunAt() != null
                && !schedule.getNextRunAt().isAfter(now);
    }

    private boolean pause() {
        if (itemDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(itemDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // --- Manual execution ---

    /**
     * Execute one schedule now, regardless of its due time or status.
     *
     * @throws RecurringPaymentNotFoundException if the schedule does not exist
     * @throws LedgerException                   if the outcome could not be recorded
     */
    public ExecutionResult executeNow(String recurringPaymentId) {
        if (ledger.findRecurringPayment(recurringPaymentId).isEmpty()) {
            throw new RecurringPaymentNotFoundException(recurringPaymentId);
        }

        Optional<NodeConnection> active = connections.getActiveConnection();
        if (active.isEmpty()) {
            return ExecutionResult.rejected("No active phoenixd connection");
        }
        if (!locks.tryAcquire(recurringPaymentId)) {
            return ExecutionResult.rejected("Recurring payment is already executing");
        }
        try {
            DuePayment item = ledger.findForExecution(recurringPaymentId)
                    .orElseThrow(() -> new RecurringPaymentNotFoundException(recurringPaymentId));
            log.info("Manual execution of recurring payment {} via {}", recurringPaymentId, active.get().getName());
            return executor.execute(item, gateways.forConnection(active.get()));
        } finally {
            locks.release(recurringPaymentId);
        }
    }
}
