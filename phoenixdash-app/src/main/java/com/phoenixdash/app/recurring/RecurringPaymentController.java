package com.phoenixdash.app.recurring;

import com.phoenixdash.gateway.recurring.ExecutionRecord;
import com.phoenixdash.gateway.recurring.ExecutionResult;
import com.phoenixdash.gateway.recurring.RecurringPayment;
import com.phoenixdash.gateway.recurring.RecurringPaymentRequest;
import com.phoenixdash.gateway.recurring.RecurringPaymentScheduler;
import com.phoenixdash.gateway.recurring.RecurringPaymentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoints for managing and manually running recurring payments.
 */
@Slf4j
@RestController
@RequestMapping("/api/recurring-payments")
public class RecurringPaymentController {

    private final RecurringPaymentService service;
    private final RecurringPaymentScheduler scheduler;

    public RecurringPaymentController(RecurringPaymentService service, RecurringPaymentScheduler scheduler) {
        this.service = service;
        this.scheduler = scheduler;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    @GetMapping
    public List<RecurringPayment> list(@RequestParam(required = false) String status,
            @RequestParam(required = false) String contactId,
            @RequestParam(defaultValue = "false") boolean showAll) {
        return service.list(status, contactId, showAll);
    }

    @GetMapping("/{id}")
    public RecurringPayment get(@PathVariable String id) {
        return service.get(id);
    }

    @GetMapping("/{id}/executions")
    public List<ExecutionRecord> executions(@PathVariable String id,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return service.listExecutions(id, limit, offset);
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    @PostMapping
    public ResponseEntity<RecurringPayment> create(@RequestBody RecurringPaymentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @PutMapping("/{id}")
    public RecurringPayment update(@PathVariable String id, @RequestBody RecurringPaymentRequest request) {
        return service.update(id, request);
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(@PathVariable String id) {
        service.delete(id);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("message", "Recurring payment deleted");
        return result;
    }

    /**
     * Run a schedule now, whatever its status. Failed and rejected runs are
     * reported in the body with {@code success: false}.
     */
    @PostMapping("/{id}/execute")
    public ExecutionResult execute(@PathVariable String id) {
        log.info("Manual execution requested for recurring payment {}", id);
        return scheduler.executeNow(id);
    }
}
