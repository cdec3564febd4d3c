package com.phoenixdash.gateway.recurring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A standing payment order to one of a contact's addresses.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecurringPayment {
    private String id;
    private String contactId;
    private String addressId;
    /** Node connection this schedule runs against; null runs on any active connection. */
    private String connectionId;
    private long amountSat;

    private Frequency frequency;
    /** "HH:mm", UTC. */
    @Builder.Default
    private String timeOfDay = "09:00";
    /** 0 = Sunday ... 6 = Saturday; weekly only. */
    private Integer dayOfWeek;
    /** 1-31; monthly only. */
    private Integer dayOfMonth;

    private String note;
    private String categoryId;
    @Builder.Default
    private RecurringStatus status = RecurringStatus.ACTIVE;

    private Instant nextRunAt;
    private Instant lastRunAt;
    private String lastError;
    private long totalPaid;
    private int paymentCount;

    private Instant createdAt;
    private Instant updatedAt;
}
