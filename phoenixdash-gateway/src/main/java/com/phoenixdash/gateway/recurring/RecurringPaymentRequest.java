package com.phoenixdash.gateway.recurring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Create/update payload for a recurring payment. On update a null field means
 * "leave unchanged" and an empty note or categoryId clears it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecurringPaymentRequest {
    private String contactId;
    private String addressId;
    private Long amountSat;
    private String frequency;
    private Integer dayOfWeek;
    private Integer dayOfMonth;
    private String timeOfDay;
    private String note;
    private String categoryId;
    /** Update only. */
    private String status;
}
