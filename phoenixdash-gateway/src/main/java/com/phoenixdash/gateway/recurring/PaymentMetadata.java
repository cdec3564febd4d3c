package com.phoenixdash.gateway.recurring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Links an outgoing payment to a contact, note and categories.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentMetadata {
    private String paymentId;
    private String contactId;
    private String note;
    @Builder.Default
    private Set<String> categoryIds = new LinkedHashSet<>();
    private Instant updatedAt;
}
