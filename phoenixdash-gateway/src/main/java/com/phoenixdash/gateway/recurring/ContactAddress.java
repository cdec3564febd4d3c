package com.phoenixdash.gateway.recurring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactAddress {
    private String id;
    private String address;
    private AddressType type;
    private String label;
    private boolean primary;
}
