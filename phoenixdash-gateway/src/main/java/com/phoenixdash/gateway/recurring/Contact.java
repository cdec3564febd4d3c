package com.phoenixdash.gateway.recurring;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A saved payee with one or more payment addresses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Contact {
    private String id;
    private String name;
    @Builder.Default
    private List<ContactAddress> addresses = new ArrayList<>();

    public Optional<ContactAddress> findAddress(String addressId) {
        if (addressId == null || addresses == null)
            return Optional.empty();
        return addresses.stream().filter(a -> addressId.equals(a.getId())).findFirst();
    }
}
