package com.phoenixdash.gateway.lnurl;

/**
 * A parsed {@code user@domain} Lightning Address.
 */
public record LightningAddress(String user, String domain) {

    /**
     * @throws LnurlResolutionException if the address is not of the form user@domain
     */
    public static LightningAddress parse(String address) {
        if (address == null) {
            throw new LnurlResolutionException("Invalid Lightning Address format");
        }
        String[] parts = address.trim().split("@", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new LnurlResolutionException("Invalid Lightning Address format");
        }
        return new LightningAddress(parts[0], parts[1]);
    }

    /** LUD-16 well-known path for this address. */
    public String wellKnownUrl(String scheme) {
        return scheme + "://" + domain + "/.well-known/lnurlp/" + user;
    }

    @Override
    public String toString() {
        return user + "@" + domain;
    }
}
