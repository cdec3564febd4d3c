package com.phoenixdash.gateway.phoenixd;

/**
 * Sends outgoing Lightning payments. Implementations must report a failure
 * wrapped inside a successful transport response as a {@link GatewayException}.
 */
public interface PaymentGateway {

    /** Pay a Lightning Address ({@code user@domain}). */
    PaymentResult payToAddress(String address, long amountSat, String message);

    /** Pay a reusable BOLT12 offer. */
    PaymentResult payOffer(String offer, long amountSat, String message);

    /**
     * Pay a BOLT11 invoice.
     *
     * @param amountSat only needed for amountless invoices, may be null
     */
    PaymentResult payInvoice(String invoice, Long amountSat);
}
