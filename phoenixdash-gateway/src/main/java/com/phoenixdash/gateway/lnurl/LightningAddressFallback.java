package com.phoenixdash.gateway.lnurl;

import com.phoenixdash.gateway.phoenixd.PaymentGateway;
import com.phoenixdash.gateway.phoenixd.PaymentResult;

/**
 * Second route for paying a Lightning Address when the node cannot reach the
 * address domain itself.
 */
@FunctionalInterface
public interface LightningAddressFallback {

    /**
     * @throws LnurlResolutionException if the address cannot be resolved to an invoice
     */
    PaymentResult pay(PaymentGateway gateway, String address, long amountSat, String comment);
}
