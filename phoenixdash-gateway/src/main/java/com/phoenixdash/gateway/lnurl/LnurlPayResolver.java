package com.phoenixdash.gateway.lnurl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenixdash.common.infra.SsrfGuard;
import com.phoenixdash.gateway.phoenixd.PaymentGateway;
import com.phoenixdash.gateway.phoenixd.PaymentResult;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Resolves a Lightning Address locally through LNURL-pay (LUD-06 / LUD-16)
 * and pays the returned invoice through the gateway. Used when phoenixd
 * cannot reach the address domain itself.
 */
@Slf4j
public class LnurlPayResolver implements LightningAddressFallback {

    static final String PAY_REQUEST_TAG = "payRequest";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final SsrfGuard.SsrfPolicy policy;
    private final String scheme;

    public LnurlPayResolver(OkHttpClient httpClient, ObjectMapper objectMapper,
            SsrfGuard.SsrfPolicy policy, String scheme) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.policy = policy;
        this.scheme = scheme;
    }

    /**
     * Resolve {@code address} to an invoice for {@code amountSat} and pay it.
     *
     * @throws LnurlResolutionException if any resolution step fails
     */
    @Override
    public PaymentResult pay(PaymentGateway gateway, String address, long amountSat, String comment) {
        String invoice = requestInvoice(address, amountSat, comment);
        log.info("Paying invoice for {} via local LNURL resolution", address);
        return gateway.payInvoice(invoice, null);
    }

    /**
     * Run the metadata and callback round trips and return the BOLT11 invoice.
     */
    public String requestInvoice(String address, long amountSat, String comment) {
        LightningAddress parsed = LightningAddress.parse(address);
        String metadataUrl = parsed.wellKnownUrl(scheme);

        log.info("Fetching LNURL metadata from {}", metadataUrl);
        JsonNode metadata = getJson(metadataUrl, "Failed to fetch LNURL");

        if ("ERROR".equalsIgnoreCase(metadata.path("status").asText())) {
            throw new LnurlResolutionException("LNURL error: " + metadata.path("reason").asText("unknown"));
        }
        if (!PAY_REQUEST_TAG.equals(metadata.path("tag").asText())) {
            throw new LnurlResolutionException("Not a valid LNURL-pay endpoint");
        }

        // LNURL amounts are millisatoshis
        long amountMsat = amountSat * 1000;
        long minSendable = metadata.path("minSendable").asLong(0);
        long maxSendable = metadata.path("maxSendable").asLong(0);
        if (minSendable > 0 && amountMsat < minSendable) {
            throw new LnurlResolutionException("Amount too low. Minimum: " + minSendable / 1000 + " sats");
        }
        if (maxSendable > 0 && amountMsat > maxSendable) {
            throw new LnurlResolutionException("Amount too high. Maximum: " + maxSendable / 1000 + " sats");
        }

        String callback = metadata.path("callback").asText(null);
        HttpUrl callbackUrl = callback != null ? HttpUrl.parse(callback) : null;
        if (callbackUrl == null) {
            throw new LnurlResolutionException("LNURL-pay response has no valid callback");
        }

        HttpUrl.Builder invoiceUrl = callbackUrl.newBuilder()
                .setQueryParameter("amount", Long.toString(amountMsat));
        long commentAllowed = metadata.path("commentAllowed").asLong(0);
        if (comment != null && !comment.isEmpty() && commentAllowed > 0 && comment.length() <= commentAllowed) {
            invoiceUrl.setQueryParameter("comment", comment);
        }

        log.info("Requesting invoice from {}", callbackUrl.host());
        JsonNode invoice = getJson(invoiceUrl.build().toString(), "Failed to get invoice");
        String pr = invoice.path("pr").asText("");
        if ("ERROR".equalsIgnoreCase(invoice.path("status").asText()) || pr.isBlank()) {
            String reason = invoice.path("reason").asText("");
            throw new LnurlResolutionException("Failed to get invoice from Lightning Address"
                    + (reason.isBlank() ? "" : ": " + reason));
        }
        return pr;
    }

    private JsonNode getJson(String url, String failurePrefix) {
        HttpUrl httpUrl = HttpUrl.parse(url);
        if (httpUrl == null) {
            throw new LnurlResolutionException("Invalid LNURL endpoint: " + url);
        }
        try {
            SsrfGuard.assertPublicHostname(httpUrl.host(), policy);
        } catch (SsrfGuard.SsrfBlockedError e) {
            throw new LnurlResolutionException(e.getMessage(), e);
        }

        Request request = new Request.Builder().url(httpUrl).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new LnurlResolutionException(failurePrefix + ": " + response.code());
            }
            ResponseBody body = response.body();
            JsonNode node = objectMapper.readTree(body != null ? body.string() : "");
            if (node == null || !node.isObject()) {
                throw new LnurlResolutionException(failurePrefix + ": response is not a JSON object");
            }
            return node;
        } catch (InterruptedIOException e) {
            throw new LnurlResolutionException(failurePrefix + ": request timed out", e);
        } catch (IOException e) {
            throw new LnurlResolutionException(failurePrefix + ": " + e.getMessage(), e);
        }
    }
}
