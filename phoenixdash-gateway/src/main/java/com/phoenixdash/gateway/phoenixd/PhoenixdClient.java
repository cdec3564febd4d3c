package com.phoenixdash.gateway.phoenixd;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenixdash.gateway.node.NodeConnection;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * phoenixd HTTP API client bound to a single node connection.
 * Requests use HTTP Basic auth (empty user, connection password) and
 * form-encoded bodies.
 */
@Slf4j
public class PhoenixdClient implements PaymentGateway {

    /**
     * Fragments phoenixd uses when it cannot reach the recipient's Lightning
     * Address domain. Only these make a payment eligible for LNURL fallback.
     */
    static final List<String> ADDRESS_CONNECTIVITY_MARKERS = List.of("could not connect", "cannot resolve");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final NodeConnection connection;

    public PhoenixdClient(OkHttpClient httpClient, ObjectMapper objectMapper, NodeConnection connection) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.connection = connection;
    }

    /**
     * Build the shared HTTP client. The call timeout bounds the whole request,
     * payment settlement included.
     */
    public static OkHttpClient newHttpClient(Duration connectTimeout, Duration callTimeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(callTimeout)
                .callTimeout(callTimeout)
                .build();
    }

    public NodeConnection getConnection() {
        return connection;
    }

    @Override
    public PaymentResult payToAddress(String address, long amountSat, String message) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("address", address);
        form.put("amountSat", amountSat);
        form.put("message", message);
        return pay("/paylnaddress", form);
    }

    @Override
    public PaymentResult payOffer(String offer, long amountSat, String message) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("offer", offer);
        form.put("amountSat", amountSat);
        form.put("message", message);
        return pay("/payoffer", form);
    }

    @Override
    public PaymentResult payInvoice(String invoice, Long amountSat) {
        Map<String, Object> form = new LinkedHashMap<>();
        form.put("invoice", invoice);
        form.put("amountSat", amountSat);
        return pay("/payinvoice", form);
    }

    private PaymentResult pay(String endpoint, Map<String, Object> form) {
        JsonNode body = post(endpoint, form);

        // phoenixd answers 200 for failed payments and puts the cause in "reason"
        String reason = text(body, "reason");
        if (reason != null && !reason.isBlank()) {
            throw new GatewayException(classify(reason, GatewayErrorKind.PAYMENT_FAILED), reason);
        }

        String paymentId = text(body, "paymentId");
        if (paymentId == null || paymentId.isBlank()) {
            throw new GatewayException(GatewayErrorKind.INVALID_RESPONSE,
                    "Payment succeeded but no paymentId returned");
        }
        return new PaymentResult(
                paymentId,
                text(body, "paymentHash"),
                body.path("recipientAmountSat").asLong(),
                body.path("routingFeeSat").asLong(),
                text(body, "paymentPreimage"));
    }

    private JsonNode post(String endpoint, Map<String, Object> form) {
        HttpUrl url = HttpUrl.parse(trimTrailingSlash(connection.getUrl()) + endpoint);
        if (url == null) {
            throw new GatewayException(GatewayErrorKind.NODE_UNAVAILABLE,
                    "Invalid phoenixd URL: " + connection.getUrl());
        }

        FormBody.Builder formBody = new FormBody.Builder();
        form.forEach((key, value) -> {
            if (value != null) {
                formBody.add(key, String.valueOf(value));
            }
        });

        Request request = new Request.Builder()
                .url(url)
                .header("Authorization", Credentials.basic("", nullToEmpty(connection.getPassword())))
                .post(formBody.build())
                .build();

        log.debug("phoenixd POST {} via {}", endpoint, connection.getName());
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody != null ? responseBody.string() : "";

            if (!response.isSuccessful()) {
                String message = "Phoenixd API error: " + response.code() + " - " + raw;
                throw new GatewayException(classify(raw, GatewayErrorKind.NODE_REJECTED), message);
            }
            try {
                JsonNode node = objectMapper.readTree(raw);
                if (node == null || !node.isObject()) {
                    throw new GatewayException(GatewayErrorKind.INVALID_RESPONSE,
                            "Unexpected phoenixd response: " + abbreviate(raw));
                }
                return node;
            } catch (IOException e) {
                throw new GatewayException(GatewayErrorKind.INVALID_RESPONSE,
                        "Unexpected phoenixd response: " + abbreviate(raw), e);
            }
        } catch (InterruptedIOException e) {
            throw new GatewayException(GatewayErrorKind.TIMEOUT,
                    "phoenixd request " + endpoint + " timed out", e);
        } catch (IOException e) {
            throw new GatewayException(GatewayErrorKind.NODE_UNAVAILABLE,
                    "Cannot reach phoenixd at " + connection.getUrl() + ": " + e.getMessage(), e);
        }
    }

    static GatewayErrorKind classify(String message, GatewayErrorKind otherwise) {
        if (message == null) {
            return otherwise;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : ADDRESS_CONNECTIVITY_MARKERS) {
            if (lower.contains(marker)) {
                return GatewayErrorKind.ADDRESS_UNREACHABLE;
            }
        }
        return otherwise;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String trimTrailingSlash(String url) {
        if (url == null)
            return "";
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
