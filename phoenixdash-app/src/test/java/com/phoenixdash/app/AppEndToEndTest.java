package com.phoenixdash.app;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end flows through the REST layer, the recurring payment service,
 * the file-backed ledger and the phoenixd client.
 */
class AppEndToEndTest extends AppTestSupport {

    private Map<String, Object> weeklyRequest(JsonNode contact, String addressType) {
        Map<String, Object> body = new HashMap<>();
        body.put("contactId", contact.get("id").asText());
        body.put("addressId", addressId(contact, addressType));
        body.put("amountSat", 1000);
        body.put("frequency", "weekly");
        body.put("dayOfWeek", 3);
        body.put("timeOfDay", "10:30");
        return body;
    }

    // =========================================================================
    // Health
    // =========================================================================

    @Test
    void healthReportsSchedulerAndActiveConnection() {
        Reply reply = get("/health");

        assertEquals(200, reply.status());
        assertEquals("ok", reply.body().get("status").asText());
        assertFalse(reply.body().get("scheduler").get("running").asBoolean());
        assertEquals(NODE_NAME, reply.body().get("activeConnection").asText());
    }

    // =========================================================================
    // CRUD
    // =========================================================================

    @Test
    void createReturns201WithComputedSchedule() {
        JsonNode contact = createContact("Alice");

        Reply reply = post("/api/recurring-payments", weeklyRequest(contact, "lightning_address"));

        assertEquals(201, reply.status());
        JsonNode created = reply.body();
        assertNotNull(created.get("id").asText());
        assertEquals("weekly", created.get("frequency").asText());
        assertEquals(3, created.get("dayOfWeek").asInt());
        assertTrue(created.get("dayOfMonth") == null || created.get("dayOfMonth").isNull());
        assertEquals("active", created.get("status").asText());
        assertEquals("test-node", created.get("connectionId").asText());
        assertFalse(created.get("nextRunAt").isNull());
    }

    @Test
    void getUnknownIdIs404() {
        Reply reply = get("/api/recurring-payments/does-not-exist");

        assertEquals(404, reply.status());
        assertEquals("Recurring payment not found", reply.body().get("error").asText());
    }

    @Test
    void invalidAmountIs400() {
        JsonNode contact = createContact("Bob");
        Map<String, Object> body = weeklyRequest(contact, "lightning_address");
        body.put("amountSat", 0);

        Reply reply = post("/api/recurring-payments", body);

        assertEquals(400, reply.status());
        assertEquals("Amount must be greater than 0", reply.body().get("error").asText());
    }

    @Test
    void unknownContactIs404() {
        Map<String, Object> body = new HashMap<>();
        body.put("contactId", "nobody");
        body.put("addressId", "nothing");
        body.put("amountSat", 10);
        body.put("frequency", "daily");

        Reply reply = post("/api/recurring-payments", body);

        assertEquals(404, reply.status());
        assertEquals("Contact not found", reply.body().get("error").asText());
    }

    @Test
    void updatePausesAndListFiltersByStatus() {
        JsonNode contact = createContact("Carol");
        String id = post("/api/recurring-payments", weeklyRequest(contact, "lightning_address"))
                .body().get("id").asText();

        Reply updated = put("/api/recurring-payments/" + id, Map.of("status", "paused"));
        assertEquals(200, updated.status());
        assertEquals("paused", updated.body().get("status").asText());

        Reply paused = get("/api/recurring-payments?status=paused&contactId=" + contact.get("id").asText());
        assertEquals(1, paused.body().size());
        assertEquals(id, paused.body().get(0).get("id").asText());

        Reply bad = put("/api/recurring-payments/" + id, Map.of("status", "sleeping"));
        assertEquals(400, bad.status());
        assertEquals("Status must be active, paused, or cancelled", bad.body().get("error").asText());
    }

    @Test
    void deleteRemovesSchedule() {
        JsonNode contact = createContact("Dave");
        String id = post("/api/recurring-payments", weeklyRequest(contact, "lightning_address"))
                .body().get("id").asText();

        Reply deleted = delete("/api/recurring-payments/" + id);

        assertEquals(200, deleted.status());
        assertTrue(deleted.body().get("success").asBoolean());
        assertEquals("Recurring payment deleted", deleted.body().get("message").asText());
        assertEquals(404, get("/api/recurring-payments/" + id).status());
        assertEquals(404, delete("/api/recurring-payments/" + id).status());
    }

    @Test
    void negativeExecutionLimitIs400() {
        JsonNode contact = createContact("Erin");
        String id = post("/api/recurring-payments", weeklyRequest(contact, "lightning_address"))
                .body().get("id").asText();

        assertEquals(400, get("/api/recurring-payments/" + id + "/executions?limit=-1").status());
    }

    // =========================================================================
    // Manual execution
    // =========================================================================

    @Test
    void successfulRunPaysAddressAndRecordsExecution() throws Exception {
        JsonNode contact = createContact("Frank");
        String id = post("/api/recurring-payments", weeklyRequest(contact, "lightning_address"))
                .body().get("id").asText();
        enqueuePaid("pay-frank");

        Reply result = post("/api/recurring-payments/" + id + "/execute", Map.of());

        assertEquals(200, result.status());
        assertTrue(result.body().get("success").asBoolean());
        assertEquals("pay-frank", result.body().get("paymentId").asText());

        RecordedRequest request = phoenixd.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/paylnaddress", request.getPath());
        String form = request.getBody().readUtf8();
        assertTrue(form.contains("address=frank%40example.com"), form);
        assertTrue(form.contains("amountSat=1000"), form);

        JsonNode schedule = get("/api/recurring-payments/" + id).body();
        assertEquals(1000, schedule.get("totalPaid").asLong());
        assertEquals(1, schedule.get("paymentCount").asInt());
        assertTrue(schedule.get("lastError") == null || schedule.get("lastError").isNull());

        JsonNode executions = get("/api/recurring-payments/" + id + "/executions").body();
        assertEquals(1, executions.size());
        assertEquals("success", executions.get(0).get("status").asText());
        assertEquals("pay-frank", executions.get(0).get("paymentId").asText());
    }

    @Test
    void pausedScheduleStillRunsWhenTriggeredManually() throws Exception {
        JsonNode contact = createContact("Grace");
        String id = post("/api/recurring-payments", weeklyRequest(contact, "bolt12_offer"))
                .body().get("id").asText();
        put("/api/recurring-payments/" + id, Map.of("status", "paused"));
        enqueuePaid("pay-grace");

        Reply result = post("/api/recurring-payments/" + id + "/execute", Map.of());

        assertTrue(result.body().get("success").asBoolean());
        RecordedRequest request = phoenixd.takeRequest(5, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/payoffer", request.getPath());
    }

    @Test
    void nodeFailureIsRecordedOnTheSchedule() throws Exception {
        JsonNode contact = createContact("Heidi");
        String id = post("/api/recurring-payments", weeklyRequest(contact, "bolt12_offer"))
                .body().get("id").asText();
        phoenixd.enqueue(new okhttp3.mockwebserver.MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"reason\":\"insufficient funds\"}"));

        Reply result = post("/api/recurring-payments/" + id + "/execute", Map.of());

        assertEquals(200, result.status());
        assertFalse(result.body().get("success").asBoolean());
        assertEquals("insufficient funds", result.body().get("error").asText());
        assertNotNull(phoenixd.takeRequest(5, TimeUnit.SECONDS));

        JsonNode schedule = get("/api/recurring-payments/" + id).body();
        assertEquals("insufficient funds", schedule.get("lastError").asText());
        assertEquals(0, schedule.get("paymentCount").asInt());

        JsonNode executions = get("/api/recurring-payments/" + id + "/executions").body();
        assertEquals(1, executions.size());
        assertEquals("failed", executions.get(0).get("status").asText());
    }

    @Test
    void executeUnknownScheduleIs404() {
        Reply reply = post("/api/recurring-payments/missing/execute", Map.of());

        assertEquals(404, reply.status());
    }
}
