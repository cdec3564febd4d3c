package com.phoenixdash.gateway.events;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotifier implements PaymentEventNotifier {

    public record Published(String type, Object payload) {
    }

    private final List<Published> published = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String type, Object payload) {
        published.add(new Published(type, payload));
    }

    public List<Published> published() {
        return published;
    }

    public long count(String type) {
        return published.stream().filter(p -> p.type().equals(type)).count();
    }
}
