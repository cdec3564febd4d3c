package com.phoenixdash.gateway.events;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process fan-out of payment events. Listener failures are logged and
 * never reach the publisher.
 */
@Slf4j
public class PaymentEventBus implements PaymentEventNotifier {

    private final Set<Consumer<PaymentEvent>> listeners = new CopyOnWriteArraySet<>();
    private final AtomicLong seq = new AtomicLong();

    @Override
    public void publish(String type, Object payload) {
        PaymentEvent event = new PaymentEvent(seq.incrementAndGet(), type, System.currentTimeMillis(), payload);
        for (Consumer<PaymentEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.warn("Payment event listener failed for {}: {}", type, e.getMessage());
            }
        }
    }

    /**
     * Register a listener.
     *
     * @return a Runnable that removes the listener when called
     */
    public Runnable onEvent(Consumer<PaymentEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }
}
