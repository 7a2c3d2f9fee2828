package com.squadron.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for agent and worktree lifecycle events.
 * <p>
 * A subscription can be narrowed to one scope (an agent id or a repository name) and to a
 * set of event types. Events are delivered synchronously on the publishing thread, in
 * subscription order. A subscriber that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    /** scopeId null matches every scope; an empty type set matches every type */
    private record Registration(String scopeId, Set<SquadronEventType> types, Consumer<SquadronEvent> consumer) {

        boolean matches(SquadronEvent event) {
            return (scopeId == null || scopeId.equals(event.scopeId()))
                    && (types.isEmpty() || types.contains(event.eventType()));
        }
    }

    public void publish(SquadronEvent event) {
        log.debug("Publishing event: {} for scope {}", event.eventType(), event.scopeId());
        for (Registration registration : registrations) {
            if (registration.matches(event)) {
                deliverSafely(registration.consumer(), event);
            }
        }
    }

    /**
     * Subscribe to every event of one scope.
     *
     * @param scopeId  the agent id or repository name to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String scopeId, Consumer<SquadronEvent> consumer) {
        return register(new Registration(scopeId, Set.of(), consumer));
    }

    /**
     * Subscribe to selected event types.
     *
     * @param scopeId the scope to listen to, or null for every scope
     * @param types   event types to deliver; must not be empty
     */
    public Subscription subscribe(String scopeId, Set<SquadronEventType> types, Consumer<SquadronEvent> consumer) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        return register(new Registration(scopeId, EnumSet.copyOf(types), consumer));
    }

    /** Subscribe to every event regardless of scope. */
    public Subscription subscribeAll(Consumer<SquadronEvent> consumer) {
        return register(new Registration(null, Set.of(), consumer));
    }

    public int subscriberCount() {
        return registrations.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        log.debug("Subscribed to {} (types {})",
                registration.scopeId() != null ? "scope " + registration.scopeId() : "all scopes",
                registration.types().isEmpty() ? "all" : registration.types());
        return () -> registrations.remove(registration);
    }

    private void deliverSafely(Consumer<SquadronEvent> subscriber, SquadronEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
