package io.queuedservices.listener.endpoint;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered behavior collection of a {@link ServiceEndpoint}. Insertion order is preserved.
 */
public final class EndpointBehaviors implements Iterable<EndpointBehavior> {

    private final List<EndpointBehavior> behaviors = new ArrayList<>();

    public EndpointBehaviors add(EndpointBehavior behavior) {
        behaviors.add(Objects.requireNonNull(behavior, "behavior"));
        return this;
    }

    public EndpointBehaviors addAll(List<? extends EndpointBehavior> additional) {
        Objects.requireNonNull(additional, "additional");
        for (EndpointBehavior behavior : additional) {
            add(behavior);
        }
        return this;
    }

    /**
     * Returns the first behavior of the given type.
     */
    public <T extends EndpointBehavior> Optional<T> find(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return behaviors.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .findFirst();
    }

    public int size() {
        return behaviors.size();
    }

    public boolean isEmpty() {
        return behaviors.isEmpty();
    }

    public List<EndpointBehavior> asList() {
        return List.copyOf(behaviors);
    }

    @Override
    public Iterator<EndpointBehavior> iterator() {
        return asList().iterator();
    }
}
