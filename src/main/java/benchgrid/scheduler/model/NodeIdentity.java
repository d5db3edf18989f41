package benchgrid.scheduler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A registered node: hostname or connection address, plus when it first registered.
 */
public record NodeIdentity(String id, Instant registeredAt) {

    public NodeIdentity {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(registeredAt, "registeredAt is required");
    }
}
