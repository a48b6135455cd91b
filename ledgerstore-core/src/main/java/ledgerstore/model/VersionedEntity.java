package ledgerstore.model;

import java.time.Instant;

/**
 * An entity that is mutated only through conditional writes keyed on {@code (id, version)}.
 *
 * <p>{@code version} starts at 1 and every successful mutation increments it by exactly one,
 * so a version number is never reused for the same entity.
 */
public interface VersionedEntity {

  String id();

  long version();

  Instant createdAt();

  Instant updatedAt();
}
