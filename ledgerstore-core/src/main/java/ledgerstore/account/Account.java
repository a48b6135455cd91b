package ledgerstore.account;

import java.time.Instant;
import java.util.Objects;

import ledgerstore.model.VersionedEntity;

/**
 * A ledger account.
 *
 * <p>{@code externalId} and {@code currencyCode} identify the account in upstream systems
 * and never change after creation. {@code externalGroupId} is optional.
 *
 * @param id              store-assigned identifier, {@code null} before creation
 * @param name            display name
 * @param externalId      caller's identifier, unique per account
 * @param externalGroupId optional grouping key, may be {@code null}
 * @param currencyCode    ISO 4217 code
 * @param accountType     chart-of-accounts category
 * @param createdAt       creation time, {@code null} before creation
 * @param updatedAt       last mutation time, {@code null} before creation
 * @param version         optimistic-lock token, 0 before creation
 */
public record Account(
    String id,
    String name,
    String externalId,
    String externalGroupId,
    String currencyCode,
    AccountType accountType,
    Instant createdAt,
    Instant updatedAt,
    long version
) implements VersionedEntity {

  /**
   * Creates an account that has not been stored yet.
   */
  public static Account newAccount(String name, String externalId, String externalGroupId,
      String currencyCode, AccountType accountType) {
    return new Account(null, name, externalId, externalGroupId, currencyCode, accountType,
        null, null, 0L);
  }

  /**
   * Returns a copy carrying the identity and bookkeeping assigned on insert.
   */
  public Account asCreated(String id, Instant now) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(now, "now");
    return new Account(id, name, externalId, externalGroupId, currencyCode, accountType, now, now, 1L);
  }
}
