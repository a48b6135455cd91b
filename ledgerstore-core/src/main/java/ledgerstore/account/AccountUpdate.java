package ledgerstore.account;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A set of field changes for one account update.
 *
 * <p>The builder accepts any {@link AccountField}, including immutable ones, so that the
 * repository can reject such requests explicitly rather than drop them. A field set to
 * {@code null} is cleared, which is only valid for optional fields.
 */
public final class AccountUpdate {
  private final Map<AccountField, Object> changes;

  private AccountUpdate(Map<AccountField, Object> changes) {
    this.changes = Collections.unmodifiableMap(new EnumMap<>(changes));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * An update that changes no field and only advances the version.
   */
  public static AccountUpdate none() {
    return new AccountUpdate(new EnumMap<>(AccountField.class));
  }

  /**
   * Changes keyed by field, in declaration order. Values may be {@code null}.
   */
  public Map<AccountField, Object> changes() {
    return changes;
  }

  public Set<AccountField> fields() {
    return changes.keySet();
  }

  public boolean isEmpty() {
    return changes.isEmpty();
  }

  @Override
  public String toString() {
    return "AccountUpdate" + changes;
  }

  public static final class Builder {
    private final Map<AccountField, Object> changes = new EnumMap<>(AccountField.class);

    private Builder() {
    }

    public Builder name(String name) {
      return set(AccountField.NAME, name);
    }

    public Builder externalGroupId(String externalGroupId) {
      return set(AccountField.EXTERNAL_GROUP_ID, externalGroupId);
    }

    public Builder accountType(AccountType accountType) {
      return set(AccountField.ACCOUNT_TYPE, accountType);
    }

    public Builder set(AccountField field, Object value) {
      changes.put(Objects.requireNonNull(field, "field"), value);
      return this;
    }

    public AccountUpdate build() {
      return new AccountUpdate(changes);
    }
  }
}
