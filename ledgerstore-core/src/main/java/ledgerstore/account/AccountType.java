package ledgerstore.account;

import java.util.Locale;

import ledgerstore.error.StoreException;

/**
 * Chart-of-accounts category.
 */
public enum AccountType {
  ASSET,
  LIABILITY,
  EQUITY,
  REVENUE,
  EXPENSE;

  private static final String WIRE_PREFIX = "ACCOUNT_TYPE_";

  /**
   * Parses a stored or transport value, accepting an optional {@code ACCOUNT_TYPE_} prefix.
   *
   * @throws StoreException with kind {@code INVALID_ARGUMENT} for unknown values
   */
  public static AccountType parse(String value) {
    if (value == null || value.isBlank()) {
      throw StoreException.invalidArgument("account type is required");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if (normalized.startsWith(WIRE_PREFIX)) {
      normalized = normalized.substring(WIRE_PREFIX.length());
    }
    for (AccountType type : values()) {
      if (type.name().equals(normalized)) {
        return type;
      }
    }
    throw StoreException.invalidArgument("unknown account type: " + value);
  }
}
