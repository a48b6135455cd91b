package ledgerstore.account;

/**
 * Optional predicates for listing accounts. {@code null} components do not filter.
 *
 * @param accountType     exact account type
 * @param currencyCode    exact currency code
 * @param externalGroupId exact group
 * @param nameContains    case-insensitive substring of the name
 */
public record AccountFilter(
    AccountType accountType,
    String currencyCode,
    String externalGroupId,
    String nameContains
) {
  private static final AccountFilter NONE = new AccountFilter(null, null, null, null);

  public static AccountFilter none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private AccountType accountType;
    private String currencyCode;
    private String externalGroupId;
    private String nameContains;

    private Builder() {
    }

    public Builder accountType(AccountType accountType) {
      this.accountType = accountType;
      return this;
    }

    public Builder currencyCode(String currencyCode) {
      this.currencyCode = currencyCode;
      return this;
    }

    public Builder externalGroupId(String externalGroupId) {
      this.externalGroupId = externalGroupId;
      return this;
    }

    public Builder nameContains(String nameContains) {
      this.nameContains = nameContains;
      return this;
    }

    public AccountFilter build() {
      return new AccountFilter(accountType, blankToNull(currencyCode), blankToNull(externalGroupId),
          blankToNull(nameContains));
    }

    private static String blankToNull(String value) {
      return value == null || value.isBlank() ? null : value;
    }
  }
}
