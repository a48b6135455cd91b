package ledgerstore.account;

import ledgerstore.model.EntityField;

/**
 * Fields of an {@link Account} that an update can name.
 */
public enum AccountField implements EntityField {
  NAME("name", true),
  EXTERNAL_GROUP_ID("external_group_id", true),
  ACCOUNT_TYPE("account_type", true),
  EXTERNAL_ID("external_id", false),
  CURRENCY_CODE("currency_code", false);

  private final String column;
  private final boolean mutable;

  AccountField(String column, boolean mutable) {
    this.column = column;
    this.mutable = mutable;
  }

  @Override
  public String column() {
    return column;
  }

  @Override
  public boolean mutable() {
    return mutable;
  }
}
