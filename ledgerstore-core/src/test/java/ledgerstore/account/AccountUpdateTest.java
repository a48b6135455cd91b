package ledgerstore.account;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccountUpdateTest {

  @Test
  void keepsFieldsInDeclarationOrder() {
    AccountUpdate update = AccountUpdate.builder()
        .accountType(AccountType.EQUITY)
        .name("Retained earnings")
        .build();

    assertEquals(List.of(AccountField.NAME, AccountField.ACCOUNT_TYPE), List.copyOf(update.fields()));
    assertEquals("Retained earnings", update.changes().get(AccountField.NAME));
  }

  @Test
  void nullClearsOptionalField() {
    AccountUpdate update = AccountUpdate.builder().externalGroupId(null).build();

    assertTrue(update.fields().contains(AccountField.EXTERNAL_GROUP_ID));
    assertNull(update.changes().get(AccountField.EXTERNAL_GROUP_ID));
  }

  @Test
  void noneIsEmptyAndImmutable() {
    AccountUpdate none = AccountUpdate.none();

    assertTrue(none.isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> none.changes().put(AccountField.NAME, "x"));
  }

  @Test
  void identityFieldsAreImmutable() {
    assertFalse(AccountField.EXTERNAL_ID.mutable());
    assertFalse(AccountField.CURRENCY_CODE.mutable());
    assertTrue(AccountField.NAME.mutable());
    assertEquals("external_group_id", AccountField.EXTERNAL_GROUP_ID.column());
  }

  @Test
  void filterBuilderDropsBlanks() {
    AccountFilter filter = AccountFilter.builder().currencyCode(" ").nameContains("cash").build();

    assertNull(filter.currencyCode());
    assertEquals("cash", filter.nameContains());
  }
}
