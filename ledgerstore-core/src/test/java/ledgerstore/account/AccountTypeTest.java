package ledgerstore.account;

import ledgerstore.error.ErrorKind;
import ledgerstore.error.StoreException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccountTypeTest {

  @Test
  void parsesPlainAndPrefixedNames() {
    assertEquals(AccountType.ASSET, AccountType.parse("ASSET"));
    assertEquals(AccountType.LIABILITY, AccountType.parse("ACCOUNT_TYPE_LIABILITY"));
    assertEquals(AccountType.REVENUE, AccountType.parse(" revenue "));
  }

  @Test
  void unknownTypeIsInvalidArgument() {
    StoreException e = assertThrows(StoreException.class, () -> AccountType.parse("ACCOUNT_TYPE_UNSPECIFIED"));
    assertEquals(ErrorKind.INVALID_ARGUMENT, e.kind());
    assertThrows(StoreException.class, () -> AccountType.parse(""));
    assertThrows(StoreException.class, () -> AccountType.parse(null));
  }
}
