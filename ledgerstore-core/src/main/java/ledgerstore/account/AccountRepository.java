package ledgerstore.account;

import ledgerstore.Deadline;
import ledgerstore.model.Page;

/**
 * Versioned storage for accounts.
 *
 * <p>All methods throw {@link ledgerstore.error.StoreException}; its kind tells the caller
 * whether to fix the request ({@code INVALID_ARGUMENT}), report absence ({@code NOT_FOUND},
 * {@code ALREADY_EXISTS}), retry ({@code ABORTED}, {@code UNAVAILABLE}) or give up
 * ({@code INTERNAL}).
 */
public interface AccountRepository {

  /**
   * Stores a new account with {@code version = 1}. An identifier is generated when the
   * given account has none.
   *
   * @return the stored account, including identifier and timestamps
   */
  Account create(Deadline deadline, Account account);

  Account getById(Deadline deadline, String id);

  Account getByExternalId(Deadline deadline, String externalId);

  /**
   * Applies {@code update} if the stored version still equals {@code expectedVersion}.
   *
   * @return the account as re-read after the write, with {@code version = expectedVersion + 1}
   * @throws ledgerstore.error.StoreException {@code ABORTED} when another writer won,
   *                                          {@code NOT_FOUND} when the account is gone,
   *                                          {@code INVALID_ARGUMENT} when an immutable field
   *                                          is named
   */
  Account update(Deadline deadline, String id, AccountUpdate update, long expectedVersion);

  /**
   * Lists accounts newest first.
   *
   * @param pageSize  0 for the default, values above the maximum are clamped
   * @param pageToken token from a previous page, or empty for the first page
   */
  Page<Account> list(Deadline deadline, AccountFilter filter, int pageSize, String pageToken);
}
