package ledgerstore.jdbc.repository;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

import ledgerstore.Deadline;
import ledgerstore.account.Account;
import ledgerstore.account.AccountField;
import ledgerstore.account.AccountFilter;
import ledgerstore.account.AccountRepository;
import ledgerstore.account.AccountType;
import ledgerstore.account.AccountUpdate;
import ledgerstore.error.ErrorClassifier;
import ledgerstore.error.StoreException;
import ledgerstore.jdbc.JdbcTemplate;
import ledgerstore.jdbc.TableNames;
import ledgerstore.model.Page;
import ledgerstore.spi.MetricsExporter;
import ledgerstore.spi.SessionProvider;

/**
 * {@link AccountRepository} over the {@code accounts} table.
 *
 * <p>The store cannot enforce {@code external_id} uniqueness, so {@link #create} looks the
 * external id up before inserting. The lookup and the insert are not atomic; readers that
 * need a strict guarantee resolve duplicates through {@link #getByExternalId}, which returns
 * the oldest matching row.
 */
public final class JdbcAccountRepository extends AbstractVersionedRepository<Account, AccountField>
    implements AccountRepository {

  private static final List<String> COLUMNS = List.of(
      "id", "name", "external_id", "external_group_id", "currency_code", "account_type",
      "created_at", "updated_at", "version");

  private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

  private static final JdbcTemplate.RowMapper<Account> ROW_MAPPER = rs -> new Account(
      rs.getString("id"),
      rs.getString("name"),
      rs.getString("external_id"),
      rs.getString("external_group_id"),
      rs.getString("currency_code"),
      AccountType.parse(rs.getString("account_type")),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"),
      rs.getLong("version"));

  public JdbcAccountRepository(SessionProvider sessions, ErrorClassifier errorClassifier) {
    this(sessions, errorClassifier, TableNames.ACCOUNTS, MetricsExporter.NOOP);
  }

  public JdbcAccountRepository(SessionProvider sessions, ErrorClassifier errorClassifier, String table,
      MetricsExporter metrics) {
    this(sessions, errorClassifier, table, metrics, MonotonicClock.SYSTEM);
  }

  JdbcAccountRepository(SessionProvider sessions, ErrorClassifier errorClassifier, String table,
      MetricsExporter metrics, MonotonicClock clock) {
    super(sessions, errorClassifier, table, metrics, clock);
  }

  @Override
  public Account create(Deadline deadline, Account account) {
    Objects.requireNonNull(account, "account");
    validateNew(account);
    String id = account.id() == null || account.id().isBlank() ? UUID.randomUUID().toString() : account.id();
    Account created = account.asCreated(id, clock.next());

    return withSession(deadline, "create account", conn -> {
      if (selectOne(conn, deadline, "external_id", created.externalId()).isPresent()) {
        throw StoreException.alreadyExists(
            "account with external_id " + created.externalId() + " already exists", null);
      }
      insert(conn, deadline, created);
      return created;
    });
  }

  @Override
  public Account getById(Deadline deadline, String id) {
    if (id == null || id.isBlank()) {
      throw StoreException.invalidArgument("account id is required");
    }
    return requireOne(deadline, "id", id, "id=" + id);
  }

  @Override
  public Account getByExternalId(Deadline deadline, String externalId) {
    if (externalId == null || externalId.isBlank()) {
      throw StoreException.invalidArgument("external id is required");
    }
    return requireOne(deadline, "external_id", externalId, "external_id=" + externalId);
  }

  @Override
  public Account update(Deadline deadline, String id, AccountUpdate update,
      long expectedVersion) {
    Objects.requireNonNull(update, "update");
    return conditionalUpdate(deadline, id, update.changes(), expectedVersion);
  }

  @Override
  public Page<Account> list(Deadline deadline, AccountFilter filter, int pageSize, String pageToken) {
    AccountFilter f = filter == null ? AccountFilter.none() : filter;
    Criteria criteria = new Criteria()
        .eq("account_type", f.accountType())
        .eq("currency_code", f.currencyCode())
        .eq("external_group_id", f.externalGroupId())
        .containsIgnoreCase("name", f.nameContains());
    return page(deadline, criteria, pageSize, pageToken);
  }

  @Override
  protected String entityName() {
    return "account";
  }

  @Override
  protected List<String> columns() {
    return COLUMNS;
  }

  @Override
  protected JdbcTemplate.RowMapper<Account> rowMapper() {
    return ROW_MAPPER;
  }

  @Override
  protected Object[] insertValues(Account a) {
    return new Object[]{
        a.id(), a.name(), a.externalId(), a.externalGroupId(), a.currencyCode(), a.accountType(),
        a.createdAt(), a.updatedAt(), a.version()};
  }

  @Override
  protected Object columnValue(AccountField field, Object value) {
    return switch (field) {
      case NAME -> {
        if (!(value instanceof String name) || name.isBlank()) {
          throw StoreException.invalidArgument("account name must be a non-empty string");
        }
        yield name;
      }
      case EXTERNAL_GROUP_ID -> {
        if (value != null && !(value instanceof String)) {
          throw StoreException.invalidArgument("external group id must be a string or null");
        }
        yield value;
      }
      case ACCOUNT_TYPE -> {
        if (value instanceof AccountType type) {
          yield type;
        }
        if (value instanceof String text) {
          yield AccountType.parse(text);
        }
        throw StoreException.invalidArgument("account type is required");
      }
      case EXTERNAL_ID, CURRENCY_CODE ->
          throw StoreException.invalidArgument("field " + field.column() + " is immutable");
    };
  }

  private static void validateNew(Account account) {
    if (account.name() == null || account.name().isBlank()) {
      throw StoreException.invalidArgument("account name is required");
    }
    if (account.externalId() == null || account.externalId().isBlank()) {
      throw StoreException.invalidArgument("external id is required");
    }
    if (account.currencyCode() == null || !CURRENCY_CODE.matcher(account.currencyCode()).matches()) {
      throw StoreException.invalidArgument("currency code must be three upper-case letters, got: "
          + account.currencyCode());
    }
    if (account.accountType() == null) {
      throw StoreException.invalidArgument("account type is required");
    }
  }
}
