package ledgerstore.error;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlStateErrorClassifierTest {

  private final SqlStateErrorClassifier classifier = new SqlStateErrorClassifier();

  @Test
  void sessionLossIsUnavailable() {
    assertEquals(ErrorKind.UNAVAILABLE, classifier.classify(new SQLException("rpc error: session not found")));
    assertEquals(ErrorKind.UNAVAILABLE, classifier.classify(new SQLException("PermissionDenied")));
    assertEquals(ErrorKind.UNAVAILABLE, classifier.classify(new SQLException("link down", "08006")));
    assertEquals(ErrorKind.UNAVAILABLE, classifier.classify(new SQLNonTransientConnectionException("gone")));
  }

  @Test
  void timeoutsAreUnavailable() {
    assertEquals(ErrorKind.UNAVAILABLE, classifier.classify(new SQLTimeoutException("slow")));
    assertEquals(ErrorKind.UNAVAILABLE, classifier.classify(new SQLException("canceling statement", "57014")));
  }

  @Test
  void duplicatesAreAlreadyExists() {
    assertEquals(ErrorKind.ALREADY_EXISTS, classifier.classify(new SQLException("x", "23505")));
    assertEquals(ErrorKind.ALREADY_EXISTS,
        classifier.classify(new SQLIntegrityConstraintViolationException("constraint")));
    assertEquals(ErrorKind.ALREADY_EXISTS, classifier.classify(new SQLException("Duplicate key value")));
    assertEquals(ErrorKind.ALREADY_EXISTS, classifier.classify(new SQLException("violates UNIQUE index")));
  }

  @Test
  void conflictsAreAborted() {
    assertEquals(ErrorKind.ABORTED, classifier.classify(new SQLException("deadlock", "40P01")));
    assertEquals(ErrorKind.ABORTED, classifier.classify(new SQLException("tx read conflict: version mismatch")));
  }

  @Test
  void dataErrorsAreInvalidArgument() {
    assertEquals(ErrorKind.INVALID_ARGUMENT, classifier.classify(new SQLException("value too long", "22001")));
  }

  @Test
  void everythingElseIsInternal() {
    assertEquals(ErrorKind.INTERNAL, classifier.classify(new SQLException("syntax error", "42601")));
    assertEquals(ErrorKind.INTERNAL, classifier.classify(new SQLException((String) null)));
  }

  @Test
  void sessionLossIsFoundInCauseChain() {
    SQLException wrapped = new SQLException("query failed", "XX000", new RuntimeException("session expired"));

    assertTrue(classifier.isSessionLost(wrapped));
    assertFalse(classifier.isSessionLost(new SQLException("syntax error", "42601")));
  }

  @Test
  void extraMarkersAreMerged() {
    SqlStateErrorClassifier extended = classifier.withSessionLostMarkers(List.of("Server Has Gone Away"));

    assertTrue(extended.isSessionLost(new SQLException("MySQL server has gone away")));
    assertFalse(classifier.isSessionLost(new SQLException("MySQL server has gone away")));
    assertTrue(extended.isSessionLost(new SQLException("session not found")));
  }

  @Test
  void translateKeepsCauseAndPrefixesOperation() {
    SQLException cause = new SQLException("x", "23505");

    StoreException e = classifier.translate("create account", cause);

    assertEquals(ErrorKind.ALREADY_EXISTS, e.kind());
    assertSame(cause, e.getCause());
    assertTrue(e.getMessage().startsWith("create account: "));
  }

  @Test
  void onlyAbortedAndUnavailableAreRetryable() {
    for (ErrorKind kind : ErrorKind.values()) {
      assertEquals(kind == ErrorKind.ABORTED || kind == ErrorKind.UNAVAILABLE, kind.isRetryable(), kind.name());
    }
  }
}
