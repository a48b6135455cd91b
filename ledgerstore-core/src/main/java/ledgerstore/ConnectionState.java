package ledgerstore;

/**
 * Lifecycle of the managed session.
 *
 * <pre>
 * DISCONNECTED -&gt; CONNECTING -&gt; CONNECTED -&gt; (DEGRADED &lt;-&gt; CONNECTED) -&gt; DISCONNECTED
 * </pre>
 *
 * <p>{@link #DEGRADED} is only observable while a health check is reconnecting; the check
 * always leaves the manager in {@link #CONNECTED} or {@link #DISCONNECTED}.
 */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  DEGRADED
}
