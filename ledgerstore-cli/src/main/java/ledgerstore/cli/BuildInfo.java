package ledgerstore.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Build metadata stamped into the CLI jar at package time.
 *
 * <p>Values come from {@code ledgerstore/cli/build-info.properties}, which Maven filters.
 * Pass {@code -Dbuild.commit=... -Dbuild.branch=...} to the build to record them.
 */
public record BuildInfo(String version, String commit, String branch) {

  static final String RESOURCE = "build-info.properties";
  static final String UNKNOWN = "unknown";

  public BuildInfo {
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(commit, "commit");
    Objects.requireNonNull(branch, "branch");
  }

  /**
   * Loads the stamped metadata. An unfiltered or missing resource yields {@code dev}.
   */
  public static BuildInfo load() {
    Properties props = new Properties();
    try (InputStream in = BuildInfo.class.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        props.load(in);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE, e);
    }
    String fallbackVersion = BuildInfo.class.getPackage().getImplementationVersion();
    return new BuildInfo(
        value(props, "version", fallbackVersion != null ? fallbackVersion : "dev"),
        value(props, "commit", UNKNOWN),
        value(props, "branch", UNKNOWN));
  }

  private static String value(Properties props, String key, String fallback) {
    String value = props.getProperty(key);
    if (value == null || value.isBlank() || value.startsWith("${")) {
      return fallback;
    }
    return value.trim();
  }

  @Override
  public String toString() {
    return version + " (commit " + commit + ", branch " + branch + ")";
  }
}
