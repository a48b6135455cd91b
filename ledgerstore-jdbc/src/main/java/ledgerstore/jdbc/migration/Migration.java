package ledgerstore.jdbc.migration;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A migration script found on disk.
 *
 * @param version  sequence number from the file name prefix
 * @param name     description part of the file name
 * @param path     script location
 * @param content  script text
 * @param checksum SHA-256 of the content, lower-case hex
 */
public record Migration(int version, String name, Path path, String content, String checksum) {
  public Migration {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(checksum, "checksum");
  }

  /**
   * File-style identifier, for example {@code 003_create_accounts}.
   */
  public String id() {
    return String.format("%03d_%s", version, name);
  }
}
