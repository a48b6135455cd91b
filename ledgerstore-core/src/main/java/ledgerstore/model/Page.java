package ledgerstore.model;

import java.util.List;
import java.util.Objects;

/**
 * One page of a listing.
 *
 * @param items         entities on this page, in listing order
 * @param nextPageToken opaque token for the following page; empty when this is the last page
 * @param totalCount    number of entities matching the filter across all pages
 */
public record Page<T>(List<T> items, String nextPageToken, long totalCount) {
  public Page {
    items = List.copyOf(Objects.requireNonNull(items, "items"));
    nextPageToken = nextPageToken == null ? "" : nextPageToken;
  }

  public boolean hasNext() {
    return !nextPageToken.isEmpty();
  }
}
