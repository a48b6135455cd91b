/**
 * Versioned repositories: conditional writes keyed on {@code (id, version)} with
 * read-after-write verification, and offset-token pagination.
 */
package ledgerstore.jdbc.repository;
