/**
 * Error taxonomy shared by every store operation, and the single place where low-level
 * failures are classified.
 *
 * @see ledgerstore.error.StoreException
 * @see ledgerstore.error.ErrorClassifier
 */
package ledgerstore.error;
