/**
 * Entity-agnostic building blocks for versioned entities.
 */
package ledgerstore.model;
