/**
 * The account entity and its repository contract.
 */
package ledgerstore.account;
