/**
 * Spring Boot auto-configuration for ledgerstore.
 *
 * <p>Configured under the {@code ledgerstore.*} prefix:
 * <ul>
 *   <li>{@code ledgerstore.connection.*}: target store, retry and health-check timing</li>
 *   <li>{@code ledgerstore.migration.*}: script directory, ledger table, run-on-boot</li>
 *   <li>{@code ledgerstore.metrics.*}: Micrometer export</li>
 * </ul>
 *
 * @see ledgerstore.spring.boot.LedgerStoreAutoConfiguration
 * @see ledgerstore.spring.boot.LedgerStoreProperties
 */
package ledgerstore.spring.boot;
