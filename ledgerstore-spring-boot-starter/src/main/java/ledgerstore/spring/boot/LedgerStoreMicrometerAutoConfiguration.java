package ledgerstore.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import ledgerstore.micrometer.MicrometerMetricsExporter;
import ledgerstore.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath and
 * {@code ledgerstore.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link LedgerStoreAutoConfiguration} so the connection manager, repository
 * and migration runner pick the exporter up.
 */
@AutoConfiguration(before = LedgerStoreAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "ledgerstore.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(LedgerStoreProperties.class)
public class LedgerStoreMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, LedgerStoreProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
