package cable.spring.boot;

import cable.SolidCable;
import cable.jdbc.DataSourceConnectionProvider;
import cable.jdbc.TableNames;
import cable.jdbc.store.AbstractJdbcMessageStore;
import cable.jdbc.store.JdbcMessageStores;
import cable.spi.ConnectionProvider;
import cable.spi.MetricsExporter;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the message bus.
 *
 * <p>Wires a {@link SolidCable} from the application {@link DataSource} and
 * {@link CableProperties}. The store dialect is detected from the JDBC URL. The data source
 * stays owned by Spring: closing the bus does not close it.
 *
 * @see CableProperties
 * @see CableMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SolidCable.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CableProperties.class)
public class CableAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcMessageStore messageStore(DataSource dataSource, CableProperties props) {
    AbstractJdbcMessageStore detected = JdbcMessageStores.detect(dataSource);
    if (!TableNames.DEFAULT_TABLE.equals(props.getTableName())) {
      return detected.withTableName(props.getTableName());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource, false);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public SolidCable solidCable(CableProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcMessageStore messageStore,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = SolidCable.builder()
        .connectionProvider(connectionProvider)
        .messageStore(messageStore)
        .createSchema(props.isCreateSchema())
        .pollIntervalMs(props.getPoller().getIntervalMs())
        .batchSize(props.getPoller().getBatchSize())
        .queueCapacity(props.getSubscriber().getQueueCapacity())
        .drainTimeoutMs(props.getSubscriber().getDrainTimeoutMs())
        .retentionEnabled(props.getRetention().isEnabled())
        .retention(props.getRetention().getPeriod())
        .purgeBatchSize(props.getRetention().getBatchSize())
        .sweepIntervalSeconds(props.getRetention().getIntervalSeconds());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public CableSubscriberRegistrar cableSubscriberRegistrar(ListableBeanFactory beanFactory,
      SolidCable solidCable) {
    return new CableSubscriberRegistrar(beanFactory, solidCable);
  }
}
