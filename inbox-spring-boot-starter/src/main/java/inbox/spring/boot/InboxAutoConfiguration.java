package inbox.spring.boot;

import inbox.Inbox;
import inbox.jdbc.DataSourceConnectionProvider;
import inbox.jdbc.SchemaInitializer;
import inbox.jdbc.TableNames;
import inbox.jdbc.store.AbstractJdbcInboxStore;
import inbox.jdbc.store.JdbcInboxStores;
import inbox.registry.DefaultHandlerRegistry;
import inbox.spi.ConnectionProvider;
import inbox.spi.ConnectivityProbe;
import inbox.spi.MetricsExporter;
import inbox.spi.UpdateSource;

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
 * Auto-configuration for the inbox.
 *
 * <p>Wires an {@link Inbox} composite from a {@link DataSource}, an {@link UpdateSource}
 * bean and {@link InboxProperties}. A {@link ConnectivityProbe} bean enables the
 * reconnection schedule.
 *
 * @see InboxProperties
 * @see InboxMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Inbox.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(InboxProperties.class)
public class InboxAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcInboxStore inboxStore(DataSource dataSource, InboxProperties props) {
    AbstractJdbcInboxStore detected = JdbcInboxStores.detect(dataSource);
    if (!TableNames.DEFAULT_CURSOR_TABLE.equals(props.getCursorTable())
        || !TableNames.DEFAULT_LEDGER_TABLE.equals(props.getLedgerTable())) {
      return detected.withTables(props.getCursorTable(), props.getLedgerTable());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultHandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public InboxHandlerRegistrar inboxHandlerRegistrar(
      ListableBeanFactory beanFactory, DefaultHandlerRegistry handlerRegistry) {
    return new InboxHandlerRegistrar(beanFactory, handlerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Inbox inbox(InboxProperties props,
      DataSource dataSource,
      ConnectionProvider connectionProvider,
      AbstractJdbcInboxStore inboxStore,
      DefaultHandlerRegistry handlerRegistry,
      ObjectProvider<UpdateSource> updateSourceProvider,
      ObjectProvider<ConnectivityProbe> probeProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    UpdateSource updateSource = updateSourceProvider.getIfUnique();
    if (updateSource == null) {
      throw new IllegalStateException(
          "The inbox needs exactly one UpdateSource bean to fetch updates from");
    }
    if (props.isInitializeSchema()) {
      SchemaInitializer.initialize(dataSource, inboxStore);
    }

    var builder = Inbox.builder()
        .connectionProvider(connectionProvider)
        .inboxStore(inboxStore)
        .updateSource(updateSource)
        .handlerRegistry(handlerRegistry)
        .batchSize(props.getBatchSize())
        .interMessageDelay(props.getInterMessageDelay())
        .handlerTimeout(props.getHandlerTimeout())
        .connectivityCheckInterval(props.getConnectivityCheckInterval())
        .retention(props.getRetention().getWindow())
        .retentionInterval(props.getRetention().getInterval())
        .retentionBatchSize(props.getRetention().getBatchSize())
        .drainOnStart(props.isDrainOnStart());
    ConnectivityProbe probe = probeProvider.getIfUnique();
    if (probe != null) {
      builder.connectivityProbe(probe);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public InboxLifecycle inboxLifecycle(Inbox inbox) {
    return new InboxLifecycle(inbox);
  }
}
