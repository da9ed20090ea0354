package dbmanager.spring.boot;

import dbmanager.DBManager;
import dbmanager.DbLogger;
import dbmanager.spi.ConnectionFactory;
import dbmanager.spi.EngineOpener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the database connection manager.
 *
 * <p>Creates a {@link DBManager} from {@link DbManagerProperties}. Application-defined
 * {@link DbLogger}, {@link ConnectionFactory} and {@link EngineOpener} beans are picked up;
 * without a {@code DbLogger} bean, diagnostics go to the SLF4J logger {@code dbmanager}.
 *
 * @see DbManagerProperties
 */
@AutoConfiguration
@ConditionalOnClass(DBManager.class)
@ConditionalOnProperty(prefix = "dbmanager", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DbManagerProperties.class)
public class DbManagerAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public DbLogger dbLogger() {
    Logger log = LoggerFactory.getLogger("dbmanager");
    return log::info;
  }

  @Bean
  @ConditionalOnMissingBean
  public DBManager dbManager(DbManagerProperties props,
      DbLogger dbLogger,
      ObjectProvider<ConnectionFactory> connectionFactoryProvider,
      ObjectProvider<EngineOpener> openerProvider) {
    DBManager.Builder builder = DBManager.builder()
        .defaultEngine(props.getDefaultEngine())
        .logger(dbLogger)
        .retryDefaults(props.getRetry().getMaxRetries(), props.getRetry().getBaseDelayMs());
    connectionFactoryProvider.ifAvailable(builder::connectionFactory);
    openerProvider.orderedStream().forEach(builder::opener);
    return builder.build();
  }
}
