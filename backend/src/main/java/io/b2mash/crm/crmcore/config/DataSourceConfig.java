package io.b2mash.crm.crmcore.config;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Owns the single connection pool used by every repository. Repositories receive the pool only
 * through the {@link JdbcClient} bean, so statements issued inside a {@code TransactionTemplate}
 * callback share the transaction-bound connection.
 */
@Configuration
public class DataSourceConfig {

  @Bean(name = "crmDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.crm")
  public HikariDataSource crmDataSource() {
    return new HikariDataSource();
  }

  @Bean
  public JdbcClient jdbcClient(DataSource crmDataSource) {
    return JdbcClient.create(crmDataSource);
  }

  @Bean(name = "transactionManager")
  public PlatformTransactionManager transactionManager(DataSource crmDataSource) {
    return new DataSourceTransactionManager(crmDataSource);
  }
}
