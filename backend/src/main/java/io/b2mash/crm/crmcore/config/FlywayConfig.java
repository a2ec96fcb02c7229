package io.b2mash.crm.crmcore.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway crmFlyway(DataSource crmDataSource) {
    return Flyway.configure()
        .dataSource(crmDataSource)
        .locations("classpath:db/migration")
        .schemas("public")
        .baselineOnMigrate(true)
        .load();
  }
}
