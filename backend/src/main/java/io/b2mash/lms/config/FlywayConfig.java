package io.b2mash.lms.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway directoryFlyway(@Qualifier("directoryDataSource") DataSource directoryDataSource) {
    return Flyway.configure()
        .dataSource(directoryDataSource)
        .locations("classpath:db/migration/global")
        .load();
  }
}
