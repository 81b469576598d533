package io.b2mash.lms.config;

import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.simple.JdbcClient;

/** Shared directory database holding user accounts for every tenant. */
@Configuration
public class DirectoryDataSourceConfig {

  @Bean(name = "directoryDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.directory")
  public HikariDataSource directoryDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "directoryJdbcClient")
  public JdbcClient directoryJdbcClient(
      @Qualifier("directoryDataSource") DataSource directoryDataSource) {
    return JdbcClient.create(directoryDataSource);
  }
}
