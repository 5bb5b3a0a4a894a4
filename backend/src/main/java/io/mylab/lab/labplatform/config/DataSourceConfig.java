package io.mylab.lab.labplatform.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * The application connects as a role limited to DML. Migrations, including the append-only
 * triggers on the log tables, run through a separate schema-owner pool.
 */
@Configuration
public class DataSourceConfig {

  @Bean(name = "appDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.app")
  public HikariDataSource appDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "migrationDataSource")
  @ConfigurationProperties("spring.datasource.migration")
  public HikariDataSource migrationDataSource() {
    return new HikariDataSource();
  }
}
