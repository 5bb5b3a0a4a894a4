package io.mylab.lab.labplatform.config;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.orm.jpa.EntityManagerFactoryDependsOnPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway labFlyway(@Qualifier("migrationDataSource") DataSource migrationDataSource) {
    return Flyway.configure()
        .dataSource(migrationDataSource)
        .locations("classpath:db/migration/global")
        .schemas("public")
        .baselineOnMigrate(true)
        .load();
  }

  /** Schema must exist before Hibernate boots. */
  @Bean
  static EntityManagerFactoryDependsOnPostProcessor entityManagerFactoryDependsOnLabFlyway() {
    return new EntityManagerFactoryDependsOnPostProcessor("labFlyway");
  }
}
