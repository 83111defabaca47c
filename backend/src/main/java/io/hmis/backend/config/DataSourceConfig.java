package io.hmis.backend.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Connection pools. {@code appDataSource} is the primary (write) store, {@code readDataSource} the
 * read-oriented replica used by query handlers, and {@code migrationDataSource} the DDL-capable
 * pool used by Flyway and tenant provisioning. The replica may point at the primary database when
 * no replica is deployed.
 */
@Configuration
public class DataSourceConfig {

  @Bean(name = "appDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.app")
  public HikariDataSource appDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "readDataSource")
  @ConfigurationProperties("spring.datasource.read")
  public HikariDataSource readDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "migrationDataSource")
  @ConfigurationProperties("spring.datasource.migration")
  public HikariDataSource migrationDataSource() {
    return new HikariDataSource();
  }
}
