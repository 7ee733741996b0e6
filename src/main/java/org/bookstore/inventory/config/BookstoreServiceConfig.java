package org.bookstore.inventory.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Main configuration class for the Bookstore Service.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml, which switch JSON property naming to snake_case.
 */
@Configuration
@EnableConfigurationProperties(BookstoreServiceProperties.class)
public class BookstoreServiceConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
