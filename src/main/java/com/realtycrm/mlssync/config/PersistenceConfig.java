package com.realtycrm.mlssync.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repository scanning lives here rather than on the application class so that web and other non-JPA test
 * slices start without a persistence unit.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.realtycrm.mlssync.repository")
public class PersistenceConfig {
}
