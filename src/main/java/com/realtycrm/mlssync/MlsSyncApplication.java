package com.realtycrm.mlssync;

import com.realtycrm.mlssync.config.MlsSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the MLS synchronization engine.
 * <p>
 * Enables scheduling for the provider tick, retry support for provider fetches and storage uploads,
 * and binds the {@code app.sync} properties to {@link MlsSyncProperties}.
 */
@Slf4j
@EnableAsync
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = MlsSyncProperties.class)
@EnableRetry
public class MlsSyncApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting MlsSyncApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(MlsSyncApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "MlsSyncEngine"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Swagger:    http://localhost:{}/swagger-ui.html", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
