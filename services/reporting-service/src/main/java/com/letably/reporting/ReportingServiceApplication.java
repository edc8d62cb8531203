package com.letably.reporting;

import com.letably.database.gateway.GatewayConfig;
import com.letably.reporting.config.ReportingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Letably reporting service.
 *
 * <p>Hosts the five report generators behind {@link com.letably.reporting.service.ReportService}.
 * The execution gateway, its pool and the schema migrations come from {@link GatewayConfig},
 * configured under {@code letably.gateway.*}. The HTTP layer that calls the service lives
 * elsewhere; this application only wires the reporting core.
 */
@SpringBootApplication
@EnableConfigurationProperties(ReportingProperties.class)
@Import(GatewayConfig.class)
public class ReportingServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(ReportingServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ReportingServiceApplication.class, args);
        log.info("Letably reporting service started");
    }
}
