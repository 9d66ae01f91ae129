package com.cape.policyagent;

import com.cape.database.migration.LabelStoreFlywayConfig;
import com.cape.policyagent.config.PolicyAgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Cape policy agent: REST access to security groups and labelled objects.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Label store schema migrated on startup by {@link LabelStoreFlywayConfig}
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation into the logging MDC
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>CORS origins from {@code cape.agent.cors-allowed-origins}
 * </ul>
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@EnableConfigurationProperties(PolicyAgentProperties.class)
@Import(LabelStoreFlywayConfig.class)
public class PolicyAgentApplication {

    private static final Logger log = LoggerFactory.getLogger(PolicyAgentApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PolicyAgentApplication.class, args);
        log.info("Cape policy agent started successfully");
    }
}
