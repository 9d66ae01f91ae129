package com.cape.policyagent.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the policy agent, bound from {@code cape.agent.*}:
 *
 * <pre>
 * cape:
 *   agent:
 *     name: policy-agent
 *     environment: production
 *     default-page-size: 100
 *     cors-allowed-origins:
 *       - https://console.example.com
 * </pre>
 *
 * @param name Service name used for logging and the {@code service} metric tag. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param defaultPageSize Limit applied to list endpoints when the request gives none; {@code null}
 *     returns every row.
 * @param corsAllowedOrigins Origins allowed to call {@code /api/**} from a browser.
 */
@ConfigurationProperties(prefix = "cape.agent")
@Validated
public record PolicyAgentProperties(
        @NotBlank String name,
        String environment,
        @Positive Integer defaultPageSize,
        List<String> corsAllowedOrigins) {

    /** Origins of the local development consoles. */
    public static final List<String> DEFAULT_CORS_ORIGINS =
            List.of("http://localhost:3000", "http://localhost:5173");

    /** Applies defaults for optional fields; runs before Bean Validation. */
    public PolicyAgentProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        corsAllowedOrigins =
                corsAllowedOrigins == null || corsAllowedOrigins.isEmpty()
                        ? DEFAULT_CORS_ORIGINS
                        : List.copyOf(corsAllowedOrigins);
    }
}
