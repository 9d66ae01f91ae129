package com.cape.policyagent.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PolicyAgentProperties")
class PolicyAgentPropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props =
                new PolicyAgentProperties(
                        "policy-agent", "production", 50, List.of("https://console.example.com"));

        assertThat(props.name()).isEqualTo("policy-agent");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.defaultPageSize()).isEqualTo(50);
        assertThat(props.corsAllowedOrigins()).containsExactly("https://console.example.com");
    }

    @Test
    @DisplayName("defaults environment to 'development' when null")
    void defaultsEnvironmentWhenNull() {
        var props = new PolicyAgentProperties("policy-agent", null, null, null);

        assertThat(props.environment()).isEqualTo("development");
        assertThat(props.defaultPageSize()).isNull();
    }

    @Test
    @DisplayName("defaults CORS origins to the local consoles when none configured")
    void defaultsCorsOrigins() {
        assertThat(new PolicyAgentProperties("a", "dev", null, List.of()).corsAllowedOrigins())
                .isEqualTo(PolicyAgentProperties.DEFAULT_CORS_ORIGINS);
    }
}
