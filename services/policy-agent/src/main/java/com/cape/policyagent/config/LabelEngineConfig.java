package com.cape.policyagent.config;

import com.cape.label.LabelEngine;
import com.cape.label.store.LabelStore;
import com.cape.observability.MetricFactory;
import com.cape.policyagent.infrastructure.jdbc.JdbcLabelStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/** Wires the label engine to the relational label store. */
@Configuration
public class LabelEngineConfig {

    @Bean
    public LabelStore labelStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager txManager) {
        return new JdbcLabelStore(jdbcTemplate, txManager);
    }

    @Bean
    public LabelEngine labelEngine(LabelStore labelStore) {
        return new LabelEngine(labelStore);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, PolicyAgentProperties properties) {
        return new MetricFactory(registry, properties.name());
    }
}
