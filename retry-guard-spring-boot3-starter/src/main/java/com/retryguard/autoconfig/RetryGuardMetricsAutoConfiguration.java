package com.retryguard.autoconfig;

import com.retryguard.config.RetryGuardProperties;
import com.retryguard.core.event.listener.MetricsEventListener;
import com.retryguard.core.metric.GuardMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration(before = RetryGuardAutoConfiguration.class)
@EnableConfigurationProperties(RetryGuardProperties.class)
@ConditionalOnProperty(prefix = "retry.guard.events", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
public class RetryGuardMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GuardMetrics guardMetrics(ObjectProvider<MeterRegistry> discovered, RetryGuardProperties props) {
        return GuardMetrics.over(discovered.orderedStream().collect(Collectors.toList()),
                props.getEvents().getMetricTags());
    }

    @Bean
    public MetricsEventListener metricsEventListener(GuardMetrics metrics) {
        return new MetricsEventListener(metrics);
    }
}
