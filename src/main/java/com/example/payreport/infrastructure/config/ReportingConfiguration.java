package com.example.payreport.infrastructure.config;

import com.example.payreport.domain.service.PaymentAggregator;
import com.example.payreport.domain.service.ReportTableBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free domain services and the clock used for export file names.
 */
@Configuration
@EnableConfigurationProperties(ReportProperties.class)
public class ReportingConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PaymentAggregator paymentAggregator() {
        return new PaymentAggregator();
    }

    @Bean
    public ReportTableBuilder reportTableBuilder() {
        return new ReportTableBuilder();
    }
}
