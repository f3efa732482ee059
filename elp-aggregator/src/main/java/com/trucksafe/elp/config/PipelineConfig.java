package com.trucksafe.elp.config;

import com.trucksafe.elp.source.LocalCsvRecordSource;
import com.trucksafe.elp.source.RecordSource;
import com.trucksafe.elp.source.SchemaRegistry;
import com.trucksafe.elp.source.SocrataApiClient;
import com.trucksafe.elp.source.SocrataRecordSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ElpAggregatorProperties properties) {
        ElpAggregatorProperties.Source.Api api = properties.getSource().getApi();
        return builder
                .setConnectTimeout(Duration.ofSeconds(api.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(api.getReadTimeoutSeconds()))
                .build();
    }

    @Bean
    public RecordSource recordSource(ElpAggregatorProperties properties,
                                     SchemaRegistry schemas,
                                     SocrataApiClient apiClient) {
        ElpAggregatorProperties.Source source = properties.getSource();
        return switch (source.getMode()) {
            case CSV -> {
                log.info("Reading local exports: violations={}, inspections={}",
                        source.getCsv().getViolationsFile(), source.getCsv().getInspectionsFile());
                yield new LocalCsvRecordSource(
                        Paths.get(source.getCsv().getViolationsFile()),
                        Paths.get(source.getCsv().getInspectionsFile()),
                        source.getCsv().getBatchSize(),
                        schemas);
            }
            case API -> {
                log.info("Reading from Socrata at {}", source.getApi().getBaseUrl());
                yield new SocrataRecordSource(apiClient, source.getApi(), schemas);
            }
        };
    }
}
