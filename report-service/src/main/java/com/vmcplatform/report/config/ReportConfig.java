package com.vmcplatform.report.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vmcplatform.common.consensus.ConsensusAggregator;
import com.vmcplatform.common.consensus.ConsensusEngine;
import com.vmcplatform.common.consensus.PluralityConsensusStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReportConfig {

    private static final Logger log = LoggerFactory.getLogger(ReportConfig.class);

    @Value("${vmc.consensus.rater-count:3}")
    private int raterCount;

    @Value("${vmc.consensus.reference-category:Speech}")
    private String referenceCategory;

    @Bean
    public ConsensusEngine consensusEngine() {
        log.info("Consensus engine configured. strategy=plurality raterCount={}", raterCount);
        return new PluralityConsensusStrategy(raterCount);
    }

    @Bean
    public ConsensusAggregator consensusAggregator(ConsensusEngine consensusEngine) {
        return new ConsensusAggregator(consensusEngine, referenceCategory);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
