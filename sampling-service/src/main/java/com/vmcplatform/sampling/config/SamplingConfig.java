package com.vmcplatform.sampling.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vmcplatform.common.exclusion.ExclusionFilter;
import com.vmcplatform.common.exclusion.OverlapPolicy;
import com.vmcplatform.common.selection.SegmentSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
public class SamplingConfig {

    private static final Logger log = LoggerFactory.getLogger(SamplingConfig.class);

    @Value("${vmc.selection.overlap-policy:ANY_INTERSECTION}")
    private OverlapPolicy overlapPolicy;

    /** Fixed seed for reproducible draws; 0 means unseeded. */
    @Value("${vmc.selection.random-seed:0}")
    private long randomSeed;

    @Bean
    public Random samplingRandom() {
        if (randomSeed != 0) {
            log.warn("Sampling random is seeded. seed={}", randomSeed);
            return new Random(randomSeed);
        }
        return new SecureRandom();
    }

    @Bean
    public ExclusionFilter exclusionFilter() {
        log.info("Exclusion filter configured. overlapPolicy={}", overlapPolicy);
        return new ExclusionFilter(overlapPolicy);
    }

    @Bean
    public SegmentSelector segmentSelector(ExclusionFilter exclusionFilter, Random samplingRandom) {
        return new SegmentSelector(exclusionFilter, samplingRandom);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
