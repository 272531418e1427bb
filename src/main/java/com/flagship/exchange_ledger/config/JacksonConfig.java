package com.flagship.exchange_ledger.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.ConstructorDetector;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Jackson configuration shared by the REST layer, the closing report
 * JSON column and the settlement broadcast payload.
 *
 * Key features:
 * - java.time support with ISO-8601 output (not timestamps)
 * - BigDecimal amounts written as plain numbers ("146000.00", never "1.46E+5")
 * - Immutable (@Value) DTOs bound through their all-args constructor,
 *   using the parameter names the compiler keeps (-parameters)
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Money must never be rendered in scientific notation
        mapper.enable(SerializationFeature.WRITE_BIGDECIMAL_AS_PLAIN);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        mapper.registerModule(new ParameterNamesModule());
        mapper.setConstructorDetector(ConstructorDetector.USE_PROPERTIES_BASED);

        return mapper;
    }
}
