package com.fhi.dog_walking.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig 
{
   /**
    * Provides the {@link ObjectMapper} used for every request and response body:
    * - snake_case property names ("start_time", "duration_minutes") 
    * - JSON comments allowed, unknown properties ignored
    * - java.time values written as ISO strings
    */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)          // startTime <-> start_time
                .configure(JsonParser.Feature.ALLOW_COMMENTS, true)                       // // and /* */ comments in JSON
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)     // extra fields in a payload are ignored
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)                 
                .registerModule(new JavaTimeModule())                                    
                .enable(SerializationFeature.INDENT_OUTPUT);                             // for pretty print
    }
}
