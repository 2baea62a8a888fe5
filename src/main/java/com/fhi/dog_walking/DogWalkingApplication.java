package com.fhi.dog_walking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.fhi.dog_walking.config.DogWalkingProperties;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(DogWalkingProperties.class)
public class DogWalkingApplication 
{

    /**
     * Run against a local MongoDB (override with MONGODB_URI):
     * $ mvn spring-boot:run -Dspring-boot.run.profiles=local
     */
    public static void main(String[] args) 
    {
        SpringApplication.run(DogWalkingApplication.class, args);
        log.info("Dog walking API started");
    }
}
