package com.fhi.dog_walking.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Arrays;


/**
 * Logs diagnostics information about the Spring environment during startup.
 * 
 * <p>Helps verifying which profiles are active, which MongoDB the application points at,
 * and whether owner references are verified on writes.
 *
 * <p>Enabled by setting:
 * <pre>
 *   app.startup-diagnostics-logger.enabled=true
 * </pre>
 * in the active profile (e.g. in `application.yaml`).</p>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.startup-diagnostics-logger.enabled", havingValue = "true", matchIfMissing = false)
public class StartupDiagnosticsLogger 
{
   private static final String PREFIX = "[Startup Diagnostics]";

   private final Environment environment;

   private final DogWalkingProperties properties;

   @Value("${spring.data.mongodb.uri:__UNSET__}")
   private String mongoUri;



   public StartupDiagnosticsLogger(Environment environment, DogWalkingProperties properties) 
   {  this.environment = environment;
      this.properties  = properties;
   }


   @PostConstruct
   public void logDebugInfo() 
   {
      log.info("{} Diagnostics mode is ON", PREFIX);

      log.info("{} Active Spring profiles          : {}", PREFIX, Arrays.toString(environment.getActiveProfiles()));
      log.info("{} MongoDB URI                     : {}", PREFIX, maskCredentials(mongoUri));
      log.info("{} Verify owner references         : {}", PREFIX, properties.isVerifyOwnerReferences());
      log.info("{} Mongo command profiling         : {}", PREFIX, environment.getProperty("profiling.mongo.enabled", "NOT SET"));
   }


   /**
    * Hides the "user:password@" part of a connection string.
    */
   static String maskCredentials(String uri) 
   {  if (uri == null) return null;
      return uri.replaceFirst("//[^/@]+@", "//***@");
   }
}
