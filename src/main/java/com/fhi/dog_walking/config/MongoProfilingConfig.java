package com.fhi.dog_walking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import com.fhi.dog_walking.tools.ProfilingCommandListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Registers {@link ProfilingCommandListener} on the {@code MongoClient} built by Spring Boot,
 * so that every command sent to MongoDB is logged with its execution time and the
 * application method that triggered it.
 *
 * <p>Should never be enabled in production!
 *
 * <p>The listener only produces output when {@code profiling.mongo.enabled=true}.
 */
@Configuration
@Profile({ "local"   // we want the profiler when running locally
          ,"dev"     // in dev too
        })
@Slf4j
public class MongoProfilingConfig 
{

    /**
     * Creates the command profiling listener.
     *
     * @param enabled whether command profiling should be active
     * @param logLinePrefix prefix added to each profiling log line
     */
    @Bean
    public ProfilingCommandListener profilingCommandListener
          (@Value("${profiling.mongo.enabled:false}")              boolean enabled,
           @Value("${profiling.mongo.logLinePrefix:PROFILING---}") String logLinePrefix
          ) 
    {   return new ProfilingCommandListener(enabled, logLinePrefix);
    }


    @Bean
    public MongoClientSettingsBuilderCustomizer profilingCommandListenerCustomizer(ProfilingCommandListener listener) 
    {   log.debug("Registering Mongo command profiling listener");
        return builder -> builder.addCommandListener(listener);
    }
}
