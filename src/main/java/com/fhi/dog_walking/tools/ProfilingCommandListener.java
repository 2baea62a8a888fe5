package com.fhi.dog_walking.tools;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.mongodb.event.CommandFailedEvent;
import com.mongodb.event.CommandListener;
import com.mongodb.event.CommandStartedEvent;
import com.mongodb.event.CommandSucceededEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * MongoDB command listener used for performance profiling.
 *
 * <p>It logs every command the driver sends to the server, with its execution time
 * and the Java method (class, line number) of the application that triggered it.
 * Infrastructure layers (Spring Data, the driver itself, etc) are skipped when looking
 * for that method.
 *
 * <p>The synchronous driver runs commands on the calling thread, which is what makes the
 * stack trace lookup meaningful.
 *
 * <p>Note: the command document itself is only logged at debug level, as it contains the
 * stored values.
 */
@Slf4j
public class ProfilingCommandListener implements CommandListener
{
   /*
    * If enabled, outputs log lines according to logging setup.
    */
   private final boolean enabled;

   /**
    * Prefix this to log lines with this to make searching or reading easier.
    */
   private final String logLinePrefix;

   /**
    * Package prefixes for known infrastructure layers (JDK, Spring, driver, etc.) 
    * that should be skipped when examining the stack to find the application caller.
    */
    private static final List<String> IGNORED_PACKAGES = List.of(
        "java.",
        "jdk.",
        "jakarta.",
        "org.springframework.",
        "com.mongodb.",
        "org.bson.",
        "ch.qos.logback."
    );

    /**
     * Classes within our own codebase that are not considered meaningful callers.
     */
    private static final List<String> IGNORED_CLASSES = List.of(
        ProfilingCommandListener.class.getName()
    );


   private static final String APP_PACKAGE_START = "com.fhi.dog_walking";


    public ProfilingCommandListener(boolean enabled, String logLinePrefix) 
    {   this.enabled = enabled;
        this.logLinePrefix = logLinePrefix;
    }


    @Override
    public void commandStarted(CommandStartedEvent event) 
    {
        if (!enabled || !log.isDebugEnabled()) return;

        log.debug("{} [{}] {} on {}: {}",
                  logLinePrefix,
                  event.getRequestId(),
                  event.getCommandName(),
                  event.getDatabaseName(),
                  event.getCommand().toJson());
    }


   /**
    * Executed after each successful command.
    */
    @Override
    public void commandSucceeded(CommandSucceededEvent event) 
    {   
      if (!enabled) return;

      StackTraceElement caller =  findApplicationCaller()
                                 .orElse(new StackTraceElement("unknown", "unknown", "unknown", -1));

      log.info("{} in [{}:{}:{}], executed Mongo command [{}] (request {}) in {} ms",
               logLinePrefix,
               simpleName(caller.getClassName()),
               caller.getMethodName(),
               caller.getLineNumber(),
               event.getCommandName(),
               event.getRequestId(),
               event.getElapsedTime(TimeUnit.MILLISECONDS));
    }


    @Override
    public void commandFailed(CommandFailedEvent event) 
    {
      if (!enabled) return;

      log.warn("{} Mongo command [{}] (request {}) failed after {} ms: {}",
               logLinePrefix,
               event.getCommandName(),
               event.getRequestId(),
               event.getElapsedTime(TimeUnit.MILLISECONDS),
               event.getThrowable().getMessage());
    }


   /**
    * Finds the first stack frame that belongs to application code, skipping this
    * listener and infrastructure packages.
    */
   Optional<StackTraceElement> findApplicationCaller() 
   {
      return Arrays.stream(Thread.currentThread().getStackTrace())
                   .filter(element -> {
                                        String className = element.getClassName();
                                        return     className.startsWith(APP_PACKAGE_START)
                                                && !shouldIgnoreClass(className);
                   })
                   .findFirst();
   }


    private boolean shouldIgnoreClass(String className) 
    {
        return     IGNORED_PACKAGES.stream().anyMatch(className::startsWith)
                || IGNORED_CLASSES.contains(className);
    }


    private static String simpleName(String className) 
    {   int lastDot = className.lastIndexOf('.');
        return lastDot < 0 ? className : className.substring(lastDot + 1);
    }
}
