package stackwatch;

import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.jul.LevelChangePropagator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;

/**
 * Initializes a minimal/readable logback config.
 *
 * Build and deploy output is interleaved with ours on the console, so the
 * pattern stays short.
 */
public class LoggingConfig {

  private static final String pattern = "%date{YYYY-MM-dd HH:mm:ss} %-5level %msg%n";
  private static volatile boolean started = false;

  public synchronized static void init() {
    if (started) {
      return;
    }
    started = true;

    // route java.util.logging (e.g. from the JDK's WatchService internals) to slf4j
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();

    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    LevelChangePropagator p = new LevelChangePropagator();
    p.setContext(context);
    p.start();
    context.addListener(p);

    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setContext(context);
    console.setEncoder(newEncoder(context));
    console.start();

    Logger root = getRootLogger();
    root.detachAndStopAllAppenders();
    root.addAppender(console);
    root.setLevel(Level.INFO);

    getLogger("stackwatch").setLevel(Level.INFO);
    // jgit logs at debug for every ignore rule it compiles
    getLogger("org.eclipse.jgit").setLevel(Level.WARN);
  }

  /** For --debug, shows every trigger and sync decision. */
  public synchronized static void enableDebug() {
    init();
    getLogger("stackwatch").setLevel(Level.DEBUG);
  }

  public synchronized static void enableLogFile() {
    init();

    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

    FileAppender<ILoggingEvent> file = new FileAppender<>();
    file.setContext(context);
    file.setAppend(true);
    file.setFile("stackwatch.log");
    file.setEncoder(newEncoder(context));
    file.start();
    getRootLogger().addAppender(file);
    getLogger("stackwatch").setLevel(Level.DEBUG);
  }

  private static PatternLayoutEncoder newEncoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(pattern);
    encoder.start();
    return encoder;
  }

  private static Logger getRootLogger() {
    return getLogger(Logger.ROOT_LOGGER_NAME);
  }

  private static Logger getLogger(String name) {
    return (Logger) LoggerFactory.getLogger(name);
  }

}
