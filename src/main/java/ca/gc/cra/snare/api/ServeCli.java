package ca.gc.cra.snare.api;

import ca.gc.cra.snare.application.listener.ListenerStatus;
import ca.gc.cra.snare.application.port.EventStoreException;
import ca.gc.cra.snare.application.port.ListenerBindException;
import ca.gc.cra.snare.config.CompositionRoot;
import ca.gc.cra.snare.config.ConfigMerger;
import ca.gc.cra.snare.config.DefaultsForMode;
import ca.gc.cra.snare.config.SnareConfig;
import ca.gc.cra.snare.config.YamlConfigLoader;
import ca.gc.cra.snare.domain.attack.Protocol;
import ca.gc.cra.snare.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the configured decoy listeners and blocks until the JVM is asked to stop.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String MODE = "serve";
  private static final String SUMMARY_USAGE =
      "usage: serve [config=PATH] [db=PATH] [host=ADDR] [sshPort=N] [httpPort=N] [ftpPort=N] "
          + "[protocols=ssh,http,ftp] [sshTimeoutMillis=N] [readTimeoutMillis=N] [backlog=N] "
          + "[maxConnections=N] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...] [--dry-run]";
  private static final String HELP_TEXT = """
      SNARE decoy listeners

      Usage:
        serve [options]

      Options (validated):
        config=PATH                 YAML file; 'common' and 'serve' sections are merged (CLI wins)
        db=PATH                     SQLite database (default ~/.snare/snare.db)
        host=ADDR                   Bind address shared by all decoys (default 0.0.0.0)
        sshPort=0-65535             SSH decoy port (default 2222; 0 picks a free port)
        httpPort=0-65535            HTTP decoy port (default 8080)
        ftpPort=0-65535             FTP decoy port (default 2121)
        protocols=ssh,http,ftp      Decoys to start (default all)
        sshTimeoutMillis=0-600000   SSH read timeout (default 30000)
        readTimeoutMillis=0-600000  HTTP/FTP read timeout (default 30000)
        backlog=1-65535             Accept backlog per listener (default 50)
        maxConnections=N            Concurrent handlers per listener; 0 is unbounded (default)
        metricsExporter=otlp|none   Configure metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate inputs and print the plan without binding
        --verbose                   Enable DEBUG logging for troubleshooting
        --help                      Show this message
      """;

  private ServeCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the serve command, registering a shutdown hook that stops every listener.
   *
   * @param args raw CLI arguments
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args) {
    CountDownLatch stopped = new CountDownLatch(1);
    return run(args, CompositionRoot::new, root -> {
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        log.info("Shutdown requested; stopping decoys");
        root.close();
        stopped.countDown();
      }, "snare-shutdown"));
      return stopped;
    });
  }

  /**
   * Runs the serve command with an explicit graph factory and stop signal.
   *
   * @param args raw CLI arguments
   * @param rootFactory builds the composition root from validated configuration
   * @param stopSignal supplies the latch whose release ends the serve loop
   * @return exit code signalling success or failure
   */
  static ExitCode run(
      String[] args,
      Function<SnareConfig, CompositionRoot> rootFactory,
      Function<CompositionRoot, CountDownLatch> stopSignal) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve CLI");
    }

    Map<String, String> cliArgs;
    try {
      cliArgs = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(cliArgs);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      try {
        yaml = YamlConfigLoader.load(Path.of(configPath), MODE);
        if (yaml.isEmpty()) {
          log.error("Config file not found: {}", configPath);
          return ExitCode.CONFIG_ERROR;
        }
      } catch (IOException | InvalidPathException ex) {
        log.error("Unable to read config file {}: {}", configPath, ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IllegalArgumentException ex) {
        log.error("Invalid config file {}: {}", configPath, ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
    }

    SnareConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          MODE, yaml, cliArgs, DefaultsForMode.asFlatMap(MODE), log::warn);
      config = SnareConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return yaml.isPresent() ? ExitCode.CONFIG_ERROR : ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run") || config.dryRun()) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    TelemetryConfigurator.configureMetrics(config);

    CompositionRoot root;
    try {
      root = rootFactory.apply(config);
    } catch (EventStoreException ex) {
      log.error("Unable to open event store {}", config.database(), ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot active = root) {
      List<ListenerStatus> started = new ArrayList<>();
      for (Protocol protocol : config.protocols()) {
        started.add(active.registry().start(protocol, config.host(), config.port(protocol)));
      }
      log.info("SNARE serving {} decoy(s); database {}", started.size(), config.database());
      stopSignal.apply(active).await();
      return ExitCode.SUCCESS;
    } catch (ListenerBindException ex) {
      log.error("Unable to bind {}:{}", ex.host(), ex.port(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Serve configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Serve interrupted; stopping decoys", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while serving", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(SnareConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Serve dry-run: no sockets will be bound.");
    lines.add(" Database         : " + config.database());
    lines.add(" Bind host        : " + config.host());
    for (Protocol protocol : config.protocols()) {
      lines.add(String.format(" %-16s : port %d", protocol.label().toUpperCase(Locale.ROOT) + " decoy",
          config.port(protocol)));
    }
    lines.add(" SSH timeout (ms) : " + config.sshTimeout().toMillis());
    lines.add(" Read timeout (ms): " + config.readTimeout().toMillis());
    lines.add(" Backlog          : " + config.backlog());
    lines.add(" Max connections  : " + (config.maxConnections() == 0 ? "unbounded" : config.maxConnections()));
    lines.add(" Metrics exporter : " + config.metricsExporter());
    lines.add(" Re-run without --dry-run to start the decoys.");
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
