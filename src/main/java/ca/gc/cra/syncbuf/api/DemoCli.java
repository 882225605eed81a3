package ca.gc.cra.syncbuf.api;

import ca.gc.cra.syncbuf.application.sync.SyncSnapshot;
import ca.gc.cra.syncbuf.application.sync.TimeSyncBuffer;
import ca.gc.cra.syncbuf.config.BufferConfig;
import ca.gc.cra.syncbuf.config.CompositionRoot;
import ca.gc.cra.syncbuf.config.ConfigMerger;
import ca.gc.cra.syncbuf.config.DefaultsForMode;
import ca.gc.cra.syncbuf.config.DemoConfig;
import ca.gc.cra.syncbuf.config.YamlConfigLoader;
import ca.gc.cra.syncbuf.domain.buffer.ChannelSpec;
import ca.gc.cra.syncbuf.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.syncbuf.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.syncbuf.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Producer/consumer demonstration of a two-channel buffer.
 *
 * <p>One thread writes an {@code Integer} counter (stored as {@code Float}) and a {@code String} label each
 * period; another reads the freshest pair with {@code readLast} until the producer finishes. The buffer is then
 * drained and its contents printed.</p>
 */
public final class DemoCli {
  private static final Logger log = LoggerFactory.getLogger(DemoCli.class);
  private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(10);
  private static final String SUMMARY_USAGE =
      "usage: demo [capacity=N] [iterations=N] [producerPeriodMs=N] [consumerPeriodMs=N] [maxDiffMs=N] "
          + "[config=PATH] [metricsExporter=otlp|none] [--no-dump] [--verbose]";
  private static final String HELP_TEXT = """
      Time-synchronized buffer demo

      Usage:
        demo [options]

      Options:
        capacity=N             Entries kept per channel (default 10)
        iterations=N           Producer rounds (default 50)
        producerPeriodMs=N     Pause between producer rounds (default 10)
        consumerPeriodMs=N     Pause between consumer reads (default 25)
        maxDiffMs=N            readLast recency tolerance (default 100)
        drainTimeoutMs=N       Close drain timeout (default 5000)
        config=PATH            YAML file with common/demo sections
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL       OTLP metrics endpoint when exporter=otlp
        --no-dump              Skip printing the buffer contents at the end
        --verbose              Enable DEBUG logging
        --help                 Show this message
      """;

  static final ChannelSpec<Integer, Float> COUNTER = ChannelSpec.of("counter", Integer.class, Float.class);
  static final ChannelSpec<String, String> LABEL = ChannelSpec.identity("label", String.class);

  private DemoCli() {}

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
   * Runs the demo and returns its exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for demo CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, "demo");
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
        "demo", yamlConfig, kv, DefaultsForMode.asFlatMap("demo"), log::warn));
    boolean dump = !input.hasFlag("--no-dump") && ConfigCliUtils.parseBoolean(effective, "dump", true);

    CompositionRoot root;
    DemoConfig demo;
    try {
      String exporter = TelemetryConfigurator.configureMetrics(effective);
      BufferConfig bufferConfig = BufferConfig.fromMap(effective);
      demo = DemoConfig.fromMap(effective);
      root = new CompositionRoot(bufferConfig, exporter);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid demo configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    log.info("Running demo: capacity={}, iterations={}, producerPeriod={}, consumerPeriod={}, maxDiff={}",
        root.bufferConfig().capacity(), demo.iterations(), demo.producerPeriod(), demo.consumerPeriod(),
        demo.maxDiff());
    try (TimeSyncBuffer buffer = root.newBuffer(List.of(COUNTER, LABEL))) {
      runProducerConsumer(buffer, demo, root);
      if (!buffer.flush(FLUSH_TIMEOUT)) {
        log.warn("Buffer did not drain within {}", FLUSH_TIMEOUT);
      }
      if (dump) {
        CliPrinter.println(buffer.dump().stripTrailing());
      }
      buffer.logContents();
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Demo interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (ExecutionException ex) {
      log.error("Demo worker failed", ex.getCause());
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in demo", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (root.metrics() instanceof OpenTelemetryMetricsAdapter otel) {
        otel.forceFlush();
        otel.close();
      }
    }
  }

  private static void runProducerConsumer(TimeSyncBuffer buffer, DemoConfig demo, CompositionRoot root)
      throws InterruptedException, ExecutionException {
    ExecutorService pool = ExecutorFactories.newNamedPool(
        2, "syncbuf-demo", (thread, ex) -> log.error("Uncaught exception in {}", thread.getName(), ex));
    CountDownLatch producerDone = new CountDownLatch(1);
    try {
      Future<?> producer = pool.submit(() -> {
        try {
          produce(buffer, demo, root);
        } finally {
          producerDone.countDown();
        }
        return null;
      });
      Future<?> consumer = pool.submit(() -> {
        consume(buffer, demo, producerDone, root);
        return null;
      });
      producer.get();
      consumer.get();
    } finally {
      pool.shutdownNow();
      if (!pool.awaitTermination(FLUSH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Demo threads did not stop within {}", FLUSH_TIMEOUT);
      }
    }
  }

  private static void produce(TimeSyncBuffer buffer, DemoConfig demo, CompositionRoot root)
      throws InterruptedException {
    for (int i = 0; i < demo.iterations(); i++) {
      long timestamp = nowMillis(root);
      buffer.put(COUNTER, i, timestamp);
      buffer.put(LABEL, "sample-" + i, timestamp);
      log.debug("Producer: {} at time: {}", i, timestamp);
      sleep(demo.producerPeriod());
    }
  }

  private static void consume(
      TimeSyncBuffer buffer, DemoConfig demo, CountDownLatch producerDone, CompositionRoot root)
      throws InterruptedException {
    do {
      SyncSnapshot latest = buffer.readLast(demo.maxDiff());
      if (latest.get(COUNTER).isPresent()) {
        CliPrinter.println("Read most recent data at " + nowMillis(root) + ": " + latest);
      }
    } while (!producerDone.await(demo.consumerPeriod().toNanos(), TimeUnit.NANOSECONDS));
  }

  private static long nowMillis(CompositionRoot root) {
    return TimeUnit.NANOSECONDS.toMillis(root.clock().nanoTime());
  }

  private static void sleep(Duration period) throws InterruptedException {
    if (!period.isZero()) {
      Thread.sleep(period.toMillis());
    }
  }
}
