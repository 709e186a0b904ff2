package temporal.cli;

import java.io.IOException;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import temporal.core.EngineOptions;
import temporal.core.TemporalGraphEngine;
import temporal.core.TemporalGraphException;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code generate --vertices N --snapshots L --probability P [--seed S] [--out FILE]}
 *   <li>{@code expand --graph FILE [--start T --delta D | --window T,D] [--out FILE]}
 *   <li>{@code twins --graph FILE [--out FILE]}
 *   <li>{@code analyze --graph FILE [--start T] [--delta D] [--exact-limit K] [--parallel]}
 * </ul>
 *
 * Exit codes: 0 on success, 1 on I/O failure, 2 on an invalid request.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_IO = 1;
  static final int EXIT_INVALID = 2;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    if (args == null || args.length == 0) {
      LOG.error("Missing command. Expected one of: generate, expand, twins, analyze");
      return EXIT_INVALID;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    try {
      EngineOptions options = EngineOptions.fromSystemProperties();
      TemporalGraphEngine engine = new TemporalGraphEngine(options);
      return switch (command) {
        case "generate", "init-random" -> new GenerateCommand(engine).execute(args);
        case "expand", "differential", "static-expansion" ->
            new ExpandCommand(engine).execute(args);
        case "twins" -> new TwinsCommand(engine).execute(args);
        case "analyze" -> new AnalyzeCommand(options).execute(args);
        default -> {
          LOG.error("Unknown command: {}", args[0]);
          yield EXIT_INVALID;
        }
      };
    } catch (TemporalGraphException ex) {
      LOG.error("Invalid request ({}={}): {}", ex.field(), ex.value(), ex.getMessage());
      return EXIT_INVALID;
    } catch (IllegalArgumentException ex) {
      LOG.error("Invalid arguments: {}", ex.getMessage());
      return EXIT_INVALID;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return EXIT_IO;
    }
  }
}
