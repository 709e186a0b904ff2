package temporal.cli;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Shared helpers for CLI argument parsing and output. */
final class CliParsers {
  private CliParsers() {}

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, String optionName) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, String optionName) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + optionName + ": " + raw);
    }
  }

  /** Parses {@code t,delta} into a two-element array. */
  static int[] parseWindow(String raw) {
    List<String> parts = Splitter.on(',').trimResults().omitEmptyStrings().splitToList(raw);
    if (parts.size() != 2) {
      throw new IllegalArgumentException("--window expects t,delta but got: " + raw);
    }
    return new int[] {parseInt(parts.get(0), "--window"), parseInt(parts.get(1), "--window")};
  }

  /** Writes {@code json} to {@code out}, or to standard output when {@code out} is null. */
  static void emit(String json, Path out) throws IOException {
    if (out == null) {
      System.out.println(json);
      return;
    }
    Path parent = out.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(out, json + System.lineSeparator(), StandardCharsets.UTF_8);
  }

  /**
   * Parses {@code --option value}, {@code --option=value} and flag arguments against {@code
   * specs}.
   */
  static CliOptions parse(List<String> args, Map<String, OptionSpec> specs) {
    CliOptions.Builder builder = CliOptions.builder();
    for (int i = 0; i < args.size(); i++) {
      ParsedArg parsed = ParsedArg.parse(args.get(i));
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args.get(i));
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.size()) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args.get(++i);
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  static Map<String, OptionSpec> specs() {
    return new LinkedHashMap<>();
  }

  static List<String> tail(String[] args) {
    List<String> rest = new ArrayList<>();
    for (int i = 1; i < args.length; i++) {
      rest.add(args[i]);
    }
    return rest;
  }

  record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
