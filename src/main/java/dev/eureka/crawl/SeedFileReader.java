package dev.eureka.crawl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Reads crawl seeds: one URL per line, blank lines and {@code #} comments ignored. */
public final class SeedFileReader {

  private SeedFileReader() {}

  public static List<String> read(Path seedFile) {
    try {
      return Files.readAllLines(seedFile, StandardCharsets.UTF_8).stream()
          .map(String::strip)
          .filter(line -> !line.isEmpty() && !line.startsWith("#"))
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read seed file " + seedFile, e);
    }
  }
}
