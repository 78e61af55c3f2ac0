/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/** Keeps {@code coincore.json5.example} in step with the built-in template. */
final class ConfigTemplateWriter {

  private ConfigTemplateWriter() {}

  /**
   * Writes the example file when it is missing or its bytes differ from {@code contents}.
   *
   * @param path destination, usually {@code config/coincore.json5.example}
   * @param contents canonical template text
   * @return {@code true} when the file was (re)written
   */
  static boolean writeExample(Path path, String contents) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(contents, "contents");

    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      byte[] data = contents.getBytes(StandardCharsets.UTF_8);
      if (Files.exists(path) && Arrays.equals(Files.readAllBytes(path), data)) {
        return false;
      }
      Files.write(path, data);
      return true;
    } catch (IOException e) {
      throw new RuntimeException("Failed to write config template: " + path, e);
    }
  }
}
