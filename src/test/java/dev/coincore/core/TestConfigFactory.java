/* CoinCore © 2025 — MIT */
package dev.coincore.core;

/** Builds configs pointing at the embedded test database. */
final class TestConfigFactory {
  private TestConfigFactory() {}

  static Config create(String database) {
    String raw =
        Config.template()
            .replace("port: 3306", "port: " + MariaDbTestSupport.port())
            .replace("database: \"coincore\"", "database: \"" + database + "\"")
            .replace("user: \"coincore\"", "user: \"" + MariaDbTestSupport.USER + "\"")
            .replace("password: \"change-me\"", "password: \"" + MariaDbTestSupport.PASSWORD + "\"")
            .replace("startupAttempts: 3", "startupAttempts: 1")
            .replace("reconnectEveryS: 10", "reconnectEveryS: 1");
    return Config.parse(raw);
  }
}
