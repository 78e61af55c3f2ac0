/* CoinCore © 2025 — MIT */
package dev.coincore.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigTest {

  @Test
  void templateParsesToDefaults() {
    Config cfg = Config.parse(Config.template());

    assertEquals(Config.Economy.defaults(), cfg.economy());
    assertEquals(3, cfg.store().maxRetries());
    assertEquals(ZoneId.of("UTC"), cfg.time().zone());
    assertTrue(cfg.modules().scheduler().enabled());
    assertEquals("0 0 0 * * *", cfg.jobs().interest().schedule());
    assertEquals(9, cfg.economy().work().jobs().size());
    assertFalse(cfg.log().json());
  }

  @Test
  void economyBlocksOverrideDefaults() {
    Config cfg =
        Config.parse(
            minimal(
                """
                economy: {
                  checkin: { baseReward: 10, streakBonuses: { "2": 5, }, },
                  bank: { vipThreshold: 500, vipRate: 0.01 },
                  robbery: { successRate: 1.0 },
                  work: {
                    dailyLimit: 3,
                    jobs: [ { name: "tester", minSalary: 5, maxSalary: 9, cooldownHours: 0.5, exp: 2 } ]
                  }
                },
                """));

    assertEquals(10, cfg.economy().checkin().baseReward());
    assertEquals(5, cfg.economy().checkin().streakBonus(4));
    assertEquals(0, cfg.economy().checkin().streakBonus(1));
    assertEquals(0.01D, cfg.economy().bank().rateFor(500));
    assertEquals(0.001D, cfg.economy().bank().rateFor(499));
    assertEquals(1.0D, cfg.economy().robbery().successRate());
    assertEquals(3, cfg.economy().work().dailyLimit());
    var job = cfg.economy().work().job(" tester ").orElseThrow();
    assertEquals(5, job.baseSalary());
    assertEquals(1, job.levelRequired());
    assertEquals(0.5D, job.cooldownHours());
  }

  @Test
  void zoneIsConfigurable() {
    Config cfg = Config.parse(minimal("").replace("time: { zone: \"UTC\" }", "time: { zone: \"Asia/Shanghai\" }"));
    assertEquals(ZoneId.of("Asia/Shanghai"), cfg.time().zone());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(
        IllegalStateException.class,
        () -> Config.parse(minimal("economy: { bank: { minDeposit: 0 } },")));
    assertThrows(
        IllegalStateException.class,
        () -> Config.parse(minimal("economy: { robbery: { successRate: 1.5 } },")));
    assertThrows(
        IllegalStateException.class,
        () -> Config.parse(minimal("economy: { checkin: { randomMin: 10, randomMax: 5 } },")));
    assertThrows(
        IllegalStateException.class,
        () ->
            Config.parse(
                minimal(
                    "economy: { work: { jobs: [ { name: \"a\", maxSalary: 1 }, { name: \"a\", maxSalary: 1 } ] } },")));
    assertThrows(
        IllegalStateException.class,
        () -> Config.parse(minimal("modules: { scheduler: { jobs: { interest: { schedule: \"0 0 *\" } } } },")));
    assertThrows(
        IllegalStateException.class,
        () -> Config.parse(minimal("").replace("\"UTC\"", "\"Mars/Olympus\"")));
    assertThrows(IllegalStateException.class, () -> Config.parse("{ economy: {} }"));
  }

  @Test
  void invalidLogLevelIsRejected() {
    assertThrows(
        IllegalStateException.class,
        () -> Config.parse(minimal("").replace("level: \"INFO\"", "level: \"LOUD\"")));
  }

  @Test
  void loadWritesTemplateAndExample(@TempDir Path dir) {
    Path path = dir.resolve("config").resolve("coincore.json5");

    Config cfg = Config.loadOrWriteDefault(path);

    assertTrue(Files.exists(path));
    assertTrue(Files.exists(path.resolveSibling("coincore.json5.example")));
    assertEquals(Config.Economy.defaults(), cfg.economy());
  }

  private static String minimal(String extra) {
    return """
        // comment line
        {
          core: {
            db: { host: "127.0.0.1", port: 3306, database: "coincore", user: "u", password: "p" },
            time: { zone: "UTC" },
            log: { json: false, level: "INFO" },
          },
        """
        + extra
        + "\n}\n";
  }
}
