/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import dev.coincore.api.Work;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runtime configuration loaded from {@code config/coincore.json5}.
 *
 * <ul>
 *   <li>Writes a commented template on first boot.
 *   <li>Emits a {@code coincore.json5.example} snapshot for ops tooling.
 *   <li>Supports environment overrides for the DB connection ({@code COINCORE_DB_*}).
 *   <li>Parses the economy rule blocks handed to each engine at construction.
 * </ul>
 *
 * <p>Instances are immutable. Reloading means building a new {@code Config} and new engines.
 */
public final class Config {

  private static final String TEMPLATE =
      """
      // CoinCore v1.0.0 configuration (JSON5 with comments)
      // Drop into config/coincore.json5. Environment overrides: COINCORE_DB_HOST|PORT|DATABASE|USER|PASSWORD.
      {
        core: {
          db: {
            host: "127.0.0.1",
            port: 3306,
            database: "coincore",
            user: "coincore",
            password: "change-me",
            tls: { enabled: false },
            session: { forceUtc: true },
            pool: {
              maxPoolSize: 10,
              minimumIdle: 2,
              connectionTimeoutMs: 10000,
              idleTimeoutMs: 600000,
              maxLifetimeMs: 1700000,
              startupAttempts: 3
            }
          },
          runtime: { reconnectEveryS: 10 },
          // Whole-unit retries on deadlock / lock wait timeout
          store: { maxRetries: 3 },
          // Zone that defines "today" for quotas, limits, streaks and interest cycles
          time: { zone: "UTC" },
          log: {
            json: false,
            level: "INFO"
          }
        },
        economy: {
          checkin: {
            baseReward: 100,
            randomMin: 0,
            randomMax: 50,
            // streak day -> bonus; the highest tier reached applies
            streakBonuses: { "3": 50, "7": 200, "15": 500, "30": 1000 }
          },
          work: {
            dailyLimit: 10,
            cooldownMultiplier: 1.0,
            expMultiplier: 1.0,
            luckChance: 0.10,
            luckRatio: 0.5,
            levelBonusRate: 0.02,
            jobs: [
              { name: "搬砖", baseSalary: 80, minSalary: 60, maxSalary: 120, level: 1, cooldownHours: 1, exp: 5 },
              { name: "送外卖", baseSalary: 120, minSalary: 80, maxSalary: 180, level: 1, cooldownHours: 1, exp: 8 },
              { name: "便利店员", baseSalary: 150, minSalary: 100, maxSalary: 200, level: 2, cooldownHours: 2, exp: 10 },
              { name: "快递员", baseSalary: 200, minSalary: 150, maxSalary: 280, level: 3, cooldownHours: 2, exp: 15 },
              { name: "客服代表", baseSalary: 250, minSalary: 180, maxSalary: 350, level: 5, cooldownHours: 3, exp: 20 },
              { name: "程序员", baseSalary: 500, minSalary: 300, maxSalary: 800, level: 10, cooldownHours: 4, exp: 50 },
              { name: "设计师", baseSalary: 450, minSalary: 280, maxSalary: 700, level: 8, cooldownHours: 4, exp: 40 },
              { name: "金融分析师", baseSalary: 800, minSalary: 500, maxSalary: 1200, level: 15, cooldownHours: 6, exp: 80 },
              { name: "企业顾问", baseSalary: 1000, minSalary: 600, maxSalary: 1500, level: 20, cooldownHours: 8, exp: 100 }
            ]
          },
          bank: {
            minDeposit: 10,
            maxDeposit: 100000,
            minWithdraw: 10,
            maxWithdraw: 50000,
            dailyWithdrawLimit: 200000,
            // daily fractional rates
            baseRate: 0.001,
            vipRate: 0.0015,
            vipThreshold: 10000
          },
          robbery: {
            successRate: 0.30,
            minAmount: 50,
            maxAmount: 300,
            cooldownHours: 6,
            levelRequirement: 5,
            protectionAmount: 100,
            failurePenalty: 20
          }
        },
        modules: {
          scheduler: {
            enabled: true,
            jobs: {
              interest: {
                enabled: true,
                // sec min hour day month dow, evaluated in core.time.zone
                schedule: "0 0 0 * * *"
              }
            }
          }
        }
      }
      """;

  private final Db db;
  private final Runtime runtime;
  private final Store store;
  private final Time time;
  private final Economy economy;
  private final Modules modules;
  private final Log log;

  private Config(
      Db db,
      Runtime runtime,
      Store store,
      Time time,
      Economy economy,
      Modules modules,
      Log log) {
    this.db = db;
    this.runtime = runtime;
    this.store = store;
    this.time = time;
    this.economy = economy;
    this.modules = modules;
    this.log = log;
  }

  /**
   * Database connection block.
   *
   * @return database settings
   */
  public Db db() {
    return db;
  }

  /**
   * Runtime behavior (reconnect cadence).
   *
   * @return runtime configuration values
   */
  public Runtime runtime() {
    return runtime;
  }

  /**
   * Ledger store behavior.
   *
   * @return store settings
   */
  public Store store() {
    return store;
  }

  /**
   * Day-boundary zone.
   *
   * @return time settings
   */
  public Time time() {
    return time;
  }

  /**
   * Economy rules.
   *
   * @return rule blocks for every engine
   */
  public Economy economy() {
    return economy;
  }

  /**
   * Module configuration.
   *
   * @return module toggles and settings
   */
  public Modules modules() {
    return modules;
  }

  /**
   * Scheduled job configuration.
   *
   * @return job scheduling block
   */
  public Jobs jobs() {
    return modules.scheduler().jobs();
  }

  /**
   * Logging configuration.
   *
   * @return logging configuration block
   */
  public Log log() {
    return log;
  }

  /**
   * Loads configuration, writing a default file if it does not exist and always refreshing the
   * commented example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    try {
      Path configDir = path.getParent();
      Path exampleDir = configDir != null ? configDir : Path.of(".");
      ConfigTemplateWriter.writeExample(exampleDir.resolve("coincore.json5.example"), TEMPLATE);

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }
      return parse(Files.readString(path, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new RuntimeException("Failed to read config: " + path, e);
    }
  }

  /**
   * Parses JSON5 text into a validated config.
   *
   * @param raw JSON5 document
   * @return parsed config
   * @throws IllegalStateException when a block is missing or a value is out of range
   */
  static Config parse(String raw) {
    JsonObject root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    JsonObject core = optObject(root, "core");
    if (core == null) {
      throw new IllegalStateException("config missing core{} block");
    }

    Db db = parseDb(optObject(core, "db"));
    Runtime runtime = new Runtime(optInt(optObject(core, "runtime"), "reconnectEveryS", 10));
    Store store = new Store(optInt(optObject(core, "store"), "maxRetries", 3));
    Time time = parseTime(optObject(core, "time"));
    Economy economy = parseEconomy(optObject(root, "economy"));
    Modules modules = parseModules(optObject(root, "modules"));
    Log log = parseLog(optObject(core, "log"));

    Config config = new Config(db, runtime, store, time, economy, modules, log);
    validate(config);
    return config;
  }

  /** Built-in template text. */
  static String template() {
    return TEMPLATE;
  }

  private static String stripJson5(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    boolean inString = false;
    char quote = 0;
    int i = 0;
    while (i < raw.length()) {
      char ch = raw.charAt(i);
      if (inString) {
        out.append(ch);
        if (ch == '\\' && i + 1 < raw.length()) {
          out.append(raw.charAt(i + 1));
          i += 2;
          continue;
        }
        if (ch == quote) {
          inString = false;
        }
        i++;
        continue;
      }
      if (ch == '"' || ch == '\'') {
        inString = true;
        quote = ch;
        out.append(ch);
        i++;
      } else if (ch == '/' && i + 1 < raw.length() && raw.charAt(i + 1) == '/') {
        while (i < raw.length() && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (ch == '/' && i + 1 < raw.length() && raw.charAt(i + 1) == '*') {
        int end = raw.indexOf("*/", i + 2);
        i = end < 0 ? raw.length() : end + 2;
      } else if (ch == ',' && nextSignificantCloses(raw, i + 1)) {
        i++;
      } else {
        out.append(ch);
        i++;
      }
    }
    return out.toString();
  }

  private static boolean nextSignificantCloses(String raw, int from) {
    int i = from;
    while (i < raw.length()) {
      char ch = raw.charAt(i);
      if (Character.isWhitespace(ch)) {
        i++;
      } else if (ch == '/' && i + 1 < raw.length() && raw.charAt(i + 1) == '/') {
        while (i < raw.length() && raw.charAt(i) != '\n') {
          i++;
        }
      } else if (ch == '/' && i + 1 < raw.length() && raw.charAt(i + 1) == '*') {
        int end = raw.indexOf("*/", i + 2);
        i = end < 0 ? raw.length() : end + 2;
      } else {
        return ch == '}' || ch == ']';
      }
    }
    return false;
  }

  private static Db parseDb(JsonObject db) {
    if (db == null) {
      throw new IllegalStateException("config missing core.db{}");
    }
    String envHost = System.getenv("COINCORE_DB_HOST");
    String envPort = System.getenv("COINCORE_DB_PORT");
    String envDatabase = System.getenv("COINCORE_DB_DATABASE");
    String envUser = System.getenv("COINCORE_DB_USER");
    String envPassword = System.getenv("COINCORE_DB_PASSWORD");

    String host = envHost != null ? envHost : optString(db, "host", "127.0.0.1");
    int port = envPort != null ? parsePort(envPort) : optInt(db, "port", 3306);
    String database = envDatabase != null ? envDatabase : optString(db, "database", "coincore");
    String user = envUser != null ? envUser : optString(db, "user", "coincore");
    String password = envPassword != null ? envPassword : optString(db, "password", "");

    JsonObject tlsObj = optObject(db, "tls");
    boolean tls = tlsObj != null && optBoolean(tlsObj, "enabled", false);

    JsonObject sessionObj = optObject(db, "session");
    boolean forceUtc = sessionObj == null || optBoolean(sessionObj, "forceUtc", true);

    JsonObject poolObj = optObject(db, "pool");
    Pool pool =
        new Pool(
            optInt(poolObj, "maxPoolSize", 10),
            optInt(poolObj, "minimumIdle", 2),
            optLong(poolObj, "connectionTimeoutMs", 10_000L),
            optLong(poolObj, "idleTimeoutMs", 600_000L),
            optLong(poolObj, "maxLifetimeMs", 1_700_000L),
            optInt(poolObj, "startupAttempts", 3));
    return new Db(host, port, database, user, password, tls, forceUtc, pool);
  }

  private static int parsePort(String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("COINCORE_DB_PORT is not a number: " + raw, e);
    }
  }

  private static Time parseTime(JsonObject time) {
    String zone = optString(time, "zone", "UTC");
    try {
      return new Time(ZoneId.of(zone));
    } catch (Exception e) {
      throw new IllegalStateException("core.time.zone is invalid: " + zone, e);
    }
  }

  private static Economy parseEconomy(JsonObject economy) {
    return new Economy(
        parseCheckin(optObject(economy, "checkin")),
        parseWork(optObject(economy, "work")),
        parseBank(optObject(economy, "bank")),
        parseRobbery(optObject(economy, "robbery")));
  }

  private static CheckinRules parseCheckin(JsonObject checkin) {
    CheckinRules defaults = CheckinRules.defaults();
    if (checkin == null) {
      return defaults;
    }
    NavigableMap<Integer, Long> tiers = defaults.streakBonuses();
    JsonObject tierObj = optObject(checkin, "streakBonuses");
    if (tierObj != null) {
      tiers = new TreeMap<>();
      for (Map.Entry<String, JsonElement> entry : tierObj.entrySet()) {
        int day;
        try {
          day = Integer.parseInt(entry.getKey().trim());
        } catch (NumberFormatException e) {
          throw new IllegalStateException(
              "economy.checkin.streakBonuses keys must be day numbers: " + entry.getKey(), e);
        }
        tiers.put(day, entry.getValue().getAsLong());
      }
    }
    return new CheckinRules(
        optLong(checkin, "baseReward", defaults.baseReward()),
        optLong(checkin, "randomMin", defaults.randomMin()),
        optLong(checkin, "randomMax", defaults.randomMax()),
        tiers);
  }

  private static WorkRules parseWork(JsonObject work) {
    WorkRules defaults = WorkRules.defaults();
    if (work == null) {
      return defaults;
    }
    List<Work.Job> jobs = defaults.jobs();
    if (work.has("jobs") && work.get("jobs").isJsonArray()) {
      JsonArray arr = work.getAsJsonArray("jobs");
      jobs = new ArrayList<>(arr.size());
      for (JsonElement el : arr) {
        if (!el.isJsonObject()) {
          throw new IllegalStateException("economy.work.jobs entries must be objects");
        }
        JsonObject job = el.getAsJsonObject();
        String name = optString(job, "name", null);
        if (name == null || name.isBlank()) {
          throw new IllegalStateException("economy.work.jobs entry missing name");
        }
        long min = optLong(job, "minSalary", 0L);
        long max = optLong(job, "maxSalary", min);
        jobs.add(
            new Work.Job(
                name.trim(),
                optLong(job, "baseSalary", min),
                min,
                max,
                optInt(job, "level", 1),
                optDouble(job, "cooldownHours", 1.0D),
                optLong(job, "exp", 0L)));
      }
    }
    return new WorkRules(
        optInt(work, "dailyLimit", defaults.dailyLimit()),
        optDouble(work, "cooldownMultiplier", defaults.cooldownMultiplier()),
        optDouble(work, "expMultiplier", defaults.expMultiplier()),
        optDouble(work, "luckChance", defaults.luckChance()),
        optDouble(work, "luckRatio", defaults.luckRatio()),
        optDouble(work, "levelBonusRate", defaults.levelBonusRate()),
        jobs);
  }

  private static BankRules parseBank(JsonObject bank) {
    BankRules d = BankRules.defaults();
    if (bank == null) {
      return d;
    }
    return new BankRules(
        optLong(bank, "minDeposit", d.minDeposit()),
        optLong(bank, "maxDeposit", d.maxDeposit()),
        optLong(bank, "minWithdraw", d.minWithdraw()),
        optLong(bank, "maxWithdraw", d.maxWithdraw()),
        optLong(bank, "dailyWithdrawLimit", d.dailyWithdrawLimit()),
        optDouble(bank, "baseRate", d.baseRate()),
        optDouble(bank, "vipRate", d.vipRate()),
        optLong(bank, "vipThreshold", d.vipThreshold()));
  }

  private static RobberyRules parseRobbery(JsonObject robbery) {
    RobberyRules d = RobberyRules.defaults();
    if (robbery == null) {
      return d;
    }
    return new RobberyRules(
        optDouble(robbery, "successRate", d.successRate()),
        optLong(robbery, "minAmount", d.minAmount()),
        optLong(robbery, "maxAmount", d.maxAmount()),
        optDouble(robbery, "cooldownHours", d.cooldownHours()),
        optInt(robbery, "levelRequirement", d.levelRequirement()),
        optLong(robbery, "protectionAmount", d.protectionAmount()),
        optLong(robbery, "failurePenalty", d.failurePenalty()));
  }

  private static Modules parseModules(JsonObject modules) {
    JsonObject scheduler = optObject(modules, "scheduler");
    boolean enabled = scheduler == null || optBoolean(scheduler, "enabled", true);
    JsonObject jobsObj = optObject(scheduler, "jobs");
    JsonObject interestObj = optObject(jobsObj, "interest");
    Interest interest =
        new Interest(
            interestObj == null || optBoolean(interestObj, "enabled", true),
            optString(interestObj, "schedule", "0 0 0 * * *"));
    return new Modules(new SchedulerModule(enabled, new Jobs(interest)));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, "INFO");
    }
    return new Log(optBoolean(log, "json", false), optString(log, "level", "INFO"));
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static int optInt(JsonObject obj, String key, int def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsInt() : def;
  }

  private static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  private static double optDouble(JsonObject obj, String key, double def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsDouble() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsString() : def;
  }

  private static void validate(Config cfg) {
    validateDb(cfg.db());
    int reconnect = cfg.runtime().reconnectEveryS();
    if (reconnect < 5 || reconnect > 300) {
      throw new IllegalStateException(
          "core.runtime.reconnectEveryS must be between 5 and 300 seconds");
    }
    int retries = cfg.store().maxRetries();
    if (retries < 0 || retries > 10) {
      throw new IllegalStateException("core.store.maxRetries must be between 0 and 10");
    }
    validateEconomy(cfg.economy());
    validateJobs(cfg.modules());
    validateLog(cfg.log());
  }

  private static void validateDb(Db db) {
    requireNonBlank(db.host(), "core.db.host");
    requireNonBlank(db.database(), "core.db.database");
    requireNonBlank(db.user(), "core.db.user");
    if (db.port() <= 0 || db.port() > 65535) {
      throw new IllegalStateException("core.db.port must be between 1 and 65535");
    }
    if (db.host().contains(" ")) {
      throw new IllegalStateException("core.db.host must not contain spaces");
    }
    if (!db.database().matches("[A-Za-z0-9_]+")) {
      throw new IllegalStateException("core.db.database must match [A-Za-z0-9_]+");
    }
    Pool pool = db.pool();
    if (pool.maxPoolSize() < 1 || pool.maxPoolSize() > 50) {
      throw new IllegalStateException("core.db.pool.maxPoolSize must be between 1 and 50");
    }
    if (pool.minimumIdle() < 0 || pool.minimumIdle() > pool.maxPoolSize()) {
      throw new IllegalStateException("core.db.pool.minimumIdle must be between 0 and maxPoolSize");
    }
    if (pool.connectionTimeoutMs() < 1_000 || pool.connectionTimeoutMs() > 120_000) {
      throw new IllegalStateException(
          "core.db.pool.connectionTimeoutMs must be between 1000 and 120000");
    }
    if (pool.idleTimeoutMs() < 10_000 || pool.idleTimeoutMs() > 3_600_000) {
      throw new IllegalStateException(
          "core.db.pool.idleTimeoutMs must be between 10000 and 3600000");
    }
    if (pool.maxLifetimeMs() < 30_000L || pool.maxLifetimeMs() > 3_600_000L) {
      throw new IllegalStateException(
          "core.db.pool.maxLifetimeMs must be between 30000 and 3600000");
    }
    if (pool.startupAttempts() < 1 || pool.startupAttempts() > 10) {
      throw new IllegalStateException("core.db.pool.startupAttempts must be between 1 and 10");
    }
    if (pool.idleTimeoutMs() >= pool.maxLifetimeMs()) {
      throw new IllegalStateException("core.db.pool.idleTimeoutMs must be less than maxLifetimeMs");
    }
  }

  private static void validateEconomy(Economy economy) {
    CheckinRules checkin = economy.checkin();
    if (checkin.baseReward() < 0) {
      throw new IllegalStateException("economy.checkin.baseReward must be >= 0");
    }
    if (checkin.randomMin() < 0 || checkin.randomMax() < checkin.randomMin()) {
      throw new IllegalStateException("economy.checkin.randomMin/randomMax must satisfy 0 <= min <= max");
    }
    for (Map.Entry<Integer, Long> tier : checkin.streakBonuses().entrySet()) {
      if (tier.getKey() < 1 || tier.getValue() < 0) {
        throw new IllegalStateException(
            "economy.checkin.streakBonuses entries must have day >= 1 and bonus >= 0");
      }
    }

    WorkRules work = economy.work();
    if (work.dailyLimit() < 1) {
      throw new IllegalStateException("economy.work.dailyLimit must be >= 1");
    }
    if (work.cooldownMultiplier() < 0 || work.expMultiplier() < 0) {
      throw new IllegalStateException("economy.work multipliers must be >= 0");
    }
    requireFraction(work.luckChance(), "economy.work.luckChance");
    if (work.luckRatio() < 0 || work.levelBonusRate() < 0) {
      throw new IllegalStateException("economy.work.luckRatio and levelBonusRate must be >= 0");
    }
    if (work.jobs().isEmpty()) {
      throw new IllegalStateException("economy.work.jobs must list at least one job");
    }
    Set<String> names = new HashSet<>();
    for (Work.Job job : work.jobs()) {
      if (!names.add(job.name())) {
        throw new IllegalStateException("economy.work.jobs has duplicate name: " + job.name());
      }
      if (job.minSalary() < 0 || job.maxSalary() < job.minSalary() || job.baseSalary() < 0) {
        throw new IllegalStateException(
            "economy.work.jobs[" + job.name() + "] salaries must satisfy 0 <= min <= max");
      }
      if (job.levelRequired() < 1 || job.cooldownHours() < 0 || job.expReward() < 0) {
        throw new IllegalStateException(
            "economy.work.jobs[" + job.name() + "] needs level >= 1, cooldownHours >= 0, exp >= 0");
      }
    }

    BankRules bank = economy.bank();
    if (bank.minDeposit() < 1 || bank.maxDeposit() < bank.minDeposit()) {
      throw new IllegalStateException("economy.bank deposit bounds must satisfy 1 <= min <= max");
    }
    if (bank.minWithdraw() < 1 || bank.maxWithdraw() < bank.minWithdraw()) {
      throw new IllegalStateException("economy.bank withdraw bounds must satisfy 1 <= min <= max");
    }
    if (bank.dailyWithdrawLimit() < 0) {
      throw new IllegalStateException("economy.bank.dailyWithdrawLimit must be >= 0");
    }
    if (bank.baseRate() < 0 || bank.vipRate() < 0 || bank.vipThreshold() < 0) {
      throw new IllegalStateException("economy.bank rates and vipThreshold must be >= 0");
    }

    RobberyRules robbery = economy.robbery();
    requireFraction(robbery.successRate(), "economy.robbery.successRate");
    if (robbery.minAmount() < 0 || robbery.maxAmount() < robbery.minAmount()) {
      throw new IllegalStateException("economy.robbery amounts must satisfy 0 <= min <= max");
    }
    if (robbery.cooldownHours() < 0
        || robbery.levelRequirement() < 1
        || robbery.protectionAmount() < 0
        || robbery.failurePenalty() < 0) {
      throw new IllegalStateException(
          "economy.robbery needs cooldownHours >= 0, levelRequirement >= 1, protection and penalty >= 0");
    }
  }

  private static void validateJobs(Modules modules) {
    Interest interest = modules.scheduler().jobs().interest();
    requireNonBlank(interest.schedule(), "modules.scheduler.jobs.interest.schedule");
    String[] parts = interest.schedule().trim().split("\\s+");
    if (parts.length != 6) {
      throw new IllegalStateException(
          "modules.scheduler.jobs.interest.schedule must be a 6-field cron expression");
    }
  }

  private static void validateLog(Log log) {
    requireNonBlank(log.level(), "core.log.level");
    String normalized = log.level().toUpperCase(Locale.ROOT);
    if (!List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR").contains(normalized)) {
      throw new IllegalStateException("core.log.level must be TRACE, DEBUG, INFO, WARN, or ERROR");
    }
  }

  private static void requireFraction(double value, String field) {
    if (Double.isNaN(value) || value < 0 || value > 1) {
      throw new IllegalStateException(field + " must be between 0 and 1");
    }
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalStateException(field + " must be provided");
    }
  }

  /**
   * Database settings parsed from {@code core.db}.
   *
   * @param host hostname or IP for the MariaDB server
   * @param port TCP port for the database service
   * @param database schema name to use when connecting
   * @param user database user
   * @param password password for the configured {@code user}
   * @param tlsEnabled whether to request TLS when connecting
   * @param forceUtc whether to issue {@code SET time_zone='+00:00'} per connection
   * @param pool pool tuning overrides applied to HikariCP
   */
  public record Db(
      String host,
      int port,
      String database,
      String user,
      String password,
      boolean tlsEnabled,
      boolean forceUtc,
      Pool pool) {

    /**
     * Fully formed JDBC URL (MariaDB tuned for UTF-8 + UTC).
     *
     * @return JDBC URL string for MariaDB connections
     */
    public String jdbcUrl() {
      StringBuilder url =
          new StringBuilder("jdbc:mariadb://")
              .append(host)
              .append(':')
              .append(port)
              .append('/')
              .append(database)
              .append("?useUnicode=true&characterEncoding=utf8mb4&serverTimezone=UTC");
      if (tlsEnabled) {
        url.append("&sslMode=VERIFY_IDENTITY");
      } else {
        url.append("&sslMode=DISABLE");
      }
      return url.toString();
    }
  }

  /**
   * Connection pool tuning.
   *
   * @param maxPoolSize maximum number of pooled connections
   * @param minimumIdle minimum number of idle connections to retain
   * @param connectionTimeoutMs wait time when borrowing a connection
   * @param idleTimeoutMs idle connection eviction threshold
   * @param maxLifetimeMs maximum lifetime of each connection
   * @param startupAttempts retry count when initializing the pool
   */
  public record Pool(
      int maxPoolSize,
      int minimumIdle,
      long connectionTimeoutMs,
      long idleTimeoutMs,
      long maxLifetimeMs,
      int startupAttempts) {}

  /**
   * Runtime reconnect cadence.
   *
   * @param reconnectEveryS seconds between degraded-mode reconnect probes
   */
  public record Runtime(int reconnectEveryS) {}

  /**
   * Ledger store behavior.
   *
   * @param maxRetries whole-unit retries after a deadlock or lock wait timeout
   */
  public record Store(int maxRetries) {}

  /**
   * Day boundaries.
   *
   * @param zone zone in which calendar days are evaluated
   */
  public record Time(ZoneId zone) {}

  /**
   * Economy rules, one block per engine.
   *
   * @param checkin checkin rules
   * @param work work rules and job catalog
   * @param bank bank limits and interest rates
   * @param robbery robbery rules
   */
  public record Economy(
      CheckinRules checkin, WorkRules work, BankRules bank, RobberyRules robbery) {

    /** Built-in defaults for every block. */
    public static Economy defaults() {
      return new Economy(
          CheckinRules.defaults(),
          WorkRules.defaults(),
          BankRules.defaults(),
          RobberyRules.defaults());
    }
  }

  /**
   * Checkin rewards.
   *
   * @param baseReward fixed part of every reward
   * @param randomMin lowest random part
   * @param randomMax highest random part
   * @param streakBonuses streak day threshold to bonus; the highest reached tier applies
   */
  public record CheckinRules(
      long baseReward, long randomMin, long randomMax, NavigableMap<Integer, Long> streakBonuses) {
    public CheckinRules {
      streakBonuses = Collections.unmodifiableNavigableMap(new TreeMap<>(streakBonuses));
    }

    public static CheckinRules defaults() {
      TreeMap<Integer, Long> tiers = new TreeMap<>();
      tiers.put(3, 50L);
      tiers.put(7, 200L);
      tiers.put(15, 500L);
      tiers.put(30, 1000L);
      return new CheckinRules(100L, 0L, 50L, tiers);
    }

    /** Bonus of the highest tier {@code streak} has reached, 0 below the first tier. */
    public long streakBonus(long streak) {
      if (streak > Integer.MAX_VALUE) {
        streak = Integer.MAX_VALUE;
      }
      Map.Entry<Integer, Long> tier = streakBonuses.floorEntry((int) streak);
      return tier == null ? 0L : tier.getValue();
    }
  }

  /**
   * Work rules.
   *
   * @param dailyLimit shifts allowed per calendar day
   * @param cooldownMultiplier factor applied to every job cooldown
   * @param expMultiplier factor applied to every experience reward
   * @param luckChance probability of the luck bonus
   * @param luckRatio luck bonus as a fraction of the drawn salary
   * @param levelBonusRate bonus per level above 1, as a fraction of the job's base salary
   * @param jobs job catalog in display order
   */
  public record WorkRules(
      int dailyLimit,
      double cooldownMultiplier,
      double expMultiplier,
      double luckChance,
      double luckRatio,
      double levelBonusRate,
      List<Work.Job> jobs) {
    public WorkRules {
      jobs = List.copyOf(jobs);
    }

    public static WorkRules defaults() {
      return new WorkRules(
          10,
          1.0D,
          1.0D,
          0.10D,
          0.5D,
          0.02D,
          List.of(
              new Work.Job("搬砖", 80, 60, 120, 1, 1, 5),
              new Work.Job("送外卖", 120, 80, 180, 1, 1, 8),
              new Work.Job("便利店员", 150, 100, 200, 2, 2, 10),
              new Work.Job("快递员", 200, 150, 280, 3, 2, 15),
              new Work.Job("客服代表", 250, 180, 350, 5, 3, 20),
              new Work.Job("程序员", 500, 300, 800, 10, 4, 50),
              new Work.Job("设计师", 450, 280, 700, 8, 4, 40),
              new Work.Job("金融分析师", 800, 500, 1200, 15, 6, 80),
              new Work.Job("企业顾问", 1000, 600, 1500, 20, 8, 100)));
    }

    /** Catalog entry named {@code name}. */
    public Optional<Work.Job> job(String name) {
      if (name == null) {
        return Optional.empty();
      }
      String wanted = name.trim();
      return jobs.stream().filter(j -> j.name().equals(wanted)).findFirst();
    }
  }

  /**
   * Bank limits and interest.
   *
   * @param minDeposit smallest deposit or transfer
   * @param maxDeposit largest deposit or transfer
   * @param minWithdraw smallest withdrawal
   * @param maxWithdraw largest withdrawal
   * @param dailyWithdrawLimit total withdrawals allowed per calendar day
   * @param baseRate daily interest rate below the VIP threshold
   * @param vipRate daily interest rate at or above the VIP threshold
   * @param vipThreshold savings at which the VIP rate applies
   */
  public record BankRules(
      long minDeposit,
      long maxDeposit,
      long minWithdraw,
      long maxWithdraw,
      long dailyWithdrawLimit,
      double baseRate,
      double vipRate,
      long vipThreshold) {

    public static BankRules defaults() {
      return new BankRules(10L, 100_000L, 10L, 50_000L, 200_000L, 0.001D, 0.0015D, 10_000L);
    }

    /** Whether {@code savings} earns the VIP rate. */
    public boolean isVip(long savings) {
      return savings >= vipThreshold;
    }

    /** Daily rate applicable to {@code savings}. */
    public double rateFor(long savings) {
      return isVip(savings) ? vipRate : baseRate;
    }
  }

  /**
   * Robbery rules.
   *
   * @param successRate probability that an attempt succeeds
   * @param minAmount smallest take on success
   * @param maxAmount largest take on success
   * @param cooldownHours hours between attempts by the same robber
   * @param levelRequirement minimum robber level
   * @param protectionAmount victim cash floor; poorer victims cannot be targeted
   * @param failurePenalty cash paid to the victim on failure
   */
  public record RobberyRules(
      double successRate,
      long minAmount,
      long maxAmount,
      double cooldownHours,
      int levelRequirement,
      long protectionAmount,
      long failurePenalty) {

    public static RobberyRules defaults() {
      return new RobberyRules(0.30D, 50L, 300L, 6.0D, 5, 100L, 20L);
    }
  }

  /**
   * Module configuration.
   *
   * @param scheduler scheduler module settings
   */
  public record Modules(SchedulerModule scheduler) {}

  /**
   * Scheduler module settings.
   *
   * @param enabled whether to schedule jobs
   * @param jobs job definitions
   */
  public record SchedulerModule(boolean enabled, Jobs jobs) {}

  /**
   * Scheduled jobs.
   *
   * @param interest daily interest accrual job
   */
  public record Jobs(Interest interest) {}

  /**
   * Interest accrual job.
   *
   * @param enabled whether the job is scheduled
   * @param schedule 6-field cron expression evaluated in {@link Time#zone()}
   */
  public record Interest(boolean enabled, String schedule) {}

  /**
   * Logging options.
   *
   * @param json emit one JSON object per line instead of the plain pattern
   * @param level root log level
   */
  public record Log(boolean json, String level) {}
}
