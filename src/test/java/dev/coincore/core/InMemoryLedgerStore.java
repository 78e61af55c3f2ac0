/* CoinCore © 2025 — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.InvariantViolationException;
import dev.coincore.api.Rankings.Metric;
import dev.coincore.api.StoreUnavailableException;
import dev.coincore.api.records.CheckinRecord;
import dev.coincore.api.records.RobberyRecord;
import dev.coincore.api.records.TransactionRecord;
import dev.coincore.api.records.TransactionType;
import dev.coincore.api.records.WorkRecord;
import dev.coincore.api.storage.LedgerSession;
import dev.coincore.api.storage.LedgerStore;
import dev.coincore.api.storage.Mutation;
import dev.coincore.api.storage.UnitOfWork;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Serialized in-memory ledger for engine tests. Every unit holds one global lock and works on a
 * copy of the state that replaces the live state only when the unit commits.
 */
final class InMemoryLedgerStore implements LedgerStore {
  private final ReentrantLock lock = new ReentrantLock();
  private State state = new State();
  private SQLException nextFault;
  private String faultAccount;

  /** Makes the next unit touching {@code accountId} fail with {@code fault}. */
  void failOnAccount(String accountId, SQLException fault) {
    lock.lock();
    try {
      this.faultAccount = accountId;
      this.nextFault = fault;
    } finally {
      lock.unlock();
    }
  }

  /** Replaces an account row directly, bypassing the engines. */
  void put(Account account) {
    lock.lock();
    try {
      state.accounts.put(account.id(), account);
    } finally {
      lock.unlock();
    }
  }

  /** Appends a bank record directly, bypassing the engines. */
  void putTransaction(TransactionRecord record) {
    lock.lock();
    try {
      state.transactions.add(withId(record, state.transactions.size() + 1L));
    } finally {
      lock.unlock();
    }
  }

  /** Appends a work record directly, bypassing the engines. */
  void putWork(WorkRecord record) {
    lock.lock();
    try {
      state.work.add(record);
    } finally {
      lock.unlock();
    }
  }

  /** Appends a checkin record directly, bypassing the engines. */
  void putCheckin(CheckinRecord record) {
    lock.lock();
    try {
      state.checkins.add(record);
    } finally {
      lock.unlock();
    }
  }

  /** Appends a robbery record directly, bypassing the engines. */
  void putRobbery(RobberyRecord record) {
    lock.lock();
    try {
      state.robberies.add(record);
    } finally {
      lock.unlock();
    }
  }

  Account account(String id) {
    lock.lock();
    try {
      return state.accounts.get(id);
    } finally {
      lock.unlock();
    }
  }

  List<TransactionRecord> transactions(String accountId) {
    lock.lock();
    try {
      return state.transactions.stream()
          .filter(r -> r.accountId().equals(accountId))
          .collect(Collectors.toList());
    } finally {
      lock.unlock();
    }
  }

  List<WorkRecord> work(String accountId) {
    lock.lock();
    try {
      return state.work.stream()
          .filter(r -> r.accountId().equals(accountId))
          .collect(Collectors.toList());
    } finally {
      lock.unlock();
    }
  }

  List<CheckinRecord> checkins(String accountId) {
    lock.lock();
    try {
      return state.checkins.stream()
          .filter(r -> r.accountId().equals(accountId))
          .collect(Collectors.toList());
    } finally {
      lock.unlock();
    }
  }

  List<RobberyRecord> robberies() {
    lock.lock();
    try {
      return List.copyOf(state.robberies);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public <T> Mutation<T> inTransaction(String op, UnitOfWork<Mutation<T>> work) {
    lock.lock();
    try {
      State working = state.copy();
      Mutation<T> m = run(op, working, work);
      if (m.commit()) {
        state = working;
      }
      return m;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public <T> T read(String op, UnitOfWork<T> work) {
    lock.lock();
    try {
      return run(op, state.copy(), work);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Account ensureAccount(String id, String displayName, long nowS) {
    lock.lock();
    try {
      Account existing = state.accounts.get(id);
      Account next;
      if (existing == null) {
        next = Account.fresh(id, displayName, nowS);
      } else {
        next =
            new Account(
                id,
                displayName,
                existing.cash(),
                existing.savings(),
                existing.totalEarned(),
                existing.level(),
                existing.experience(),
                existing.checkinStreak(),
                existing.totalCheckins(),
                existing.lastCheckinDate(),
                existing.lastWorkAtS(),
                existing.lastInterestDate(),
                existing.createdAtS(),
                nowS);
      }
      state.accounts.put(id, next);
      return next;
    } finally {
      lock.unlock();
    }
  }

  private <T> T run(String op, State working, UnitOfWork<T> work) {
    try {
      return work.run(new Session(working));
    } catch (SQLException e) {
      throw new StoreUnavailableException(
          ErrorCode.CONNECTION_LOST, op + " failed: " + e.getMessage(), e);
    }
  }

  private void maybeFail(String accountId) throws SQLException {
    if (nextFault != null && accountId.equals(faultAccount)) {
      SQLException fault = nextFault;
      nextFault = null;
      faultAccount = null;
      throw fault;
    }
  }

  private static TransactionRecord withId(TransactionRecord r, long id) {
    return new TransactionRecord(
        id, r.accountId(), r.type(), r.amount(), r.balanceBefore(), r.balanceAfter(), r.tsS());
  }

  private static final class State {
    final TreeMap<String, Account> accounts = new TreeMap<>();
    final List<TransactionRecord> transactions = new ArrayList<>();
    final List<WorkRecord> work = new ArrayList<>();
    final List<CheckinRecord> checkins = new ArrayList<>();
    final List<RobberyRecord> robberies = new ArrayList<>();

    State copy() {
      State s = new State();
      s.accounts.putAll(accounts);
      s.transactions.addAll(transactions);
      s.work.addAll(work);
      s.checkins.addAll(checkins);
      s.robberies.addAll(robberies);
      return s;
    }
  }

  private final class Session implements LedgerSession {
    private final State s;

    Session(State s) {
      this.s = s;
    }

    @Override
    public Optional<Account> findAccount(String id) {
      return Optional.ofNullable(s.accounts.get(id));
    }

    @Override
    public Optional<Account> lockAccount(String id) throws SQLException {
      maybeFail(id);
      return Optional.ofNullable(s.accounts.get(id));
    }

    @Override
    public Map<String, Account> lockAccounts(List<String> ids) throws SQLException {
      Map<String, Account> out = new LinkedHashMap<>();
      for (String id : new TreeSet<>(ids)) {
        maybeFail(id);
        Account a = s.accounts.get(id);
        if (a != null) {
          out.put(id, a);
        }
      }
      return out;
    }

    @Override
    public void updateAccount(Account account) {
      if (!s.accounts.containsKey(account.id())) {
        throw new InvariantViolationException("account row missing on update: " + account.id());
      }
      if (account.cash() < 0 || account.savings() < 0) {
        throw new InvariantViolationException("negative balance for " + account.id());
      }
      s.accounts.put(account.id(), account);
    }

    @Override
    public void appendTransaction(TransactionRecord record) {
      s.transactions.add(withId(record, s.transactions.size() + 1L));
    }

    @Override
    public void appendWork(WorkRecord r) {
      s.work.add(
          new WorkRecord(
              s.work.size() + 1L,
              r.accountId(),
              r.jobName(),
              r.baseSalary(),
              r.bonus(),
              r.totalEarned(),
              r.tsS()));
    }

    @Override
    public void appendCheckin(CheckinRecord r) throws SQLException {
      if (findCheckin(r.accountId(), r.checkinDate()).isPresent()) {
        throw new SQLIntegrityConstraintViolationException(
            "duplicate checkin", "23000", 1062);
      }
      s.checkins.add(
          new CheckinRecord(
              s.checkins.size() + 1L,
              r.accountId(),
              r.checkinDate(),
              r.rewardAmount(),
              r.consecutiveDays(),
              r.tsS()));
    }

    @Override
    public void appendRobbery(RobberyRecord r) {
      s.robberies.add(
          new RobberyRecord(
              s.robberies.size() + 1L, r.robberId(), r.victimId(), r.amount(), r.success(),
              r.tsS()));
    }

    @Override
    public Optional<CheckinRecord> findCheckin(String accountId, LocalDate day) {
      return s.checkins.stream()
          .filter(r -> r.accountId().equals(accountId) && r.checkinDate().equals(day))
          .findFirst();
    }

    @Override
    public List<CheckinRecord> recentCheckins(String accountId, int limit) {
      return s.checkins.stream()
          .filter(r -> r.accountId().equals(accountId))
          .sorted(Comparator.comparing(CheckinRecord::checkinDate).reversed())
          .limit(limit)
          .collect(Collectors.toList());
    }

    @Override
    public Tally transactionTally(String accountId, TransactionType type, long fromS, long toS) {
      List<TransactionRecord> rows =
          s.transactions.stream()
              .filter(
                  r ->
                      r.accountId().equals(accountId)
                          && r.type() == type
                          && r.tsS() >= fromS
                          && r.tsS() < toS)
              .collect(Collectors.toList());
      return new Tally(rows.size(), rows.stream().mapToLong(TransactionRecord::amount).sum());
    }

    @Override
    public List<TransactionRecord> recentTransactions(String accountId, int limit) {
      return s.transactions.stream()
          .filter(r -> r.accountId().equals(accountId))
          .sorted(
              Comparator.comparingLong(TransactionRecord::tsS)
                  .thenComparingLong(TransactionRecord::id)
                  .reversed())
          .limit(limit)
          .collect(Collectors.toList());
    }

    @Override
    public Tally workTally(String accountId, long fromS, long toS) {
      List<WorkRecord> rows = work(r -> r.accountId().equals(accountId) && in(r.tsS(), fromS, toS));
      return new Tally(rows.size(), rows.stream().mapToLong(WorkRecord::totalEarned).sum());
    }

    @Override
    public Map<String, Tally> workTallyByJob(String accountId) {
      Map<String, Tally> out = new TreeMap<>();
      for (WorkRecord r : work(r -> r.accountId().equals(accountId))) {
        Tally t = out.getOrDefault(r.jobName(), Tally.EMPTY);
        out.put(r.jobName(), new Tally(t.count() + 1, t.total() + r.totalEarned()));
      }
      return out;
    }

    @Override
    public Map<String, Long> lastWorkByJob(String accountId) {
      Map<String, Long> out = new LinkedHashMap<>();
      for (WorkRecord r : work(r -> r.accountId().equals(accountId))) {
        out.merge(r.jobName(), r.tsS(), Math::max);
      }
      return out;
    }

    @Override
    public OptionalLong lastWorkAt(String accountId, String jobName) {
      return work(r -> r.accountId().equals(accountId) && r.jobName().equals(jobName)).stream()
          .mapToLong(WorkRecord::tsS)
          .max();
    }

    @Override
    public List<WorkRecord> recentWork(String accountId, int limit) {
      return work(r -> r.accountId().equals(accountId)).stream()
          .sorted(
              Comparator.comparingLong(WorkRecord::tsS)
                  .thenComparingLong(WorkRecord::id)
                  .reversed())
          .limit(limit)
          .collect(Collectors.toList());
    }

    @Override
    public OptionalLong lastRobberyAt(String robberId) {
      return s.robberies.stream()
          .filter(r -> r.robberId().equals(robberId))
          .mapToLong(RobberyRecord::tsS)
          .max();
    }

    @Override
    public RobberyTally robberyTally(String accountId, boolean asRobber, long fromS, long toS) {
      long attempts = 0;
      long successes = 0;
      long successAmount = 0;
      long failureAmount = 0;
      for (RobberyRecord r : s.robberies) {
        String party = asRobber ? r.robberId() : r.victimId();
        if (!party.equals(accountId) || !in(r.tsS(), fromS, toS)) {
          continue;
        }
        attempts++;
        if (r.success()) {
          successes++;
          successAmount += r.amount();
        } else {
          failureAmount += r.amount();
        }
      }
      return new RobberyTally(attempts, successes, successAmount, failureAmount);
    }

    @Override
    public List<Account> accountsWithCashAtLeast(long minCash, String excludeId, int limit) {
      return s.accounts.values().stream()
          .filter(a -> a.cash() >= minCash && !a.id().equals(excludeId))
          .sorted(Comparator.comparingLong(Account::cash).reversed().thenComparing(Account::id))
          .limit(limit)
          .collect(Collectors.toList());
    }

    @Override
    public List<String> savingsHoldersAfter(String afterId, int limit) {
      String from = afterId == null ? "" : afterId;
      return s.accounts.tailMap(from, false).values().stream()
          .filter(a -> a.savings() > 0)
          .map(Account::id)
          .limit(limit)
          .collect(Collectors.toList());
    }

    @Override
    public long countAhead(Metric metric, Account account) {
      return s.accounts.values().stream().filter(a -> ahead(metric, a, account)).count();
    }

    @Override
    public List<Account> top(Metric metric, int limit) {
      Comparator<Account> order =
          metric == Metric.EXPERIENCE
              ? Comparator.comparingInt(Account::level)
                  .thenComparingLong(Account::experience)
                  .reversed()
              : Comparator.comparingLong((Account a) -> metric.valueOf(a)).reversed();
      return s.accounts.values().stream()
          .filter(a -> metric.valueOf(a) > 0)
          .sorted(order.thenComparing(Account::id))
          .limit(limit)
          .collect(Collectors.toList());
    }

    @Override
    public long participantCount() {
      return s.accounts.values().stream()
          .filter(a -> a.cash() > 0 || a.totalCheckins() > 0)
          .count();
    }

    private List<WorkRecord> work(Predicate<WorkRecord> filter) {
      return s.work.stream().filter(filter).collect(Collectors.toList());
    }
  }

  private static boolean in(long ts, long fromS, long toS) {
    return ts >= fromS && ts < toS;
  }

  private static boolean ahead(Metric metric, Account other, Account self) {
    if (metric == Metric.EXPERIENCE) {
      return other.level() > self.level()
          || (other.level() == self.level() && other.experience() > self.experience());
    }
    return metric.valueOf(other) > metric.valueOf(self);
  }
}
