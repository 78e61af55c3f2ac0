/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.Account;
import dev.coincore.api.ActionResult;
import dev.coincore.api.ErrorCode;
import dev.coincore.api.Rankings;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Read-only standings over the accounts table. */
public final class RankingsImpl implements Rankings {
  private static final int MAX_TOP = 100;

  private final EngineContext ctx;

  RankingsImpl(EngineContext ctx) {
    this.ctx = ctx;
  }

  @Override
  public ActionResult<Standing> rank(String id, Metric metric) {
    if (EngineContext.isInvalidId(id) || metric == null) {
      return ctx.decline("rankings.rank", ErrorCode.INVALID_ARGUMENT, "id and metric required");
    }
    Optional<Standing> standing =
        ctx.store()
            .read(
                "rankings.rank",
                s -> {
                  Optional<Account> a = s.findAccount(id);
                  if (a.isEmpty()) {
                    return Optional.empty();
                  }
                  return Optional.of(
                      new Standing(
                          id,
                          metric,
                          metric.valueOf(a.get()),
                          s.countAhead(metric, a.get()) + 1,
                          s.participantCount()));
                });
    if (standing.isEmpty()) {
      return ctx.decline("rankings.rank", ErrorCode.ACCOUNT_NOT_FOUND, "no account " + id);
    }
    return ctx.record("rankings.rank", ActionResult.success(standing.get()));
  }

  @Override
  public ActionResult<List<Entry>> topN(Metric metric, int n) {
    if (metric == null || n < 1) {
      return ctx.decline("rankings.top", ErrorCode.INVALID_ARGUMENT, "metric and n >= 1 required");
    }
    int limit = Math.min(n, MAX_TOP);
    List<Entry> entries =
        ctx.store()
            .read(
                "rankings.top",
                s -> {
                  List<Account> top = s.top(metric, limit);
                  List<Entry> out = new ArrayList<>(top.size());
                  for (int i = 0; i < top.size(); i++) {
                    Account a = top.get(i);
                    out.add(
                        new Entry(i + 1L, a.id(), a.displayName(), metric.valueOf(a), a.level()));
                  }
                  return out;
                });
    return ctx.record("rankings.top", ActionResult.success(entries));
  }

  @Override
  public long participantCount() {
    return ctx.store().read("rankings.participants", s -> s.participantCount());
  }
}
