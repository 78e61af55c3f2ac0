/* CoinCore © 2025 CoinCore Devs — MIT */
package dev.coincore.core;

import dev.coincore.api.events.EconomyEvents;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous in-process event bus for economy events.
 *
 * <p>Each account has a dedicated serial queue to guarantee in-order delivery while still allowing
 * concurrent dispatch for different accounts.
 */
public final class EventBus implements EconomyEvents, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("coincore");

  private final List<Consumer<BalanceChangedEvent>> bal = new CopyOnWriteArrayList<>();
  private final List<Consumer<LevelUpEvent>> lvl = new CopyOnWriteArrayList<>();
  private final Map<String, AccountQueue> queues = new ConcurrentHashMap<>();
  private final ExecutorService executor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** Creates a new event bus with a daemon thread pool sized for the host. */
  public EventBus() {
    this(createExecutor());
  }

  EventBus(ExecutorService executor) {
    this.executor = executor;
  }

  private static ExecutorService createExecutor() {
    int threads = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    ThreadFactory factory =
        r -> {
          Thread t = new Thread(r, "coincore-events");
          t.setDaemon(true);
          return t;
        };
    return Executors.newFixedThreadPool(threads, factory);
  }

  @Override
  public AutoCloseable onBalanceChanged(Consumer<BalanceChangedEvent> h) {
    bal.add(h);
    return () -> bal.remove(h);
  }

  @Override
  public AutoCloseable onLevelUp(Consumer<LevelUpEvent> h) {
    lvl.add(h);
    return () -> lvl.remove(h);
  }

  /**
   * Dispatches committed events in list order.
   *
   * @param events events produced by one committed unit
   */
  public void publishAll(List<? extends Event> events) {
    if (events == null) {
      return;
    }
    for (Event e : events) {
      publish(e);
    }
  }

  /**
   * Dispatches one event asynchronously on its account's queue.
   *
   * @param e event to dispatch
   */
  public void publish(Event e) {
    if (e == null || closed.get()) {
      return;
    }
    if (e instanceof BalanceChangedEvent b) {
      enqueue(b.accountId(), () -> dispatch(bal, b));
    } else if (e instanceof LevelUpEvent l) {
      enqueue(l.accountId(), () -> dispatch(lvl, l));
    } else {
      LOG.debug("(coincore) op=events unknown event type {}", e.getClass().getName());
    }
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      executor.shutdownNow();
      queues.clear();
      bal.clear();
      lvl.clear();
    }
  }

  private <T extends Event> void dispatch(List<Consumer<T>> handlers, T event) {
    for (Consumer<T> handler : handlers) {
      try {
        handler.accept(event);
      } catch (Throwable e) {
        LOG.warn(
            "(coincore) op=events handler failed for account {}: {}",
            event.accountId(),
            e.getMessage(),
            e);
      }
    }
  }

  private void enqueue(String accountId, Runnable task) {
    if (accountId == null) {
      executor.execute(() -> runGuarded(null, task));
      return;
    }
    AccountQueue queue = queues.computeIfAbsent(accountId, id -> new AccountQueue());
    queue.tasks.add(task);
    if (queue.draining.compareAndSet(false, true)) {
      executor.execute(() -> drain(accountId, queue));
    }
  }

  private void drain(String accountId, AccountQueue queue) {
    while (true) {
      Runnable next = queue.tasks.poll();
      if (next == null) {
        if (queue.draining.compareAndSet(true, false)) {
          if (queue.tasks.isEmpty()) {
            if (queues.remove(accountId, queue)) {
              Runnable extra;
              while ((extra = queue.tasks.poll()) != null) {
                enqueue(accountId, extra);
              }
            }
            return;
          }
          if (!queue.draining.compareAndSet(false, true)) {
            return;
          }
          continue;
        }
        return;
      }
      runGuarded(accountId, next);
    }
  }

  /** A failing task must not leave its account queue marked as draining. */
  private static void runGuarded(String accountId, Runnable task) {
    try {
      task.run();
    } catch (Throwable t) {
      LOG.error("(coincore) op=events delivery failed for account {}", accountId, t);
    }
  }

  private static final class AccountQueue {
    final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    final AtomicBoolean draining = new AtomicBoolean(false);
  }
}
