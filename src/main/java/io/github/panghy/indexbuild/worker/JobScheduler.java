package io.github.panghy.indexbuild.worker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded FIFO intake queue drained by a fixed number of build threads.
 *
 * <p>The thread count is the build parallelism and the only admission control: jobs beyond it
 * wait in the queue, and {@link #offer} rejects once {@code maxQueueLength} jobs are waiting.</p>
 */
public final class JobScheduler implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

  private final LinkedBlockingDeque<IndexBuildTask> queue;
  private final AtomicInteger active = new AtomicInteger();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final List<Thread> threads = new ArrayList<>();
  private int parallelism;

  public JobScheduler(int maxQueueLength) {
    if (maxQueueLength <= 0) throw new IllegalArgumentException("maxQueueLength must be positive");
    this.queue = new LinkedBlockingDeque<>(maxQueueLength);
  }

  /** Starts {@code n} build threads. No-op if {@code n <= 0} or already started. */
  public synchronized void start(int n) {
    if (n <= 0 || running.get()) return;
    running.set(true);
    parallelism = n;
    LOG.debug("JobScheduler starting threads={}", n);
    for (int i = 0; i < n; i++) {
      Thread t = new Thread(this::loop, "indexbuild-worker-" + i);
      t.setDaemon(true);
      t.start();
      threads.add(t);
    }
  }

  /** Enqueues a task; returns {@code false} when the queue is full or the scheduler is stopped. */
  boolean offer(IndexBuildTask task) {
    return running.get() && queue.offerLast(task);
  }

  /**
   * Takes the task tracked by {@code info} out of the queue if no build thread picked it up yet.
   *
   * @return {@code true} if a queued task was removed
   */
  boolean remove(TaskInfo info) {
    return queue.removeIf(t -> t.info() == info);
  }

  /** Number of queued tasks not yet picked up by a build thread. */
  public int queued() {
    return queue.size();
  }

  /** Number of tasks currently being built. */
  public int active() {
    return active.get();
  }

  public synchronized int parallelism() {
    return parallelism;
  }

  /**
   * Waits until the queue is empty and no build is running.
   *
   * @return {@code true} if idle within the timeout
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (queue.size() + active.get() > 0) {
      if (System.nanoTime() - deadline >= 0) return false;
      Thread.sleep(10);
    }
    return true;
  }

  /** Stops the build threads, interrupting running builds and discarding queued ones. */
  @Override
  public synchronized void close() {
    if (!running.getAndSet(false)) return;
    LOG.debug("JobScheduler stopping threads={} queued={}", threads.size(), queue.size());
    queue.clear();
    for (Thread t : threads) t.interrupt();
    threads.clear();
  }

  private void loop() {
    while (running.get()) {
      IndexBuildTask task;
      try {
        task = queue.pollFirst(100, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (task == null) continue;
      active.incrementAndGet();
      try {
        task.run();
      } catch (RuntimeException e) {
        LOG.warn("index build task crashed buildID={}", task.info().buildId(), e);
      } finally {
        active.decrementAndGet();
      }
    }
  }
}
