package com.scholary.video.splitter.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Per-job locks guarding read-modify-write cycles on a job record.
 *
 * <p>The worker's terminal write and the status reader's output correction both take the job's
 * lock, so the two never interleave. Locks are held with weak values in a Caffeine cache: a lock
 * nobody holds or waits on is collected, and the map stays bounded by the number of jobs in use.
 */
@Component
public class JobLocks {

  private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder().weakValues().build();

  public <T> T withLock(String jobId, Supplier<T> action) {
    ReentrantLock lock = locks.get(jobId, id -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /** Number of locks currently retained; for monitoring only. */
  public long size() {
    locks.cleanUp();
    return locks.estimatedSize();
  }
}
