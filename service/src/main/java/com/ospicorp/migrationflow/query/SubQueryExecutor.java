package com.ospicorp.migrationflow.query;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs one sub-query per {@link YearRange} concurrently and joins on all of them. The result is
 * all-or-nothing: if any sub-query fails, the whole call fails once every sub-query has settled.
 */
@Component
public class SubQueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(SubQueryExecutor.class);

  private final Executor executor;

  public SubQueryExecutor(@Qualifier("subQueryTaskExecutor") Executor executor) {
    this.executor = executor;
  }

  public <T> List<T> runAll(List<YearRange> ranges, Function<YearRange, T> subQuery) {
    if (ranges.isEmpty()) {
      return List.of();
    }
    List<CompletableFuture<T>> futures = new ArrayList<>(ranges.size());
    for (YearRange range : ranges) {
      futures.add(CompletableFuture.supplyAsync(() -> subQuery.apply(range), executor));
    }

    // wait for every sub-query, even after a failure
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
        .exceptionally(ex -> null)
        .join();

    int failed = 0;
    Throwable firstFailure = null;
    for (int i = 0; i < futures.size(); i++) {
      CompletableFuture<T> future = futures.get(i);
      if (future.isCompletedExceptionally()) {
        Throwable cause = unwrap(future);
        YearRange range = ranges.get(i);
        log.warn("Sub-query {} to {} failed: {}", range.start(), range.end(), cause.getMessage());
        failed++;
        if (firstFailure == null) {
          firstFailure = cause;
        }
      }
    }
    if (failed > 0) {
      throw new SubQueryFailureException(failed, futures.size(), firstFailure);
    }

    List<T> results = new ArrayList<>(futures.size());
    for (CompletableFuture<T> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  private static Throwable unwrap(CompletableFuture<?> future) {
    try {
      future.join();
      return new IllegalStateException("sub-query completed normally");
    } catch (CompletionException ex) {
      return ex.getCause() != null ? ex.getCause() : ex;
    } catch (RuntimeException ex) {
      return ex;
    }
  }
}
