package com.ospicorp.migrationflow.location.service;

import com.ospicorp.migrationflow.location.model.CachedCatalog;
import com.ospicorp.migrationflow.location.model.LocationCatalog;
import com.ospicorp.migrationflow.upstream.MigrationApiClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Time-boxed cache of the location catalog. While the cached catalog is fresh every caller gets
 * it; once it expires the next caller refetches and callers arriving meanwhile wait for that same
 * fetch instead of starting their own. A failed refetch falls back to the expired catalog when
 * there is one.
 */
@Service
public class LocationCatalogCache {
  private static final Logger log = LoggerFactory.getLogger(LocationCatalogCache.class);

  private final MigrationApiClient client;
  private final Clock clock;
  private final Duration ttl;

  private LocationCatalog cached;
  private Instant fetchedAt;
  private CompletableFuture<LocationCatalog> inFlight;

  public LocationCatalogCache(MigrationApiClient client, Clock clock,
      @Value("${migration.catalog.ttl:PT5M}") Duration ttl) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("migration.catalog.ttl must be positive");
    }
    this.client = client;
    this.clock = clock;
    this.ttl = ttl;
  }

  public CachedCatalog get() {
    CompletableFuture<LocationCatalog> fetch;
    boolean owner = false;
    synchronized (this) {
      if (cached != null && isFresh()) {
        return new CachedCatalog(cached, true);
      }
      if (inFlight == null) {
        inFlight = new CompletableFuture<>();
        owner = true;
      }
      fetch = inFlight;
    }
    return owner ? fetch(fetch) : await(fetch);
  }

  public synchronized void invalidate() {
    cached = null;
    fetchedAt = null;
    log.info("Location catalog cache invalidated");
  }

  public synchronized boolean isValid() {
    return cached != null && isFresh();
  }

  // callers blocked on the in-flight fetch
  synchronized int waitingCallers() {
    return inFlight == null ? 0 : inFlight.getNumberOfDependents();
  }

  private CachedCatalog fetch(CompletableFuture<LocationCatalog> fetch) {
    LocationCatalog catalog;
    try {
      catalog = client.getMetadata();
    } catch (RuntimeException ex) {
      LocationCatalog stale;
      synchronized (this) {
        inFlight = null;
        stale = cached;
      }
      fetch.completeExceptionally(ex);
      return staleOrThrow(stale, ex);
    } catch (Error err) {
      synchronized (this) {
        inFlight = null;
      }
      fetch.completeExceptionally(err);
      throw err;
    }
    synchronized (this) {
      cached = catalog;
      fetchedAt = clock.instant();
      inFlight = null;
    }
    fetch.complete(catalog);
    log.debug("Location catalog refreshed: {} provinces, {} districts, {} subdistricts",
        catalog.provinces().size(), catalog.districts().size(), catalog.subdistricts().size());
    return new CachedCatalog(catalog, false);
  }

  private CachedCatalog await(CompletableFuture<LocationCatalog> fetch) {
    try {
      return new CachedCatalog(fetch.join(), false);
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof Error err) {
        throw err;
      }
      RuntimeException cause = ex.getCause() instanceof RuntimeException runtime ? runtime : ex;
      LocationCatalog stale;
      synchronized (this) {
        stale = cached;
      }
      return staleOrThrow(stale, cause);
    }
  }

  private static CachedCatalog staleOrThrow(LocationCatalog stale, RuntimeException failure) {
    if (stale == null) {
      throw failure;
    }
    log.warn("Using expired location catalog after refresh failure: {}", failure.getMessage());
    return new CachedCatalog(stale, true);
  }

  private boolean isFresh() {
    return fetchedAt != null && clock.instant().isBefore(fetchedAt.plus(ttl));
  }
}
