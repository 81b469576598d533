package io.b2mash.lms.multitenancy;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

/**
 * Process-wide registry of tenant connection pools, keyed by sanitized tenant id.
 *
 * <p>The cache holds the in-flight open future rather than the finished pool, so concurrent first
 * requests for a tenant share a single open. A failed open is dropped from the cache and the next
 * request tries again. A pool that reports a connection error is evicted and closed, but only if it
 * is still the cached one.
 */
@Component
public class TenantDataSourceRegistry implements DisposableBean {

  private static final Logger log = LoggerFactory.getLogger(TenantDataSourceRegistry.class);

  private final TenantDataSourceFactory factory;
  private final String databasePrefix;
  private final AsyncCache<String, TenantDataSource> dataSources =
      Caffeine.newBuilder().buildAsync();

  public TenantDataSourceRegistry(TenancyProperties properties, TenantDataSourceFactory factory) {
    if (properties.baseUrl() == null || properties.baseUrl().isBlank()) {
      throw new IllegalStateException("lms.tenancy.base-url must be configured");
    }
    this.factory = factory;
    this.databasePrefix = properties.databasePrefix();
  }

  public TenantDataSource get(String tenantId) {
    String key = TenantResolver.sanitize(tenantId);
    CompletableFuture<TenantDataSource> future = dataSources.get(key, this::open);
    try {
      return future.join();
    } catch (CompletionException e) {
      dataSources.asMap().remove(key, future);
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new TenantConnectionException(key, cause);
    }
  }

  public String databaseNameFor(String tenantId) {
    return TenantDatabaseNames.databaseName(databasePrefix, tenantId);
  }

  /**
   * Called when a pool handed out by {@link #get} fails to produce a connection. Evicts and closes
   * the pool unless another thread has already replaced it.
   */
  public void reportFailure(String tenantId, TenantDataSource failed) {
    String key = TenantResolver.sanitize(tenantId);
    CompletableFuture<TenantDataSource> current = dataSources.getIfPresent(key);
    if (current == null || !current.isDone() || current.isCompletedExceptionally()) {
      return;
    }
    if (current.join() == failed && dataSources.asMap().remove(key, current)) {
      log.warn(
          "Evicted tenant pool after connection error: tenant={}, database={}",
          key,
          failed.databaseName());
      closeQuietly(failed);
    }
  }

  public void evict(String tenantId) {
    String key = TenantResolver.sanitize(tenantId);
    CompletableFuture<TenantDataSource> removed = dataSources.asMap().remove(key);
    if (removed != null) {
      log.info("Evicted tenant pool: tenant={}", key);
      closeWhenOpened(removed);
    }
  }

  public Set<String> cachedTenantIds() {
    return Set.copyOf(dataSources.asMap().keySet());
  }

  /**
   * Empties the cache, then closes every pool that was in it. One failing close does not stop the
   * others.
   */
  public void disconnectAll() {
    List<CompletableFuture<TenantDataSource>> removed = new ArrayList<>();
    for (String key : new ArrayList<>(dataSources.asMap().keySet())) {
      CompletableFuture<TenantDataSource> future = dataSources.asMap().remove(key);
      if (future != null) {
        removed.add(future);
      }
    }
    log.info("Closing {} tenant pools", removed.size());
    removed.forEach(this::closeWhenOpened);
  }

  @Override
  public void destroy() {
    disconnectAll();
  }

  private TenantDataSource open(String key) {
    String databaseName = databaseNameFor(key);
    log.info("Opening tenant pool: tenant={}, database={}", key, databaseName);
    return factory.open(key, databaseName);
  }

  private void closeWhenOpened(CompletableFuture<TenantDataSource> future) {
    future.whenComplete(
        (dataSource, error) -> {
          if (dataSource != null) {
            closeQuietly(dataSource);
          }
        });
  }

  private void closeQuietly(TenantDataSource dataSource) {
    try {
      dataSource.close();
      log.info("Closed tenant pool: tenant={}", dataSource.tenantId());
    } catch (RuntimeException e) {
      log.error("Failed to close tenant pool: tenant={}", dataSource.tenantId(), e);
    }
  }
}
