package io.ledgerbridge.services;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledgerbridge.models.CacheEntry;
import io.ledgerbridge.models.ResourceFamily;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * In-memory TTL cache of parsed read responses. Expired entries are never returned; they are
 * dropped lazily on read and by a periodic purge.
 *
 * <p>Every invalidation bumps a generation counter for the families it touches. A read captures
 * the generation of its key before going to the network and stores its result with {@link
 * #putIfUnchanged}, so a response fetched before a mutation is never cached after it.
 */
@Service
@Slf4j
public class ResponseCacheService {
  private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
  private final Map<ResourceFamily, AtomicLong> generations = new EnumMap<>(ResourceFamily.class);
  // keys outside every family are bumped by any invalidation
  private final AtomicLong unscopedGeneration = new AtomicLong();
  private final Clock clock;

  public ResponseCacheService(Clock clock) {
    this.clock = clock;
    Arrays.stream(ResourceFamily.values())
        .forEach(family -> generations.put(family, new AtomicLong()));
  }

  /** Current generation of the family {@code key} belongs to. */
  public long generation(String key) {
    return generationFor(key).get();
  }

  public Optional<JsonNode> get(String key) {
    var entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.instant())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    log.debug("Cache hit for {}", key);
    return Optional.of(entry.getValue().deepCopy());
  }

  public void put(String key, JsonNode value, Duration ttl) {
    if (ttl.isNegative() || ttl.isZero()) {
      return;
    }
    entries.put(key, newEntry(key, value, ttl));
  }

  /**
   * Stores {@code value} unless the family of {@code key} was invalidated since {@code
   * generation} was read.
   *
   * @return whether the value is cached
   */
  public boolean putIfUnchanged(String key, JsonNode value, Duration ttl, long generation) {
    if (ttl.isNegative() || ttl.isZero()) {
      return false;
    }
    var counter = generationFor(key);
    if (counter.get() != generation) {
      log.debug("Not caching {}, invalidated while it was fetched", key);
      return false;
    }
    var entry = newEntry(key, value, ttl);
    entries.put(key, entry);
    // invalidate bumps before it removes: either it removes this entry or the bump is seen here
    if (counter.get() != generation) {
      entries.remove(key, entry);
      return false;
    }
    return true;
  }

  /**
   * Removes every entry whose key starts with {@code prefix}; an empty prefix clears the cache.
   *
   * @return number of entries removed
   */
  public int invalidate(String prefix) {
    unscopedGeneration.incrementAndGet();
    generations.forEach(
        (family, counter) -> {
          var familyPrefix = family.getCachePrefix();
          if (familyPrefix.startsWith(prefix) || prefix.startsWith(familyPrefix)) {
            counter.incrementAndGet();
          }
        });
    var before = entries.size();
    if (prefix.isEmpty()) {
      entries.clear();
    } else {
      entries.keySet().removeIf(key -> key.startsWith(prefix));
    }
    var removed = Math.max(0, before - entries.size());
    log.debug("Invalidated {} cache entries with prefix '{}'", removed, prefix);
    return removed;
  }

  public int invalidate(ResourceFamily family) {
    return invalidate(family.getCachePrefix());
  }

  public int size() {
    return entries.size();
  }

  private AtomicLong generationFor(String key) {
    return generations.entrySet().stream()
        .filter(family -> key.startsWith(family.getKey().getCachePrefix()))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(unscopedGeneration);
  }

  private CacheEntry newEntry(String key, JsonNode value, Duration ttl) {
    return new CacheEntry.Builder()
        .key(key)
        .value(value.deepCopy())
        .expiresAt(clock.instant().plus(ttl))
        .build();
  }

  @Scheduled(fixedDelayString = "#{@getLedgerBridgeConfig.getCachePurgeInterval().toMillis()}")
  public void purgeExpired() {
    var now = clock.instant();
    entries.values().removeIf(entry -> entry.isExpired(now));
  }
}
