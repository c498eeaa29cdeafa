package world.willfrog.angelmarket.valuationservice.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 带过期时间的有界 LRU 缓存，用于短期缓存计算结果。
 * <p>
 * 条目存放在按访问顺序排列的 LinkedHashMap 中，超出容量时淘汰最久未访问的条目，所有访问由同一把锁串行化。
 * {@link #getOrCompute(Object, Supplier)} 保证同一个 key 同时最多只有一个计算在进行，
 * 并发请求等待并共享该结果；计算失败不写入缓存，异常传递给所有等待方。
 */
@Slf4j
public class ResultCache<K, V> {

    private final String name;
    private final Clock clock;
    private final Duration ttl;
    private final int maxEntries;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, CacheEntry<V>> entries;
    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public ResultCache(String name, Clock clock, Duration ttl, int maxEntries) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive");
        }
        this.name = name;
        this.clock = clock;
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<K, CacheEntry<V>>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, CacheEntry<V>> eldest) {
                return size() > ResultCache.this.maxEntries;
            }
        };
    }

    /**
     * 未命中或已过期时返回 empty，过期条目同时被移除
     */
    public Optional<V> get(K key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (isExpired(entry)) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            entries.put(key, new CacheEntry<>(value, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    public V getOrCompute(K key, Supplier<V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        CompletableFuture<V> pending = new CompletableFuture<>();
        CompletableFuture<V> running = inFlight.putIfAbsent(key, pending);
        if (running != null) {
            return await(running);
        }

        try {
            // 抢到计算权之前，上一个计算可能刚写入缓存
            Optional<V> raced = get(key);
            if (raced.isPresent()) {
                pending.complete(raced.get());
                return raced.get();
            }
            V value = loader.get();
            put(key, value);
            pending.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, pending);
        }
    }

    public void invalidate(K key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.debug("Cache cleared name={}", name);
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    private boolean isExpired(CacheEntry<V> entry) {
        return !clock.instant().isBefore(entry.storedAt().plus(ttl));
    }

    private V await(CompletableFuture<V> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private record CacheEntry<V>(V value, Instant storedAt) {
    }
}
