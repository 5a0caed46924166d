package com.ddm.mnemosyne.cache;

import com.ddm.mnemosyne.crypto.Encryptor;
import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.exception.DecryptionFailureException;
import com.ddm.mnemosyne.store.ConfigStore;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于 Caffeine LoadingCache 的配置读缓存。
 *
 * <p><strong>缓存机制：</strong>
 * <ul>
 *   <li>整张配置表作为一个快照缓存在唯一的 Key 下，采用 expireAfterWrite 策略，
 *       过期后首次访问同步重建；Caffeine 保证同一时刻只有一个加载在执行，
 *       并发读取等待同一次加载（single-flight）</li>
 *   <li>快照中缺失的 Key 单独从存储读取并回填；不存在的配置使用 MISSING 作为负缓存，
 *       直到下一次快照重建</li>
 *   <li>值在加载时解密并按类型解析，命中后不再重复解密</li>
 * </ul>
 *
 * <p><strong>失效：</strong>
 * {@link #invalidate(String)} 只移除一个 Key。每次失效登记一个递增的序号，
 * 每个缓存槽记录它开始加载时的序号；槽的序号早于该 Key 最近一次失效时视为过期，
 * 读取时重新加载。因此与失效并发进行的快照重建不会把旧值带回缓存。
 *
 * <p>刷新时无法解密的配置会被记录并跳过，直接读取该 Key 时抛出
 * {@link DecryptionFailureException}。
 *
 * @author liyifei
 * @since 1.0
 */
public final class CaffeineConfigCache implements ConfigCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeineConfigCache.class);

    /**
     * 快照在 LoadingCache 中的唯一 Key。
     */
    private static final String SNAPSHOT = "snapshot";

    /**
     * 负缓存标记：存储中没有这个 Key。
     */
    private static final CachedValue MISSING = new CachedValue(null, null, null);

    /**
     * 缓存槽：值 + 开始加载时的失效序号。
     */
    private record Slot(CachedValue value, long epoch) {
    }

    private final LoadingCache<String, ConcurrentMap<String, Slot>> snapshots;
    private final ConfigStore store;
    private final Encryptor encryptor;

    /**
     * 失效序号，每次失效递增。
     */
    private final AtomicLong epoch = new AtomicLong();

    /**
     * Key -> 最近一次失效时的序号。
     */
    private final ConcurrentMap<String, Long> invalidations = new ConcurrentHashMap<>();

    /**
     * 最近一次全量失效时的序号。
     */
    private final AtomicLong fullInvalidation = new AtomicLong(-1);

    public CaffeineConfigCache(ConfigStore store, Encryptor encryptor, Duration ttl) {
        this(store, encryptor, ttl, Ticker.systemTicker());
    }

    /**
     * @param store     配置存储
     * @param encryptor 解密器
     * @param ttl       快照有效期
     * @param ticker    时间源，测试中可替换
     */
    public CaffeineConfigCache(ConfigStore store, Encryptor encryptor, Duration ttl, Ticker ticker) {
        Objects.requireNonNull(ttl, "ttl required");
        this.store = Objects.requireNonNull(store, "store required");
        this.encryptor = Objects.requireNonNull(encryptor, "encryptor required");
        this.snapshots = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(Objects.requireNonNull(ticker, "ticker"))
                .executor(Runnable::run)
                .build(k -> loadSnapshot());
        log.info("Config cache initialized (ttl={})", ttl);
    }

    @Override
    public Optional<CachedValue> get(String key) {
        Objects.requireNonNull(key, "key");
        ConcurrentMap<String, Slot> snapshot = snapshots.get(SNAPSHOT);
        Slot slot = snapshot.get(key);
        if (slot == null || isStale(key, slot)) {
            slot = snapshot.compute(key, (k, current) ->
                    current == null || isStale(k, current) ? loadOne(k) : current);
        }
        return slot.value() == MISSING ? Optional.empty() : Optional.of(slot.value());
    }

    @Override
    public void invalidate(String key) {
        invalidations.put(key, epoch.incrementAndGet());
        ConcurrentMap<String, Slot> snapshot = snapshots.getIfPresent(SNAPSHOT);
        if (snapshot != null) {
            snapshot.remove(key);
        }
        log.debug("Config cache invalidated: {}", key);
    }

    @Override
    public void invalidateAll() {
        fullInvalidation.set(epoch.incrementAndGet());
        snapshots.invalidateAll();
        log.debug("Config cache invalidated: all");
    }

    @Override
    public long size() {
        ConcurrentMap<String, Slot> snapshot = snapshots.getIfPresent(SNAPSHOT);
        if (snapshot == null) {
            return 0;
        }
        return snapshot.values().stream().filter(s -> s.value() != MISSING).count();
    }

    /**
     * 重建快照（被 Caffeine LoadingCache 调用）。
     */
    private ConcurrentMap<String, Slot> loadSnapshot() {
        long startEpoch = epoch.get();
        long begin = System.nanoTime();
        List<ConfigEntry> entries = store.findAll();

        ConcurrentMap<String, Slot> snapshot = new ConcurrentHashMap<>(Math.max(16, entries.size() * 2));
        if (fullInvalidation.get() > startEpoch) {
            log.debug("Full invalidation raced the snapshot refresh; loading lazily");
            return snapshot;
        }
        int skipped = 0;
        for (ConfigEntry entry : entries) {
            try {
                snapshot.put(entry.key(), new Slot(decode(entry), startEpoch));
            } catch (DecryptionFailureException e) {
                skipped++;
                log.error("Config {} could not be decrypted during refresh, left out of cache", entry.key());
            }
        }
        // 新快照中所有槽的序号都不早于 startEpoch，更早的失效登记已无意义
        invalidations.values().removeIf(e -> e <= startEpoch);

        log.debug("Config snapshot refreshed: {} entries, {} skipped, {} ms",
                snapshot.size(), skipped, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin));
        return snapshot;
    }

    private boolean isStale(String key, Slot slot) {
        Long invalidatedAt = invalidations.get(key);
        return invalidatedAt != null && invalidatedAt > slot.epoch();
    }

    private Slot loadOne(String key) {
        long startEpoch = epoch.get();
        log.debug("Loading config item: {}", key);
        CachedValue value = store.find(key).map(this::decode).orElse(MISSING);
        return new Slot(value, startEpoch);
    }

    private CachedValue decode(ConfigEntry entry) {
        String plaintext = entry.encrypted() && !entry.value().isEmpty()
                ? encryptor.decrypt(entry.value())
                : entry.value();
        return new CachedValue(entry, plaintext, entry.valueType().parse(plaintext));
    }
}
