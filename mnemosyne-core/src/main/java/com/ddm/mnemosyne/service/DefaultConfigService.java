package com.ddm.mnemosyne.service;

import com.ddm.mnemosyne.cache.CachedValue;
import com.ddm.mnemosyne.cache.ConfigCache;
import com.ddm.mnemosyne.crypto.Encryptor;
import com.ddm.mnemosyne.crypto.SecretMasker;
import com.ddm.mnemosyne.defined.ChangeKind;
import com.ddm.mnemosyne.defined.ConfigCategory;
import com.ddm.mnemosyne.defined.ConfigDefinition;
import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.defined.ConfigView;
import com.ddm.mnemosyne.defined.HistoryPage;
import com.ddm.mnemosyne.defined.HistoryRecord;
import com.ddm.mnemosyne.defined.ImportResult;
import com.ddm.mnemosyne.defined.ListFilter;
import com.ddm.mnemosyne.defined.UpdateResult;
import com.ddm.mnemosyne.event.ConfigChangeEvent;
import com.ddm.mnemosyne.event.ConfigChangeListener;
import com.ddm.mnemosyne.exception.ConcurrencyConflictException;
import com.ddm.mnemosyne.exception.ConfigException;
import com.ddm.mnemosyne.exception.DecryptionFailureException;
import com.ddm.mnemosyne.exception.HistoryMismatchException;
import com.ddm.mnemosyne.exception.NotFoundException;
import com.ddm.mnemosyne.exception.ReadOnlyViolationException;
import com.ddm.mnemosyne.exception.ValidationException;
import com.ddm.mnemosyne.store.ConfigStore;
import com.ddm.mnemosyne.store.HistoryLedger;
import com.ddm.mnemosyne.store.TransactionScope;
import com.ddm.mnemosyne.utils.Converters;
import com.ddm.mnemosyne.validation.Validation;
import com.ddm.mnemosyne.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 默认的配置中心实现。
 *
 * <p><strong>写路径：</strong>
 * <ol>
 *   <li>获取该 Key 的锁（最多等待 lockTimeout）</li>
 *   <li>从存储读取当前状态，只读配置直接拒绝</li>
 *   <li>校验候选值，序列化；加密配置调用 Encryptor</li>
 *   <li>事务内：按版本号 CAS 写入当前值 + 追加历史记录，然后提交</li>
 *   <li>提交后同步失效缓存中的该 Key，再通知监听器</li>
 * </ol>
 *
 * <p><strong>并发：</strong>
 * 同进程内由 Key 级别的 {@link ReentrantLock} 串行化写入；跨进程由存储层的版本号 CAS 兜底，
 * 两者任一失败都抛出 {@link ConcurrencyConflictException}，不在内部重试。
 *
 * <p><strong>敏感信息：</strong>
 * 加密配置的历史记录与展示视图只包含遮蔽值，日志中不输出加密配置的任何值。
 *
 * @author liyifei
 * @since 1.0
 */
public class DefaultConfigService implements ConfigService {

    private static final Logger log = LoggerFactory.getLogger(DefaultConfigService.class);

    static final String IMPORT_REASON = "Bulk import";
    static final String RESET_REASON = "Reset to default";
    static final String PROVISION_ACTOR = "system";

    private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private static final Comparator<ConfigEntry> DISPLAY_ORDER = Comparator
            .comparing(ConfigEntry::category)
            .thenComparingInt(ConfigEntry::sortOrder)
            .thenComparing(ConfigEntry::name);

    private final ConfigStore store;
    private final HistoryLedger ledger;
    private final TransactionScope transactions;
    private final ConfigCache cache;
    private final Encryptor encryptor;
    private final Validator validator;
    private final List<ConfigChangeListener> listeners;
    private final Duration lockTimeout;
    private final Clock clock;

    private final ConcurrentMap<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

    public DefaultConfigService(ConfigStore store,
                                HistoryLedger ledger,
                                TransactionScope transactions,
                                ConfigCache cache,
                                Encryptor encryptor,
                                Validator validator,
                                List<ConfigChangeListener> listeners) {
        this(store, ledger, transactions, cache, encryptor, validator, listeners, DEFAULT_LOCK_TIMEOUT, Clock.systemUTC());
    }

    public DefaultConfigService(ConfigStore store,
                                HistoryLedger ledger,
                                TransactionScope transactions,
                                ConfigCache cache,
                                Encryptor encryptor,
                                Validator validator,
                                List<ConfigChangeListener> listeners,
                                Duration lockTimeout,
                                Clock clock) {
        this.store = Objects.requireNonNull(store, "store required");
        this.ledger = Objects.requireNonNull(ledger, "ledger required");
        this.transactions = Objects.requireNonNull(transactions, "transactions required");
        this.cache = Objects.requireNonNull(cache, "cache required");
        this.encryptor = Objects.requireNonNull(encryptor, "encryptor required");
        this.validator = Objects.requireNonNull(validator, "validator required");
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.lockTimeout = lockTimeout == null ? DEFAULT_LOCK_TIMEOUT : lockTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /* ===================== 读 ===================== */

    @Override
    public List<ConfigView> list(ListFilter filter) {
        ListFilter f = filter == null ? ListFilter.all() : filter;
        List<ConfigView> result = new ArrayList<>();
        store.findAll().stream()
                .filter(f::matches)
                .sorted(DISPLAY_ORDER)
                .forEach(entry -> result.add(listView(entry)));
        return result;
    }

    @Override
    public Map<ConfigCategory, List<ConfigView>> listGrouped(ListFilter filter) {
        Map<ConfigCategory, List<ConfigView>> grouped = new EnumMap<>(ConfigCategory.class);
        for (ConfigCategory category : ConfigCategory.values()) {
            grouped.put(category, new ArrayList<>());
        }
        for (ConfigView view : list(filter)) {
            grouped.get(view.category()).add(view);
        }
        return grouped;
    }

    @Override
    public ConfigView get(String key) {
        return cache.get(key).map(this::toView).orElseThrow(() -> new NotFoundException(key));
    }

    @Override
    public <T> T getValue(String key, Class<T> type) {
        CachedValue cached = cache.get(key).orElseThrow(() -> new NotFoundException(key));
        return cached.value() == null ? null : Converters.cast(cached.value(), type);
    }

    @Override
    public <T> T getValue(String key, Class<T> type, T fallback) {
        Optional<CachedValue> cached = cache.get(key);
        if (cached.isEmpty() || cached.get().value() == null) {
            return fallback;
        }
        try {
            T value = Converters.cast(cached.get().value(), type);
            return value == null ? fallback : value;
        } catch (RuntimeException e) {
            log.warn("Config {} cannot be converted to {}, using fallback", key, type.getSimpleName());
            return fallback;
        }
    }

    @Override
    public HistoryPage history(String key, int limit, int offset) {
        requireEntry(key);
        List<HistoryRecord> records = ledger.listForKey(key, limit, offset);
        return new HistoryPage(records, ledger.countForKey(key));
    }

    @Override
    public boolean verifyHistory(String key) {
        requireEntry(key);
        return HistoryChain.verify(ledger.listAllForKey(key));
    }

    @Override
    public Map<String, Object> exportValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        store.findAll().stream()
                .filter(e -> !e.encrypted())
                .sorted(Comparator.comparing(ConfigEntry::key))
                .forEach(e -> values.put(e.key(), e.valueType().parse(e.value())));
        return values;
    }

    /* ===================== 写 ===================== */

    @Override
    public UpdateResult update(String key, Object value, String actor, String reason) {
        return withKeyLock(key, () -> apply(key, value, actor, reason, ChangeKind.UPDATE));
    }

    @Override
    public UpdateResult rollback(String key, String historyId, String actor, String reason) {
        return withKeyLock(key, () -> {
            ConfigEntry entry = requireEntry(key);
            if (entry.readOnly()) {
                log.debug("Rejected rollback of read-only config {}", key);
                throw new ReadOnlyViolationException(key);
            }
            HistoryRecord target = Optional.ofNullable(historyId)
                    .flatMap(ledger::getById)
                    .filter(r -> r.configKey().equals(key))
                    .orElseThrow(() -> new HistoryMismatchException(key, historyId));

            String stored = Objects.requireNonNullElse(target.restorableValue(), "");
            String plaintext = decryptStored(entry, stored);
            String why = reason != null ? reason : "Rolled back to version " + (target.version() - 1);
            return commit(entry, stored, plaintext, actor, why, ChangeKind.ROLLBACK, target.id());
        });
    }

    @Override
    public UpdateResult resetToDefault(String key, String actor, String reason) {
        return withKeyLock(key, () -> {
            ConfigEntry entry = requireEntry(key);
            if (entry.readOnly()) {
                log.debug("Rejected reset of read-only config {}", key);
                throw new ReadOnlyViolationException(key);
            }
            if (isAtDefault(entry)) {
                log.debug("Config {} already at default, reset skipped", key);
                return new UpdateResult(toView(entry, entry.defaultValue()), entry.effectType(), false, null);
            }
            String stored = encryptIfNeeded(entry.encrypted(), entry.defaultValue());
            return commit(entry, stored, entry.defaultValue(), actor,
                    reason != null ? reason : RESET_REASON, ChangeKind.RESET, null);
        });
    }

    @Override
    public void reload() {
        cache.invalidateAll();
        Instant at = now();
        log.info("Config cache reloaded");
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onReload(at);
            } catch (RuntimeException e) {
                log.warn("Config change listener {} failed on reload", listener.getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public ConfigView provision(ConfigDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        boolean encrypted = definition.isEncrypted();
        String defaultValue = Objects.requireNonNullElse(definition.defaultValue(), "");
        if (!defaultValue.isEmpty()) {
            Validation check = validator.validate(defaultValue, definition.valueType(), definition.validation());
            if (!check.isOk()) {
                throw new ValidationException(definition.key(), check.reason());
            }
        }
        Instant at = now();
        ConfigEntry entry = new ConfigEntry(
                definition.key(),
                definition.name(),
                definition.description(),
                definition.category(),
                definition.valueType(),
                definition.effectType(),
                encryptIfNeeded(encrypted, defaultValue),
                defaultValue,
                definition.validation(),
                definition.impactNote(),
                definition.sortOrder() == null ? 0 : definition.sortOrder(),
                encrypted,
                definition.isReadOnly(),
                1L,
                at,
                PROVISION_ACTOR);
        store.insert(entry);
        cache.invalidate(entry.key());
        log.info("Provisioned config {} ({}, encrypted={}, readOnly={})",
                entry.key(), entry.valueType(), entry.encrypted(), entry.readOnly());
        return toView(entry, defaultValue);
    }

    @Override
    public ImportResult importValues(Map<String, ?> values, String actor) {
        int imported = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, ?> item : values.entrySet()) {
            String key = item.getKey();
            Optional<ConfigEntry> entry = store.find(key);
            if (entry.isEmpty() || entry.get().encrypted() || entry.get().readOnly()) {
                skipped++;
                continue;
            }
            try {
                withKeyLock(key, () -> apply(key, item.getValue(), actor, IMPORT_REASON, ChangeKind.IMPORT));
                imported++;
            } catch (ValidationException e) {
                errors.add(key + ": " + e.reason());
            } catch (ConfigException e) {
                errors.add(key + ": " + e.getMessage());
            }
        }
        log.info("Config import by {}: imported={}, skipped={}, failed={}", actor, imported, skipped, errors.size());
        return new ImportResult(imported, skipped, errors);
    }

    /* ===================== 内部 ===================== */

    private UpdateResult apply(String key, Object value, String actor, String reason, ChangeKind kind) {
        ConfigEntry entry = requireEntry(key);
        Validation check = validator.validate(entry, value);
        if (check.outcome() == Validation.Outcome.READ_ONLY) {
            log.debug("Rejected write to read-only config {}", key);
            throw new ReadOnlyViolationException(key);
        }
        if (!check.isOk()) {
            log.debug("Rejected value for config {}: {}", key, check.reason());
            throw new ValidationException(key, check.reason());
        }
        String plaintext = entry.valueType().serialize(value);
        String stored = encryptIfNeeded(entry.encrypted(), plaintext);
        return commit(entry, stored, plaintext, actor, reason, kind, null);
    }

    /**
     * 在一个事务中写入新值并追加历史，提交后失效缓存并通知监听器。
     */
    private UpdateResult commit(ConfigEntry entry, String stored, String plaintext, String actor,
                                String reason, ChangeKind kind, String rollbackSourceId) {
        String key = entry.key();
        Instant at = now();
        String previousPlaintext = previousPlaintext(entry);
        HistoryRecord record = new HistoryRecord(
                UUID.randomUUID().toString(),
                key,
                entry.version() + 1,
                display(entry, previousPlaintext),
                display(entry, plaintext),
                entry.value(),
                at,
                actor,
                reason,
                kind,
                rollbackSourceId);

        try (TransactionScope.Transaction tx = transactions.begin()) {
            if (!store.updateValue(key, entry.version(), stored, actor, at)) {
                throw new ConcurrencyConflictException("Config " + key + " was modified concurrently (expected version "
                        + entry.version() + ")");
            }
            ledger.append(record);
            tx.commit();
        }
        cache.invalidate(key);

        ConfigEntry updated = entry.withValue(stored, actor, at);
        if (entry.encrypted()) {
            log.info("Config {} {} by {} -> version {}", key, kind, actor, updated.version());
        } else {
            log.info("Config {} {} by {} -> version {} ({})", key, kind, actor, updated.version(),
                    previewValue(plaintext, 100));
        }
        notifyListeners(new ConfigChangeEvent(key, entry.effectType(), actor, at, kind, updated.version(), record.id()));
        return new UpdateResult(toView(updated, plaintext), entry.effectType(), true, record.id());
    }

    /**
     * 在 Key 锁内执行写操作。只为已存在的配置创建锁，配置不可删除，锁表大小以配置总数为上限。
     */
    private <T> T withKeyLock(String key, Supplier<T> action) {
        Objects.requireNonNull(key, "key");
        requireEntry(key);
        ReentrantLock lock = keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
        boolean locked;
        try {
            locked = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("Interrupted while waiting for config " + key);
        }
        if (!locked) {
            throw new ConcurrencyConflictException("Timed out waiting for config " + key + " after " + lockTimeout);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int lockedKeyCount() {
        return keyLocks.size();
    }

    private void notifyListeners(ConfigChangeEvent event) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onChange(event);
            } catch (RuntimeException e) {
                log.warn("Config change listener {} failed for {}", listener.getClass().getSimpleName(), event.key(), e);
            }
        }
    }

    private ConfigEntry requireEntry(String key) {
        return store.find(key).orElseThrow(() -> {
            log.debug("Config {} not found", key);
            return new NotFoundException(key);
        });
    }

    private ConfigView listView(ConfigEntry entry) {
        if (!entry.encrypted()) {
            return toView(entry, entry.value());
        }
        try {
            return cache.get(entry.key())
                    .map(this::toView)
                    .orElseGet(() -> toView(entry, decryptStored(entry, entry.value())));
        } catch (DecryptionFailureException e) {
            // 列表中只展示遮蔽符，直接读取该 Key 时仍会失败
            return view(entry, SecretMasker.MASK, false);
        }
    }

    private ConfigView toView(CachedValue cached) {
        ConfigEntry entry = cached.entry();
        Object value = entry.encrypted() ? display(entry, cached.plaintext()) : cached.value();
        return view(entry, value, cached.isModified());
    }

    private ConfigView toView(ConfigEntry entry, String plaintext) {
        Object value = entry.encrypted() ? display(entry, plaintext) : entry.valueType().parse(plaintext);
        return view(entry, value, !plaintext.equals(entry.defaultValue()));
    }

    private static ConfigView view(ConfigEntry entry, Object value, boolean modified) {
        Object defaultValue = entry.encrypted()
                ? display(entry, entry.defaultValue())
                : entry.valueType().parse(entry.defaultValue());
        return new ConfigView(entry.key(), entry.name(), entry.description(), entry.category(),
                entry.valueType(), entry.effectType(), value, defaultValue, entry.validation(),
                entry.impactNote(), entry.encrypted(), entry.readOnly(), modified,
                entry.version(), entry.updatedAt(), entry.updatedBy());
    }

    /**
     * 展示形态：加密配置遮蔽，空值保持为空。
     */
    private static String display(ConfigEntry entry, String plaintext) {
        if (!entry.encrypted() || plaintext.isEmpty()) {
            return plaintext;
        }
        return SecretMasker.mask(plaintext);
    }

    private String decryptStored(ConfigEntry entry, String stored) {
        if (!entry.encrypted() || stored.isEmpty()) {
            return stored;
        }
        return encryptor.decrypt(stored);
    }

    /**
     * 变更前的明文，仅用于生成历史中的展示值。
     * <p>
     * 旧值无法解密时记为遮蔽符，允许操作者用新值覆盖损坏的密文。
     */
    private String previousPlaintext(ConfigEntry entry) {
        try {
            return decryptStored(entry, entry.value());
        } catch (DecryptionFailureException e) {
            log.warn("Previous value of config {} could not be decrypted, history records it as masked", entry.key());
            return SecretMasker.MASK;
        }
    }

    /**
     * 当前值是否等于默认值；无法解密的当前值视为已修改，重置可用来覆盖损坏的密文。
     */
    private boolean isAtDefault(ConfigEntry entry) {
        try {
            return decryptStored(entry, entry.value()).equals(entry.defaultValue());
        } catch (DecryptionFailureException e) {
            log.warn("Current value of config {} could not be decrypted, resetting to default", entry.key());
            return false;
        }
    }

    private String encryptIfNeeded(boolean encrypted, String plaintext) {
        return encrypted && !plaintext.isEmpty() ? encryptor.encrypt(plaintext) : plaintext;
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static String previewValue(String v, int maxLength) {
        if (v == null) return "null";
        if (v.length() <= maxLength) return v;
        return v.substring(0, maxLength) + "...(truncated)";
    }
}
