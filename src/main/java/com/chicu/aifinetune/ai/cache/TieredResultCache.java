package com.chicu.aifinetune.ai.cache;

import com.chicu.aifinetune.ai.ml.ResultCache;
import com.chicu.aifinetune.domain.FineTuningResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Трёхуровневый кэш результатов на Caffeine.
 * <ul>
 *     <li>новое значение кладётся в L1;</li>
 *     <li>вытеснение по размеру опускает запись на уровень ниже (из L3: удаление);</li>
 *     <li>попадание в L2/L3 поднимает запись обратно в L1.</li>
 * </ul>
 * Истёкшие по TTL записи не опускаются.
 * <p>
 * Все операции идут под одним монитором: подъём, демоушен и запись
 * по одному ключу не перемежаются.
 */
@Slf4j
@Component
public class TieredResultCache implements ResultCache {

    private final Cache<String, FineTuningResult> l3;
    private final Cache<String, FineTuningResult> l2;
    private final Cache<String, FineTuningResult> l1;

    private final Object monitor = new Object();

    @Autowired
    public TieredResultCache(ResultCacheProperties props) {
        this(props, Ticker.systemTicker());
    }

    TieredResultCache(ResultCacheProperties props, Ticker ticker) {
        this.l3 = tier("L3", props.getL3(), ticker, null);
        this.l2 = tier("L2", props.getL2(), ticker, l3);
        this.l1 = tier("L1", props.getL1(), ticker, l2);

        log.info("🗃️ TieredResultCache поднят. L1={}/{} L2={}/{} L3={}/{}",
                props.getL1().getMaxSize(), props.getL1().getTtl(),
                props.getL2().getMaxSize(), props.getL2().getTtl(),
                props.getL3().getMaxSize(), props.getL3().getTtl());
    }

    private static Cache<String, FineTuningResult> tier(String name,
                                                        ResultCacheProperties.Tier cfg,
                                                        Ticker ticker,
                                                        Cache<String, FineTuningResult> next) {
        Caffeine<String, FineTuningResult> b = Caffeine.newBuilder()
                .maximumSize(Math.max(1, cfg.getMaxSize()))
                .ticker(ticker)
                // обслуживание синхронно: демоушен виден сразу после put
                .executor(Runnable::run)
                .evictionListener((String key, FineTuningResult value, RemovalCause cause) -> {
                    if (cause != RemovalCause.SIZE || key == null || value == null) return;
                    if (next != null) {
                        next.put(key, value);
                        log.debug("🗃️ CACHE demote {} key={}", name, key);
                    } else {
                        log.debug("🗃️ CACHE drop {} key={}", name, key);
                    }
                });

        if (cfg.getTtl() != null && !cfg.getTtl().isZero() && !cfg.getTtl().isNegative()) {
            b.expireAfterWrite(cfg.getTtl());
        }

        return b.build();
    }

    @Override
    public Optional<FineTuningResult> get(String key) {
        if (key == null) return Optional.empty();

        synchronized (monitor) {
            FineTuningResult hot = l1.getIfPresent(key);
            if (hot != null) return Optional.of(hot);

            FineTuningResult warm = l2.asMap().remove(key);
            if (warm != null) {
                l1.put(key, warm);
                log.debug("🗃️ CACHE promote L2→L1 key={}", key);
                return Optional.of(warm);
            }

            FineTuningResult cold = l3.asMap().remove(key);
            if (cold != null) {
                l1.put(key, cold);
                log.debug("🗃️ CACHE promote L3→L1 key={}", key);
                return Optional.of(cold);
            }

            return Optional.empty();
        }
    }

    @Override
    public Optional<FineTuningResult> peek(String key) {
        if (key == null) return Optional.empty();

        synchronized (monitor) {
            FineTuningResult found = l1.asMap().get(key);
            if (found == null) found = l2.asMap().get(key);
            if (found == null) found = l3.asMap().get(key);
            return Optional.ofNullable(found);
        }
    }

    @Override
    public void set(String key, FineTuningResult value) {
        if (key == null) throw new IllegalArgumentException("key=null");
        if (value == null) throw new IllegalArgumentException("value=null");

        synchronized (monitor) {
            // last-write-wins: старые копии на нижних уровнях убираем
            l2.invalidate(key);
            l3.invalidate(key);
            l1.put(key, value);
        }
    }

    @Override
    public boolean delete(String key) {
        if (key == null) return false;

        synchronized (monitor) {
            boolean removed = l1.asMap().remove(key) != null;
            removed |= l2.asMap().remove(key) != null;
            removed |= l3.asMap().remove(key) != null;
            return removed;
        }
    }

    @Override
    public Set<String> listKeys() {
        synchronized (monitor) {
            Set<String> keys = new LinkedHashSet<>(l1.asMap().keySet());
            keys.addAll(l2.asMap().keySet());
            keys.addAll(l3.asMap().keySet());
            return keys;
        }
    }

    @Override
    public void clear() {
        synchronized (monitor) {
            l1.invalidateAll();
            l2.invalidateAll();
            l3.invalidateAll();
        }
    }

    // =========================================================
    // для тестов: раскладка по уровням
    // =========================================================

    /** Номер уровня, где лежит ключ (1..3), или 0. */
    int tierOf(String key) {
        synchronized (monitor) {
            if (l1.asMap().containsKey(key)) return 1;
            if (l2.asMap().containsKey(key)) return 2;
            if (l3.asMap().containsKey(key)) return 3;
            return 0;
        }
    }

    void putIntoTier(int tier, String key, FineTuningResult value) {
        synchronized (monitor) {
            switch (tier) {
                case 1 -> l1.put(key, value);
                case 2 -> l2.put(key, value);
                case 3 -> l3.put(key, value);
                default -> throw new IllegalArgumentException("tier=" + tier);
            }
        }
    }
}
