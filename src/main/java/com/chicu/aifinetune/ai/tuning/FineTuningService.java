package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.ai.ml.ModelRegistry;
import com.chicu.aifinetune.ai.ml.ResultCache;
import com.chicu.aifinetune.ai.tuning.error.DeploymentException;
import com.chicu.aifinetune.ai.tuning.error.FineTuningException;
import com.chicu.aifinetune.ai.tuning.error.ModelNotFoundException;
import com.chicu.aifinetune.ai.tuning.error.PipelineTimeoutException;
import com.chicu.aifinetune.common.enums.ErrorType;
import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.domain.FineTuningRequest;
import com.chicu.aifinetune.domain.FineTuningResult;
import com.chicu.aifinetune.domain.ModelInfo;
import com.chicu.aifinetune.domain.ModelListFilters;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Точка входа: fineTuneModel + управление режимом, реестром и кэшем.
 * <p>
 * Конвейер крутится на собственном пуле; вызывающий ждёт не дольше дедлайна заявки.
 * Одинаковые одновременные заявки (тот же отпечаток, кэш включён) ждут одно вычисление.
 */
@Slf4j
@Service
public class FineTuningService {

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicLong ctr = new AtomicLong(1);
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("ft-worker-" + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private final FineTuningOrchestrator orchestrator;
    private final CacheKeyBuilder cacheKeyBuilder;
    private final ModelRegistry registry;
    private final ResultCache resultCache;
    private final FineTuningProperties props;
    private final MeterRegistry meterRegistry;

    private final AtomicReference<ExecutionMode> pinnedMode;

    /** отпечаток → вычисление, которое уже идёт */
    private final ConcurrentMap<String, CompletableFuture<FineTuningResult>> inFlight = new ConcurrentHashMap<>();

    private final ExecutorService executor;

    public FineTuningService(FineTuningOrchestrator orchestrator,
                             CacheKeyBuilder cacheKeyBuilder,
                             ModelRegistry registry,
                             ResultCache resultCache,
                             FineTuningProperties props,
                             MeterRegistry meterRegistry) {
        this.orchestrator = orchestrator;
        this.cacheKeyBuilder = cacheKeyBuilder;
        this.registry = registry;
        this.resultCache = resultCache;
        this.props = props;
        this.meterRegistry = meterRegistry;

        this.pinnedMode = new AtomicReference<>(
                props.getPinnedMode() != null ? props.getPinnedMode() : ExecutionMode.AUTO);

        int threads = Math.max(1, props.getWorkerThreads());
        this.executor = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new WorkerThreadFactory()
        );

        log.info("🧠 FineTuningService поднят. workers={} pinnedMode={} singleFlight={} defaultTimeout={}",
                threads, pinnedMode.get().value(), props.isSingleFlight(), props.getDefaultTimeout());
    }

    public FineTuningResult fineTuneModel(FineTuningRequest request) {
        if (request == null) throw new IllegalArgumentException("request=null");

        long started = System.currentTimeMillis();
        ExecutionMode pinned = pinnedMode.get();

        Duration budget = request.timeout() != null ? request.timeout() : props.getDefaultTimeout();
        PipelineDeadline deadline = budget != null ? PipelineDeadline.after(budget) : PipelineDeadline.none();

        String flightKey = props.isSingleFlight() && request.cachingEnabled() ? flightKeyOf(request) : null;

        if (flightKey == null) {
            CompletableFuture<FineTuningResult> own = new CompletableFuture<>();
            Future<?> task = submit(own, request, pinned, deadline);
            return await(own, task, request, pinned, deadline, started);
        }

        CompletableFuture<FineTuningResult> fresh = new CompletableFuture<>();
        CompletableFuture<FineTuningResult> running = inFlight.putIfAbsent(flightKey, fresh);

        if (running != null) {
            log.info("⏳ FT JOIN in-flight type={} purpose={}", request.modelType(), request.purpose());
            return await(running, null, request, pinned, deadline, started);
        }

        fresh.whenComplete((r, e) -> inFlight.remove(flightKey, fresh));
        Future<?> task = submit(fresh, request, pinned, deadline);
        return await(fresh, task, request, pinned, deadline, started);
    }

    // =========================================================
    // режим
    // =========================================================

    public void setOperationMode(ExecutionMode mode) {
        if (mode == null) throw new IllegalArgumentException("mode=null");
        ExecutionMode prev = pinnedMode.getAndSet(mode);
        log.info("🧭 FT MODE pinned {} → {}", prev.value(), mode.value());
    }

    public ExecutionMode getOperationMode() {
        return pinnedMode.get();
    }

    // =========================================================
    // реестр и кэш
    // =========================================================

    public ModelInfo getModelInfo(String modelId) {
        return registry.getModelInfo(modelId)
                .orElseThrow(() -> new ModelNotFoundException(modelId));
    }

    public List<ModelInfo> listModels(ModelListFilters filters) {
        return registry.listModels(filters != null ? filters : ModelListFilters.NONE);
    }

    /**
     * Удаляет модель из реестра и все закэшированные результаты, которые на неё указывают.
     */
    public boolean deleteModel(String modelId) {
        boolean deleted = registry.deleteModel(modelId);
        if (!deleted) {
            log.warn("⚠️ FT DELETE modelId={} нет в реестре", modelId);
            return false;
        }

        int evicted = 0;
        for (String key : resultCache.listKeys()) {
            // peek: обход не должен переставлять уровни кэша
            boolean pointsToModel = resultCache.peek(key)
                    .map(r -> modelId.equals(r.modelId()))
                    .orElse(false);
            if (pointsToModel && resultCache.delete(key)) {
                evicted++;
            }
        }

        log.info("🗑️ FT DELETE modelId={} evictedCacheEntries={}", modelId, evicted);
        return true;
    }

    public void clearCache() {
        resultCache.clear();
        log.info("🧹 FT CACHE cleared");
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        log.info("🛑 FineTuningService остановлен. inFlight={}", inFlight.size());
    }

    // =========================================================
    // helpers
    // =========================================================

    private Future<?> submit(CompletableFuture<FineTuningResult> target,
                             FineTuningRequest request,
                             ExecutionMode pinned,
                             PipelineDeadline deadline) {
        return executor.submit(() -> {
            try {
                target.complete(orchestrator.run(request, pinned, deadline));
            } catch (Throwable t) {
                target.completeExceptionally(t);
            }
        });
    }

    private FineTuningResult await(CompletableFuture<FineTuningResult> future,
                                   Future<?> task,
                                   FineTuningRequest request,
                                   ExecutionMode pinned,
                                   PipelineDeadline deadline,
                                   long started) {
        try {
            return deadline.isUnbounded()
                    ? future.get()
                    : future.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            String message = "Fine-tuning did not finish within " + describeBudget(request);
            if (task != null) {
                // владелец вычисления: будим всех, кто присоединился, и прерываем конвейер
                future.completeExceptionally(new PipelineTimeoutException(message));
                task.cancel(true);
            }
            meterRegistry.counter("fine_tuning.timeout").increment();
            log.warn("⏰ FT TIMEOUT type={} purpose={} tookMs={}",
                    request.modelType(), request.purpose(), System.currentTimeMillis() - started);
            return orchestrator.failure(request, pinned, ErrorType.TIMEOUT, message, null, started);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (task != null) task.cancel(true);
            return orchestrator.failure(request, pinned, ErrorType.TIMEOUT, "Fine-tuning interrupted", null, started);

        } catch (ExecutionException e) {
            return fromFailure(e.getCause(), request, pinned, started);
        }
    }

    private FineTuningResult fromFailure(Throwable cause,
                                         FineTuningRequest request,
                                         ExecutionMode pinned,
                                         long started) {
        if (cause instanceof DeploymentException de) {
            if (props.isPropagateDeploymentErrors()) {
                throw de;
            }
            if (de.getResult() != null) {
                return de.getResult();
            }
            return orchestrator.failure(request, pinned, ErrorType.DEPLOYMENT, de.getMessage(), null, started);
        }

        if (cause instanceof FineTuningException fe) {
            return orchestrator.failure(request, pinned, fe.getType(), fe.getMessage(), null, started);
        }

        log.error("❌ FT WORKER FAILED type={} : {}", request.modelType(), cause != null ? cause.getMessage() : null, cause);
        String message = cause != null && cause.getMessage() != null ? cause.getMessage() : "Fine-tuning failed";
        return orchestrator.failure(request, pinned, ErrorType.UNKNOWN, message, null, started);
    }

    private String flightKeyOf(FineTuningRequest request) {
        try {
            return cacheKeyBuilder.build(request);
        } catch (RuntimeException e) {
            log.warn("⚠️ FT fingerprint failed, single-flight off for this request: {}", e.getMessage());
            return null;
        }
    }

    private String describeBudget(FineTuningRequest request) {
        Duration budget = request.timeout() != null ? request.timeout() : props.getDefaultTimeout();
        return String.valueOf(budget);
    }
}
