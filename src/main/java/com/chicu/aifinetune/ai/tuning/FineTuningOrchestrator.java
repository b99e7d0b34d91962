package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.ai.ml.HardwareSnapshotProvider;
import com.chicu.aifinetune.ai.ml.ModelEvaluator;
import com.chicu.aifinetune.ai.ml.ModelRegistry;
import com.chicu.aifinetune.ai.ml.ModelTrainer;
import com.chicu.aifinetune.ai.ml.OverfittingAnalysis;
import com.chicu.aifinetune.ai.ml.OverfittingDetector;
import com.chicu.aifinetune.ai.ml.ResultCache;
import com.chicu.aifinetune.ai.ml.TrainedModel;
import com.chicu.aifinetune.ai.ml.TrainingMetrics;
import com.chicu.aifinetune.ai.tuning.error.DeploymentException;
import com.chicu.aifinetune.ai.tuning.error.FineTuningException;
import com.chicu.aifinetune.ai.tuning.error.ValidationException;
import com.chicu.aifinetune.ai.tuning.preprocess.DataPreprocessor;
import com.chicu.aifinetune.common.enums.DeploymentEnvironment;
import com.chicu.aifinetune.common.enums.ErrorType;
import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import com.chicu.aifinetune.domain.DeploymentOptions;
import com.chicu.aifinetune.domain.DeploymentOutcome;
import com.chicu.aifinetune.domain.EvaluationResult;
import com.chicu.aifinetune.domain.FineTuningRequest;
import com.chicu.aifinetune.domain.FineTuningResult;
import com.chicu.aifinetune.domain.ModelInfo;
import com.chicu.aifinetune.domain.ModelMetadata;
import com.chicu.aifinetune.domain.OptimizationOptions;
import com.chicu.aifinetune.domain.ResultError;
import com.chicu.aifinetune.domain.ResultMetadata;
import com.chicu.aifinetune.domain.ResultWarning;
import com.chicu.aifinetune.domain.TrainingParameters;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Конвейер одной заявки:
 * кэш → режим → похожая модель → препроцессинг → параметры → обучение → оценка →
 * переобучение → (оптимизация) → регистрация → (выкладка) → кэш.
 * <p>
 * Ожидаемые ошибки не бросаются, а превращаются в FineTuningResult с success=false.
 * Исключение одно: DeploymentException после успешной регистрации (в ней лежит готовый двухфазный итог).
 */
@Slf4j
@Service
public class FineTuningOrchestrator {

    private static final String METRIC_PREFIX = "fine_tuning.";

    private final CacheKeyBuilder cacheKeyBuilder;
    private final ModeSelector modeSelector;
    private final DataPreprocessor preprocessor;
    private final ParameterConfigurer parameterConfigurer;
    private final ModelTrainer trainer;
    private final ModelEvaluator evaluator;
    private final OverfittingDetector overfittingDetector;
    private final ModelRegistry registry;
    private final ResultCache resultCache;
    private final HardwareSnapshotProvider hardware;
    private final MeterRegistry meterRegistry;

    private final Retry trainerRetry;
    private final Retry evaluatorRetry;

    public FineTuningOrchestrator(CacheKeyBuilder cacheKeyBuilder,
                                  ModeSelector modeSelector,
                                  DataPreprocessor preprocessor,
                                  ParameterConfigurer parameterConfigurer,
                                  ModelTrainer trainer,
                                  ModelEvaluator evaluator,
                                  OverfittingDetector overfittingDetector,
                                  ModelRegistry registry,
                                  ResultCache resultCache,
                                  HardwareSnapshotProvider hardware,
                                  MeterRegistry meterRegistry,
                                  RetryRegistry retryRegistry) {
        this.cacheKeyBuilder = cacheKeyBuilder;
        this.modeSelector = modeSelector;
        this.preprocessor = preprocessor;
        this.parameterConfigurer = parameterConfigurer;
        this.trainer = trainer;
        this.evaluator = evaluator;
        this.overfittingDetector = overfittingDetector;
        this.registry = registry;
        this.resultCache = resultCache;
        this.hardware = hardware;
        this.meterRegistry = meterRegistry;
        this.trainerRetry = retryRegistry.retry("trainer");
        this.evaluatorRetry = retryRegistry.retry("evaluator");
    }

    public FineTuningResult run(FineTuningRequest request, ExecutionMode pinnedMode, PipelineDeadline deadline) {
        if (request == null) throw new IllegalArgumentException("request=null");
        if (deadline == null) deadline = PipelineDeadline.none();

        long started = System.currentTimeMillis();
        count("start");

        try {
            // ==========================
            // кэш
            // ==========================
            deadline.checkpoint("cache");
            String cacheKey = request.cachingEnabled() ? cacheKeyBuilder.build(request) : null;

            if (cacheKey != null) {
                Optional<FineTuningResult> cached = resultCache.get(cacheKey);
                if (cached.isPresent()) {
                    count("cache_hit");
                    log.info("⚡ FT CACHE HIT type={} purpose={} modelId={}",
                            safe(request.modelType()), safe(request.purpose()), cached.get().modelId());
                    return cached.get();
                }
            }

            // ==========================
            // режим
            // ==========================
            deadline.checkpoint("mode");
            ExecutionMode mode = modeSelector.resolve(request, pinnedMode, hardware::snapshot);

            // неизвестную категорию отсеет препроцессор, реестр ради неё не трогаем
            Optional<ModelCategory> parsedCategory = ModelCategory.fromValue(request.modelType());

            // ==========================
            // похожая модель
            // ==========================
            if (parsedCategory.isPresent() && !request.forceRetrain()) {
                deadline.checkpoint("registry-lookup");
                Optional<ModelInfo> existing = registry.findSimilarModel(
                        parsedCategory.get(), request.purpose(), request.targetDomain(), request.learnerProfile());

                if (existing.isPresent()) {
                    FineTuningResult reused = reuseExisting(existing.get(), mode, started);
                    writeCache(cacheKey, reused);
                    return reused;
                }
            }

            // ==========================
            // данные и параметры
            // ==========================
            deadline.checkpoint("preprocess");
            List<Map<String, Object>> processed = preprocessor.process(request.trainingData(), request.modelType());
            if (processed.isEmpty()) {
                throw new ValidationException("No valid training records left after preprocessing");
            }

            ModelCategory category = parsedCategory
                    .orElseThrow(() -> new ValidationException("Unsupported model type: " + request.modelType()));

            TrainingParameters params = parameterConfigurer.configure(
                    request.trainingParameters(), category, processed.size(), mode);

            // ==========================
            // обучение
            // ==========================
            deadline.checkpoint("train");
            log.info("🏋️ FT TRAIN START type={} mode={} samples={} validation={}",
                    category.value(), mode.value(), processed.size(), request.validationData().size());

            long trainStarted = System.currentTimeMillis();
            TrainedModel trained = trainerRetry.executeSupplier(() ->
                    trainer.trainModel(category, processed, params, mode, request.validationData()));
            if (trained == null || trained.modelId() == null || trained.modelId().isBlank()) {
                throw new IllegalStateException("Trainer returned no model id");
            }

            log.info("🏋️ FT TRAIN DONE modelId={} size={} tookMs={}",
                    trained.modelId(), trained.modelSize(), System.currentTimeMillis() - trainStarted);

            // ==========================
            // оценка (не фатальна)
            // ==========================
            List<ResultWarning> warnings = new ArrayList<>();

            deadline.checkpoint("evaluate");
            EvaluationResult evaluation = evaluate(trained.modelId(), request.evaluationData(), category, warnings);

            // ==========================
            // переобучение → оптимизация
            // ==========================
            deadline.checkpoint("overfitting");
            OverfittingAnalysis analysis = overfittingDetector.detectOverfitting(trained.trainingMetrics(), evaluation);
            if (analysis == null) analysis = OverfittingAnalysis.none();

            TrainedModel finalModel = trained;
            if (analysis.overfitting() || request.optimizationOptions() != null) {
                deadline.checkpoint("optimize");
                OptimizationOptions options = optimizationOptions(request.optimizationOptions(), analysis, mode);

                log.info("🪚 FT OPTIMIZE modelId={} overfitting={} options={}",
                        trained.modelId(), analysis.overfitting(), options.toMap());

                TrainedModel optimized = trainer.optimizeModel(trained.modelId(), options);
                if (optimized != null && optimized.modelId() != null && !optimized.modelId().isBlank()) {
                    finalModel = optimized;
                }
            }

            boolean optimized = !finalModel.modelId().equals(trained.modelId());

            // ==========================
            // регистрация
            // ==========================
            Instant now = Instant.now();
            ModelMetadata metadata = ModelMetadata.builder()
                    .baseModelType(category)
                    .purpose(request.purpose())
                    .targetDomain(request.targetDomain())
                    .learnerProfileTarget(request.learnerProfile())
                    .createdAt(now)
                    .lastUsed(now)
                    .trainingDatasetSize(processed.size())
                    .operationMode(mode)
                    .optimized(optimized)
                    .tags(request.tags())
                    .build();

            deadline.checkpoint("register");
            registry.registerModel(finalModel.modelId(), metadata, evaluation, finalModel.modelSize());

            log.info("🗂️ FT REGISTERED modelId={} optimized={} size={}",
                    finalModel.modelId(), optimized, finalModel.modelSize());

            if (analysis.overfitting()) {
                warnings.add(ResultWarning.overfitting());
            }

            FineTuningResult.FineTuningResultBuilder result = FineTuningResult.builder()
                    .modelId(finalModel.modelId())
                    .originalModelType(request.modelType())
                    .purpose(request.purpose())
                    .success(true)
                    .metrics(resultMetrics(evaluation, trained, finalModel, processed.size(), request))
                    .evaluation(evaluation)
                    .warnings(warnings)
                    .deployment(DeploymentOutcome.registeredOnly(finalModel.modelId()));

            // ==========================
            // выкладка
            // ==========================
            if (request.deployment() != null) {
                deadline.checkpoint("deploy");
                DeploymentOutcome outcome = deploy(finalModel.modelId(), request, mode, started, now);
                result.deployment(outcome);
            }

            FineTuningResult done = result
                    .metadata(ResultMetadata.builder()
                            .createdAt(now)
                            .lastUsed(now)
                            .operationMode(mode)
                            .existingModel(false)
                            .processingTimeMs(System.currentTimeMillis() - started)
                            .optimized(optimized)
                            .build())
                    .build();

            writeCache(cacheKey, done);

            count("success");
            meterRegistry.timer(METRIC_PREFIX + "processing")
                    .record(System.currentTimeMillis() - started, TimeUnit.MILLISECONDS);

            log.info("✅ FT DONE modelId={} mode={} optimized={} warnings={} tookMs={}",
                    done.modelId(), mode.value(), optimized, warnings.size(), System.currentTimeMillis() - started);

            return done;

        } catch (DeploymentException e) {
            throw e;

        } catch (FineTuningException e) {
            count(e.getType() == ErrorType.TIMEOUT ? "timeout" : "error");
            log.error("❌ FT FAILED type={} errorType={} tookMs={} : {}",
                    safe(request.modelType()), e.getType(), System.currentTimeMillis() - started, e.getMessage());
            return failure(request, pinnedMode, e.getType(), e.getMessage(), null, started);

        } catch (Exception e) {
            count("error");
            log.error("❌ FT FAILED type={} tookMs={} : {}",
                    safe(request.modelType()), System.currentTimeMillis() - started, e.getMessage(), e);
            return failure(request, pinnedMode, ErrorType.UNKNOWN, messageOf(e), stackTraceOf(e), started);
        }
    }

    /**
     * Итог с success=false. Режим: закреплённый: до выбора режима могли и не дойти.
     */
    public FineTuningResult failure(FineTuningRequest request,
                                    ExecutionMode pinnedMode,
                                    ErrorType type,
                                    String message,
                                    String details,
                                    long startedMs) {
        Instant now = Instant.now();
        return FineTuningResult.builder()
                .modelId("")
                .originalModelType(request.modelType())
                .purpose(request.purpose())
                .success(false)
                .error(new ResultError(type, message, details))
                .metadata(ResultMetadata.builder()
                        .createdAt(now)
                        .lastUsed(now)
                        .operationMode(pinnedMode != null ? pinnedMode : ExecutionMode.AUTO)
                        .existingModel(false)
                        .processingTimeMs(System.currentTimeMillis() - startedMs)
                        .build())
                .build();
    }

    // =========================================================
    // стадии
    // =========================================================

    private FineTuningResult reuseExisting(ModelInfo existing, ExecutionMode mode, long started) {
        count("existing_model_used");
        log.info("♻️ FT EXISTING MODEL modelId={} status={} usage={}",
                existing.modelId(), existing.status(), existing.usageCount());

        registry.recordModelUsage(existing.modelId());

        return FineTuningResult.builder()
                .modelId(existing.modelId())
                .originalModelType(existing.baseModelType() != null ? existing.baseModelType().value() : null)
                .purpose(existing.purpose())
                .success(true)
                .metrics(existing.metrics())
                .deployment(DeploymentOutcome.registeredOnly(existing.modelId()))
                .metadata(ResultMetadata.builder()
                        .createdAt(existing.createdAt())
                        .lastUsed(Instant.now())
                        .operationMode(mode)
                        .existingModel(true)
                        .processingTimeMs(System.currentTimeMillis() - started)
                        .build())
                .build();
    }

    private EvaluationResult evaluate(String modelId,
                                      List<Map<String, Object>> data,
                                      ModelCategory category,
                                      List<ResultWarning> warnings) {
        long t0 = System.currentTimeMillis();
        try {
            EvaluationResult res = evaluatorRetry.executeSupplier(() -> evaluator.evaluateModel(modelId, data, category));
            if (res == null) {
                res = EvaluationResult.failed(modelId, "Evaluator returned no result");
            }
            if (!res.success()) {
                count("evaluation_error");
                warnings.add(ResultWarning.evaluationFailed(safe(res.error())));
                log.warn("⚠️ FT EVAL NOT OK modelId={} error={}", modelId, safe(res.error()));
            } else {
                log.info("📏 FT EVAL modelId={} samples={} metrics={} tookMs={}",
                        modelId, data.size(), res.metrics(), System.currentTimeMillis() - t0);
            }
            return res;

        } catch (Exception e) {
            count("evaluation_error");
            String reason = messageOf(e);
            log.warn("⚠️ FT EVAL FAILED modelId={} tookMs={} : {}", modelId, System.currentTimeMillis() - t0, reason);
            warnings.add(ResultWarning.evaluationFailed(reason));
            return EvaluationResult.failed(modelId, reason);
        }
    }

    private static OptimizationOptions optimizationOptions(OptimizationOptions callerOptions,
                                                           OverfittingAnalysis analysis,
                                                           ExecutionMode mode) {
        OptimizationOptions base = callerOptions != null ? callerOptions : OptimizationOptions.builder().build();
        boolean quantization = base.wantsQuantization() || mode == ExecutionMode.LOCAL;

        return base.toBuilder()
                .addressOverfitting(analysis.overfitting())
                .pruningThreshold(analysis.recommendedPruningThreshold())
                .quantization(quantization)
                .build();
    }

    /**
     * Выкладка после регистрации. При ошибке собирается двухфазный итог
     * (registered=true, deployed=false) и бросается DeploymentException с ним внутри.
     */
    private DeploymentOutcome deploy(String modelId,
                                     FineTuningRequest request,
                                     ExecutionMode mode,
                                     long started,
                                     Instant createdAt) {
        DeploymentOptions options = request.deployment();
        String environment = options.environment();

        log.info("🚀 FT DEPLOY START modelId={} env={} endpoint={}", modelId, safe(environment), safe(options.endpointName()));

        try {
            DeploymentEnvironment target = DeploymentEnvironment.fromValue(environment)
                    .orElseThrow(() -> new DeploymentException("Unsupported deployment environment: " + environment));

            switch (target) {
                case LOCAL -> trainer.deployModelLocally(modelId, options);
                case CLOUD -> trainer.deployModelToCloud(modelId, options);
                case EDGE -> trainer.deployModelToEdge(modelId, options);
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("deploymentEnvironment", target.value());
            details.put("deploymentTimestamp", Instant.now().toString());
            details.put("deploymentConfig", options.toMap());
            registry.updateModelStatus(modelId, ModelStatus.DEPLOYED, details);

            log.info("🚀 FT DEPLOY DONE modelId={} env={}", modelId, target.value());
            return DeploymentOutcome.deployed(modelId, target.value());

        } catch (Exception e) {
            count("deployment_error");
            log.error("❌ FT DEPLOY FAILED modelId={} env={} : {}", modelId, safe(environment), e.getMessage());

            String message = e instanceof DeploymentException
                    ? e.getMessage()
                    : "Deployment failed: " + messageOf(e);

            FineTuningResult failed = failure(request, mode, ErrorType.DEPLOYMENT, message, null, started)
                    .toBuilder()
                    .deployment(DeploymentOutcome.deploymentFailed(modelId, environment))
                    .build();

            log.warn("⚠️ FT PARTIAL modelId={} registered=true deployed=false createdAt={}", modelId, createdAt);
            throw new DeploymentException(message, e, failed);
        }
    }

    private static Map<String, Double> resultMetrics(EvaluationResult evaluation,
                                                     TrainedModel trained,
                                                     TrainedModel finalModel,
                                                     int trainingSamples,
                                                     FineTuningRequest request) {
        TrainingMetrics tm = finalModel.trainingMetrics() != null
                ? finalModel.trainingMetrics()
                : trained.trainingMetrics();

        Map<String, Double> m = new LinkedHashMap<>(evaluation.metrics());
        if (tm != null) {
            m.put("trainingLoss", tm.finalLoss());
            m.put("validationLoss", tm.validationLoss());
        }
        m.put("trainingSamples", (double) trainingSamples);
        m.put("validationSamples", (double) request.validationData().size());
        m.put("evaluationSamples", (double) request.evaluationData().size());
        m.put("modelSize", (double) finalModel.modelSize());
        m.put("originalModelSize", (double) trained.modelSize());
        m.put("reductionRatio", reductionRatio(trained.modelSize(), finalModel.modelSize()));
        return m;
    }

    static double reductionRatio(long originalSize, long optimizedSize) {
        return originalSize > 0 ? 1.0 - ((double) optimizedSize / originalSize) : 0.0;
    }

    private void writeCache(String cacheKey, FineTuningResult result) {
        if (cacheKey == null) return;
        try {
            resultCache.set(cacheKey, result);
        } catch (Exception e) {
            // сбой записи в кэш заявку не роняет
            log.warn("⚠️ FT CACHE WRITE FAILED modelId={} : {}", result.modelId(), e.getMessage());
        }
    }

    // =========================================================
    // helpers
    // =========================================================

    private void count(String name) {
        meterRegistry.counter(METRIC_PREFIX + name).increment();
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String stackTraceOf(Throwable e) {
        StringWriter sw = new StringWriter();
        e.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    private static String safe(String s) {
        if (s == null) return "";
        String x = s.trim();
        return x.length() > 200 ? x.substring(0, 200) : x;
    }
}
