package com.chicu.aifinetune.ai.ml.sidecar;

import com.chicu.aifinetune.ai.ml.sidecar.dto.DeployRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.DeployResponseDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.EvaluateRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.EvaluateResponseDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.OptimizeRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.TrainRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.TrainResponseDto;
import com.chicu.aifinetune.ai.ml.sidecar.props.MlSidecarProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * HTTP-клиент к python sidecar, который реально учит/оптимизирует/оценивает/выкладывает модели.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MlSidecarClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final MlSidecarProperties props;

    private OkHttpClient clientWithTimeouts() {
        return baseClient.newBuilder()
                .connectTimeout(Duration.ofMillis(Math.max(200, props.getConnectTimeoutMs())))
                .readTimeout(Duration.ofMillis(Math.max(500, props.getReadTimeoutMs())))
                .build();
    }

    public JsonNode health() {
        Request.Builder rb = new Request.Builder()
                .url(url("/health"))
                .get();
        withApiKey(rb);

        try (Response resp = clientWithTimeouts().newCall(rb.build()).execute()) {
            if (!resp.isSuccessful()) {
                throw new IllegalStateException("ML sidecar /health HTTP " + resp.code());
            }
            String body = resp.body() != null ? resp.body().string() : "";
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new IllegalStateException("ML sidecar /health failed: " + e.getMessage(), e);
        }
    }

    public TrainResponseDto train(TrainRequestDto req) {
        return post("/train", req, TrainResponseDto.class);
    }

    public TrainResponseDto optimize(OptimizeRequestDto req) {
        return post("/optimize", req, TrainResponseDto.class);
    }

    public EvaluateResponseDto evaluate(EvaluateRequestDto req) {
        return post("/evaluate", req, EvaluateResponseDto.class);
    }

    public DeployResponseDto deploy(DeployRequestDto req) {
        return post("/deploy", req, DeployResponseDto.class);
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        String url = url(path);

        try {
            String json = objectMapper.writeValueAsString(body);

            Request.Builder rb = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(json, JSON));
            withApiKey(rb);

            long t0 = System.currentTimeMillis();
            try (Response resp = clientWithTimeouts().newCall(rb.build()).execute()) {

                String respBody = resp.body() != null ? resp.body().string() : "";

                if (!resp.isSuccessful()) {
                    log.warn("🧠 ML sidecar error: {} {} -> {} body={}", "POST", path, resp.code(), shrink(respBody));
                    throw new IllegalStateException("ML sidecar HTTP " + resp.code() + ": " + shrink(respBody));
                }

                if (respBody.isBlank()) {
                    throw new IllegalStateException("ML sidecar пустой ответ: " + path);
                }

                log.debug("🧠 ML sidecar POST {} -> {} tookMs={}", path, resp.code(), System.currentTimeMillis() - t0);
                return objectMapper.readValue(respBody, responseType);
            }

        } catch (IOException e) {
            throw new IllegalStateException("ML sidecar IO error: " + url + " -> " + e.getMessage(), e);
        }
    }

    private String url(String path) {
        return props.getBaseUrl().replaceAll("/+$", "") + path;
    }

    private void withApiKey(Request.Builder rb) {
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            rb.header("X-API-KEY", props.getApiKey().trim());
        }
    }

    static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
