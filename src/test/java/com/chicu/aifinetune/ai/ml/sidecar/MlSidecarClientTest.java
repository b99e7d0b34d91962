package com.chicu.aifinetune.ai.ml.sidecar;

import com.chicu.aifinetune.ai.ml.sidecar.dto.EvaluateRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.EvaluateResponseDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.TrainRequestDto;
import com.chicu.aifinetune.ai.ml.sidecar.dto.TrainResponseDto;
import com.chicu.aifinetune.ai.ml.sidecar.props.MlSidecarProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MlSidecarClientTest {

    private MockWebServer server;
    private MlSidecarProperties props;
    private MlSidecarClient client;
    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        props = new MlSidecarProperties();
        props.setBaseUrl(server.url("/").toString());
        props.setApiKey("secret");

        client = new MlSidecarClient(new OkHttpClient(), mapper, props);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void train_shouldPostJsonWithApiKey_andParseResponse() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"ok\":true,\"modelId\":\"m1\",\"modelSize\":1024,\"epochs\":3,"
                        + "\"finalLoss\":0.2,\"validationLoss\":0.25,\"trainingTimeMs\":900}"));

        TrainResponseDto resp = client.train(TrainRequestDto.builder()
                .modelType("text-classification")
                .mode("local")
                .data(List.of(Map.of("text", "bonjour", "label", "greeting")))
                .validationData(List.of())
                .params(Map.of("epochs", 3))
                .build());

        assertTrue(resp.isOk());
        assertEquals("m1", resp.getModelId());
        assertEquals(1024, resp.getModelSize());
        assertEquals(0.25, resp.getValidationLoss());

        RecordedRequest rec = server.takeRequest();
        assertEquals("POST", rec.getMethod());
        assertEquals("/train", rec.getPath(), "лишний слэш в base-url не должен дублироваться");
        assertEquals("secret", rec.getHeader("X-API-KEY"));

        JsonNode body = mapper.readTree(rec.getBody().readUtf8());
        assertEquals("text-classification", body.get("modelType").asText());
        assertEquals("bonjour", body.get("data").get(0).get("text").asText());
    }

    @Test
    void evaluate_shouldHitEvaluatePath() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true,\"modelId\":\"m1\",\"metrics\":{\"accuracy\":0.91}}"));

        EvaluateResponseDto resp = client.evaluate(EvaluateRequestDto.builder()
                .modelId("m1")
                .modelType("text-classification")
                .data(List.of())
                .build());

        assertEquals(0.91, resp.getMetrics().get("accuracy"));
        assertEquals("/evaluate", server.takeRequest().getPath());
    }

    @Test
    void httpError_shouldBecomeIllegalState_withShrunkBody() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("  model   server\n overloaded "));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> client.train(TrainRequestDto.builder().modelType("text-classification").build()));

        assertEquals("ML sidecar HTTP 503: model server overloaded", e.getMessage());
    }

    @Test
    void emptyBody_shouldBeRejected() {
        server.enqueue(new MockResponse().setBody(""));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> client.evaluate(EvaluateRequestDto.builder().modelId("m1").build()));

        assertTrue(e.getMessage().contains("/evaluate"));
    }

    @Test
    void blankApiKey_shouldNotSendHeader() throws Exception {
        props.setApiKey("  ");
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\"}"));

        JsonNode health = client.health();

        assertEquals("ok", health.get("status").asText());
        RecordedRequest rec = server.takeRequest();
        assertEquals("GET", rec.getMethod());
        assertEquals("/health", rec.getPath());
        assertNull(rec.getHeader("X-API-KEY"));
    }

    @Test
    void unreachableSidecar_shouldFailWithIoError() {
        MlSidecarProperties dead = new MlSidecarProperties();
        dead.setBaseUrl("http://127.0.0.1:1");
        MlSidecarClient offline = new MlSidecarClient(new OkHttpClient(), mapper, dead);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> offline.train(TrainRequestDto.builder().modelType("text-classification").build()));

        assertTrue(e.getMessage().startsWith("ML sidecar IO error"), e.getMessage());
    }

    @Test
    void shrink_shouldCollapseWhitespaceAndTruncate() {
        assertEquals("null", MlSidecarClient.shrink(null));
        assertEquals("a b c", MlSidecarClient.shrink(" a \n b\t c "));

        String longBody = "x".repeat(500);
        String shrunk = MlSidecarClient.shrink(longBody);
        assertEquals(403, shrunk.length());
        assertTrue(shrunk.endsWith("..."));
    }
}
