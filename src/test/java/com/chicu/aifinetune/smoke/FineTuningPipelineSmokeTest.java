package com.chicu.aifinetune.smoke;

import com.chicu.aifinetune.ai.ml.ModelEvaluator;
import com.chicu.aifinetune.ai.ml.ModelTrainer;
import com.chicu.aifinetune.ai.ml.TrainedModel;
import com.chicu.aifinetune.ai.ml.TrainingMetrics;
import com.chicu.aifinetune.domain.EvaluationResult;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Полный проход через HTTP: обучение → реестр → кэш → удаление.
 * Sidecar подменён моками тренера и оценщика.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class FineTuningPipelineSmokeTest {

    @LocalServerPort
    int port;

    @MockBean
    private ModelTrainer trainer;

    @MockBean
    private ModelEvaluator evaluator;

    private final TestRestTemplate rest = new TestRestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + "/api/fine-tuning" + path;
    }

    @Test
    @SuppressWarnings("unchecked")
    void fineTune_register_cache_delete() {
        when(trainer.trainModel(any(), anyList(), any(), any(), anyList()))
                .thenReturn(new TrainedModel("m-smoke", 2048, new TrainingMetrics(3, 0.2, 0.21, 500)));
        when(evaluator.evaluateModel(eq("m-smoke"), anyList(), any()))
                .thenReturn(EvaluationResult.ok("m-smoke", Map.of("accuracy", 0.92)));

        Map<String, Object> request = Map.of(
                "modelType", "text-classification",
                "purpose", "smoke-quiz",
                "targetDomain", "smoke",
                "preferredMode", "cloud",
                "trainingData", List.of(
                        Map.of("text", "bonjour", "label", "greeting"),
                        Map.of("text", "merci", "label", "thanks")),
                "evaluationData", List.of(Map.of("text", "salut", "label", "greeting"))
        );

        // первый проход: обучение
        ResponseEntity<Map> first = rest.postForEntity(url(""), request, Map.class);
        assertEquals(200, first.getStatusCode().value(), String.valueOf(first.getBody()));
        assertEquals("m-smoke", first.getBody().get("modelId"));
        assertEquals(0.92, ((Map<String, Object>) first.getBody().get("metrics")).get("accuracy"));

        // модель в реестре
        ResponseEntity<Map> info = rest.getForEntity(url("/models/m-smoke"), Map.class);
        assertEquals(200, info.getStatusCode().value());
        assertEquals("registered", info.getBody().get("status"));

        // повтор той же заявки: из кэша, тренер второй раз не зовётся
        ResponseEntity<Map> second = rest.postForEntity(url(""), request, Map.class);
        assertEquals(200, second.getStatusCode().value());
        assertEquals("m-smoke", second.getBody().get("modelId"));
        verify(trainer, times(1)).trainModel(any(), anyList(), any(), any(), anyList());

        // удаление
        rest.delete(url("/models/m-smoke"));
        ResponseEntity<Map> gone = rest.getForEntity(url("/models/m-smoke"), Map.class);
        assertEquals(404, gone.getStatusCode().value());
    }

    @Test
    void unsupportedModelType_shouldReturn422() {
        Map<String, Object> request = Map.of(
                "modelType", "speech-to-text",
                "purpose", "smoke",
                "trainingData", List.of(Map.of("audio", "a.wav"))
        );

        ResponseEntity<Map> resp = rest.postForEntity(url(""), request, Map.class);

        assertEquals(422, resp.getStatusCode().value());
        assertEquals(false, resp.getBody().get("success"));
        verifyNoInteractions(trainer);
    }
}
