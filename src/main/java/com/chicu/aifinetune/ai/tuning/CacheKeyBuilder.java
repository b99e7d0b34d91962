package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.domain.FineTuningRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Отпечаток заявки для кэша результатов.
 * <p>
 * Пример:
 * finetuning_{"modelType":"text-classification","purpose":"quiz","targetDomain":"lsf","learnerLevel":"any","dataHash":"120_100_93127164"}
 * <p>
 * Сериализация канонична: ключи map внутри записей сортируются, поэтому порядок полей
 * у вызывающего не влияет на ключ.
 */
@Component
public class CacheKeyBuilder {

    static final String PREFIX = "finetuning_";

    private static final int SAMPLE_SIZE = 5;
    private static final int SAMPLE_CHARS = 100;

    private final ObjectMapper canonical = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String build(FineTuningRequest request) {
        if (request == null) throw new IllegalArgumentException("request=null");

        String level = request.learnerProfile() != null
                && request.learnerProfile().skillLevel() != null
                && !request.learnerProfile().skillLevel().isBlank()
                ? request.learnerProfile().skillLevel()
                : "any";

        // порядок полей фиксирован LinkedHashMap'ом, не зависит от рантайма
        Map<String, Object> keyParams = new LinkedHashMap<>();
        keyParams.put("modelType", request.modelType());
        keyParams.put("purpose", request.purpose());
        keyParams.put("targetDomain", request.targetDomain());
        keyParams.put("learnerLevel", level);
        keyParams.put("dataHash", dataFingerprint(request.trainingData()));

        return PREFIX + writeKeyParams(keyParams);
    }

    /**
     * {totalCount}_{truncatedLength}_{hash} по ≤5 равномерно взятым записям.
     */
    public String dataFingerprint(List<Map<String, Object>> data) {
        if (data == null || data.isEmpty()) {
            return "empty";
        }

        int n = data.size();
        int sampleSize = Math.min(SAMPLE_SIZE, n);
        List<Map<String, Object>> samples = new ArrayList<>(sampleSize);

        for (int i = 0; i < sampleSize; i++) {
            int index = (int) Math.floor(i * ((double) n / sampleSize));
            samples.add(data.get(index));
        }

        String sampleString = serialize(samples).replaceAll("\\s+", "");
        if (sampleString.length() > SAMPLE_CHARS) {
            sampleString = sampleString.substring(0, SAMPLE_CHARS);
        }

        return n + "_" + sampleString.length() + "_" + simpleHash(sampleString);
    }

    /**
     * hash = hash*31 + char в 32 битах, по модулю.
     * Integer.MIN_VALUE по модулю не помещается в int, поэтому long.
     */
    static long simpleHash(String s) {
        int hash = 0;
        for (int i = 0; i < s.length(); i++) {
            hash = 31 * hash + s.charAt(i);
        }
        return Math.abs((long) hash);
    }

    private String writeKeyParams(Map<String, Object> keyParams) {
        try {
            // keyParams собраны в нужном порядке: сортировка тут не нужна
            return canonical.writer()
                    .without(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(keyParams);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cache key serialization failed: " + e.getMessage(), e);
        }
    }

    private String serialize(Object value) {
        try {
            return canonical.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("training sample serialization failed: " + e.getMessage(), e);
        }
    }
}
