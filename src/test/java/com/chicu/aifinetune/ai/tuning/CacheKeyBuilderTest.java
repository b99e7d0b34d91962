package com.chicu.aifinetune.ai.tuning;

import com.chicu.aifinetune.domain.FineTuningRequest;
import com.chicu.aifinetune.domain.LearnerProfile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyBuilderTest {

    private final CacheKeyBuilder builder = new CacheKeyBuilder();

    private static List<Map<String, Object>> records(int n) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Map.of("t", "r" + i));
        }
        return out;
    }

    private static FineTuningRequest request(List<Map<String, Object>> data, String level) {
        return FineTuningRequest.builder()
                .modelType("text-classification")
                .purpose("quiz")
                .targetDomain("lsf")
                .learnerProfile(level == null ? null : LearnerProfile.builder().skillLevel(level).build())
                .trainingData(data)
                .build();
    }

    @Test
    void sameSemanticRequest_shouldGiveSameKey() {
        String a = builder.build(request(records(10), "beginner"));
        String b = builder.build(request(records(10), "beginner"));

        assertEquals(a, b, "одинаковые заявки → одинаковый ключ");
        assertTrue(a.startsWith("finetuning_{\"modelType\":\"text-classification\""), "префикс и порядок полей фиксированы");
        assertTrue(a.contains("\"learnerLevel\":\"beginner\""));
    }

    @Test
    void fieldOrderInsideRecords_shouldNotChangeKey() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("text", "bonjour");
        ab.put("label", "greeting");

        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("label", "greeting");
        ba.put("text", "bonjour");

        assertEquals(
                builder.build(request(List.of(ab), null)),
                builder.build(request(List.of(ba), null)),
                "порядок ключей в записи не должен влиять на отпечаток"
        );
    }

    @Test
    void missingProfile_shouldUseAnyLevel_andEmptyData_shouldHashToEmpty() {
        String key = builder.build(request(List.of(), null));

        assertTrue(key.contains("\"learnerLevel\":\"any\""));
        assertTrue(key.endsWith("\"dataHash\":\"empty\"}"));
    }

    @Test
    void emptyOrBlankSkillLevel_shouldCollapseToAny() {
        String any = builder.build(request(records(3), "any"));

        assertEquals(any, builder.build(request(records(3), "")), "пустой уровень = any");
        assertEquals(any, builder.build(request(records(3), "   ")), "уровень из пробелов = any");
        assertEquals(any, builder.build(request(records(3), null)));
    }

    @Test
    void differentLevel_shouldGiveDifferentKey() {
        assertNotEquals(
                builder.build(request(records(3), "beginner")),
                builder.build(request(records(3), "advanced"))
        );
    }

    @Test
    void fingerprint_shouldSampleEvenlySpacedRecords() {
        // n=10, выборка 5 → индексы 0,2,4,6,8
        List<Map<String, Object>> base = records(10);

        List<Map<String, Object>> oddChanged = new ArrayList<>(base);
        oddChanged.set(1, Map.of("t", "changed"));

        List<Map<String, Object>> evenChanged = new ArrayList<>(base);
        evenChanged.set(2, Map.of("t", "changed"));

        String fp = builder.dataFingerprint(base);

        assertTrue(fp.startsWith("10_"), "первым идёт общее число записей");
        assertEquals(fp, builder.dataFingerprint(oddChanged), "запись 1 не попадает в выборку");
        assertNotEquals(fp, builder.dataFingerprint(evenChanged), "запись 2 попадает в выборку");
    }

    @Test
    void fingerprint_shouldTruncateSampleTo100Chars() {
        List<Map<String, Object>> data = List.of(Map.of("text", "x".repeat(500)));

        String fp = builder.dataFingerprint(data);
        String[] parts = fp.split("_");

        assertEquals("1", parts[0]);
        assertEquals("100", parts[1]);
    }

    @Test
    void simpleHash_shouldMatchRollingHash() {
        assertEquals(0L, CacheKeyBuilder.simpleHash(""));
        assertEquals(97L, CacheKeyBuilder.simpleHash("a"));
        assertEquals(97L * 31 + 98, CacheKeyBuilder.simpleHash("ab"));
        assertEquals(Math.abs((long) "hello world".hashCode()), CacheKeyBuilder.simpleHash("hello world"));
        assertTrue(CacheKeyBuilder.simpleHash("x".repeat(100)) >= 0, "по модулю: всегда неотрицательный");
    }
}
