package com.chicu.aifinetune.ai.tuning.preprocess;

import com.chicu.aifinetune.common.enums.ModelCategory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * input → output, prompt_template необязателен.
 */
@Component
public class TextGenerationNormalizer implements RecordNormalizer {

    @Override
    public ModelCategory getCategory() {
        return ModelCategory.TEXT_GENERATION;
    }

    @Override
    public Optional<Map<String, Object>> normalize(Map<String, Object> record) {
        Object input = record.get("input");
        Object output = record.get("output");
        if (!RecordFields.isNonEmptyString(input) || !RecordFields.isNonEmptyString(output)) {
            return Optional.empty();
        }

        Object template = record.get("prompt_template");

        // LinkedHashMap: prompt_template может быть null
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("input", ((String) input).trim());
        out.put("output", ((String) output).trim());
        out.put("prompt_template", RecordFields.isPresent(template) ? template : null);
        return Optional.of(out);
    }
}
