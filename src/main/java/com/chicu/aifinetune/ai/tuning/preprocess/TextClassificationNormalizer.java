package com.chicu.aifinetune.ai.tuning.preprocess;

import com.chicu.aifinetune.common.enums.ModelCategory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * text + label. label приводится к строке.
 */
@Component
public class TextClassificationNormalizer implements RecordNormalizer {

    @Override
    public ModelCategory getCategory() {
        return ModelCategory.TEXT_CLASSIFICATION;
    }

    @Override
    public Optional<Map<String, Object>> normalize(Map<String, Object> record) {
        Object text = record.get("text");
        if (!RecordFields.isNonEmptyString(text) || !RecordFields.isDefined(record, "label")) {
            return Optional.empty();
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("text", ((String) text).trim());
        out.put("label", RecordFields.labelOf(record));
        return Optional.of(out);
    }
}
