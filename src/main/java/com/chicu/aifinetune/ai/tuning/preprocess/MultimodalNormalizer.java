package com.chicu.aifinetune.ai.tuning.preprocess;

import com.chicu.aifinetune.common.enums.ModelCategory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Текст и/или картинка + label. Отсутствующая модальность → null.
 */
@Component
public class MultimodalNormalizer implements RecordNormalizer {

    @Override
    public ModelCategory getCategory() {
        return ModelCategory.MULTIMODAL;
    }

    @Override
    public Optional<Map<String, Object>> normalize(Map<String, Object> record) {
        Object text = record.get("text");
        Object image = record.get("image");

        boolean hasText = text instanceof String;
        boolean hasImage = RecordFields.isPresent(image);

        if (!(hasText || hasImage) || !RecordFields.isDefined(record, "label")) {
            return Optional.empty();
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("text", hasText ? ((String) text).trim() : null);
        out.put("image", hasImage ? image : null);
        out.put("label", RecordFields.labelOf(record));
        out.put("metadata", RecordFields.metadataOf(record));
        return Optional.of(out);
    }
}
