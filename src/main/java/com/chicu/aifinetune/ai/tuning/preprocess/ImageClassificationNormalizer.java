package com.chicu.aifinetune.ai.tuning.preprocess;

import com.chicu.aifinetune.common.enums.ModelCategory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Component
public class ImageClassificationNormalizer implements RecordNormalizer {

    @Override
    public ModelCategory getCategory() {
        return ModelCategory.IMAGE_CLASSIFICATION;
    }

    @Override
    public Optional<Map<String, Object>> normalize(Map<String, Object> record) {
        Object image = record.get("image");
        if (!RecordFields.isPresent(image) || !RecordFields.isDefined(record, "label")) {
            return Optional.empty();
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("image", image);
        out.put("label", RecordFields.labelOf(record));
        out.put("metadata", RecordFields.metadataOf(record));
        return Optional.of(out);
    }
}
