package com.chicu.aifinetune.ai.persistence;

import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ModelRecordRepository extends JpaRepository<ModelRecordEntity, Long> {

    Optional<ModelRecordEntity> findByModelId(String modelId);

    List<ModelRecordEntity> findByBaseModelTypeAndPurposeAndStatusInOrderByLastUsedDesc(
            ModelCategory baseModelType,
            String purpose,
            Collection<ModelStatus> statuses
    );

    List<ModelRecordEntity> findAllByOrderByCreatedAtDesc();

    long deleteByModelId(String modelId);
}
