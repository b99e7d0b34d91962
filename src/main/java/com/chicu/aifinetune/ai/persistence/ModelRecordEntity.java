package com.chicu.aifinetune.ai.persistence;

import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
        name = "ft_model_record",
        uniqueConstraints = @UniqueConstraint(name = "uq_ft_model_record_model_id", columnNames = "model_id"),
        indexes = {
                @Index(name = "idx_ft_model_record_lookup", columnList = "base_model_type, purpose, status")
        }
)
public class ModelRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_id", nullable = false, length = 191)
    private String modelId;

    @Enumerated(EnumType.STRING)
    @Column(name = "base_model_type", nullable = false, length = 64)
    private ModelCategory baseModelType;

    @Column(name = "purpose", length = 191)
    private String purpose;

    @Column(name = "target_domain", length = 191)
    private String targetDomain;

    @Column(name = "learner_skill_level", length = 64)
    private String learnerSkillLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ModelStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation_mode", length = 16)
    private ExecutionMode operationMode;

    @Column(name = "model_size", nullable = false)
    private long modelSize;

    @Column(name = "training_dataset_size", nullable = false)
    private int trainingDatasetSize;

    @Column(name = "optimized", nullable = false)
    private boolean optimized;

    @Column(name = "usage_count", nullable = false)
    private long usageCount;

    /**
     * JSON: метрики оценки {"accuracy":0.91,...}
     */
    @Lob
    @Column(name = "metrics_json")
    private String metricsJson;

    /**
     * JSON-массив тегов.
     */
    @Lob
    @Column(name = "tags_json")
    private String tagsJson;

    /**
     * JSON: профиль ученика, под которого учили.
     */
    @Lob
    @Column(name = "learner_profile_json")
    private String learnerProfileJson;

    /**
     * JSON: детали последней смены статуса (deploymentEnvironment, deploymentTimestamp, deploymentConfig).
     */
    @Lob
    @Column(name = "deployment_json")
    private String deploymentJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "last_used")
    private Instant lastUsed;
}
