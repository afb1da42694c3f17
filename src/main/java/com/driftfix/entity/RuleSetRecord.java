package com.driftfix.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(
    name = "ruleset_records",
    indexes = {
        @Index(name = "idx_ruleset_updated", columnList = "updated_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleSetRecord {

    @Id
    @Column(name = "model_id", length = 128, updatable = false, nullable = false)
    private String modelId;

    @Column(name = "active_version", nullable = false)
    private long activeVersion;

    @Column(name = "can_roll_back", nullable = false)
    private boolean canRollBack;

    @Column(name = "history_json", nullable = false, columnDefinition = "TEXT")
    private String historyJson;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "row_version")
    private Long rowVersion;
}
