package com.aigreentick.services.setupwizard.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Singleton progress record of the setup wizard.
 *
 * The primary key is always {@code PROGRESS_RECORD_ID}; a second row can
 * never be inserted, a concurrent first insert fails on the key instead.
 *
 * stepData holds a JSON object keyed by step id. Entries are only ever
 * replaced one key at a time and are removed only by a full reset.
 */
@Entity
@Table(name = "setup_wizard_progress")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WizardProgress {

    @Id
    private Long id;

    /** Id of the most recently saved step. Informational only, never used for gating. */
    @Column(name = "step_completed", length = 50)
    private String stepCompleted;

    @Column(name = "step_data", columnDefinition = "TEXT")
    private String stepData;

    @Column(name = "wizard_completed", nullable = false)
    @Builder.Default
    private boolean wizardCompleted = false;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
