package com.aigreentick.services.setupwizard.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Scoped key/value setting. Used for simple Y/N flags as well as
 * JSON-serialized payloads owned by individual wizard steps.
 */
@Entity
@Table(name = "settings",
        uniqueConstraints = @UniqueConstraint(name = "uq_setting_scope_name",
                columnNames = {"scope", "name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Setting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scope", nullable = false, length = 50)
    private String scope;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "name_display", length = 150)
    private String nameDisplay;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "setting_value", columnDefinition = "TEXT")
    private String value;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
