package com.aigreentick.services.setupwizard.entity;

import com.aigreentick.services.setupwizard.constants.PersonRole;
import com.aigreentick.services.setupwizard.constants.RecordOrigin;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A person known to the platform. The wizard creates administrators and,
 * when sample data is requested, students, parents and staff.
 */
@Entity
@Table(name = "people",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_person_username", columnNames = "username")
        },
        indexes = {
                @Index(name = "idx_person_role", columnList = "role"),
                @Index(name = "idx_person_origin", columnList = "origin"),
                @Index(name = "idx_person_email", columnList = "email")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Person {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "surname", nullable = false, length = 100)
    private String surname;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "username", nullable = false, length = 50)
    private String username;

    @Column(name = "password_hash", length = 100)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private PersonRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "origin", nullable = false, length = 20)
    private RecordOrigin origin;

    @Column(name = "job_title", length = 100)
    private String jobTitle;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(name = "care_group_id")
    private Long careGroupId;

    @Column(name = "can_login", nullable = false)
    @Builder.Default
    private boolean canLogin = false;

    @Column(name = "created_at", updatable = false)
    @CreationTimestamp
    private LocalDateTime createdAt;
}
