package com.aigreentick.services.setupwizard.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(name = "closure_dates",
        indexes = @Index(name = "idx_closure_date", columnList = "closure_date"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClosureDate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "closure_date", nullable = false)
    private LocalDate date;

    @Column(name = "reason", nullable = false, length = 255)
    private String reason;
}
