package com.aigreentick.services.setupwizard.repository;

import com.aigreentick.services.setupwizard.entity.WizardProgress;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface WizardProgressRepository extends JpaRepository<WizardProgress, Long> {

    /**
     * Read the progress row for a merge. The row lock serializes concurrent
     * merges of different steps so neither overwrites the other's key.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM WizardProgress p WHERE p.id = :id")
    Optional<WizardProgress> findByIdForUpdate(@Param("id") Long id);
}
