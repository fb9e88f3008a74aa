package com.aigreentick.services.setupwizard.repository;

import com.aigreentick.services.setupwizard.entity.Organization;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OrganizationRepository extends JpaRepository<Organization, Long> {

    Optional<Organization> findFirstByOrderByIdAsc();
}
