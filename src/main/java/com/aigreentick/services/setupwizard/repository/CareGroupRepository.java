package com.aigreentick.services.setupwizard.repository;

import com.aigreentick.services.setupwizard.entity.CareGroup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CareGroupRepository extends JpaRepository<CareGroup, Long> {

    List<CareGroup> findAllByOrderByIdAsc();

    List<CareGroup> findByActiveTrueOrderByMinAgeAsc();
}
