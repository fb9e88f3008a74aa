package com.aigreentick.services.setupwizard.repository;

import com.aigreentick.services.setupwizard.entity.ClosureDate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ClosureDateRepository extends JpaRepository<ClosureDate, Long> {

    List<ClosureDate> findAllByOrderByDateAsc();
}
