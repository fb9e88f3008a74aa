package com.aigreentick.services.setupwizard.repository;

import com.aigreentick.services.setupwizard.entity.Setting;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SettingRepository extends JpaRepository<Setting, Long> {

    Optional<Setting> findByScopeAndName(String scope, String name);

    boolean existsByScopeAndName(String scope, String name);

    @Modifying
    @Query("DELETE FROM Setting s WHERE s.scope = :scope AND s.name = :name")
    int deleteByScopeAndName(@Param("scope") String scope, @Param("name") String name);
}
