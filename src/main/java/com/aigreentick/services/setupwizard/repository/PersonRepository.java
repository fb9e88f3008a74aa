package com.aigreentick.services.setupwizard.repository;

import com.aigreentick.services.setupwizard.constants.PersonRole;
import com.aigreentick.services.setupwizard.constants.RecordOrigin;
import com.aigreentick.services.setupwizard.entity.Person;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PersonRepository extends JpaRepository<Person, Long> {

    boolean existsByRole(PersonRole role);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByUsernameIgnoreCase(String username);

    Optional<Person> findFirstByRoleAndOriginOrderByIdAsc(PersonRole role, RecordOrigin origin);

    long countByRoleAndOrigin(PersonRole role, RecordOrigin origin);

    @Modifying
    @Query("DELETE FROM Person p WHERE p.role = :role AND p.origin = :origin")
    int deleteByRoleAndOrigin(@Param("role") PersonRole role, @Param("origin") RecordOrigin origin);

    @Modifying
    @Query("UPDATE Person p SET p.careGroupId = NULL WHERE p.careGroupId IS NOT NULL")
    int clearCareGroupAssignments();

    @Modifying
    @Query("DELETE FROM Person p WHERE p.origin = :origin")
    int deleteByOrigin(@Param("origin") RecordOrigin origin);
}
