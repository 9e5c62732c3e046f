package com.ogt.crm.repository;

import com.ogt.crm.entity.Organization;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface OrganizationRepository extends JpaRepository<Organization, UUID> {
    Optional<Organization> findFirstByNameIgnoreCase(String name);
    boolean existsByNameIgnoreCase(String name);
}
