package com.ogt.crm.repository;

import com.ogt.crm.entity.Opportunity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface OpportunityRepository extends JpaRepository<Opportunity, UUID> {
    Optional<Opportunity> findFirstByNameIgnoreCase(String name);
}
