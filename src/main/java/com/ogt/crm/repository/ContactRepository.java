package com.ogt.crm.repository;

import com.ogt.crm.entity.Contact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ContactRepository extends JpaRepository<Contact, UUID> {

    boolean existsByOrganizationIdAndFirstNameIgnoreCaseAndLastNameIgnoreCase(UUID organizationId, String firstName, String lastName);

    boolean existsByOrganizationIdAndFirstNameIgnoreCaseAndLastNameIsNull(UUID organizationId, String firstName);

    Optional<Contact> findFirstByFirstNameIgnoreCaseAndLastNameIgnoreCase(String firstName, String lastName);

    Optional<Contact> findFirstByFirstNameIgnoreCaseAndLastNameIsNull(String firstName);
}
