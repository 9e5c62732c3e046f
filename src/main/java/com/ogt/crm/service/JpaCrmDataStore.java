package com.ogt.crm.service;

import com.ogt.crm.entity.Contact;
import com.ogt.crm.entity.Interaction;
import com.ogt.crm.entity.Opportunity;
import com.ogt.crm.entity.Organization;
import com.ogt.crm.exception.DataStoreUnavailableException;
import com.ogt.crm.exception.RowValidationException;
import com.ogt.crm.model.EntityRecord;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.model.WriteOutcome;
import com.ogt.crm.repository.ContactRepository;
import com.ogt.crm.repository.InteractionRepository;
import com.ogt.crm.repository.OpportunityRepository;
import com.ogt.crm.repository.OrganizationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link CrmDataStore} sobre Spring Data JPA. Cada alta corre en su propia transacción.
 */
@Service
@Slf4j
public class JpaCrmDataStore implements CrmDataStore {

    private final OrganizationRepository organizationRepository;
    private final ContactRepository contactRepository;
    private final OpportunityRepository opportunityRepository;
    private final InteractionRepository interactionRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaCrmDataStore(OrganizationRepository organizationRepository,
                           ContactRepository contactRepository,
                           OpportunityRepository opportunityRepository,
                           InteractionRepository interactionRepository,
                           PlatformTransactionManager transactionManager) {
        this.organizationRepository = organizationRepository;
        this.contactRepository = contactRepository;
        this.opportunityRepository = opportunityRepository;
        this.interactionRepository = interactionRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public WriteOutcome create(TargetEntity entity, EntityRecord record) {
        return guarded("create " + entity.getStatsKey(), () -> transactionTemplate.execute(status -> {
            switch (entity) {
                case ORGANIZATIONS:
                    return createOrganization(record);
                case CONTACTS:
                    return createContact(record);
                case OPPORTUNITIES:
                    return createOpportunity(record);
                case INTERACTIONS:
                    return createInteraction(record);
                default:
                    throw new IllegalArgumentException("Unsupported entity: " + entity);
            }
        }));
    }

    @Override
    public long count(TargetEntity entity) {
        return guarded("count " + entity.getStatsKey(), () -> {
            switch (entity) {
                case ORGANIZATIONS:
                    return organizationRepository.count();
                case CONTACTS:
                    return contactRepository.count();
                case OPPORTUNITIES:
                    return opportunityRepository.count();
                case INTERACTIONS:
                    return interactionRepository.count();
                default:
                    throw new IllegalArgumentException("Unsupported entity: " + entity);
            }
        });
    }

    // =================================================================================
    // 🏢 ALTAS POR ENTIDAD
    // =================================================================================

    private WriteOutcome createOrganization(EntityRecord record) {
        String name = record.getString("name");
        if (organizationRepository.existsByNameIgnoreCase(name)) {
            log.debug("Organización '{}' ya existe (fila {})", name, record.getSourceRow() + 1);
            return WriteOutcome.DUPLICATE;
        }

        Organization organization = Organization.builder()
                .name(name)
                .priority(record.has("priority") ? record.getString("priority") : "NONE")
                .segment(record.getString("segment"))
                .distributor(record.getString("distributor"))
                .accountManager(record.getString("accountManager"))
                .phone(record.getString("phone"))
                .email(record.getString("email"))
                .address(record.getString("address"))
                .city(record.getString("city"))
                .state(record.getString("state"))
                .zipCode(record.getString("zipCode"))
                .notes(record.getString("notes"))
                .build();

        organizationRepository.save(organization);
        return WriteOutcome.CREATED;
    }

    private WriteOutcome createContact(EntityRecord record) {
        Organization organization = requireOrganization(record);
        String firstName = record.getString("firstName");
        String lastName = record.getString("lastName");

        if (firstName != null && isDuplicateContact(organization, firstName, lastName)) {
            log.debug("Contacto '{} {}' ya existe en '{}'", firstName, lastName, organization.getName());
            return WriteOutcome.DUPLICATE;
        }

        Contact contact = Contact.builder()
                .organization(organization)
                .firstName(firstName)
                .lastName(lastName)
                .position(record.getString("position"))
                .email(record.getString("email"))
                .phone(record.getString("phone"))
                .accountManager(record.getString("accountManager"))
                .linkedIn(record.getString("linkedIn"))
                .build();

        contactRepository.save(contact);
        return WriteOutcome.CREATED;
    }

    private WriteOutcome createOpportunity(EntityRecord record) {
        Organization organization = requireOrganization(record);

        Opportunity opportunity = Opportunity.builder()
                .organization(organization)
                .name(record.getString("name"))
                .stage(record.has("stage") ? record.getString("stage") : "LEAD")
                .status(record.has("status") ? record.getString("status") : "OPEN")
                .value(record.getDecimal("value"))
                .probability(record.getDecimal("probability"))
                .startDate(record.getDate("startDate"))
                .expectedCloseDate(record.getDate("expectedCloseDate"))
                .principal(record.getString("principal"))
                .product(record.getString("product"))
                .owner(record.getString("owner"))
                .build();

        opportunityRepository.save(opportunity);
        return WriteOutcome.CREATED;
    }

    private WriteOutcome createInteraction(EntityRecord record) {
        Interaction interaction = Interaction.builder()
                .date(record.getDate("date"))
                .type(record.has("type") ? record.getString("type") : "OTHER")
                .organization(findOrganization(record.getString("organizationName")).orElse(null))
                .contact(findContact(record.getString("contactName")).orElse(null))
                .opportunity(findOpportunity(record.getString("opportunity")).orElse(null))
                .accountManager(record.getString("accountManager"))
                .principal(record.getString("principal"))
                .notes(record.getString("notes"))
                .build();

        interactionRepository.save(interaction);
        return WriteOutcome.CREATED;
    }

    // =================================================================================
    // 🔗 RESOLUCIÓN DE REFERENCIAS
    // =================================================================================

    private Organization requireOrganization(EntityRecord record) {
        String name = record.getString("organizationName");
        return findOrganization(name)
                .orElseThrow(() -> new RowValidationException("organizationName", "Organization not found: " + name));
    }

    private Optional<Organization> findOrganization(String name) {
        if (name == null) return Optional.empty();
        return organizationRepository.findFirstByNameIgnoreCase(name);
    }

    private boolean isDuplicateContact(Organization organization, String firstName, String lastName) {
        return lastName != null
                ? contactRepository.existsByOrganizationIdAndFirstNameIgnoreCaseAndLastNameIgnoreCase(
                        organization.getId(), firstName, lastName)
                : contactRepository.existsByOrganizationIdAndFirstNameIgnoreCaseAndLastNameIsNull(
                        organization.getId(), firstName);
    }

    private Optional<Contact> findContact(String fullName) {
        if (fullName == null) return Optional.empty();
        String[] parts = fullName.trim().split("[,\\s]+", 2);
        return parts.length > 1
                ? contactRepository.findFirstByFirstNameIgnoreCaseAndLastNameIgnoreCase(parts[0], parts[1].trim())
                : contactRepository.findFirstByFirstNameIgnoreCaseAndLastNameIsNull(parts[0]);
    }

    private Optional<Opportunity> findOpportunity(String name) {
        if (name == null) return Optional.empty();
        return opportunityRepository.findFirstByNameIgnoreCase(name);
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (CannotCreateTransactionException | DataAccessResourceFailureException
                 | TransientDataAccessResourceException | TransactionSystemException e) {
            log.error("❌ Base de datos no disponible ({}): {}", operation, e.getMessage());
            throw new DataStoreUnavailableException("Data store unavailable during " + operation, e);
        }
    }
}
