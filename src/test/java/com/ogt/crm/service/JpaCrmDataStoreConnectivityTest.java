package com.ogt.crm.service;

import com.ogt.crm.entity.Organization;
import com.ogt.crm.exception.DataStoreUnavailableException;
import com.ogt.crm.model.EntityRecord;
import com.ogt.crm.model.TargetEntity;
import com.ogt.crm.repository.ContactRepository;
import com.ogt.crm.repository.InteractionRepository;
import com.ogt.crm.repository.OpportunityRepository;
import com.ogt.crm.repository.OrganizationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JpaCrmDataStoreConnectivityTest {

    private final OrganizationRepository organizationRepository = mock(OrganizationRepository.class);
    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);

    private JpaCrmDataStore store;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        store = new JpaCrmDataStore(organizationRepository, mock(ContactRepository.class),
                mock(OpportunityRepository.class), mock(InteractionRepository.class), transactionManager);
    }

    @Test
    void connectionLostAtCommitIsReportedAsUnavailableStore() {
        when(organizationRepository.save(any(Organization.class))).thenAnswer(inv -> inv.getArgument(0));
        doThrow(new TransactionSystemException("Could not commit JPA transaction"))
                .when(transactionManager).commit(any());

        EntityRecord record = new EntityRecord(TargetEntity.ORGANIZATIONS, 3, Map.of("name", "Acme Foods"));

        assertThatThrownBy(() -> store.create(TargetEntity.ORGANIZATIONS, record))
                .isInstanceOf(DataStoreUnavailableException.class)
                .hasCauseInstanceOf(TransactionSystemException.class);
    }

    @Test
    void transientDriverFailureIsReportedAsUnavailableStore() {
        when(organizationRepository.count()).thenThrow(new TransientDataAccessResourceException("Connection reset"));

        assertThatThrownBy(() -> store.count(TargetEntity.ORGANIZATIONS))
                .isInstanceOf(DataStoreUnavailableException.class)
                .hasCauseInstanceOf(TransientDataAccessResourceException.class);
    }
}
