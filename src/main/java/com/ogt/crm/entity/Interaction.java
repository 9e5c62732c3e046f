package com.ogt.crm.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "interactions")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Interaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "interaction_date", nullable = false)
    private LocalDate date;

    @Builder.Default
    @Column(nullable = false, length = 20)
    private String type = "OTHER"; // CALL, EMAIL, MEETING, OTHER

    // Vínculos opcionales: quedan en null si no se resuelven
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "organization_id")
    private Organization organization;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contact_id")
    private Contact contact;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "opportunity_id")
    private Opportunity opportunity;

    @Column(name = "account_manager")
    private String accountManager;

    private String principal;

    @Column(length = 4000)
    private String notes;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
