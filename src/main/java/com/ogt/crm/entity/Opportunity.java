package com.ogt.crm.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "opportunities")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Opportunity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "organization_id")
    private Organization organization;

    @Column(nullable = false)
    private String name;

    @Builder.Default
    @Column(nullable = false, length = 20)
    private String stage = "LEAD"; // LEAD, QUALIFIED, PROPOSAL, NEGOTIATION, CLOSED

    @Builder.Default
    @Column(nullable = false, length = 20)
    private String status = "OPEN"; // OPEN, CLOSED_WON, CLOSED_LOST

    @Column(name = "estimated_value", precision = 15, scale = 2)
    private BigDecimal value;

    @Column(precision = 5, scale = 2)
    private BigDecimal probability; // 0 - 100

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "expected_close_date")
    private LocalDate expectedCloseDate;

    private String principal;

    private String product;

    private String owner;

    @CreationTimestamp
    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
