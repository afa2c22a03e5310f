package com.platform.inventory.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * JPA entity for registered providers.
 */
@Entity
@Table(name = "providers", indexes = {
    @Index(name = "idx_provider_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false, unique = true, length = 100)
    private String name;
    
    /**
     * Client kind used to talk to this provider (e.g. "rest").
     */
    @Column(nullable = false, length = 30)
    @Builder.Default
    private String type = "rest";
    
    @Column(nullable = false)
    private String endpoint;
    
    @ToString.Exclude
    @Column(name = "api_token", length = 512)
    private String apiToken;
    
    @Column(nullable = false, length = 20)
    @Builder.Default
    private String status = "active";
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }
    
    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
