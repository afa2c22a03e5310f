package com.platform.inventory.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for port forwarding rules. Owned by exactly one instance
 * and deleted together with it.
 */
@Entity
@Table(name = "port_mappings", indexes = {
    @Index(name = "idx_port_mapping_instance", columnList = "instance_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortMappingEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "instance_id", nullable = false)
    private Long instanceId;
    
    @Column(name = "host_port", nullable = false)
    private int hostPort;
    
    @Column(name = "guest_port", nullable = false)
    private int guestPort;
    
    @Column(nullable = false, length = 10)
    @Builder.Default
    private String protocol = "tcp";
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
