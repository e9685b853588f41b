package com.firehose.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row that exhausted its retry budget.
 * 
 * Written once and never replayed automatically; the payload keeps the row
 * exactly as it was sent to the destination table.
 */
@Entity
@Table(name = "bluesky_dead_letters", indexes = {
    @Index(name = "idx_dead_letters_destination_created", columnList = "destination,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(nullable = false, length = 100)
    private String destination;
    
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;
    
    @Column(columnDefinition = "TEXT")
    private String errorMessage;
    
    @Column(length = 30)
    private String failureKind;
    
    @Column
    private Integer attempts;
    
    @Column(nullable = false)
    private Instant createdAt;
    
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
