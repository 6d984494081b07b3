package com.platform.paas.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for a user's link to an external identity provider.
 */
@Entity
@Table(name = "social_links", indexes = {
    @Index(name = "idx_social_links_last_used", columnList = "last_used_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SocialLinkEntity {
    
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    
    @Column(name = "user_id", length = 63, nullable = false)
    private String userId;
    
    @Column(length = 32, nullable = false)
    private String provider;
    
    @Column(length = 255, nullable = false)
    private String uid;
    
    @Column(name = "last_used_at", nullable = false)
    private Instant lastUsedAt;
}
