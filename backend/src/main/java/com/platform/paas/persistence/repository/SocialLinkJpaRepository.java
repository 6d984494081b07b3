package com.platform.paas.persistence.repository;

import com.platform.paas.persistence.entity.SocialLinkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Spring Data JPA repository for social-auth links.
 */
@Repository
public interface SocialLinkJpaRepository extends JpaRepository<SocialLinkEntity, Long> {
    
    /**
     * Delete links not used since the cutoff.
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM SocialLinkEntity s WHERE s.lastUsedAt < :cutoff")
    int deleteUnusedSince(@Param("cutoff") Instant cutoff);
    
    long countByLastUsedAtBefore(Instant cutoff);
}
