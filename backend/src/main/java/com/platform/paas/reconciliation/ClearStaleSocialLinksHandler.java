package com.platform.paas.reconciliation;

import com.platform.paas.persistence.repository.SocialLinkJpaRepository;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.worker.TaskContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Removes social-auth links unused for longer than the retention window.
 */
@Slf4j
@Component
public class ClearStaleSocialLinksHandler extends AbstractTaskHandler {
    
    private final SocialLinkJpaRepository socialLinks;
    private final Clock clock;
    private final int retentionDays;
    
    public ClearStaleSocialLinksHandler(
            SocialLinkJpaRepository socialLinks,
            Clock clock,
            @Value("${controlplane.social.retention-days:30}") int retentionDays) {
        this.socialLinks = socialLinks;
        this.clock = clock;
        this.retentionDays = retentionDays;
    }
    
    @Override
    public TaskKind kind() {
        return TaskKind.CLEAR_STALE_SOCIAL_LINKS;
    }
    
    @Override
    public void handle(ReconciliationTask task, TaskContext context) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
        context.checkpoint();
        int deleted = store(() -> socialLinks.deleteUnusedSince(cutoff));
        log.info("Cleared {} social link(s) unused since {}", deleted, cutoff);
    }
}
