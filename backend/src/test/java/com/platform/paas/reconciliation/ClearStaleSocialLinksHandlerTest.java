package com.platform.paas.reconciliation;

import com.platform.paas.persistence.repository.SocialLinkJpaRepository;
import com.platform.paas.queue.ReconciliationTask;
import com.platform.paas.queue.TaskKind;
import com.platform.paas.queue.TaskScope;
import com.platform.paas.schedule.ScheduleGenerations;
import com.platform.paas.support.MutableClock;
import com.platform.paas.support.TestConfigurations;
import com.platform.paas.worker.HandlerTransientException;
import com.platform.paas.worker.TaskContext;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClearStaleSocialLinksHandlerTest {

    private final SocialLinkJpaRepository socialLinks = mock(SocialLinkJpaRepository.class);
    private final ClearStaleSocialLinksHandler handler =
        new ClearStaleSocialLinksHandler(socialLinks, new MutableClock(TestConfigurations.EPOCH), 30);

    @Test
    void shouldDeleteLinksOlderThanRetention() {
        when(socialLinks.deleteUnusedSince(any())).thenReturn(4);

        run();

        verify(socialLinks).deleteUnusedSince(Instant.parse("2024-01-31T10:15:30Z"));
    }

    @Test
    void shouldRetryWhenStoreTimesOut() {
        when(socialLinks.deleteUnusedSince(any())).thenThrow(new QueryTimeoutException("slow"));

        assertThrows(HandlerTransientException.class, this::run);
    }

    private void run() {
        ReconciliationTask task = ReconciliationTask.of(TaskKind.CLEAR_STALE_SOCIAL_LINKS, TaskScope.all());
        handler.handle(task, new TaskContext(task, new ScheduleGenerations()));
    }
}
