package com.platform.paas.observability;

import ch.qos.logback.classic.LoggerContext;
import com.platform.paas.queue.ReconciliationTask;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.context.annotation.Bean;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for requests and task context for workers.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_TASK_ID = "taskId";
    public static final String MDC_TASK_KIND = "taskKind";
    public static final String MDC_BAND = "band";
    
    @Value("${spring.application.name:paas-controller}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);
        
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            String correlationId = request.getHeader(CORRELATION_ID_HEADER);
            if (correlationId == null || correlationId.isBlank()) {
                correlationId = UUID.randomUUID().toString();
            }
            MDC.put(MDC_CORRELATION_ID, correlationId);
            response.setHeader(CORRELATION_ID_HEADER, correlationId);
            try {
                filterChain.doFilter(request, response);
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Set task information in MDC for the executing thread.
     */
    public static void setTaskContext(ReconciliationTask task) {
        MDC.put(MDC_TASK_ID, task.id());
        MDC.put(MDC_TASK_KIND, task.kind().wireName());
        MDC.put(MDC_BAND, task.band().tag());
    }
    
    /**
     * Clear task context from MDC.
     */
    public static void clearTaskContext() {
        MDC.remove(MDC_TASK_ID);
        MDC.remove(MDC_TASK_KIND);
        MDC.remove(MDC_BAND);
    }
}
