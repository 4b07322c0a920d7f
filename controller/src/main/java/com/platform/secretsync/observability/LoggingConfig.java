package com.platform.secretsync.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration and MDC helpers for per-target log context.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_SYNC_TARGET = "syncTarget";
    public static final String MDC_PHASE = "phase";
    public static final String MDC_PROVIDER = "provider";
    public static final String MDC_REVISION = "revision";

    @Value("${spring.application.name:secret-sync-controller}")
    private String applicationName;

    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);

        log.info("Logging configuration initialized for application: {}", applicationName);
    }

    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    /**
     * Adds a trace id to every API request.
     */
    public static class CorrelationIdFilter extends OncePerRequestFilter {

        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_TRACE_ID = "traceId";

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {

            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString().substring(0, 8);
                }
                MDC.put(MDC_TRACE_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);

                filterChain.doFilter(request, response);
            } finally {
                MDC.remove(MDC_TRACE_ID);
            }
        }
    }

    public static void setTargetContext(String target, String provider) {
        MDC.put(MDC_SYNC_TARGET, target);
        if (provider != null) {
            MDC.put(MDC_PROVIDER, provider);
        }
    }

    public static void setPhase(String phase) {
        MDC.put(MDC_PHASE, phase);
    }

    public static void setRevision(String revision) {
        if (revision != null) {
            MDC.put(MDC_REVISION, revision);
        }
    }

    public static void clearTargetContext() {
        MDC.remove(MDC_SYNC_TARGET);
        MDC.remove(MDC_PROVIDER);
        MDC.remove(MDC_PHASE);
        MDC.remove(MDC_REVISION);
    }
}
