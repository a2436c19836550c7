/**
 * Configuration for retrying source fetches
 *
 * @author William Callahan
 *
 * Features:
 * - Builds one RetryTemplate per source session, bound to the run's cancellation token
 * - Retries only transient source failures, up to the configured attempt ceiling
 * - Exponential back-off with optional jitter whose sleep wakes on cancellation
 */

package com.williamcallahan.steam_analytics.config;

import com.williamcallahan.steam_analytics.service.source.CancellationToken;
import com.williamcallahan.steam_analytics.service.source.PipelineCancelledException;
import com.williamcallahan.steam_analytics.service.source.TransientSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryContext;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.Map;

@Configuration
@EnableRetry
public class RetryConfig {

    private final IngestionProperties properties;

    public RetryConfig(IngestionProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the retry template a source session uses for one run.
     *
     * @param token run token; a cancelled token interrupts the back-off sleep
     * @return RetryTemplate retrying {@link TransientSourceException} only
     */
    public RetryTemplate sourceRetryTemplate(CancellationToken token) {
        return buildSourceRetryTemplate(properties.getRetry(), token);
    }

    public static RetryTemplate buildSourceRetryTemplate(IngestionProperties.Retry settings, CancellationToken token) {
        RetryTemplate retryTemplate = new RetryTemplate();

        Map<Class<? extends Throwable>, Boolean> retryableExceptions = Map.of(TransientSourceException.class, true);
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(Math.max(1, settings.getMaxAttempts()), retryableExceptions);
        retryTemplate.setRetryPolicy(retryPolicy);

        CancellableExponentialBackOffPolicy backOffPolicy = new CancellableExponentialBackOffPolicy(token);
        backOffPolicy.setInitialInterval(settings.getInitialBackoff().toMillis());
        backOffPolicy.setMultiplier(settings.getMultiplier());
        backOffPolicy.setMaxInterval(settings.getMaxBackoff().toMillis());
        backOffPolicy.setJitterFactor(settings.getJitterFactor());
        retryTemplate.setBackOffPolicy(backOffPolicy);

        return retryTemplate;
    }

    /**
     * Exponential back-off (interval doubles by default, capped) whose sleep goes through the run's
     * cancellation token instead of {@code Thread.sleep}
     */
    public static class CancellableExponentialBackOffPolicy implements BackOffPolicy {
        private static final Logger logger = LoggerFactory.getLogger(CancellableExponentialBackOffPolicy.class);
        private final CancellationToken token;
        private long initialInterval = 2000;
        private double multiplier = 2.0;
        private long maxInterval = 30000;
        private double jitterFactor = 0.0;

        public CancellableExponentialBackOffPolicy(CancellationToken token) {
            this.token = token;
        }

        public void setInitialInterval(long initialInterval) {
            this.initialInterval = initialInterval;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public void setMaxInterval(long maxInterval) {
            this.maxInterval = maxInterval;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        private static class BackOffContextImpl implements BackOffContext {
            long currentInterval;
        }

        @Override
        public BackOffContext start(RetryContext context) {
            BackOffContextImpl ctx = new BackOffContextImpl();
            ctx.currentInterval = this.initialInterval;
            return ctx;
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            BackOffContextImpl ctx = (BackOffContextImpl) backOffContext;
            long sleepTime = ctx.currentInterval;
            if (jitterFactor > 0) {
                long jitter = (long) (sleepTime * jitterFactor * (2 * Math.random() - 1));
                sleepTime = Math.max(1, sleepTime + jitter);
            }
            if (logger.isDebugEnabled()) {
                logger.debug("Backing off for {}ms", sleepTime);
            }
            try {
                token.sleep(Duration.ofMillis(sleepTime));
            } catch (PipelineCancelledException e) {
                throw new BackOffInterruptedException("Run cancelled while backing off", e);
            }
            long nextInterval = (long) (ctx.currentInterval * multiplier);
            ctx.currentInterval = Math.min(nextInterval, maxInterval);
        }
    }
}
