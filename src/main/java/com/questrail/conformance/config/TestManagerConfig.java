package com.questrail.conformance.config;

import java.time.Duration;
import java.util.Objects;

/**
 * TestManagerConfig
 * -----------------------------------------------------------------------------
 * Settings of one test manager instance.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>eventQueueCapacity</b>: Maximum number of unconsumed event
 *       observations. Further events are dropped and published as
 *       {@code DROPPED} observability events.</li>
 *   <li><b>returnQueueCapacity</b>: Same bound for method-return observations.</li>
 *   <li><b>throwTestFailureException</b>: When set, failed assertions made
 *       outside a transaction and unmet expectations raise
 *       {@code TestFailureException} instead of being forwarded to the
 *       reporting sink.</li>
 *   <li><b>defaultExpectationTimeout</b>: Timeout used by the
 *       {@code expectEvent} / {@code expectReturn} overloads that take none.</li>
 * </ul>
 */
public record TestManagerConfig(
        int eventQueueCapacity,
        int returnQueueCapacity,
        boolean throwTestFailureException,
        Duration defaultExpectationTimeout
) {
    public TestManagerConfig {
        Objects.requireNonNull(defaultExpectationTimeout, "defaultExpectationTimeout");

        if (eventQueueCapacity < 1) {
            throw new IllegalArgumentException("eventQueueCapacity must be >= 1");
        }
        if (returnQueueCapacity < 1) {
            throw new IllegalArgumentException("returnQueueCapacity must be >= 1");
        }
        if (defaultExpectationTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultExpectationTimeout must be non-negative");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>eventQueueCapacity: 1024</li>
     *   <li>returnQueueCapacity: 1024</li>
     *   <li>throwTestFailureException: false</li>
     *   <li>defaultExpectationTimeout: 1s</li>
     * </ul>
     */
    public static TestManagerConfig defaults() {
        return new TestManagerConfig(1024, 1024, false, Duration.ofSeconds(1));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int eventQueueCapacity = 1024;
        private int returnQueueCapacity = 1024;
        private boolean throwTestFailureException;
        private Duration defaultExpectationTimeout = Duration.ofSeconds(1);

        public Builder withEventQueueCapacity(int capacity) {
            this.eventQueueCapacity = capacity;
            return this;
        }

        public Builder withReturnQueueCapacity(int capacity) {
            this.returnQueueCapacity = capacity;
            return this;
        }

        public Builder withThrowTestFailureException(boolean enabled) {
            this.throwTestFailureException = enabled;
            return this;
        }

        public Builder withDefaultExpectationTimeout(Duration timeout) {
            this.defaultExpectationTimeout = timeout;
            return this;
        }

        public TestManagerConfig build() {
            return new TestManagerConfig(
                    eventQueueCapacity,
                    returnQueueCapacity,
                    throwTestFailureException,
                    defaultExpectationTimeout);
        }
    }
}
