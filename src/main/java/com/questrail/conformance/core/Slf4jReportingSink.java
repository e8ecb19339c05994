package com.questrail.conformance.core;

import com.questrail.conformance.api.ReportingSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ReportingSink} that writes verdicts to SLF4J and counts failures.
 *
 * <p>Useful when a test case runs outside a harness that collects verdicts.
 * Failed assertions are logged at error level, failed assumptions at warn.</p>
 */
public final class Slf4jReportingSink implements ReportingSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jReportingSink.class);

    private final AtomicInteger failures = new AtomicInteger();
    private final AtomicInteger inconclusive = new AtomicInteger();

    @Override
    public void assertTrue(boolean condition, String description) {
        if (condition) {
            log.debug("Assert succeeded: {}", description);
        } else {
            failures.incrementAndGet();
            log.error("Assert failed: {}", description);
        }
    }

    @Override
    public void assume(boolean condition, String description) {
        if (condition) {
            log.debug("Assume succeeded: {}", description);
        } else {
            inconclusive.incrementAndGet();
            log.warn("Assume failed: {}", description);
        }
    }

    @Override
    public void checkpoint(String description) {
        log.info("Checkpoint: {}", description);
    }

    @Override
    public void comment(String description) {
        log.info("{}", description);
    }

    @Override
    public void beginTest(String name) {
        log.info("Begin Test: {}", name);
    }

    @Override
    public void endTest() {
        log.info("End Test. ({} failure(s), {} failed assumption(s))", failures.get(), inconclusive.get());
    }

    public int failureCount() {
        return failures.get();
    }

    public int failedAssumptionCount() {
        return inconclusive.get();
    }
}
