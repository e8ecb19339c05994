/**
 * Expectation Matching
 * =============================================================================
 *
 * <p>This package holds the algorithm that decides whether the head of an
 * observation queue satisfies one of several expected patterns.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   producers → ObservationQueue
 *                   → ExpectationMatcher   (peek, try each pattern, consume)
 *                       → TransactionLog   (commit or roll back per attempt)
 *                           → ReportingSink
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>{@code TransactionAbort} never escapes this package; each attempt turns
 *       it into an {@link com.questrail.conformance.internal.match.AttemptResult}.</li>
 *   <li>An observation is consumed only after its accepting pattern's
 *       transaction has been committed.</li>
 *   <li>Failure texts are rendered here; how a failure is surfaced is decided
 *       by the caller's failure reporter.</li>
 * </ul>
 */
package com.questrail.conformance.internal.match;
