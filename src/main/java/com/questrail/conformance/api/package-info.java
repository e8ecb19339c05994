/**
 * Public surface of the conformance oracle: the {@link
 * com.questrail.conformance.api.TestManager} used by test cases and the
 * collaborators it consumes ({@link com.questrail.conformance.api.ReportingSink},
 * {@link com.questrail.conformance.api.AdapterLookup},
 * {@link com.questrail.conformance.api.EventHookup}).
 */
package com.questrail.conformance.api;
