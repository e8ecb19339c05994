package com.questrail.conformance.internal.match;

import com.questrail.conformance.internal.transaction.Transaction;

/**
 * What happened to one expected pattern while an observation was matched.
 *
 * @param index    0-based position of the pattern
 * @param pattern  the pattern, rendered through {@code toString}
 * @param identityMatched whether the observation concerned the pattern's member and target
 * @param trace    the rolled-back transaction of a rejected checker, or {@code null}
 */
record PatternOutcome(int index, Object pattern, boolean identityMatched, Transaction trace)
{
    static PatternOutcome identityMismatch(int index, Object pattern) {
        return new PatternOutcome(index, pattern, false, null);
    }

    static PatternOutcome rejected(int index, Object pattern, Transaction trace) {
        return new PatternOutcome(index, pattern, true, trace);
    }

    void describe(StringBuilder sb) {
        String nl = System.lineSeparator();
        sb.append("  ").append(index + 1).append(". ").append(pattern);
        if (!identityMatched) {
            sb.append(" does not match the observed member or target").append(nl);
            return;
        }
        sb.append(" is not matching").append(nl);
        if (trace.isEmpty()) {
            sb.append("      (checker recorded no entries)").append(nl);
        } else {
            trace.describe(sb, "      ");
        }
    }
}
