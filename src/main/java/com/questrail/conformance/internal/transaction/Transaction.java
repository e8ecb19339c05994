package com.questrail.conformance.internal.transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered record of one transaction. Entries are only appended while the
 * transaction is active; afterwards the record is kept for diagnostics.
 */
public final class Transaction
{
    private final List<TransactionEntry> entries = new ArrayList<>();

    void append(TransactionEntry entry) {
        entries.add(entry);
    }

    public List<TransactionEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Appends one line per entry, each starting with {@code prefix}.
     */
    public void describe(StringBuilder sb, String prefix) {
        for (TransactionEntry entry : entries) {
            sb.append(prefix).append(entry.render()).append(System.lineSeparator());
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        describe(sb, "");
        return sb.toString();
    }
}
