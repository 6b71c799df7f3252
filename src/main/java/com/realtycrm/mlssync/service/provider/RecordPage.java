package com.realtycrm.mlssync.service.provider;

import java.util.List;

/**
 * A page of records and the cursor that continues the sequence, or {@code null} after the last page.
 */
public record RecordPage(List<ProviderRecord> records, String nextCursor) {

    public RecordPage {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean isLast() {
        return nextCursor == null;
    }
}
