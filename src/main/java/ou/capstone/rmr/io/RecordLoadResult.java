package ou.capstone.rmr.io;

import java.util.List;

import ou.capstone.rmr.validation.RawRecord;

/**
 * Rows read from a discontinuity table, not yet validated.
 */
public record RecordLoadResult(String sourceName, List<RawRecord> records) {
    public RecordLoadResult {
        records = List.copyOf(records);
    }
}
