package ou.capstone.rmr.validation;

import java.util.List;

import ou.capstone.rmr.exceptions.RmrException;

/**
 * An input row that failed validation, with every reason.
 */
public record RejectedRecord(int row, String stationId, List<RmrException> errors) {
    public RejectedRecord {
        errors = List.copyOf(errors);
    }

    public List<String> reasons() {
        return errors.stream().map(Throwable::getMessage).toList();
    }
}
