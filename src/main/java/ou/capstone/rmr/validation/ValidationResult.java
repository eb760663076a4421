package ou.capstone.rmr.validation;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import ou.capstone.rmr.exceptions.RmrException;
import ou.capstone.rmr.model.Discontinuity;

/**
 * Result of validating one input row: a discontinuity, or every problem found in the row.
 */
public final class ValidationResult {
    private final boolean ok;
    private final Discontinuity discontinuity;
    private final Double suppliedRqd;
    private final List<RmrException> errors;

    private ValidationResult(boolean ok, Discontinuity discontinuity, Double suppliedRqd, List<RmrException> errors) {
        this.ok = ok;
        this.discontinuity = discontinuity;
        this.suppliedRqd = suppliedRqd;
        this.errors = (errors == null) ? List.of() : List.copyOf(errors);
    }

    public static ValidationResult success(final Discontinuity d, final Double suppliedRqd) {
        return new ValidationResult(true, d, suppliedRqd, List.of());
    }

    public static ValidationResult error(final List<RmrException> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("An error result needs at least one error");
        }
        return new ValidationResult(false, null, null, errors);
    }

    public boolean isOk() {
        return ok;
    }

    public Optional<Discontinuity> discontinuity() {
        return Optional.ofNullable(discontinuity);
    }

    public Optional<Double> suppliedRqd() {
        return Optional.ofNullable(suppliedRqd);
    }

    public List<RmrException> errors() {
        return errors;
    }

    public String message() {
        if (ok) return "OK";
        return errors.stream().map(Throwable::getMessage).collect(Collectors.joining("; "));
    }
}
