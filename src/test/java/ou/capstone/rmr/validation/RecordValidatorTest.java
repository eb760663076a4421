package ou.capstone.rmr.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import ou.capstone.rmr.TestData;
import ou.capstone.rmr.codes.CodeDictionary;
import ou.capstone.rmr.codes.RmrParameter;
import ou.capstone.rmr.exceptions.InvalidRangeException;
import ou.capstone.rmr.exceptions.RmrException;
import ou.capstone.rmr.exceptions.UnknownCodeException;
import ou.capstone.rmr.model.Discontinuity;

public class RecordValidatorTest {

    private final RecordValidator validator = new RecordValidator(CodeDictionary.defaults());

    @Test
    void validRowBecomesDiscontinuity() {
        final ValidationResult result = validator.validate(TestData.rawRow(5, " E-1 ", "120", "35"));

        assertTrue(result.isOk());
        assertEquals("OK", result.message());
        final Discontinuity d = result.discontinuity().orElseThrow();
        assertEquals("E-1", d.getStationId());
        assertEquals(5, d.getRow());
        assertEquals(120.0, d.getOrientation().getDipDirection(), 1e-9);
        assertFalse(result.suppliedRqd().isPresent());
    }

    @Test
    void dipDirectionWrapsAndSmallDipExcursionsAreClamped() {
        final Discontinuity wrapped = validator.validate(TestData.rawRow(2, "E-1", "-30", "90.4"))
                .discontinuity().orElseThrow();
        assertEquals(330.0, wrapped.getOrientation().getDipDirection(), 1e-9);
        assertEquals(90.0, wrapped.getOrientation().getDip(), 1e-9);

        final Discontinuity negative = validator.validate(TestData.rawRow(3, "E-1", "370", "-0.8"))
                .discontinuity().orElseThrow();
        assertEquals(10.0, negative.getOrientation().getDipDirection(), 1e-9);
        assertEquals(0.0, negative.getOrientation().getDip(), 1e-9);
    }

    @Test
    void dipFarOutOfRangeIsRejected() {
        final ValidationResult result = validator.validate(TestData.rawRow(4, "E-1", "10", "95"));

        assertFalse(result.isOk());
        assertEquals(1, result.errors().size());
        final InvalidRangeException ex = (InvalidRangeException) result.errors().get(0);
        assertEquals("dip", ex.getField());
        assertEquals(95.0, ex.getValue(), 1e-9);
        assertTrue(result.message().contains("row 4"));
    }

    @Test
    void everyProblemInARowIsReported() {
        final RawRecord raw = new RawRecord(9, "E-2", "-2", "Q", "abc", "45",
                "4", "2", "2", "9", "1", "2", "2", "");

        final ValidationResult result = validator.validate(raw);

        assertFalse(result.isOk());
        final List<RmrException> errors = result.errors();
        assertEquals(4, errors.size(), result.message());
        assertTrue(errors.stream().anyMatch(e -> e instanceof InvalidRangeException
                && "distance".equals(((InvalidRangeException) e).getField())));
        assertTrue(errors.stream().anyMatch(e -> e.getMessage().contains("dip direction 'abc'")));
        assertTrue(errors.stream().anyMatch(e -> e instanceof UnknownCodeException
                && ((UnknownCodeException) e).getParameter() == RmrParameter.STRUCTURE_TYPE));
        assertTrue(errors.stream().anyMatch(e -> e instanceof UnknownCodeException
                && ((UnknownCodeException) e).getParameter() == RmrParameter.ROUGHNESS));
    }

    @Test
    void missingFieldsAreErrorsNotCrashes() {
        final RawRecord raw = new RawRecord(3, "", null, null, "", null,
                null, null, null, null, null, null, null, null);

        final ValidationResult result = validator.validate(raw);

        assertFalse(result.isOk());
        // station, distance, dip direction, dip, and the eight codes
        assertEquals(12, result.errors().size(), result.message());
    }

    @Test
    void suppliedRqdIsCarried() {
        final RawRecord raw = new RawRecord(2, "E-1", "0.5", "J", "44", "64",
                "4", "2", "2", "2", "1", "2", "2", "78.2");

        final ValidationResult result = validator.validate(raw);

        assertEquals(78.2, result.suppliedRqd().orElseThrow(), 1e-9);
    }

    @Test
    void errorResultNeedsErrors() {
        assertThrows(IllegalArgumentException.class, () -> ValidationResult.error(List.of()));
    }
}
