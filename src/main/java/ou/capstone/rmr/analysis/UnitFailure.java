package ou.capstone.rmr.analysis;

import ou.capstone.rmr.exceptions.RmrException;

/**
 * A station or family whose score could not be computed.
 */
public record UnitFailure(Kind kind, String unitId, RmrException cause) {

    public enum Kind { STATION, FAMILY }

    public String message() {
        return cause.getMessage();
    }
}
