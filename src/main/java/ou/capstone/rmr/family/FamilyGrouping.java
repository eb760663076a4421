package ou.capstone.rmr.family;

import java.util.List;

import ou.capstone.rmr.model.Discontinuity;

/**
 * Families plus the discontinuities that joined none.
 */
public record FamilyGrouping(List<Family> families, List<Discontinuity> unclustered) {
    public FamilyGrouping {
        families = List.copyOf(families);
        unclustered = List.copyOf(unclustered);
    }
}
