package ou.capstone.rmr.report;

import java.util.List;

/**
 * A flat report row that can be written as one CSV line.
 */
public interface TabularRow {

    /** Cell values in the same order as the row type's header. */
    List<String> values();
}
