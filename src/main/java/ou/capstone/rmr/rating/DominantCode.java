package ou.capstone.rmr.rating;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import ou.capstone.rmr.codes.CodeDictionary;

/**
 * Most frequent code among a group; ties go to the code seen first.
 */
public final class DominantCode {

    private DominantCode() {
    }

    /**
     * @return the dominant code in normalized form, or null for an empty group
     */
    public static <T> String of(final List<T> items, final Function<T, String> code) {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (T item : items) {
            final String key = CodeDictionary.normalizeCode(code.apply(item));
            if (key != null) {
                counts.merge(key, 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }
}
