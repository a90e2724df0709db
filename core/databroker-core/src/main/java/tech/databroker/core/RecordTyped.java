package tech.databroker.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A strategy or handler bound to a single record type.
 *
 * <p>Record-specific handlers, sorters and filters are registered as beans and picked
 * by the record type they declare.
 *
 * @param <T> the record type
 */
public interface RecordTyped<T> {

    Class<T> recordType();

    /**
     * Select the candidate registered for {@code recordType}.
     *
     * @param candidates every registered candidate
     * @param recordType the record type being processed
     * @return the matching candidate, or empty if none is registered
     * @throws DataPipelineException if more than one candidate claims the record type
     */
    static <H extends RecordTyped<?>> Optional<H> select(Iterable<H> candidates, Class<?> recordType) {
        List<H> matches = new ArrayList<>();
        for (H candidate : candidates) {
            if (recordType.equals(candidate.recordType())) {
                matches.add(candidate);
            }
        }

        if (matches.size() > 1) {
            throw new DataPipelineException(
                "More than one " + matches.get(0).getClass().getSimpleName()
                    + " candidate is registered for " + recordType.getName());
        }
        return matches.stream().findFirst();
    }
}
