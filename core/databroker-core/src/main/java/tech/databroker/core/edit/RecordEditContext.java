package tech.databroker.core.edit;

import java.util.UUID;

/**
 * Editable view of a record that remembers the record it was loaded from.
 *
 * @param <T> the record type
 */
public interface RecordEditContext<T> extends EditContext {

    /**
     * The record as loaded, before any edits.
     */
    T baseRecord();

    UUID uid();

    /**
     * A new record built from the current field values.
     */
    T record();

    void load(T record, boolean notify);

    /**
     * A copy of the current values with a freshly assigned identity.
     */
    T asNewRecord();

    /**
     * Discard edits and go back to the base record.
     */
    void reset();

    /**
     * Make the current values the new base record, typically after a successful save.
     */
    void setAsSaved();
}
