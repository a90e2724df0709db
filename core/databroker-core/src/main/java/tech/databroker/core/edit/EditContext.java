package tech.databroker.core.edit;

import java.util.function.Consumer;

/**
 * Edit state of a record being edited.
 */
public interface EditContext {

    boolean isDirty();

    boolean isNew();

    /**
     * Register a listener called with the field name whenever a field changes.
     */
    void addFieldChangedListener(Consumer<String> listener);

    /**
     * Register a listener called with the dirty flag whenever the edit state changes.
     */
    void addEditStateListener(Consumer<Boolean> listener);
}
