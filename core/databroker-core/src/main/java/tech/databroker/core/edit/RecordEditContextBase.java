package tech.databroker.core.edit;

import tech.databroker.core.GuidIdentity;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Base class for record edit contexts.
 *
 * <p>Subclasses hold one private field per editable record field, expose setters that go
 * through {@link #updateIfChangedAndNotify}, and rebuild the record in {@link #record()}.
 * A record is dirty when the rebuilt record is not equal to the base record, so the
 * record type must implement value equality.
 *
 * <p>Subclass constructors must call {@link #load(Object, boolean)}; the base class does
 * not, because the subclass fields are not initialized yet while it runs.
 *
 * @param <T> the record type
 */
public abstract class RecordEditContextBase<T> implements RecordEditContext<T> {

    private final List<Consumer<String>> fieldChangedListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<Boolean>> editStateListeners = new CopyOnWriteArrayList<>();

    protected T baseRecord;
    protected UUID uid = GuidIdentity.EMPTY_UID;

    @Override
    public T baseRecord() {
        return baseRecord;
    }

    @Override
    public UUID uid() {
        return uid;
    }

    @Override
    public boolean isDirty() {
        return !Objects.equals(baseRecord, record());
    }

    @Override
    public boolean isNew() {
        return uid == null || GuidIdentity.EMPTY_UID.equals(uid);
    }

    @Override
    public void reset() {
        load(baseRecord, true);
    }

    @Override
    public void setAsSaved() {
        load(record(), true);
    }

    @Override
    public void addFieldChangedListener(Consumer<String> listener) {
        fieldChangedListeners.add(listener);
    }

    @Override
    public void addEditStateListener(Consumer<Boolean> listener) {
        editStateListeners.add(listener);
    }

    /**
     * Tell edit state listeners the context was (re)loaded.
     */
    protected void notifyEditStateChanged() {
        boolean dirty = isDirty();
        editStateListeners.forEach(listener -> listener.accept(dirty));
    }

    protected void notifyFieldChanged(String fieldName) {
        fieldChangedListeners.forEach(listener -> listener.accept(fieldName));
        notifyEditStateChanged();
    }

    /**
     * Apply {@code value} through {@code setter} if it differs from {@code currentValue}
     * and notify the listeners.
     *
     * @return true if the value changed
     */
    protected <V> boolean updateIfChangedAndNotify(V currentValue, V value, Consumer<V> setter, String fieldName) {
        if (Objects.equals(currentValue, value)) {
            return false;
        }
        setter.accept(value);
        notifyFieldChanged(fieldName);
        return true;
    }
}
