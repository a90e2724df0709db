package tech.databroker.core.edit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.databroker.core.GuidIdentity;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class RecordEditContextBaseTest {

    record Note(UUID uid, String title, int priority) {
    }

    static class NoteEditContext extends RecordEditContextBase<Note> {
        private String title;
        private int priority;

        NoteEditContext(Note note) {
            load(note, false);
        }

        void setTitle(String value) {
            updateIfChangedAndNotify(title, value, v -> title = v, "title");
        }

        void setPriority(int value) {
            updateIfChangedAndNotify(priority, value, v -> priority = v, "priority");
        }

        @Override
        public Note record() {
            return new Note(uid, title, priority);
        }

        @Override
        public Note asNewRecord() {
            return new Note(UUID.randomUUID(), title, priority);
        }

        @Override
        public void load(Note note, boolean notify) {
            baseRecord = note;
            uid = note.uid();
            title = note.title();
            priority = note.priority();
            if (notify) {
                notifyEditStateChanged();
            }
        }
    }

    private final Note stored = new Note(UUID.randomUUID(), "Check the barometer", 2);

    private NoteEditContext context;
    private List<String> changedFields;
    private List<Boolean> editStates;

    @BeforeEach
    void setUp() {
        context = new NoteEditContext(stored);
        changedFields = new ArrayList<>();
        editStates = new ArrayList<>();
        context.addFieldChangedListener(changedFields::add);
        context.addEditStateListener(editStates::add);
    }

    // ========================================
    // DIRTY TRACKING
    // ========================================

    @Test
    @DisplayName("freshly loaded context should be clean")
    void isDirty_shouldBeFalse_afterLoad() {
        assertThat(context.isDirty()).isFalse();
        assertThat(context.record()).isEqualTo(stored);
    }

    @Test
    @DisplayName("changing a field should make the context dirty and notify listeners")
    void setField_shouldMarkDirtyAndNotify() {
        context.setTitle("Check the rain gauge");

        assertThat(context.isDirty()).isTrue();
        assertThat(changedFields).containsExactly("title");
        assertThat(editStates).containsExactly(true);
    }

    @Test
    @DisplayName("setting a field to its current value should not notify")
    void setField_shouldNotNotify_whenValueUnchanged() {
        context.setPriority(2);

        assertThat(changedFields).isEmpty();
        assertThat(context.isDirty()).isFalse();
    }

    @Test
    @DisplayName("changing a field back should make the context clean again")
    void isDirty_shouldBeFalse_whenValueRestored() {
        context.setPriority(5);
        context.setPriority(2);

        assertThat(context.isDirty()).isFalse();
        assertThat(editStates).containsExactly(true, false);
    }

    // ========================================
    // RESET AND SAVE
    // ========================================

    @Test
    @DisplayName("reset should discard edits")
    void reset_shouldRestoreBaseRecord() {
        context.setTitle("Something else");

        context.reset();

        assertThat(context.record()).isEqualTo(stored);
        assertThat(context.isDirty()).isFalse();
        assertThat(editStates).endsWith(false);
    }

    @Test
    @DisplayName("setAsSaved should make the edited values the new base record")
    void setAsSaved_shouldRebaseOnCurrentValues() {
        context.setTitle("Saved title");

        context.setAsSaved();

        assertThat(context.isDirty()).isFalse();
        assertThat(context.baseRecord().title()).isEqualTo("Saved title");
    }

    // ========================================
    // NEW RECORDS
    // ========================================

    @Test
    @DisplayName("context with the empty Uid should be new")
    void isNew_shouldBeTrue_forEmptyUid() {
        NoteEditContext fresh = new NoteEditContext(new Note(GuidIdentity.EMPTY_UID, "", 0));

        assertThat(fresh.isNew()).isTrue();
        assertThat(context.isNew()).isFalse();
    }

    @Test
    @DisplayName("asNewRecord should copy the values under a new Uid")
    void asNewRecord_shouldAssignNewUid() {
        Note copy = context.asNewRecord();

        assertThat(copy.uid()).isNotEqualTo(stored.uid());
        assertThat(copy.title()).isEqualTo(stored.title());
        assertThat(copy.priority()).isEqualTo(stored.priority());
    }
}
