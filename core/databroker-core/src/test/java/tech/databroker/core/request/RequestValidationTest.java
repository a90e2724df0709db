package tech.databroker.core.request;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.databroker.core.DataPipelineException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Construction rules for item, command and filter requests.
 */
class RequestValidationTest {

    @Test
    @DisplayName("ItemQueryRequest without a Uid is a pipeline error")
    void itemQueryRequest_shouldThrow_whenUidMissing() {
        assertThatThrownBy(() -> ItemQueryRequest.of(null))
            .isInstanceOf(DataPipelineException.class)
            .hasMessageContaining("No Uid");
    }

    @Test
    @DisplayName("ItemQueryRequest should carry the Uid")
    void itemQueryRequest_shouldCarryUid() {
        UUID uid = UUID.randomUUID();

        assertThat(ItemQueryRequest.of(uid).uid()).isEqualTo(uid);
    }

    @Test
    @DisplayName("CommandRequest without an item is a pipeline error")
    void commandRequest_shouldThrow_whenItemMissing() {
        assertThatThrownBy(() -> CommandRequest.of(null))
            .isInstanceOf(DataPipelineException.class)
            .hasMessageContaining("No Item");
    }

    @Test
    @DisplayName("FilterDefinition should require a name")
    void filterDefinition_shouldThrow_whenNameBlank() {
        assertThatThrownBy(() -> new FilterDefinition(" ", "Balmy"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FilterDefinition(null, "Balmy"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("FilterDefinition should default missing data to empty")
    void filterDefinition_shouldDefaultData() {
        assertThat(new FilterDefinition("BySummary", null).filterData()).isEmpty();
    }
}
