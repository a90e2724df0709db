package tech.databroker.core.request;

import tech.databroker.core.DataPipelineException;

import java.util.UUID;

/**
 * Query for a single record by its identifier.
 *
 * @param uid Identifier of the record to retrieve
 */
public record ItemQueryRequest(
    UUID uid
) {
    public ItemQueryRequest {
        if (uid == null) {
            throw new DataPipelineException("No Uid provided for the ItemQueryRequest");
        }
    }

    public static ItemQueryRequest of(UUID uid) {
        return new ItemQueryRequest(uid);
    }
}
