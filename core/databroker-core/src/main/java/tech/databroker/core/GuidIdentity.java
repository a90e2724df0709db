package tech.databroker.core;

import java.util.UUID;

/**
 * Marks a record that is identified by a {@link UUID} held in its {@value #UID_ATTRIBUTE}
 * attribute.
 *
 * <p>Item queries for records implementing this interface select on the attribute
 * directly instead of going through the ORM's find-by-primary-key.
 */
public interface GuidIdentity {

    /**
     * Name of the mapped attribute holding the identifier.
     */
    String UID_ATTRIBUTE = "uid";

    /**
     * The nil UUID, used by records that have not been assigned an identity yet.
     */
    UUID EMPTY_UID = new UUID(0L, 0L);

    UUID uid();
}
