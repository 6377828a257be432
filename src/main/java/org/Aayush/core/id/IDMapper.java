package org.Aayush.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between client-facing participant ids and dense internal ids.
 *
 * <p>Internal ids are assigned in declaration order, so the n-th declared participant
 * of a market side becomes internal id {@code n}.</p>
 */
public interface IDMapper {

    /**
     * Converts an external id to its internal index.
     * @param externalId client-facing id.
     * @return internal 0-based index.
     * @throws UnknownIDException if the id was never declared.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to the external id.
     * @param internalId internal index.
     * @return client-facing id.
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    String toExternal(int internalId);

    /**
     * Checks whether an external id was declared.
     *
     * @param externalId external id to test.
     * @return true when the id is present.
     */
    boolean containsExternal(String externalId);

    /**
     * Checks whether an internal id is within mapper bounds.
     *
     * @param internalId internal id to test.
     * @return true when the internal id is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of declared ids.
     *
     * @return mapping size.
     */
    int size();

    /**
     * Exception thrown when an external id cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable mapper from ids in declaration order.
     *
     * @param externalIds distinct, non-blank ids; position becomes the internal id.
     * @return an immutable IDMapper instance.
     */
    static IDMapper fromOrdered(List<String> externalIds) {
        return new FastUtilIDMapper(externalIds);
    }
}
