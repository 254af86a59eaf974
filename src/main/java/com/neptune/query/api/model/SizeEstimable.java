package com.neptune.query.api.model;

/**
 * Implemented by items that can be placed in a request body. The estimate is used only to
 * split large requests; it need not be exact but must be deterministic and cheap.
 */
public interface SizeEstimable {

    int estimatedSizeBytes();
}
