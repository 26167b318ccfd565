package com.tierstore.error;

import java.util.Map;

public class CollectionNotFoundException extends TierStoreException {
    public CollectionNotFoundException(String collectionName) {
        super(ErrorCode.COLLECTION_NOT_FOUND,
                "Collection " + collectionName + " does not exist",
                Map.of("collection", collectionName));
    }
}
