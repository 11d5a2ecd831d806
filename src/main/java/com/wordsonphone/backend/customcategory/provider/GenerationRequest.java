package com.wordsonphone.backend.customcategory.provider;

import java.util.List;

/**
 * itemIds 由呼叫端產生（UUID），數量一定等於 batchSize，回來的 item 才對得回去。
 */
public record GenerationRequest(String topic, int batchSize, List<String> itemIds) {

    public GenerationRequest {
        if (batchSize < 1 || batchSize > 100) {
            throw new IllegalArgumentException("BATCH_SIZE_OUT_OF_RANGE: " + batchSize);
        }
        if (itemIds == null || itemIds.size() != batchSize) {
            throw new IllegalArgumentException("ITEM_IDS_SIZE_MISMATCH");
        }
        itemIds = List.copyOf(itemIds);
    }
}
