package com.wordsonphone.backend.customcategory.provider;

import com.wordsonphone.backend.customcategory.model.Difficulty;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 沒設定任何 provider 時的 fallback（dev / 測試用）。
 * 每次呼叫都加 counter，避免同一個 category 重打時全部被 dedup 掉。
 */
public class StubGenerationClient implements GenerationClient {

    public static final String CODE = "STUB";

    private static final String[] SEEDS = {
            "Party", "Festival", "Classic", "Weekend", "Backyard",
            "Midnight", "Summer", "Family", "Road Trip", "Birthday"
    };

    private final AtomicLong counter = new AtomicLong();

    @Override
    public String providerCode() { return CODE; }

    @Override
    public boolean structuredOutput() { return true; }

    @Override
    public List<GeneratedItem> generateBatch(GenerationRequest request) {
        String topic = (request.topic() == null || request.topic().isBlank()) ? "Mixed" : request.topic().trim();
        List<GeneratedItem> out = new ArrayList<>(request.batchSize());
        for (String id : request.itemIds()) {
            long n = counter.incrementAndGet();
            String text = SEEDS[(int) (n % SEEDS.length)] + " " + topic + " " + n;
            out.add(new GeneratedItem(id, request.topic(), text, Difficulty.MEDIUM));
        }
        return out;
    }

    @Override
    public List<String> sampleWords(String categoryName, int count) {
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(SEEDS[i % SEEDS.length] + " " + categoryName);
        }
        return out;
    }
}
