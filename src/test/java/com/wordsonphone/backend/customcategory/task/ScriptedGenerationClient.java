package com.wordsonphone.backend.customcategory.task;

import com.wordsonphone.backend.customcategory.model.ProviderErrorCode;
import com.wordsonphone.backend.customcategory.provider.GeneratedItem;
import com.wordsonphone.backend.customcategory.provider.GenerationClient;
import com.wordsonphone.backend.customcategory.provider.GenerationClientException;
import com.wordsonphone.backend.customcategory.provider.GenerationRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * 依呼叫順序（0 起算）回固定的字串；script 可以直接丟 GenerationClientException。
 * 回來的 id 照 request.itemIds 的順序 echo。
 */
class ScriptedGenerationClient implements GenerationClient {

    private final String code;
    private final boolean structured;
    private final IntFunction<List<String>> script;
    private final AtomicInteger calls = new AtomicInteger();

    ScriptedGenerationClient(String code, boolean structured, IntFunction<List<String>> script) {
        this.code = code;
        this.structured = structured;
        this.script = script;
    }

    int calls() { return calls.get(); }

    @Override
    public String providerCode() { return code; }

    @Override
    public boolean structuredOutput() { return structured; }

    @Override
    public List<GeneratedItem> generateBatch(GenerationRequest request) {
        List<String> texts = script.apply(calls.getAndIncrement());
        List<GeneratedItem> out = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String id = (i < request.itemIds().size()) ? request.itemIds().get(i) : "unknown-" + i;
            out.add(new GeneratedItem(id, request.topic(), texts.get(i), null));
        }
        return out;
    }

    @Override
    public List<String> sampleWords(String categoryName, int count) {
        return script.apply(calls.getAndIncrement());
    }

    static List<String> numbered(String prefix, int n) {
        List<String> out = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) out.add(prefix + " " + i);
        return out;
    }

    static GenerationClientException providerError(String msg) {
        return new GenerationClientException(ProviderErrorCode.PROVIDER_ERROR, msg);
    }

    /** 可被 interrupt 的睡眠；被中斷就當作 provider timeout */
    static void sleepInterruptibly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationClientException(ProviderErrorCode.PROVIDER_TIMEOUT, "interrupted", null, e);
        }
    }
}
