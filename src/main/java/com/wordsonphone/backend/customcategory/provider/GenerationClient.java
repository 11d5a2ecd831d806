package com.wordsonphone.backend.customcategory.provider;

import java.util.List;

public interface GenerationClient {

    /** OPENAI / GEMINI / STUB */
    String providerCode();

    /**
     * true：provider 回結構化 JSON、會 echo itemIds，結果直接收。
     * false：自由文字要靠 heuristic 解析，batch 內會視品質重打。
     */
    boolean structuredOutput();

    /**
     * 失敗一律丟 {@link GenerationClientException}（帶 ProviderErrorCode），不回 null。
     */
    List<GeneratedItem> generateBatch(GenerationRequest request);

    /** preview 用：回最多 count 個代表字 */
    List<String> sampleWords(String categoryName, int count);
}
