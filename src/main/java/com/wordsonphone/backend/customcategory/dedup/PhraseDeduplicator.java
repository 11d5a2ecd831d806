package com.wordsonphone.backend.customcategory.dedup;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;

/**
 * 去重只做小寫比對，不去空白、不去標點：
 * "Pizza Night" 與 "pizza night" 算重複，"Pizza  Night"、"Pizza-Night" 不算。
 * <p>
 * 兩段式：
 * 1) 新產生的這批先自己去重（保留第一次出現的）
 * 2) 再濾掉已經在 corpus（內建題庫 + 已存的自訂題 + 其他 batch 已收下的）的
 * <p>
 * 不改輸入、不改順序。
 */
@Component
public class PhraseDeduplicator {

    public static String normalize(String text) {
        return (text == null) ? "" : text.toLowerCase(Locale.ROOT);
    }

    public <T> List<T> dedupe(List<T> candidates, Function<T, String> textOf, Set<String> existingCorpusKeys) {
        if (candidates == null || candidates.isEmpty()) return List.of();
        Set<String> corpus = (existingCorpusKeys == null) ? Set.of() : existingCorpusKeys;

        Set<String> seen = new HashSet<>();
        List<T> out = new ArrayList<>(candidates.size());
        for (T c : candidates) {
            String key = normalize(textOf.apply(c));
            if (!seen.add(key)) continue;
            if (corpus.contains(key)) continue;
            out.add(c);
        }
        return out;
    }

    /** 只做第 1 段（批次內 / 跨批次去重），不比 corpus */
    public <T> List<T> dedupeWithin(List<T> candidates, Function<T, String> textOf) {
        return dedupe(candidates, textOf, Set.of());
    }

    public static Set<String> keysOf(Collection<String> texts) {
        Set<String> out = new HashSet<>();
        if (texts == null) return out;
        for (String t : texts) out.add(normalize(t));
        return out;
    }
}
