package com.wordsonphone.backend.customcategory.store;

import com.wordsonphone.backend.customcategory.entity.CategoryRequestEntity;
import com.wordsonphone.backend.customcategory.entity.GeneratedPhraseEntity;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 唯一的 durable state 寫入者。
 * 生成過程中 corpus 只讀；phrases 只在 fan-in 之後寫一次。
 */
public interface PhraseStore {

    CategoryRequestEntity saveRequest(CategoryRequestEntity request);

    Optional<CategoryRequestEntity> getRequest(String id);

    /**
     * 已存在（case-insensitive）的 text 會被略過，不丟例外。
     * @return 實際寫入的 phrases
     */
    List<GeneratedPhraseEntity> savePhrases(List<GeneratedPhraseEntity> phrases);

    List<GeneratedPhraseEntity> getAllPhrases();

    List<String> getPhrasesByCategory(String categoryName);

    /** phrases + request 一起刪；空類別是 no-op */
    void deleteCategory(String categoryName);

    List<String> getAllCategoryNames();

    /** 內建題庫 + 已存的 custom phrases，全部是小寫 key */
    Set<String> corpusKeys();
}
