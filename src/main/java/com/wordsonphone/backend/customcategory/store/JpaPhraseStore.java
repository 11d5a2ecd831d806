package com.wordsonphone.backend.customcategory.store;

import com.wordsonphone.backend.customcategory.dedup.PhraseDeduplicator;
import com.wordsonphone.backend.customcategory.entity.CategoryRequestEntity;
import com.wordsonphone.backend.customcategory.entity.GeneratedPhraseEntity;
import com.wordsonphone.backend.customcategory.model.CategoryIds;
import com.wordsonphone.backend.customcategory.repo.CategoryRequestRepository;
import com.wordsonphone.backend.customcategory.repo.GeneratedPhraseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

@Slf4j
@RequiredArgsConstructor
@Service
public class JpaPhraseStore implements PhraseStore {

    private final CategoryRequestRepository requestRepo;
    private final GeneratedPhraseRepository phraseRepo;
    private final StaticPhraseCatalog staticCatalog;

    @Override
    @Transactional
    public CategoryRequestEntity saveRequest(CategoryRequestEntity request) {
        return requestRepo.save(request);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CategoryRequestEntity> getRequest(String id) {
        return requestRepo.findById(id);
    }

    @Override
    @Transactional
    public List<GeneratedPhraseEntity> savePhrases(List<GeneratedPhraseEntity> phrases) {
        if (phrases == null || phrases.isEmpty()) return List.of();

        Map<String, GeneratedPhraseEntity> byKey = new LinkedHashMap<>();
        for (GeneratedPhraseEntity p : phrases) {
            String key = PhraseDeduplicator.normalize(p.getText());
            p.setTextKey(key);
            byKey.putIfAbsent(key, p);
        }

        Set<String> existing = new HashSet<>(phraseRepo.findExistingTextKeys(byKey.keySet()));
        List<GeneratedPhraseEntity> toSave = new ArrayList<>(byKey.size());
        for (Map.Entry<String, GeneratedPhraseEntity> e : byKey.entrySet()) {
            if (!existing.contains(e.getKey())) toSave.add(e.getValue());
        }

        int skipped = phrases.size() - toSave.size();
        if (skipped > 0) {
            log.info("phrases_skipped_existing count={}", skipped);
        }
        return phraseRepo.saveAll(toSave);
    }

    @Override
    @Transactional(readOnly = true)
    public List<GeneratedPhraseEntity> getAllPhrases() {
        return phraseRepo.findAllByOrderByCreatedAtUtcAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> getPhrasesByCategory(String categoryName) {
        return phraseRepo.findTextsByCategory(categoryName);
    }

    @Override
    @Transactional
    public void deleteCategory(String categoryName) {
        int deleted = phraseRepo.deleteByCategory(categoryName);

        String requestId = CategoryIds.requestIdFor(categoryName);
        boolean hadRequest = requestRepo.existsById(requestId);
        if (hadRequest) requestRepo.deleteById(requestId);

        log.info("category_deleted category={} phrases={} request={}", categoryName, deleted, hadRequest);
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> getAllCategoryNames() {
        return phraseRepo.findDistinctCategories();
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> corpusKeys() {
        Set<String> keys = new HashSet<>(staticCatalog.keys());
        keys.addAll(phraseRepo.findAllTextKeys());
        return keys;
    }
}
