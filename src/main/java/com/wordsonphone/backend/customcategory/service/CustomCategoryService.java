package com.wordsonphone.backend.customcategory.service;

import com.wordsonphone.backend.customcategory.config.CustomCategoryProperties;
import com.wordsonphone.backend.customcategory.dto.*;
import com.wordsonphone.backend.customcategory.entity.CategoryRequestEntity;
import com.wordsonphone.backend.customcategory.model.CategoryIds;
import com.wordsonphone.backend.customcategory.model.CategoryRequestStatus;
import com.wordsonphone.backend.customcategory.provider.GenerationClient;
import com.wordsonphone.backend.customcategory.provider.GenerationClientRouter;
import com.wordsonphone.backend.customcategory.quota.QuotaLedger;
import com.wordsonphone.backend.customcategory.quota.QuotaStatus;
import com.wordsonphone.backend.customcategory.scoring.PhraseScore;
import com.wordsonphone.backend.customcategory.scoring.PhraseScorer;
import com.wordsonphone.backend.customcategory.store.PhraseStore;
import com.wordsonphone.backend.customcategory.task.BatchOrchestrator;
import com.wordsonphone.backend.customcategory.task.GenerationResult;
import com.wordsonphone.backend.customcategory.web.CategoryNotFoundException;
import com.wordsonphone.backend.customcategory.web.InsufficientSampleWordsException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
@Service
public class CustomCategoryService {

    /** preview 至少要這麼多個才算成功 */
    static final int MIN_SAMPLE_WORDS = 2;

    private final QuotaLedger ledger;
    private final GenerationClientRouter router;
    private final BatchOrchestrator orchestrator;
    private final PhraseStore store;
    private final PhraseScorer scorer;
    private final CustomCategoryProperties props;
    private final Clock clock;

    public QuotaResponse quota() {
        QuotaStatus st = ledger.canMakeRequest();
        return new QuotaResponse(st.allowed(), st.remaining(), st.dailyLimit(), ledger.secondsUntilReset());
    }

    /**
     * preview：request 重建成 PENDING，拿到足夠的 sample words 才轉 CONFIRMED。
     * provider 呼叫送出去就記一次 attempt。
     */
    public SampleWordsResponse requestSampleWords(String rawCategoryName) {
        String categoryName = normalizeName(rawCategoryName);
        ledger.requireAvailable();
        GenerationClient client = router.resolve();

        CategoryRequestEntity request = new CategoryRequestEntity();
        request.setId(CategoryIds.requestIdFor(categoryName));
        request.setCategoryName(categoryName);
        request.setRequestedAtUtc(clock.instant());
        request.setStatus(CategoryRequestStatus.PENDING);
        request = store.saveRequest(request);

        int count = props.getBatch().getSampleWordsCount();
        try {
            List<String> words;
            try {
                words = cleanWords(client.sampleWords(categoryName, count), count);
            } finally {
                safeRecordAttempt(categoryName);
            }

            if (words.size() < MIN_SAMPLE_WORDS) {
                throw new InsufficientSampleWordsException(words.size());
            }

            request.setSampleWords(new ArrayList<>(words));
            request.transitionTo(CategoryRequestStatus.CONFIRMED);
            request = store.saveRequest(request);

            log.info("sample_words_ok category={} requestId={} provider={} words={}",
                    categoryName, request.getId(), client.providerCode(), words.size());
            return new SampleWordsResponse(request.getId(), categoryName, List.copyOf(words),
                    ledger.canMakeRequest().remaining());
        } catch (RuntimeException e) {
            log.warn("sample_words_failed category={} provider={} err={}", categoryName, client.providerCode(), e.toString());
            request.markFailed(e.getMessage());
            store.saveRequest(request);
            throw e;
        }
    }

    public GenerateCategoryResponse generateFullCategory(GenerateCategoryRequest req) {
        String categoryName = normalizeName(req.categoryName());
        int target = (req.targetCount() == null) ? props.getBatch().getTargetCount() : req.targetCount();

        GenerationResult r = orchestrator.generate(categoryName, target, req.sampleWords(), req.description(), req.tags());

        return new GenerateCategoryResponse(
                r.requestId(),
                r.categoryName(),
                r.phrases().size(),
                r.targetCount(),
                r.partial(),
                r.attempts(),
                r.successfulBatches(),
                r.failedBatches(),
                r.phrases().stream().map(PhraseView::from).toList()
        );
    }

    public List<String> listCategoryNames() {
        return store.getAllCategoryNames();
    }

    public List<String> phrasesFor(String categoryName) {
        return store.getPhrasesByCategory(normalizeName(categoryName));
    }

    public CategoryRequestView requestFor(String categoryName) {
        String name = normalizeName(categoryName);
        return store.getRequest(CategoryIds.requestIdFor(name))
                .map(CategoryRequestView::from)
                .orElseThrow(() -> new CategoryNotFoundException(name));
    }

    public void deleteCategory(String categoryName) {
        store.deleteCategory(normalizeName(categoryName));
    }

    public ScoreResponse score(ScoreRequest req) {
        boolean useBoosters = Boolean.TRUE.equals(req.useBoosters());
        PhraseScore s = scorer.score(req.text().trim(), req.category().trim(), useBoosters);
        return ScoreResponse.from(s, useBoosters ? PhraseScorer.MAX_TOTAL : PhraseScorer.MAX_LOCAL);
    }

    // ===== helpers =====

    private void safeRecordAttempt(String categoryName) {
        try {
            ledger.recordAttempt();
        } catch (RuntimeException e) {
            log.warn("quota_record_attempt_failed category={} err={}", categoryName, e.toString());
        }
    }

    static List<String> cleanWords(List<String> raw, int max) {
        List<String> out = new ArrayList<>(max);
        if (raw == null) return out;
        for (String w : raw) {
            if (out.size() >= max) break;
            if (w == null) continue;
            String t = w.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static String normalizeName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("CATEGORY_NAME_REQUIRED");
        return name.trim();
    }
}
