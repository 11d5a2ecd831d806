package com.wordsonphone.backend.customcategory.task;

import com.wordsonphone.backend.customcategory.config.CustomCategoryProperties;
import com.wordsonphone.backend.customcategory.dedup.PhraseDeduplicator;
import com.wordsonphone.backend.customcategory.entity.CategoryRequestEntity;
import com.wordsonphone.backend.customcategory.entity.GeneratedPhraseEntity;
import com.wordsonphone.backend.customcategory.model.CategoryIds;
import com.wordsonphone.backend.customcategory.model.CategoryRequestStatus;
import com.wordsonphone.backend.customcategory.provider.GenerationClient;
import com.wordsonphone.backend.customcategory.provider.GenerationClientRouter;
import com.wordsonphone.backend.customcategory.provider.ProviderErrorMapper;
import com.wordsonphone.backend.customcategory.quota.QuotaLedger;
import com.wordsonphone.backend.customcategory.quota.QuotaStatus;
import com.wordsonphone.backend.customcategory.scoring.PhraseScore;
import com.wordsonphone.backend.customcategory.store.PhraseStore;
import com.wordsonphone.backend.customcategory.web.AllBatchesFailedException;
import com.wordsonphone.backend.customcategory.web.EmptyAfterDedupException;
import com.wordsonphone.backend.customcategory.web.GenerationCancelledException;
import com.wordsonphone.backend.customcategory.web.QuotaExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

/**
 * 一次 orchestration：
 * 1) admission check（還沒打任何 provider）
 * 2) fan-out N 個 batch，每個 batch 自己 pre-check quota、自己記 attempt
 * 3) fan-in：全部 settle 才往下；0 個成功 = AllBatchesFailed
 * 4) 跨 batch 去重，再比 corpus 去重
 * 5) 不夠 target 且 attempts 未達上限：補「一個」順序 batch（只補一次）
 * 6) 寫入 phrases，request -> GENERATED（致命錯誤 -> FAILED）
 * <p>
 * 生成期間 corpus 只讀；phrases 只在 fan-in 之後寫一次。
 */
@Slf4j
@Service
public class BatchOrchestrator {

    private final QuotaLedger ledger;
    private final SingleBatchGenerator batchGenerator;
    private final PhraseDeduplicator dedup;
    private final PhraseStore store;
    private final GenerationClientRouter router;
    private final AsyncTaskExecutor executor;
    private final CustomCategoryProperties props;
    private final Clock clock;

    public BatchOrchestrator(
            QuotaLedger ledger,
            SingleBatchGenerator batchGenerator,
            PhraseDeduplicator dedup,
            PhraseStore store,
            GenerationClientRouter router,
            @Qualifier("batchGenerationExecutor") AsyncTaskExecutor executor,
            CustomCategoryProperties props,
            Clock clock
    ) {
        this.ledger = ledger;
        this.batchGenerator = batchGenerator;
        this.dedup = dedup;
        this.store = store;
        this.router = router;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    public GenerationResult generate(String categoryName, int targetCount) {
        return generate(categoryName, targetCount, null, null, null);
    }

    /**
     * sampleWords / description / tags 為 null 代表沿用 request 上既有的值。
     */
    public GenerationResult generate(String categoryName, int targetCount,
                                     List<String> sampleWords, String description, List<String> tags) {
        ledger.requireAvailable();

        // ✅ provider 每次 orchestration 只決定一次，不在每個 batch 重新判斷
        GenerationClient client = router.resolve();
        CategoryRequestEntity request = openRequest(categoryName, sampleWords, description, tags);

        CustomCategoryProperties.Batch cfg = props.getBatch();
        int parallel = Math.max(1, cfg.getParallelBatches());
        long timeoutNanos = cfg.getCallTimeout().toNanos();

        Set<String> corpus = store.corpusKeys();
        log.info("generation_start category={} requestId={} provider={} target={} parallel={} corpus={}",
                categoryName, request.getId(), client.providerCode(), targetCount, parallel, corpus.size());

        // ===== fan-out =====
        List<Future<List<ScoredCandidate>>> futures = new ArrayList<>(parallel);
        for (int i = 1; i <= parallel; i++) {
            final int batchNo = i;
            futures.add(executor.submit(() -> runBatch(client, categoryName, batchNo)));
        }

        // ===== fan-in（allSettled） =====
        List<ScoredCandidate> collected = new ArrayList<>();
        int ok = 0;
        int failed = 0;
        long deadline = System.nanoTime() + timeoutNanos;
        for (int i = 0; i < futures.size(); i++) {
            List<ScoredCandidate> r = await(futures.get(i), deadline, categoryName, i + 1, futures, request);
            if (r == null) {
                failed++;
            } else {
                ok++;
                collected.addAll(r);
            }
        }

        if (ok == 0) {
            log.warn("generation_all_batches_failed category={} failed={}", categoryName, failed);
            throw failRequest(request, new AllBatchesFailedException(failed));
        }

        List<ScoredCandidate> unique = dedup.dedupeWithin(collected, ScoredCandidate::text);
        int afterCrossBatch = unique.size();
        unique = dedup.dedupe(unique, ScoredCandidate::text, corpus);
        log.info("generation_dedup category={} collected={} crossBatchUnique={} corpusUnique={}",
                categoryName, collected.size(), afterCrossBatch, unique.size());

        // ===== 最多補一次 =====
        int attempts = parallel;
        if (BatchRetryPolicy.shouldRetryOrchestration(unique.size(), targetCount, attempts, cfg.getMaxAttempts())) {
            attempts++;
            log.info("generation_retry_batch category={} unique={} target={} attempt={}",
                    categoryName, unique.size(), targetCount, attempts);

            Future<List<ScoredCandidate>> f = executor.submit(() -> runBatch(client, categoryName, parallel + 1));
            List<ScoredCandidate> extra = await(f, System.nanoTime() + timeoutNanos, categoryName, parallel + 1, List.of(f), request);
            if (extra == null) {
                failed++;
            } else {
                ok++;
                Set<String> seen = new HashSet<>(corpus);
                for (ScoredCandidate c : unique) seen.add(PhraseDeduplicator.normalize(c.text()));

                List<ScoredCandidate> added = dedup.dedupe(extra, ScoredCandidate::text, seen);
                List<ScoredCandidate> merged = new ArrayList<>(unique.size() + added.size());
                merged.addAll(unique);
                merged.addAll(added);
                unique = merged;
                log.info("generation_retry_batch_done category={} added={} unique={}", categoryName, added.size(), unique.size());
            }
        }

        if (unique.isEmpty()) {
            throw failRequest(request, new EmptyAfterDedupException());
        }

        // ===== persist（只寫這一次） =====
        List<GeneratedPhraseEntity> saved = store.savePhrases(toEntities(unique, categoryName));
        if (saved.isEmpty()) {
            throw failRequest(request, new EmptyAfterDedupException());
        }

        request.markGenerated(saved.size());
        store.saveRequest(request);

        log.info("generation_done category={} requestId={} accepted={} target={} attempts={} okBatches={} failedBatches={}",
                categoryName, request.getId(), saved.size(), targetCount, attempts, ok, failed);
        return new GenerationResult(categoryName, request.getId(), saved, targetCount, attempts, ok, failed);
    }

    // ===== batch =====

    private List<ScoredCandidate> runBatch(GenerationClient client, String categoryName, int batchNo) {
        QuotaStatus st = ledger.canMakeRequest();
        if (!st.allowed()) {
            // 還沒送出，不算 attempt
            throw new QuotaExceededException(QuotaLedger.MSG_DAILY_LIMIT, ledger.secondsUntilReset(), "WAIT_TOMORROW");
        }

        try {
            List<ScoredCandidate> r = batchGenerator.generate(client, categoryName, props.getBatch().getBatchSize());
            log.info("batch_done category={} batch={} items={}", categoryName, batchNo, r.size());
            return r;
        } finally {
            // ✅ 送出去就算一次，不管成功失敗
            safeRecordAttempt(categoryName, batchNo);
        }
    }

    private void safeRecordAttempt(String categoryName, int batchNo) {
        try {
            ledger.recordAttempt();
        } catch (RuntimeException e) {
            log.warn("quota_record_attempt_failed category={} batch={} err={}", categoryName, batchNo, e.toString());
        }
    }

    /**
     * @return null 代表這個 batch 失敗（已 log）；被 interrupt 時 cancel 全部並丟 GenerationCancelledException
     */
    private List<ScoredCandidate> await(Future<List<ScoredCandidate>> f, long deadlineNanos,
                                        String categoryName, int batchNo,
                                        List<Future<List<ScoredCandidate>>> siblings,
                                        CategoryRequestEntity request) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return f.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("batch_failed category={} batch={} errorCode=PROVIDER_TIMEOUT msg=deadline exceeded", categoryName, batchNo);
            return null;
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() == null) ? e : e.getCause();
            String code = (cause instanceof QuotaExceededException)
                    ? "QUOTA_EXCEEDED"
                    : ProviderErrorMapper.map(cause).code().name();
            log.warn("batch_failed category={} batch={} errorCode={} msg={}", categoryName, batchNo, code, cause.getMessage());
            return null;
        } catch (CancellationException e) {
            log.warn("batch_failed category={} batch={} errorCode=CANCELLED", categoryName, batchNo);
            return null;
        } catch (InterruptedException e) {
            for (Future<?> s : siblings) s.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("generation_cancelled category={} batch={}", categoryName, batchNo);
            throw failRequest(request, new GenerationCancelledException("Generation cancelled.", e));
        }
    }

    // ===== request lifecycle =====

    /**
     * 同名類別共用一筆 request：
     * - 沒有：直接建 CONFIRMED
     * - PENDING：轉 CONFIRMED
     * - 終態（GENERATED / FAILED）：同 id 換一筆新的，重新開始
     */
    private CategoryRequestEntity openRequest(String categoryName, List<String> sampleWords,
                                              String description, List<String> tags) {
        String id = CategoryIds.requestIdFor(categoryName);
        CategoryRequestEntity existing = store.getRequest(id).orElse(null);

        CategoryRequestEntity req;
        if (existing == null || existing.getStatus() == null || existing.getStatus().isTerminal()) {
            req = new CategoryRequestEntity();
            req.setId(id);
            req.setCategoryName(categoryName);
            req.setRequestedAtUtc(clock.instant());
            req.setStatus(CategoryRequestStatus.CONFIRMED);
            if (existing != null) {
                req.setSampleWords(new ArrayList<>(existing.getSampleWords()));
                req.setDescription(existing.getDescription());
                req.setTags(new ArrayList<>(existing.getTags()));
            }
        } else {
            req = existing;
            if (req.getStatus() == CategoryRequestStatus.PENDING) {
                req.transitionTo(CategoryRequestStatus.CONFIRMED);
            }
        }

        if (sampleWords != null && !sampleWords.isEmpty()) req.setSampleWords(new ArrayList<>(sampleWords));
        if (description != null) req.setDescription(description);
        if (tags != null) req.setTags(new ArrayList<>(tags));

        return store.saveRequest(req);
    }

    private RuntimeException failRequest(CategoryRequestEntity request, RuntimeException cause) {
        try {
            request.markFailed(cause.getMessage());
            store.saveRequest(request);
        } catch (RuntimeException e) {
            log.warn("request_mark_failed_error requestId={} err={}", request.getId(), e.toString());
            cause.addSuppressed(e);
        }
        return cause;
    }

    private List<GeneratedPhraseEntity> toEntities(List<ScoredCandidate> accepted, String categoryName) {
        Instant now = clock.instant();
        Set<String> ids = new HashSet<>();
        List<GeneratedPhraseEntity> out = new ArrayList<>(accepted.size());

        for (ScoredCandidate c : accepted) {
            String id = c.id();
            for (int n = 2; !ids.add(id); n++) id = c.id() + "_" + n;

            PhraseScore s = c.score();
            GeneratedPhraseEntity e = new GeneratedPhraseEntity();
            e.setId(id);
            e.setText(c.text());
            e.setTextKey(PhraseDeduplicator.normalize(c.text()));
            e.setCustomCategory(categoryName);
            e.setProvider(c.provider());
            e.setQualityScore(s.total());
            e.setLexicalScore(s.breakdown().lexical());
            e.setCategoryBoost(s.breakdown().categoryBoost());
            e.setEncyclopediaScore(s.breakdown().encyclopedia());
            e.setEngagementScore(s.breakdown().engagement());
            e.setScoringError(s.breakdown().error());
            e.setDifficulty(c.difficulty());
            e.setCreatedAtUtc(now);
            out.add(e);
        }
        return out;
    }
}
