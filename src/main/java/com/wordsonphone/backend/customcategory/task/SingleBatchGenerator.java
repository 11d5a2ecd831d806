package com.wordsonphone.backend.customcategory.task;

import com.wordsonphone.backend.customcategory.config.CustomCategoryProperties;
import com.wordsonphone.backend.customcategory.model.CategoryIds;
import com.wordsonphone.backend.customcategory.provider.GeneratedItem;
import com.wordsonphone.backend.customcategory.provider.GenerationClient;
import com.wordsonphone.backend.customcategory.provider.GenerationClientException;
import com.wordsonphone.backend.customcategory.provider.GenerationRequest;
import com.wordsonphone.backend.customcategory.scoring.PhraseScore;
import com.wordsonphone.backend.customcategory.scoring.PhraseScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;

/**
 * 一個 batch = 一次（或含 nested retry 的數次）provider 呼叫 + local 評分。
 * <p>
 * nested retry 用明確的 loop：(extraAttempts, elapsed, highRatio)，
 * 只對 prompt-based provider 生效；structured provider 一次就收。
 * 第一次呼叫失敗直接往上丟（算這個 batch 失敗）；重打失敗就保留上一輪結果。
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SingleBatchGenerator {

    private final PhraseScorer scorer;
    private final CustomCategoryProperties props;
    private final Clock clock;

    public List<ScoredCandidate> generate(GenerationClient client, String category, int batchSize) {
        CustomCategoryProperties.Batch cfg = props.getBatch();
        long budgetMs = cfg.getNestedTimeBudget().toMillis();
        long startMs = clock.millis();

        List<ScoredCandidate> current = callAndScore(client, category, batchSize, startMs, 0);
        int extra = 0;

        while (true) {
            long elapsed = clock.millis() - startMs;
            QualityMetrics m = QualityMetrics.of(current, cfg.getHighQualityThreshold(), cfg.getMediumQualityThreshold(), elapsed);

            boolean retry = BatchRetryPolicy.shouldRetryNested(
                    client.structuredOutput(), extra, cfg.getNestedMaxExtraAttempts(),
                    elapsed, budgetMs, m.highRatio(), cfg.getHighQualityRatio());
            if (!retry) return current;

            extra++;
            log.info("batch_nested_retry category={} provider={} attempt={} highPct={}",
                    category, client.providerCode(), extra + 1, pct(m.highRatio()));
            try {
                current = callAndScore(client, category, batchSize, startMs, extra);
            } catch (GenerationClientException e) {
                log.warn("batch_nested_retry_failed category={} provider={} attempt={} errorCode={} keep={}",
                        category, client.providerCode(), extra + 1, e.code(), current.size());
                return current;
            }
        }
    }

    private List<ScoredCandidate> callAndScore(GenerationClient client, String category, int batchSize,
                                               long startMs, int attempt) {
        List<String> ids = newItemIds(batchSize);
        List<GeneratedItem> items = client.generateBatch(new GenerationRequest(category, batchSize, ids));

        long scoringStart = clock.millis();
        List<ScoredCandidate> scored = score(client.providerCode(), category, items, ids);

        CustomCategoryProperties.Batch cfg = props.getBatch();
        QualityMetrics m = QualityMetrics.of(scored, cfg.getHighQualityThreshold(), cfg.getMediumQualityThreshold(),
                clock.millis() - startMs);
        log.info("batch_quality category={} provider={} attempt={} total={} high={} medium={} low={} avg={} highPct={} scoringMs={} elapsedMs={}",
                category, client.providerCode(), attempt + 1, m.total(), m.high(), m.medium(), m.low(),
                String.format(Locale.ROOT, "%.1f", m.averageScore()), pct(m.highRatio()),
                clock.millis() - scoringStart, m.elapsedMs());
        return scored;
    }

    List<ScoredCandidate> score(String provider, String category, List<GeneratedItem> items, List<String> requestedIds) {
        Set<String> allowed = new HashSet<>(requestedIds);
        Set<String> used = new HashSet<>();
        long now = clock.millis();

        List<ScoredCandidate> out = new ArrayList<>(items.size());
        for (GeneratedItem it : items) {
            String text = (it.text() == null) ? "" : it.text().trim();
            if (text.isEmpty()) continue;

            // id 必須是這批發出去的其中一個，且不能重複；否則用 text+category+時間 補一個
            String id = it.id();
            if (id == null || !allowed.contains(id) || !used.add(id)) {
                String base = CategoryIds.fallbackPhraseId(text, category, now);
                id = base;
                for (int n = 2; !used.add(id); n++) id = base + "_" + n;
            }

            out.add(new ScoredCandidate(id, text, it.topic(), it.difficulty(), provider, safeScore(text, category)));
        }

        // stable：同分保持 provider 原本順序
        out.sort(Comparator.comparingDouble(ScoredCandidate::total).reversed());
        return out;
    }

    private PhraseScore safeScore(String text, String category) {
        try {
            return scorer.score(text, category, false);
        } catch (RuntimeException e) {
            log.warn("phrase_scoring_failed text={} category={} err={}", text, category, e.toString());
            return PhraseScore.fallback(text, category, "Scoring failed");
        }
    }

    private static List<String> newItemIds(int n) {
        List<String> ids = new ArrayList<>(n);
        for (int i = 0; i < n; i++) ids.add(UUID.randomUUID().toString());
        return ids;
    }

    private static String pct(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }
}
