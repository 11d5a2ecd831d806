package com.wordsonphone.backend.customcategory.scoring;

import com.wordsonphone.backend.customcategory.scoring.booster.QualityBooster;
import com.wordsonphone.backend.customcategory.scoring.booster.QualityBooster.BoosterKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * 派對遊戲題目的品質分數（0~100；不跑 booster 時 0~55）。
 * <ul>
 *   <li>lexical（0~40）：短字、常用字、字數少、近年話題字</li>
 *   <li>categoryBoost（0~15）：流行文化類別加分，科技/學術類別扣分，品牌字加分</li>
 *   <li>encyclopedia（0~30）/ engagement（0~15）：外部 booster，只有 useBoosters=true 才查</li>
 * </ul>
 * 不跑 booster 時滿分直接就是 55，不把 booster 的權重分給其他項。
 */
@Slf4j
@Service
public class PhraseScorer {

    public static final double WEIGHT_LEXICAL = 40;
    public static final double WEIGHT_CATEGORY = 15;
    public static final double MAX_LOCAL = WEIGHT_LEXICAL + WEIGHT_CATEGORY;
    public static final double MAX_TOTAL = 100;

    private static final double WORD_SIMPLICITY_CAP = 25;
    private static final double WORD_SIMPLICITY_SCALE = 4.5;
    private static final double RECENCY_CAP = 10;

    private final List<QualityBooster> boosters;

    @Autowired
    public PhraseScorer(ObjectProvider<QualityBooster> boosters) {
        this(boosters.orderedStream().toList());
    }

    public PhraseScorer(List<QualityBooster> boosters) {
        this.boosters = (boosters == null) ? List.of() : List.copyOf(boosters);
    }

    public PhraseScore score(String text, String category, boolean useBoosters) {
        String safeText = (text == null) ? "" : text;
        String safeCategory = (category == null) ? "" : category;

        double lexical = lexicalScore(safeText);
        double boost = categoryBoost(safeText, safeCategory);

        if (!useBoosters) {
            double total = clamp(lexical + boost, 0, MAX_LOCAL);
            return new PhraseScore(safeText, safeCategory, total,
                    ScoreBreakdown.localOnly(lexical, boost), Verdict.of(total), false);
        }

        Double encyclopedia = null;
        Double engagement = null;
        List<String> errors = new ArrayList<>();

        for (QualityBooster b : boosters) {
            double pts = boosterPoints(b, safeText, errors);
            if (b.kind() == BoosterKind.ENCYCLOPEDIA) encyclopedia = pts;
            else if (b.kind() == BoosterKind.ENGAGEMENT) engagement = pts;
        }

        double total = clamp(lexical + boost
                             + (encyclopedia == null ? 0 : encyclopedia)
                             + (engagement == null ? 0 : engagement), 0, MAX_TOTAL);

        String error = errors.isEmpty() ? null : String.join("; ", errors);
        return new PhraseScore(safeText, safeCategory, total,
                new ScoreBreakdown(lexical, boost, encyclopedia, engagement, error),
                Verdict.of(total), true);
    }

    /** 依分數由高到低；同分保持輸入順序 */
    public List<PhraseScore> scoreAll(List<String> texts, String category, boolean useBoosters) {
        if (texts == null || texts.isEmpty()) return List.of();
        List<PhraseScore> out = new ArrayList<>(texts.size());
        for (String t : texts) out.add(score(t, category, useBoosters));
        out.sort(Comparator.comparingDouble(PhraseScore::total).reversed());
        return out;
    }

    public List<PhraseScore> filterByQuality(List<String> texts, String category, double minScore, boolean useBoosters) {
        return scoreAll(texts, category, useBoosters).stream()
                .filter(s -> s.total() >= minScore)
                .toList();
    }

    // ===== sub-scores =====

    double lexicalScore(String text) {
        if (text == null || text.isBlank()) return 0;

        String lower = text.toLowerCase(Locale.ROOT);
        String[] words = Arrays.stream(lower.trim().split("\\s+"))
                .filter(w -> !w.isEmpty())
                .toArray(String[]::new);
        if (words.length == 0) return 0;

        // 1) word simplicity（0~25）
        double sum = 0;
        for (String w : words) sum += wordPoints(w);
        double avg = sum / words.length;
        double score = Math.min(avg * WORD_SIMPLICITY_SCALE, WORD_SIMPLICITY_CAP);

        // 2) 字數越少越好（1~10）
        if (words.length <= 2) score += 10;
        else if (words.length <= 3) score += 8;
        else if (words.length <= 4) score += 5;
        else score += 1;

        // 3) 近年話題（0~10）
        int recent = 0;
        for (String indicator : ScoringVocabulary.RECENT_INDICATORS) {
            if (lower.contains(indicator)) recent++;
        }
        score += Math.min(recent * 5.0, RECENCY_CAP);

        // 4) 短而完整（+5）
        if (words.length <= 4 && Arrays.stream(words).allMatch(w -> w.length() >= 2)) {
            score += 5;
        }

        return clamp(score, 0, WEIGHT_LEXICAL);
    }

    double categoryBoost(String text, String category) {
        double boost = 0;

        if (ScoringVocabulary.POP_CULTURE_CATEGORIES.contains(category)) {
            boost += 10;
        }

        String lowerCategory = category.toLowerCase(Locale.ROOT);
        String lowerText = text.toLowerCase(Locale.ROOT);

        if (lowerCategory.contains("movie") || lowerCategory.contains("tv")) {
            boost += 10;
        } else if (lowerCategory.contains("food") || lowerCategory.contains("drink")) {
            boost += 10;
        } else if (lowerCategory.contains("sport")) {
            boost += 8;
        } else if (lowerCategory.contains("music")) {
            boost += 8;
        } else if (lowerCategory.contains("science") || lowerCategory.contains("technology")) {
            boost -= 5;
        }

        for (String brand : ScoringVocabulary.BRAND_TOKENS) {
            if (lowerText.contains(brand)) {
                boost += 5;
                break;
            }
        }

        // 扣分可以抵銷加分，但最後不會變負的
        return clamp(boost, 0, WEIGHT_CATEGORY);
    }

    private static double wordPoints(String w) {
        if (ScoringVocabulary.COMMON_WORDS.contains(w)) return 6;
        if (w.length() <= 4) return 5;
        if (w.length() <= 6) return 4;
        if (w.length() <= 8) return 3;
        return 1;
    }

    private static double boosterPoints(QualityBooster b, String text, List<String> errors) {
        try {
            int pts = b.points(text);
            return clamp(pts, 0, b.kind().maxPoints());
        } catch (RuntimeException e) {
            log.warn("booster_failed kind={} text={} err={}", b.kind(), text, e.toString());
            errors.add(b.kind().name() + " lookup failed: " + safeMsg(e));
            return 0;
        }
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(v, max));
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
