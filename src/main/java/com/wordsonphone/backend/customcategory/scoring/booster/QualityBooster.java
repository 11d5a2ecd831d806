package com.wordsonphone.backend.customcategory.scoring.booster;

/**
 * 外部品質訊號（百科、社群熱度）。
 * 查不到就回 0；連線失敗、回應壞掉要丟例外，由 scorer 降級成 0 並記錄原因。
 */
public interface QualityBooster {

    BoosterKind kind();

    /** 0 ~ kind().maxPoints() 的分段分數 */
    int points(String text);

    enum BoosterKind {
        ENCYCLOPEDIA(30),
        ENGAGEMENT(15);

        private final int maxPoints;

        BoosterKind(int maxPoints) { this.maxPoints = maxPoints; }

        public int maxPoints() { return maxPoints; }
    }
}
