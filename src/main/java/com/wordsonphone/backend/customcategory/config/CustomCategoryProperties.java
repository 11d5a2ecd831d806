package com.wordsonphone.backend.customcategory.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.custom-category")
public class CustomCategoryProperties {

    /** AUTO / OPENAI / GEMINI / STUB；AUTO = 有哪個 enabled 用哪個，OPENAI 優先 */
    private String provider = "AUTO";

    private final Quota quota = new Quota();
    private final Batch batch = new Batch();

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }

    public Quota getQuota() { return quota; }
    public Batch getBatch() { return batch; }

    public static class Quota {

        /** 每日可發出的生成呼叫次數（preview + 每個 batch 各算一次） */
        private int dailyLimit = 20;

        /** 「今天」用哪個時區切 */
        private String zone = "UTC";

        /**
         * ledger 讀不到時的行為：
         * - true：放行（可用性優先）
         * - false：擋下（配額嚴格）
         */
        private boolean failOpenOnReadError = true;

        public int getDailyLimit() { return dailyLimit; }
        public void setDailyLimit(int dailyLimit) { this.dailyLimit = dailyLimit; }

        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }

        public boolean isFailOpenOnReadError() { return failOpenOnReadError; }
        public void setFailOpenOnReadError(boolean failOpenOnReadError) { this.failOpenOnReadError = failOpenOnReadError; }
    }

    public static class Batch {

        private int parallelBatches = 3;
        private int batchSize = 15;
        private int targetCount = 30;

        /** orchestration 層的總嘗試上限（含第一輪 fan-out） */
        private int maxAttempts = 4;

        /** 單一 batch 的 deadline */
        private Duration callTimeout = Duration.ofSeconds(25);

        private int sampleWordsCount = 3;

        /** prompt-based provider 的 batch 內重打 */
        private int nestedMaxExtraAttempts = 2;
        private Duration nestedTimeBudget = Duration.ofSeconds(7);
        private double highQualityRatio = 0.5;

        /** 分數 >= 這個值算 high；不開 booster 時滿分只有 55 */
        private double highQualityThreshold = 35;
        private double mediumQualityThreshold = 25;

        public int getParallelBatches() { return parallelBatches; }
        public void setParallelBatches(int parallelBatches) { this.parallelBatches = parallelBatches; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public int getTargetCount() { return targetCount; }
        public void setTargetCount(int targetCount) { this.targetCount = targetCount; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getCallTimeout() { return callTimeout; }
        public void setCallTimeout(Duration callTimeout) { this.callTimeout = callTimeout; }

        public int getSampleWordsCount() { return sampleWordsCount; }
        public void setSampleWordsCount(int sampleWordsCount) { this.sampleWordsCount = sampleWordsCount; }

        public int getNestedMaxExtraAttempts() { return nestedMaxExtraAttempts; }
        public void setNestedMaxExtraAttempts(int nestedMaxExtraAttempts) { this.nestedMaxExtraAttempts = nestedMaxExtraAttempts; }

        public Duration getNestedTimeBudget() { return nestedTimeBudget; }
        public void setNestedTimeBudget(Duration nestedTimeBudget) { this.nestedTimeBudget = nestedTimeBudget; }

        public double getHighQualityRatio() { return highQualityRatio; }
        public void setHighQualityRatio(double highQualityRatio) { this.highQualityRatio = highQualityRatio; }

        public double getHighQualityThreshold() { return highQualityThreshold; }
        public void setHighQualityThreshold(double highQualityThreshold) { this.highQualityThreshold = highQualityThreshold; }

        public double getMediumQualityThreshold() { return mediumQualityThreshold; }
        public void setMediumQualityThreshold(double mediumQualityThreshold) { this.mediumQualityThreshold = mediumQualityThreshold; }
    }
}
