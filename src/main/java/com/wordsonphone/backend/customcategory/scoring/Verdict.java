package com.wordsonphone.backend.customcategory.scoring;

public enum Verdict {
    EXCELLENT(45, "Excellent - Perfect for party games"),
    GOOD(35, "Good - Suitable for gameplay"),
    FAIR(25, "Fair - May work but could be challenging"),
    POOR(15, "Poor - Likely too difficult or obscure"),
    REJECT(Double.NEGATIVE_INFINITY, "Reject - Not suitable for party games");

    private final double minScore;
    private final String label;

    Verdict(double minScore, String label) {
        this.minScore = minScore;
        this.label = label;
    }

    public double minScore() { return minScore; }
    public String label() { return label; }

    /** 由高往低比，第一個 >= 門檻的就是 */
    public static Verdict of(double total) {
        for (Verdict v : values()) {
            if (total >= v.minScore) return v;
        }
        return REJECT;
    }
}
