package com.wordsonphone.backend.customcategory.scoring;

import java.util.List;
import java.util.Set;

final class ScoringVocabulary {

    private ScoringVocabulary() {}

    static final Set<String> COMMON_WORDS = Set.of(
            "the", "and", "you", "that", "was", "for", "are", "with", "his", "they",
            "have", "this", "will", "one", "all", "were", "can", "had", "her", "what",
            "said", "there", "each", "which", "she", "how", "their", "time", "way",
            "about", "many", "then", "them", "these", "two", "more", "very", "know",
            "just", "first", "into", "over", "think", "also", "your", "work", "life",
            "only", "new", "years", "could", "other", "after", "world", "good", "right",
            "people", "where", "those", "come", "state", "system", "some", "because"
    );

    /** 完全比對（大小寫也要一樣），跟 App 內建類別名稱同步 */
    static final Set<String> POP_CULTURE_CATEGORIES = Set.of(
            "Movies & TV", "Music", "Video Games", "Social Media", "Internet Culture",
            "Sports", "Food & Drink", "Brands", "Places", "Animals"
    );

    /** substring 比對（小寫），所以 "ai" 也會命中 "chair"，已知行為 */
    static final List<String> RECENT_INDICATORS = List.of(
            "tiktok", "covid", "zoom", "biden", "trump", "ukraine", "climate", "ai",
            "chatgpt", "spotify", "netflix", "disney+", "squid game", "wordle",
            "nft", "crypto", "meta", "metaverse", "tesla", "elon musk", "taylor swift",
            "marvel", "fortnite", "instagram", "youtube", "twitch", "among us"
    );

    static final List<String> BRAND_TOKENS = List.of(
            "apple", "google", "facebook", "instagram", "tiktok", "youtube"
    );
}
