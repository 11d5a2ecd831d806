package com.wordsonphone.backend.customcategory.provider.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * LLM 回的 JSON 常見問題：
 * 1) 包在 ```json ... ``` 裡
 * 2) 前後夾說明文字
 * 3) 尾巴多一個逗號 [ "a", "b", ]
 * 4) 被截斷，少了最後的 ] 或 }
 * 這裡盡量救回第一個完整的 array / object；真的救不回來就回 null，由呼叫端決定要不要 fallback。
 */
public final class LenientJsonExtractor {

    private static final int PREVIEW_LEN = 200;

    private LenientJsonExtractor() {}

    /** 第一個 { 或 [ 開始的 payload */
    public static JsonNode tryParse(ObjectMapper om, String raw) {
        return parsePayload(om, extractFirstJsonPayload(clean(raw), '{', '['));
    }

    /**
     * 只找 array（prompt-based provider 要的是字串陣列，前面的 {...} 說明不算）。
     * 依序試每一個 [，回第一個至少有一個字串元素的；像 "Here are [2] phrases: [...]" 前面的 [2] 會被跳過。
     */
    public static JsonNode tryParseStringArray(ObjectMapper om, String raw) {
        String s = clean(raw);
        for (int i = s.indexOf('['); i >= 0; i = s.indexOf('[', i + 1)) {
            JsonNode n = parsePayload(om, extractPayloadAt(s, i));
            if (n != null && n.isArray() && hasTextual(n)) return n;
        }
        return null;
    }

    public static String safeOneLine200(String s) {
        if (s == null) return null;
        String t = s.replace("\r", " ").replace("\n", " ").trim();
        return (t.length() > PREVIEW_LEN) ? t.substring(0, PREVIEW_LEN) : t;
    }

    // ---- internals ----

    private static JsonNode parsePayload(ObjectMapper om, String payload) {
        if (payload == null || payload.isBlank()) return null;

        String fixed = removeTrailingCommas(balanceJsonIfNeeded(payload));
        try {
            return om.readTree(fixed);
        } catch (Exception ignore) {
            return null;
        }
    }

    static String clean(String s) {
        return stripFence(stripBomAndNulls(s));
    }

    static String stripBomAndNulls(String s) {
        if (s == null) return "";
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') s = s.substring(1);
        return s.replace("\u0000", "");
    }

    static String stripFence(String s) {
        if (s == null) return "";
        if (!s.contains("```")) return s.trim();

        int first = s.indexOf("```");
        int firstNl = s.indexOf('\n', first);
        if (firstNl > 0) s = s.substring(firstNl + 1);
        int lastFence = s.lastIndexOf("```");
        if (lastFence >= 0) s = s.substring(0, lastFence);
        return s.trim();
    }

    /**
     * 從第一個 openA / openB 開始，掃到括號平衡為止（字串裡的括號不算）。
     * 沒平衡就回到結尾，交給 balanceJsonIfNeeded 補。
     */
    static String extractFirstJsonPayload(String s, char openA, char openB) {
        if (s == null) return null;

        int iA = s.indexOf(openA);
        int iB = s.indexOf(openB);

        int start;
        if (iA < 0 && iB < 0) return null;
        if (iA < 0) start = iB;
        else if (iB < 0) start = iA;
        else start = Math.min(iA, iB);

        return extractPayloadAt(s, start);
    }

    static String extractPayloadAt(String s, int start) {
        boolean inString = false;
        boolean escaped = false;
        int brace = 0;
        int bracket = 0;

        for (int i = start; i < s.length(); i++) {
            char ch = s.charAt(i);

            if (escaped) { escaped = false; continue; }

            if (inString) {
                if (ch == '\\') { escaped = true; continue; }
                if (ch == '"') inString = false;
                continue;
            }

            if (ch == '"') { inString = true; continue; }
            if (ch == '{') brace++;
            else if (ch == '}') brace--;
            else if (ch == '[') bracket++;
            else if (ch == ']') bracket--;

            if (brace == 0 && bracket == 0) {
                return s.substring(start, i + 1).trim();
            }
        }

        return s.substring(start).trim();
    }

    private static boolean hasTextual(JsonNode arr) {
        for (JsonNode n : arr) {
            if (n != null && n.isTextual()) return true;
        }
        return false;
    }

    static String removeTrailingCommas(String s) {
        if (s == null) return null;
        String t = s.replaceAll(",\\s*([}\\]])", "$1");
        return t.replaceAll(",\\s*$", "");
    }

    static String balanceJsonIfNeeded(String s) {
        if (s == null || s.isBlank()) return s;

        boolean inString = false, escaped = false;
        Deque<Character> stack = new ArrayDeque<>();

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);

            if (escaped) { escaped = false; continue; }

            if (inString) {
                if (ch == '\\') escaped = true;
                else if (ch == '"') inString = false;
                continue;
            }

            if (ch == '"') { inString = true; continue; }

            if (ch == '{' || ch == '[') {
                stack.push(ch);
            } else if (ch == '}' || ch == ']') {
                if (!stack.isEmpty()) {
                    char top = stack.peek();
                    if ((top == '{' && ch == '}') || (top == '[' && ch == ']')) stack.pop();
                }
            }
        }

        StringBuilder out = new StringBuilder(s);
        // 截在字串中間：先把字串關掉
        if (inString) out.append('"');
        if (stack.isEmpty()) return out.toString();

        String t = removeTrailingCommas(out.toString());
        out = new StringBuilder(t);
        while (!stack.isEmpty()) {
            char open = stack.pop();
            out.append(open == '{' ? '}' : ']');
        }
        return out.toString();
    }
}
