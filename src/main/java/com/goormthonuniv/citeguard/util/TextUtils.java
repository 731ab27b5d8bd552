package com.goormthonuniv.citeguard.util;

import java.util.regex.Pattern;

public final class TextUtils {
    private static final Pattern CODE_FENCE_OPEN = Pattern.compile("^```[a-zA-Z]*\\s*");
    private static final Pattern CODE_FENCE_CLOSE = Pattern.compile("\\s*```$");
    private static final String TRAILING_PUNCT = ".,;:!?'\"";

    private TextUtils() {}

    /** 문장 끝 구두점/따옴표가 URL·DOI 끝에 붙어 잡힌 경우 떼어낸다 */
    public static String trimTrailingPunctuation(String token) {
        if (token == null) return "";
        int end = token.length();
        while (end > 0 && TRAILING_PUNCT.indexOf(token.charAt(end - 1)) >= 0) end--;
        return token.substring(0, end);
    }

    /** [start, end) 주변 radius 글자씩 포함한 스니펫 */
    public static String context(String text, int start, int end, int radius) {
        if (text == null || text.isEmpty()) return "";
        int from = Math.max(0, start - radius);
        int to = Math.min(text.length(), end + radius);
        return text.substring(from, to).strip();
    }

    public static String truncate(String text, int max) {
        if (text == null) return "";
        return text.length() > max ? text.substring(0, max) : text;
    }

    /** LLM 응답이 ```json ... ``` 으로 감싸져 오는 경우 */
    public static String stripCodeFence(String raw) {
        if (raw == null) return "";
        String t = raw.strip();
        if (!t.startsWith("```")) return t;
        t = CODE_FENCE_OPEN.matcher(t).replaceFirst("");
        return CODE_FENCE_CLOSE.matcher(t).replaceFirst("").strip();
    }
}
