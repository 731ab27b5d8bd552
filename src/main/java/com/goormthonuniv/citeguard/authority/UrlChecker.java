package com.goormthonuniv.citeguard.authority;

import com.goormthonuniv.citeguard.dto.UrlValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.StringEscapeUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL 도달성 확인.
 * 형식 검사 → HEAD → (2xx text/html 이면) GET 으로 &lt;title&gt; 추출. 본문은 앞 8KB 만 읽는다.
 * 제목 추출 실패는 결과를 무효로 만들지 않는다.
 */
@Slf4j
@Component
public class UrlChecker {

    /** 제목은 문서 앞부분에만 있다고 보고 이만큼만 읽는다 */
    static final int TITLE_SCAN_LIMIT = 8 * 1024;

    private static final Pattern TITLE = Pattern.compile("<title[^>]*>([^<]+)</title>", Pattern.CASE_INSENSITIVE);

    private final RestClient rest;

    public UrlChecker(RestClient rest) {
        this.rest = rest;
    }

    public UrlValidationResult check(String url) {
        long start = System.currentTimeMillis();

        URI uri = parse(url);
        if (uri == null) {
            return new UrlValidationResult(url, false, false, null, null, null, null, false,
                    List.of("Invalid URL format"), Instant.now(), System.currentTimeMillis() - start);
        }
        boolean secure = "https".equalsIgnoreCase(uri.getScheme());

        HeadResponse head;
        try {
            head = rest.head()
                    .uri(uri)
                    .exchange((req, res) -> new HeadResponse(
                            res.getStatusCode().value(),
                            res.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE),
                            res.getHeaders().getFirst(HttpHeaders.LAST_MODIFIED)));
        } catch (Exception e) {
            log.debug("URL check failed for {}: {}", url, e.getMessage());
            String error = e.getMessage() == null ? "Network error" : e.getMessage();
            return new UrlValidationResult(url, true, false, null, null, null, null, secure,
                    List.of(error), Instant.now(), System.currentTimeMillis() - start);
        }

        boolean accessible = head.status() < 400;
        UrlValidationResult result = new UrlValidationResult(
                url,
                true,
                accessible,
                head.status(),
                head.contentType(),
                null,
                head.lastModified(),
                secure,
                accessible ? List.of() : List.of("HTTP " + head.status()),
                Instant.now(),
                System.currentTimeMillis() - start
        );

        if (head.status() >= 200 && head.status() < 300 && isHtml(head.contentType())) {
            String title = fetchTitle(uri);
            if (title != null) result = result.withTitle(title);
        }
        return result;
    }

    String fetchTitle(URI uri) {
        try {
            String html = rest.get().uri(uri).exchange((req, res) -> {
                if (!res.getStatusCode().is2xxSuccessful()) return null;
                MediaType type = res.getHeaders().getContentType();
                Charset charset = type != null && type.getCharset() != null ? type.getCharset() : StandardCharsets.UTF_8;
                try (InputStream body = res.getBody()) {
                    return new String(body.readNBytes(TITLE_SCAN_LIMIT), charset);
                }
            });
            if (html == null) return null;
            Matcher m = TITLE.matcher(html);
            if (!m.find()) return null;
            String title = StringEscapeUtils.unescapeHtml4(m.group(1)).strip();
            return title.isEmpty() ? null : title;
        } catch (Exception e) {
            log.warn("Failed to extract title from {}: {}", uri, e.getMessage());
            return null;
        }
    }

    static URI parse(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) return null;
            String s = scheme.toLowerCase(Locale.ROOT);
            return s.equals("http") || s.equals("https") ? uri : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static boolean isHtml(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html");
    }

    private record HeadResponse(int status, String contentType, String lastModified) {}
}
