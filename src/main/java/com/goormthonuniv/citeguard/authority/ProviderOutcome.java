package com.goormthonuniv.citeguard.authority;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 외부 프로바이더 호출 한 번의 결과. 예외 대신 값으로 돌려서 폴백 체인이 순서대로 시도한다.
 * <ul>
 *   <li>SUCCESS: 값 있음</li>
 *   <li>UNAVAILABLE: 자격증명 없음. 호출 자체를 안 함</li>
 *   <li>FAILED: 호출했지만 실패. retryable 이면 재시도 대상</li>
 * </ul>
 */
public final class ProviderOutcome<T> {

    public enum Kind { SUCCESS, UNAVAILABLE, FAILED }

    private final Kind kind;
    private final T value;
    private final String reason;
    private final Integer statusCode;
    private final boolean retryable;

    private ProviderOutcome(Kind kind, T value, String reason, Integer statusCode, boolean retryable) {
        this.kind = kind;
        this.value = value;
        this.reason = reason;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static <T> ProviderOutcome<T> success(T value) {
        return success(value, null);
    }

    public static <T> ProviderOutcome<T> success(T value, Integer statusCode) {
        if (value == null) throw new IllegalArgumentException("success value must not be null");
        return new ProviderOutcome<>(Kind.SUCCESS, value, null, statusCode, false);
    }

    public static <T> ProviderOutcome<T> unavailable(String reason) {
        return new ProviderOutcome<>(Kind.UNAVAILABLE, null, reason, null, false);
    }

    public static <T> ProviderOutcome<T> failed(String reason, Integer statusCode, boolean retryable) {
        return new ProviderOutcome<>(Kind.FAILED, null, reason, statusCode, retryable);
    }

    /** I/O, 타임아웃, 5xx 는 재시도 대상. 4xx 와 그 밖의 예외는 아니다. */
    public static <T> ProviderOutcome<T> fromException(Exception e) {
        if (e instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            return failed("HTTP " + status, status, status >= 500);
        }
        if (e instanceof ResourceAccessException) {
            return failed(String.valueOf(e.getMessage()), null, true);
        }
        return failed(e.getClass().getSimpleName() + ": " + e.getMessage(), null, false);
    }

    public Kind kind() { return kind; }

    public boolean isSuccess() { return kind == Kind.SUCCESS; }

    public boolean isUnavailable() { return kind == Kind.UNAVAILABLE; }

    public boolean isRetryable() { return kind == Kind.FAILED && retryable; }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public T get() {
        if (value == null) throw new NoSuchElementException("no value: " + kind + " " + reason);
        return value;
    }

    public String reason() { return reason; }

    public Integer statusCode() { return statusCode; }

    /** 모니터링 errorType 태그용 */
    public String errorType() {
        if (kind != Kind.FAILED) return null;
        if (statusCode != null) return statusCode >= 500 ? "server_error" : "client_error";
        return retryable ? "network_error" : "unexpected";
    }

    @Override
    public String toString() {
        return isSuccess() ? "SUCCESS(" + value + ")" : kind + "(" + reason + ")";
    }
}
