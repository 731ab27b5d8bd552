package com.goormthonuniv.citeguard.authority;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/** 권위/DOI 호출의 재시도. 일시적 실패만 다시 시도한다. */
@Slf4j
@Component
public class ApiRetryPolicy {

    private final int attempts;
    private final RetryRegistry registry;

    public ApiRetryPolicy(@Value("${citeguard.api.retry-attempts:3}") int attempts,
                          @Value("${citeguard.api.retry-delay-ms:1000}") long delayMs) {
        this.attempts = Math.max(1, attempts);
        RetryConfig config = RetryConfig.<ProviderOutcome<?>>custom()
                .maxAttempts(this.attempts)
                .waitDuration(Duration.ofMillis(Math.max(0, delayMs)))
                .retryOnResult(ProviderOutcome::isRetryable)
                // 공급자는 예외 대신 FAILED 결과를 돌려준다
                .retryOnException(e -> false)
                .build();
        this.registry = RetryRegistry.of(config);
        // API 이름별 인스턴스가 처음 만들어질 때 로그 리스너를 붙인다
        registry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onRetry(e -> log.debug("Retrying {} (attempt {}/{}) in {}ms",
                        e.getName(), e.getNumberOfRetryAttempts() + 1, this.attempts, e.getWaitInterval().toMillis())));
    }

    public int attempts() {
        return attempts;
    }

    public <T> ProviderOutcome<T> execute(String apiName, Supplier<ProviderOutcome<T>> call) {
        Retry retry = registry.retry(apiName);
        return Retry.decorateSupplier(retry, call).get();
    }
}
