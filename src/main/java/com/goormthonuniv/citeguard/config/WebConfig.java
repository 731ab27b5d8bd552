package com.goormthonuniv.citeguard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class WebConfig {

    /** 모든 외부 호출(URL 프로브, 권위 조회, DOI, LLM)이 공유하는 클라이언트. 타임아웃이 유일한 취소 수단. */
    @Bean
    public RestClient restClient(RestClient.Builder builder,
                                 @Value("${citeguard.api.timeout-ms:10000}") long timeoutMs) {
        HttpClient http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(http);
        factory.setReadTimeout(Duration.ofMillis(timeoutMs));
        return builder.requestFactory(factory).build();
    }

    /** 인용 단위 검증 fan-out 용 풀 */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService citationVerificationExecutor(@Value("${citeguard.verification.pool-size:8}") int poolSize) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "citation-verify-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(poolSize, tf);
    }
}
