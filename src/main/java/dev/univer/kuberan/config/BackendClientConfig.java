package dev.univer.kuberan.config;

import dev.univer.kuberan.service.BackendProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class BackendClientConfig {

    private final BackendProperties props;

    /** Reads and writes against the Kuberan API. */
    @Bean
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder) {
        log.info("Kuberan API at {} (read timeout {})", props.getBaseUrl(), props.getReadTimeout());
        return build(builder, props.getReadTimeout());
    }

    /** Activity pings are fire-and-forget and get a shorter budget. */
    @Bean
    public RestTemplate activityRestTemplate(RestTemplateBuilder builder) {
        return build(builder, props.getActivityTimeout());
    }

    private RestTemplate build(RestTemplateBuilder builder, Duration readTimeout) {
        return builder
                .rootUri(props.getBaseUrl())
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(readTimeout)
                .additionalInterceptors(loggingInterceptor())
                .build();
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long start = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("{} {} -> {} in {}ms", request.getMethod(), request.getURI().getPath(),
                    response.getStatusCode(), System.currentTimeMillis() - start);
            return response;
        };
    }
}
