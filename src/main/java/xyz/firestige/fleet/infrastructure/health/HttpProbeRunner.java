package xyz.firestige.fleet.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP 探针：GET 返回 2xx 表示健康
 * <p>
 * 连接与读取超时由 RestTemplate 的请求工厂决定，整体截止时间由 {@link HealthCheckService} 控制
 */
public class HttpProbeRunner implements ProbeRunner {

    private static final Logger log = LoggerFactory.getLogger(HttpProbeRunner.class);

    private final RestTemplate restTemplate;

    public HttpProbeRunner(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public ProbeResult run(String url, Duration timeout) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            log.debug("HTTP probe {} -> {}", url, response.getStatusCode());
            return response.getStatusCode().is2xxSuccessful()
                    ? ProbeResult.ok()
                    : ProbeResult.unhealthy("HTTP " + response.getStatusCode().value());
        } catch (RestClientException e) {
            return ProbeResult.unhealthy("HTTP 探针失败: " + e.getMessage());
        }
    }
}
