package com.gaia.adapter.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaia.config.RemoteExecutorConfig;
import com.gaia.core.ExecutionResult;
import com.gaia.core.ExecutionStatus;
import com.gaia.core.TestExecutor;
import com.gaia.core.TestItem;
import com.gaia.exception.ExecutionException;
import com.gaia.scheduler.DomSignatures;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes test items on the remote browser-automation host.
 * <p>
 * Protocol: POST {@code {hostUrl}/execute} with
 * {@code {"action":"execute_scenario","params":{"scenario":...}}}. After a
 * successful scenario with a target URL, the page is analysed with
 * {@code {"action":"analyze_page","params":{"url":...}}} to derive the DOM
 * signature and element count.
 * <p>
 * Non-200 responses are retryable failures. Transport errors are fatal for the item.
 */
public class RemoteTestExecutor implements TestExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RemoteTestExecutor.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final RemoteExecutorConfig config;
    private final CloseableHttpClient httpClient;
    private final String executeUrl;

    public RemoteTestExecutor(RemoteExecutorConfig config) {
        this(config, HttpClients.createDefault());
    }

    public RemoteTestExecutor(RemoteExecutorConfig config, CloseableHttpClient httpClient) {
        this.config = config;
        this.httpClient = httpClient;
        this.executeUrl = config.hostUrl() + "/execute";
        log.info("RemoteTestExecutor targeting {}", executeUrl);
    }

    @Override
    public ExecutionResult execute(TestItem item) {
        Map<String, Object> scenario = ScenarioMapper.toScenario(item);
        Map<String, Object> request = Map.of(
                "action", "execute_scenario",
                "params", Map.of("scenario", scenario)
        );

        try {
            RemoteResponse response = post(request, config.requestTimeoutSeconds());
            if (response.statusCode() != 200) {
                log.warn("Remote host returned {} for item {}", response.statusCode(), item.getId());
                return ExecutionResult.failed("Remote host returned " + response.statusCode());
            }

            Map<String, Object> body = response.body();
            Object rawStatus = body.get("status");
            ExecutionStatus status = ExecutionStatus.fromValue(rawStatus != null ? rawStatus.toString() : null);

            ExecutionResult.Builder result = ExecutionResult.builder()
                    .status(status)
                    .newElements(0)
                    .detail("logs", body.getOrDefault("logs", List.of()))
                    .detail("remote_result", body);

            if (status == ExecutionStatus.SUCCESS && item.hasTargetUrl()) {
                analyzePage(item.getTargetUrl()).ifPresent(dom -> result
                        .domSignature(DomSignatures.compute(dom))
                        .newElements(DomSignatures.elementCount(dom)));
            }
            return result.build();
        } catch (IOException | ExecutionException e) {
            log.warn("Remote execution failed for item {}: {}", item.getId(), e.getMessage());
            return ExecutionResult.fatal(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Ask the host to analyse a page.
     *
     * @return DOM data, or empty if the host could not analyse it
     */
    Optional<Map<String, Object>> analyzePage(String url) {
        Map<String, Object> request = Map.of(
                "action", "analyze_page",
                "params", Map.of("url", url)
        );
        try {
            RemoteResponse response = post(request, config.analyzeTimeoutSeconds());
            if (response.statusCode() == 200) {
                return Optional.of(response.body());
            }
            log.debug("Page analysis of {} returned {}", url, response.statusCode());
        } catch (IOException | ExecutionException e) {
            log.debug("Page analysis of {} failed: {}", url, e.getMessage());
        }
        return Optional.empty();
    }

    private RemoteResponse post(Map<String, Object> request, int timeoutSeconds) throws IOException {
        HttpPost post = new HttpPost(executeUrl);
        post.setConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofSeconds(timeoutSeconds))
                .setConnectionRequestTimeout(Timeout.ofSeconds(timeoutSeconds))
                .build());
        post.setEntity(new StringEntity(objectMapper.writeValueAsString(request), ContentType.APPLICATION_JSON));

        return httpClient.execute(post, response -> {
            int code = response.getCode();
            if (code != 200) {
                return new RemoteResponse(code, Map.of());
            }
            String json = response.getEntity() != null
                    ? EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)
                    : "";
            return new RemoteResponse(code, parseBody(json));
        });
    }

    private static Map<String, Object> parseBody(String json) {
        if (json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new ExecutionException("Remote host returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private record RemoteResponse(int statusCode, Map<String, Object> body) {
    }
}
