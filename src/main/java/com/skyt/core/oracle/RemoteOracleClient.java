package com.skyt.core.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * RemoteOracleClient: delegates validation to an external test harness over HTTP.
 *
 * POST {base-url}/validate with {code, contract_id, timeout_ms}; the harness
 * answers {passed, pass_rate, detail}. The HTTP read timeout is the caller's
 * timeout plus a small margin, so a hung harness still yields a failed result.
 */
@Component
@Profile("remote-oracle")
public class RemoteOracleClient implements Oracle {

    private static final Logger log = LoggerFactory.getLogger(RemoteOracleClient.class);

    private static final long TRANSPORT_MARGIN_MS = 2000;

    private final String       baseUrl;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RestTemplateBuilder restTemplateBuilder;

    public RemoteOracleClient(
            @Value("${skyt.oracle.remote.base-url}") String baseUrl,
            RestTemplateBuilder restTemplateBuilder
    ) {
        this.baseUrl             = baseUrl;
        this.restTemplateBuilder = restTemplateBuilder;
        log.info("[RemoteOracle] Harness: {}", baseUrl);
    }

    @Override
    public OracleResult validate(String code, Contract contract, long timeoutMillis) {
        RestTemplate restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(Math.min(timeoutMillis, 5000)))
                .setReadTimeout(Duration.ofMillis(timeoutMillis + TRANSPORT_MARGIN_MS))
                .build();

        Map<String, Object> body = new HashMap<>();
        body.put("code",        code);
        body.put("contract_id", contract != null ? contract.getId() : null);
        body.put("timeout_ms",  timeoutMillis);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(baseUrl + "/validate", new HttpEntity<>(body, headers), String.class);
            JsonNode root = objectMapper.readTree(response.getBody());

            boolean passed = root.path("passed").asBoolean(false);
            double  rate   = root.has("pass_rate") ? root.get("pass_rate").asDouble() : (passed ? 1.0 : 0.0);
            String  detail = root.path("detail").asText("");
            return new OracleResult(passed, rate, detail);

        } catch (RestClientException e) {
            log.error("[RemoteOracle] Call failed: {}", e.getMessage());
            return OracleResult.fail(0.0, "Remote oracle unavailable: " + e.getMessage());
        } catch (Exception e) {
            log.error("[RemoteOracle] Unreadable response: {}", e.getMessage());
            return OracleResult.fail(0.0, "Remote oracle response unreadable: " + e.getMessage());
        }
    }
}
