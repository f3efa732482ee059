package com.trucksafe.elp.source;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Thin client over the Socrata SODA API on data.transportation.gov.
 *
 * One call returns one page of rows as JSON objects. Socrata omits keys whose
 * value is null, so two rows of the same dataset can have different key sets.
 *
 * The public endpoint throttles anonymous callers; an app token raises the
 * limit. A 429 or 5xx triggers the Resilience4j retry with exponential backoff.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SocrataApiClient {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ElpAggregatorProperties properties;

    /**
     * Fetch one page of a dataset.
     *
     * @param dataset four-by-four dataset id, e.g. "876r-jsdb"
     * @param where   SoQL filter, blank for none
     * @param order   SoQL order clause; paging is only stable with one
     * @param offset  rows to skip
     * @param limit   page size
     * @return rows of the page (empty past the end, never null)
     */
    @Retry(name = "socrataApi")
    public List<Map<String, Object>> fetchPage(String dataset, String where, String order, int offset, int limit) {
        ElpAggregatorProperties.Source.Api api = properties.getSource().getApi();

        UriComponentsBuilder builder = UriComponentsBuilder
                .fromHttpUrl(api.getBaseUrl() + "/resource/" + dataset + ".json")
                .queryParam("$limit", limit)
                .queryParam("$offset", offset)
                .queryParam("$order", order);
        if (where != null && !where.isBlank()) {
            builder.queryParam("$where", where);
        }

        return callApi(builder.build().encode().toUri(), api.getAppToken());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<Map<String, Object>> callApi(URI uri, String appToken) {
        log.debug("Calling Socrata API: {}", uri);

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (appToken != null && !appToken.isBlank()) {
            headers.set("X-App-Token", appToken);
        }

        try {
            applyRateLimit();
            ResponseEntity<List<Map<String, Object>>> response =
                    restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), ROWS);
            List<Map<String, Object>> body = response.getBody();
            if (body == null) {
                return Collections.emptyList();
            }
            log.debug("API returned {} rows for {}", body.size(), uri);
            return body;

        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No data found (404) for {}", uri);
            return Collections.emptyList();

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by Socrata, backing off before retry");
            sleepMs(5000);
            throw e;

        } catch (RuntimeException e) {
            log.error("API call failed for {}: {}", uri, e.getMessage());
            throw e;
        }
    }

    private void applyRateLimit() {
        sleepMs(properties.getSource().getApi().getRateLimitDelayMs());
    }

    private void sleepMs(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
