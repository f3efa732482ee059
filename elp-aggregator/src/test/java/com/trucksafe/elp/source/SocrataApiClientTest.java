package com.trucksafe.elp.source;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SocrataApiClientTest {

    private static final String BASE = "https://data.example.gov";

    private MockRestServiceServer server;
    private ElpAggregatorProperties properties;
    private SocrataApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new ElpAggregatorProperties();
        properties.getSource().getApi().setBaseUrl(BASE);
        properties.getSource().getApi().setRateLimitDelayMs(0);
        client = new SocrataApiClient(restTemplate, properties);
    }

    @Test
    @DisplayName("requests one page with limit, offset and order")
    void pageRequest() {
        server.expect(requestTo(startsWith(BASE + "/resource/876r-jsdb.json")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("$limit", "100"))
                .andExpect(queryParam("$offset", "200"))
                .andExpect(queryParam("$order", ":id"))
                .andRespond(withSuccess("""
                        [{"inspection_id": "1", "part_no": "391"},
                         {"inspection_id": "2", "part_no": "392", "oos_indicator": true}]
                        """, MediaType.APPLICATION_JSON));

        List<Map<String, Object>> rows = client.fetchPage("876r-jsdb", "", ":id", 200, 100);

        server.verify();
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsEntry("inspection_id", "1");
        assertThat(rows.get(1)).containsEntry("oos_indicator", true);
    }

    @Test
    @DisplayName("sends the app token when one is configured")
    void appToken() {
        properties.getSource().getApi().setAppToken("secret");
        server.expect(requestTo(startsWith(BASE)))
                .andExpect(header("X-App-Token", "secret"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThat(client.fetchPage("fx4q-ay7w", null, ":id", 0, 10)).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("a where clause is passed through as a query parameter")
    void whereClause() {
        server.expect(requestTo(startsWith(BASE)))
                .andExpect(request -> assertThat(request.getURI().getRawQuery()).contains("$where="))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        client.fetchPage("876r-jsdb", "part_no='391'", ":id", 0, 10);
        server.verify();
    }

    @Test
    @DisplayName("a missing dataset reads as an empty page")
    void notFound() {
        server.expect(requestTo(startsWith(BASE)))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.fetchPage("nope-nope", "", ":id", 0, 10)).isEmpty();
    }

    @Test
    @DisplayName("server errors propagate so the retry can act on them")
    void serverError() {
        server.expect(requestTo(startsWith(BASE)))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchPage("876r-jsdb", "", ":id", 0, 10))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
