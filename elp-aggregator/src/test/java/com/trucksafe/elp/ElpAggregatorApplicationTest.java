package com.trucksafe.elp;

import com.trucksafe.elp.config.ElpAggregatorProperties;
import com.trucksafe.elp.source.LocalCsvRecordSource;
import com.trucksafe.elp.source.RecordSource;
import com.trucksafe.elp.source.SocrataApiClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@SpringBootTest(properties = {
        "elp-aggregator.run-on-startup=false",
        "elp-aggregator.source.api.base-url=https://data.example.gov",
        "elp-aggregator.source.api.rate-limit-delay-ms=0",
        "resilience4j.retry.instances.socrataApi.wait-duration=10ms"
})
class ElpAggregatorApplicationTest {

    @Autowired
    private ElpAggregatorProperties properties;

    @Autowired
    private RecordSource recordSource;

    @Autowired
    private RestTemplate restTemplate;

    @Autowired
    private SocrataApiClient apiClient;

    @Test
    @DisplayName("defaults bind from application.yml")
    void defaults() {
        assertThat(properties.getAnalysis().getStartYear()).isEqualTo(2025);
        assertThat(properties.getClassification().getPart()).isEqualTo("391");
        assertThat(properties.getClassification().getSection()).isEqualTo("11B2");
        assertThat(properties.getSource().getApi().getViolationsDataset()).isEqualTo("876r-jsdb");
        assertThat(properties.getStatistics().getMoverMinPrevious()).isEqualTo(5);
        assertThat(recordSource).isInstanceOf(LocalCsvRecordSource.class);
    }

    @Test
    @DisplayName("server errors from Socrata are retried")
    void retriesServerErrors() {
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(ExpectedCount.times(2), requestTo(startsWith("https://data.example.gov/resource/876r-jsdb.json")))
                .andRespond(withServerError());
        server.expect(requestTo(startsWith("https://data.example.gov/resource/876r-jsdb.json")))
                .andRespond(withSuccess("[{\"inspection_id\": \"1\"}]", MediaType.APPLICATION_JSON));

        assertThat(apiClient.fetchPage("876r-jsdb", "", ":id", 0, 10)).hasSize(1);
        server.verify();
    }
}
