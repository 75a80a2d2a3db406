package com.power.anomaly;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Trains on the bundled sample dataset through the HTTP API, then queries it.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class AnomalyApiIntegrationTest {

    @TempDir
    static Path modelDir;

    @DynamicPropertySource
    static void modelDirectory(DynamicPropertyRegistry registry) {
        registry.add("detection.model-directory", () -> modelDir.toString());
    }

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    @Order(1)
    void queryBeforeTraining_returns404() {
        ResponseEntity<String> response = restTemplate.getForEntity("/api/v1/anomalies?tag=untrained", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(JsonPath.parse(response.getBody()).read("$.kind", String.class)).isEqualTo("MODEL_NOT_FOUND");
    }

    @Test
    @Order(2)
    void trainOnDefaultDataset_publishesModel() {
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/train", null, String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat(json.read("$.message", String.class)).isEqualTo("Model trained and saved successfully");
        assertThat(json.read("$.rows_parsed", Integer.class)).isEqualTo(118);
        assertThat(json.read("$.rows_dropped", Integer.class)).isEqualTo(2);
        assertThat(json.read("$.model_tag", String.class)).isEqualTo("default");

        ResponseEntity<String> metadata = restTemplate.getForEntity("/api/v1/models/default", String.class);
        assertThat(metadata.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(JsonPath.parse(metadata.getBody()).read("$.treeCount", Integer.class)).isEqualTo(50);
    }

    @Test
    @Order(3)
    void queryWholeDay_scoresEveryRecordOfThatDay() {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/api/v1/anomalies?start_date=2006-12-16&end_date=2006-12-16", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat(json.read("$.total_records", Integer.class)).isEqualTo(118);
        assertThat(json.read("$.anomaly_count", Integer.class)).isBetween(0, 1);
    }

    @Test
    @Order(4)
    void queryOutsideDataset_returnsEmptyResult() {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/api/v1/anomalies?start_date=2008-01-01&end_date=2008-01-02", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        DocumentContext json = JsonPath.parse(response.getBody());
        assertThat(json.read("$.total_records", Integer.class)).isZero();
        assertThat(json.read("$.anomaly_percentage", Double.class)).isZero();
    }

    @Test
    @Order(5)
    void invertedRange_returns400() {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/api/v1/anomalies?start_date=2006-12-17&end_date=2006-12-16", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(JsonPath.parse(response.getBody()).read("$.kind", String.class)).isEqualTo("INVALID_RANGE");
    }

    @Test
    @Order(6)
    void analyzeDefaultData_withSample_scoresSampleOnly() {
        ResponseEntity<String> response = restTemplate.getForEntity(
                "/api/v1/analyze-default-data?sample_size=40", String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(JsonPath.parse(response.getBody()).read("$.total_records", Integer.class)).isEqualTo(40);
    }
}
