package com.phillippitts.groundstation;

import com.phillippitts.groundstation.service.broker.BrokerConnectionManager;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full application against an unreachable broker: the HTTP surface stays up while the
 * connection manager keeps retrying in the background.
 */
@Tag("integration")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class GroundStationApplicationTests {

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private BrokerConnectionManager connectionManager;

    @Test
    void healthProbeAnswersWithoutBroker() {
        ResponseEntity<Map> response = rest.getForEntity("/health", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "healthy");
        assertThat(connectionManager.isConnected()).isFalse();
    }

    @Test
    void readinessReportsNoConnections() {
        ResponseEntity<Map> response = rest.getForEntity("/acceptsConnections", Map.class);

        assertThat(response.getBody()).containsEntry("active_connections", 0);
    }

    @Test
    void textEndpointRejectsIncompleteBody() {
        ResponseEntity<Map> response = putText("test-token", "{\"text\":\"hi\"}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void textEndpointReportsBrokerOutage() {
        ResponseEntity<Map> response = putText("test-token", "{\"text\":\"hi\",\"device_id\":\"kitchen\"}");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).containsEntry("errorCode", "BrokerNotConnectedException");
    }

    private ResponseEntity<Map> putText(String token, String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("user-token", token);
        return rest.exchange("/text", HttpMethod.PUT, new HttpEntity<>(json, headers), Map.class);
    }
}
