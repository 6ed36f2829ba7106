package club.ppmc.monitor.probe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import club.ppmc.monitor.config.MonitorProperties;
import club.ppmc.monitor.model.ProbeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

class HttpApiProbeTest {

    private static final String HEALTH_URL = "http://localhost:8080/api/health";

    private MockRestServiceServer server;
    private HttpApiProbe probe;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        MonitorProperties properties = new MonitorProperties();
        properties.getProbes().setApiHealthUrl(HEALTH_URL);
        probe = new HttpApiProbe(restTemplate, properties);
    }

    @Test
    void healthyOn2xx() {
        server.expect(requestTo(HEALTH_URL)).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        ProbeResult result = probe.probe();

        assertThat(result.healthy()).isTrue();
        assertThat(result.latencyMs()).isGreaterThanOrEqualTo(0.0);
        server.verify();
    }

    @Test
    void serverErrorPropagatesToCollector() {
        server.expect(requestTo(HEALTH_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> probe.probe()).isInstanceOf(HttpServerErrorException.class);
    }
}
