package com.uptimefleet.slave.reporter;

import com.uptimefleet.common.model.MonitoringResult;
import com.uptimefleet.slave.config.SlaveConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class MasterReporterTest {

    private SlaveConfig config;
    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private MasterReporter reporter;

    @BeforeEach
    void setUp() {
        config = new SlaveConfig();
        config.setId("slave-1");
        config.setName("Worker One");
        config.setApiKey("s3cret");
        config.setMasterUrl("http://master:3000/");
        config.getReport().setRetryDelayMs(10L);

        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        // run deliveries inline so the test can verify them
        reporter = new MasterReporter(config, restTemplate, Runnable::run);
    }

    @Test
    void testReportIsPostedWithAuthAndSlaveId() {
        server.expect(requestTo("http://master:3000/report"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer s3cret"))
                .andExpect(header("X-Slave-Id", "slave-1"))
                .andExpect(jsonPath("$.serviceId").value("svc-1"))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("HTTP 500: Internal Server Error"))
                .andExpect(jsonPath("$.slaveId").value("slave-1"))
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        reporter.onResult(MonitoringResult.down("svc-1", 1000L, 12L, "HTTP 500: Internal Server Error"));

        server.verify();
        assertEquals(1, reporter.getSentCount());
    }

    @Test
    void testTransportFailureIsRetriedThenSucceeds() {
        server.expect(requestTo("http://master:3000/report"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo("http://master:3000/report"))
                .andRespond(withSuccess());

        assertTrue(reporter.sendReport(MonitoringResult.up("svc-1", 1000L, 5L)));

        server.verify();
        assertEquals(0, reporter.getFailedCount());
    }

    @Test
    void testResultIsDroppedAfterRetryBudget() {
        server.expect(ExpectedCount.times(3), requestTo("http://master:3000/report"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertFalse(reporter.sendReport(MonitoringResult.up("svc-1", 1000L, 5L)));

        server.verify();
        assertEquals(1, reporter.getFailedCount());
        assertEquals(0, reporter.getSentCount());
    }
}
