package com.yanweiyi.micodeexecutor.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.Verdict;
import com.yanweiyi.micodeexecutor.model.WorkerRegistration;
import com.yanweiyi.micodeexecutor.model.enums.VerdictOutcomeEnum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class HttpMasterClientTest {

    private MockRestServiceServer server;

    private HttpMasterClient client;

    @BeforeEach
    public void setUp() {
        ObjectMapper objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        RestTemplate restTemplate = new RestTemplateBuilder()
                .rootUri("http://master:8080")
                .messageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpMasterClient(restTemplate, "s3cret");
    }

    @Test
    public void registersWithSecretHeader() {
        server.expect(requestTo("http://master:8080/internal/workers/register"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpMasterClient.AUTH_REQUEST_HEADER, "s3cret"))
                .andExpect(jsonPath("$.id").value("w1"))
                .andExpect(jsonPath("$.capacity").value(4))
                .andRespond(withSuccess());

        client.register(new WorkerRegistration("w1", "10.0.0.1", 4));

        server.verify();
    }

    @Test
    public void heartbeatReportsUnknownWorker() {
        server.expect(requestTo("http://master:8080/internal/workers/w1/heartbeat"))
                .andExpect(jsonPath("$.active_tasks").value(2))
                .andRespond(withSuccess());
        server.expect(requestTo("http://master:8080/internal/workers/w1/heartbeat"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(client.heartbeat("w1", 2));
        assertFalse(client.heartbeat("w1", 0));
        server.verify();
    }

    @Test
    public void pollsAssignments() {
        String body = "[{\"job_id\":\"job-1\",\"language\":\"python\",\"source_code\":\"print(1)\","
                + "\"test_cases\":[{\"id\":\"t1\",\"input\":\"\",\"expected_output\":\"1\\n\"}],"
                + "\"time_limit_ms\":1000,\"memory_limit_mb\":64,\"attempt\":1}]";
        server.expect(requestTo("http://master:8080/internal/workers/w1/assignments"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        List<JobAssignment> assignments = client.pollAssignments("w1");

        assertEquals(1, assignments.size());
        assertEquals("job-1", assignments.get(0).getJobId());
        assertEquals("1\n", assignments.get(0).getTestCases().get(0).getExpectedOutput());
        server.verify();
    }

    @Test
    public void reportsVerdictWithWireNames() {
        server.expect(requestTo("http://master:8080/internal/jobs/job-1/verdicts"))
                .andExpect(jsonPath("$.worker_id").value("w1"))
                .andExpect(jsonPath("$.verdict.test_case_id").value("t1"))
                .andExpect(jsonPath("$.verdict.outcome").value("time_limit_exceeded"))
                .andRespond(withSuccess());

        client.reportVerdict("job-1", "w1", Verdict.builder().testCaseId("t1")
                .outcome(VerdictOutcomeEnum.TIME_LIMIT_EXCEEDED).durationMs(1000L).build());

        server.verify();
    }

    @Test
    public void deregisters() {
        server.expect(requestTo("http://master:8080/internal/workers/w1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        client.deregister("w1");

        server.verify();
    }
}
