package com.yanweiyi.micodeexecutor.worker;

import cn.hutool.core.util.StrUtil;
import com.yanweiyi.micodeexecutor.model.FailureReport;
import com.yanweiyi.micodeexecutor.model.HeartbeatRequest;
import com.yanweiyi.micodeexecutor.model.JobAssignment;
import com.yanweiyi.micodeexecutor.model.JobStatusUpdate;
import com.yanweiyi.micodeexecutor.model.Verdict;
import com.yanweiyi.micodeexecutor.model.VerdictReport;
import com.yanweiyi.micodeexecutor.model.WorkerRegistration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 通过 HTTP 访问远程 Master 的 /internal 接口
 *
 * @author yanweiyi
 */
@Slf4j
public class HttpMasterClient implements MasterClient {

    /**
     * 鉴权请求头
     */
    public static final String AUTH_REQUEST_HEADER = "X-Micode-Secret";

    private final RestTemplate restTemplate;

    private final String secret;

    public HttpMasterClient(RestTemplate restTemplate, String secret) {
        this.restTemplate = restTemplate;
        this.secret = secret;
    }

    @Override
    public void register(WorkerRegistration registration) {
        post("/internal/workers/register", registration);
    }

    @Override
    public boolean heartbeat(String workerId, int activeTasks) {
        try {
            post("/internal/workers/{workerId}/heartbeat", new HeartbeatRequest(activeTasks), workerId);
            return true;
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("master does not know worker {}", workerId);
            return false;
        }
    }

    @Override
    public List<JobAssignment> pollAssignments(String workerId) {
        ResponseEntity<JobAssignment[]> response = restTemplate.exchange("/internal/workers/{workerId}/assignments",
                HttpMethod.POST, new HttpEntity<>(headers()), JobAssignment[].class, workerId);
        JobAssignment[] body = response.getBody();
        return body == null ? Collections.emptyList() : Arrays.asList(body);
    }

    @Override
    public void reportStatus(String jobId, JobStatusUpdate update) {
        post("/internal/jobs/{jobId}/status", update, jobId);
    }

    @Override
    public void reportVerdict(String jobId, String workerId, Verdict verdict) {
        post("/internal/jobs/{jobId}/verdicts", new VerdictReport(workerId, verdict), jobId);
    }

    @Override
    public void reportFailure(String jobId, String workerId, String reason) {
        post("/internal/jobs/{jobId}/failure", new FailureReport(workerId, reason), jobId);
    }

    @Override
    public void deregister(String workerId) {
        restTemplate.exchange("/internal/workers/{workerId}", HttpMethod.DELETE,
                new HttpEntity<>(headers()), Void.class, workerId);
    }

    private void post(String path, Object body, Object... uriVariables) {
        restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers()), Void.class, uriVariables);
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StrUtil.isNotEmpty(secret)) {
            headers.set(AUTH_REQUEST_HEADER, secret);
        }
        return headers;
    }
}
