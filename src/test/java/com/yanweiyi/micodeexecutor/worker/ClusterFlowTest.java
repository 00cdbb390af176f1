package com.yanweiyi.micodeexecutor.worker;

import com.yanweiyi.micodeexecutor.config.MicodeProperties;
import com.yanweiyi.micodeexecutor.model.JobStatusResponse;
import com.yanweiyi.micodeexecutor.model.SubmitRequest;
import com.yanweiyi.micodeexecutor.model.TestCase;
import com.yanweiyi.micodeexecutor.model.enums.JobStatusEnum;
import com.yanweiyi.micodeexecutor.model.enums.VerdictOutcomeEnum;
import com.yanweiyi.micodeexecutor.sandbox.SandboxResult;
import com.yanweiyi.micodeexecutor.sandbox.language.LanguageProfileRegistry;
import com.yanweiyi.micodeexecutor.service.JobScheduler;
import com.yanweiyi.micodeexecutor.service.JobStore;
import com.yanweiyi.micodeexecutor.service.WorkerRegistry;
import com.yanweiyi.micodeexecutor.support.ScriptedSandboxRunner;
import com.yanweiyi.micodeexecutor.support.TestLanguages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Master 与工作节点在同一进程内，沙箱使用脚本结果
 */
public class ClusterFlowTest {

    @TempDir
    Path workspaceDir;

    private JobScheduler scheduler;

    private WorkerAgent agent;

    @BeforeEach
    public void setUp() {
        MicodeProperties properties = new MicodeProperties();
        properties.getWorker().setId("w1");
        properties.getWorker().setCapacity(2);
        properties.getWorker().setWorkspaceDir(workspaceDir.toString());
        LanguageProfileRegistry languages = new LanguageProfileRegistry(TestLanguages.pythonAndC());
        scheduler = new JobScheduler(new JobStore(), new WorkerRegistry(), languages, properties, Clock.systemUTC());

        ScriptedSandboxRunner sandboxRunner = new ScriptedSandboxRunner((request, stdin) -> {
            if ("loop\n".equals(stdin)) {
                SandboxResult result = ScriptedSandboxRunner.exited(137, "", "");
                result.setTimeout(true);
                return result;
            }
            return ScriptedSandboxRunner.exited(0, "hello\n", "");
        }, 10L);
        MasterClient masterClient = new LocalMasterClient(scheduler);
        agent = new WorkerAgent(masterClient, new JobExecutor(sandboxRunner, languages, masterClient, properties),
                properties);
    }

    @AfterEach
    public void tearDown() {
        agent.stop();
    }

    private JobStatusResponse awaitTerminal(String jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000L;
        JobStatusResponse status = scheduler.getStatus(jobId);
        while (!status.getStatus().isTerminal() && System.currentTimeMillis() < deadline) {
            agent.pollOnce();
            Thread.sleep(20L);
            status = scheduler.getStatus(jobId);
        }
        return status;
    }

    @Test
    public void helloWorldIsAccepted() throws InterruptedException {
        agent.heartbeat();
        assertTrue(agent.isRegistered());
        SubmitRequest request = new SubmitRequest();
        request.setLanguage("python");
        request.setSourceCode("print('hello')");
        request.setTestCases(Arrays.asList(new TestCase("t1", "", "hello\n")));

        JobStatusResponse status = awaitTerminal(scheduler.submit(request));

        assertEquals(JobStatusEnum.COMPLETED, status.getStatus());
        assertEquals(1, status.getAttempts());
        assertEquals(VerdictOutcomeEnum.ACCEPTED, status.getVerdicts().get(0).getOutcome());
    }

    @Test
    public void timeLimitIsIsolatedToItsTestCase() throws InterruptedException {
        agent.heartbeat();
        SubmitRequest request = new SubmitRequest();
        request.setLanguage("python");
        request.setSourceCode("import sys\nprint('hello')");
        request.setTestCases(Arrays.asList(new TestCase("fast", "", "hello\n"),
                new TestCase("slow", "loop\n", "hello\n")));

        JobStatusResponse status = awaitTerminal(scheduler.submit(request));

        assertEquals(JobStatusEnum.COMPLETED, status.getStatus());
        assertEquals(VerdictOutcomeEnum.ACCEPTED, status.getVerdicts().get(0).getOutcome());
        assertEquals(VerdictOutcomeEnum.TIME_LIMIT_EXCEEDED, status.getVerdicts().get(1).getOutcome());
    }

    @Test
    public void submittedBeforeAnyWorkerRunsOnceOneJoins() throws InterruptedException {
        SubmitRequest request = new SubmitRequest();
        request.setLanguage("py");
        request.setSourceCode("print('hello')");
        request.setTestCases(Arrays.asList(new TestCase("t1", "", "hello\n")));
        String jobId = scheduler.submit(request);
        assertEquals(JobStatusEnum.PENDING, scheduler.getStatus(jobId).getStatus());

        agent.heartbeat();

        assertEquals(JobStatusEnum.COMPLETED, awaitTerminal(jobId).getStatus());
        assertEquals(1, scheduler.listWorkers().size());
    }

    @Test
    public void workerRegistersAgainAfterBeingForgotten() {
        agent.heartbeat();
        scheduler.deregisterWorker("w1");
        assertTrue(scheduler.listWorkers().isEmpty());

        agent.heartbeat();

        assertEquals(1, scheduler.listWorkers().size());
        assertEquals("w1", scheduler.listWorkers().get(0).getId());
    }
}
