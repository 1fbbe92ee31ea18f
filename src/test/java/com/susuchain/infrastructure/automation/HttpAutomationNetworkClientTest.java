package com.susuchain.infrastructure.automation;

import com.susuchain.domain.model.DutyState;
import com.susuchain.infrastructure.automation.AutomationNetworkException.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpAutomationNetworkClientTest {

    private static final String BASE_URL = "http://automation.test";

    private MockRestServiceServer server;
    private HttpAutomationNetworkClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpAutomationNetworkClient(builder.build());
    }

    @Test
    void createTask_postsRequestAndReturnsTaskId() {
        server.expect(requestTo(BASE_URL + "/tasks"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.execSelector").value("0x8c7d3c6a"))
                .andExpect(jsonPath("$.dedicatedMsgSender").value(true))
                .andRespond(withSuccess("{\"taskId\":\"task-1\"}", MediaType.APPLICATION_JSON));

        String taskId = client.createTask(CreateTaskRequest.builder()
                .execAddress("0x1111111111111111111111111111111111111111")
                .execSelector("0x8c7d3c6a")
                .dedicatedMsgSender(true)
                .name("SusuChain Payout - Family")
                .resolverAddress("0x1111111111111111111111111111111111111111")
                .resolverData("0x75d5ae14")
                .build());

        assertEquals("task-1", taskId);
        server.verify();
    }

    @Test
    void createTask_conflict_classifiedAsDuplicate() {
        server.expect(requestTo(BASE_URL + "/tasks"))
                .andRespond(withStatus(HttpStatus.CONFLICT).body("task exists"));

        AutomationNetworkException e = assertThrows(AutomationNetworkException.class,
                () -> client.createTask(CreateTaskRequest.builder().build()));

        assertEquals(ErrorCode.DUPLICATE_TASK, e.getErrorCode());
    }

    @Test
    void cancelTask_notFound_classifiedAsTaskNotFound() {
        server.expect(requestTo(BASE_URL + "/tasks/task-9"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        AutomationNetworkException e = assertThrows(AutomationNetworkException.class,
                () -> client.cancelTask("task-9"));

        assertEquals(ErrorCode.TASK_NOT_FOUND, e.getErrorCode());
    }

    @Test
    void getActiveTasks_serverError_classifiedAsUnavailable() {
        server.expect(requestTo(BASE_URL + "/tasks?active=true"))
                .andRespond(withServerError());

        AutomationNetworkException e = assertThrows(AutomationNetworkException.class,
                () -> client.getActiveTasks());

        assertEquals(ErrorCode.UNAVAILABLE, e.getErrorCode());
    }

    @Test
    void depositFunds_badRequest_classifiedAsRejected() {
        server.expect(requestTo(BASE_URL + "/balance/deposits"))
                .andRespond(withBadRequest());

        AutomationNetworkException e = assertThrows(AutomationNetworkException.class,
                () -> client.depositFunds(BigInteger.TEN));

        assertEquals(ErrorCode.REJECTED, e.getErrorCode());
    }

    @Test
    void getActiveTasks_parsesTaskList() {
        server.expect(requestTo(BASE_URL + "/tasks?active=true"))
                .andRespond(withSuccess("[{\"taskId\":\"task-1\",\"execAddress\":\"0xabc\",\"name\":\"n\"}]",
                        MediaType.APPLICATION_JSON));

        List<AutomationTask> tasks = client.getActiveTasks();

        assertEquals(1, tasks.size());
        assertEquals("0xabc", tasks.get(0).getExecAddress());
    }

    @Test
    void getTaskStateAndBalance() {
        server.expect(requestTo(BASE_URL + "/tasks/task-1/state"))
                .andRespond(withSuccess("{\"status\":\"active\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/balance"))
                .andRespond(withSuccess("{\"balance\":20000000000000000}", MediaType.APPLICATION_JSON));

        DutyState state = client.getTaskState("task-1");
        BigInteger balance = client.getBalance();

        assertEquals("task-1", state.getDutyId());
        assertEquals("active", state.getStatus());
        assertEquals(new BigInteger("20000000000000000"), balance);
    }
}
