package com.susuchain.infrastructure.automation;

import com.susuchain.domain.model.DutyExecution;
import com.susuchain.domain.model.DutyState;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Automation network task API over HTTP.
 *
 * Base URL and bearer API key are set on the automationRestClient bean.
 * HTTP status classification:
 * - 409: DUPLICATE_TASK
 * - 404: TASK_NOT_FOUND
 * - other 4xx: REJECTED
 * - 5xx, connect/read timeouts: UNAVAILABLE
 */
@Slf4j
@Component
public class HttpAutomationNetworkClient implements AutomationNetworkClient {

    private final RestClient restClient;

    public HttpAutomationNetworkClient(@Qualifier("automationRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String createTask(CreateTaskRequest request) {
        CreateTaskResponse response = exchange("createTask", () -> restClient.post()
                .uri("/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(CreateTaskResponse.class));

        if (response == null || response.getTaskId() == null) {
            throw new AutomationNetworkException(AutomationNetworkException.ErrorCode.UNAVAILABLE,
                    "createTask returned no task id");
        }
        return response.getTaskId();
    }

    @Override
    public void cancelTask(String taskId) {
        exchange("cancelTask", () -> restClient.delete()
                .uri("/tasks/{taskId}", taskId)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public List<AutomationTask> getActiveTasks() {
        List<AutomationTask> tasks = exchange("getActiveTasks", () -> restClient.get()
                .uri("/tasks?active=true")
                .retrieve()
                .body(new ParameterizedTypeReference<List<AutomationTask>>() {
                }));
        return tasks != null ? tasks : Collections.emptyList();
    }

    @Override
    public DutyState getTaskState(String taskId) {
        TaskStateResponse response = exchange("getTaskState", () -> restClient.get()
                .uri("/tasks/{taskId}/state", taskId)
                .retrieve()
                .body(TaskStateResponse.class));

        if (response == null) {
            throw new AutomationNetworkException(AutomationNetworkException.ErrorCode.UNAVAILABLE,
                    "getTaskState returned no body for " + taskId);
        }
        return DutyState.builder()
                .dutyId(taskId)
                .status(response.getStatus())
                .lastExecuted(response.getLastExecuted())
                .nextExecution(response.getNextExecution())
                .build();
    }

    @Override
    public List<DutyExecution> getTaskExecutions(String taskId) {
        List<DutyExecution> executions = exchange("getTaskExecutions", () -> restClient.get()
                .uri("/tasks/{taskId}/executions", taskId)
                .retrieve()
                .body(new ParameterizedTypeReference<List<DutyExecution>>() {
                }));
        return executions != null ? executions : Collections.emptyList();
    }

    @Override
    public BigInteger getBalance() {
        BalanceResponse response = exchange("getBalance", () -> restClient.get()
                .uri("/balance")
                .retrieve()
                .body(BalanceResponse.class));

        if (response == null || response.getBalance() == null) {
            throw new AutomationNetworkException(AutomationNetworkException.ErrorCode.UNAVAILABLE,
                    "getBalance returned no balance");
        }
        return response.getBalance();
    }

    @Override
    public void depositFunds(BigInteger amountWei) {
        exchange("depositFunds", () -> restClient.post()
                .uri("/balance/deposits")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("amount", amountWei.toString()))
                .retrieve()
                .toBodilessEntity());
    }

    private <T> T exchange(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            throw classify(operation, e);
        } catch (ResourceAccessException e) {
            throw new AutomationNetworkException(AutomationNetworkException.ErrorCode.UNAVAILABLE,
                    operation + " could not reach the automation network: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new AutomationNetworkException(AutomationNetworkException.ErrorCode.UNAVAILABLE,
                    operation + " failed: " + e.getMessage(), e);
        }
    }

    private AutomationNetworkException classify(String operation, RestClientResponseException e) {
        int status = e.getStatusCode().value();
        AutomationNetworkException.ErrorCode code;
        if (status == HttpStatus.CONFLICT.value()) {
            code = AutomationNetworkException.ErrorCode.DUPLICATE_TASK;
        } else if (status == HttpStatus.NOT_FOUND.value()) {
            code = AutomationNetworkException.ErrorCode.TASK_NOT_FOUND;
        } else if (e.getStatusCode().is4xxClientError()) {
            code = AutomationNetworkException.ErrorCode.REJECTED;
        } else {
            code = AutomationNetworkException.ErrorCode.UNAVAILABLE;
        }

        log.debug("{} answered HTTP {} -> {}", operation, status, code);
        return new AutomationNetworkException(code,
                operation + " failed with HTTP " + status + ": " + e.getResponseBodyAsString(), e);
    }

    @Data
    @NoArgsConstructor
    static class CreateTaskResponse {
        private String taskId;
    }

    @Data
    @NoArgsConstructor
    static class TaskStateResponse {
        private String status;
        private Instant lastExecuted;
        private Instant nextExecution;
    }

    @Data
    @NoArgsConstructor
    static class BalanceResponse {
        private BigInteger balance;
    }
}
