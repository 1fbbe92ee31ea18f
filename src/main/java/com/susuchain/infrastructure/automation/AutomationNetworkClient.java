package com.susuchain.infrastructure.automation;

import com.susuchain.domain.model.DutyExecution;
import com.susuchain.domain.model.DutyState;

import java.math.BigInteger;
import java.util.List;

/**
 * The automation network's task API.
 *
 * Every method throws {@link AutomationNetworkException} with an
 * {@link AutomationNetworkException.ErrorCode} describing the failure.
 */
public interface AutomationNetworkClient {

    /**
     * @return the task id assigned by the network
     */
    String createTask(CreateTaskRequest request);

    void cancelTask(String taskId);

    List<AutomationTask> getActiveTasks();

    DutyState getTaskState(String taskId);

    List<DutyExecution> getTaskExecutions(String taskId);

    /**
     * Prepaid balance funding task execution, in wei.
     */
    BigInteger getBalance();

    void depositFunds(BigInteger amountWei);
}
