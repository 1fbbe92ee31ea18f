package com.susuchain.infrastructure.chain;

/**
 * The slice of the SusuGroup contract ABI this service reads and writes.
 *
 * Selectors are the first four bytes of keccak256(signature).
 */
public final class SusuGroupAbi {

    public static final ContractFunction GROUP_ACTIVE =
            ContractFunction.of("groupActive()", "0x81a64e76");

    public static final ContractFunction CURRENT_ROUND =
            ContractFunction.of("currentRound()", "0x8a19c8bc");

    public static final ContractFunction ROUND_DEADLINE =
            ContractFunction.of("roundDeadline()", "0xaf8532e3");

    public static final ContractFunction GET_TIME_UNTIL_DEADLINE =
            ContractFunction.of("getTimeUntilDeadline()", "0xf849ae62");

    public static final ContractFunction CAN_EXECUTE_PAYOUT =
            ContractFunction.of("canExecutePayout()", "0xebd0cbf8");

    public static final ContractFunction EXECUTE_SCHEDULED_PAYOUT =
            ContractFunction.of("executeScheduledPayout()", "0x56d976de");

    public static final ContractFunction AUTOMATION_EXECUTOR =
            ContractFunction.of("automationExecutor()", "0x308844c7");

    public static final ContractFunction SET_AUTOMATION_EXECUTOR =
            ContractFunction.of("setAutomationExecutor(address)", "0x093f4772");

    /**
     * (string name, string ensName, uint256 contribution, uint256 interval, uint256 maxMembers,
     * uint256 currentMembers, uint256 round, bool active, address currentBeneficiary)
     */
    public static final ContractFunction GET_GROUP_INFO =
            ContractFunction.of("getGroupInfo()", "0xfad6036b");

    /**
     * Execute selector every duty is registered with on the automation network.
     * Existing duties were created with this value, so it must not be recomputed.
     */
    public static final ContractFunction DUTY_EXECUTE =
            ContractFunction.of(EXECUTE_SCHEDULED_PAYOUT.getSignature(), "0x8c7d3c6a");

    /**
     * Resolver selector every duty is registered with on the automation network.
     */
    public static final ContractFunction DUTY_RESOLVER =
            ContractFunction.of(CAN_EXECUTE_PAYOUT.getSignature(), "0x75d5ae14");

    private SusuGroupAbi() {
    }
}
