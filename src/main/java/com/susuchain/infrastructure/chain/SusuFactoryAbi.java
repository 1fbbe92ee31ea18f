package com.susuchain.infrastructure.chain;

public final class SusuFactoryAbi {

    public static final ContractFunction GET_RECENT_GROUPS =
            ContractFunction.of("getRecentGroups(uint256)", "0x6a517028");

    public static final ContractFunction GET_ALL_GROUPS =
            ContractFunction.of("getAllGroups()", "0x21cd3cae");

    private SusuFactoryAbi() {
    }
}
