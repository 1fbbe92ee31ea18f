package com.susuchain.infrastructure.chain;

import com.susuchain.domain.model.GroupInfo;
import com.susuchain.domain.model.PayoutEligibility;

import java.math.BigInteger;

/**
 * Read-only view of a SusuGroup contract.
 *
 * Every method throws {@link com.susuchain.domain.exception.ChainReadException}
 * on RPC failure, revert, or a response that does not decode.
 */
public interface SusuGroupReader {

    boolean isGroupActive(String groupAddress);

    BigInteger getCurrentRound(String groupAddress);

    /**
     * Unix timestamp (seconds) of the current round's contribution deadline.
     */
    BigInteger getRoundDeadline(String groupAddress);

    BigInteger getTimeUntilDeadline(String groupAddress);

    PayoutEligibility canExecutePayout(String groupAddress);

    /**
     * The zero address when no executor has been set.
     */
    String getAutomationExecutor(String groupAddress);

    GroupInfo getGroupInfo(String groupAddress);
}
