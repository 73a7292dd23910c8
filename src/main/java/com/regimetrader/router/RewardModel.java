package com.regimetrader.router;

/**
 * Reward belief family used by every policy posterior of a router.
 *
 * <ul>
 *   <li>BETA -- success/failure style rewards; Beta(α, β) starting from Beta(1, 1)</li>
 *   <li>NORMAL -- real-valued rewards; conjugate Normal mean with known observation variance</li>
 * </ul>
 */
public enum RewardModel {
    BETA,
    NORMAL
}
