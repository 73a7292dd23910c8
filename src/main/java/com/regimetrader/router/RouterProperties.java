package com.regimetrader.router;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the strategy router, loaded from application.yml.
 *
 * <p>Properties prefix: {@code regimetrader.router.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>rewardModel: BETA</li>
 *   <li>learningRate: 0.01 (contextual weight step)</li>
 *   <li>explorationWeight: 0.1 (bonus = weight / √(timesChosen + 1))</li>
 *   <li>normalObservationVariance: 1.0 (NORMAL model only)</li>
 *   <li>maxWeight: 5.0 (absolute clamp on each contextual weight)</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.router")
public class RouterProperties {

    private RewardModel rewardModel = RewardModel.BETA;
    private double learningRate = 0.01;
    private double explorationWeight = 0.1;
    private double normalObservationVariance = 1.0;
    private double maxWeight = 5.0;
}
