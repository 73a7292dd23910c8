package com.regimetrader.canary;

import com.regimetrader.exception.ConfigurationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Canary rollout configuration: the trade window and the promotion criteria out of
 * the CANARY and PARTIAL stages.
 *
 * <p>DISABLED has no criteria (it is left only through an explicit enable) and LIVE is
 * terminal.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.canary")
public class CanaryProperties {

    /** Number of most recent trades the metrics are computed over. */
    private int windowSize = 200;

    /** Start a new pipeline already at CANARY instead of DISABLED. */
    private boolean enabledOnStartup = false;

    private Stage canary = new Stage(25, 0.60, 0.05, 100.0, 0.075);

    private Stage partial = new Stage(100, 0.65, 0.08, 500.0, 0.12);

    /**
     * Criteria for promotion out of the given stage.
     *
     * @throws ConfigurationException for DISABLED and LIVE, which have no automatic promotion
     */
    public CanaryCriteria criteriaFor(CanaryState state) {
        return switch (state) {
            case CANARY -> canary.toCriteria();
            case PARTIAL -> partial.toCriteria();
            case DISABLED, LIVE -> throw new ConfigurationException("No promotion criteria for canary state " + state);
        };
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stage {
        private int minTrades;
        private double minWinRate;
        private double maxDrawdown;
        private double pnlThreshold;
        private double cvarCap;

        CanaryCriteria toCriteria() {
            return CanaryCriteria.builder()
                    .minTrades(minTrades)
                    .minWinRate(minWinRate)
                    .maxDrawdown(maxDrawdown)
                    .pnlThreshold(pnlThreshold)
                    .cvarCap(cvarCap)
                    .build();
        }
    }
}
