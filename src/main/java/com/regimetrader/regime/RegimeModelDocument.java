package com.regimetrader.regime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * JSON shape of a regime model file. Bound by Jackson, then validated and converted
 * into a {@link RegimeModel} by {@link RegimeModelLoader}.
 *
 * <p>Noise covariances may be given either as full matrices or as diagonals; the
 * observation matrix defaults to identity when omitted.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegimeModelDocument {

    private String version;
    private int dimension;
    private double[] initialState;
    private double[] initialCovarianceDiagonal;
    private double[] initialRegimePrior;
    private List<RegimeDocument> regimes = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegimeDocument {
        private int id;
        private String name;
        private double[][] stateTransition;
        private double[] stateTransitionDiagonal;
        private double[][] observation;
        private double[][] processNoise;
        private double[] processNoiseDiagonal;
        private double[][] observationNoise;
        private double[] observationNoiseDiagonal;
        private double[][] regimeTransition;
        private double[] initialPrior;
        private double meanReversionStrength;
        private double volatility;
        private double momentum;
    }
}
