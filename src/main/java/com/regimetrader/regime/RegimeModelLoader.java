package com.regimetrader.regime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.regimetrader.domain.vo.LatentState;
import com.regimetrader.exception.ConfigurationException;
import com.regimetrader.exception.ErrorCode;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads a versioned regime model from a JSON resource and validates it.
 *
 * <p>Any problem with the file (absent, unparsable, wrong shapes, transition rows that
 * are not probability distributions) is a wiring error and raises
 * {@link ConfigurationException}: a pipeline must never start without a usable model.
 */
@Component
public class RegimeModelLoader {

    private static final Logger log = LoggerFactory.getLogger(RegimeModelLoader.class);

    private static final double PROBABILITY_TOLERANCE = 1e-6;

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public RegimeModelLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public RegimeModel load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw ConfigurationException.regimeModelMissing(location);
        }

        RegimeModelDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = objectMapper.readValue(in, RegimeModelDocument.class);
        } catch (IOException e) {
            throw new ConfigurationException(
                    ErrorCode.REGIME_MODEL_INVALID, "Cannot parse regime model " + location + ": " + e.getMessage(), e);
        }

        RegimeModel model = toModel(document);
        log.info(
                "Loaded regime model version {} from {} ({} regimes, dimension {})",
                model.getVersion(),
                location,
                model.regimeCount(),
                model.getDimension());
        return model;
    }

    RegimeModel toModel(RegimeModelDocument document) {
        int dimension = document.getDimension();
        if (dimension != LatentState.DIMENSION) {
            throw ConfigurationException.regimeModelInvalid(
                    "dimension must be " + LatentState.DIMENSION + " but was " + dimension);
        }
        if (document.getVersion() == null || document.getVersion().isBlank()) {
            throw ConfigurationException.regimeModelInvalid("version is required");
        }

        List<RegimeModelDocument.RegimeDocument> regimeDocuments = document.getRegimes();
        int regimeCount = regimeDocuments == null ? 0 : regimeDocuments.size();
        if (regimeCount == 0) {
            throw ConfigurationException.regimeModelInvalid("at least one regime is required");
        }

        double[] initialState = requireVector(document.getInitialState(), dimension, "initialState");
        double[] initialCovariance =
                requireVector(document.getInitialCovarianceDiagonal(), dimension, "initialCovarianceDiagonal");
        double[] initialRegimePrior = document.getInitialRegimePrior() != null
                ? requireDistribution(document.getInitialRegimePrior(), regimeCount, "initialRegimePrior")
                : uniform(regimeCount);

        List<RegimeParameters> regimes = new ArrayList<>(regimeCount);
        for (int i = 0; i < regimeCount; i++) {
            RegimeModelDocument.RegimeDocument regime = regimeDocuments.get(i);
            if (regime.getId() != i) {
                throw ConfigurationException.regimeModelInvalid(
                        "regimes must be listed in id order, expected id " + i + " but found " + regime.getId());
            }
            regimes.add(toRegime(regime, dimension, regimeCount));
        }

        return RegimeModel.builder()
                .version(document.getVersion())
                .dimension(dimension)
                .initialState(new ArrayRealVector(initialState))
                .initialCovariance(MatrixUtils.createRealDiagonalMatrix(initialCovariance))
                .initialRegimePrior(initialRegimePrior)
                .regimes(List.copyOf(regimes))
                .build();
    }

    private RegimeParameters toRegime(RegimeModelDocument.RegimeDocument regime, int dimension, int regimeCount) {
        String label = "regime " + regime.getId();

        RealMatrix stateTransition = matrixOrDiagonal(
                regime.getStateTransition(), regime.getStateTransitionDiagonal(), dimension, label + " stateTransition");
        RealMatrix observation = regime.getObservation() != null
                ? requireMatrix(regime.getObservation(), dimension, label + " observation")
                : MatrixUtils.createRealIdentityMatrix(dimension);
        RealMatrix processNoise = matrixOrDiagonal(
                regime.getProcessNoise(), regime.getProcessNoiseDiagonal(), dimension, label + " processNoise");
        RealMatrix observationNoise = matrixOrDiagonal(
                regime.getObservationNoise(),
                regime.getObservationNoiseDiagonal(),
                dimension,
                label + " observationNoise");

        double[][] regimeTransition = regime.getRegimeTransition();
        if (regimeTransition == null || regimeTransition.length != regimeCount) {
            throw ConfigurationException.regimeModelInvalid(
                    label + " regimeTransition must have " + regimeCount + " rows");
        }
        // Only the owning regime's row describes where this regime goes next
        double[] transitionRow =
                requireDistribution(regimeTransition[regime.getId()], regimeCount, label + " regimeTransition row");

        double[] initialPrior = regime.getInitialPrior() != null
                ? requireDistribution(regime.getInitialPrior(), regimeCount, label + " initialPrior")
                : uniform(regimeCount);

        return RegimeParameters.builder()
                .id(regime.getId())
                .name(regime.getName() != null ? regime.getName() : "regime-" + regime.getId())
                .stateTransition(stateTransition)
                .observation(observation)
                .processNoise(processNoise)
                .observationNoise(observationNoise)
                .transitionRow(transitionRow)
                .initialPrior(initialPrior)
                .meanReversionStrength(regime.getMeanReversionStrength())
                .volatility(regime.getVolatility())
                .momentum(regime.getMomentum())
                .build();
    }

    // ---- Validation helpers ----

    private static RealMatrix matrixOrDiagonal(double[][] full, double[] diagonal, int dimension, String label) {
        if (full != null) {
            return requireMatrix(full, dimension, label);
        }
        if (diagonal != null) {
            return MatrixUtils.createRealDiagonalMatrix(requireVector(diagonal, dimension, label));
        }
        throw ConfigurationException.regimeModelInvalid(label + " is required");
    }

    private static RealMatrix requireMatrix(double[][] values, int dimension, String label) {
        if (values.length != dimension) {
            throw ConfigurationException.regimeModelInvalid(label + " must be " + dimension + "x" + dimension);
        }
        for (double[] row : values) {
            requireVector(row, dimension, label);
        }
        return new Array2DRowRealMatrix(values, true);
    }

    private static double[] requireVector(double[] values, int length, String label) {
        if (values == null || values.length != length) {
            throw ConfigurationException.regimeModelInvalid(label + " must have " + length + " entries");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw ConfigurationException.regimeModelInvalid(label + " contains a non-finite value");
            }
        }
        return values.clone();
    }

    private static double[] requireDistribution(double[] values, int length, String label) {
        double[] checked = requireVector(values, length, label);
        double sum = 0.0;
        for (double v : checked) {
            if (v < 0.0) {
                throw ConfigurationException.regimeModelInvalid(label + " contains a negative probability");
            }
            sum += v;
        }
        if (Math.abs(sum - 1.0) > PROBABILITY_TOLERANCE) {
            throw ConfigurationException.regimeModelInvalid(label + " must sum to 1 but sums to " + sum);
        }
        return checked;
    }

    private static double[] uniform(int n) {
        double[] values = new double[n];
        Arrays.fill(values, 1.0 / n);
        return values;
    }
}
