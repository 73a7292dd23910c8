package com.regimetrader.regime;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numerically guarded inverse and determinant for the small covariance matrices the
 * Kalman bank works with.
 *
 * <p>Neither operation ever throws. Inversion goes through an LU decomposition; a singular
 * or non-finite result is retried with increasing Tikhonov regularization (M + λI) and,
 * if every attempt fails, the identity is returned. Determinants are floored at
 * {@link #DETERMINANT_FLOOR} so likelihoods stay strictly positive.
 */
public final class GuardedMatrices {

    private static final Logger log = LoggerFactory.getLogger(GuardedMatrices.class);

    public static final double DETERMINANT_FLOOR = 1e-10;

    static final double SINGULARITY_THRESHOLD = 1e-12;

    private static final double[] REGULARIZATION_STEPS = {1e-9, 1e-6, 1e-3, 1e-1};

    private GuardedMatrices() {}

    /**
     * Returns the inverse of a square matrix, regularizing when it is (near-)singular and
     * falling back to the identity when regularization does not help.
     */
    public static RealMatrix inverse(RealMatrix matrix) {
        int n = matrix.getRowDimension();
        if (!isFinite(matrix)) {
            log.debug("Non-finite matrix, substituting identity inverse");
            return MatrixUtils.createRealIdentityMatrix(n);
        }

        RealMatrix inverse = tryInverse(matrix);
        if (inverse != null) {
            return inverse;
        }

        RealMatrix identity = MatrixUtils.createRealIdentityMatrix(n);
        for (double lambda : REGULARIZATION_STEPS) {
            inverse = tryInverse(matrix.add(identity.scalarMultiply(lambda)));
            if (inverse != null) {
                log.debug("Inverted singular matrix with regularization λ={}", lambda);
                return inverse;
            }
        }

        log.warn("Matrix inversion failed after regularization, falling back to identity ({}x{})", n, n);
        return identity;
    }

    /** Determinant, floored at {@link #DETERMINANT_FLOOR}. Non-finite results also map to the floor. */
    public static double determinant(RealMatrix matrix) {
        if (!isFinite(matrix)) {
            return DETERMINANT_FLOOR;
        }
        double det = new LUDecomposition(matrix, SINGULARITY_THRESHOLD).getDeterminant();
        if (!Double.isFinite(det) || det < DETERMINANT_FLOOR) {
            return DETERMINANT_FLOOR;
        }
        return det;
    }

    /** (M + Mᵗ) / 2, used to keep covariance updates symmetric despite rounding. */
    public static RealMatrix symmetrize(RealMatrix matrix) {
        return matrix.add(matrix.transpose()).scalarMultiply(0.5);
    }

    public static boolean isFinite(RealMatrix matrix) {
        for (int i = 0; i < matrix.getRowDimension(); i++) {
            for (int j = 0; j < matrix.getColumnDimension(); j++) {
                if (!Double.isFinite(matrix.getEntry(i, j))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static RealMatrix tryInverse(RealMatrix matrix) {
        DecompositionSolver solver = new LUDecomposition(matrix, SINGULARITY_THRESHOLD).getSolver();
        if (!solver.isNonSingular()) {
            return null;
        }
        RealMatrix inverse = solver.getInverse();
        return isFinite(inverse) ? inverse : null;
    }
}
