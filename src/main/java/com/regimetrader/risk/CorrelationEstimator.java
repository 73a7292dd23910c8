package com.regimetrader.risk;

import com.regimetrader.domain.model.PortfolioSnapshot;
import java.util.List;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.springframework.stereotype.Component;

/**
 * Rolling Pearson correlation between a candidate symbol and the symbols already held.
 *
 * <p>Uses the tail-aligned overlap of the two return series, at most {@link #WINDOW}
 * points. With fewer than {@link #MIN_OBSERVATIONS} overlapping points, or a flat series,
 * the pair counts as uncorrelated. The series themselves are refreshed by the fill/price
 * reporter on each price update, so every sizing call sees current data.
 */
@Component
public class CorrelationEstimator {

    public static final int WINDOW = 60;
    public static final int MIN_OBSERVATIONS = 10;

    /** Largest |ρ| between {@code symbol} and any other open position, 0 when none is measurable. */
    public double maxCorrelation(String symbol, PortfolioSnapshot portfolio) {
        if (portfolio == null) {
            return 0.0;
        }
        List<Double> candidate = portfolio.returnsOf(symbol);
        double max = 0.0;
        for (String held : portfolio.getPositions().keySet()) {
            if (held.equals(symbol)) {
                continue;
            }
            max = Math.max(max, Math.abs(correlation(candidate, portfolio.returnsOf(held))));
        }
        return max;
    }

    public double correlation(List<Double> a, List<Double> b) {
        int n = Math.min(WINDOW, Math.min(a.size(), b.size()));
        if (n < MIN_OBSERVATIONS) {
            return 0.0;
        }
        double[] x = new double[n];
        double[] y = new double[n];
        int offsetA = a.size() - n;
        int offsetB = b.size() - n;
        for (int i = 0; i < n; i++) {
            Double va = a.get(offsetA + i);
            Double vb = b.get(offsetB + i);
            if (va == null || vb == null || !Double.isFinite(va) || !Double.isFinite(vb)) {
                return 0.0;
            }
            x[i] = va;
            y[i] = vb;
        }
        double rho = new PearsonsCorrelation().correlation(x, y);
        return Double.isFinite(rho) ? rho : 0.0;
    }
}
