package com.polkadot.analytics.engine.forecast;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Ordinary least squares with an intercept, solved through SVD so that constant or
 * collinear feature columns (a fixed hour, lags of a perfectly linear series) yield
 * the minimum-norm solution instead of a singular system. Singular values below
 * {@code 1e-10} of the largest one are treated as zero.
 */
public class LinearRegressor implements Regressor {

    private static final long serialVersionUID = 1L;

    private static final double RELATIVE_RANK_TOLERANCE = 1e-10;

    private final double intercept;
    private final double[] coefficients;

    private LinearRegressor(double intercept, double[] coefficients) {
        this.intercept = intercept;
        this.coefficients = coefficients;
    }

    public static LinearRegressor fit(double[][] x, double[] y) {
        int n = x.length;
        int p = x[0].length;
        double[][] design = new double[n][p + 1];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            System.arraycopy(x[i], 0, design[i], 1, p);
        }
        RealMatrix matrix = new Array2DRowRealMatrix(design, false);
        RealVector target = new ArrayRealVector(y, false);
        RealVector beta = minimumNormSolution(new SingularValueDecomposition(matrix), target);

        double[] coefficients = new double[p];
        for (int j = 0; j < p; j++) {
            coefficients[j] = beta.getEntry(j + 1);
        }
        return new LinearRegressor(beta.getEntry(0), coefficients);
    }

    private static RealVector minimumNormSolution(SingularValueDecomposition svd, RealVector target) {
        double[] singular = svd.getSingularValues();
        RealMatrix u = svd.getU();
        RealMatrix v = svd.getV();
        double cutoff = singular[0] * RELATIVE_RANK_TOLERANCE;

        RealVector beta = new ArrayRealVector(v.getRowDimension());
        for (int k = 0; k < singular.length; k++) {
            if (singular[k] <= cutoff) {
                break;
            }
            double weight = u.getColumnVector(k).dotProduct(target) / singular[k];
            beta = beta.add(v.getColumnVector(k).mapMultiply(weight));
        }
        return beta;
    }

    @Override
    public double[] predict(double[][] features) {
        double[] out = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            double sum = intercept;
            for (int j = 0; j < coefficients.length; j++) {
                sum += coefficients[j] * features[i][j];
            }
            out[i] = sum;
        }
        return out;
    }

    public double getIntercept() {
        return intercept;
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }
}
