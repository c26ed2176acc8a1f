package com.featuredetect.numeric;

/**
 * Small dense helpers for symmetric 3x3 systems, such as the scale-space Hessian.
 */
public class SymmetricMatrix3 {

    private static final int MAX_SWEEPS = 50;
    private static final double EPSILON = Math.ulp(1.0);

    private SymmetricMatrix3() {
    }

    /**
     * Minimum-norm least squares solution of {@code a x = b} for a symmetric {@code a},
     * computed through the pseudo-inverse. Eigenvalues smaller than {@code 3 * eps * max|lambda|}
     * are treated as zero, so a singular matrix still yields a finite answer.
     */
    public static double[] solveLeastSquares(double[][] a, double[] b) {
        double[][] eigenvectors = new double[3][3];
        double[] eigenvalues = eigenDecomposition(a, eigenvectors);

        double largest = 0;
        for (double value : eigenvalues) {
            largest = Math.max(largest, Math.abs(value));
        }
        double cutoff = 3 * EPSILON * largest;

        double[] x = new double[3];
        for (int k = 0; k < 3; k++) {
            if (Math.abs(eigenvalues[k]) <= cutoff || eigenvalues[k] == 0) {
                continue;
            }
            double projection = 0;
            for (int i = 0; i < 3; i++) {
                projection += eigenvectors[i][k] * b[i];
            }
            projection /= eigenvalues[k];
            for (int i = 0; i < 3; i++) {
                x[i] += projection * eigenvectors[i][k];
            }
        }
        return x;
    }

    /**
     * Cyclic Jacobi eigen decomposition.
     *
     * @param a symmetric input, left untouched.
     * @param eigenvectors receives the eigenvectors as columns.
     * @return eigenvalues in column order of {@code eigenvectors}.
     */
    public static double[] eigenDecomposition(double[][] a, double[][] eigenvectors) {
        double[][] m = new double[3][3];
        for (int i = 0; i < 3; i++) {
            System.arraycopy(a[i], 0, m[i], 0, 3);
            for (int j = 0; j < 3; j++) {
                eigenvectors[i][j] = (i == j) ? 1 : 0;
            }
        }

        for (int sweep = 0; sweep < MAX_SWEEPS; sweep++) {
            double offDiagonal = m[0][1] * m[0][1] + m[0][2] * m[0][2] + m[1][2] * m[1][2];
            double diagonal = m[0][0] * m[0][0] + m[1][1] * m[1][1] + m[2][2] * m[2][2];
            if (offDiagonal == 0 || offDiagonal <= EPSILON * EPSILON * diagonal) {
                break;
            }
            rotate(m, eigenvectors, 0, 1);
            rotate(m, eigenvectors, 0, 2);
            rotate(m, eigenvectors, 1, 2);
        }
        return new double[] { m[0][0], m[1][1], m[2][2] };
    }

    // m <- J^T m J and v <- v J, with J chosen to zero m[p][q]
    private static void rotate(double[][] m, double[][] v, int p, int q) {
        if (m[p][q] == 0) {
            return;
        }
        double theta = (m[q][q] - m[p][p]) / (2 * m[p][q]);
        double t = 1.0 / (Math.abs(theta) + Math.sqrt(theta * theta + 1));
        if (theta < 0) {
            t = -t;
        }
        double c = 1.0 / Math.sqrt(t * t + 1);
        double s = t * c;

        double[][] j = { { 1, 0, 0 }, { 0, 1, 0 }, { 0, 0, 1 } };
        j[p][p] = c;
        j[q][q] = c;
        j[p][q] = s;
        j[q][p] = -s;

        double[][] rotated = multiply(transpose(j), multiply(m, j));
        rotated[p][q] = 0;
        rotated[q][p] = 0;
        for (int i = 0; i < 3; i++) {
            System.arraycopy(rotated[i], 0, m[i], 0, 3);
        }
        double[][] vectors = multiply(v, j);
        for (int i = 0; i < 3; i++) {
            System.arraycopy(vectors[i], 0, v[i], 0, 3);
        }
    }

    static double[][] multiply(double[][] x, double[][] y) {
        double[][] result = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int k = 0; k < 3; k++) {
                double sum = 0;
                for (int n = 0; n < 3; n++) {
                    sum += x[i][n] * y[n][k];
                }
                result[i][k] = sum;
            }
        }
        return result;
    }

    static double[][] transpose(double[][] x) {
        double[][] result = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int k = 0; k < 3; k++) {
                result[k][i] = x[i][k];
            }
        }
        return result;
    }
}
