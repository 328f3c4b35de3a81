package com.jeevanfit.backend.trend.service;

/**
 * 純數學工具：x 軸固定為 0..n-1。
 */
final class TrendStats {

    private TrendStats() {}

    static double mean(double[] y) {
        if (y.length == 0) return 0.0;
        double s = 0.0;
        for (double v : y) s += v;
        return s / y.length;
    }

    static boolean constant(double[] y) {
        for (int i = 1; i < y.length; i++) {
            if (Double.compare(y[i], y[0]) != 0) return false;
        }
        return true;
    }

    /** least-squares 斜率 */
    static double slope(double[] y) {
        int n = y.length;
        if (n < 2) return 0.0;
        double mx = (n - 1) / 2.0;
        double my = mean(y);
        double num = 0.0;
        double den = 0.0;
        for (int i = 0; i < n; i++) {
            num += (i - mx) * (y[i] - my);
            den += (i - mx) * (i - mx);
        }
        return den == 0.0 ? 0.0 : num / den;
    }

    static double rSquared(double[] y, double slope) {
        int n = y.length;
        double mx = (n - 1) / 2.0;
        double my = mean(y);
        double ssTot = 0.0;
        double ssRes = 0.0;
        for (int i = 0; i < n; i++) {
            double predicted = my + slope * (i - mx);
            ssTot += (y[i] - my) * (y[i] - my);
            ssRes += (y[i] - predicted) * (y[i] - predicted);
        }
        if (ssTot == 0.0) return 0.0;
        return clamp01(1.0 - ssRes / ssTot);
    }

    /**
     * 相鄰差值與斜率同號的比例（差值為 0 不算同號）。
     */
    static double signAgreement(double[] y, double slope) {
        if (y.length < 2 || slope == 0.0) return 0.0;
        int agree = 0;
        for (int i = 1; i < y.length; i++) {
            double d = y[i] - y[i - 1];
            if (Math.signum(d) == Math.signum(slope)) agree++;
        }
        return (double) agree / (y.length - 1);
    }

    static double autocorrelation(double[] y, int lag) {
        int n = y.length;
        if (lag <= 0 || lag >= n) return 0.0;
        double m = mean(y);
        double den = 0.0;
        for (double v : y) den += (v - m) * (v - m);
        if (den == 0.0) return 0.0;
        double num = 0.0;
        for (int i = 0; i + lag < n; i++) {
            num += (y[i] - m) * (y[i + lag] - m);
        }
        return num / den;
    }

    /** Pearson r；任一邊沒有變異時回 0 */
    static double pearson(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        if (n < 2) return 0.0;
        double ma = 0.0;
        double mb = 0.0;
        for (int i = 0; i < n; i++) {
            ma += a[i];
            mb += b[i];
        }
        ma /= n;
        mb /= n;
        double cov = 0.0;
        double va = 0.0;
        double vb = 0.0;
        for (int i = 0; i < n; i++) {
            cov += (a[i] - ma) * (b[i] - mb);
            va += (a[i] - ma) * (a[i] - ma);
            vb += (b[i] - mb) * (b[i] - mb);
        }
        if (va == 0.0 || vb == 0.0) return 0.0;
        double r = cov / Math.sqrt(va * vb);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
