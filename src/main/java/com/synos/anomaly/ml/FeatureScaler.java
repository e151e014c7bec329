package com.synos.anomaly.ml;

import com.synos.anomaly.service.BaselineStatistics;

import java.io.Serializable;

/**
 * 컬럼별 (x - center) / scale 변환
 * standard: 평균/표준편차, robust: 중앙값/IQR
 */
public final class FeatureScaler implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final double[] center;
    private final double[] scale;

    private FeatureScaler(String kind, double[] center, double[] scale) {
        this.kind = kind;
        this.center = center;
        this.scale = scale;
    }

    public static FeatureScaler standard(double[][] data) {
        int columns = columnCount(data);
        double[] mean = new double[columns];
        double[] std = new double[columns];
        for (int c = 0; c < columns; c++) {
            double[] column = column(data, c);
            double sum = 0.0;
            for (double v : column) {
                sum += v;
            }
            mean[c] = sum / column.length;
            double squares = 0.0;
            for (double v : column) {
                squares += (v - mean[c]) * (v - mean[c]);
            }
            // 모집단 표준편차, 0이면 스케일링하지 않음
            std[c] = nonZero(Math.sqrt(squares / column.length));
        }
        return new FeatureScaler("standard", mean, std);
    }

    public static FeatureScaler robust(double[][] data) {
        int columns = columnCount(data);
        double[] median = new double[columns];
        double[] iqr = new double[columns];
        for (int c = 0; c < columns; c++) {
            double[] column = column(data, c);
            median[c] = BaselineStatistics.percentile(column, 50);
            iqr[c] = nonZero(BaselineStatistics.percentile(column, 75) - BaselineStatistics.percentile(column, 25));
        }
        return new FeatureScaler("robust", median, iqr);
    }

    public double[] transform(double[] row) {
        if (row.length != center.length) {
            throw new IllegalArgumentException(
                    "Feature vector has " + row.length + " columns, scaler expects " + center.length);
        }
        double[] scaled = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            scaled[i] = (row[i] - center[i]) / scale[i];
        }
        return scaled;
    }

    public double[][] transform(double[][] data) {
        double[][] scaled = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            scaled[i] = transform(data[i]);
        }
        return scaled;
    }

    public String getKind() {
        return kind;
    }

    private static int columnCount(double[][] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Cannot fit scaler on empty data");
        }
        return data[0].length;
    }

    private static double[] column(double[][] data, int c) {
        double[] column = new double[data.length];
        for (int r = 0; r < data.length; r++) {
            column[r] = data[r][c];
        }
        return column;
    }

    private static double nonZero(double value) {
        return value == 0.0 || !Double.isFinite(value) ? 1.0 : value;
    }
}
