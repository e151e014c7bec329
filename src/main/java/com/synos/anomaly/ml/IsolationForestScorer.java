package com.synos.anomaly.ml;

import com.synos.anomaly.service.BaselineStatistics;
import smile.anomaly.IsolationForest;

/**
 * Isolation Forest 점수를 학습 데이터 분포로 보정한 scorer
 * 학습 점수의 중앙값 -> 0, (1 - contamination) 분위수 -> targetScore
 */
public class IsolationForestScorer implements AnomalyScorer {

    private static final long serialVersionUID = 1L;

    private final IsolationForest forest;
    private final double medianScore;
    private final double thresholdScore;
    private final double targetScore;

    IsolationForestScorer(IsolationForest forest, double medianScore, double thresholdScore, double targetScore) {
        this.forest = forest;
        this.medianScore = medianScore;
        this.thresholdScore = thresholdScore;
        this.targetScore = targetScore;
    }

    public static IsolationForestScorer fit(double[][] scaledData, double contamination, double targetScore) {
        IsolationForest forest = IsolationForest.fit(scaledData);

        double[] trainingScores = new double[scaledData.length];
        for (int i = 0; i < scaledData.length; i++) {
            trainingScores[i] = forest.score(scaledData[i]);
        }
        double median = BaselineStatistics.percentile(trainingScores, 50);
        double threshold = BaselineStatistics.percentile(trainingScores, 100.0 * (1.0 - contamination));
        return new IsolationForestScorer(forest, median, threshold, targetScore);
    }

    @Override
    public double score(double[] scaledFeatures) {
        double raw = forest.score(scaledFeatures);
        double spread = thresholdScore - medianScore;
        if (spread <= 1e-12) {
            return raw > thresholdScore ? 1.0 : 0.0;
        }
        double calibrated = (raw - medianScore) / spread * targetScore;
        return Math.max(0.0, Math.min(1.0, calibrated));
    }
}
