package com.synos.anomaly.ml;

import java.io.Serializable;

/**
 * 스케일링된 feature 벡터 -> 이상 점수 [0, 1] (클수록 이상)
 */
public interface AnomalyScorer extends Serializable {

    double score(double[] scaledFeatures);
}
