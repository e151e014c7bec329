package com.synos.anomaly.ml;

import smile.classification.RandomForest;
import smile.data.DataFrame;
import smile.data.formula.Formula;
import smile.data.vector.IntVector;
import smile.math.MathEx;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * 지도학습 Random Forest scorer: 이상 클래스(1)의 사후확률을 점수로 사용
 */
public class RandomForestScorer implements AnomalyScorer {

    private static final long serialVersionUID = 1L;

    static final String LABEL = "is_anomaly";

    private final RandomForest model;
    private final String[] columns;

    RandomForestScorer(RandomForest model, String[] columns) {
        this.model = model;
        this.columns = columns;
    }

    public static RandomForestScorer fit(double[][] scaledData, int[] labels, List<String> featureNames,
                                         int trees, long seed) {
        String[] columns = featureNames.toArray(new String[0]);
        DataFrame data = frame(scaledData, labels, columns);

        Properties params = new Properties();
        params.setProperty("smile.random_forest.trees", String.valueOf(trees));
        MathEx.setSeed(seed);
        RandomForest model = RandomForest.fit(Formula.lhs(LABEL), data, params);
        return new RandomForestScorer(model, columns);
    }

    @Override
    public double score(double[] scaledFeatures) {
        DataFrame row = frame(new double[][]{scaledFeatures}, new int[]{0}, columns);
        double[] posteriori = new double[2];
        model.predict(row.get(0), posteriori);
        return posteriori[1];
    }

    public int predict(double[] scaledFeatures) {
        DataFrame row = frame(new double[][]{scaledFeatures}, new int[]{0}, columns);
        return model.predict(row.get(0));
    }

    /**
     * feature 이름 -> 중요도 (학습 컬럼 순서 유지)
     */
    public Map<String, Double> featureImportance() {
        double[] importance = model.importance();
        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < columns.length && i < importance.length; i++) {
            result.put(columns[i], importance[i]);
        }
        return result;
    }

    // label 컬럼까지 포함해 학습 때와 같은 schema로 구성
    private static DataFrame frame(double[][] data, int[] labels, String[] columns) {
        return DataFrame.of(data, columns).merge(IntVector.of(LABEL, labels));
    }
}
