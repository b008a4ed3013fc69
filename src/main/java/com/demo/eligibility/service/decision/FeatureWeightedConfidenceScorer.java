package com.demo.eligibility.service.decision;

import com.demo.eligibility.model.CategoryScores;
import com.demo.eligibility.service.dto.ValidationRecord;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

/**
 * Linear stand-in for the offline eligibility classifier, weighted by that classifier's
 * feature importances. Spread and minimum are taken over the non-zero signals only.
 */
@Component
public class FeatureWeightedConfidenceScorer implements ConfidenceScorer {

    static final double W_QUALITY = 0.2553;
    static final double W_CONSISTENCY = 0.1489;
    static final double W_ASSETS = 0.1277;
    static final double W_VARIANCE = 0.1277;
    static final double W_MIN = 0.1064;
    static final double W_COMPLETENESS = 0.0638;
    static final double W_INCOME = 0.0638;
    static final double W_EMPLOYMENT = 0.0364;

    @Override
    public ConfidencePrediction predict(ValidationRecord v) {
        CategoryScores c = v.categoryScoresOrZero();
        double[] signals = {
                v.getQualityScore(), v.getConsistencyScore(), v.getCompletenessScore(),
                c.assets(), c.employment(), c.income()
        };
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (double s : signals) {
            if (s > 0) stats.addValue(s);
        }
        double variance = stats.getN() > 1 ? stats.getPopulationVariance() : 0.0;
        double min = stats.getN() > 0 ? stats.getMin() : 0.0;

        double p = W_QUALITY * v.getQualityScore()
                + W_CONSISTENCY * v.getConsistencyScore()
                + W_ASSETS * c.assets()
                + W_VARIANCE * variance
                + W_MIN * min
                + W_COMPLETENESS * v.getCompletenessScore()
                + W_INCOME * c.income()
                + W_EMPLOYMENT * c.employment();
        return ConfidencePrediction.of(p);
    }
}
