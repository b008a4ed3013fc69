package com.demo.eligibility.service.decision;

import com.demo.eligibility.service.dto.ValidationRecord;

/** Source of the model-confidence signal fed into a decision. */
public interface ConfidenceScorer {

    ConfidencePrediction predict(ValidationRecord validation);
}
