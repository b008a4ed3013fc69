package com.demo.eligibility.service.validation;

import com.demo.eligibility.model.ApplicationExtraction;
import com.demo.eligibility.model.FindingCategory;
import com.demo.eligibility.model.ValidationFinding;

import java.util.List;

/** One pure check over an assembled application. */
public interface ConsistencyChecker {

    FindingCategory category();

    List<ValidationFinding> check(ApplicationExtraction application);
}
