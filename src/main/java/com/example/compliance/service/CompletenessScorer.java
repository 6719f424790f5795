package com.example.compliance.service;

import com.example.compliance.model.TestCase;
import org.springframework.stereotype.Component;

/**
 * Structural completeness of a test case: a weighted checklist of populated fields.
 * <p>
 * Weights (in tenths): title 1, description 1, preconditions 1, test steps 3,
 * expected results 2, postconditions 1, priority 1. They add up to exactly 1.0.
 */
@Component
public class CompletenessScorer {

    public double score(TestCase testCase) {
        int tenths = 0;
        if (!testCase.title().isEmpty()) tenths += 1;
        if (!testCase.description().isEmpty()) tenths += 1;
        if (!testCase.preconditions().isEmpty()) tenths += 1;
        if (!testCase.testSteps().isEmpty()) tenths += 3;
        if (!testCase.expectedResults().isEmpty()) tenths += 2;
        if (!testCase.postconditions().isEmpty()) tenths += 1;
        if (!testCase.priority().isEmpty()) tenths += 1;
        return tenths / 10.0;
    }
}
