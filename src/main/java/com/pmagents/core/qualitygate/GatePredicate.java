package com.pmagents.core.qualitygate;

import com.pmagents.core.aggregation.AggregatedResult;

/**
 * A named custom quality check, referenced by {@code CUSTOM_PREDICATE} gates. Spring beans
 * implementing this interface are available to {@link ValidationPipeline} by name.
 */
public interface GatePredicate {

    String name();

    boolean test(AggregatedResult result, double threshold);
}
