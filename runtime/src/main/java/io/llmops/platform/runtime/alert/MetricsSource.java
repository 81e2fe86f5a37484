package io.llmops.platform.runtime.alert;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Supplies metric samples to the alert evaluator.
 */
@FunctionalInterface
public interface MetricsSource {

    /**
     * Collect the samples observed since the previous poll.
     *
     * @return new samples, possibly empty
     * @throws MetricsUnavailableException if the source cannot be reached
     */
    @Nonnull
    List<MetricSample> poll() throws MetricsUnavailableException;
}
