package com.forum.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementListings();

    void incrementViews();

    void incrementReadMarksWritten(int count);

    void incrementWatermarkAdvances();

    void incrementDiscussionsStarted();

    void incrementCommentsPosted();

    void incrementOutboxEventsPublished(int count);

    <T> T recordReadStatusComputation(Supplier<T> operation);
}
