package com.forum.infrastructure.metrics;

import com.forum.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter listings;
    private final Counter views;
    private final Counter readMarksWritten;
    private final Counter watermarkAdvances;
    private final Counter discussionsStarted;
    private final Counter commentsPosted;
    private final Counter outboxEventsPublished;
    private final Timer readStatusDuration;

    public AppMetrics(MeterRegistry registry) {
        this.listings = Counter.builder("discussion_listings_total")
            .description("Total number of discussion listing requests")
            .register(registry);

        this.views = Counter.builder("discussion_views_total")
            .description("Total number of discussion views recorded as read marks")
            .register(registry);

        this.readMarksWritten = Counter.builder("read_marks_written_total")
            .description("Total number of read marks written by filtered mark-all-read")
            .register(registry);

        this.watermarkAdvances = Counter.builder("read_watermark_advances_total")
            .description("Total number of unfiltered mark-all-read requests")
            .register(registry);

        this.discussionsStarted = Counter.builder("discussions_started_total")
            .description("Total number of discussions started")
            .register(registry);

        this.commentsPosted = Counter.builder("comments_posted_total")
            .description("Total number of comments posted")
            .register(registry);

        this.outboxEventsPublished = Counter.builder("outbox_events_published_total")
            .description("Total number of outbox events published to Kafka")
            .register(registry);

        this.readStatusDuration = Timer.builder("read_status_computation_seconds")
            .description("Time taken to compute read status for a candidate set")
            .register(registry);
    }

    @Override
    public void incrementListings() {
        listings.increment();
    }

    @Override
    public void incrementViews() {
        views.increment();
    }

    @Override
    public void incrementReadMarksWritten(int count) {
        readMarksWritten.increment(count);
    }

    @Override
    public void incrementWatermarkAdvances() {
        watermarkAdvances.increment();
    }

    @Override
    public void incrementDiscussionsStarted() {
        discussionsStarted.increment();
    }

    @Override
    public void incrementCommentsPosted() {
        commentsPosted.increment();
    }

    @Override
    public void incrementOutboxEventsPublished(int count) {
        outboxEventsPublished.increment(count);
    }

    @Override
    public <T> T recordReadStatusComputation(Supplier<T> operation) {
        return readStatusDuration.record(operation);
    }
}
