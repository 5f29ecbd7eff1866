package com.forum.application.service;

import com.forum.application.port.in.MarkAllReadUseCase.MarkAllReadOutcome;
import com.forum.application.port.in.MarkAllReadUseCase.MarkScope;
import com.forum.application.port.out.DiscussionRepository;
import com.forum.application.port.out.MetricsPort;
import com.forum.application.port.out.ReadMarkRepository;
import com.forum.application.port.out.UserRepository;
import com.forum.domain.filter.FilterResult;
import com.forum.domain.model.DiscussionActivity;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.ReadMark;
import com.forum.domain.model.ReadStatus;
import com.forum.domain.model.UserId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Records and answers "has this user seen this discussion's latest activity".
 *
 * <p>State is split between per-discussion read marks and one read-since watermark per user. Marking a
 * filtered subset as read writes one mark per discussion of the subset; marking the whole board as read
 * only moves the watermark, so its cost does not grow with the number of discussions.
 */
@Service
public class ReadStatusTracker {

    private static final Logger log = LoggerFactory.getLogger(ReadStatusTracker.class);

    private final ReadMarkRepository readMarkRepository;
    private final DiscussionRepository discussionRepository;
    private final UserRepository userRepository;
    private final MetricsPort metrics;

    public ReadStatusTracker(
            ReadMarkRepository readMarkRepository,
            DiscussionRepository discussionRepository,
            UserRepository userRepository,
            MetricsPort metrics) {
        this.readMarkRepository = readMarkRepository;
        this.discussionRepository = discussionRepository;
        this.userRepository = userRepository;
        this.metrics = metrics;
    }

    @Transactional
    public void recordView(UserId userId, UUID discussionId, Instant now) {
        readMarkRepository.upsert(new ReadMark(userId, discussionId, now));
        metrics.incrementViews();
        log.debug("View recorded: user={}, discussion={}, at={}", userId, discussionId, now);
    }

    /**
     * Ids of the candidate discussions that are read for the user. Only the candidates are examined.
     */
    @Transactional(readOnly = true)
    public Set<UUID> readIds(DiscussionQuery candidates, UserId userId) {
        return metrics.recordReadStatusComputation(() -> {
            Instant watermark = userRepository.findReadSinceWatermark(userId).orElse(null);
            List<DiscussionActivity> activity = discussionRepository.findActivity(candidates, userId);

            Set<UUID> read = activity.stream()
                .filter(a -> a.readStatus(watermark) == ReadStatus.READ)
                .map(DiscussionActivity::discussionId)
                .collect(Collectors.toSet());

            log.debug("Read status computed: user={}, candidates={}, read={}", userId, activity.size(), read.size());
            return read;
        });
    }

    /**
     * Marks everything the filter result selects as read.
     *
     * <p>The branch depends only on whether a narrowing filter was applied, never on how many discussions
     * matched: filtered requests get one mark per matching discussion, all stamped {@code now}, written as
     * a single batch; unfiltered requests move the user's watermark to {@code now}. Both writes are
     * idempotent, so a failed attempt can simply be retried.
     */
    @Transactional
    public MarkAllReadOutcome markAllRead(UserId userId, FilterResult filterResult, Instant now) {
        if (filterResult.applied().isNarrowed()) {
            List<UUID> ids = discussionRepository.findIds(filterResult.query());
            if (!ids.isEmpty()) {
                List<ReadMark> marks = ids.stream()
                    .map(id -> new ReadMark(userId, id, now))
                    .toList();
                readMarkRepository.upsertAll(marks);
                metrics.incrementReadMarksWritten(marks.size());
            }
            log.info("Marked {} filtered discussions read: user={}, at={}", ids.size(), userId, now);
            return new MarkAllReadOutcome(MarkScope.FILTERED, ids.size(), now, filterResult.applied());
        }

        userRepository.advanceReadSinceWatermark(userId, now);
        metrics.incrementWatermarkAdvances();
        log.info("Read-since watermark advanced: user={}, at={}", userId, now);
        return new MarkAllReadOutcome(MarkScope.WATERMARK, 0, now, filterResult.applied());
    }
}
