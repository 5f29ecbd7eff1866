package com.forum.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReadStatus")
class ReadStatusTest {

    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2024-01-01T11:00:00Z");
    private static final Instant T2 = Instant.parse("2024-01-01T12:00:00Z");

    @Nested
    @DisplayName("of")
    class OfTests {

        @Test
        @DisplayName("Should be unread without mark and without watermark")
        void shouldBeUnreadWithoutMarkOrWatermark() {
            assertEquals(ReadStatus.UNREAD, ReadStatus.of(T0, null, null));
        }

        @Test
        @DisplayName("Should follow view then new comment")
        void shouldFollowViewThenComment() {
            // Never viewed
            assertEquals(ReadStatus.UNREAD, ReadStatus.of(T0, null, null));
            // Viewed at t1
            assertEquals(ReadStatus.READ, ReadStatus.of(T0, T1, null));
            // A comment bumps last activity to t2
            assertEquals(ReadStatus.UNREAD, ReadStatus.of(T2, T1, null));
        }

        @Test
        @DisplayName("Should treat a mark equal to last activity as read")
        void shouldTreatEqualMarkAsRead() {
            assertEquals(ReadStatus.READ, ReadStatus.of(T1, T1, null));
        }

        @Test
        @DisplayName("Should treat a watermark equal to last activity as read")
        void shouldTreatEqualWatermarkAsRead() {
            assertEquals(ReadStatus.READ, ReadStatus.of(T1, null, T1));
        }

        @Test
        @DisplayName("Should mark everything at or before the watermark as read")
        void shouldApplyWatermarkToOlderActivity() {
            Instant watermark = Instant.ofEpochSecond(100);

            assertEquals(ReadStatus.READ, ReadStatus.of(Instant.ofEpochSecond(50), null, watermark));
            assertEquals(ReadStatus.READ, ReadStatus.of(Instant.ofEpochSecond(90), null, watermark));
            assertEquals(ReadStatus.UNREAD, ReadStatus.of(Instant.ofEpochSecond(150), null, watermark));
        }

        @Test
        @DisplayName("Should keep a fresh mark read when the watermark is older")
        void shouldKeepFreshMarkWhenWatermarkIsOlder() {
            assertEquals(ReadStatus.READ, ReadStatus.of(T1, T2, T0));
        }

        @Test
        @DisplayName("Should be read by watermark even when the mark is stale")
        void shouldBeReadByWatermarkWhenMarkIsStale() {
            assertEquals(ReadStatus.READ, ReadStatus.of(T1, T0, T2));
        }

        @Test
        @DisplayName("Should be unread when both mark and watermark are older")
        void shouldBeUnreadWhenBothAreOlder() {
            assertEquals(ReadStatus.UNREAD, ReadStatus.of(T2, T1, T0));
        }
    }

    @Nested
    @DisplayName("fromParam")
    class FromParamTests {

        @Test
        @DisplayName("Should recognize read and unread")
        void shouldRecognizeValues() {
            assertEquals(ReadStatus.READ, ReadStatus.fromParam("read").orElseThrow());
            assertEquals(ReadStatus.UNREAD, ReadStatus.fromParam("unread").orElseThrow());
        }

        @Test
        @DisplayName("Should ignore anything else")
        void shouldIgnoreUnknownValues() {
            assertTrue(ReadStatus.fromParam(null).isEmpty());
            assertTrue(ReadStatus.fromParam("").isEmpty());
            assertTrue(ReadStatus.fromParam("READ").isEmpty());
            assertTrue(ReadStatus.fromParam("seen").isEmpty());
        }
    }

    @Test
    @DisplayName("DiscussionActivity should delegate to the same comparison")
    void activityShouldUseSameComparison() {
        var activity = new DiscussionActivity(java.util.UUID.randomUUID(), T1, null);

        assertEquals(ReadStatus.UNREAD, activity.readStatus(null));
        assertEquals(ReadStatus.UNREAD, activity.readStatus(T0));
        assertEquals(ReadStatus.READ, activity.readStatus(T2));
    }
}
