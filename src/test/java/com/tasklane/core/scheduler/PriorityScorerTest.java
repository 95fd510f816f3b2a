package com.tasklane.core.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.tasklane.core.scheduler.TestTasks.task;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link PriorityScorer}.
 */
class PriorityScorerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final PriorityScorer scorer = new PriorityScorer(
            new DependencyResolver(), Clock.fixed(NOW, ZoneOffset.UTC), 3);

    @Test
    @DisplayName("plain task scores zero")
    void plainTask() {
        var a = task("a").build();

        assertEquals(0, scorer.score(a, List.of(a)));
    }

    @Test
    @DisplayName("each transitive dependent adds the blocked weight")
    void blockedWeight() {
        var a = task("a").build();
        var b = task("b").dependsOn("a").build();
        var c = task("c").dependsOn("b").build();
        var all = List.of(a, b, c);

        assertEquals(2 * PriorityScorer.BLOCKED_WEIGHT, scorer.score(a, all));
        assertEquals(PriorityScorer.BLOCKED_WEIGHT, scorer.score(b, all));
        assertEquals(2, scorer.blockedCount(a, all));
    }

    @Test
    @DisplayName("quick win bonus applies")
    void quickWin() {
        var a = task("a").quickWin().build();

        assertEquals(PriorityScorer.QUICK_WIN_BONUS, scorer.score(a, List.of(a)));
    }

    @Test
    @DisplayName("deadline inside the window adds the bonus, outside does not")
    void deadlineWindow() {
        var soon = task("soon").deadline(NOW.plus(Duration.ofDays(2))).build();
        var edge = task("edge").deadline(NOW.plus(Duration.ofDays(3))).build();
        var later = task("later").deadline(NOW.plus(Duration.ofDays(4))).build();
        var overdue = task("overdue").deadline(NOW.minus(Duration.ofDays(1))).build();
        var all = List.of(soon, edge, later, overdue);

        assertEquals(PriorityScorer.DEADLINE_BONUS, scorer.score(soon, all));
        assertEquals(PriorityScorer.DEADLINE_BONUS, scorer.score(edge, all));
        assertEquals(0, scorer.score(later, all));
        assertEquals(PriorityScorer.DEADLINE_BONUS, scorer.score(overdue, all));
    }

    @Test
    @DisplayName("bulk scores match individual scores")
    void bulkScores() {
        var a = task("a").quickWin().build();
        var b = task("b").dependsOn("a").build();
        var all = List.of(a, b);

        var scores = scorer.scores(all);

        assertEquals(scorer.score(a, all), scores.get("a"));
        assertEquals(scorer.score(b, all), scores.get("b"));
    }
}
