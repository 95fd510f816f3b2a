package com.tasklane.core.scheduler;

import com.tasklane.core.model.FileOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.tasklane.core.model.FileOperation.*;
import static com.tasklane.core.scheduler.TestTasks.task;
import static org.junit.jupiter.api.Assertions.*;

class FileConflictCheckerTest {

    private final FileConflictChecker checker = new FileConflictChecker();

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource({
            "CREATE, CREATE, true",
            "UPDATE, UPDATE, true",
            "DELETE, CREATE, true",
            "DELETE, UPDATE, true",
            "DELETE, DELETE, true",
            "CREATE, UPDATE, false",
            "READ, CREATE, false",
            "READ, UPDATE, false",
            "READ, DELETE, false",
            "READ, READ, false"
    })
    @DisplayName("conflict matrix is symmetric")
    void conflictMatrix(FileOperation x, FileOperation y, boolean expected) {
        assertEquals(expected, FileConflictChecker.operationsConflict(x, y));
        assertEquals(expected, FileConflictChecker.operationsConflict(y, x));
    }

    @Nested
    @DisplayName("path normalization")
    class Normalization {

        @Test
        @DisplayName("leading slash, dot-slash, backslashes and case are ignored")
        void normalizesEquivalentPaths() {
            assertEquals("server/auth.ts", FileConflictChecker.normalizePath("/server/auth.ts"));
            assertEquals("server/auth.ts", FileConflictChecker.normalizePath("./server/auth.ts"));
            assertEquals("server/auth.ts", FileConflictChecker.normalizePath("Server\\Auth.ts"));
            assertEquals("server/auth.ts", FileConflictChecker.normalizePath("server//auth.ts/"));
        }

        @Test
        @DisplayName("differently spelled same path conflicts")
        void normalizedPathsConflict() {
            var a = task("a").file("/server/auth.ts", CREATE).build();
            var b = task("b").file("./Server/auth.ts", CREATE).build();

            assertTrue(checker.conflicts(a, b));
        }
    }

    @Test
    @DisplayName("different paths never conflict")
    void differentPaths() {
        var a = task("a").file("a.ts", DELETE).build();
        var b = task("b").file("b.ts", DELETE).build();

        assertFalse(checker.conflicts(a, b));
    }

    @Test
    @DisplayName("conflictingPaths lists each clashing path")
    void listsConflictingPaths() {
        var a = task("a").file("x.ts", UPDATE).file("y.ts", READ).build();
        var b = task("b").file("x.ts", UPDATE).file("y.ts", DELETE).build();

        var conflicts = checker.conflictingPaths(a, b);

        assertEquals(1, conflicts.size());
        assertEquals("x.ts", conflicts.get(0).path());
    }

    @Test
    @DisplayName("explicit conflicts_with excludes in either direction")
    void explicitConflict() {
        var a = task("a").conflictsWith("b").build();
        var b = task("b").build();

        assertTrue(checker.excludes(a, b));
        assertTrue(checker.excludes(b, a));
        assertFalse(checker.conflicts(a, b));
    }
}
