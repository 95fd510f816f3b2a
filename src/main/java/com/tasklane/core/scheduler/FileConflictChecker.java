package com.tasklane.core.scheduler;

import com.tasklane.core.model.FileImpact;
import com.tasklane.core.model.FileOperation;
import com.tasklane.core.model.Task;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether two tasks may run in the same wave based on their declared file operations.
 *
 * <p>Conflict matrix (symmetric, same path only): CREATE/CREATE, UPDATE/UPDATE, and any pairing
 * of DELETE with CREATE, UPDATE or DELETE conflict. Anything paired with READ is safe, as is
 * CREATE/UPDATE. Declared confidence is ignored: every declared impact is binding.
 */
@Service
public class FileConflictChecker {

    /**
     * A single conflicting path between two tasks.
     */
    public record FileConflict(String path, FileOperation operationA, FileOperation operationB) {}

    public boolean conflicts(Task a, Task b) {
        return !conflictingPaths(a, b).isEmpty();
    }

    /**
     * True when the tasks must not share a wave: a file conflict or an explicit conflicts_with edge
     * in either direction.
     */
    public boolean excludes(Task a, Task b) {
        return a.conflictsWith().contains(b.id())
                || b.conflictsWith().contains(a.id())
                || conflicts(a, b);
    }

    public List<FileConflict> conflictingPaths(Task a, Task b) {
        return conflictingPaths(a.fileImpacts(), b.fileImpacts());
    }

    public List<FileConflict> conflictingPaths(List<FileImpact> impactsA, List<FileImpact> impactsB) {
        var conflicts = new ArrayList<FileConflict>();
        for (var impactA : impactsA) {
            String pathA = normalizePath(impactA.path());
            for (var impactB : impactsB) {
                if (pathA.equals(normalizePath(impactB.path()))
                        && operationsConflict(impactA.operation(), impactB.operation())) {
                    conflicts.add(new FileConflict(pathA, impactA.operation(), impactB.operation()));
                }
            }
        }
        return conflicts;
    }

    static boolean operationsConflict(FileOperation x, FileOperation y) {
        if (x == FileOperation.READ || y == FileOperation.READ) {
            return false;
        }
        if (x == FileOperation.DELETE || y == FileOperation.DELETE) {
            return true;
        }
        return x == y;
    }

    /**
     * Normalizes separators, leading "./" or "/", duplicate and trailing slashes, and case.
     */
    static String normalizePath(String path) {
        String p = path.trim().replace('\\', '/').replaceAll("/+", "/");
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        if (p.startsWith("/")) {
            p = p.substring(1);
        }
        if (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p.toLowerCase();
    }
}
