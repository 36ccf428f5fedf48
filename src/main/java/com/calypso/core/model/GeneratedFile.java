package com.calypso.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * One file of a generated source tree.
 *
 * @param path    project-relative path, forward slashes
 * @param content full file content
 */
public record GeneratedFile(String path, String content) implements Serializable {

    /**
     * Merges {@code changes} into {@code base} by path: a changed file replaces the
     * file with the same path in place, a new path is appended. Files not mentioned
     * in {@code changes} are kept untouched.
     */
    public static List<GeneratedFile> mergeByPath(List<GeneratedFile> base, List<GeneratedFile> changes) {
        var merged = new ArrayList<>(base);
        for (GeneratedFile change : changes) {
            int idx = indexOf(merged, change.path());
            if (idx >= 0) {
                merged.set(idx, change);
            } else {
                merged.add(change);
            }
        }
        return merged;
    }

    static int indexOf(List<GeneratedFile> files, String path) {
        for (int i = 0; i < files.size(); i++) {
            if (files.get(i).path().equals(path)) {
                return i;
            }
        }
        return -1;
    }
}
