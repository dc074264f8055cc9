package bigo.conductor.classifier;

import java.util.List;

/**
 * Rough change-size estimate from substring cues in the task text.
 * Buckets are checked broadest first so that "across the entire codebase"
 * lands in the widest bucket it names.
 */
public final class ScopeEstimator {

    static final int DEFAULT_LINES = 50;
    static final int DEFAULT_FILES = 2;
    static final int SINGLE_FILE_LINES = 5;

    private record Bucket(int value, List<String> cues) {
        boolean matches(String text) {
            for (String cue : cues) {
                if (text.contains(cue)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final List<Bucket> LINE_BUCKETS = List.of(
            new Bucket(500, List.of("entire", "complete", "full")),
            new Bucket(200, List.of("large", "major", "significant")),
            new Bucket(20, List.of("small", "minor")),
            new Bucket(5, List.of("few lines")),
            new Bucket(1, List.of("single line", "one line")));

    private static final List<Bucket> FILE_BUCKETS = List.of(
            new Bucket(20, List.of("codebase", "project-wide")),
            new Bucket(10, List.of("across", "throughout")),
            new Bucket(5, List.of("multiple file", "several file")),
            new Bucket(1, List.of("single file", "one file", "this file")));

    public record Estimate(int lines, int files) {
    }

    /**
     * @param text lower-cased task text
     */
    public Estimate estimate(String text) {
        int files = firstMatch(FILE_BUCKETS, text, DEFAULT_FILES);
        Integer lines = firstMatch(LINE_BUCKETS, text);
        if (lines == null) {
            // a task confined to one file with no size hint is treated as a small edit
            lines = files == 1 ? SINGLE_FILE_LINES : DEFAULT_LINES;
        }
        return new Estimate(lines, files);
    }

    private static int firstMatch(List<Bucket> buckets, String text, int fallback) {
        Integer value = firstMatch(buckets, text);
        return value != null ? value : fallback;
    }

    private static Integer firstMatch(List<Bucket> buckets, String text) {
        for (Bucket bucket : buckets) {
            if (bucket.matches(text)) {
                return bucket.value();
            }
        }
        return null;
    }
}
