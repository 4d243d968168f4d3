package ai.relocale.recovery;

import ai.relocale.text.Candidate;
import ai.relocale.text.CandidateScorer;
import ai.relocale.text.CandidateTextExtractor;
import ai.relocale.text.KeyPaths;
import ai.relocale.text.TranslationCalls;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Pulls the text a translation call replaced out of the unified diff that introduced the call. Only hunks whose
 * added lines contain the call contribute their removed lines.
 */
final class DiffCandidateMiner {
    static final int MIN_SCORE = 3;
    static final int SINGLE_LINE_BONUS = 5;
    private static final Pattern LINE = Pattern.compile("\\R");

    record Hunk(List<String> removed, List<String> added) {}

    private DiffCandidateMiner() {}

    /** Highest-ranked acceptable candidate that {@code plausible} admits, if it scores at least {@link #MIN_SCORE}. */
    static @Nullable Candidate best(
            String unifiedDiff, String key, List<String> placeholderHints, Predicate<String> plausible) {
        var hints = KeyPaths.extractHintWords(key);
        for (var candidate : candidates(unifiedDiff, key, placeholderHints)) {
            if (CandidateAcceptance.isAcceptable(candidate.text(), hints, placeholderHints)
                    && plausible.test(candidate.text())) {
                return candidate.score() >= MIN_SCORE ? candidate : null;
            }
        }
        return null;
    }

    /** Signal-bearing candidates from the removed side, best first. */
    static List<Candidate> candidates(String unifiedDiff, String key, List<String> placeholderHints) {
        var hints = KeyPaths.extractHintWords(key);
        var call = TranslationCalls.callPattern(key);
        var found = new ArrayList<Candidate>();

        for (var hunk : parse(unifiedDiff)) {
            if (hunk.added().stream().noneMatch(line -> call.matcher(line).find())) {
                continue;
            }
            for (var removed : hunk.removed()) {
                addWithSignal(found, CandidateTextExtractor.extract(removed, hints, placeholderHints), hints, placeholderHints);
            }
            if (hunk.removed().size() > 1) {
                var joined = String.join("\n", hunk.removed());
                addWithSignal(found, CandidateTextExtractor.extract(joined, hints, placeholderHints), hints, placeholderHints);
            }
        }

        for (var hunk : parse(unifiedDiff)) {
            for (var removed : hunk.removed()) {
                var single = CandidateTextExtractor.extractHardcodedStringFromLine(removed, key);
                if (single != null
                        && CandidateAcceptance.hasSignal(single, hints, placeholderHints)
                        && !KeyPaths.isKeyLike(single)) {
                    found.add(new Candidate(single, CandidateScorer.score(single, hints) + SINGLE_LINE_BONUS));
                }
            }
        }

        found.sort(Candidate.BY_SCORE_DESC);
        return found;
    }

    private static void addWithSignal(
            List<Candidate> into, List<Candidate> extracted, List<String> hints, List<String> placeholderHints) {
        for (var candidate : extracted) {
            if (CandidateAcceptance.hasSignal(candidate.text(), hints, placeholderHints)
                    && !KeyPaths.isKeyLike(candidate.text())) {
                into.add(candidate);
            }
        }
    }

    static List<Hunk> parse(String unifiedDiff) {
        var hunks = new ArrayList<Hunk>();
        List<String> removed = null;
        List<String> added = null;
        for (var line : LINE.split(unifiedDiff)) {
            if (line.startsWith("@@")) {
                if (removed != null) {
                    hunks.add(new Hunk(removed, added));
                }
                removed = new ArrayList<>();
                added = new ArrayList<>();
            } else if (removed == null) {
                continue;
            } else if (line.startsWith("-") && !line.startsWith("---")) {
                removed.add(line.substring(1));
            } else if (line.startsWith("+") && !line.startsWith("+++")) {
                added.add(line.substring(1));
            }
        }
        if (removed != null) {
            hunks.add(new Hunk(removed, added));
        }
        return hunks;
    }
}
