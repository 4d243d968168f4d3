package ai.relocale.text;

import java.util.Comparator;

/** A string pulled out of source text together with its relevance score. */
public record Candidate(String text, int score) {

    /** Highest score first, longer text breaking ties. */
    public static final Comparator<Candidate> BY_SCORE_DESC = Comparator.comparingInt(Candidate::score)
            .reversed()
            .thenComparing(Comparator.comparingInt((Candidate c) -> c.text().length()).reversed());
}
