package ai.relocale.text;

import java.util.function.Function;

/**
 * A named predicate in the "looks like user text" decision. Rules are evaluated in priority order and the first one
 * that does not {@link Outcome#CONTINUE} decides.
 */
public record TextRule(String name, Function<String, Outcome> check) {

    public enum Outcome {
        ACCEPT,
        REJECT,
        CONTINUE
    }

    /** Outcome tagged with the rule that produced it. */
    public record Verdict(String rule, Outcome outcome) {
        public boolean accepted() {
            return outcome == Outcome.ACCEPT;
        }
    }

    public Verdict apply(String text) {
        return new Verdict(name, check.apply(text));
    }

    static TextRule rejectIf(String name, Function<String, Boolean> predicate) {
        return new TextRule(name, text -> predicate.apply(text) ? Outcome.REJECT : Outcome.CONTINUE);
    }

    static TextRule acceptIf(String name, Function<String, Boolean> predicate) {
        return new TextRule(name, text -> predicate.apply(text) ? Outcome.ACCEPT : Outcome.CONTINUE);
    }
}
