package ai.relocale.recovery;

/**
 * A recovered value and where it came from. Source tags: {@code head}, {@code head:<locale>},
 * {@code history:<commit>}, {@code history:<locale>:<commit>}, {@code ref:<commit>}, {@code diff:<a>..<b>} and
 * {@code source:<commit>:<path>}.
 */
public record RecoveryResult(String value, String source) {

    public static RecoveryResult head(String value) {
        return new RecoveryResult(value, "head");
    }

    public static RecoveryResult headLocale(String value, String locale) {
        return new RecoveryResult(value, "head:" + locale);
    }

    public static RecoveryResult history(String value, String commit) {
        return new RecoveryResult(value, "history:" + commit);
    }

    public static RecoveryResult historyLocale(String value, String locale, String commit) {
        return new RecoveryResult(value, "history:" + locale + ":" + commit);
    }

    public static RecoveryResult ref(String value, String commit) {
        return new RecoveryResult(value, "ref:" + commit);
    }

    public static RecoveryResult diff(String value, String fromCommit, String toCommit) {
        return new RecoveryResult(value, "diff:" + fromCommit + ".." + toCommit);
    }

    public static RecoveryResult source(String value, String commit, String relativePath) {
        return new RecoveryResult(value, "source:" + commit + ":" + relativePath);
    }

    /** Phase name, the part of the source tag before the first colon. */
    public String kind() {
        int colon = source.indexOf(':');
        return colon < 0 ? source : source.substring(0, colon);
    }
}
