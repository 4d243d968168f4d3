package ai.relocale.history;

import java.time.Instant;

/** One commit touching a file, as returned by {@link VersionHistorySource#listCommits}. Lists are newest first. */
public record CommitRef(String hash, Instant date, String message) {

    public String shortHash() {
        return hash.length() > 7 ? hash.substring(0, 7) : hash;
    }
}
