package ai.relocale.history;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only view of a workspace's version history. Paths are workspace-relative and use forward slashes.
 *
 * <p>Implementations never throw for missing files, unknown commits or an unreadable repository: lookups return an
 * empty list or {@code null} instead.
 */
public interface VersionHistorySource {

    /** The source used when the workspace has no repository. */
    VersionHistorySource NONE = new DisabledHistorySource();

    /** Whether this source is backed by a real repository. */
    boolean isAvailable();

    /**
     * Commits that touched {@code path}, newest first.
     *
     * @param since only commits at or after this instant; {@code null} for no lower bound
     * @param maxCount upper bound on the number of commits returned
     */
    List<CommitRef> listCommits(String path, @Nullable Instant since, int maxCount);

    /**
     * Batched form of {@link #listCommits(String, Instant, int)}. Implementations backed by an external process or a
     * repository walk should override this to answer all paths in one pass.
     */
    default Map<String, List<CommitRef>> listCommits(Collection<String> paths, @Nullable Instant since, int maxCount) {
        var result = new LinkedHashMap<String, List<CommitRef>>();
        for (var path : paths) {
            result.put(path, listCommits(path, since, maxCount));
        }
        return result;
    }

    /** File content at the given commit, or {@code null} if the file did not exist there or cannot be read. */
    @Nullable
    String contentAt(String path, String commit);

    /**
     * Unified diff of {@code path} from {@code fromCommit} to {@code toCommit}, with {@code @@} hunk headers and
     * {@code +}/{@code -} line prefixes. {@code null} when either side is unavailable.
     */
    @Nullable
    String diff(String path, String fromCommit, String toCommit);

    /** Full hash of the current HEAD commit, or {@code null}. */
    @Nullable
    String headCommit();
}
