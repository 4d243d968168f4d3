package ai.relocale.history;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

public class DisabledHistorySource implements VersionHistorySource {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public List<CommitRef> listCommits(String path, @Nullable Instant since, int maxCount) {
        return List.of();
    }

    @Override
    public Map<String, List<CommitRef>> listCommits(Collection<String> paths, @Nullable Instant since, int maxCount) {
        return Map.of();
    }

    @Override
    public @Nullable String contentAt(String path, String commit) {
        return null;
    }

    @Override
    public @Nullable String diff(String path, String fromCommit, String toCommit) {
        return null;
    }

    @Override
    public @Nullable String headCommit() {
        return null;
    }
}
