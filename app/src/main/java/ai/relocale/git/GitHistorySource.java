package ai.relocale.git;

import ai.relocale.history.CommitRef;
import ai.relocale.history.VersionHistorySource;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.errors.RevWalkException;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.CommitTimeRevFilter;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.AndTreeFilter;
import org.eclipse.jgit.treewalk.filter.PathFilterGroup;
import org.eclipse.jgit.treewalk.filter.TreeFilter;
import org.jetbrains.annotations.Nullable;

/**
 * {@link VersionHistorySource} over a local Git repository using JGit. The workspace may be the work tree root or a
 * directory inside it; paths are translated accordingly. Every lookup logs failures at debug level and degrades to an
 * empty or null answer.
 */
public final class GitHistorySource implements VersionHistorySource, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GitHistorySource.class);
    private static final int DIFF_CONTEXT_LINES = 3;

    private final Git git;
    private final Repository repository;
    private final String pathPrefix;

    GitHistorySource(Git git, String pathPrefix) {
        this.git = git;
        this.repository = git.getRepository();
        this.pathPrefix = pathPrefix;
    }

    /**
     * Opens the repository containing {@code workspace}, or returns {@link VersionHistorySource#NONE} when there is
     * none or it cannot be read.
     */
    public static VersionHistorySource open(Path workspace) {
        if (!hasGitRepo(workspace)) {
            logger.debug("No git repository at {}", workspace);
            return VersionHistorySource.NONE;
        }
        try {
            var repo = new FileRepositoryBuilder().findGitDir(workspace.toFile()).build();
            var workTree = repo.getWorkTree().toPath().toRealPath();
            var prefix = workTree.relativize(workspace.toRealPath()).toString().replace('\\', '/');
            return new GitHistorySource(new Git(repo), prefix.isEmpty() ? "" : prefix + "/");
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            logger.warn("Could not open git repository for {}: {}", workspace, e.getMessage());
            return VersionHistorySource.NONE;
        }
    }

    /** True if {@code dir} is inside a readable repository with at least one local branch. */
    public static boolean hasGitRepo(Path dir) {
        try {
            var builder = new FileRepositoryBuilder().findGitDir(dir.toFile());
            if (builder.getGitDir() == null) {
                return false;
            }
            try (var repo = builder.build()) {
                return !repo.getRefDatabase().getRefsByPrefix(Constants.R_HEADS).isEmpty();
            }
        } catch (IOException e) {
            logger.warn("Could not read git repo at {}: {}", dir, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public List<CommitRef> listCommits(String path, @Nullable Instant since, int maxCount) {
        return listCommits(List.of(path), since, maxCount).getOrDefault(path, List.of());
    }

    /** One history walk filtered to all {@code paths}; each path keeps at most {@code maxCount} commits. */
    @Override
    public Map<String, List<CommitRef>> listCommits(Collection<String> paths, @Nullable Instant since, int maxCount) {
        var result = new LinkedHashMap<String, List<CommitRef>>();
        paths.forEach(p -> result.put(p, new ArrayList<>()));
        if (paths.isEmpty() || maxCount <= 0) {
            return result;
        }
        var byRepoPath = paths.stream().distinct().collect(Collectors.toMap(this::toRepoPath, p -> p));
        var filter = PathFilterGroup.createFromStrings(byRepoPath.keySet());
        try (var walk = new RevWalk(repository)) {
            var head = repository.resolve(Constants.HEAD);
            if (head == null) {
                return result;
            }
            walk.setRewriteParents(false);
            walk.markStart(walk.parseCommit(head));
            walk.setTreeFilter(AndTreeFilter.create(filter, TreeFilter.ANY_DIFF));
            if (since != null) {
                walk.setRevFilter(CommitTimeRevFilter.after(Date.from(since)));
            }
            var remaining = new HashMap<String, Integer>();
            byRepoPath.keySet().forEach(p -> remaining.put(p, maxCount));
            for (var commit : walk) {
                var ref = toRef(commit);
                for (var changed : changedPaths(commit, filter)) {
                    var left = remaining.getOrDefault(changed, 0);
                    if (left > 0) {
                        result.get(byRepoPath.get(changed)).add(ref);
                        remaining.put(changed, left - 1);
                    }
                }
                if (remaining.values().stream().allMatch(n -> n == 0)) {
                    break;
                }
            }
        } catch (IOException | RevWalkException e) {
            logger.debug("History walk failed for {}: {}", paths, e.getMessage());
        }
        return result;
    }

    private Set<String> changedPaths(RevCommit commit, TreeFilter filter) throws IOException {
        try (var treeWalk = new TreeWalk(repository)) {
            treeWalk.setRecursive(true);
            if (commit.getParentCount() == 0) {
                treeWalk.addTree(new EmptyTreeIterator());
            } else {
                treeWalk.addTree(repository.parseCommit(commit.getParent(0)).getTree());
            }
            treeWalk.addTree(commit.getTree());
            treeWalk.setFilter(AndTreeFilter.create(filter, TreeFilter.ANY_DIFF));
            var changed = new HashSet<String>();
            while (treeWalk.next()) {
                changed.add(treeWalk.getPathString());
            }
            return changed;
        }
    }

    private static CommitRef toRef(RevCommit commit) {
        return new CommitRef(commit.getName(), Instant.ofEpochSecond(commit.getCommitTime()), commit.getShortMessage());
    }

    @Override
    public @Nullable String contentAt(String path, String commit) {
        try {
            var commitId = repository.resolve(commit);
            if (commitId == null) {
                return null;
            }
            try (var walk = new RevWalk(repository)) {
                var revCommit = walk.parseCommit(commitId);
                try (var treeWalk = TreeWalk.forPath(repository, toRepoPath(path), revCommit.getTree())) {
                    if (treeWalk == null) {
                        return null;
                    }
                    var loader = repository.open(treeWalk.getObjectId(0));
                    return new String(loader.getBytes(), StandardCharsets.UTF_8);
                }
            }
        } catch (IOException | RevisionSyntaxException e) {
            logger.debug("Could not read {} at {}: {}", path, commit, e.getMessage());
            return null;
        }
    }

    @Override
    public @Nullable String diff(String path, String fromCommit, String toCommit) {
        var before = contentAt(path, fromCommit);
        var after = contentAt(path, toCommit);
        if (before == null || after == null) {
            return null;
        }
        var beforeLines = before.lines().toList();
        var patch = DiffUtils.diff(beforeLines, after.lines().toList());
        var unified = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + path, "b/" + path, beforeLines, patch, DIFF_CONTEXT_LINES);
        return String.join("\n", unified);
    }

    @Override
    public @Nullable String headCommit() {
        try {
            var head = repository.resolve(Constants.HEAD);
            return head != null ? head.name() : null;
        } catch (IOException e) {
            logger.debug("Could not resolve HEAD: {}", e.getMessage());
            return null;
        }
    }

    private String toRepoPath(String path) {
        return pathPrefix + path.replace('\\', '/');
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }
}
