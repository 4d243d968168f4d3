package ai.relocale.git;

import static org.junit.jupiter.api.Assertions.*;

import ai.relocale.history.CommitRef;
import ai.relocale.history.VersionHistorySource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitHistorySourceTest {
    private static final String EN = "src/locales/en.json";
    private static final String APP = "src/App.tsx";

    @TempDir
    Path tempDir;

    private Path repoRoot;
    private String first;
    private String second;
    private String third;
    private VersionHistorySource source;

    @BeforeEach
    void setUp() throws Exception {
        repoRoot = tempDir.resolve("project");
        Files.createDirectories(repoRoot.resolve("src/locales"));

        try (Git git = Git.init().setDirectory(repoRoot.toFile()).call()) {
            Files.writeString(repoRoot.resolve(EN), "{\n  \"title\": \"Home\"\n}\n");
            git.add().addFilepattern(EN).call();
            first = commit(git, "Add English locale");

            Files.writeString(repoRoot.resolve(APP), "export const App = () => <h1>Home</h1>;\n");
            git.add().addFilepattern(APP).call();
            second = commit(git, "Add app");

            Files.writeString(repoRoot.resolve(EN), "{\n  \"title\": \"Start page\"\n}\n");
            git.add().addFilepattern(EN).call();
            third = commit(git, "Rename title");
        }
        source = GitHistorySource.open(repoRoot);
    }

    private static String commit(Git git, String message) throws Exception {
        return git.commit()
                .setMessage(message)
                .setAuthor("Test User", "test@example.com")
                .setSign(false)
                .call()
                .getName();
    }

    @AfterEach
    void tearDown() {
        if (source instanceof GitHistorySource git) {
            git.close();
        }
    }

    private static List<String> hashes(List<CommitRef> commits) {
        return commits.stream().map(CommitRef::hash).toList();
    }

    @Test
    void testOpensRepository() {
        assertInstanceOf(GitHistorySource.class, source);
        assertTrue(source.isAvailable());
        assertEquals(third, source.headCommit());
    }

    @Test
    void testNoRepositoryGivesDisabledSource() throws Exception {
        var plain = Files.createDirectories(tempDir.resolve("plain"));

        var none = GitHistorySource.open(plain);

        assertSame(VersionHistorySource.NONE, none);
        assertFalse(none.isAvailable());
        assertTrue(none.listCommits(EN, null, 10).isEmpty());
        assertNull(none.headCommit());
    }

    @Test
    void testListCommitsNewestFirst() {
        var commits = source.listCommits(EN, null, 10);

        assertEquals(List.of(third, first), hashes(commits));
        assertEquals("Rename title", commits.get(0).message());
        assertEquals(1, source.listCommits(EN, null, 1).size());
    }

    @Test
    void testBatchedListCommitsPerPathLimits() {
        var byPath = source.listCommits(List.of(EN, APP, "missing.json"), null, 1);

        assertEquals(List.of(third), hashes(byPath.get(EN)));
        assertEquals(List.of(second), hashes(byPath.get(APP)));
        assertTrue(byPath.get("missing.json").isEmpty());
    }

    @Test
    void testSinceExcludesOlderCommits() {
        assertTrue(source.listCommits(EN, Instant.now().plus(Duration.ofDays(1)), 10).isEmpty());
        assertEquals(2, source.listCommits(EN, Instant.now().minus(Duration.ofDays(1)), 10).size());
    }

    @Test
    void testContentAt() {
        assertEquals("{\n  \"title\": \"Home\"\n}\n", source.contentAt(EN, first));
        assertNull(source.contentAt(APP, first));
        assertNull(source.contentAt(EN, "not-a-commit"));
    }

    @Test
    void testUnifiedDiff() {
        var diff = source.diff(EN, first, third);

        assertNotNull(diff);
        assertTrue(diff.contains("@@"), diff);
        assertTrue(diff.contains("-  \"title\": \"Home\""), diff);
        assertTrue(diff.contains("+  \"title\": \"Start page\""), diff);
        assertNull(source.diff(APP, first, third));
    }

    @Test
    void testSubdirectoryWorkspaceUsesRelativePaths() {
        var nested = GitHistorySource.open(repoRoot.resolve("src"));
        try {
            assertEquals(List.of(third, first), hashes(nested.listCommits("locales/en.json", null, 10)));
            assertNotNull(nested.contentAt("App.tsx", second));
        } finally {
            if (nested instanceof GitHistorySource git) {
                git.close();
            }
        }
    }
}
