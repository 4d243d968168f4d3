package ai.relocale.recovery;

import static org.junit.jupiter.api.Assertions.*;

import ai.relocale.cache.LocaleSnapshotCache;
import ai.relocale.config.RecoveryConfig;
import ai.relocale.history.VersionHistorySource;
import ai.relocale.lock.CancellationToken;
import ai.relocale.testutil.FakeHistorySource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecoveryPipelineTest {
    private static final String EN = "src/locales/en.json";
    private static final String FR = "src/locales/fr.json";
    private static final String APP = "src/App.tsx";

    @TempDir
    Path workspace;

    private FakeHistorySource history;
    private RecoveryPipeline pipeline;
    private RecoveryOptions options;

    @BeforeEach
    void setUp() {
        history = new FakeHistorySource();
        pipeline = newPipeline(history);
        options = RecoveryOptions.singleKey(RecoveryConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    private RecoveryPipeline newPipeline(VersionHistorySource source) {
        return new RecoveryPipeline(new LocaleSnapshotCache.Registry(ws -> source, ws -> RecoveryConfig.defaults()));
    }

    private void write(String relativePath, String content) throws IOException {
        var file = workspace.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void testHeadValueNeedsNoHistory() throws IOException {
        write(EN, "{\"nav\": {\"home\": \"Go to the home page\"}}");
        write(FR, "{\"nav\": {\"home\": \"Accueil\"}}");

        var result = pipeline.recover(workspace, "en", "nav.home", options);

        assertNotNull(result);
        assertEquals("Go to the home page", result.value());
        assertEquals("head", result.source());
        assertEquals(0, history.totalCalls());
    }

    @Test
    void testOtherLocaleAtHead() throws IOException {
        write(EN, "{}");
        write(FR, "{\"nav\": {\"home\": \"Accueil\"}}");

        var result = pipeline.recover(workspace, "en", "nav.home", options);

        assertNotNull(result);
        assertEquals("Accueil", result.value());
        assertEquals("head:fr", result.source());
    }

    @Test
    void testKeyVariationsMatchShorterPaths() throws IOException {
        write(EN, "{\"errors\": {\"invalid_credentials\": \"Wrong email or password\"}}");

        var result = pipeline.recover(workspace, "en", "auth.errors.invalid_credentials", options);

        assertNotNull(result);
        assertEquals("Wrong email or password", result.value());
    }

    @Test
    void testValueEqualToKeyIsSkipped() throws IOException {
        write(EN, "{\"nav\": {\"home\": \"nav.home\"}}");
        write(FR, "{\"nav\": {\"home\": \"Accueil\"}}");

        var result = pipeline.recover(workspace, "en", "nav.home", options);

        assertNotNull(result);
        assertEquals("head:fr", result.source());
    }

    @Test
    void testUnknownPlaceholderFallsThroughToLaterPhase() throws IOException {
        write(EN, "{\"greeting\": {\"hello\": \"Hello {name}\"}}");
        write(FR, "{\"greeting\": {\"hello\": \"Bonjour {user}\"}}");

        var result = pipeline.recover(
                workspace, "en", "greeting.hello", options.withKnownOptionNames(List.of("user")));

        assertNotNull(result);
        assertEquals("Bonjour {user}", result.value());
        assertEquals("head:fr", result.source());
    }

    @Test
    void testPlaceholdersCheckedAgainstCallSiteOptions() throws IOException {
        write(EN, "{\"greeting\": {\"hello\": \"Hello {name}\"}}");
        write(FR, "{\"greeting\": {\"hello\": \"Bonjour {user}\"}}");
        write(APP, "const msg = t('greeting.hello', { user: currentUser });\n");

        var result = pipeline.recover(workspace, "en", "greeting.hello", options);

        assertNotNull(result);
        assertEquals("head:fr", result.source());
    }

    @Test
    void testPlaceholdersNotCheckedWithoutCallSite() throws IOException {
        write(EN, "{\"greeting\": {\"hello\": \"Hello {name}\"}}");

        var result = pipeline.recover(workspace, "en", "greeting.hello", options);

        assertNotNull(result);
        assertEquals("head", result.source());
    }

    @Test
    void testTargetLocaleHistory() throws IOException {
        var old = history.commit("add nav", Map.of(EN, "{\"nav\": {\"home\": \"Go to the home page\"}}"));
        history.commit("drop nav", Map.of(EN, "{}"));
        write(EN, "{}");

        var result = pipeline.recover(workspace, "en", "nav.home", options);

        assertNotNull(result);
        assertEquals("Go to the home page", result.value());
        assertEquals("history:" + old, result.source());
    }

    @Test
    void testOtherLocaleHistoryIsTaggedWithLocale() throws IOException {
        var old = history.commit("add fr", Map.of(FR, "{\"nav\": {\"home\": \"Accueil\"}}"));
        history.commit("drop fr", Map.of(FR, "{}"));
        write(EN, "{}");
        write(FR, "{}");

        var result = pipeline.recover(workspace, "en", "nav.home", options);

        assertNotNull(result);
        assertEquals("history:fr:" + old, result.source());
    }

    @Test
    void testBadlyExtractedValueAbandonsLocaleHistory() throws IOException {
        history.commit("good", Map.of(EN, "{\"limits\": {\"rate\": \"{value1} allowed, {value2} sent\"}}"));
        history.commit("mangled", Map.of(EN, "{\"limits\": {\"rate\": \"Value1 allowed value2 sent\"}}"));
        history.commit("removed", Map.of(EN, "{}"));
        write(EN, "{}");

        var result = pipeline.recover(workspace, "en", "limits.rate", options);

        assertNull(result);
    }

    @Test
    void testExtractionRefComesBeforeHead() throws IOException {
        var ref = history.commit("before extract", Map.of(EN, "{\"nav\": {\"home\": \"Home sweet home\"}}"));
        history.commit("extract", Map.of(EN, "{\"nav\": {\"home\": \"Go to the home page\"}}"));
        write(EN, "{\"nav\": {\"home\": \"Go to the home page\"}}");

        var result = pipeline.recover(workspace, "en", "nav.home", options.withExtractRef(ref));

        assertNotNull(result);
        assertEquals("Home sweet home", result.value());
        assertEquals("ref:" + ref, result.source());
    }

    @Test
    void testDiffRecoveryFromSourceHistory() throws IOException {
        var before = history.commit(
                "page",
                Map.of(APP, "export function Page() {\n  return <h1>Welcome back to the dashboard</h1>;\n}\n"));
        var after = history.commit(
                "extract",
                Map.of(APP, "export function Page() {\n  return <h1>{t('auth.welcome_message')}</h1>;\n}\n"));
        write(EN, "{\"auth\": {}}");
        write(APP, "export function Page() {\n  return <h1>{t('auth.welcome_message')}</h1>;\n}\n");

        var result = pipeline.recover(workspace, "en", "auth.welcome_message", options);

        assertNotNull(result);
        assertEquals("Welcome back to the dashboard", result.value());
        assertEquals("diff:" + before + ".." + after, result.source());
    }

    @Test
    void testSnapshotRecoveryWhenDiffHasNoCandidate() throws IOException {
        var filler = "const a = 1;\n".repeat(10);
        var before = "const title = <h2>Your billing history</h2>;\n" + filler;
        var after = before + "const label = t('billing.history_title');\n";
        var withoutCall = history.commit("page", Map.of(APP, before));
        history.commit("extract", Map.of(APP, after));
        write(EN, "{}");
        write(APP, after);

        var result = pipeline.recover(workspace, "en", "billing.history_title", options);

        assertNotNull(result);
        assertEquals("Your billing history", result.value());
        assertEquals("source:" + withoutCall + ":" + APP, result.source());
    }

    @Test
    void testExhaustedSearchReturnsNull() throws IOException {
        write(EN, "{}");

        assertNull(pipeline.recover(workspace, "en", "nothing.here", options));
    }

    @Test
    void testMissingRepositoryDegradesToHeadOnly() throws IOException {
        try (var noHistory = newPipeline(VersionHistorySource.NONE)) {
            write(EN, "{}");
            write(APP, "t('auth.welcome_message')");

            assertNull(noHistory.recover(workspace, "en", "auth.welcome_message", options));
        }
    }

    @Test
    void testInvalidKeyReturnsNull() {
        assertNull(pipeline.recover(workspace, "en", "...", options));
    }

    @Test
    void testSecondLookupHitsSessionCache() throws IOException {
        history.commit("page", Map.of(APP, "return <h1>Welcome back to the dashboard</h1>;\n"));
        history.commit("extract", Map.of(APP, "return <h1>{t('auth.welcome_message')}</h1>;\n"));
        write(EN, "{}");
        write(APP, "return <h1>{t('auth.welcome_message')}</h1>;\n");

        var first = pipeline.recover(workspace, "en", "auth.welcome_message", options);
        int callsAfterFirst = history.totalCalls();
        var second = pipeline.recover(workspace, "en", "auth.welcome_message", options);

        assertNotNull(first);
        assertEquals(first, second);
        assertEquals(callsAfterFirst, history.totalCalls());
    }

    @Test
    void testClearCachesForcesFreshLookup() throws IOException {
        write(EN, "{\"nav\": {\"home\": \"Go to the home page\"}}");
        assertNotNull(pipeline.recover(workspace, "en", "nav.home", options));
        assertEquals(1, pipeline.cachedResultCount());

        pipeline.clearCaches();
        Files.writeString(workspace.resolve(EN), "{\"nav\": {\"home\": \"Back to the start\"}}");

        var result = pipeline.recover(workspace, "en", "nav.home", options);
        assertNotNull(result);
        assertEquals("Back to the start", result.value());
    }

    @Test
    void testCancelledRecoveryReturnsNull() throws IOException {
        write(EN, "{\"nav\": {\"home\": \"Go to the home page\"}}");
        var token = new CancellationToken();
        token.cancel();

        assertNull(pipeline.recover(workspace, "en", "nav.home", options.withCancellation(token)));
    }

    @Test
    void testBatchMatchesSingleKeyResults() throws IOException {
        var enOld = history.commit("en v1", Map.of(EN, "{\"nav\": {\"home\": \"Home\", \"about\": \"About our team\"}}"));
        history.commit("en v2", Map.of(EN, "{\"nav\": {\"home\": \"Home\"}}"));
        history.commit("fr v1", Map.of(FR, "{\"nav\": {\"contact\": \"Nous contacter\"}}"));
        history.commit("fr v2", Map.of(FR, "{}"));
        history.commit("page", Map.of(APP, "return <p>Read the privacy policy first</p>;\n"));
        history.commit("extract", Map.of(APP, "return <p>{t('legal.privacy_policy')}</p>;\n"));
        write(EN, "{\"nav\": {\"home\": \"Home\"}}");
        write(FR, "{\"nav\": {\"settings\": \"Paramètres\"}}");
        write(APP, "return <p>{t('legal.privacy_policy')}</p>;\n");

        var keys = List.of("nav.home", "nav.about", "nav.settings", "nav.contact", "legal.privacy_policy", "x.missing");
        var batch = pipeline.recoverBatch(workspace, keys, "en", options);

        try (var single = newPipeline(history)) {
            for (var key : keys) {
                assertEquals(single.recover(workspace, "en", key, options), batch.get(key), key);
            }
        }
        assertEquals(keys, List.copyOf(batch.keySet()));
        assertEquals("history:" + enOld, batch.get("nav.about").source());
        assertEquals("head:fr", batch.get("nav.settings").source());
        assertTrue(batch.get("nav.contact").source().startsWith("history:fr:"));
        assertTrue(batch.get("legal.privacy_policy").source().startsWith("diff:"));
        assertNull(batch.get("x.missing"));
    }

    @Test
    void testBatchPrefetchesLocaleHistoryOnce() throws IOException {
        for (int i = 0; i < 12; i++) {
            history.commit("edit " + i, Map.of(EN, "{\"k\": {\"v" + i + "\": \"Value number " + i + "\"}}"));
        }
        write(EN, "{}");

        var batch = pipeline.recoverBatch(workspace, List.of("k.v0", "k.v5", "k.v11"), "en", options);

        assertEquals(3, batch.values().stream().filter(r -> r != null).count());
        assertEquals(1, history.batchListCalls());
        assertEquals(0, history.listCalls());
    }

    @Test
    void testBatchSourceRecoveryPrefetchesEachFileOnce() throws IOException {
        var page = "src/Page.tsx";
        var pageBefore = "export function Page() {\n  return <h1>Welcome back to the dashboard</h1>;\n}\n";
        var pageAfter = "export function Page() {\n  return <h1>{t('auth.welcome_message')}</h1>;\n}\n";
        var welcomeFrom = history.commit("page", Map.of(page, pageBefore));
        var welcomeTo = history.commit("extract page", Map.of(page, pageAfter));
        history.commit("legal", Map.of(APP, "return <p>Read the privacy policy first</p>;\n"));
        history.commit("extract legal", Map.of(APP, "return <p>{t('legal.privacy_policy')}</p>;\n"));
        write(EN, "{}");
        write(page, pageAfter);
        write(APP, "return <p>{t('legal.privacy_policy')}</p>;\n");

        var batch = pipeline.recoverBatch(
                workspace, List.of("auth.welcome_message", "legal.privacy_policy"), "en", options);

        assertEquals("Welcome back to the dashboard", batch.get("auth.welcome_message").value());
        assertEquals("diff:" + welcomeFrom + ".." + welcomeTo, batch.get("auth.welcome_message").source());
        assertEquals("Read the privacy policy first", batch.get("legal.privacy_policy").value());
        assertEquals(2, history.listCalls());
        assertEquals(4, history.contentCalls());
    }

    @Test
    void testCloseReleasesHistorySource() throws IOException {
        var closed = new AtomicBoolean();
        class ClosingHistory extends FakeHistorySource implements AutoCloseable {
            @Override
            public void close() {
                closed.set(true);
            }
        }
        write(EN, "{\"nav\": {\"home\": \"Go to the home page\"}}");
        var closing = newPipeline(new ClosingHistory());
        assertNotNull(closing.recover(workspace, "en", "nav.home", options));

        closing.close();

        assertTrue(closed.get());
    }
}
