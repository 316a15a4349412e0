package de.mirkosertic.mcp.knowledgebase.crawler;

import de.mirkosertic.mcp.knowledgebase.cache.AtomicFileWriter;
import de.mirkosertic.mcp.knowledgebase.cache.CacheRecord;
import de.mirkosertic.mcp.knowledgebase.cache.CacheStore;
import de.mirkosertic.mcp.knowledgebase.cache.FetchStatus;
import de.mirkosertic.mcp.knowledgebase.cache.KnowledgeBaseCache;
import de.mirkosertic.mcp.knowledgebase.cache.SourceType;
import de.mirkosertic.mcp.knowledgebase.cache.UpdateAbortedException;
import de.mirkosertic.mcp.knowledgebase.cache.UpdateLock;
import de.mirkosertic.mcp.knowledgebase.config.ApplicationConfig;
import de.mirkosertic.mcp.knowledgebase.source.ExternalCallExecutor;
import de.mirkosertic.mcp.knowledgebase.source.FetchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("UpdateOrchestrator Tests")
class UpdateOrchestratorTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private Path sourcesDir;
    private Path linksFile;
    private Path cachePath;
    private Path indexPath;

    private ApplicationConfig config;
    private MutableClock clock;
    private RecordingSummarizer summarizer;
    private ScriptedContentFetcher fetcher;
    private ExternalCallExecutor callExecutor;
    private long fetchTimeoutMs = 2000;

    @BeforeEach
    void setUp() throws IOException {
        sourcesDir = Files.createDirectories(tempDir.resolve("kb"));
        linksFile = tempDir.resolve("links.txt");
        cachePath = tempDir.resolve("state/kb-cache.json");
        indexPath = tempDir.resolve("state/kb-index.txt");

        config = mock(ApplicationConfig.class);
        when(config.getSummarizeTimeoutMs()).thenReturn(2000L);
        when(config.getUrlManualBudget()).thenReturn(10);
        when(config.getUrlTickBudget()).thenReturn(10);

        clock = new MutableClock(START);
        summarizer = new RecordingSummarizer();
        fetcher = new ScriptedContentFetcher();
        callExecutor = new ExternalCallExecutor();
    }

    @AfterEach
    void tearDown() {
        callExecutor.close();
    }

    private UpdateOrchestrator orchestrator() {
        return orchestrator(new AtomicFileWriter());
    }

    private UpdateOrchestrator orchestrator(final AtomicFileWriter writer) {
        final CacheStore cacheStore = new CacheStore(cachePath, indexPath, writer, clock);
        final UpdateLock lock = new UpdateLock(cachePath, 2000);
        final SourceEnumerator enumerator = new SourceEnumerator(sourcesDir, linksFile,
                new FilePatternMatcher(List.of("*.md", "*.txt"), List.of()));
        final UrlRefreshScheduler urlScheduler = new UrlRefreshScheduler(clock, fetcher, summarizer, callExecutor,
                Duration.ofHours(1), Duration.ofDays(7), Duration.ofSeconds(10), Duration.ofSeconds(60), fetchTimeoutMs, 2000);
        return new UpdateOrchestrator(config, cacheStore, lock, enumerator, new ChangeDetector(1024 * 1024),
                urlScheduler, summarizer, callExecutor, clock);
    }

    private Path writeSource(final String relativePath, final String content) throws IOException {
        final Path file = sourcesDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private void writeLinks(final String... urls) throws IOException {
        Files.writeString(linksFile, String.join("\n", urls) + "\n", StandardCharsets.UTF_8);
    }

    private KnowledgeBaseCache loadCache() {
        return new CacheStore(cachePath, indexPath, new AtomicFileWriter(), clock).load();
    }

    private String indexText() throws IOException {
        return Files.readString(indexPath, StandardCharsets.UTF_8);
    }

    private static void bumpMtime(final Path file) throws IOException {
        final FileTime current = Files.getLastModifiedTime(file);
        Files.setLastModifiedTime(file, FileTime.fromMillis(current.toMillis() + 5_000));
    }

    @Test
    @DisplayName("First pass should summarize every file and write cache and index")
    void shouldIndexNewFiles() throws Exception {
        writeSource("b.md", "Beta\nSecond document");
        writeSource("docs/a.md", "Alpha\nFirst document");
        writeSource("ignored.bin", "not included");

        final UpdateResult result = orchestrator().update(UpdateScope.full());

        assertThat(result.added()).isEqualTo(2);
        assertThat(result.cacheWritten()).isTrue();
        assertThat(result.indexWritten()).isTrue();
        assertThat(summarizer.calls()).containsExactlyInAnyOrder("b.md", "docs/a.md");
        assertThat(indexText()).isEqualTo("b.md\nSummary: Beta\n\ndocs/a.md\nSummary: Alpha\n");

        final CacheRecord record = loadCache().get("docs/a.md");
        assertThat(record).isNotNull();
        assertThat(record.getRelPath()).isEqualTo("docs/a.md");
        assertThat(record.getSizeBytes()).isEqualTo(Files.size(sourcesDir.resolve("docs/a.md")));
        assertThat(record.getLastIndexedAt()).isEqualTo(START);
    }

    @Test
    @DisplayName("Second pass without changes should not summarize or write anything")
    void shouldBeIdempotent() throws Exception {
        writeSource("a.md", "Alpha");
        writeSource("b.md", "Beta");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        final String cacheBefore = Files.readString(cachePath);
        final String indexBefore = indexText();
        summarizer.reset();

        clock.advance(Duration.ofMinutes(5));
        final UpdateResult result = orchestrator.update(UpdateScope.full());

        assertThat(summarizer.callCount()).isZero();
        assertThat(result.unchanged()).isEqualTo(2);
        assertThat(result.cacheWritten()).isFalse();
        assertThat(result.indexWritten()).isFalse();
        assertThat(Files.readString(cachePath)).isEqualTo(cacheBefore);
        assertThat(indexText()).isEqualTo(indexBefore);
    }

    @Test
    @DisplayName("Touching a file should refresh its fingerprint without summarizing")
    void shouldRefreshFingerprintOnTouch() throws Exception {
        final Path file = writeSource("a.md", "Alpha");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        summarizer.reset();

        bumpMtime(file);
        final UpdateResult result = orchestrator.update(UpdateScope.full());

        assertThat(summarizer.callCount()).isZero();
        assertThat(result.metadataOnly()).isEqualTo(1);
        assertThat(result.cacheWritten()).isTrue();
        assertThat(result.indexWritten()).isFalse();
        assertThat(loadCache().get("a.md").getMtimeNs())
                .isEqualTo(Files.getLastModifiedTime(file).to(TimeUnit.NANOSECONDS));

        // The refreshed fingerprint short-circuits the next pass
        final UpdateResult third = orchestrator.update(UpdateScope.full());
        assertThat(third.unchanged()).isEqualTo(1);
        assertThat(third.cacheWritten()).isFalse();
    }

    @Test
    @DisplayName("Whitespace-only edits should not trigger a summarizer call")
    void shouldIgnoreWhitespaceOnlyEdit() throws Exception {
        final Path file = writeSource("a.md", "Alpha\nBody");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        summarizer.reset();

        Files.writeString(file, "\n\nAlpha   \r\nBody\t\r\n\n", StandardCharsets.UTF_8);
        bumpMtime(file);
        final UpdateResult result = orchestrator.update(UpdateScope.full());

        assertThat(summarizer.callCount()).isZero();
        assertThat(result.metadataOnly()).isEqualTo(1);
        assertThat(result.changed()).isZero();
    }

    @Test
    @DisplayName("Content change should summarize again and rewrite the index")
    void shouldResummarizeChangedFile() throws Exception {
        final Path file = writeSource("a.md", "Alpha");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        summarizer.reset();

        Files.writeString(file, "Alpha revised", StandardCharsets.UTF_8);
        bumpMtime(file);
        final UpdateResult result = orchestrator.update(UpdateScope.full());

        assertThat(result.changed()).isEqualTo(1);
        assertThat(summarizer.calls()).containsExactly("a.md");
        assertThat(indexText()).isEqualTo("a.md\nSummary: Alpha revised\n");
    }

    @Test
    @DisplayName("Deleted files should be removed from cache and index")
    void shouldRemoveDeletedFile() throws Exception {
        writeSource("a.md", "Alpha");
        final Path b = writeSource("b.md", "Beta");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());

        Files.delete(b);
        final UpdateResult result = orchestrator.update(UpdateScope.full());

        assertThat(result.removed()).isEqualTo(1);
        assertThat(loadCache().getSources()).containsOnlyKeys("a.md");
        assertThat(indexText()).isEqualTo("a.md\nSummary: Alpha\n");
    }

    @Test
    @DisplayName("Summarizer failure should leave the source out and retry on the next pass")
    void shouldRetryAfterSummarizerFailure() throws Exception {
        writeSource("a.md", "Alpha");
        writeSource("b.md", "Beta");
        summarizer.failFor("b.md");
        final UpdateOrchestrator orchestrator = orchestrator();

        final UpdateResult first = orchestrator.update(UpdateScope.full());

        assertThat(first.added()).isEqualTo(1);
        assertThat(first.failed()).isEqualTo(1);
        assertThat(loadCache().get("b.md")).isNull();
        assertThat(indexText()).doesNotContain("b.md");

        summarizer.recover("b.md");
        summarizer.reset();
        final UpdateResult second = orchestrator.update(UpdateScope.full());

        assertThat(second.added()).isEqualTo(1);
        assertThat(summarizer.calls()).containsExactly("b.md");
        assertThat(indexText()).contains("b.md\nSummary: Beta");
    }

    @Test
    @DisplayName("Summarizer failure on a changed file should keep the previous summary and fingerprint")
    void shouldKeepPreviousSummaryWhenResummarizeFails() throws Exception {
        final Path file = writeSource("a.md", "Alpha");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        final CacheRecord before = loadCache().get("a.md");

        Files.writeString(file, "Alpha revised", StandardCharsets.UTF_8);
        bumpMtime(file);
        summarizer.failFor("a.md");
        final UpdateResult result = orchestrator.update(UpdateScope.full());

        assertThat(result.failed()).isEqualTo(1);
        final CacheRecord after = loadCache().get("a.md");
        assertThat(after.getSummaryText()).isEqualTo("Summary: Alpha");
        assertThat(after.getContentHash()).isEqualTo(before.getContentHash());
        assertThat(after.getMtimeNs()).isEqualTo(before.getMtimeNs());
    }

    @Test
    @DisplayName("Invalid UTF-8 files should be skipped without touching their record")
    void shouldSkipUndecodableFile() throws Exception {
        writeSource("a.md", "Alpha");
        Files.write(sourcesDir.resolve("broken.md"), new byte[]{'o', 'k', (byte) 0xC3, (byte) 0x28});

        final UpdateResult result = orchestrator().update(UpdateScope.full());

        assertThat(result.added()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(loadCache().get("broken.md")).isNull();
        assertThat(summarizer.calls()).containsExactly("a.md");
    }

    @Test
    @DisplayName("FILE scope should only look at the given path")
    void shouldLimitFileScope() throws Exception {
        final Path a = writeSource("a.md", "Alpha");
        final Path b = writeSource("b.md", "Beta");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        summarizer.reset();

        Files.writeString(a, "Alpha revised", StandardCharsets.UTF_8);
        bumpMtime(a);
        Files.delete(b);
        final UpdateResult result = orchestrator.update(UpdateScope.file("a.md"));

        assertThat(result.changed()).isEqualTo(1);
        assertThat(result.removed()).isZero();
        assertThat(summarizer.calls()).containsExactly("a.md");
        assertThat(loadCache().getSources()).containsOnlyKeys("a.md", "b.md");

        final UpdateResult deletion = orchestrator.update(UpdateScope.file("b.md"));
        assertThat(deletion.removed()).isEqualTo(1);
        assertThat(loadCache().getSources()).containsOnlyKeys("a.md");
    }

    @Test
    @DisplayName("Index should list files before URLs, each in lexical order")
    void shouldOrderIndexFilesBeforeUrls() throws Exception {
        writeSource("zeta.md", "Zeta");
        writeSource("alpha.md", "Alpha");
        writeLinks("https://example.com/b", "https://example.com/a");
        fetcher.respond("https://example.com/a", FetchResult.success("Page A", null, null));
        fetcher.respond("https://example.com/b", FetchResult.success("Page B", null, null));

        final UpdateResult result = orchestrator().update(UpdateScope.full());

        assertThat(result.added()).isEqualTo(4);
        assertThat(result.urlsFetched()).isEqualTo(2);
        assertThat(indexText()).isEqualTo(
                "alpha.md\nSummary: Alpha\n\n"
                        + "zeta.md\nSummary: Zeta\n\n"
                        + "https://example.com/a\nSummary: Page A\n\n"
                        + "https://example.com/b\nSummary: Page B\n");
    }

    @Test
    @DisplayName("Missing index should be regenerated even when nothing changed")
    void shouldRegenerateMissingIndex() throws Exception {
        writeSource("a.md", "Alpha");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        Files.delete(indexPath);
        summarizer.reset();

        final UpdateResult result = orchestrator.update(UpdateScope.full());

        assertThat(result.indexWritten()).isTrue();
        assertThat(result.cacheWritten()).isFalse();
        assertThat(summarizer.callCount()).isZero();
        assertThat(indexText()).isEqualTo("a.md\nSummary: Alpha\n");
    }

    @Test
    @DisplayName("Missing sources directory should abort the pass and leave the cache untouched")
    void shouldAbortWhenSourcesDirectoryMissing() throws Exception {
        writeSource("a.md", "Alpha");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        final String cacheBefore = Files.readString(cachePath);

        Files.delete(sourcesDir.resolve("a.md"));
        Files.delete(sourcesDir);

        assertThatThrownBy(() -> orchestrator.update(UpdateScope.full()))
                .isInstanceOf(UpdateAbortedException.class)
                .hasMessageContaining("Enumerating sources failed");
        assertThat(Files.readString(cachePath)).isEqualTo(cacheBefore);
    }

    @Test
    @DisplayName("Crash between temporary write and rename should keep the previous cache")
    void shouldKeepPreviousCacheOnCrashDuringPersist() throws Exception {
        final Path a = writeSource("a.md", "Alpha");
        orchestrator().update(UpdateScope.full());
        final String cacheBefore = Files.readString(cachePath);
        final String indexBefore = indexText();

        final AtomicFileWriter crashingWriter = new AtomicFileWriter() {
            @Override
            protected void move(final Path source, final Path target) throws IOException {
                throw new IOException("Simulated crash before rename");
            }
        };
        Files.writeString(a, "Alpha revised", StandardCharsets.UTF_8);
        bumpMtime(a);

        assertThatThrownBy(() -> orchestrator(crashingWriter).update(UpdateScope.full()))
                .isInstanceOf(UpdateAbortedException.class);
        assertThat(Files.readString(cachePath)).isEqualTo(cacheBefore);
        assertThat(indexText()).isEqualTo(indexBefore);
        try (var files = Files.list(cachePath.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .noneMatch(name -> name.endsWith(".tmp"));
        }

        // A healthy pass afterwards picks up the change
        final UpdateResult recovered = orchestrator().update(UpdateScope.full());
        assertThat(recovered.changed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Link list changes should add and drop URL records without fetching")
    void shouldSyncLinkListWithoutFetching() throws Exception {
        writeLinks("https://example.com/a", "# a comment", "", "https://example.com/b");
        fetcher.respond("https://example.com/a", FetchResult.success("Page A", null, null));
        fetcher.respond("https://example.com/b", FetchResult.success("Page B", null, null));
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        fetcher.reset();

        writeLinks("https://example.com/a", "https://example.com/c");
        final UpdateResult result = orchestrator.update(UpdateScope.linkList());

        assertThat(result.removed()).isEqualTo(1);
        assertThat(result.urlsFetched()).isZero();
        assertThat(fetcher.requests()).isEmpty();
        final KnowledgeBaseCache cache = loadCache();
        assertThat(cache.getSources()).containsOnlyKeys("https://example.com/a", "https://example.com/c");
        assertThat(cache.get("https://example.com/c").hasSummary()).isFalse();
        assertThat(cache.get("https://example.com/c").getNextCheckAt()).isEqualTo(START);
        assertThat(indexText()).doesNotContain("https://example.com/b").doesNotContain("https://example.com/c");
    }

    @Test
    @DisplayName("Refresh tick should fetch new URLs within the tick budget and defer the rest")
    void shouldDeferUrlsBeyondBudget() throws Exception {
        when(config.getUrlTickBudget()).thenReturn(2);
        writeLinks("https://example.com/1", "https://example.com/2", "https://example.com/3");
        for (int i = 1; i <= 3; i++) {
            fetcher.respond("https://example.com/" + i, FetchResult.success("Page " + i, null, null));
        }
        final UpdateOrchestrator orchestrator = orchestrator();

        final UpdateResult first = orchestrator.update(UpdateScope.refreshTick());

        assertThat(first.urlsFetched()).isEqualTo(2);
        assertThat(first.urlsDeferred()).isEqualTo(1);
        assertThat(fetcher.fetchedUrls()).containsExactly("https://example.com/1", "https://example.com/2");

        fetcher.reset();
        final UpdateResult second = orchestrator.update(UpdateScope.refreshTick());

        assertThat(second.urlsFetched()).isEqualTo(1);
        assertThat(second.urlsDeferred()).isZero();
        assertThat(fetcher.fetchedUrls()).containsExactly("https://example.com/3");
    }

    @Test
    @DisplayName("Reindex without URL refresh should not fetch anything")
    void shouldNotFetchWhenRefreshDisabled() throws Exception {
        writeSource("a.md", "Alpha");
        writeLinks("https://example.com/a");

        final UpdateResult result = orchestrator().update(UpdateScope.full(false));

        assertThat(result.added()).isEqualTo(1);
        assertThat(result.urlsFetched()).isZero();
        assertThat(result.urlsDeferred()).isEqualTo(1);
        assertThat(fetcher.requests()).isEmpty();
        assertThat(loadCache().get("https://example.com/a")).isNotNull();
    }

    @Test
    @DisplayName("Not modified responses should count as unchanged and keep the index")
    void shouldHandleNotModifiedUrl() throws Exception {
        writeLinks("https://example.com/a");
        fetcher.respond("https://example.com/a", FetchResult.success("Page A", "\"v1\"", null));
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        summarizer.reset();

        fetcher.respond("https://example.com/a", FetchResult.notModified(null, null));
        clock.advance(Duration.ofHours(2));
        final UpdateResult result = orchestrator.update(UpdateScope.refreshTick());

        assertThat(result.urlsNotModified()).isEqualTo(1);
        assertThat(result.indexWritten()).isFalse();
        assertThat(summarizer.callCount()).isZero();
        final CacheRecord record = loadCache().get("https://example.com/a");
        assertThat(record.getEtag()).isEqualTo("\"v1\"");
        assertThat(record.getNextCheckAt()).isEqualTo(clock.instant().plus(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("Summarizer overrunning its deadline should keep that source's summary while the batch persists")
    void shouldKeepPreviousSummaryWhenSummarizerTimesOut() throws Exception {
        final Path a = writeSource("a.md", "Alpha");
        final Path b = writeSource("b.md", "Beta");
        final UpdateOrchestrator orchestrator = orchestrator();
        orchestrator.update(UpdateScope.full());
        final CacheRecord before = loadCache().get("a.md");

        Files.writeString(a, "Alpha revised", StandardCharsets.UTF_8);
        bumpMtime(a);
        Files.writeString(b, "Beta revised", StandardCharsets.UTF_8);
        bumpMtime(b);
        summarizer.blockFor("a.md");
        when(config.getSummarizeTimeoutMs()).thenReturn(200L);

        final long started = System.nanoTime();
        final UpdateResult result = orchestrator.update(UpdateScope.full());
        final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMs).isLessThan(5000);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.changed()).isEqualTo(1);
        final KnowledgeBaseCache cache = loadCache();
        assertThat(cache.get("a.md").getSummaryText()).isEqualTo("Summary: Alpha");
        assertThat(cache.get("a.md").getContentHash()).isEqualTo(before.getContentHash());
        assertThat(cache.get("a.md").getMtimeNs()).isEqualTo(before.getMtimeNs());
        assertThat(cache.get("b.md").getSummaryText()).isEqualTo("Summary: Beta revised");
        assertThat(indexText()).isEqualTo("a.md\nSummary: Alpha\n\nb.md\nSummary: Beta revised\n");
    }

    @Test
    @DisplayName("Fetcher overrunning its deadline should record a timeout and back off")
    void shouldBackOffWhenFetcherTimesOut() throws Exception {
        writeLinks("https://example.com/slow", "https://example.com/fast");
        fetcher.hang("https://example.com/slow");
        fetcher.respond("https://example.com/fast", FetchResult.success("Fast page", null, null));
        fetchTimeoutMs = 200;

        final UpdateResult result = orchestrator().update(UpdateScope.full());

        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.added()).isEqualTo(1);
        final CacheRecord slow = loadCache().get("https://example.com/slow");
        assertThat(slow.getFetchStatus()).isEqualTo(FetchStatus.TIMEOUT);
        assertThat(slow.getConsecutiveFailures()).isEqualTo(1);
        assertThat(slow.getNextCheckAt()).isEqualTo(START.plus(Duration.ofSeconds(10)));
        assertThat(slow.hasSummary()).isFalse();
        assertThat(indexText()).isEqualTo("https://example.com/fast\nSummary: Fast page\n");
    }

    @Test
    @DisplayName("Cache holding an untyped record should be rebuilt so the file reaches the index")
    void shouldRebuildCacheWithUntypedRecord() throws Exception {
        writeSource("a.md", "Alpha");
        Files.createDirectories(cachePath.getParent());
        Files.writeString(cachePath, """
                {"schema_version": 1, "sources": {"a.md": {"source_id": "a.md", "summary_text": "old"}}}
                """, StandardCharsets.UTF_8);
        final UpdateOrchestrator orchestrator = orchestrator();

        final UpdateResult first = orchestrator.update(UpdateScope.full());
        final UpdateResult second = orchestrator.update(UpdateScope.full());

        assertThat(first.added()).isEqualTo(1);
        assertThat(second.unchanged()).isEqualTo(1);
        assertThat(indexText()).isEqualTo("a.md\nSummary: Alpha\n");
        assertThat(loadCache().get("a.md").getSourceType()).isEqualTo(SourceType.FILE);
    }

    @Test
    @DisplayName("Cache holding a null record should be rebuilt instead of failing every pass")
    void shouldRebuildCacheWithNullRecord() throws Exception {
        writeSource("a.md", "Alpha");
        Files.createDirectories(cachePath.getParent());
        Files.writeString(cachePath, "{\"schema_version\": 1, \"sources\": {\"a.md\": null}}",
                StandardCharsets.UTF_8);

        final UpdateResult result = orchestrator().update(UpdateScope.full());

        assertThat(result.added()).isEqualTo(1);
        assertThat(result.cacheWritten()).isTrue();
        assertThat(loadCache().getSources()).containsOnlyKeys("a.md");
    }

    @Test
    @DisplayName("Scope check should match the path itself and everything below it")
    void shouldMatchScope() {
        assertThat(UpdateOrchestrator.inScope("docs/a.md", UpdateScope.file("docs"))).isTrue();
        assertThat(UpdateOrchestrator.inScope("docs/a.md", UpdateScope.file("docs/a.md"))).isTrue();
        assertThat(UpdateOrchestrator.inScope("docsx/a.md", UpdateScope.file("docs"))).isFalse();
        assertThat(UpdateOrchestrator.inScope("other.md", UpdateScope.full())).isTrue();
    }
}
