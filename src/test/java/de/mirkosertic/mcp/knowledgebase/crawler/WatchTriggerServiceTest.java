package de.mirkosertic.mcp.knowledgebase.crawler;

import de.mirkosertic.mcp.knowledgebase.config.ApplicationConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the debounced translation of watch events into update passes.
 */
@DisplayName("WatchTriggerService Tests")
class WatchTriggerServiceTest {

    @TempDir
    Path tempDir;

    private Path sourcesDir;
    private ApplicationConfig config;
    private DirectoryWatcherService watcherService;
    private Consumer<UpdateScope> submitter;
    private WatchTriggerService triggerService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws IOException {
        sourcesDir = Files.createDirectories(tempDir.resolve("kb"));
        config = mock(ApplicationConfig.class);
        when(config.getFileDebounceMs()).thenReturn(200L);
        when(config.getLinkDebounceMs()).thenReturn(200L);
        when(config.isFileWatchEnabled()).thenReturn(true);
        when(config.isLinkWatchEnabled()).thenReturn(true);

        watcherService = mock(DirectoryWatcherService.class);
        submitter = mock(Consumer.class);
        triggerService = createService(tempDir.resolve("links.txt"));
    }

    @AfterEach
    void tearDown() {
        triggerService.shutdown();
    }

    private WatchTriggerService createService(final Path linksFile) {
        final SourceEnumerator enumerator = new SourceEnumerator(sourcesDir, linksFile,
                new FilePatternMatcher(List.of("*.md"), List.of()));
        return new WatchTriggerService(config, enumerator, watcherService, submitter);
    }

    @Test
    @DisplayName("Should collapse rapid modifications of one file into a single FILE pass")
    void shouldDebounceFileEvents() {
        final Path file = sourcesDir.resolve("docs/a.md");

        triggerService.onFileCreated(file);
        for (int i = 0; i < 5; i++) {
            triggerService.onFileModified(file);
        }

        verify(submitter, timeout(2000).times(1)).accept(UpdateScope.file("docs/a.md"));
        verify(submitter, after(400).times(1)).accept(any());
    }

    @Test
    @DisplayName("Should raise one FILE pass per changed file")
    void shouldTriggerPerFile() {
        triggerService.onFileModified(sourcesDir.resolve("a.md"));
        triggerService.onFileDeleted(sourcesDir.resolve("b.md"));

        verify(submitter, timeout(2000).times(1)).accept(UpdateScope.file("a.md"));
        verify(submitter, timeout(2000).times(1)).accept(UpdateScope.file("b.md"));
    }

    @Test
    @DisplayName("Should raise a LINK_LIST pass for link list changes")
    void shouldTriggerLinkListPass() {
        final Path linksFile = tempDir.resolve("links.txt");

        triggerService.onFileModified(linksFile);
        triggerService.onFileModified(linksFile);

        verify(submitter, timeout(2000).times(1)).accept(UpdateScope.linkList());
        verify(submitter, after(400).never()).accept(UpdateScope.file("links.txt"));
    }

    @Test
    @DisplayName("Should ignore hidden files and paths outside the sources directory")
    void shouldIgnoreIrrelevantPaths() {
        triggerService.onFileModified(sourcesDir.resolve(".git/index"));
        triggerService.onFileModified(sourcesDir.resolve("docs/.draft.md"));
        triggerService.onFileModified(tempDir.resolve("elsewhere.md"));

        verify(submitter, after(500).never()).accept(any());
    }

    @Test
    @DisplayName("Should ignore file events when file watching is disabled")
    void shouldIgnoreFileEventsWhenDisabled() {
        when(config.isFileWatchEnabled()).thenReturn(false);

        triggerService.onFileModified(sourcesDir.resolve("a.md"));

        verify(submitter, after(500).never()).accept(any());
    }

    @Test
    @DisplayName("Should watch the sources directory and a link list outside of it")
    void shouldRegisterWatches() throws Exception {
        triggerService.start();

        verify(watcherService).watchDirectory(sourcesDir.toAbsolutePath().normalize(), triggerService);
        verify(watcherService).watchFile(tempDir.resolve("links.txt").toAbsolutePath().normalize(), triggerService);
    }

    @Test
    @DisplayName("Should not watch a link list that the sources directory watch already covers")
    void shouldNotDoubleWatchLinkListInsideSources() throws Exception {
        triggerService.shutdown();
        triggerService = createService(sourcesDir.resolve("links.txt"));

        triggerService.start();

        verify(watcherService).watchDirectory(eq(sourcesDir.toAbsolutePath().normalize()), any());
        verify(watcherService, never()).watchFile(any(), any());
    }
}
