package de.mirkosertic.mcp.knowledgebase.source;

import de.mirkosertic.mcp.knowledgebase.index.IndexEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("KnowledgeBaseReader Tests")
class KnowledgeBaseReaderTest {

    @TempDir
    Path tempDir;

    private Path sourcesDir;
    private Path indexPath;
    private ContentFetcher fetcher;
    private KnowledgeBaseReader reader;

    @BeforeEach
    void setUp() throws IOException {
        sourcesDir = Files.createDirectories(tempDir.resolve("sources"));
        indexPath = tempDir.resolve("kb-index.txt");
        fetcher = mock(ContentFetcher.class);
        reader = new KnowledgeBaseReader(sourcesDir, indexPath, fetcher);
        Files.createDirectories(sourcesDir.resolve("docs"));
        Files.writeString(sourcesDir.resolve("docs/setup.md"), "How to set things up", StandardCharsets.UTF_8);
    }

    @Test
    void missingIndexShouldReadAsEmpty() throws IOException {
        assertThat(reader.loadIndexText()).isEmpty();
        assertThat(reader.loadIndexEntries()).isEmpty();
    }

    @Test
    void shouldParseIndexEntries() throws IOException {
        Files.writeString(indexPath, "docs/setup.md\nSetup guide\nsecond line\n\nhttps://example.com\nExample site\n",
                StandardCharsets.UTF_8);

        final List<IndexEntry> entries = reader.loadIndexEntries();

        assertThat(entries).containsExactly(
                new IndexEntry("docs/setup.md", "Setup guide\nsecond line"),
                new IndexEntry("https://example.com", "Example site"));
    }

    @Test
    void shouldLoadFileByRelativeId() throws IOException {
        assertThat(reader.loadSourceContent("docs/setup.md").text()).isEqualTo("How to set things up");
    }

    @Test
    @DisplayName("Should accept backslashes, leading slashes and a sources directory prefix")
    void shouldNormalizeSloppyIds() throws IOException {
        assertThat(reader.loadSourceContent("docs\\setup.md").text()).isEqualTo("How to set things up");
        assertThat(reader.loadSourceContent("/docs/setup.md").text()).isEqualTo("How to set things up");
        assertThat(reader.loadSourceContent(sourcesDir.resolve("docs/setup.md").toString()).text())
                .isEqualTo("How to set things up");
    }

    @Test
    void shouldRejectPathsOutsideSourcesDir() throws IOException {
        Files.writeString(tempDir.resolve("secret.txt"), "secret", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.loadSourceContent("../secret.txt"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> reader.loadSourceContent("docs/missing.md"))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void shouldFailForEmptyFile() throws IOException {
        Files.writeString(sourcesDir.resolve("empty.md"), "  \n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> reader.loadSourceContent("empty.md"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void shouldFailForInvalidUtf8() throws IOException {
        Files.write(sourcesDir.resolve("binary.bin"), new byte[]{(byte) 0xFF, (byte) 0xFE, 0x00, (byte) 0xC3});

        assertThatThrownBy(() -> reader.loadSourceContent("binary.bin"))
                .isInstanceOf(CharacterCodingException.class);
    }

    @Test
    @DisplayName("URL sources should be fetched unconditionally")
    void shouldFetchUrls() throws IOException {
        when(fetcher.fetch("https://example.com/doc", null, null))
                .thenReturn(FetchResult.success("Page text", "\"e1\"", null));

        assertThat(reader.loadSourceContent(" https://example.com/doc ").text()).isEqualTo("Page text");
    }

    @Test
    void failedUrlFetchShouldBeAnError() {
        when(fetcher.fetch("https://example.com/down", null, null)).thenReturn(FetchResult.error("HTTP 500"));

        assertThatThrownBy(() -> reader.loadSourceContent("https://example.com/down"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("https://example.com/down");
    }
}
