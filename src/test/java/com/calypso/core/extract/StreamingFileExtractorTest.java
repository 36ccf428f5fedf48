package com.calypso.core.extract;

import com.calypso.core.model.GeneratedFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamingFileExtractorTest {

    private static final String TWO_FILES = """
            Here is your project.
            ===FILE: package.json===
            {"name": "demo"}
            ===END FILE===
            ===FILE: src/app/page.tsx===
            export default function Page() {
              return <main>Hello</main>;
            }
            ===END FILE===
            Done!
            """;

    private static List<GeneratedFile> parseStream(String text) {
        var extractor = new StreamingFileExtractor();
        extractor.feed(text);
        extractor.finish();
        return extractor.files();
    }

    @Nested
    @DisplayName("single-delta stream")
    class SingleDeltaTests {

        @Test
        @DisplayName("extracts framed files in order and drops prose around them")
        void extractsFramedFiles() {
            List<GeneratedFile> files = parseStream(TWO_FILES);

            assertEquals(2, files.size());
            assertEquals("package.json", files.get(0).path());
            assertEquals("{\"name\": \"demo\"}", files.get(0).content());
            assertEquals("src/app/page.tsx", files.get(1).path());
            assertTrue(files.get(1).content().startsWith("export default function Page()"));
            assertTrue(files.get(1).content().endsWith("}"));
        }

        @Test
        @DisplayName("trims whitespace around the path")
        void trimsPath() {
            List<GeneratedFile> files = parseStream("===FILE:   index.html  ===\n<p>x</p>\n===END FILE===");
            assertEquals("index.html", files.get(0).path());
        }

        @Test
        @DisplayName("a repeated path replaces the earlier file in place")
        void duplicatePathReplaces() {
            String text = """
                    ===FILE: a.txt===
                    first
                    ===END FILE===
                    ===FILE: b.txt===
                    bee
                    ===END FILE===
                    ===FILE: a.txt===
                    second
                    ===END FILE===
                    """;

            List<GeneratedFile> files = parseStream(text);

            assertEquals(List.of(new GeneratedFile("a.txt", "second"), new GeneratedFile("b.txt", "bee")), files);
        }

        @Test
        @DisplayName("a truncated trailing file is kept when it has content")
        void truncatedTrailingFileKept() {
            List<GeneratedFile> files = parseStream("===FILE: a.css===\nbody { margin: 0; }\n");
            assertEquals(List.of(new GeneratedFile("a.css", "body { margin: 0; }")), files);
        }

        @Test
        @DisplayName("a truncated trailing file with blank content is dropped")
        void blankTrailingFileDropped() {
            assertTrue(parseStream("===FILE: a.css===\n   \n").isEmpty());
        }

        @Test
        @DisplayName("text without markers yields no files")
        void noMarkers() {
            assertTrue(parseStream("I cannot help with that.").isEmpty());
        }
    }

    @Nested
    @DisplayName("parseClosed")
    class ParseClosedTests {

        @Test
        @DisplayName("keeps files closed by the end marker")
        void keepsClosedFiles() {
            assertEquals(parseStream(TWO_FILES), StreamingFileExtractor.parseClosed(TWO_FILES));
        }

        @Test
        @DisplayName("drops a truncated trailing file")
        void dropsTruncatedFile() {
            String text = """
                    ===FILE: package.json===
                    {"name": "demo"}
                    ===END FILE===
                    ===FILE: src/app/page.tsx===
                    export default function Page() { return <ma""";

            assertEquals(List.of(new GeneratedFile("package.json", "{\"name\": \"demo\"}")),
                    StreamingFileExtractor.parseClosed(text));
        }

        @Test
        @DisplayName("drops closed files with blank content")
        void dropsBlankFiles() {
            assertTrue(StreamingFileExtractor.parseClosed("===FILE: a.ts===\n===END FILE===").isEmpty());
            assertTrue(StreamingFileExtractor.parseClosed("===FILE: a.ts===\n  \n===END FILE===").isEmpty());
        }
    }

    @Nested
    @DisplayName("feed")
    class FeedTests {

        @Test
        @DisplayName("the result does not depend on how the text is split into deltas")
        void splitIndependent() {
            List<GeneratedFile> whole = parseStream(TWO_FILES);

            for (int size : new int[]{1, 2, 3, 7, 13, 64}) {
                var extractor = new StreamingFileExtractor();
                for (int i = 0; i < TWO_FILES.length(); i += size) {
                    extractor.feed(TWO_FILES.substring(i, Math.min(TWO_FILES.length(), i + size)));
                }
                extractor.finish();
                assertEquals(whole, extractor.files(), "delta size " + size);
            }
        }

        @Test
        @DisplayName("emits start, chunk and complete events; chunks are a prefix of the content")
        void emitsEvents() {
            var extractor = new StreamingFileExtractor();
            List<ExtractionEvent> events = new ArrayList<>();
            for (char c : TWO_FILES.toCharArray()) {
                events.addAll(extractor.feed(String.valueOf(c)));
            }
            events.addAll(extractor.finish());

            assertEquals(new ExtractionEvent.FileStarted("package.json"), events.get(0));
            var chunks = new StringBuilder();
            ExtractionEvent.FileCompleted completed = null;
            for (ExtractionEvent event : events) {
                if (event instanceof ExtractionEvent.FileChunk chunk && chunk.path().equals("package.json")) {
                    chunks.append(chunk.text());
                }
                if (event instanceof ExtractionEvent.FileCompleted done && completed == null) {
                    completed = done;
                }
            }
            assertNotNull(completed);
            assertEquals("package.json", completed.path());
            assertTrue(completed.content().startsWith(chunks.toString().stripTrailing()));
            assertFalse(chunks.toString().contains("===END"));
        }

        @Test
        @DisplayName("an end marker split across deltas is never emitted as content")
        void splitEndMarker() {
            var extractor = new StreamingFileExtractor();
            List<ExtractionEvent> events = new ArrayList<>();
            events.addAll(extractor.feed("===FILE: a.txt===\nhello world, this is long enough\n===END"));
            events.addAll(extractor.feed(" FILE===\n"));

            for (ExtractionEvent event : events) {
                if (event instanceof ExtractionEvent.FileChunk chunk) {
                    assertFalse(chunk.text().contains("="), chunk.text());
                }
            }
            assertEquals(List.of(new GeneratedFile("a.txt", "hello world, this is long enough")), extractor.files());
        }

        @Test
        @DisplayName("tracks whether a file is open")
        void tracksOpenFile() {
            var extractor = new StreamingFileExtractor();
            extractor.feed("===FILE: x.js===\nconst a = 1;");
            assertTrue(extractor.isInFile());
            assertEquals("x.js", extractor.currentPath());

            extractor.feed("\n===END FILE===");
            assertFalse(extractor.isInFile());
            assertNull(extractor.currentPath());
        }

        @Test
        @DisplayName("feeding after finish is rejected")
        void feedAfterFinish() {
            var extractor = new StreamingFileExtractor();
            extractor.finish();
            assertThrows(IllegalStateException.class, () -> extractor.feed("more"));
        }
    }
}
