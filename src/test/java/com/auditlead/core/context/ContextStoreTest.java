package com.auditlead.core.context;

import com.auditlead.core.model.RunMode;
import com.auditlead.core.model.SharedArtifact;
import com.auditlead.core.model.TaskRecord;
import com.auditlead.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ContextStoreTest {

    private static final String TARGET = "https://example.com/";

    private ContextStore store;

    @BeforeEach
    void setUp() {
        store = new ContextStore("AUD-1", TARGET, RunMode.FULL);
    }

    private static SharedArtifact page(String url, String type, String text) {
        return SharedArtifact.of(SharedArtifact.PAGE, url, "web_scraper", text, Map.of("type", type, "title", "T " + url));
    }

    @Nested
    @DisplayName("artifacts")
    class ArtifactTests {

        @Test
        @DisplayName("re-inserting a key overwrites")
        void overwriteByKey() {
            store.setArtifact(page("https://example.com/a", "other", "v1"));
            store.setArtifact(page("https://example.com/a", "other", "v2"));

            assertEquals(1, store.artifacts(SharedArtifact.PAGE).size());
            assertEquals("v2", store.artifact(SharedArtifact.PAGE, "https://example.com/a").orElseThrow().text());
        }

        @Test
        @DisplayName("100 concurrent writers with unique keys are all present")
        void concurrentWrites() throws Exception {
            int writers = 100;
            ExecutorService pool = Executors.newFixedThreadPool(16);
            var start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String url = "https://example.com/page-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    store.setArtifact(page(url, "other", "text"));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
            pool.shutdown();

            assertEquals(writers, store.artifacts(SharedArtifact.PAGE).size());
            assertEquals(writers, store.artifactCounts().get(SharedArtifact.PAGE));
        }

        @Test
        @DisplayName("readers see consistent snapshots while writers run")
        void readersDuringWrites() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(2);
            var failed = new AtomicBoolean(false);
            Future<?> writer = pool.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    store.setArtifact(page("https://example.com/" + i, "other", "x"));
                }
            });
            Future<?> reader = pool.submit(() -> {
                int last = 0;
                while (!writer.isDone()) {
                    int size = store.artifacts(SharedArtifact.PAGE).size();
                    if (size < last) {
                        failed.set(true);
                    }
                    last = size;
                    store.concatenatedText(SharedArtifact.PAGE, 10_000);
                }
            });
            writer.get(10, TimeUnit.SECONDS);
            reader.get(10, TimeUnit.SECONDS);
            pool.shutdown();

            assertFalse(failed.get());
            assertEquals(500, store.artifacts(SharedArtifact.PAGE).size());
        }

        @Test
        @DisplayName("filters by attribute and key prefix")
        void filters() {
            store.setArtifact(page("https://example.com/pricing", "pricing", "p"));
            store.setArtifact(page("https://example.com/about", "about", "a"));
            String url = "https://example.com/";
            store.setArtifact(SharedArtifact.of(SharedArtifact.SCREENSHOT,
                    SharedArtifact.screenshotKey(url, "desktop"), "screenshot", "", Map.of("type", "desktop")));
            store.setArtifact(SharedArtifact.of(SharedArtifact.SCREENSHOT,
                    SharedArtifact.screenshotKey(url, "mobile"), "screenshot", "", Map.of("type", "mobile")));
            store.setArtifact(SharedArtifact.of(SharedArtifact.SCREENSHOT,
                    SharedArtifact.screenshotKey("https://other.com/", "desktop"), "screenshot", "", Map.of()));

            assertEquals(1, store.artifactsWhere(SharedArtifact.PAGE, "type", "pricing").size());
            assertEquals(2, store.artifactsWithKeyPrefix(SharedArtifact.SCREENSHOT, url).size());
            assertTrue(store.artifacts("unknown").isEmpty());
        }

        @Test
        @DisplayName("primary artifact matches the target ignoring a trailing slash")
        void primaryArtifact() {
            store.setArtifact(page("https://example.com/about", "about", "a"));
            store.setArtifact(page("https://example.com", "homepage", "h"));

            assertEquals("h", store.primaryArtifact(SharedArtifact.PAGE).orElseThrow().text());
        }

        @Test
        @DisplayName("primary artifact falls back to the first inserted")
        void primaryArtifactFallback() {
            store.setArtifact(page("https://example.com/about", "about", "a"));
            store.setArtifact(page("https://example.com/blog", "blog", "b"));

            assertEquals("a", store.primaryArtifact(SharedArtifact.PAGE).orElseThrow().text());
            assertTrue(store.primaryArtifact(SharedArtifact.SCREENSHOT).isEmpty());
        }
    }

    @Nested
    @DisplayName("concatenatedText")
    class ConcatenatedTextTests {

        @Test
        @DisplayName("includes header, title and content per artifact")
        void format() {
            store.setArtifact(page("https://example.com/a", "other", "hello"));

            String text = store.concatenatedText(SharedArtifact.PAGE, 10_000);

            assertTrue(text.contains("--- PAGE: https://example.com/a ---"));
            assertTrue(text.contains("Title: T https://example.com/a"));
            assertTrue(text.contains("Content:\nhello"));
        }

        @Test
        @DisplayName("caps each artifact at 5000 characters")
        void perArtifactCap() {
            store.setArtifact(page("https://example.com/a", "other", "x".repeat(8000)));

            String text = store.concatenatedText(SharedArtifact.PAGE, 100_000);

            assertFalse(text.contains("x".repeat(ContextStore.MAX_CHARS_PER_ARTIFACT + 1)));
            assertTrue(text.contains("x".repeat(ContextStore.MAX_CHARS_PER_ARTIFACT)));
        }

        @Test
        @DisplayName("stops before exceeding the budget")
        void budget() {
            for (int i = 0; i < 10; i++) {
                store.setArtifact(page("https://example.com/" + i, "other", "y".repeat(1000)));
            }

            String text = store.concatenatedText(SharedArtifact.PAGE, 3500);

            assertTrue(text.length() <= 3500);
            assertTrue(text.contains("https://example.com/0"));
            assertFalse(text.contains("https://example.com/9"));
        }

        @Test
        @DisplayName("uses the run budget by default")
        void defaultBudget() {
            var small = new ContextStore("AUD-2", TARGET, RunMode.FULL, 1200);
            small.setArtifact(page("https://example.com/0", "other", "z".repeat(1000)));
            small.setArtifact(page("https://example.com/1", "other", "z".repeat(1000)));

            assertFalse(small.concatenatedText(SharedArtifact.PAGE).contains("https://example.com/1"));
        }

        @Test
        @DisplayName("empty kind yields empty text")
        void emptyKind() {
            assertEquals("", store.concatenatedText(SharedArtifact.PAGE, 1000));
        }
    }

    @Nested
    @DisplayName("task records")
    class RecordTests {

        @Test
        @DisplayName("registered tasks start PENDING in registration order")
        void registration() {
            store.registerTask("web_scraper");
            store.registerTask("seo");
            store.registerTask("web_scraper");

            var records = store.records();
            assertEquals(2, records.size());
            assertEquals("web_scraper", records.get(0).name());
            assertEquals(TaskStatus.PENDING, records.get(1).status());
        }

        @Test
        @DisplayName("getResult is empty until COMPLETED, then returns the payload")
        void resultVisibleWithStatus() {
            store.registerTask("seo");
            TaskRecord running = store.record("seo").orElseThrow().running("", Instant.now());
            store.setResult(running);

            assertTrue(store.getResult("seo").isEmpty());
            assertFalse(store.isCompleted("seo"));

            store.setResult(running.completed(Map.of("score", 7), Instant.now()));

            assertTrue(store.isCompleted("seo"));
            assertEquals(7, store.getResult("seo").orElseThrow().get("score"));
        }

        @Test
        @DisplayName("a reader observing COMPLETED always sees the payload")
        void statusAndPayloadAtomic() throws Exception {
            store.registerTask("seo");
            var failed = new AtomicBoolean(false);
            var start = new CountDownLatch(1);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            Future<?> reader = pool.submit(() -> {
                start.await();
                while (true) {
                    var record = store.record("seo").orElseThrow();
                    if (record.status() == TaskStatus.COMPLETED) {
                        if (record.resultPayload() == null || !record.resultPayload().containsKey("score")) {
                            failed.set(true);
                        }
                        return null;
                    }
                }
            });
            start.countDown();
            TaskRecord running = store.record("seo").orElseThrow().running("", Instant.now());
            store.setResult(running);
            store.setResult(running.completed(Map.of("score", 1), Instant.now()));
            reader.get(10, TimeUnit.SECONDS);
            pool.shutdown();

            assertFalse(failed.get());
        }

        @Test
        @DisplayName("rejects unregistered tasks and writes after terminal")
        void illegalWrites() {
            assertThrows(IllegalStateException.class,
                    () -> store.setResult(TaskRecord.pending("ghost").running("", Instant.now())));

            store.registerTask("seo");
            TaskRecord running = store.record("seo").orElseThrow().running("", Instant.now());
            store.setResult(running);
            store.setResult(running.failed("boom", Instant.now()));

            assertThrows(IllegalStateException.class, () -> store.setResult(running.withProgress(50, "late")));
            assertEquals(TaskStatus.FAILED, store.record("seo").orElseThrow().status());
        }

        @Test
        @DisplayName("exposes run-scoped scalars")
        void scalars() {
            store.setTargetName("Example Inc");

            assertEquals("AUD-1", store.runId());
            assertEquals(TARGET, store.targetId());
            assertEquals(RunMode.FULL, store.runMode());
            assertEquals("Example Inc", store.targetName());
        }
    }
}
