package com.newsaggregator.collector.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsaggregator.collector.config.StoreConfig;
import com.newsaggregator.collector.entity.Article;
import com.newsaggregator.collector.entity.Relevance;
import com.newsaggregator.collector.exception.StoreCorruptionException;
import com.newsaggregator.collector.exception.StoreException;
import com.newsaggregator.collector.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonStore 단위 테스트 (임시 디렉터리 사용)
 */
class JsonStoreTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper objectMapper = StoreConfig.storeObjectMapper();
    private MutableClock clock;
    private JsonStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-10T09:00:00Z");
        store = newStore();
    }

    private JsonStore newStore() {
        return new JsonStore(objectMapper, dataDir, 7, clock);
    }

    private static Article article(String id, String title) {
        return Article.builder()
                .id(id)
                .title(title)
                .body("body of " + title)
                .sourceId("feed-a")
                .build()
                .rehash();
    }

    private Path primary() {
        return dataDir.resolve("articles.json");
    }

    @Nested
    @DisplayName("기본 CRUD")
    class Crud {

        @Test
        @DisplayName("저장한 레코드를 다시 읽을 수 있다")
        void upsertThenGet() {
            // when
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));

            // then
            assertThat(store.get(StoreCollection.ARTICLES, "a1"))
                    .get()
                    .extracting(Article::getTitle)
                    .isEqualTo("First");
            assertThat(store.count(StoreCollection.ARTICLES)).isEqualTo(1);
        }

        @Test
        @DisplayName("읽은 객체를 수정해도 저장소 상태는 바뀌지 않는다")
        void readsAreDetachedCopies() {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));

            // when
            Article copy = store.get(StoreCollection.ARTICLES, "a1").orElseThrow();
            copy.setTitle("Mutated");
            copy.setRelevance(Relevance.SPAM);

            // then
            Article reread = store.get(StoreCollection.ARTICLES, "a1").orElseThrow();
            assertThat(reread.getTitle()).isEqualTo("First");
            assertThat(reread.getRelevance()).isEqualTo(Relevance.UNCLASSIFIED);
        }

        @Test
        @DisplayName("파일이 없으면 빈 컬렉션으로 시작한다")
        void missingFileIsEmpty() {
            assertThat(store.snapshot(StoreCollection.SOURCES)).isEmpty();
            assertThat(Files.exists(dataDir.resolve("sources.json"))).isFalse();
        }

        @Test
        @DisplayName("list는 필터를 적용하고 delete는 레코드를 제거한다")
        void listAndDelete() {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "Keep"));
            store.upsert(StoreCollection.ARTICLES, article("a2", "Drop"));

            // when
            boolean deleted = store.delete(StoreCollection.ARTICLES, "a2");

            // then
            assertThat(deleted).isTrue();
            assertThat(store.delete(StoreCollection.ARTICLES, "missing")).isFalse();
            assertThat(store.list(StoreCollection.ARTICLES, a -> a.getTitle().startsWith("K")))
                    .extracting(Article::getId)
                    .containsExactly("a1");
        }

        @Test
        @DisplayName("다시 열면 디스크에 기록된 내용이 그대로 로드된다")
        void survivesReopen() throws Exception {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));
            store.upsert(StoreCollection.ARTICLES, article("a2", "Second"));

            // when
            JsonStore reopened = newStore();

            // then
            assertThat(reopened.snapshot(StoreCollection.ARTICLES))
                    .extracting(Article::getId)
                    .containsExactly("a1", "a2");

            JsonNode root = objectMapper.readTree(primary().toFile());
            assertThat(root.path("metadata").path("total_count").asInt()).isEqualTo(2);
            assertThat(root.path("metadata").path("version").asText()).isEqualTo("1.0");
            assertThat(root.path("articles").path("a1").path("content_hash").asText()).hasSize(64);
        }
    }

    @Nested
    @DisplayName("원자적 쓰기")
    class AtomicWrites {

        @Test
        @DisplayName("쓰기 후 임시 파일이 남지 않는다")
        void noTempFileLeftBehind() {
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));

            assertThat(Files.exists(dataDir.resolve("articles.json.tmp"))).isFalse();
            assertThat(Files.exists(primary())).isTrue();
        }

        @Test
        @DisplayName("중단된 쓰기가 남긴 임시 파일은 로드 시 무시되고 삭제된다")
        void staleTempFileIgnored() throws Exception {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));
            Files.writeString(dataDir.resolve("articles.json.tmp"), "{\"metadata\": {\"trunc");

            // when
            JsonStore reopened = newStore();

            // then
            assertThat(reopened.snapshot(StoreCollection.ARTICLES)).extracting(Article::getId).containsExactly("a1");
            assertThat(Files.exists(dataDir.resolve("articles.json.tmp"))).isFalse();
        }

        @Test
        @DisplayName("쓰기에 실패하면 기존 파일과 메모리 상태가 그대로 남는다")
        void failedWriteKeepsPreviousState() throws Exception {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));
            String before = Files.readString(primary());
            Path blocker = dataDir.resolve("articles.json.tmp");
            Files.createDirectory(blocker);
            Files.writeString(blocker.resolve("occupied"), "x");

            // when / then
            assertThatThrownBy(() -> store.upsert(StoreCollection.ARTICLES, article("a2", "Second")))
                    .isInstanceOf(StoreException.class);
            assertThat(Files.readString(primary())).isEqualTo(before);
            assertThat(store.get(StoreCollection.ARTICLES, "a2")).isEmpty();
            assertThat(store.count(StoreCollection.ARTICLES)).isEqualTo(1);
        }

        @Test
        @DisplayName("일괄 저장은 한 번의 쓰기로 모두 반영된다")
        void upsertAllWritesEveryRecord() {
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));

            List<Article> saved = store.upsertAll(StoreCollection.ARTICLES,
                    List.of(article("a2", "Second"), article("a1", "First again")));

            assertThat(saved).extracting(Article::getId).containsExactly("a2", "a1");
            JsonStore reopened = newStore();
            assertThat(reopened.count(StoreCollection.ARTICLES)).isEqualTo(2);
            assertThat(reopened.get(StoreCollection.ARTICLES, "a1").orElseThrow().getTitle()).isEqualTo("First again");
        }

        @Test
        @DisplayName("일괄 저장이 실패하면 어떤 레코드도 반영되지 않는다")
        void failedUpsertAllKeepsPreviousState() throws Exception {
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));
            Path blocker = dataDir.resolve("articles.json.tmp");
            Files.createDirectory(blocker);
            Files.writeString(blocker.resolve("occupied"), "x");

            assertThatThrownBy(() -> store.upsertAll(StoreCollection.ARTICLES,
                    List.of(article("a2", "Second"), article("a3", "Third"))))
                    .isInstanceOf(StoreException.class);
            assertThat(store.count(StoreCollection.ARTICLES)).isEqualTo(1);
            assertThat(store.get(StoreCollection.ARTICLES, "a2")).isEmpty();
        }

        @Test
        @DisplayName("동시 쓰기가 서로를 잃어버리지 않는다")
        void concurrentUpsertsAreSerialized() throws Exception {
            // given
            int threads = 8;
            int perThread = 15;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            // when
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.upsert(StoreCollection.ARTICLES, article("t" + thread + "-" + i, "Title " + thread + i));
                        store.snapshot(StoreCollection.ARTICLES);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            pool.shutdown();

            // then
            assertThat(store.count(StoreCollection.ARTICLES)).isEqualTo(threads * perThread);
            assertThat(newStore().count(StoreCollection.ARTICLES)).isEqualTo(threads * perThread);
        }
    }

    @Nested
    @DisplayName("일일 백업")
    class Backups {

        private Path backup(LocalDate date) {
            return dataDir.resolve("backups").resolve("articles_" + date.toString().replace("-", "") + ".json");
        }

        @Test
        @DisplayName("하루에 한 번, 쓰기 직전 상태를 백업한다")
        void oneBackupPerDay() throws Exception {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));

            // when
            store.upsert(StoreCollection.ARTICLES, article("a2", "Second"));
            store.upsert(StoreCollection.ARTICLES, article("a3", "Third"));

            // then
            Path today = backup(LocalDate.of(2024, 3, 10));
            assertThat(today).exists();
            JsonNode backedUp = objectMapper.readTree(today.toFile()).path("articles");
            assertThat(backedUp.has("a1")).isTrue();
            assertThat(backedUp.has("a2")).isFalse();

            // 다음 날 첫 쓰기에서 새 백업
            clock.advance(Duration.ofDays(1));
            store.upsert(StoreCollection.ARTICLES, article("a4", "Fourth"));

            Path tomorrow = backup(LocalDate.of(2024, 3, 11));
            assertThat(tomorrow).exists();
            assertThat(objectMapper.readTree(tomorrow.toFile()).path("articles").size()).isEqualTo(3);
        }

        @Test
        @DisplayName("보존 기간이 지난 백업은 정리된다")
        void prunesExpiredBackups() throws Exception {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));
            Files.createDirectories(dataDir.resolve("backups"));
            Path old = backup(LocalDate.of(2024, 2, 28));
            Path recent = backup(LocalDate.of(2024, 3, 7));
            Files.copy(primary(), old);
            Files.copy(primary(), recent);

            // when
            store.upsert(StoreCollection.ARTICLES, article("a2", "Second"));

            // then
            assertThat(old).doesNotExist();
            assertThat(recent).exists();
        }
    }

    @Nested
    @DisplayName("손상 복구")
    class Corruption {

        @Test
        @DisplayName("손상된 파일은 격리하고 가장 최근의 정상 백업으로 복구한다")
        void recoversFromNewestValidBackup() throws Exception {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));
            clock.advance(Duration.ofDays(1));
            store.upsert(StoreCollection.ARTICLES, article("a2", "Second"));
            Files.writeString(primary(), "{\"metadata\": {\"version\": \"1.0\"}, \"articles\": {\"a1\": ");

            // when
            JsonStore reopened = newStore();

            // then
            assertThat(reopened.snapshot(StoreCollection.ARTICLES)).extracting(Article::getId).containsExactly("a1");
            try (Stream<Path> files = Files.list(dataDir)) {
                assertThat(files.map(p -> p.getFileName().toString()))
                        .anyMatch(name -> name.startsWith("articles.corrupt-"));
            }
            assertThat(objectMapper.readTree(primary().toFile()).path("articles").has("a1")).isTrue();
        }

        @Test
        @DisplayName("손상된 백업은 건너뛰고 더 오래된 정상 백업을 사용한다")
        void skipsCorruptBackups() throws Exception {
            // given
            store.upsert(StoreCollection.ARTICLES, article("a1", "First"));
            Path backups = Files.createDirectories(dataDir.resolve("backups"));
            Files.copy(primary(), backups.resolve("articles_20240305.json"));
            Files.writeString(backups.resolve("articles_20240309.json"), "garbage");
            Files.writeString(primary(), "");

            // when
            JsonStore reopened = newStore();

            // then
            assertThat(reopened.get(StoreCollection.ARTICLES, "a1")).isPresent();
        }

        @Test
        @DisplayName("사용 가능한 백업이 없으면 빈 컬렉션을 만들지 않고 예외를 던진다")
        void failsWithoutBackup() throws Exception {
            // given
            Files.writeString(primary(), "[1, 2, 3");

            // when / then
            assertThatThrownBy(() -> store.snapshot(StoreCollection.ARTICLES))
                    .isInstanceOf(StoreCorruptionException.class)
                    .hasMessageContaining("articles");
            assertThat(Files.readString(primary())).isEqualTo("[1, 2, 3");
            assertThatThrownBy(() -> store.count(StoreCollection.ARTICLES))
                    .isInstanceOf(StoreCorruptionException.class);
        }

        @Test
        @DisplayName("한 컬렉션의 손상은 다른 컬렉션에 영향을 주지 않는다")
        void collectionsAreIndependent() throws Exception {
            // given
            Files.writeString(primary(), "not json");

            // when
            assertThatThrownBy(() -> store.count(StoreCollection.ARTICLES)).isInstanceOf(StoreCorruptionException.class);

            // then
            assertThat(store.snapshot(StoreCollection.SOURCES)).isEmpty();
        }
    }
}
