package com.newsaggregator.collector.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.newsaggregator.collector.exception.StoreCorruptionException;
import com.newsaggregator.collector.exception.StoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * 컬렉션 단위 JSON 파일 저장소.
 *
 * <ul>
 *   <li>컬렉션마다 독립된 read/write 잠금 (여러 reader 또는 하나의 writer)</li>
 *   <li>쓰기는 임시 파일에 기록한 뒤 원자적으로 교체</li>
 *   <li>하루 첫 쓰기 전에 일일 백업을 남기고 보존 기간이 지난 백업은 정리</li>
 *   <li>로드 시 파일이 손상되어 있으면 격리하고 가장 최근의 정상 백업으로 복구</li>
 * </ul>
 *
 * 읽기 결과는 매번 새로 역직렬화된 객체이므로 호출자가 수정해도 저장소 상태에 영향이 없다.
 */
@Slf4j
public class JsonStore {

    static final String METADATA = "metadata";
    static final String FORMAT_VERSION = "1.0";

    private static final DateTimeFormatter BACKUP_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter CORRUPT_STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final ObjectMapper objectMapper;
    private final Path dataDir;
    private final Path backupDir;
    private final int backupRetentionDays;
    private final Clock clock;

    private final Map<String, CollectionState> states = new ConcurrentHashMap<>();

    public JsonStore(ObjectMapper objectMapper, Path dataDir, int backupRetentionDays, Clock clock) {
        this.objectMapper = objectMapper;
        this.dataDir = dataDir;
        this.backupDir = dataDir.resolve("backups");
        this.backupRetentionDays = backupRetentionDays;
        this.clock = clock;
    }

    public <T> Optional<T> get(StoreCollection<T> collection, String id) {
        CollectionState state = state(collection);
        state.lock.readLock().lock();
        try {
            ObjectNode node = state.records.get(id);
            return node == null ? Optional.empty() : Optional.of(materialize(collection, node));
        } finally {
            state.lock.readLock().unlock();
        }
    }

    public <T> List<T> list(StoreCollection<T> collection, Predicate<? super T> filter) {
        CollectionState state = state(collection);
        state.lock.readLock().lock();
        try {
            List<T> result = new ArrayList<>();
            for (ObjectNode node : state.records.values()) {
                T record = materialize(collection, node);
                if (filter.test(record)) {
                    result.add(record);
                }
            }
            return result;
        } finally {
            state.lock.readLock().unlock();
        }
    }

    /**
     * 컬렉션 전체의 일관된 스냅샷 (삽입 순서)
     */
    public <T> List<T> snapshot(StoreCollection<T> collection) {
        return list(collection, record -> true);
    }

    public int count(StoreCollection<?> collection) {
        CollectionState state = state(collection);
        state.lock.readLock().lock();
        try {
            return state.records.size();
        } finally {
            state.lock.readLock().unlock();
        }
    }

    /**
     * 레코드를 삽입하거나 교체하고 즉시 디스크에 반영한다.
     * 디스크 쓰기에 실패하면 메모리 상태도 이전 그대로 유지된다.
     */
    public <T> T upsert(StoreCollection<T> collection, T record) {
        String id = collection.idOf(record);
        ObjectNode node = objectMapper.valueToTree(record);

        CollectionState state = state(collection);
        state.lock.writeLock().lock();
        try {
            Map<String, ObjectNode> next = new LinkedHashMap<>(state.records);
            next.put(id, node);
            persist(collection.name(), state, next);
            state.records = next;
            return materialize(collection, node);
        } finally {
            state.lock.writeLock().unlock();
        }
    }

    /**
     * 여러 레코드를 한 번의 파일 쓰기로 반영한다. 전부 반영되거나 하나도 반영되지 않는다.
     */
    public <T> List<T> upsertAll(StoreCollection<T> collection, List<T> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        Map<String, ObjectNode> nodes = new LinkedHashMap<>();
        for (T record : records) {
            nodes.put(collection.idOf(record), objectMapper.valueToTree(record));
        }

        CollectionState state = state(collection);
        state.lock.writeLock().lock();
        try {
            Map<String, ObjectNode> next = new LinkedHashMap<>(state.records);
            next.putAll(nodes);
            persist(collection.name(), state, next);
            state.records = next;
            List<T> saved = new ArrayList<>(nodes.size());
            for (ObjectNode node : nodes.values()) {
                saved.add(materialize(collection, node));
            }
            return saved;
        } finally {
            state.lock.writeLock().unlock();
        }
    }

    public <T> boolean delete(StoreCollection<T> collection, String id) {
        CollectionState state = state(collection);
        state.lock.writeLock().lock();
        try {
            if (!state.records.containsKey(id)) {
                return false;
            }
            Map<String, ObjectNode> next = new LinkedHashMap<>(state.records);
            next.remove(id);
            persist(collection.name(), state, next);
            state.records = next;
            return true;
        } finally {
            state.lock.writeLock().unlock();
        }
    }

    Path fileOf(String name) {
        return dataDir.resolve(name + ".json");
    }

    Path backupOf(String name, LocalDate date) {
        return backupDir.resolve(name + "_" + BACKUP_DATE.format(date) + ".json");
    }

    private CollectionState state(StoreCollection<?> collection) {
        CollectionState state = states.computeIfAbsent(collection.name(), name -> new CollectionState());
        if (!state.loaded) {
            state.lock.writeLock().lock();
            try {
                if (!state.loaded) {
                    state.records = load(collection.name());
                    state.loaded = true;
                }
            } finally {
                state.lock.writeLock().unlock();
            }
        }
        return state;
    }

    private <T> T materialize(StoreCollection<T> collection, JsonNode node) {
        try {
            return objectMapper.treeToValue(node, collection.type());
        } catch (JsonProcessingException e) {
            throw StoreException.serialization(collection.name(), e);
        }
    }

    // ---- load / recovery ----

    private Map<String, ObjectNode> load(String name) {
        Path file = fileOf(name);
        Path tmp = tempOf(name);
        try {
            if (Files.deleteIfExists(tmp)) {
                log.warn("Removed stale temp file left by an interrupted write: {}", tmp);
            }
        } catch (IOException e) {
            log.warn("Could not remove stale temp file {}: {}", tmp, e.getMessage());
        }

        if (!Files.exists(file)) {
            log.debug("Collection '{}' has no file yet, starting empty", name);
            return new LinkedHashMap<>();
        }

        try {
            Map<String, ObjectNode> records = parse(name, file);
            log.info("Loaded collection '{}' with {} records", name, records.size());
            return records;
        } catch (IOException | IllegalStateException e) {
            log.warn("Collection file {} is corrupt ({}), attempting recovery from backup", file, e.getMessage());
            return recoverFromBackup(name, file, e);
        }
    }

    private Map<String, ObjectNode> parse(String name, Path file) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("root is not a JSON object");
        }
        JsonNode body = root.get(name);
        Map<String, ObjectNode> records = new LinkedHashMap<>();
        if (body == null || body.isNull()) {
            return records;
        }
        if (!body.isObject()) {
            throw new IllegalStateException("'" + name + "' is not a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isObject()) {
                throw new IllegalStateException("record '" + entry.getKey() + "' is not a JSON object");
            }
            records.put(entry.getKey(), (ObjectNode) entry.getValue());
        }
        return records;
    }

    private void quarantine(String name, Path file) {
        Path target = dataDir.resolve(name + ".corrupt-" + CORRUPT_STAMP.format(LocalDateTime.now(clock)) + ".json");
        try {
            Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Moved corrupt collection file to {}", target);
        } catch (IOException e) {
            throw new StoreCorruptionException(name, "Corrupt file " + file + " could not be quarantined", e);
        }
    }

    /**
     * 손상된 원본은 정상 백업을 찾은 뒤에만 격리한다. 백업이 없으면 원본을 그대로 두고 실패하므로
     * 이후 로드에서도 빈 컬렉션으로 대체되지 않는다.
     */
    private Map<String, ObjectNode> recoverFromBackup(String name, Path file, Exception original) {
        for (Path backup : backupsOf(name)) {
            Map<String, ObjectNode> records;
            try {
                records = parse(name, backup);
            } catch (IOException | IllegalStateException e) {
                log.warn("Backup {} is not usable: {}", backup.getFileName(), e.getMessage());
                continue;
            }
            quarantine(name, file);
            try {
                writeFile(name, records);
            } catch (IOException e) {
                throw new StoreCorruptionException(name, "Recovered '" + name + "' from backup but could not rewrite it", e);
            }
            log.warn("Recovered collection '{}' from backup {} ({} records)", name, backup.getFileName(), records.size());
            return records;
        }
        throw new StoreCorruptionException(name,
                "Collection '" + name + "' is corrupt and no valid backup exists", original);
    }

    /**
     * 해당 컬렉션의 백업 목록, 최신 날짜 순
     */
    List<Path> backupsOf(String name) {
        List<Path> backups = new ArrayList<>();
        if (!Files.isDirectory(backupDir)) {
            return backups;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir, name + "_*.json")) {
            for (Path path : stream) {
                if (backupDate(name, path) != null) {
                    backups.add(path);
                }
            }
        } catch (IOException e) {
            log.warn("Could not list backups for '{}': {}", name, e.getMessage());
        }
        backups.sort(Comparator.comparing((Path p) -> backupDate(name, p)).reversed());
        return backups;
    }

    private LocalDate backupDate(String name, Path path) {
        String fileName = path.getFileName().toString();
        String stamp = fileName.substring(name.length() + 1, fileName.length() - ".json".length());
        try {
            return LocalDate.parse(stamp, BACKUP_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    // ---- write path ----

    private void persist(String name, CollectionState state, Map<String, ObjectNode> records) {
        backupIfDue(name, state);
        try {
            writeFile(name, records);
        } catch (IOException e) {
            throw StoreException.writeFailed(name, e);
        }
    }

    private void writeFile(String name, Map<String, ObjectNode> records) throws IOException {
        Files.createDirectories(dataDir);

        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode metadata = root.putObject(METADATA);
        metadata.put("version", FORMAT_VERSION);
        metadata.put("updated_at", clock.instant().toString());
        metadata.put("total_count", records.size());
        ObjectNode body = root.putObject(name);
        records.forEach(body::set);

        Path tmp = tempOf(name);
        Path file = fileOf(name);
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), root);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    private void backupIfDue(String name, CollectionState state) {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(state.lastBackupDate)) {
            return;
        }
        Path file = fileOf(name);
        if (!Files.exists(file)) {
            return;
        }
        Path backup = backupOf(name, today);
        try {
            Files.createDirectories(backupDir);
            if (!Files.exists(backup)) {
                Files.copy(file, backup);
                log.info("Created daily backup {}", backup.getFileName());
            }
            state.lastBackupDate = today;
            pruneBackups(name, today);
        } catch (IOException e) {
            log.warn("Daily backup of '{}' failed: {}", name, e.getMessage());
        }
    }

    private void pruneBackups(String name, LocalDate today) {
        LocalDate cutoff = today.minusDays(backupRetentionDays);
        for (Path backup : backupsOf(name)) {
            LocalDate date = backupDate(name, backup);
            if (date != null && date.isBefore(cutoff)) {
                try {
                    Files.deleteIfExists(backup);
                    log.info("Removed expired backup {}", backup.getFileName());
                } catch (IOException e) {
                    log.warn("Could not remove expired backup {}: {}", backup.getFileName(), e.getMessage());
                }
            }
        }
    }

    private Path tempOf(String name) {
        return dataDir.resolve(name + ".json.tmp");
    }

    private static final class CollectionState {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private volatile boolean loaded;
        private Map<String, ObjectNode> records = new LinkedHashMap<>();
        private LocalDate lastBackupDate;
    }
}
