package personal.clinic.scheduling.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;
import personal.clinic.common.exception.ErrorCode;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.out.CollectionFileInfo;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * JSON File Store (Persistence Engine)
 * 컬렉션 하나를 JSON 배열 파일 하나({@code <collection>.json})로 저장한다.
 *
 * <ul>
 *   <li>저장: {@code <collection>.json.tmp}에 기록 → fsync → 원자적 rename. 실패 시 임시 파일 삭제, 기존 파일 유지</li>
 *   <li>append/update/delete: 컬렉션 락을 점유한 채 load → 메모리 수정 → save (컬렉션 단위 원자성)</li>
 *   <li>load: 파일이 없거나 내용이 깨진 경우 빈 컬렉션 반환 (로그만 남김)</li>
 * </ul>
 * 읽기도 같은 컬렉션 락을 사용한다 (reader/writer 분리 없음).
 */
@Slf4j
public class JsonFileStore {

    public static final String RECORD_ID = "id";
    static final String FILE_SUFFIX = ".json";
    static final String TEMP_SUFFIX = ".json.tmp";

    private static final TypeReference<List<Map<String, Object>>> RECORDS_TYPE = new TypeReference<>() {
    };
    private static final DateTimeFormatter BACKUP_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path dataDir;
    private final Path backupDir;
    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final Clock clock;
    private final CollectionLockTable lockTable = new CollectionLockTable();

    public JsonFileStore(Path dataDir, Path backupDir, ObjectMapper objectMapper, Clock clock) {
        this.dataDir = dataDir;
        this.backupDir = backupDir;
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
        this.clock = clock;
    }

    /**
     * 컬렉션 전체 로드
     *
     * @return 변경 가능한 레코드 목록 (파일 없음/손상 시 빈 목록)
     */
    public List<Map<String, Object>> load(String collection) {
        ReentrantLock lock = lockTable.lockFor(collection);
        lock.lock();
        try {
            return readRecords(collection);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 컬렉션 전체 저장 (원자적 교체)
     */
    public Outcome<Void> save(String collection, List<Map<String, Object>> records) {
        ReentrantLock lock = lockTable.lockFor(collection);
        lock.lock();
        try {
            return writeAtomically(collection, records);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 레코드 추가
     */
    public Outcome<Void> append(String collection, Map<String, Object> record) {
        ReentrantLock lock = lockTable.lockFor(collection);
        lock.lock();
        try {
            List<Map<String, Object>> records = readRecords(collection);
            records.add(record);
            return writeAtomically(collection, records);
        } finally {
            lock.unlock();
        }
    }

    /**
     * ID가 일치하는 레코드 교체
     */
    public Outcome<Void> update(String collection, String id, Map<String, Object> record) {
        ReentrantLock lock = lockTable.lockFor(collection);
        lock.lock();
        try {
            List<Map<String, Object>> records = readRecords(collection);
            for (int i = 0; i < records.size(); i++) {
                if (hasId(records.get(i), id)) {
                    records.set(i, record);
                    log.debug("Record updated in memory: collection={}, id={}", collection, id);
                    return writeAtomically(collection, records);
                }
            }
            log.warn("Record not found for update: collection={}, id={}", collection, id);
            return Outcome.rejected(ErrorCode.NOT_FOUND, "Record not found: " + collection + "/" + id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * ID가 일치하는 레코드 삭제
     */
    public Outcome<Void> delete(String collection, String id) {
        ReentrantLock lock = lockTable.lockFor(collection);
        lock.lock();
        try {
            List<Map<String, Object>> records = readRecords(collection);
            boolean removed = records.removeIf(record -> hasId(record, id));
            if (!removed) {
                log.warn("Record not found for delete: collection={}, id={}", collection, id);
                return Outcome.rejected(ErrorCode.NOT_FOUND, "Record not found: " + collection + "/" + id);
            }
            log.info("Record removed: collection={}, id={}", collection, id);
            return writeAtomically(collection, records);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Map<String, Object>> findById(String collection, String id) {
        return load(collection).stream()
                .filter(record -> hasId(record, id))
                .findFirst();
    }

    public int count(String collection) {
        return load(collection).size();
    }

    /**
     * 파일 메타데이터 (stat)
     */
    public CollectionFileInfo fileInfo(String collection) {
        ReentrantLock lock = lockTable.lockFor(collection);
        lock.lock();
        try {
            Path file = fileOf(collection);
            if (!Files.exists(file)) {
                return CollectionFileInfo.missing(collection);
            }
            return new CollectionFileInfo(
                    collection,
                    true,
                    Files.size(file),
                    readRecords(collection).size(),
                    Files.getLastModifiedTime(file).toInstant());
        } catch (IOException e) {
            log.error("Failed to read file info: collection={}", collection, e);
            return CollectionFileInfo.missing(collection);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 파일을 백업 디렉토리로 복사 ({@code <collection>_yyyyMMdd_HHmmss.json})
     *
     * @return 생성된 백업 파일 경로
     */
    public Outcome<Path> backup(String collection) {
        ReentrantLock lock = lockTable.lockFor(collection);
        lock.lock();
        try {
            Path source = fileOf(collection);
            if (!Files.exists(source)) {
                log.warn("Nothing to back up, collection file does not exist: collection={}", collection);
                return Outcome.rejected(ErrorCode.NOT_FOUND, "Collection file does not exist: " + collection);
            }
            Files.createDirectories(backupDir);
            String stamp = LocalDateTime.now(clock).format(BACKUP_STAMP);
            Path target = backupDir.resolve(collection + "_" + stamp + FILE_SUFFIX);
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("Backup created: collection={}, file={}", collection, target.getFileName());
            return Outcome.success(target);
        } catch (IOException e) {
            log.error("Failed to back up collection: collection={}", collection, e);
            return Outcome.failed("Failed to back up collection " + collection, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 백업 파일 목록 (최신순)
     *
     * @param collection 컬렉션 이름 필터, null이면 전체
     */
    public List<String> listBackups(String collection) {
        if (!Files.isDirectory(backupDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(backupDir)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(FILE_SUFFIX))
                    .filter(name -> collection == null || name.startsWith(collection + "_"))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list backups: dir={}", backupDir, e);
            return List.of();
        }
    }

    Path fileOf(String collection) {
        return dataDir.resolve(collection + FILE_SUFFIX);
    }

    Path tempFileOf(String collection) {
        return dataDir.resolve(collection + TEMP_SUFFIX);
    }

    /**
     * 임시 파일을 대상 파일로 원자적으로 교체
     */
    void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported, falling back to replace: target={}", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private List<Map<String, Object>> readRecords(String collection) {
        Path file = fileOf(collection);
        if (!Files.exists(file)) {
            log.debug("Collection file does not exist yet: collection={}", collection);
            return new ArrayList<>();
        }
        try {
            List<Map<String, Object>> records = objectMapper.readValue(file.toFile(), RECORDS_TYPE);
            if (records == null) {
                return new ArrayList<>();
            }
            log.debug("Collection loaded: collection={}, records={}", collection, records.size());
            return new ArrayList<>(records);
        } catch (JsonProcessingException e) {
            log.error("Malformed collection file, treating as empty: collection={}, error={}",
                    collection, e.getOriginalMessage());
            return new ArrayList<>();
        } catch (IOException e) {
            log.error("Failed to read collection file, treating as empty: collection={}", collection, e);
            return new ArrayList<>();
        }
    }

    private Outcome<Void> writeAtomically(String collection, List<Map<String, Object>> records) {
        Path target = fileOf(collection);
        Path temp = tempFileOf(collection);
        try {
            Files.createDirectories(dataDir);
            byte[] bytes = writer.writeValueAsBytes(records);
            writeDurably(temp, bytes);
            moveIntoPlace(temp, target);
            log.info("Collection saved: collection={}, records={}", collection, records.size());
            return Outcome.done();
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save collection, previous file kept: collection={}", collection, e);
            discardTemp(temp);
            return Outcome.failed("Failed to save collection " + collection, e);
        }
    }

    private void writeDurably(Path temp, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(temp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void discardTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to remove temporary file: file={}", temp, e);
        }
    }

    private static boolean hasId(Map<String, Object> record, String id) {
        return Objects.equals(String.valueOf(record.get(RECORD_ID)), id);
    }
}
