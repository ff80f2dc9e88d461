package personal.clinic.scheduling.adapter.out.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Document Mapper
 * 저장소 레코드(Map) ↔ 문서(record) ↔ 도메인 변환
 * 변환할 수 없는 레코드는 로그를 남기고 건너뛴다 (컬렉션 전체를 버리지 않음).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentMapper {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Map<String, Object> toRecord(Object document) {
        return objectMapper.convertValue(document, RECORD_TYPE);
    }

    public <D, T> Optional<T> toDomain(Map<String, Object> record,
                                       Class<D> documentType,
                                       Function<D, T> converter) {
        try {
            D document = objectMapper.convertValue(record, documentType);
            return Optional.of(converter.apply(document));
        } catch (RuntimeException e) {
            log.error("Skipping unreadable record: type={}, id={}, error={}",
                    documentType.getSimpleName(), record.get(JsonFileStore.RECORD_ID), e.getMessage());
            return Optional.empty();
        }
    }

    public <D, T> List<T> toDomainList(List<Map<String, Object>> records,
                                       Class<D> documentType,
                                       Function<D, T> converter) {
        List<T> result = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            toDomain(record, documentType, converter).ifPresent(result::add);
        }
        return List.copyOf(result);
    }
}
