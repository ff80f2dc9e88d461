package personal.clinic.scheduling.adapter.out.persistence;

import java.time.LocalDateTime;

/**
 * 문서 시각 필드 변환 (ISO-8601, 누락 시 현재 시각)
 */
final class DocumentTimes {

    private DocumentTimes() {
    }

    static String format(LocalDateTime time) {
        return time == null ? null : time.toString();
    }

    static LocalDateTime parseOrNow(String text) {
        if (text == null || text.isBlank()) {
            return LocalDateTime.now();
        }
        return LocalDateTime.parse(text);
    }
}
