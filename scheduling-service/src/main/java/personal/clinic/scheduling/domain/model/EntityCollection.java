package personal.clinic.scheduling.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 저장 컬렉션 (컬렉션당 파일 하나)
 */
public enum EntityCollection {
    PATIENTS("patients"),
    PROVIDERS("providers"),
    APPOINTMENTS("appointments");

    private final String collectionName;

    EntityCollection(String collectionName) {
        this.collectionName = collectionName;
    }

    public String collectionName() {
        return collectionName;
    }

    public static Optional<EntityCollection> fromName(String name) {
        return Arrays.stream(values())
                .filter(collection -> collection.collectionName.equalsIgnoreCase(name))
                .findFirst();
    }
}
