package personal.clinic.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.out.PatientRepository;
import personal.clinic.scheduling.domain.model.EntityCollection;
import personal.clinic.scheduling.domain.model.Patient;

import java.util.List;
import java.util.Optional;

/**
 * Patient File Adapter
 * patients.json 기반 환자 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatientFileAdapter implements PatientRepository {

    private static final String COLLECTION = EntityCollection.PATIENTS.collectionName();

    private final JsonFileStore store;
    private final DocumentMapper mapper;

    @Override
    public List<Patient> findAll() {
        return mapper.toDomainList(store.load(COLLECTION), PatientDocument.class, PatientDocument::toDomain);
    }

    @Override
    public Optional<Patient> findById(String patientId) {
        log.debug("Finding patient: patientId={}", patientId);
        return store.findById(COLLECTION, patientId)
                .flatMap(record -> mapper.toDomain(record, PatientDocument.class, PatientDocument::toDomain));
    }

    @Override
    public Outcome<Patient> save(Patient patient) {
        log.debug("Saving patient: patientId={}", patient.id());
        return store.append(COLLECTION, mapper.toRecord(PatientDocument.fromDomain(patient)))
                .map(ignored -> patient);
    }

    @Override
    public Outcome<Patient> update(Patient patient) {
        log.debug("Updating patient: patientId={}", patient.id());
        return store.update(COLLECTION, patient.id(), mapper.toRecord(PatientDocument.fromDomain(patient)))
                .map(ignored -> patient);
    }

    @Override
    public Outcome<Void> delete(String patientId) {
        return store.delete(COLLECTION, patientId);
    }
}
