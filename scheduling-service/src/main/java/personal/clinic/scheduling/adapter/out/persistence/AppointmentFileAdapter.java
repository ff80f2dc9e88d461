package personal.clinic.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.clinic.common.result.Outcome;
import personal.clinic.scheduling.application.port.out.AppointmentRepository;
import personal.clinic.scheduling.domain.model.Appointment;
import personal.clinic.scheduling.domain.model.EntityCollection;

import java.util.List;
import java.util.Optional;

/**
 * Appointment File Adapter
 * appointments.json 기반 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AppointmentFileAdapter implements AppointmentRepository {

    private static final String COLLECTION = EntityCollection.APPOINTMENTS.collectionName();

    private final JsonFileStore store;
    private final DocumentMapper mapper;

    @Override
    public List<Appointment> findAll() {
        return mapper.toDomainList(store.load(COLLECTION), AppointmentDocument.class, AppointmentDocument::toDomain);
    }

    @Override
    public Optional<Appointment> findById(String appointmentId) {
        log.debug("Finding appointment: appointmentId={}", appointmentId);
        return store.findById(COLLECTION, appointmentId)
                .flatMap(record -> mapper.toDomain(record, AppointmentDocument.class, AppointmentDocument::toDomain));
    }

    @Override
    public Outcome<Appointment> save(Appointment appointment) {
        log.debug("Saving appointment: appointmentId={}, providerId={}, date={}, slot={}",
                appointment.id(), appointment.providerId(), appointment.date(), appointment.slot());
        return store.append(COLLECTION, mapper.toRecord(AppointmentDocument.fromDomain(appointment)))
                .map(ignored -> appointment);
    }

    @Override
    public Outcome<Appointment> update(Appointment appointment) {
        log.debug("Updating appointment: appointmentId={}, status={}", appointment.id(), appointment.status());
        return store.update(COLLECTION, appointment.id(), mapper.toRecord(AppointmentDocument.fromDomain(appointment)))
                .map(ignored -> appointment);
    }
}
