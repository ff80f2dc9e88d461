package personal.clinic.scheduling.application.port.in;

/**
 * Get Statistics UseCase (Input Port)
 */
public interface GetStatisticsUseCase {

    SchedulingStatistics getStatistics();
}
