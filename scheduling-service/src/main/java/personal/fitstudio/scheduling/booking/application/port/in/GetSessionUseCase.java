package personal.fitstudio.scheduling.booking.application.port.in;

import personal.fitstudio.scheduling.booking.domain.model.SessionDetails;

/**
 * Get Session UseCase (Input Port)
 */
public interface GetSessionUseCase {

    SessionDetails getSession(Long sessionId);
}
