package in.mechmate.application.port.output;

import in.mechmate.domain.model.TaskType;

import java.util.Optional;

public interface TaskTypeRepository {

    Optional<TaskType> findById(long taskTypeId);
}
