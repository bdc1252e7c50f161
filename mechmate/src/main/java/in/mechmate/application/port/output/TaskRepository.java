package in.mechmate.application.port.output;

import in.mechmate.domain.model.Task;

import java.util.List;

/**
 * Read-only access to maintenance tasks.
 */
public interface TaskRepository {

    /**
     * All tasks with status PENDING.
     */
    List<Task> findAllPending();
}
