package in.mechmate.application.port.output;

import in.mechmate.domain.model.Equipment;
import in.mechmate.domain.model.Task;
import in.mechmate.domain.model.TaskType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory tasks, equipment and task types for tests.
 *
 * Counts lookups so tests can assert per-scan caching.
 */
public class InMemoryMaintenanceCatalog implements TaskRepository, EquipmentRepository {

    private final List<Task> tasks = new ArrayList<>();
    private final Map<Long, Equipment> equipment = new HashMap<>();
    private final Map<Long, TaskType> taskTypes = new HashMap<>();
    private int equipmentLookups;
    private int taskTypeLookups;

    public InMemoryMaintenanceCatalog add(Equipment e) {
        equipment.put(e.id(), e);
        return this;
    }

    public InMemoryMaintenanceCatalog add(TaskType t) {
        taskTypes.put(t.id(), t);
        return this;
    }

    public InMemoryMaintenanceCatalog add(Task t) {
        tasks.add(t);
        return this;
    }

    public int equipmentLookups() {
        return equipmentLookups;
    }

    public int taskTypeLookups() {
        return taskTypeLookups;
    }

    /**
     * Returns every stored task regardless of status, so the scanner's own
     * pending filter is exercised.
     */
    @Override
    public List<Task> findAllPending() {
        return List.copyOf(tasks);
    }

    @Override
    public Optional<Equipment> findById(long id) {
        equipmentLookups++;
        return Optional.ofNullable(equipment.get(id));
    }

    public TaskTypeRepository taskTypes() {
        return id -> {
            taskTypeLookups++;
            return Optional.ofNullable(taskTypes.get(id));
        };
    }
}
