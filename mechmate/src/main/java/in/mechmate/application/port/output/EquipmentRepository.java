package in.mechmate.application.port.output;

import in.mechmate.domain.model.Equipment;

import java.util.Optional;

public interface EquipmentRepository {

    Optional<Equipment> findById(long equipmentId);
}
