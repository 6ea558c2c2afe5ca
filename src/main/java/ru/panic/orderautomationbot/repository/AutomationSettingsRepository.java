package ru.panic.orderautomationbot.repository;

import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import ru.panic.orderautomationbot.model.AutomationSettings;

@Repository
public interface AutomationSettingsRepository extends CrudRepository<AutomationSettings, Long> {
}
