package ru.panic.orderautomationbot.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import ru.panic.orderautomationbot.model.AutomationSettings;
import ru.panic.orderautomationbot.repository.AutomationSettingsRepository;

@Service
@RequiredArgsConstructor
public class AutomationSettingsService {
    private final AutomationSettingsRepository automationSettingsRepository;

    /**
     * The stored settings row, or the built-in defaults when none was saved.
     */
    public AutomationSettings get() {
        return automationSettingsRepository.findById(AutomationSettings.SINGLETON_ID)
                .orElseGet(AutomationSettings::defaults);
    }
}
