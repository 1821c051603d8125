package org.nowstart.scoring.repository;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.scoring.data.type.SettingKey;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Repository;

/**
 * Reads stored setting keys (for example {@code PARAM_SCORE_MIN_TRADES}) from the Spring environment, so
 * they can be supplied as environment variables, system properties or application properties.
 */
@Repository
@RequiredArgsConstructor
public class EnvironmentSettingsLookup implements SettingsLookup {

    private final Environment environment;

    @Override
    public Map<SettingKey, String> getSettingsByKeys(Collection<SettingKey> keys) {
        Map<SettingKey, String> values = new HashMap<>();
        for (SettingKey key : keys) {
            String raw = environment.getProperty(key.name());
            if (raw != null) {
                values.put(key, raw);
            }
        }
        return values;
    }
}
