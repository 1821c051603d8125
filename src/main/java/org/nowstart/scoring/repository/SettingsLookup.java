package org.nowstart.scoring.repository;

import java.util.Collection;
import java.util.Map;
import org.nowstart.scoring.data.type.SettingKey;

/**
 * Key-value source of stored scoring settings.
 *
 * <p>Implementations return the raw stored text for each requested key. Keys without a stored value may be
 * omitted or mapped to {@code null}. Failures are thrown to the caller as-is.
 */
public interface SettingsLookup {

    SettingsLookup NONE = keys -> Map.of();

    Map<SettingKey, String> getSettingsByKeys(Collection<SettingKey> keys);
}
