package io.github.hide212131.skillpkg.store;

import java.util.Locale;

/** レジストリに記録されるスキルの取得元種別。 */
public enum RegistrySource {
    REGISTRY,
    LOCAL,
    IMPORT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RegistrySource from(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        for (RegistrySource source : values()) {
            if (source.value().equalsIgnoreCase(value.trim())) {
                return source;
            }
        }
        throw new IllegalArgumentException("未対応の source です: " + value);
    }
}
