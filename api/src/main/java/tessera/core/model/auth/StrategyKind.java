package tessera.core.model.auth;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of credential verification strategies.
 */
public enum StrategyKind {
    LOCAL_PASSWORD("local-password"),
    EXTERNAL_PROVIDER("external-provider"),
    BEARER_TOKEN("bearer-token");

    private final String configName;

    StrategyKind(String configName) {
        this.configName = configName;
    }

    /**
     * Name used in configuration and on the wire.
     */
    public String configName() {
        return configName;
    }

    /**
     * Resolve a strategy from its configuration name, case-insensitively.
     *
     * @param name configuration name such as {@code local-password}
     * @return the strategy, or empty if the name is unknown
     */
    public static Optional<StrategyKind> fromConfigName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        final var normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(kind -> kind.configName.equals(normalized))
                .findFirst();
    }
}
