package work.lcod.flowguard.repair;

import java.util.List;
import work.lcod.flowguard.api.ValidationOptions;

/**
 * One idempotent rewrite of the graph held by a {@link RepairContext}.
 */
public interface RepairPass {
    /**
     * Stable identifier used to disable the pass through configuration.
     */
    String id();

    /**
     * Rewrites the context graph in place.
     *
     * @return one human-readable message per change, empty when nothing changed
     */
    List<String> apply(RepairContext context);

    /**
     * Whether the pass runs under the given options. Opt-in passes override this.
     */
    default boolean enabledBy(ValidationOptions options) {
        return options.isPassEnabled(id());
    }
}
