package work.lcod.flowguard.repair;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.flowguard.api.ValidationOptions;
import work.lcod.flowguard.graph.FlowGraph;
import work.lcod.flowguard.policy.PortKindPolicy;

/**
 * Fixed sequence of {@link RepairPass}es. Later passes rely on the state left by
 * earlier ones, so the order is part of the contract.
 *
 * <p>A late pass can leave work for an earlier one (pruning may orphan a service step after
 * promotion ran), so the sequence is repeated until a round applies no fix, at most
 * {@link #MAX_ROUNDS} times. Repairing a repaired graph therefore reports nothing.
 */
public final class RepairPipeline {
    private static final Logger log = LoggerFactory.getLogger(RepairPipeline.class);

    static final int MAX_ROUNDS = 5;

    private final List<RepairPass> passes;

    public RepairPipeline(List<RepairPass> passes) {
        this.passes = List.copyOf(passes);
        var ids = new LinkedHashSet<String>();
        for (var pass : this.passes) {
            if (!ids.add(pass.id())) {
                throw new IllegalArgumentException("Duplicate repair pass id: " + pass.id());
            }
        }
    }

    public static RepairPipeline standard() {
        return new RepairPipeline(List.of(
            new CompleteSchemaPass(),
            new DropBrokenEdgesPass(),
            new ChainUnwiredGraphPass(),
            new CanonicalizeDeprecatedKindsPass(),
            new StripMisusedToolEdgesPass(),
            new PromoteToolEquivalentsPass(),
            new StripModelLiteralsPass(),
            new ReverseToolEdgesPass(),
            new LayoutAuxiliariesPass(),
            new RepairNamesPass(),
            new NormalizeToolIndicesPass(),
            new PruneFanoutPass(),
            new ReconnectOrphansPass(),
            new PlaceholderCredentialsPass()
        ));
    }

    public List<RepairPass> passes() {
        return passes;
    }

    /**
     * Repairs a deep copy of {@code graph}; the argument is never modified.
     */
    public RepairResult repair(FlowGraph graph, PortKindPolicy policy, ValidationOptions options) {
        Objects.requireNonNull(graph, "graph");
        var context = new RepairContext(graph.deepCopy(), policy, options);
        var enabled = new ArrayList<RepairPass>();
        for (var pass : passes) {
            if (pass.enabledBy(options)) {
                enabled.add(pass);
            } else {
                log.debug("Skipping repair pass {}", pass.id());
            }
        }
        var fixes = new ArrayList<String>();
        for (int round = 1; round <= MAX_ROUNDS; round++) {
            var roundFixes = runRound(enabled, context);
            if (roundFixes.isEmpty()) {
                break;
            }
            fixes.addAll(roundFixes);
            if (round == MAX_ROUNDS) {
                log.warn("Repair did not settle after {} rounds", MAX_ROUNDS);
            }
        }
        return new RepairResult(context.graph(), !fixes.isEmpty(), fixes);
    }

    private static List<String> runRound(List<RepairPass> enabled, RepairContext context) {
        var fixes = new ArrayList<String>();
        for (var pass : enabled) {
            var applied = pass.apply(context);
            if (!applied.isEmpty()) {
                log.debug("Repair pass {} applied {} fix(es)", pass.id(), applied.size());
                for (var fix : applied) {
                    log.trace("[{}] {}", pass.id(), fix);
                }
                fixes.addAll(applied);
            }
        }
        return fixes;
    }
}
