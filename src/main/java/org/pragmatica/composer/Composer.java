package org.pragmatica.composer;

import org.pragmatica.composer.error.CompositionError;
import org.pragmatica.composer.error.Diagnostic;
import org.pragmatica.composer.error.Diagnostics;
import org.pragmatica.composer.error.MalformedTreeException;
import org.pragmatica.composer.error.RecoveryPolicy;
import org.pragmatica.composer.error.ResultWithDiagnostics;
import org.pragmatica.composer.table.Compositions;
import org.pragmatica.composer.table.Entry;
import org.pragmatica.composer.table.Table;
import org.pragmatica.composer.table.TableBuilder;
import org.pragmatica.composer.tree.Node;
import org.pragmatica.composer.tree.Sequence;
import org.pragmatica.composer.walk.Couplets;
import org.pragmatica.composer.walk.NextValues;
import org.pragmatica.composer.walk.RecursionRules;
import org.pragmatica.composer.walk.Walker;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for the passes a compiler driver runs over a parsed tree.
 *
 * <p>Each call collects its own diagnostics. Under {@link RecoveryPolicy#LENIENT} they are
 * returned next to the value; under {@link RecoveryPolicy#STRICT} any warning or error turns
 * the call into a {@link MalformedTreeException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * var composer = Composer.builder()
 *                        .recovery(RecoveryPolicy.STRICT)
 *                        .build();
 *
 * var table = composer.table(root).value();
 * }</pre>
 */
public final class Composer {
    private final ComposerConfig config;

    private Composer(ComposerConfig config) {
        this.config = config;
    }

    public static Composer create() {
        return create(ComposerConfig.DEFAULT);
    }

    public static Composer create(ComposerConfig config) {
        return new Composer(checkNotNull(config));
    }

    public ComposerConfig config() {
        return config;
    }

    /**
     * Convert a parsed tree into its symbol table.
     */
    public ResultWithDiagnostics<Table> table(Sequence root) throws MalformedTreeException {
        var diagnostics = newDiagnostics();
        var table = TableBuilder.build(root, diagnostics);
        return finish(table, diagnostics);
    }

    /**
     * Entries feeding the given composon or nest.
     */
    public ResultWithDiagnostics<Table> inputs(Entry composon) throws MalformedTreeException {
        var diagnostics = newDiagnostics();
        return finish(Compositions.inputs(composon, diagnostics), diagnostics);
    }

    /**
     * Entries the given composon or nest produces.
     */
    public ResultWithDiagnostics<Table> outputs(Entry composon) throws MalformedTreeException {
        var diagnostics = newDiagnostics();
        return finish(Compositions.outputs(composon, diagnostics), diagnostics);
    }

    /**
     * Couplets in scope of {@code binding}: those whose name matches the binding's base name,
     * reached only through the paths its qualifier names (and through nests).
     */
    public ResultWithDiagnostics<Sequence> targets(Sequence root, Node.Couplet binding) throws MalformedTreeException {
        var diagnostics = newDiagnostics();
        var found = Walker.scopedFilter(root,
                                        binding,
                                        RecursionRules.path(diagnostics),
                                        (node, couplet) -> !(node instanceof Node.QualifiedPath)
                                                           && Couplets.leftHandSideLength(couplet) == 1
                                                           && Couplets.sameLeftHandSide(node, couplet, diagnostics),
                                        NextValues.ifPath(diagnostics));
        return finish(found, diagnostics);
    }

    /**
     * Split every couplet with alternative left-hand sides into single-sided couplets.
     */
    public ResultWithDiagnostics<Sequence> split(Sequence couplets) throws MalformedTreeException {
        return ResultWithDiagnostics.success(Walker.mapSplit(couplets, Couplets::splitCouplet));
    }

    /**
     * Create a builder for composer configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    private Diagnostics newDiagnostics() {
        return Diagnostics.create(config.logDiagnostics());
    }

    private <T> ResultWithDiagnostics<T> finish(T value, Diagnostics diagnostics) throws MalformedTreeException {
        if (config.recovery() == RecoveryPolicy.STRICT && diagnostics.hasSignificant()) {
            var significant = diagnostics.reported()
                                         .stream()
                                         .filter(Diagnostic::isSignificant)
                                         .toList();
            throw new MalformedTreeException(new CompositionError.Escalated(significant));
        }
        return ResultWithDiagnostics.of(value, diagnostics);
    }

    public static final class Builder {
        private RecoveryPolicy recovery = RecoveryPolicy.LENIENT;
        private boolean logDiagnostics = true;

        private Builder() {}

        public Builder recovery(RecoveryPolicy recovery) {
            this.recovery = checkNotNull(recovery);
            return this;
        }

        public Builder logDiagnostics(boolean enabled) {
            this.logDiagnostics = enabled;
            return this;
        }

        public Composer build() {
            return create(new ComposerConfig(recovery, logDiagnostics));
        }
    }
}
