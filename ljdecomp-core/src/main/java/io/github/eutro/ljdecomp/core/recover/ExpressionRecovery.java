package io.github.eutro.ljdecomp.core.recover;

import io.github.eutro.ljdecomp.core.passes.InPlaceIRPass;
import io.github.eutro.ljdecomp.core.tree.TreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Turns the register-level statements of a structured tree into Lua expressions and locals.
 * <p>
 * Method calls and multiple assignments are recognized on the raw registers. Temporaries are
 * then inlined and the expression idioms applied until neither changes anything. Finally
 * locals are declared and every register is replaced with its name.
 */
public class ExpressionRecovery implements InPlaceIRPass<StructuredFunction> {
    private static final Logger LOG = LoggerFactory.getLogger(ExpressionRecovery.class);
    public static final ExpressionRecovery INSTANCE = new ExpressionRecovery();

    private static final int MAX_ROUNDS = 32;

    @Override
    public void runInPlace(StructuredFunction fn) {
        SlotNames names = new SlotNames(fn.source);
        new MethodCalls(names).run(fn);
        new MultiAssignments(names).run(fn);

        TempInliner inliner = new TempInliner(names);
        List<SequenceRewrite> idioms = Arrays.asList(
                new OrAndIdiom(),
                new BooleanValueIdiom(),
                new WhileConditionIdiom(),
                new TableConstructorIdiom(),
                new IteratorTripleIdiom(names));
        int round = 0;
        boolean changed = true;
        while (changed && round++ < MAX_ROUNDS) {
            changed = inliner.run(fn);
            for (SequenceRewrite idiom : idioms) {
                changed |= idiom.run(fn);
            }
        }
        if (changed) LOG.debug("{}: expressions still changing after {} rounds", fn.source, MAX_ROUNDS);

        new LocalDeclarations(names).run(fn);
        new Materializer(names, fn).run();
        TreeValidator.validate(fn.root);
        LOG.debug("{}: recovered\n{}", fn.source, fn.root);
    }
}
