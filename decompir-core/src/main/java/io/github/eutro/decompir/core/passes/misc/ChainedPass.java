package io.github.eutro.decompir.core.passes.misc;

import io.github.eutro.decompir.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which runs one pass and gives its result to another.
 * <p>
 * If any pass of a chain fails, the exception is tagged with the position of that pass.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    /**
     * Flatten this chain into the passes it runs, in order.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> getPasses() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> chained = (ChainedPass<?, ?, ?>) pass;
            passes.add(chained.nextPass);
            pass = chained.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return passes;
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<?, ?>> passes = getPasses();
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            try {
                acc = ((IRPass<Object, Object>) passes.get(i)).run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " in chain"));
                throw e;
            }
        }
        return (C) acc;
    }
}
