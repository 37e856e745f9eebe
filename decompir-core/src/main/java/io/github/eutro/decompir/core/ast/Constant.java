package io.github.eutro.decompir.core.ast;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A constant, which reads no variables.
 */
public abstract class Constant extends Expr {
    Constant(int id) {
        super(id);
    }

    @Override
    public Set<String> use() {
        return new LinkedHashSet<>();
    }

    @Override
    public Set<String> addressTaken() {
        return new LinkedHashSet<>();
    }
}
