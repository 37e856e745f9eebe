package io.github.eutro.decompir.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A straight-line sequence of instructions. This is the leaf statement of the tree.
 */
public final class InstrSequence extends Stmt {
    /**
     * The instructions, in execution order.
     */
    public final List<Instr> instrs;

    public InstrSequence(int id, List<? extends Instr> instrs) {
        super(id);
        this.instrs = Collections.unmodifiableList(new ArrayList<>(instrs));
    }

    @Override
    public String getTag() {
        return "instrs";
    }

    @Override
    public List<? extends Node> children() {
        return instrs;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitInstrSequence(this);
    }

    @Override
    public boolean isEmpty() {
        return instrs.isEmpty();
    }

    @Override
    public Set<String> addressTaken() {
        Set<String> result = new LinkedHashSet<>();
        for (Instr instr : instrs) result.addAll(instr.addressTaken());
        return result;
    }

    @Override
    public Set<String> variablesUsed() {
        Set<String> result = new LinkedHashSet<>();
        for (Instr instr : instrs) result.addAll(instr.variablesUsed());
        return result;
    }

    @Override
    public Set<String> callees() {
        Set<String> result = new LinkedHashSet<>();
        for (Instr instr : instrs) result.addAll(instr.callees());
        return result;
    }

    @Override
    public String toCLike(int indent) {
        StringBuilder sb = new StringBuilder();
        for (Instr instr : instrs) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(instr.toCLike(indent));
        }
        return sb.toString();
    }
}
