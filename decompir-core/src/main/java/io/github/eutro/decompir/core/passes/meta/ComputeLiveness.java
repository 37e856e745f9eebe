package io.github.eutro.decompir.core.passes.meta;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.ext.CommonExts;
import io.github.eutro.decompir.core.ext.MetadataState;
import io.github.eutro.decompir.core.flow.LiveVars;
import io.github.eutro.decompir.core.passes.InPlaceIRPass;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;

/**
 * Computes the {@link CommonExts#LIVE_VARS} of a function: the names live on exit from
 * each statement and instruction.
 * <p>
 * The body is structured and loop free, so a single backward walk suffices.
 * <p>
 * Live sets hold whole variable names. Only an assignment to a whole local variable kills it;
 * a call kills the clobbered registers but not its own result.
 */
public class ComputeLiveness implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeLiveness INSTANCE = new ComputeLiveness();

    @Override
    public void runInPlace(Function func) {
        func.attachExt(CommonExts.LIVE_VARS, compute(func.getBody(), func.convention.getCallKillSet()));
        func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.LIVENESS);
    }

    /**
     * Compute the liveness of a tree, where nothing is live on exit from the tree.
     *
     * @param body      The tree.
     * @param callKills The names every call destroys.
     * @return The names live on exit from each statement and instruction.
     */
    public static LiveVars compute(Stmt body, Set<String> callKills) {
        Walker walker = new Walker(callKills);
        walker.walk(body, new LinkedHashSet<>());
        return walker.result;
    }

    private static class Walker {
        final LiveVars result = new LiveVars();
        final Set<String> callKills;

        Walker(Set<String> callKills) {
            this.callKills = callKills;
        }

        Set<String> walk(Stmt stmt, Set<String> exit) {
            result.put(stmt.id, exit);
            return stmt.accept(new Stmt.Visitor<Set<String>>() {
                @Override
                public Set<String> visitReturn(Return stmt) {
                    return stmt.hasReturnValue() ? stmt.getExpr().use() : new LinkedHashSet<>();
                }

                @Override
                public Set<String> visitBlock(Block stmt) {
                    Set<String> live = exit;
                    for (ListIterator<Stmt> it = stmt.stmts.listIterator(stmt.stmts.size()); it.hasPrevious(); ) {
                        live = walk(it.previous(), live);
                    }
                    return live;
                }

                @Override
                public Set<String> visitInstrSequence(InstrSequence stmt) {
                    Set<String> live = exit;
                    List<Instr> instrs = stmt.instrs;
                    for (ListIterator<Instr> it = instrs.listIterator(instrs.size()); it.hasPrevious(); ) {
                        live = walk(it.previous(), live);
                    }
                    return live;
                }

                @Override
                public Set<String> visitBranch(Branch stmt) {
                    Set<String> entry = new LinkedHashSet<>(walk(stmt.thenStmt, exit));
                    entry.addAll(walk(stmt.elseStmt, exit));
                    entry.addAll(stmt.cond.use());
                    return entry;
                }
            });
        }

        Set<String> walk(Instr instr, Set<String> exit) {
            result.put(instr.id, exit);
            return instr.accept(new Instr.Visitor<Set<String>>() {
                @Override
                public Set<String> visitAssign(Assign instr) {
                    Set<String> entry = new LinkedHashSet<>(exit);
                    if (instr.lhs.isVariable()) {
                        String root = instr.lhs.getRootName();
                        // a global may be read after the function returns
                        if (instr.lhs.isGlobal()) entry.add(root);
                        // the rest of a partly written variable keeps its old value
                        else if (!instr.lhs.hasOffset()) entry.remove(root);
                    }
                    entry.addAll(instr.rhs.use());
                    entry.addAll(instr.lhs.addressUse());
                    return entry;
                }

                @Override
                public Set<String> visitCall(Call instr) {
                    Set<String> entry = new LinkedHashSet<>(exit);
                    entry.removeAll(callKills);
                    if (instr.lhs.isGlobal()) entry.add(instr.lhs.getRootName());
                    entry.addAll(instr.use());
                    entry.addAll(instr.lhs.addressUse());
                    return entry;
                }
            });
        }
    }
}
