package io.github.eutro.decompir.core.passes.meta;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.ext.CommonExts;
import io.github.eutro.decompir.core.ext.MetadataState;
import io.github.eutro.decompir.core.flow.InstrUseDef;
import io.github.eutro.decompir.core.flow.UseDef;
import io.github.eutro.decompir.core.passes.InPlaceIRPass;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes the {@link CommonExts#INSTR_USE_DEFS} of a function: the definitions reaching
 * each statement and instruction.
 * <p>
 * Definitions flow forward through blocks and sequences, fork at branches and are joined
 * after them. A call destroys the definitions of the convention's clobbered registers and of
 * every address-taken variable, as well as of the variable its result is written into.
 * <p>
 * Only whole variables are defined. Writing a field or element of a variable kills it without
 * defining it, and writes through memory are not tracked.
 */
public class ComputeUseDefs implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeUseDefs INSTANCE = new ComputeUseDefs();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.ADDRESS_TAKEN);

        Set<String> callKills = new LinkedHashSet<>(func.convention.getCallKillSet());
        callKills.addAll(func.getExtOrThrow(CommonExts.ADDRESS_TAKEN));
        func.attachExt(CommonExts.INSTR_USE_DEFS, compute(func.getBody(), callKills));
        ms.validate(MetadataState.USE_DEFS);
    }

    /**
     * Compute the reaching definitions of a tree.
     *
     * @param body      The tree.
     * @param callKills The names every call destroys.
     * @return The definitions on entry to each statement and instruction.
     */
    public static InstrUseDef compute(Stmt body, Set<String> callKills) {
        Walker walker = new Walker(callKills);
        walker.walk(body, UseDef.empty());
        return walker.result;
    }

    private static class Walker {
        final InstrUseDef result = new InstrUseDef();
        final Set<String> callKills;

        Walker(Set<String> callKills) {
            this.callKills = callKills;
        }

        UseDef walk(Stmt stmt, UseDef entry) {
            result.put(stmt.id, entry);
            return stmt.accept(new Stmt.Visitor<UseDef>() {
                @Override
                public UseDef visitReturn(Return stmt) {
                    return entry;
                }

                @Override
                public UseDef visitBlock(Block stmt) {
                    UseDef ud = entry;
                    for (Stmt child : stmt.stmts) {
                        ud = walk(child, ud);
                    }
                    return ud;
                }

                @Override
                public UseDef visitInstrSequence(InstrSequence stmt) {
                    UseDef ud = entry;
                    for (Instr instr : stmt.instrs) {
                        ud = walk(instr, ud);
                    }
                    return ud;
                }

                @Override
                public UseDef visitBranch(Branch stmt) {
                    UseDef thenExit = walk(stmt.thenStmt, entry);
                    UseDef elseExit = walk(stmt.elseStmt, entry);
                    return thenExit.join(elseExit);
                }
            });
        }

        UseDef walk(Instr instr, UseDef entry) {
            result.put(instr.id, entry);
            return instr.accept(new Instr.Visitor<UseDef>() {
                @Override
                public UseDef visitAssign(Assign instr) {
                    // stores through memory are not tracked
                    if (!instr.lhs.isVariable()) return entry;
                    if (instr.lhs.hasOffset()) return entry.applyPartialAssign(instr.lhs.getRootName());
                    return entry.applyAssign(instr.id, instr.define(), instr.rhs);
                }

                @Override
                public UseDef visitCall(Call instr) {
                    Set<String> killed = new LinkedHashSet<>(callKills);
                    if (!instr.isResultIgnored() && instr.lhs.isVariable()) killed.add(instr.lhs.getRootName());
                    return entry.applyCall(killed);
                }
            });
        }
    }
}
