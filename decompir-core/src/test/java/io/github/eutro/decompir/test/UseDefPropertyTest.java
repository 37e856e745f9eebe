package io.github.eutro.decompir.test;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.flow.InstrUseDef;
import io.github.eutro.decompir.core.flow.UseDef;
import io.github.eutro.decompir.core.passes.meta.ComputeUseDefs;
import io.github.eutro.decompir.core.passes.opts.SubstituteExprs;
import io.github.eutro.decompir.core.util.TreeWalker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the reaching definitions of random straight-line and branching trees
 * against a walk over every path.
 */
public class UseDefPropertyTest {
    private static final String[] NAMES = {"a", "b", "c", "d", "R0", "R1"};
    private static final Set<String> KILLS = new HashSet<>(Arrays.asList("R0", "R1", "R2", "R3"));

    private static final class RandomTree {
        final Trees t = new Trees();
        final Random random;
        final List<Instr> pre = new ArrayList<>();
        final List<Instr> thenArm = new ArrayList<>();
        final List<Instr> elseArm = new ArrayList<>();
        final List<Instr> post = new ArrayList<>();
        final Stmt body;

        RandomTree(long seed) {
            random = new Random(seed);
            fill(pre);
            fill(thenArm);
            fill(elseArm);
            fill(post);
            body = t.b.mkBlock(
                    t.b.mkInstrSequence(pre),
                    t.b.mkBranch(t.v(name()), t.b.mkInstrSequence(thenArm), t.b.mkInstrSequence(elseArm)),
                    t.b.mkInstrSequence(post),
                    t.b.mkReturn(t.v(name())));
        }

        String name() {
            return NAMES[random.nextInt(NAMES.length)];
        }

        Lval element() {
            return random.nextBoolean() ? t.element(name(), t.v(name())) : t.field(name(), "f");
        }

        Expr expr() {
            switch (random.nextInt(4)) {
                case 0:
                    return t.c(random.nextInt(10));
                case 1:
                    return t.v(name());
                case 2:
                    return t.read(element());
                default:
                    return t.plus(t.v(name()), random.nextBoolean() ? t.v(name()) : t.c(1));
            }
        }

        void fill(List<Instr> instrs) {
            int n = random.nextInt(5);
            for (int i = 0; i < n; i++) {
                int kind = random.nextInt(5);
                if (kind == 0) {
                    instrs.add(t.call(random.nextBoolean() ? null : name(), "callee", expr()));
                } else if (kind == 1) {
                    instrs.add(t.b.mkAssign(element(), expr()));
                } else {
                    instrs.add(t.assign(name(), expr()));
                }
            }
        }

        List<List<Instr>> paths() {
            List<Instr> viaThen = new ArrayList<>(pre);
            viaThen.addAll(thenArm);
            viaThen.addAll(post);
            List<Instr> viaElse = new ArrayList<>(pre);
            viaElse.addAll(elseArm);
            viaElse.addAll(post);
            return Arrays.asList(viaThen, viaElse);
        }
    }

    // whole or partial writes of the variable
    private static boolean writes(Instr instr, String name) {
        if (instr instanceof Call) {
            Call call = (Call) instr;
            if (KILLS.contains(name)) return true;
            if (call.isResultIgnored()) return false;
        }
        return instr.lhs.getRootName().equals(name);
    }

    private static void checkAt(Instr consumer, List<Instr> path, UseDef useDef) {
        int at = path.indexOf(consumer);
        for (Map.Entry<String, UseDef.Def> entry : useDef.asMap().entrySet()) {
            String name = entry.getKey();
            Instr last = null;
            for (int i = 0; i < at; i++) {
                if (writes(path.get(i), name)) last = path.get(i);
            }
            assertNotNull(last, name + " has no definition before " + consumer);
            assertTrue(last instanceof Assign, name + " is clobbered before " + consumer);
            assertFalse(last.lhs.hasOffset(), name + " is only partly written by " + last);
            assertEquals(entry.getValue().instrId, last.id);
            assertSame(((Assign) last).rhs, entry.getValue().expr);
            // every name the definition reads is unchanged since
            for (String read : entry.getValue().expr.use()) {
                for (int i = path.indexOf(last) + 1; i < at; i++) {
                    assertFalse(writes(path.get(i), read), read + " changes under " + name + " before " + consumer);
                }
            }
        }
    }

    @Test
    void testReachingDefinitionsHoldOnEveryPath() {
        for (long seed = 0; seed < 200; seed++) {
            RandomTree tree = new RandomTree(seed);
            InstrUseDef useDefs = ComputeUseDefs.compute(tree.body, KILLS);
            for (List<Instr> path : tree.paths()) {
                for (Instr instr : path) {
                    checkAt(instr, path, useDefs.get(instr.id));
                }
            }
        }
    }

    @Test
    void testSubstitutionKeepsIdsUnique() {
        for (long seed = 0; seed < 200; seed++) {
            RandomTree tree = new RandomTree(seed);
            Function f = tree.t.function(tree.body);
            SubstituteExprs.INSTANCE.run(f);
            SubstituteExprs.INSTANCE.run(f);
            TreeWalker.index(f.getBody());
            TreeWalker.preorder(f.getBody(), node -> {
                if (node instanceof SubstitutedExpr) {
                    SubstitutedExpr sub = (SubstitutedExpr) node;
                    assertFalse(sub.substituted.use().contains(sub.lval.toString()));
                }
            });
        }
    }
}
