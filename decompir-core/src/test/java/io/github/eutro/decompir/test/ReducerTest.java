package io.github.eutro.decompir.test;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.conf.ReductionConfig;
import io.github.eutro.decompir.core.flow.LiveVars;
import io.github.eutro.decompir.core.passes.Passes;
import io.github.eutro.decompir.core.passes.meta.ComputeLiveness;
import io.github.eutro.decompir.core.passes.opts.ReduceTree;
import io.github.eutro.decompir.core.passes.opts.TreeReducer;
import io.github.eutro.decompir.core.util.TreeWalker;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ReducerTest {
    private static final ReductionConfig NOTHING = ReductionConfig.builder().build();

    private static LiveVars liveAfter(Instr instr, String... names) {
        LiveVars live = new LiveVars();
        live.put(instr.id, new LinkedHashSet<>(Arrays.asList(names)));
        return live;
    }

    @Test
    void testFoldsSubstitutedConstant() {
        Trees t = new Trees();
        Stmt body = t.b.mkBlock(
                t.seq(t.assign("x", t.c(5)), t.assign("y", t.plus(t.v("x"), t.c(1)))),
                t.b.mkReturn(t.v("y")));
        Function f = t.function(body);
        Passes.DEFAULT.run(f);
        assertEquals("y = 6;\nreturn y;", f.getBody().toCLike());
        TreeWalker.index(f.getBody());
    }

    @Test
    void testSelfAssignmentIsDropped() {
        Trees t = new Trees();
        Assign self = t.assign("x", t.v("x"));
        InstrSequence seq = t.seq(self);

        InstrSequence none = (InstrSequence) new TreeReducer(NOTHING).reduce(seq);
        assertTrue(none.instrs.isEmpty());

        ReductionConfig live = ReductionConfig.builder().liveness(liveAfter(self, "x")).build();
        InstrSequence withLive = (InstrSequence) new TreeReducer(live).reduce(seq);
        assertTrue(withLive.instrs.isEmpty());
        assertEquals(seq.id, withLive.id);
    }

    @Test
    void testMemoryWriteIsKept() {
        Trees t = new Trees();
        Assign store = t.b.mkAssign(t.b.mkMemRefLval(t.v("p")), t.c(3));
        ReductionConfig config = ReductionConfig.builder().liveness(liveAfter(store)).build();
        InstrSequence reduced = (InstrSequence) new TreeReducer(config).reduce(t.seq(store));
        assertEquals(1, reduced.instrs.size());
        assertEquals("*(p) = 3;", reduced.toCLike());
    }

    @Test
    void testPlusFoldWraps() {
        Trees t = new Trees();
        BinaryOp sum = t.plus(t.c(Long.MAX_VALUE), t.c(1));
        Expr folded = new TreeReducer(NOTHING).reduce(sum);
        assertEquals(Long.MIN_VALUE, folded.getIntegerValue());
        assertEquals(sum.id, folded.id);
    }

    @Test
    void testFoldTakesRemappedId() {
        Trees t = new Trees();
        BinaryOp sum = t.plus(t.c(2), t.c(3));
        Map<Integer, Integer> remap = new HashMap<>();
        remap.put(sum.id, 77);
        Expr folded = new TreeReducer(ReductionConfig.builder().remap(remap).build()).reduce(sum);
        assertEquals(77, folded.id);
        assertEquals(5, folded.getIntegerValue());
    }

    @Test
    void testMinusDoesNotFold() {
        Trees t = new Trees();
        BinaryOp diff = t.minus(t.c(7), t.c(2));
        Expr reduced = new TreeReducer(NOTHING).reduce(diff);
        assertTrue(reduced instanceof BinaryOp);
        assertEquals(diff.id, reduced.id);
        assertEquals("7 - 2", reduced.toCLike());
    }

    @Test
    void testMacroKeepsId() {
        Trees t = new Trees();
        IntegerConstant flag = t.c(0x241);
        Expr reduced = new TreeReducer(ReductionConfig.builder()
                .macros(Collections.singletonMap(0x241L, "O_CREAT"))
                .build()).reduce(flag);
        assertEquals(flag.id, reduced.id);
        assertEquals("O_CREAT", reduced.toCLike());
        assertEquals(0x241, reduced.getIntegerValue());
    }

    @Test
    void testNoLivenessKeepsAssignments() {
        Trees t = new Trees();
        InstrSequence seq = t.seq(t.assign("a", t.c(1)), t.assign("b", t.c(2)));
        InstrSequence reduced = (InstrSequence) new TreeReducer(NOTHING).reduce(seq);
        assertEquals(2, reduced.instrs.size());
    }

    @Test
    void testDeadAssignments() {
        Trees t = new Trees();
        Assign dead = t.assign("a", t.c(1));
        Assign temp = t.assign("rtn_3", t.c(2));
        VarInfo named = t.symbols.getOrCreateSymbol("R5", null, "total", null, null);
        Assign altname = t.b.mkAssign(t.b.mkVariableLval(named), t.c(3));
        VarInfo global = t.symbols.getOrCreateSymbol("gv_1000", null, null, null, 0x1000L);
        Assign toGlobal = t.b.mkAssign(t.b.mkVariableLval(global), t.c(4));
        Assign live = t.assign("b", t.c(5));

        LiveVars liveness = new LiveVars();
        for (Instr instr : new Instr[]{dead, temp, altname, toGlobal}) {
            liveness.put(instr.id, Collections.emptySet());
        }
        liveness.put(live.id, Collections.singleton("b"));

        InstrSequence reduced = (InstrSequence) new TreeReducer(ReductionConfig.builder()
                .liveness(liveness)
                .build()).reduce(t.seq(dead, temp, altname, toGlobal, live));
        assertEquals(4, reduced.instrs.size());
        for (Instr instr : reduced.instrs) assertNotEquals(dead.id, instr.id);

        for (Instr instr : new Instr[]{dead, temp, altname, toGlobal, live}) {
            boolean kept = false;
            for (Instr r : reduced.instrs) kept |= r.id == instr.id;
            assertEquals(instr.isLive(Optional.of(liveness)), kept, instr.toString());
        }
    }

    @Test
    void testCallsAreKept() {
        Trees t = new Trees();
        Call call = t.call(null, "free", t.v("p"));
        LiveVars liveness = liveAfter(call);
        InstrSequence reduced = (InstrSequence) new TreeReducer(ReductionConfig.builder()
                .liveness(liveness)
                .build()).reduce(t.seq(call));
        assertEquals("free(p);", reduced.toCLike());
    }

    @Test
    void testRepeatedUseIsCopied() {
        Trees t = new Trees();
        Stmt body = t.b.mkBlock(
                t.seq(t.assign("x", t.minus(t.v("a"), t.c(1))),
                        t.assign("y", t.plus(t.v("x"), t.v("x")))),
                t.b.mkReturn(t.v("y")));
        Function f = t.function(body);
        Passes.DEFAULT.run(f);
        assertEquals("y = (a - 1) + (a - 1);\nreturn y;", f.getBody().toCLike());
        TreeWalker.index(f.getBody());
        Assign y = (Assign) ((InstrSequence) ((Block) f.getBody()).stmts.get(0)).instrs.get(0);
        BinaryOp sum = (BinaryOp) y.rhs;
        assertNotSame(((SubstitutedExpr) sum.left).substituted, ((SubstitutedExpr) sum.right).substituted);
    }

    @Test
    void testCopiesDoNotOutliveClobber() {
        Trees t = new Trees();
        Stmt body = t.b.mkBlock(
                t.seq(t.assign("x", t.plus(t.v("R0"), t.c(4))),
                        t.assign("y", t.b.mkBinaryOp("mult", t.v("x"), t.v("x"))),
                        t.call(null, "foo"),
                        t.assign("z", t.v("y"))),
                t.b.mkReturn(t.v("z")));
        Function f = t.function(body);
        Passes.DEFAULT.run(f);
        // x is not clobbered by the call, but the R0 it was computed from is
        assertEquals("x = R0 + 4;\nfoo();\nz = x * x;\nreturn z;", f.getBody().toCLike());
    }

    private static Function liveThenReduce(Function f) {
        ComputeLiveness.INSTANCE.then(ReduceTree.INSTANCE).run(f);
        return f;
    }

    @Test
    void testPartialWriteIsKeptWhileVariableIsLive() {
        Trees t = new Trees();
        Function f = t.function(t.b.mkBlock(
                t.seq(t.b.mkAssign(t.field("s", "f"), t.c(3)),
                        t.b.mkAssign(t.element("a", t.c(1)), t.c(4))),
                t.b.mkReturn(t.plus(t.v("s"), t.v("a")))));
        assertEquals("s.f = 3;\na[1] = 4;\nreturn s + a;", liveThenReduce(f).getBody().toCLike());

        Trees u = new Trees();
        Assign dead = u.b.mkAssign(u.field("s", "f"), u.c(3));
        assertTrue(dead.isLive(Optional.of(liveAfter(dead, "s"))));
        assertFalse(dead.isLive(Optional.of(liveAfter(dead, "s.f"))));
        Function g = u.function(u.b.mkBlock(u.seq(dead), u.b.mkReturn(u.c(0))));
        assertEquals("return 0;", liveThenReduce(g).getBody().toCLike());
    }

    @Test
    void testValueBeforeCallResultIsKept() {
        Trees t = new Trees();
        Function f = t.function(t.b.mkBlock(
                t.seq(t.assign("r", t.c(5)), t.call("r", "foo")),
                t.b.mkReturn(t.v("r"))));
        assertEquals("r = 5;\nr = foo();\nreturn r;", liveThenReduce(f).getBody().toCLike());
    }
}
