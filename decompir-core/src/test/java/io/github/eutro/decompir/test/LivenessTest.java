package io.github.eutro.decompir.test;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.build.AstBuilder;
import io.github.eutro.decompir.core.ext.CommonExts;
import io.github.eutro.decompir.core.flow.LiveVars;
import io.github.eutro.decompir.core.passes.meta.ComputeLiveness;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LivenessTest {
    private static Set<String> set(String... names) {
        return new HashSet<>(Arrays.asList(names));
    }

    private static LiveVars liveness(Function f) {
        return f.getExtOrRun(CommonExts.LIVE_VARS, f, ComputeLiveness.INSTANCE);
    }

    @Test
    void testStraightLine() {
        Trees t = new Trees();
        Assign x = t.assign("x", t.c(5));
        Assign y = t.assign("y", t.plus(t.v("x"), t.c(1)));
        Return ret = t.b.mkReturn(t.v("y"));
        Function f = t.function(t.b.mkBlock(t.seq(x, y), ret));
        LiveVars live = liveness(f);
        assertEquals(set("x"), live.get(x.id));
        assertEquals(set("y"), live.get(y.id));
        assertEquals(Collections.emptySet(), live.get(ret.id));
    }

    @Test
    void testBranch() {
        Trees t = new Trees();
        Assign a = t.assign("a", t.c(1));
        Assign b = t.assign("b", t.c(2));
        Assign useA = t.assign("r", t.v("a"));
        Assign useB = t.assign("r", t.v("b"));
        Branch branch = t.b.mkBranch(t.v("c"), t.seq(useA), t.seq(useB));
        Return ret = t.b.mkReturn(t.v("r"));
        InstrSequence pre = t.seq(a, b);
        Function f = t.function(t.b.mkBlock(pre, branch, ret));
        LiveVars live = liveness(f);
        assertEquals(set("a", "b", "c"), live.get(b.id));
        assertEquals(set("a", "c"), live.get(a.id));
        assertEquals(set("r"), live.get(branch.id));
        assertEquals(set("r"), live.get(useA.id));
    }

    @Test
    void testCallKills() {
        Trees t = new Trees();
        Assign r0 = t.assign("R0", t.c(1));
        Assign r4 = t.assign("R4", t.c(2));
        Call call = t.call(null, "foo", t.v("a"));
        Return ret = t.b.mkReturn(t.plus(t.v("R0"), t.v("R4")));
        Function f = t.function(t.b.mkBlock(t.seq(r0, r4, call), ret));
        LiveVars live = liveness(f);
        assertEquals(set("R0", "R4"), live.get(call.id));
        assertEquals(set("R4", "a", "foo"), live.get(r4.id));
        assertEquals(set("a", "foo"), live.get(r0.id));
    }

    @Test
    void testGlobalStaysLive() {
        Trees t = new Trees();
        AstBuilder b = t.b;
        VarInfo global = t.symbols.getOrCreateSymbol("gv_2a010", null, null, null, 0x2a010L);
        Assign first = b.mkAssign(b.mkVariableLval(global), t.c(1));
        Assign second = b.mkAssign(b.mkVariableLval(global), t.c(2));
        Function f = t.function(t.seq(first, second));
        LiveVars live = liveness(f);
        assertEquals(set("gv_2a010"), live.get(first.id));
    }

    @Test
    void testStoreAddressIsUsed() {
        Trees t = new Trees();
        Assign p = t.assign("p", t.c(0x1000));
        Assign store = t.b.mkAssign(t.b.mkMemRefLval(t.v("p")), t.c(3));
        Function f = t.function(t.seq(p, store));
        LiveVars live = liveness(f);
        assertEquals(set("p"), live.get(p.id));
    }

    @Test
    void testMissing() {
        assertThrows(NoSuchElementException.class, () -> new LiveVars().get(7));
    }

    @Test
    void testCallResultIsNotKilled() {
        Trees t = new Trees();
        Assign first = t.assign("r", t.c(5));
        Call call = t.call("r", "foo");
        Return ret = t.b.mkReturn(t.v("r"));
        Function f = t.function(t.b.mkBlock(t.seq(first, call), ret));
        LiveVars live = liveness(f);
        assertEquals(set("r"), live.get(call.id));
        assertEquals(set("r", "foo"), live.get(first.id));
    }

    @Test
    void testPartialWritesDoNotKill() {
        Trees t = new Trees();
        Assign whole = t.assign("s", t.v("u"));
        Assign field = t.b.mkAssign(t.field("s", "f"), t.c(3));
        Assign element = t.b.mkAssign(t.element("a", t.v("i")), t.c(4));
        Return ret = t.b.mkReturn(t.plus(t.v("s"), t.v("a")));
        Function f = t.function(t.b.mkBlock(t.seq(whole, field, element), ret));
        LiveVars live = liveness(f);
        assertEquals(set("s", "a"), live.get(element.id));
        assertEquals(set("s", "a", "i"), live.get(field.id));
        assertEquals(set("s", "a", "i"), live.get(whole.id));
    }
}
