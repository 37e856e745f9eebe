package io.github.eutro.decompir.test;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.ext.CommonExts;
import io.github.eutro.decompir.core.ext.MetadataState;
import io.github.eutro.decompir.core.flow.InstrUseDef;
import io.github.eutro.decompir.core.flow.UseDef;
import io.github.eutro.decompir.core.passes.meta.ComputeUseDefs;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class UseDefTest {
    private static final HashSet<String> ARM_KILLS = new HashSet<>(Arrays.asList("R0", "R1", "R2", "R3"));

    @Test
    void testAssignRecordsSelfReference() {
        Trees t = new Trees();
        Expr rhs = t.plus(t.v("x"), t.c(1));
        UseDef ud = UseDef.empty().applyAssign(3, "x", rhs);
        assertTrue(ud.hasName("x"));
        assertEquals(3, ud.get("x").instrId);
        assertSame(rhs, ud.get("x").expr);
    }

    @Test
    void testAssignDropsDependents() {
        Trees t = new Trees();
        UseDef ud = UseDef.empty()
                .applyAssign(0, "x", t.c(5))
                .applyAssign(1, "y", t.plus(t.v("x"), t.c(1)))
                .applyAssign(2, "z", t.v("w"))
                .applyAssign(3, "x", t.c(7));
        assertEquals(new HashSet<>(Arrays.asList("x", "z")), ud.names());
        assertEquals(3, ud.get("x").instrId);
    }

    @Test
    void testCallClobber() {
        Trees t = new Trees();
        Map<String, UseDef.Def> defs = new LinkedHashMap<>();
        defs.put("R0", new UseDef.Def(5, t.c(1)));
        UseDef ud = UseDef.of(defs);
        assertEquals(UseDef.empty(), ud.applyCall(ARM_KILLS));
    }

    @Test
    void testCallDropsDefsReadingKilled() {
        Trees t = new Trees();
        UseDef ud = UseDef.empty()
                .applyAssign(0, "a", t.v("R1"))
                .applyAssign(1, "b", t.v("R5"))
                .applyCall(ARM_KILLS);
        assertFalse(ud.hasName("a"));
        assertTrue(ud.hasName("b"));
    }

    @Test
    void testJoin() {
        Trees t = new Trees();
        Expr five = t.c(5);
        UseDef left = UseDef.empty()
                .applyAssign(0, "x", five)
                .applyAssign(1, "y", t.c(1))
                .applyAssign(2, "z", t.c(2));
        UseDef right = UseDef.empty()
                .applyAssign(0, "x", five)
                .applyAssign(4, "y", t.c(1));
        UseDef joined = left.join(right);
        assertEquals(new HashSet<>(Arrays.asList("x")), joined.names());
        for (String name : joined.names()) {
            assertEquals(left.get(name).instrId, joined.get(name).instrId);
            assertEquals(right.get(name).instrId, joined.get(name).instrId);
        }
        assertTrue(UseDef.empty().join(left).isEmpty());
        assertTrue(left.join(UseDef.empty()).isEmpty());
    }

    @Test
    void testMissingLookups() {
        assertThrows(NoSuchElementException.class, () -> UseDef.empty().get("x"));
        assertThrows(NoSuchElementException.class, () -> new InstrUseDef().get(0));
    }

    @Test
    void testBranchJoinsExits() {
        Trees t = new Trees();
        Assign a0 = t.assign("a", t.c(1));
        Assign b0 = t.assign("b", t.c(2));
        Assign a1 = t.assign("a", t.c(3));
        Assign use = t.assign("r", t.plus(t.v("a"), t.v("b")));
        Branch branch = t.b.mkBranch(t.v("c"), t.seq(a1), t.seq());
        Block body = t.b.mkBlock(t.seq(a0, b0), branch, t.seq(use));
        Function f = t.function(body);

        InstrUseDef useDefs = f.getExtOrRun(CommonExts.INSTR_USE_DEFS, f, ComputeUseDefs.INSTANCE);
        UseDef atUse = useDefs.get(use.id);
        assertFalse(atUse.hasName("a"));
        assertEquals(b0.id, atUse.get("b").instrId);

        UseDef atCond = useDefs.get(branch.id);
        assertEquals(a0.id, atCond.get("a").instrId);
        assertTrue(useDefs.has(a1.id));
        assertTrue(useDefs.has(body.id));
    }

    @Test
    void testMemoryStoreKeepsDefs() {
        Trees t = new Trees();
        Assign x = t.assign("x", t.c(1));
        Assign store = t.b.mkAssign(t.b.mkMemRefLval(t.v("p")), t.c(2));
        Assign use = t.assign("y", t.v("x"));
        Function f = t.function(t.seq(x, store, use));
        InstrUseDef useDefs = f.getExtOrRun(CommonExts.INSTR_USE_DEFS, f, ComputeUseDefs.INSTANCE);
        assertEquals(x.id, useDefs.get(use.id).get("x").instrId);
    }

    @Test
    void testCallKillsResultAndAddressTaken() {
        Trees t = new Trees();
        Assign x = t.assign("x", t.c(1));
        Assign s = t.assign("s", t.c(2));
        Assign k = t.assign("k", t.c(3));
        Call call = t.b.mkCall(t.b.mkVariableLval("k"), t.v("foo"), t.b.mkAddressOf(t.b.mkVariableLval("s")));
        Assign use = t.assign("y", t.c(0));
        Function f = t.function(t.seq(x, s, k, call, use));
        InstrUseDef useDefs = f.getExtOrRun(CommonExts.INSTR_USE_DEFS, f, ComputeUseDefs.INSTANCE);
        UseDef after = useDefs.get(use.id);
        assertTrue(after.hasName("x"));
        assertFalse(after.hasName("s"));
        assertFalse(after.hasName("k"));
        assertTrue(f.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.ADDRESS_TAKEN));
    }

    @Test
    void testBodyChangeInvalidates() {
        Trees t = new Trees();
        Function f = t.function(t.seq(t.assign("x", t.c(1))));
        MetadataState ms = f.getExtOrThrow(CommonExts.METADATA_STATE);
        ComputeUseDefs.INSTANCE.run(f);
        assertTrue(ms.isValid(MetadataState.USE_DEFS));
        f.setBody(t.seq());
        assertFalse(ms.isValid(MetadataState.USE_DEFS));
        assertFalse(ms.isValid(MetadataState.ADDRESS_TAKEN));
    }

    @Test
    void testPartialAssignRecordsNothing() {
        Trees t = new Trees();
        UseDef ud = UseDef.empty()
                .applyAssign(0, "s", t.v("u"))
                .applyAssign(1, "x", t.v("s"))
                .applyAssign(2, "k", t.c(4))
                .applyPartialAssign("s");
        assertEquals(Collections.singleton("k"), ud.names());
    }

    @Test
    void testFieldWritesKillTheirVariable() {
        Trees t = new Trees();
        Assign whole = t.assign("s", t.v("u"));
        Assign r = t.assign("r", t.c(2));
        Assign part = t.b.mkAssign(t.field("s", "f"), t.c(1));
        Call result = t.b.mkCall(t.field("r", "g"), t.v("foo"));
        Assign element = t.b.mkAssign(t.element("a", t.v("i")), t.c(3));
        Assign use = t.assign("y", t.plus(t.v("s"), t.v("r")));
        Function f = t.function(t.seq(whole, r, part, result, element, use));
        InstrUseDef useDefs = f.getExtOrRun(CommonExts.INSTR_USE_DEFS, f, ComputeUseDefs.INSTANCE);

        assertEquals(new HashSet<>(Arrays.asList("s", "r")), useDefs.get(part.id).names());
        assertEquals(Collections.singleton("r"), useDefs.get(result.id).names());
        assertTrue(useDefs.get(element.id).isEmpty());
        assertTrue(useDefs.get(use.id).isEmpty());
    }
}
