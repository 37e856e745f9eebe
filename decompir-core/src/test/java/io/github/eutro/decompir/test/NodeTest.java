package io.github.eutro.decompir.test;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.ast.display.StructureDisplay;
import io.github.eutro.decompir.core.util.TreeWalker;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class NodeTest {
    @Test
    void testRendering() {
        Trees t = new Trees();
        assertEquals("100000", t.c(100000).toCLike());
        assertEquals("0x186a1", t.c(100001).toCLike());
        assertEquals("100001", t.c(100001).toString());
        assertEquals("-(a + 1)", t.b.mkUnaryOp("neg", t.plus(t.v("a"), t.c(1))).toCLike());
        assertEquals("(int)x", t.b.mkCastExpr("int", t.v("x")).toCLike());
        assertEquals("*(p + 4)", t.b.mkLvalExpr(t.b.mkMemRefLval(t.plus(t.v("p"), t.c(4)))).toCLike());

        Lval field = t.b.mkLval(t.b.mkVariable("s"),
                t.b.mkFieldOffset("f", null, t.b.mkIndexOffset(t.c(2), t.b.mkNoOffset())));
        assertEquals("s.f[2]", field.toCLike());

        Call call = t.call(null, "puts", t.b.mkStringConstant(null, "hi", "0x8000"));
        assertTrue(call.isResultIgnored());
        assertFalse(call.toCLike().contains("="));
    }

    @Test
    void testBranchRendering() {
        Trees t = new Trees();
        Branch br = t.b.mkBranch(t.v("c"), t.seq(t.assign("x", t.c(1))), t.seq());
        assertEquals("if (c){\n   x = 1;\n}", br.toCLike());
        Branch both = t.b.mkBranch(t.v("c"), t.seq(t.assign("x", t.c(1))), t.seq(t.assign("x", t.c(2))));
        assertEquals("if (c){\n   x = 1;\n} else {\n   x = 2;\n}", both.toCLike());
    }

    @Test
    void testFunctionRendering() {
        Trees t = new Trees();
        Function f = t.function(t.b.mkBlock(t.seq(t.assign("x", t.c(1))), t.b.mkReturn(t.v("x"))));
        assertEquals("f(){\n   x = 1;\n   return x;\n}", f.toCLike());
    }

    @Test
    void testEmptiness() {
        Trees t = new Trees();
        assertTrue(t.seq().isEmpty());
        assertTrue(t.b.mkBlock(t.seq(), t.b.mkBlock()).isEmpty());
        assertTrue(t.b.mkBranch(t.v("c"), t.seq(), t.seq()).isEmpty());
        assertFalse(t.b.mkReturn().isEmpty());
        assertEquals("", t.b.mkBlock(t.seq(), t.seq()).toCLike());
    }

    @Test
    void testAccessorsOnWrongShape() {
        Trees t = new Trees();
        Return bare = t.b.mkReturn();
        assertFalse(bare.hasReturnValue());
        assertEquals("return;", bare.toCLike());
        assertThrows(IllegalStateException.class, bare::getExpr);
        assertThrows(IllegalStateException.class, () -> t.v("x").getIntegerValue());
        assertEquals(9, t.c(9).getIntegerValue());
        assertThrows(IllegalArgumentException.class, () -> t.b.mkBinaryOp("frobnicate", t.c(1), t.c(2)));
        assertThrows(IllegalArgumentException.class, () -> t.b.mkUnaryOp("plus", t.c(1)));
    }

    @Test
    void testUseSets() {
        Trees t = new Trees();
        assertEquals(Collections.emptySet(), t.v("PC").use());
        assertEquals(Collections.singleton("PC"), t.v("PC").variablesUsed());

        AddressOf addr = t.b.mkAddressOf(t.b.mkVariableLval("buf"));
        assertTrue(addr.use().isEmpty());
        assertEquals(Collections.singleton("buf"), addr.addressTaken());

        Assign store = t.b.mkAssign(t.b.mkMemRefLval(t.v("p")), t.v("q"));
        assertEquals(Collections.singleton("q"), store.use());
        assertEquals(Collections.singleton("p"), store.lhs.addressUse());
    }

    @Test
    void testStructureDisplay() {
        Trees t = new Trees();
        Assign assign = t.assign("x", t.c(1));
        String[] lines = StructureDisplay.show(t.seq(assign)).split("\n");
        assertTrue(lines[0].endsWith(":instrs"));
        assertEquals("  " + assign.id + ":assign", lines[1]);
        assertTrue(lines[2].startsWith("    ") && lines[2].endsWith(":lval"));
        assertTrue(lines[3].startsWith("      ") && lines[3].endsWith(":var"));
        assertTrue(lines[4].startsWith("      ") && lines[4].endsWith(":no-offset"));
        assertTrue(lines[5].startsWith("    ") && lines[5].endsWith(":integer-constant"));
        assertEquals(6, lines.length);

        // the ignored result is a placeholder
        Call call = t.call(null, "abort");
        String[] callLines = StructureDisplay.show(call).split("\n");
        assertTrue(callLines[1].endsWith(":lval-expr"));
        assertEquals(5, callLines.length);
    }

    @Test
    void testIndexRejectsSharedIds() {
        Trees t = new Trees();
        IntegerConstant shared = t.c(1);
        TreeWalker.index(t.plus(shared, shared));
        assertEquals(2, TreeWalker.nodes(t.plus(shared, shared)).size());

        IntegerConstant clash = new IntegerConstant(shared.id, 2, null);
        assertThrows(IllegalStateException.class, () -> TreeWalker.index(t.plus(shared, clash)));
    }
}
