package io.github.eutro.decompir.test;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.build.AstBuilder;
import io.github.eutro.decompir.core.build.IdAllocator;
import io.github.eutro.decompir.core.build.SymbolTable;
import io.github.eutro.decompir.core.conf.CallingConvention;
import io.github.eutro.decompir.core.types.TypeLattice;

/**
 * Shorthands for building small function trees in tests.
 */
public class Trees {
    public final IdAllocator ids = new IdAllocator();
    public final SymbolTable symbols = new SymbolTable(TypeLattice.FLAT, ids);
    public final AstBuilder b = new AstBuilder(ids, symbols);

    public LvalExpr v(String name) {
        return b.mkVariableExpr(name);
    }

    public IntegerConstant c(long value) {
        return b.mkIntegerConstant(value);
    }

    public BinaryOp plus(Expr left, Expr right) {
        return b.mkBinaryOp(Operators.PLUS, left, right);
    }

    public BinaryOp minus(Expr left, Expr right) {
        return b.mkBinaryOp(Operators.MINUS, left, right);
    }

    public Assign assign(String name, Expr rhs) {
        return b.mkAssign(b.mkVariableLval(name), rhs);
    }

    public Lval field(String struct, String fieldName) {
        return b.mkLval(b.mkVariable(struct), b.mkFieldOffset(fieldName, null, b.mkNoOffset()));
    }

    public Lval element(String array, Expr index) {
        return b.mkLval(b.mkVariable(array), b.mkIndexOffset(index, b.mkNoOffset()));
    }

    public LvalExpr read(Lval lval) {
        return b.mkLvalExpr(lval);
    }

    public Call call(String result, String target, Expr... args) {
        Lval lhs = result == null ? b.mkIgnoredLval() : b.mkVariableLval(result);
        return b.mkCall(lhs, v(target), args);
    }

    public InstrSequence seq(Instr... instrs) {
        return b.mkInstrSequence(instrs);
    }

    public Function function(Stmt body) {
        return new Function("f", CallingConvention.ARM, ids, symbols, body);
    }
}
