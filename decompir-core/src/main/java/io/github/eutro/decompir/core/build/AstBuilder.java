package io.github.eutro.decompir.core.build;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.types.CType;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Builds tree nodes, giving each a fresh id from the function's {@link IdAllocator}
 * and resolving variables through its {@link SymbolTable}.
 */
public final class AstBuilder {
    public final IdAllocator ids;
    public final SymbolTable symbols;

    public AstBuilder(IdAllocator ids, SymbolTable symbols) {
        this.ids = ids;
        this.symbols = symbols;
    }

    // statements

    public Return mkReturn(@Nullable Expr expr) {
        return new Return(ids.newId(), expr);
    }

    public Return mkReturn() {
        return mkReturn(null);
    }

    public Block mkBlock(List<? extends Stmt> stmts) {
        return new Block(ids.newId(), stmts);
    }

    public Block mkBlock(Stmt... stmts) {
        return mkBlock(Arrays.asList(stmts));
    }

    public InstrSequence mkInstrSequence(List<? extends Instr> instrs) {
        return new InstrSequence(ids.newId(), instrs);
    }

    public InstrSequence mkInstrSequence(Instr... instrs) {
        return mkInstrSequence(Arrays.asList(instrs));
    }

    public Branch mkBranch(Expr cond, Stmt thenStmt, Stmt elseStmt, int relativeOffset) {
        return new Branch(ids.newId(), cond, thenStmt, elseStmt, relativeOffset);
    }

    public Branch mkBranch(Expr cond, Stmt thenStmt, Stmt elseStmt) {
        return mkBranch(cond, thenStmt, elseStmt, 0);
    }

    // instructions

    public Assign mkAssign(Lval lhs, Expr rhs) {
        return new Assign(ids.newId(), lhs, rhs);
    }

    public Call mkCall(Lval lhs, Expr target, List<? extends Expr> args) {
        return new Call(ids.newId(), lhs, target, args);
    }

    public Call mkCall(Lval lhs, Expr target, Expr... args) {
        return mkCall(lhs, target, Arrays.asList(args));
    }

    // lvalues

    public Lval mkLval(LHost host, Offset offset) {
        return new Lval(ids.newId(), host, offset);
    }

    public Lval mkIgnoredLval() {
        return Lval.IGNORED;
    }

    public Lval mkVariableLval(String name) {
        return mkLval(mkVariable(name), mkNoOffset());
    }

    public Lval mkVariableLval(VarInfo varInfo) {
        return mkLval(mkVariable(varInfo), mkNoOffset());
    }

    public Lval mkMemRefLval(Expr address) {
        return mkLval(mkMemRef(address), mkNoOffset());
    }

    public Variable mkVariable(VarInfo varInfo) {
        return new Variable(ids.newId(), varInfo);
    }

    public Variable mkVariable(String name) {
        return mkVariable(symbols.getOrCreateSymbol(name));
    }

    public MemRef mkMemRef(Expr address) {
        return new MemRef(ids.newId(), address);
    }

    public NoOffset mkNoOffset() {
        return new NoOffset(ids.newId());
    }

    public FieldOffset mkFieldOffset(String fieldName, @Nullable CType fieldType, Offset sub) {
        return new FieldOffset(ids.newId(), fieldName, fieldType, sub);
    }

    public IndexOffset mkIndexOffset(Expr index, Offset sub) {
        return new IndexOffset(ids.newId(), index, sub);
    }

    // expressions

    public IntegerConstant mkIntegerConstant(long value) {
        return new IntegerConstant(ids.newId(), value, null);
    }

    public IntegerConstant mkIntegerConstant(long value, @Nullable String macroName) {
        return new IntegerConstant(ids.newId(), value, macroName);
    }

    public StringConstant mkStringConstant(@Nullable Expr source, String text, String address) {
        return new StringConstant(ids.newId(), source, text, address);
    }

    public LvalExpr mkLvalExpr(Lval lval) {
        return new LvalExpr(ids.newId(), lval);
    }

    /**
     * Build a read of the named variable.
     *
     * @param name The name.
     * @return The expression.
     */
    public LvalExpr mkVariableExpr(String name) {
        return mkLvalExpr(mkVariableLval(name));
    }

    public SubstitutedExpr mkSubstitutedExpr(Lval lval, int assignId, Expr substituted) {
        return new SubstitutedExpr(ids.newId(), lval, assignId, substituted);
    }

    public CastExpr mkCastExpr(String targetType, Expr expr) {
        return new CastExpr(ids.newId(), targetType, expr);
    }

    public UnaryOp mkUnaryOp(String op, Expr expr) {
        return new UnaryOp(ids.newId(), op, expr);
    }

    public BinaryOp mkBinaryOp(String op, Expr left, Expr right) {
        return new BinaryOp(ids.newId(), op, left, right);
    }

    public Question mkQuestion(Expr cond, Expr ifTrue, Expr ifFalse) {
        return new Question(ids.newId(), cond, ifTrue, ifFalse);
    }

    public AddressOf mkAddressOf(Lval lval) {
        return new AddressOf(ids.newId(), lval);
    }
}
