package io.github.eutro.decompir.core.passes.opts;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.conf.ReductionConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simplifies a tree: folds constant additions, collapses substitutions of constants,
 * names constants after macros, and removes dead instructions.
 * <p>
 * Nodes keep their ids, except that a folded node takes its id from the remap table when
 * it has an entry there. A reducer should be used for a single tree.
 */
public final class TreeReducer implements
        Stmt.Visitor<Stmt>,
        Instr.Visitor<Instr>,
        Expr.Visitor<Expr>,
        LHost.Visitor<LHost>,
        Offset.Visitor<Offset> {
    private final ReductionConfig config;
    private final Map<Integer, Integer> remap;
    private final Map<Long, String> macros;
    // subtrees shared by substitution reduce to shared results
    private final Map<Expr, Expr> reduced = new IdentityHashMap<>();

    public TreeReducer(ReductionConfig config) {
        this.config = config;
        this.remap = config.getRemap().orElse(Collections.emptyMap());
        this.macros = config.getMacros().orElse(Collections.emptyMap());
    }

    public Stmt reduce(Stmt stmt) {
        return stmt.accept(this);
    }

    public Expr reduce(Expr expr) {
        Expr result = reduced.get(expr);
        if (result == null) {
            result = expr.accept(this);
            reduced.put(expr, result);
        }
        return result;
    }

    public Lval reduce(Lval lval) {
        if (!lval.isPresent()) return lval;
        LHost host = lval.host.accept(this);
        Offset offset = lval.offset.accept(this);
        if (host == lval.host && offset == lval.offset) return lval;
        return new Lval(lval.id, host, offset);
    }

    private int foldedId(int id) {
        return remap.getOrDefault(id, id);
    }

    private IntegerConstant constant(int id, long value) {
        return new IntegerConstant(id, value, macros.get(value));
    }

    @Override
    public Stmt visitReturn(Return stmt) {
        return new Return(stmt.id, stmt.hasReturnValue() ? reduce(stmt.getExpr()) : null);
    }

    @Override
    public Stmt visitBlock(Block stmt) {
        List<Stmt> stmts = new ArrayList<>(stmt.stmts.size());
        for (Stmt child : stmt.stmts) stmts.add(reduce(child));
        return new Block(stmt.id, stmts);
    }

    @Override
    public Stmt visitInstrSequence(InstrSequence stmt) {
        List<Instr> instrs = new ArrayList<>(stmt.instrs.size());
        for (Instr instr : stmt.instrs) {
            if (!instr.isLive(config.getLiveness())) continue;
            instrs.add(instr.accept(this));
        }
        return new InstrSequence(stmt.id, instrs);
    }

    @Override
    public Stmt visitBranch(Branch stmt) {
        return new Branch(stmt.id,
                reduce(stmt.cond),
                reduce(stmt.thenStmt),
                reduce(stmt.elseStmt),
                stmt.relativeOffset);
    }

    @Override
    public Instr visitAssign(Assign instr) {
        return new Assign(instr.id, reduce(instr.lhs), reduce(instr.rhs));
    }

    @Override
    public Instr visitCall(Call instr) {
        List<Expr> args = new ArrayList<>(instr.args.size());
        for (Expr arg : instr.args) args.add(reduce(arg));
        return new Call(instr.id, reduce(instr.lhs), reduce(instr.target), args);
    }

    @Override
    public Expr visitIntegerConstant(IntegerConstant expr) {
        String macro = macros.get(expr.value);
        if (macro == null) return expr;
        return new IntegerConstant(expr.id, expr.value, macro);
    }

    @Override
    public Expr visitStringConstant(StringConstant expr) {
        return expr;
    }

    @Override
    public Expr visitLvalExpr(LvalExpr expr) {
        return new LvalExpr(expr.id, reduce(expr.lval));
    }

    @Override
    public Expr visitSubstitutedExpr(SubstitutedExpr expr) {
        Expr inner = reduce(expr.substituted);
        if (inner.isIntegerConstant()) {
            return constant(foldedId(expr.id), inner.getIntegerValue());
        }
        return new SubstitutedExpr(expr.id, reduce(expr.lval), expr.assignId, inner);
    }

    @Override
    public Expr visitCastExpr(CastExpr expr) {
        return new CastExpr(expr.id, expr.targetType, reduce(expr.expr));
    }

    @Override
    public Expr visitUnaryOp(UnaryOp expr) {
        return new UnaryOp(expr.id, expr.op, reduce(expr.expr));
    }

    @Override
    public Expr visitBinaryOp(BinaryOp expr) {
        Expr left = reduce(expr.left);
        Expr right = reduce(expr.right);
        // only plus folds
        if (Operators.PLUS.equals(expr.op) && left.isIntegerConstant() && right.isIntegerConstant()) {
            return constant(foldedId(expr.id), left.getIntegerValue() + right.getIntegerValue());
        }
        return new BinaryOp(expr.id, expr.op, left, right);
    }

    @Override
    public Expr visitQuestion(Question expr) {
        return new Question(expr.id, reduce(expr.cond), reduce(expr.ifTrue), reduce(expr.ifFalse));
    }

    @Override
    public Expr visitAddressOf(AddressOf expr) {
        return new AddressOf(expr.id, reduce(expr.lval));
    }

    @Override
    public LHost visitVariable(Variable host) {
        return host;
    }

    @Override
    public LHost visitMemRef(MemRef host) {
        return new MemRef(host.id, reduce(host.address));
    }

    @Override
    public Offset visitNoOffset(NoOffset offset) {
        return offset;
    }

    @Override
    public Offset visitFieldOffset(FieldOffset offset) {
        return new FieldOffset(offset.id, offset.fieldName, offset.fieldType, offset.sub.accept(this));
    }

    @Override
    public Offset visitIndexOffset(IndexOffset offset) {
        return new IndexOffset(offset.id, reduce(offset.index), offset.sub.accept(this));
    }
}
