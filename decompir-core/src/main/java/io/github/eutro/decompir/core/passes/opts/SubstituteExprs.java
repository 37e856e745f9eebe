package io.github.eutro.decompir.core.passes.opts;

import io.github.eutro.decompir.core.ast.*;
import io.github.eutro.decompir.core.build.IdAllocator;
import io.github.eutro.decompir.core.ext.CommonExts;
import io.github.eutro.decompir.core.ext.MetadataState;
import io.github.eutro.decompir.core.flow.InstrUseDef;
import io.github.eutro.decompir.core.flow.UseDef;
import io.github.eutro.decompir.core.passes.InPlaceIRPass;
import io.github.eutro.decompir.core.util.TreeWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces reads of variables with their single reaching definition, wrapped in a
 * {@link SubstitutedExpr} that remembers the variable and the defining instruction.
 * <p>
 * A read of {@code n} is replaced only if a definition of {@code n} reaches the instruction,
 * or condition that consumes it, the defining expression does not itself read {@code n},
 * and the variable has no user-given name. Returned expressions are left as they are.
 * <p>
 * The wrapped expression is a copy of the definition's right-hand side, itself substituted with
 * the definitions reaching the consumer. Copies of a chain of definitions that each read the
 * previous one several times grow exponentially, so a read whose copy would exceed
 * {@link #MAX_COPY_NODES} nodes is left as a plain read.
 */
public class SubstituteExprs implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final SubstituteExprs INSTANCE = new SubstituteExprs();

    /**
     * The most distinct nodes a single substituted copy may have.
     */
    public static final int MAX_COPY_NODES = 256;

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(func, MetadataState.USE_DEFS);
        InstrUseDef useDefs = func.getExtOrThrow(CommonExts.INSTR_USE_DEFS);
        func.setBody(substitute(func.getBody(), useDefs, func.ids));
    }

    /**
     * Substitute definitions into a tree.
     *
     * @param body    The tree.
     * @param useDefs The definitions reaching each statement and instruction of the tree.
     * @param ids     The allocator for the ids of new {@link SubstitutedExpr}s.
     * @return The new tree.
     */
    public static Stmt substitute(Stmt body, InstrUseDef useDefs, IdAllocator ids) {
        return body.accept(new StmtSubstituter(useDefs, ids));
    }

    private static class StmtSubstituter implements Stmt.Visitor<Stmt>, Instr.Visitor<Instr> {
        private final InstrUseDef useDefs;
        private final IdAllocator ids;

        StmtSubstituter(InstrUseDef useDefs, IdAllocator ids) {
            this.useDefs = useDefs;
            this.ids = ids;
        }

        private ExprSubstituter at(Node consumer) {
            return new ExprSubstituter(useDefs.get(consumer.id), ids, false);
        }

        @Override
        public Stmt visitReturn(Return stmt) {
            // the returned variable stays named, which keeps its assignment live
            return stmt;
        }

        @Override
        public Stmt visitBlock(Block stmt) {
            List<Stmt> stmts = new ArrayList<>(stmt.stmts.size());
            for (Stmt child : stmt.stmts) stmts.add(child.accept(this));
            return new Block(stmt.id, stmts);
        }

        @Override
        public Stmt visitInstrSequence(InstrSequence stmt) {
            List<Instr> instrs = new ArrayList<>(stmt.instrs.size());
            for (Instr instr : stmt.instrs) instrs.add(instr.accept(this));
            return new InstrSequence(stmt.id, instrs);
        }

        @Override
        public Stmt visitBranch(Branch stmt) {
            return new Branch(stmt.id,
                    at(stmt).substitute(stmt.cond),
                    stmt.thenStmt.accept(this),
                    stmt.elseStmt.accept(this),
                    stmt.relativeOffset);
        }

        @Override
        public Instr visitAssign(Assign instr) {
            ExprSubstituter sub = at(instr);
            return new Assign(instr.id, sub.substitute(instr.lhs), sub.substitute(instr.rhs));
        }

        @Override
        public Instr visitCall(Call instr) {
            ExprSubstituter sub = at(instr);
            List<Expr> args = new ArrayList<>(instr.args.size());
            for (Expr arg : instr.args) args.add(sub.substitute(arg));
            return new Call(instr.id, sub.substitute(instr.lhs), sub.substitute(instr.target), args);
        }
    }

    /**
     * Rewrites the expressions consumed at one point. Unchanged subtrees are returned as is.
     * <p>
     * In copy mode, used for definitions copied into a {@link SubstitutedExpr}, every composite
     * node is rebuilt with a fresh id, since the original may be rebuilt under its own id where
     * it is defined. Leaves are shared.
     */
    private static class ExprSubstituter implements
            Expr.Visitor<Expr>,
            LHost.Visitor<LHost>,
            Offset.Visitor<Offset> {
        private final UseDef useDef;
        private final IdAllocator ids;
        private final boolean copy;

        ExprSubstituter(UseDef useDef, IdAllocator ids, boolean copy) {
            this.useDef = useDef;
            this.ids = ids;
            this.copy = copy;
        }

        private Expr copyOf(Expr definition) {
            return new ExprSubstituter(useDef, ids, true).substitute(definition);
        }

        private int idFor(Node node) {
            return copy ? ids.newId() : node.id;
        }

        Expr substitute(Expr expr) {
            return expr.accept(this);
        }

        Lval substitute(Lval lval) {
            if (!lval.isPresent()) return lval;
            LHost host = lval.host.accept(this);
            Offset offset = lval.offset.accept(this);
            if (!copy && host == lval.host && offset == lval.offset) return lval;
            return new Lval(idFor(lval), host, offset);
        }

        @Override
        public Expr visitLvalExpr(LvalExpr expr) {
            String name = expr.lval.toString();
            if (!expr.lval.hasAltname() && useDef.hasName(name)) {
                UseDef.Def def = useDef.get(name);
                if (!def.expr.use().contains(name)) {
                    Expr substituted = copyOf(def.expr);
                    if (TreeWalker.nodes(substituted).size() <= MAX_COPY_NODES) {
                        Lval label = copy ? substitute(expr.lval) : expr.lval;
                        return new SubstitutedExpr(ids.newId(), label, def.instrId, substituted);
                    }
                }
            }
            Lval lval = substitute(expr.lval);
            if (!copy && lval == expr.lval) return expr;
            return new LvalExpr(idFor(expr), lval);
        }

        @Override
        public Expr visitSubstitutedExpr(SubstitutedExpr expr) {
            Expr inner = copyOf(expr.substituted);
            if (!copy && inner == expr.substituted) return expr;
            Lval label = copy ? substitute(expr.lval) : expr.lval;
            return new SubstitutedExpr(idFor(expr), label, expr.assignId, inner);
        }

        @Override
        public Expr visitIntegerConstant(IntegerConstant expr) {
            return expr;
        }

        @Override
        public Expr visitStringConstant(StringConstant expr) {
            return expr;
        }

        @Override
        public Expr visitCastExpr(CastExpr expr) {
            Expr inner = substitute(expr.expr);
            if (!copy && inner == expr.expr) return expr;
            return new CastExpr(idFor(expr), expr.targetType, inner);
        }

        @Override
        public Expr visitUnaryOp(UnaryOp expr) {
            Expr inner = substitute(expr.expr);
            if (!copy && inner == expr.expr) return expr;
            return new UnaryOp(idFor(expr), expr.op, inner);
        }

        @Override
        public Expr visitBinaryOp(BinaryOp expr) {
            Expr left = substitute(expr.left);
            Expr right = substitute(expr.right);
            if (!copy && left == expr.left && right == expr.right) return expr;
            return new BinaryOp(idFor(expr), expr.op, left, right);
        }

        @Override
        public Expr visitQuestion(Question expr) {
            Expr cond = substitute(expr.cond);
            Expr ifTrue = substitute(expr.ifTrue);
            Expr ifFalse = substitute(expr.ifFalse);
            if (!copy && cond == expr.cond && ifTrue == expr.ifTrue && ifFalse == expr.ifFalse) return expr;
            return new Question(idFor(expr), cond, ifTrue, ifFalse);
        }

        @Override
        public Expr visitAddressOf(AddressOf expr) {
            Lval lval = substitute(expr.lval);
            if (!copy && lval == expr.lval) return expr;
            return new AddressOf(idFor(expr), lval);
        }

        @Override
        public LHost visitVariable(Variable host) {
            return host;
        }

        @Override
        public LHost visitMemRef(MemRef host) {
            Expr address = substitute(host.address);
            if (!copy && address == host.address) return host;
            return new MemRef(idFor(host), address);
        }

        @Override
        public Offset visitNoOffset(NoOffset offset) {
            return offset;
        }

        @Override
        public Offset visitFieldOffset(FieldOffset offset) {
            Offset sub = offset.sub.accept(this);
            if (!copy && sub == offset.sub) return offset;
            return new FieldOffset(idFor(offset), offset.fieldName, offset.fieldType, sub);
        }

        @Override
        public Offset visitIndexOffset(IndexOffset offset) {
            Expr index = substitute(offset.index);
            Offset sub = offset.sub.accept(this);
            if (!copy && index == offset.index && sub == offset.sub) return offset;
            return new IndexOffset(idFor(offset), index, sub);
        }
    }
}
