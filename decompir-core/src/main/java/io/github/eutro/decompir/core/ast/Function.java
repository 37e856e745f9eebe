package io.github.eutro.decompir.core.ast;

import io.github.eutro.decompir.core.build.IdAllocator;
import io.github.eutro.decompir.core.build.SymbolTable;
import io.github.eutro.decompir.core.conf.CallingConvention;
import io.github.eutro.decompir.core.ext.CommonExts;
import io.github.eutro.decompir.core.ext.ExtHolder;
import io.github.eutro.decompir.core.ext.MetadataState;

import java.util.ArrayList;
import java.util.List;

/**
 * A decompiled function: its body, and the allocator and symbols its nodes were built with.
 * <p>
 * Analyses of the body are attached as exts, and are invalidated whenever the body is replaced.
 */
public final class Function extends ExtHolder {
    public final String name;
    public final CallingConvention convention;
    public final IdAllocator ids;
    public final SymbolTable symbols;
    public final List<FormalVarInfo> formals = new ArrayList<>();
    private Stmt body;

    public Function(String name, CallingConvention convention, IdAllocator ids, SymbolTable symbols, Stmt body) {
        this.name = name;
        this.convention = convention;
        this.ids = ids;
        this.symbols = symbols;
        this.body = body;
        attachExt(CommonExts.METADATA_STATE, new MetadataState());
    }

    public Stmt getBody() {
        return body;
    }

    public void setBody(Stmt body) {
        this.body = body;
        getExtOrThrow(CommonExts.METADATA_STATE).bodyChanged(this);
    }

    /**
     * Render this function as C-like text, with a signature built from its formals.
     *
     * @return The rendering.
     */
    public String toCLike() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < formals.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(formals.get(i).toCLike());
        }
        sb.append("){\n");
        String text = body.toCLike(Stmt.C_INDENT);
        if (!text.isEmpty()) sb.append(text).append('\n');
        return sb.append('}').toString();
    }

    @Override
    public String toString() {
        return toCLike();
    }
}
