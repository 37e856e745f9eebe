package io.github.eutro.decompir.core.ext;

import io.github.eutro.decompir.core.flow.InstrUseDef;
import io.github.eutro.decompir.core.flow.LiveVars;

import java.util.Set;

public class CommonExts {
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * The names of variables whose address is taken anywhere in a function.
     */
    public static final Ext<Set<String>> ADDRESS_TAKEN = Ext.create(Set.class, "ADDRESS_TAKEN");
    public static final Ext<InstrUseDef> INSTR_USE_DEFS = Ext.create(InstrUseDef.class, "INSTR_USE_DEFS");
    public static final Ext<LiveVars> LIVE_VARS = Ext.create(LiveVars.class, "LIVE_VARS");
}
