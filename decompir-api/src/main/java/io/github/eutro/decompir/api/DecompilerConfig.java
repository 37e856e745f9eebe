package io.github.eutro.decompir.api;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.github.eutro.decompir.core.conf.CallingConvention;

import java.io.Reader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of a {@link Decompiler}, read from JSON like
 * {@code {"callingConvention": "arm", "macros": {"0": "O_RDONLY"}, "substitute": true}}.
 * <p>
 * Missing keys take their defaults: ARM, no macros, and substitution enabled.
 */
public final class DecompilerConfig {
    public static final DecompilerConfig DEFAULT = new DecompilerConfig(CallingConvention.ARM, Collections.emptyMap(), true);

    public final CallingConvention callingConvention;
    /**
     * The macro names of constant values.
     */
    public final Map<Long, String> macros;
    /**
     * Whether to substitute definitions into their uses before reducing.
     */
    public final boolean substitute;

    public DecompilerConfig(CallingConvention callingConvention, Map<Long, String> macros, boolean substitute) {
        this.callingConvention = callingConvention;
        this.macros = Collections.unmodifiableMap(new LinkedHashMap<>(macros));
        this.substitute = substitute;
    }

    /**
     * Read a configuration.
     *
     * @param reader The source of the JSON.
     * @return The configuration.
     * @throws JsonParseException If the JSON is malformed or a setting is invalid.
     */
    public static DecompilerConfig read(Reader reader) {
        JsonElement element = JsonParser.parseReader(reader);
        if (!element.isJsonObject()) throw new JsonParseException("expected configuration object, got " + element);
        JsonObject obj = element.getAsJsonObject();

        CallingConvention convention = DEFAULT.callingConvention;
        if (obj.has("callingConvention")) {
            try {
                convention = CallingConvention.fromName(obj.get("callingConvention").getAsString());
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage(), e);
            }
        }

        Map<Long, String> macros = new LinkedHashMap<>();
        if (obj.has("macros")) {
            for (Map.Entry<String, JsonElement> entry : obj.getAsJsonObject("macros").entrySet()) {
                long value;
                try {
                    value = Long.decode(entry.getKey());
                } catch (NumberFormatException e) {
                    throw new JsonParseException("macro value " + entry.getKey() + " is not an integer", e);
                }
                macros.put(value, entry.getValue().getAsString());
            }
        }

        boolean substitute = !obj.has("substitute") || obj.get("substitute").getAsBoolean();
        return new DecompilerConfig(convention, macros, substitute);
    }
}
