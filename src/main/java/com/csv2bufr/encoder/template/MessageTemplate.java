package com.csv2bufr.encoder.template;

import com.csv2bufr.encoder.NativeType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sample message a {@link TemplateBufrEncoder} starts from: BUFR edition, master table and the keys a
 * message may carry together with their wire types.
 */
@Value
@Builder
public class MessageTemplate {

    private static final Pattern RANK_PREFIX = Pattern.compile("^#\\d+#");

    @NonNull
    String name;

    int edition;
    int masterTableNumber;

    /**
     * Element key to wire type. Keys are stored without an occurrence prefix.
     */
    @Singular
    Map<String, NativeType> elements;

    public boolean hasElement(String key) {
        return elements.containsKey(baseKey(key));
    }

    public NativeType typeOf(String key) {
        return elements.get(baseKey(key));
    }

    /**
     * Strips the {@code #n#} occurrence prefix used to address repeated elements, e.g.
     * {@code #2#airTemperature} becomes {@code airTemperature}.
     */
    public static String baseKey(String key) {
        return RANK_PREFIX.matcher(key).replaceFirst("");
    }
}
