package org.psyforge.compiler.symbols.families;

import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.DataType;
import org.psyforge.compiler.symbols.SymbolInterface;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A data symbol generated from a {@link TypeFamily}. Apart from its family and attribute values
 * it behaves exactly like any other {@link DataSymbol}.
 */
public class FamilyDataSymbol extends DataSymbol {

    private final TypeFamily family;
    private final Map<String, String> attributes;

    FamilyDataSymbol(String name, DataType datatype, SymbolInterface symbolInterface,
                     TypeFamily family, Map<String, String> attributes) {
        super(name, datatype, symbolInterface);
        this.family = family;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public TypeFamily family() {
        return family;
    }

    /**
     * @param other A family.
     * @return true if this symbol belongs to that family or to a family derived from it.
     */
    public boolean isA(TypeFamily other) {
        return family.isA(other);
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public Optional<String> getAttribute(String attribute) {
        return Optional.ofNullable(attributes.get(attribute));
    }

    @Override
    public String toString() {
        return getName() + ": " + family.getName() + "<" + getDatatype() + ", " + getInterface() + ", " + attributes + ">";
    }
}
