package org.psyforge.compiler.symbols.families;

import org.psyforge.compiler.symbols.ScalarType;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declares one family of domain-specific data symbols, e.g. "the number of degrees of freedom
 * of a function space". Instances are created once by a {@link TypeFamilyRegistry} and compared
 * by identity; generated symbols point back at the family they belong to.
 */
public final class TypeFamily {

    private final String name;
    private final FamilyKind kind;
    private final ScalarType.Intrinsic intrinsic;
    private final String precisionName;
    private final int dimensions;
    private final List<String> attributes;
    private final TypeFamily parent;

    TypeFamily(String name, FamilyKind kind, ScalarType.Intrinsic intrinsic, String precisionName,
               int dimensions, List<String> attributes, TypeFamily parent) {
        this.name = Objects.requireNonNull(name);
        this.kind = Objects.requireNonNull(kind);
        this.intrinsic = Objects.requireNonNull(intrinsic);
        this.precisionName = Objects.requireNonNull(precisionName);
        this.dimensions = dimensions;
        this.attributes = List.copyOf(attributes);
        this.parent = parent;
    }

    public String getName() {
        return name;
    }

    public FamilyKind getKind() {
        return kind;
    }

    public ScalarType.Intrinsic getIntrinsic() {
        return intrinsic;
    }

    /**
     * @return The name of the kind symbol that gives the family its precision.
     */
    public String getPrecisionName() {
        return precisionName;
    }

    /**
     * @return The rank of generated arrays; 0 for scalars.
     */
    public int getDimensions() {
        return dimensions;
    }

    /**
     * @return The names of the attributes every generated symbol must be given.
     */
    public List<String> getAttributes() {
        return attributes;
    }

    public Optional<TypeFamily> getParent() {
        return Optional.ofNullable(parent);
    }

    /**
     * @param other A family.
     * @return true if this family is {@code other} or derives from it.
     */
    public boolean isA(TypeFamily other) {
        for (TypeFamily family = this; family != null; family = family.parent) {
            if (family == other) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}
