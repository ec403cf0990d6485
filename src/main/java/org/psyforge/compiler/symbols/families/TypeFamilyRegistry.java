package org.psyforge.compiler.symbols.families;

import org.psyforge.compiler.api.SymbolNotFoundException;
import org.psyforge.compiler.symbols.ArrayDimension;
import org.psyforge.compiler.symbols.ArrayType;
import org.psyforge.compiler.symbols.ContainerSymbol;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.ImportInterface;
import org.psyforge.compiler.symbols.LocalInterface;
import org.psyforge.compiler.symbols.ScalarType;
import org.psyforge.compiler.symbols.SymbolInterface;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Holds the declared type families of one domain together with the module and kind symbols
 * they refer to. A registry is built once at the start of a run and handed to whoever creates
 * domain symbols; there is no global instance.
 */
public class TypeFamilyRegistry {

    private final ContainerSymbol constantsModule;
    private final Map<String, DataSymbol> kindSymbols = new LinkedHashMap<>();
    private final Map<String, TypeFamily> families = new LinkedHashMap<>();

    /**
     * @param constantsModuleName The module the kind symbols are imported from.
     * @param kindNames The names of the integer kind symbols.
     */
    public TypeFamilyRegistry(String constantsModuleName, List<String> kindNames) {
        this.constantsModule = new ContainerSymbol(constantsModuleName);
        for (String kind : kindNames) {
            kindSymbols.put(kind.toLowerCase(Locale.ROOT),
                    new DataSymbol(kind, ScalarType.INTEGER_TYPE, new ImportInterface(constantsModule)));
        }
    }

    /**
     * Builds the LFRic table: the kind symbols of {@code constants_mod}, the generic scalars and
     * the scalar, array and vector families used by kernel arguments.
     *
     * @return A new registry.
     */
    public static TypeFamilyRegistry lfric() {
        TypeFamilyRegistry registry = new TypeFamilyRegistry("constants_mod",
                List.of("i_def", "r_def", "r_solver", "r_tran", "l_def"));
        ScalarType.Intrinsic integer = ScalarType.Intrinsic.INTEGER;
        ScalarType.Intrinsic real = ScalarType.Intrinsic.REAL;
        ScalarType.Intrinsic logical = ScalarType.Intrinsic.BOOLEAN;

        registry.declare("LfricIntegerScalar", FamilyKind.SCALAR, integer, "i_def", 0, List.of(), null);
        registry.declare("LfricRealScalar", FamilyKind.SCALAR, real, "r_def", 0, List.of(), null);
        registry.declare("LfricLogicalScalar", FamilyKind.SCALAR, logical, "l_def", 0, List.of(), null);

        // Specific scalars
        registry.declareScalar("CellPosition", List.of());
        registry.declareScalar("MeshHeight", List.of());
        registry.declareScalar("NumberOfCells", List.of());
        registry.declareScalar("NumberOfDofs", List.of("fs"));
        registry.declareScalar("NumberOfUniqueDofs", List.of("fs"));
        registry.declareScalar("NumberOfFaces", List.of());
        registry.declareScalar("NumberOfEdges", List.of());
        registry.declareScalar("NumberOfQrPointsInXy", List.of());
        registry.declareScalar("NumberOfQrPointsInZ", List.of());
        registry.declareScalar("NumberOfQrPointsInFaces", List.of());
        registry.declareScalar("NumberOfQrPointsInEdges", List.of());

        // Arrays
        TypeFamily realField = registry.declare("RealFieldData", FamilyKind.ARRAY, real, "r_def", 1, List.of("fs"), null);
        TypeFamily integerField = registry.declare("IntegerFieldData", FamilyKind.ARRAY, integer, "i_def", 1, List.of("fs"), null);
        TypeFamily logicalField = registry.declare("LogicalFieldData", FamilyKind.ARRAY, logical, "l_def", 1, List.of("fs"), null);
        registry.declare("Operator", FamilyKind.ARRAY, real, "r_def", 3, List.of("fs_from", "fs_to"), null);
        registry.declare("DofMap", FamilyKind.ARRAY, integer, "i_def", 1, List.of("fs"), null);
        for (String suffix : List.of("Xyoz", "Face", "Edge")) {
            registry.declare("BasisFunctionQr" + suffix, FamilyKind.ARRAY, real, "r_def", 4, List.of("fs"), null);
            registry.declare("DiffBasisFunctionQr" + suffix, FamilyKind.ARRAY, real, "r_def", 4, List.of("fs"), null);
        }
        for (String suffix : List.of("Xy", "Z", "Faces", "Edges")) {
            registry.declare("QrWeightsIn" + suffix, FamilyKind.ARRAY, real, "r_def", 1, List.of(), null);
        }

        // Vectors of fields share the element layout of the field they are built from
        registry.declare("RealVectorFieldData", FamilyKind.VECTOR, real, "r_def", 1, List.of("fs"), realField);
        registry.declare("IntegerVectorFieldData", FamilyKind.VECTOR, integer, "i_def", 1, List.of("fs"), integerField);
        registry.declare("LogicalVectorFieldData", FamilyKind.VECTOR, logical, "l_def", 1, List.of("fs"), logicalField);
        return registry;
    }

    private TypeFamily declareScalar(String name, List<String> attributes) {
        return declare(name, FamilyKind.SCALAR, ScalarType.Intrinsic.INTEGER, "i_def", 0, attributes, null);
    }

    /**
     * Declares a new family.
     *
     * @param name The family name, unique within the registry.
     * @param kind Scalar, array or vector.
     * @param intrinsic The intrinsic kind of the data.
     * @param precisionName The kind symbol giving the precision; must be known to the registry.
     * @param dimensions The rank of arrays and vectors; 0 for scalars.
     * @param attributes The attributes every symbol of the family must be given.
     * @param parent The family this one derives from, or null.
     * @return The declared family.
     */
    public TypeFamily declare(String name, FamilyKind kind, ScalarType.Intrinsic intrinsic, String precisionName,
                              int dimensions, List<String> attributes, TypeFamily parent) {
        String key = name.toLowerCase(Locale.ROOT);
        if (families.containsKey(key)) {
            throw new IllegalArgumentException("Type family '" + name + "' is already declared.");
        }
        kindSymbol(precisionName);
        if ((kind == FamilyKind.SCALAR) != (dimensions == 0)) {
            throw new IllegalArgumentException(String.format(
                    "Type family '%s' of kind %s cannot have %d dimensions.", name, kind, dimensions));
        }
        TypeFamily family = new TypeFamily(name, kind, intrinsic, precisionName, dimensions, attributes, parent);
        families.put(key, family);
        return family;
    }

    /**
     * @param name A family name, case-insensitive.
     * @return The family.
     * @throws SymbolNotFoundException if no such family is declared.
     */
    public TypeFamily family(String name) {
        TypeFamily family = families.get(name.toLowerCase(Locale.ROOT));
        if (family == null) {
            throw new SymbolNotFoundException("No type family named '" + name + "' is declared.");
        }
        return family;
    }

    public List<TypeFamily> families() {
        return List.copyOf(families.values());
    }

    public ContainerSymbol getConstantsModule() {
        return constantsModule;
    }

    /**
     * @param name A kind symbol name, e.g. {@code r_def}.
     * @return The kind symbol imported from the constants module.
     * @throws SymbolNotFoundException if the registry does not know the kind.
     */
    public DataSymbol kindSymbol(String name) {
        DataSymbol symbol = kindSymbols.get(name.toLowerCase(Locale.ROOT));
        if (symbol == null) {
            throw new SymbolNotFoundException("Kind symbol '" + name + "' is not declared in '" + constantsModule.getName() + "'.");
        }
        return symbol;
    }

    public Map<String, DataSymbol> kindSymbols() {
        return Collections.unmodifiableMap(kindSymbols);
    }

    /**
     * @return The scalar type of a family, with the family's kind symbol as precision.
     */
    public ScalarType scalarType(TypeFamily family) {
        return new ScalarType(family.getIntrinsic(), kindSymbol(family.getPrecisionName()));
    }

    /**
     * Creates a local scalar of a scalar family.
     *
     * @param familyName The family.
     * @param symbolName The name of the new symbol.
     * @param attributes Exactly the attributes the family declares.
     * @return The new symbol.
     */
    public FamilyDataSymbol createScalar(String familyName, String symbolName, Map<String, String> attributes) {
        return createScalar(familyName, symbolName, attributes, new LocalInterface());
    }

    public FamilyDataSymbol createScalar(String familyName, String symbolName, Map<String, String> attributes,
                                         SymbolInterface symbolInterface) {
        TypeFamily family = family(familyName);
        if (family.getKind() != FamilyKind.SCALAR) {
            throw new IllegalArgumentException(String.format(
                    "'%s' is a %s family; use createArray to build its symbols.", family.getName(), family.getKind()));
        }
        checkAttributes(family, attributes);
        return new FamilyDataSymbol(symbolName, scalarType(family), symbolInterface, family, attributes);
    }

    /**
     * Creates a local array of an array or vector family.
     *
     * @param familyName The family.
     * @param symbolName The name of the new symbol.
     * @param dimensions One extent per declared dimension.
     * @param attributes Exactly the attributes the family declares.
     * @return The new symbol.
     */
    public FamilyDataSymbol createArray(String familyName, String symbolName, List<? extends ArrayDimension> dimensions,
                                        Map<String, String> attributes) {
        return createArray(familyName, symbolName, dimensions, attributes, new LocalInterface());
    }

    public FamilyDataSymbol createArray(String familyName, String symbolName, List<? extends ArrayDimension> dimensions,
                                        Map<String, String> attributes, SymbolInterface symbolInterface) {
        TypeFamily family = family(familyName);
        if (family.getKind() == FamilyKind.SCALAR) {
            throw new IllegalArgumentException(String.format(
                    "'%s' is a scalar family; use createScalar to build its symbols.", family.getName()));
        }
        if (dimensions == null || dimensions.size() != family.getDimensions()) {
            throw new IllegalArgumentException(String.format(
                    "'%s' expected the number of supplied dimensions to be %d but found %d.",
                    family.getName(), family.getDimensions(), dimensions == null ? 0 : dimensions.size()));
        }
        checkAttributes(family, attributes);
        ArrayType type = new ArrayType(scalarType(family), dimensions);
        return new FamilyDataSymbol(symbolName, type, symbolInterface, family, attributes);
    }

    private static void checkAttributes(TypeFamily family, Map<String, String> attributes) {
        if (attributes == null || !attributes.keySet().equals(new HashSet<>(family.getAttributes()))) {
            throw new IllegalArgumentException(String.format(
                    "'%s' expected attributes %s but found %s.",
                    family.getName(), family.getAttributes(), attributes == null ? "[]" : List.copyOf(attributes.keySet())));
        }
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new IllegalArgumentException(String.format(
                        "Attribute '%s' of '%s' must not be empty.", entry.getKey(), family.getName()));
            }
        }
    }
}
