package org.psyforge.compiler.transformations;

import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.ir.Call;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.directives.ProfileNode;
import org.psyforge.compiler.symbols.ContainerSymbol;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.DeferredType;
import org.psyforge.compiler.symbols.ImportInterface;
import org.psyforge.compiler.symbols.LocalInterface;
import org.psyforge.compiler.symbols.NameSpace;
import org.psyforge.compiler.symbols.RoutineSymbol;
import org.psyforge.compiler.symbols.SymbolTable;
import org.psyforge.compiler.symbols.TypeSymbol;
import org.psyforge.compiler.symbols.UnsupportedType;

import java.util.List;

/**
 * Encloses statements in a profiling region. The region calls {@code ProfileStart} and
 * {@code ProfileEnd} of the profiling wrapper library; what the statements compute is unchanged.
 */
public class ProfileTrans extends RegionTrans<ProfileNode> {

    /** The module of the profiling wrapper library. */
    public static final String PROFILE_MODULE = "profile_mod";
    /** The derived type holding the state of one region. */
    public static final String PROFILE_TYPE = "ProfileData";
    public static final String PROFILE_START = "ProfileStart";
    public static final String PROFILE_END = "ProfileEnd";

    private final NameSpace nameSpace;
    private final String regionName;

    /**
     * @param nameSpace The names used so far in this run.
     */
    public ProfileTrans(NameSpace nameSpace) {
        this(nameSpace, null);
    }

    /**
     * @param nameSpace The names used so far in this run.
     * @param regionName The preferred region name, or null to derive it from the enclosed code.
     */
    public ProfileTrans(NameSpace nameSpace, String regionName) {
        this.nameSpace = nameSpace;
        this.regionName = regionName;
    }

    @Override
    protected boolean allowsCodeBlocks() {
        return true;
    }

    @Override
    protected void validateRegion(List<Node> nodes) {
        if (nodes.get(0).ancestor(Routine.class).isEmpty()) {
            throw new TransformationException(String.format(
                    "Error in %s: a profiling region must be inside a Routine.", getName()));
        }
    }

    @Override
    protected ProfileNode createDirective(List<Node> nodes) {
        Routine routine = nodes.get(0).ancestor(Routine.class).orElseThrow();
        String moduleName = routine.ancestor(Container.class)
                .filter(container -> container.getParent() != null)
                .map(Container::getName)
                .orElse(routine.getName());
        String region = nameSpace.createName(regionBase(nodes, routine));
        DataSymbol profileVariable = declareProfileSymbols(routine.getSymbolTable());
        CompilerLogger.debug("Profiling region '{}' in module '{}' uses variable '{}'",
                region, moduleName, profileVariable.getName());
        return ProfileNode.create(moduleName, region, profileVariable);
    }

    private String regionBase(List<Node> nodes, Routine routine) {
        if (regionName != null && !regionName.isBlank()) {
            return regionName;
        }
        for (Node node : nodes) {
            List<Call> calls = node.walk(Call.class);
            if (!calls.isEmpty()) {
                return calls.get(0).getRoutine().getName();
            }
        }
        return routine.getName();
    }

    private static DataSymbol declareProfileSymbols(SymbolTable table) {
        ContainerSymbol module = table.resolve(PROFILE_MODULE)
                .filter(ContainerSymbol.class::isInstance)
                .map(ContainerSymbol.class::cast)
                .orElseGet(() -> {
                    ContainerSymbol created = new ContainerSymbol(PROFILE_MODULE);
                    table.add(created);
                    return created;
                });
        if (table.resolve(PROFILE_TYPE).isEmpty()) {
            TypeSymbol type = new TypeSymbol(PROFILE_TYPE, DeferredType.INSTANCE);
            type.setInterface(new ImportInterface(module));
            table.add(type);
        }
        for (String name : List.of(PROFILE_START, PROFILE_END)) {
            if (table.resolve(name).isEmpty()) {
                table.add(new RoutineSymbol(name, new ImportInterface(module)));
            }
        }
        String variableName = table.nextAvailableName("profile");
        DataSymbol variable = new DataSymbol(variableName,
                new UnsupportedType("type(" + PROFILE_TYPE + "), save"), new LocalInterface());
        table.add(variable);
        return variable;
    }
}
