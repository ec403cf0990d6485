package org.psyforge.compiler.ir.directives;

import org.psyforge.compiler.api.GenerationException;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.symbols.DataSymbol;

/**
 * A profiling region. It is written as a {@code ProfileStart}/{@code ProfileEnd} call pair
 * around its body and does not change what the body computes.
 */
public class ProfileNode extends RegionDirective {

    private final String moduleName;
    private final String regionName;
    private final DataSymbol profileVariable;

    ProfileNode(String moduleName, String regionName, DataSymbol profileVariable) {
        if (moduleName == null || regionName == null || profileVariable == null) {
            throw new GenerationException("A ProfileNode requires a module name, a region name and a profile variable.");
        }
        this.moduleName = moduleName;
        this.regionName = regionName;
        this.profileVariable = profileVariable;
    }

    /**
     * @param moduleName The module name reported to the profiling library.
     * @param regionName The region name, unique within the run.
     * @param profileVariable The {@code ProfileData} variable of the region.
     * @return A profile node with an empty body.
     */
    public static ProfileNode create(String moduleName, String regionName, DataSymbol profileVariable) {
        ProfileNode node = new ProfileNode(moduleName, regionName, profileVariable);
        node.initBody();
        return node;
    }

    public String getModuleName() {
        return moduleName;
    }

    public String getRegionName() {
        return regionName;
    }

    public DataSymbol getProfileVariable() {
        return profileVariable;
    }

    @Override
    public String beginString() {
        return String.format("CALL ProfileStart(\"%s\", \"%s\", %s)", moduleName, regionName, profileVariable.getName());
    }

    @Override
    public String endString() {
        return String.format("CALL ProfileEnd(%s)", profileVariable.getName());
    }

    @Override
    protected Node shallowCopy() {
        return new ProfileNode(moduleName, regionName, profileVariable);
    }

    @Override
    protected boolean hasSameData(Node other) {
        ProfileNode node = (ProfileNode) other;
        return moduleName.equals(node.moduleName) && regionName.equals(node.regionName)
                && profileVariable == node.profileVariable;
    }

    @Override
    protected String describe() {
        return "region:'" + regionName + "'";
    }
}
