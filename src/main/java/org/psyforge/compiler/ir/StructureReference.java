package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.AccessType;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.symbols.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * An access to a component of a derived-type variable, {@code grid%dx%value}.
 * The single child is the first {@link Member} of the chain.
 */
public class StructureReference extends Reference {

    StructureReference(Symbol symbol) {
        super(symbol);
    }

    /**
     * @param symbol The structure variable.
     * @param members The component names, outermost first.
     * @return The new reference.
     */
    public static StructureReference create(Symbol symbol, String... members) {
        StructureReference reference = new StructureReference(symbol);
        reference.initChildren(List.of(Member.chain(members)));
        return reference;
    }

    public Member getMember() {
        return (Member) getChild(0);
    }

    /**
     * @return The component names, outermost first.
     */
    public List<String> getMemberNames() {
        List<String> names = new ArrayList<>();
        for (Member member = getMember(); member != null; member = member.getNext()) {
            names.add(member.getName());
        }
        return names;
    }

    @Override
    public void referenceAccesses(VariablesAccessInfo info, AccessType accessType) {
        info.addAccess(getSymbol(), accessType, this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return position == 0 && child instanceof Member;
    }

    @Override
    protected String childrenFormat() {
        return "Member";
    }

    @Override
    protected boolean isComplete(int count) {
        return count == 1;
    }

    @Override
    protected Node shallowCopy() {
        return new StructureReference(getSymbol());
    }

    @Override
    protected String describe() {
        return "name:'" + getName() + "%" + String.join("%", getMemberNames()) + "'";
    }
}
