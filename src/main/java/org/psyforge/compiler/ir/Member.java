package org.psyforge.compiler.ir;

import org.psyforge.compiler.api.GenerationException;

/**
 * One component in a structure access chain ({@code %name}). The optional single child is the
 * next member of the chain.
 */
public class Member extends Node {

    private final String name;

    public Member(String name) {
        if (name == null || name.isBlank()) {
            throw new GenerationException("A Member requires a name.");
        }
        this.name = name;
    }

    /**
     * Builds a chain {@code first%second%...}.
     * @param names The component names, outermost first.
     * @return The first member of the chain.
     */
    public static Member chain(String... names) {
        Member first = new Member(names[0]);
        Member current = first;
        for (int i = 1; i < names.length; i++) {
            Member next = new Member(names[i]);
            current.addChild(next);
            current = next;
        }
        return first;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The next member in the chain, or null at the end.
     */
    public Member getNext() {
        return getChildCount() == 0 ? null : (Member) getChild(0);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return position == 0 && child instanceof Member;
    }

    @Override
    protected String childrenFormat() {
        return "[Member]";
    }

    @Override
    protected Node shallowCopy() {
        return new Member(name);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return name.equalsIgnoreCase(((Member) other).name);
    }

    @Override
    protected String describe() {
        return "name:'" + name + "'";
    }
}
