package org.psyforge.compiler.ir;

import org.psyforge.compiler.analysis.AccessType;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.GenerationException;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A call to a Fortran intrinsic function.
 */
public class IntrinsicCall extends DataNode {

    /**
     * The supported intrinsics with their argument counts.
     */
    public enum Intrinsic {
        LBOUND(1, 2, true),
        UBOUND(1, 2, true),
        SIZE(1, 2, true),
        ABS(1, 1, false),
        SQRT(1, 1, false),
        EXP(1, 1, false),
        MOD(2, 2, false),
        MIN(2, Integer.MAX_VALUE, false),
        MAX(2, Integer.MAX_VALUE, false);

        private final int minArgs;
        private final int maxArgs;
        private final boolean inquiry;

        Intrinsic(int minArgs, int maxArgs, boolean inquiry) {
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.inquiry = inquiry;
        }

        /**
         * @return true if the intrinsic only queries properties of its first argument, not its data.
         */
        public boolean isInquiry() {
            return inquiry;
        }

        /**
         * @param name A Fortran name, case-insensitive.
         * @return The matching intrinsic, if supported.
         */
        public static Optional<Intrinsic> fromName(String name) {
            try {
                return Optional.of(valueOf(name.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
    }

    private final Intrinsic intrinsic;

    IntrinsicCall(Intrinsic intrinsic) {
        this.intrinsic = intrinsic;
    }

    /**
     * @param intrinsic The intrinsic.
     * @param arguments Orphan argument expressions.
     * @return The new call.
     * @throws GenerationException if the number of arguments is wrong for the intrinsic.
     */
    public static IntrinsicCall create(Intrinsic intrinsic, List<? extends Node> arguments) {
        if (intrinsic == null) {
            throw new GenerationException("An IntrinsicCall requires an intrinsic.");
        }
        if (arguments.size() < intrinsic.minArgs || arguments.size() > intrinsic.maxArgs) {
            throw new GenerationException(String.format(
                    "Intrinsic '%s' requires between %d and %d arguments but found %d.",
                    intrinsic, intrinsic.minArgs, intrinsic.maxArgs, arguments.size()));
        }
        IntrinsicCall call = new IntrinsicCall(intrinsic);
        call.initChildren(arguments);
        return call;
    }

    public Intrinsic getIntrinsic() {
        return intrinsic;
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
        return DataNode.isExpression(child);
    }

    @Override
    protected String childrenFormat() {
        return "[DataNode]*";
    }

    /**
     * The first argument of an inquiry is recorded as an {@link AccessType#INQUIRY}: its data is not read.
     */
    @Override
    public void referenceAccesses(VariablesAccessInfo info) {
        for (int i = 0; i < getChildCount(); i++) {
            Node child = getChild(i);
            if (i == 0 && intrinsic.isInquiry() && child.getClass() == Reference.class) {
                ((Reference) child).referenceAccesses(info, AccessType.INQUIRY);
            } else {
                child.referenceAccesses(info);
            }
        }
    }

    @Override
    protected Node shallowCopy() {
        return new IntrinsicCall(intrinsic);
    }

    @Override
    protected boolean hasSameData(Node other) {
        return intrinsic == ((IntrinsicCall) other).intrinsic;
    }

    @Override
    protected String describe() {
        return intrinsic.name();
    }
}
