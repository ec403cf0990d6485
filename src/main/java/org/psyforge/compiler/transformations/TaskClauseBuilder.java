package org.psyforge.compiler.transformations;

import org.psyforge.compiler.analysis.AccessInfo;
import org.psyforge.compiler.analysis.AffineIndex;
import org.psyforge.compiler.analysis.SingleVariableAccessInfo;
import org.psyforge.compiler.analysis.VariablesAccessInfo;
import org.psyforge.compiler.api.TransformationException;
import org.psyforge.compiler.ir.ArrayReference;
import org.psyforge.compiler.ir.BinaryOperation;
import org.psyforge.compiler.ir.IntrinsicCall;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Range;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.directives.ParallelDirective;
import org.psyforge.compiler.ir.directives.TaskClauses;
import org.psyforge.compiler.ir.directives.TaskDirective;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes the data-sharing and depend clauses of a task around one loop nest.
 * <p>
 * The task context is the nearest enclosing {@link ParallelDirective}, or the routine when there
 * is none. Variables of the loops between the task and its context, together with the private
 * symbols of an enclosing parallel region, are private to the context; the task takes them as
 * private or firstprivate. Everything else is shared, and the shared storage the task touches is
 * listed in its depend clauses.
 * <p>
 * One builder computes the clauses of one task; it is not reusable.
 */
public final class TaskClauseBuilder {

    private final Loop loop;
    private final Node context;

    private final Map<Symbol, Loop> enclosingLoops = new IdentityHashMap<>();
    private final Map<Symbol, Loop> taskLoops = new IdentityHashMap<>();
    private final Set<Symbol> contextPrivate = identitySet();

    private final Set<Symbol> privates = identitySet();
    private final Set<Symbol> firstprivates = identitySet();

    private TaskClauseBuilder(Loop loop) {
        this.loop = loop;
        Node found = loop.ancestor(ParallelDirective.class).map(Node.class::cast)
                .or(() -> loop.ancestor(Routine.class).map(Node.class::cast))
                .orElse(loop.root());
        this.context = found;
    }

    /**
     * Computes the clauses for a loop that is about to be enclosed in a task.
     *
     * @param loop The outermost loop of the task body.
     * @return The clauses.
     * @throws TransformationException if the loop nest cannot be expressed as a task.
     */
    public static TaskClauses forLoop(Loop loop) {
        return new TaskClauseBuilder(loop).build();
    }

    /**
     * Recomputes the clauses of an existing task.
     *
     * @param directive A task directive whose body is a single loop.
     * @return The clauses.
     * @throws TransformationException if the body is not a single loop or cannot be expressed as a task.
     */
    public static TaskClauses forDirective(TaskDirective directive) {
        List<Node> body = directive.getDirBody().getChildren();
        if (body.size() != 1 || !(body.get(0) instanceof Loop bodyLoop)) {
            throw new TransformationException("OMPTaskDirective must have exactly one Loop child.");
        }
        return new TaskClauseBuilder(bodyLoop).build();
    }

    private TaskClauses build() {
        collectLoops();
        VariablesAccessInfo info = VariablesAccessInfo.of(loop);

        List<Symbol> shared = new ArrayList<>();
        List<Symbol> readOnlyArrays = new ArrayList<>();
        Set<Symbol> sharedScalars = identitySet();
        for (Symbol symbol : info.symbols()) {
            if (!(symbol instanceof DataSymbol data)) {
                continue;
            }
            SingleVariableAccessInfo accesses = info.get(symbol);
            if (!accesses.isRead() && !accesses.isWritten()) {
                continue;
            }
            if (taskLoops.containsKey(symbol)) {
                privates.add(symbol);
            } else if (contextPrivate.contains(symbol)) {
                if (accesses.isWrittenFirst()) {
                    privates.add(symbol);
                } else {
                    firstprivates.add(symbol);
                }
            } else if (data.isArray()) {
                if (accesses.isWritten()) {
                    shared.add(symbol);
                } else {
                    readOnlyArrays.add(symbol);
                }
            } else if (!accesses.isWritten() && readOnlyInLoopBounds(accesses)) {
                firstprivates.add(symbol);
            } else {
                sharedScalars.add(symbol);
                if (accesses.isWritten()) {
                    shared.add(symbol);
                }
            }
        }
        shared.sort(Comparator.comparingInt(symbol -> info.get(symbol).allWriteAccesses().get(0).getSequence()));
        shared.addAll(readOnlyArrays);

        List<Map.Entry<Symbol, AccessInfo>> sequence = accessSequence(info);
        List<Node> dependIn = new ArrayList<>();
        List<Node> dependOut = new ArrayList<>();
        for (Map.Entry<Symbol, AccessInfo> entry : sequence) {
            Symbol symbol = entry.getKey();
            AccessInfo access = entry.getValue();
            boolean array = symbol instanceof DataSymbol data && data.isArray();
            if (!array && !sharedScalars.contains(symbol)) {
                continue;
            }
            if (array && (privates.contains(symbol) || firstprivates.contains(symbol))) {
                continue;
            }
            List<Node> entries = array ? arrayEntries(symbol, access) : List.of(new Reference(symbol));
            if (access.getAccessType().isRead()) {
                addAll(dependIn, entries);
            }
            if (access.getAccessType().isWrite()) {
                addAll(dependOut, copies(entries));
            }
        }
        return new TaskClauses(inOrder(privates, info), inOrder(firstprivates, info), shared, dependIn, dependOut);
    }

    private void collectLoops() {
        for (Loop inner : loop.walk(Loop.class)) {
            taskLoops.putIfAbsent(inner.getVariable(), inner);
            checkBound(inner.getStart(), "start");
            checkBound(inner.getStop(), "stop");
            checkBound(inner.getStep(), "step");
        }
        for (Node node = loop.getParent(); node != null && node != context; node = node.getParent()) {
            if (node instanceof Loop outer) {
                enclosingLoops.putIfAbsent(outer.getVariable(), outer);
            }
        }
        contextPrivate.addAll(enclosingLoops.keySet());
        if (context instanceof ParallelDirective parallel) {
            contextPrivate.addAll(parallel.getPrivateSymbols());
            List<Symbol> loopVariables = new ArrayList<>(taskLoops.keySet());
            loopVariables.addAll(enclosingLoops.keySet());
            for (Symbol variable : loopVariables) {
                if (!parallel.getPrivateSymbols().contains(variable)) {
                    throw new TransformationException(String.format(
                            "Found shared loop variable which is not allowed in OpenMP Task directive. Variable name is %s",
                            variable.getName()));
                }
            }
        }
    }

    private static void checkBound(Node bound, String part) {
        if (!bound.walk(ArrayReference.class).isEmpty()) {
            throw new TransformationException(String.format(
                    "ArrayReference not supported in the %s variable of a Loop in a OMPTaskDirective node.", part));
        }
    }

    private boolean readOnlyInLoopBounds(SingleVariableAccessInfo accesses) {
        for (AccessInfo access : accesses.allReadAccesses()) {
            Node node = access.getNode();
            boolean inBound = false;
            for (Loop inner : taskLoops.values()) {
                if (node.isDescendantOf(inner.getStart()) || node.isDescendantOf(inner.getStop())
                        || node.isDescendantOf(inner.getStep())) {
                    inBound = true;
                    break;
                }
            }
            if (!inBound) {
                return false;
            }
        }
        return true;
    }

    private List<Node> arrayEntries(Symbol symbol, AccessInfo access) {
        if (!(access.getNode() instanceof ArrayReference reference)) {
            return List.of(new Reference(symbol));
        }
        List<List<Node>> alternatives = new ArrayList<>();
        List<Node> indices = reference.indices();
        for (int dim = 0; dim < indices.size(); dim++) {
            alternatives.add(mapIndex(indices.get(dim), symbol, dim));
        }
        List<List<Node>> combinations = new ArrayList<>();
        combinations.add(List.of());
        for (List<Node> options : alternatives) {
            List<List<Node>> next = new ArrayList<>();
            for (List<Node> prefix : combinations) {
                for (Node option : options) {
                    List<Node> combination = new ArrayList<>(prefix);
                    combination.add(option);
                    next.add(combination);
                }
            }
            combinations = next;
        }
        List<Node> entries = new ArrayList<>();
        for (List<Node> combination : combinations) {
            entries.add(ArrayReference.create(symbol, copies(combination)));
        }
        return entries;
    }

    private List<Node> mapIndex(Node index, Symbol array, int dim) {
        if (!index.walk(ArrayReference.class).isEmpty()) {
            throw new TransformationException(
                    "ArrayReference object is not allowed to appear in an Array Index expression inside an OMPTaskDirective.");
        }
        if (index instanceof Literal) {
            return List.of(index.copy());
        }
        if (index instanceof Range) {
            return List.of(fullRange(array, dim));
        }
        if (index.getClass() == Reference.class) {
            return mapOffset(index, ((Reference) index).getSymbol(), 0, false, array, dim);
        }
        if (index instanceof BinaryOperation operation) {
            BinaryOperation.Operator operator = operation.getOperator();
            if (operator != BinaryOperation.Operator.ADD && operator != BinaryOperation.Operator.SUB) {
                throw new TransformationException(String.format(
                        "Binary Operator of type %s used as in index inside an OMPTaskDirective which is not supported",
                        operator));
            }
            Optional<AffineIndex> affine = AffineIndex.of(index);
            if (affine.isEmpty()) {
                throw new TransformationException(String.format(
                        "Children of BinaryOperation are of types %s and %s, expected one Reference and one Literal "
                                + "when used as an index inside an OMPTaskDirective.",
                        operation.getLhs().getClass().getSimpleName(), operation.getRhs().getClass().getSimpleName()));
            }
            AffineIndex form = affine.get();
            return mapOffset(index, form.symbol(), form.offset(), form.literalFirst(), array, dim);
        }
        return List.of(fullRange(array, dim));
    }

    /**
     * Maps {@code variable + offset} to the storage it may touch during the whole task.
     */
    private List<Node> mapOffset(Node index, Symbol variable, long offset, boolean literalFirst, Symbol array, int dim) {
        Loop parent = enclosingLoops.get(variable);
        long total = offset;
        if (parent == null && taskLoops.containsKey(variable)) {
            Optional<AffineIndex> start = AffineIndex.of(taskLoops.get(variable).getStart())
                    .filter(form -> enclosingLoops.containsKey(form.symbol()));
            if (start.isEmpty()) {
                return List.of(fullRange(array, dim));
            }
            parent = enclosingLoops.get(start.get().symbol());
            total += start.get().offset();
        }
        if (parent != null) {
            if (total == 0) {
                return List.of(new Reference(parent.getVariable()));
            }
            if (!(parent.getStep() instanceof Literal step) || !step.isInteger() || step.integerValue() == 0) {
                return List.of(fullRange(array, dim));
            }
            List<Node> entries = new ArrayList<>();
            for (long multiple : AffineIndex.stepMultiples(total, step.integerValue())) {
                entries.add(stepOffset(parent.getVariable(), multiple, step.integerValue(), literalFirst));
            }
            return entries;
        }
        if (firstprivates.contains(variable)) {
            return List.of(index.copy());
        }
        if (privates.contains(variable)) {
            return List.of(fullRange(array, dim));
        }
        throw new TransformationException(String.format(
                "Shared variable access used as an index inside an OMPTaskDirective which is not supported. "
                        + "Variable name is %s", variable.getName()));
    }

    private static Node stepOffset(DataSymbol variable, long multiple, long step, boolean literalFirst) {
        if (multiple == 0) {
            return new Reference(variable);
        }
        long magnitude = Math.abs(multiple);
        Node amount = magnitude == 1
                ? Literal.ofInteger(step)
                : BinaryOperation.create(BinaryOperation.Operator.MUL, Literal.ofInteger(magnitude), Literal.ofInteger(step));
        if (multiple < 0) {
            return BinaryOperation.create(BinaryOperation.Operator.SUB, new Reference(variable), amount);
        }
        return literalFirst
                ? BinaryOperation.create(BinaryOperation.Operator.ADD, amount, new Reference(variable))
                : BinaryOperation.create(BinaryOperation.Operator.ADD, new Reference(variable), amount);
    }

    /**
     * @return {@code lbound(array, dim):ubound(array, dim):1}, which is written as {@code :}.
     */
    private static Node fullRange(Symbol array, int dim) {
        Node lower = IntrinsicCall.create(IntrinsicCall.Intrinsic.LBOUND,
                List.of(new Reference(array), Literal.ofInteger(dim + 1)));
        Node upper = IntrinsicCall.create(IntrinsicCall.Intrinsic.UBOUND,
                List.of(new Reference(array), Literal.ofInteger(dim + 1)));
        return Range.create(lower, upper, Literal.ofInteger(1));
    }

    private static List<Map.Entry<Symbol, AccessInfo>> accessSequence(VariablesAccessInfo info) {
        List<Map.Entry<Symbol, AccessInfo>> sequence = new ArrayList<>();
        for (Symbol symbol : info.symbols()) {
            for (AccessInfo access : info.get(symbol).getAccesses()) {
                sequence.add(Map.entry(symbol, access));
            }
        }
        sequence.sort(Comparator.comparingInt(entry -> entry.getValue().getSequence()));
        return sequence;
    }

    private static List<Symbol> inOrder(Set<Symbol> symbols, VariablesAccessInfo info) {
        return info.symbols().stream().filter(symbols::contains).toList();
    }

    private static void addAll(List<Node> target, List<Node> entries) {
        for (Node entry : entries) {
            if (target.stream().noneMatch(existing -> existing.isStructurallyEqual(entry))) {
                target.add(entry);
            }
        }
    }

    private static List<Node> copies(List<Node> nodes) {
        return nodes.stream().map(Node::copy).toList();
    }

    private static Set<Symbol> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
