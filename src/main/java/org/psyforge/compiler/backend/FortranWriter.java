package org.psyforge.compiler.backend;

import org.psyforge.compiler.api.InternalCompilerException;
import org.psyforge.compiler.ir.ArrayReference;
import org.psyforge.compiler.ir.Assignment;
import org.psyforge.compiler.ir.BinaryOperation;
import org.psyforge.compiler.ir.Call;
import org.psyforge.compiler.ir.CodeBlock;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.ir.IfBlock;
import org.psyforge.compiler.ir.IntrinsicCall;
import org.psyforge.compiler.ir.Literal;
import org.psyforge.compiler.ir.Loop;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.Range;
import org.psyforge.compiler.ir.Reference;
import org.psyforge.compiler.ir.Return;
import org.psyforge.compiler.ir.Routine;
import org.psyforge.compiler.ir.Schedule;
import org.psyforge.compiler.ir.StructureReference;
import org.psyforge.compiler.ir.UnaryOperation;
import org.psyforge.compiler.ir.directives.ProfileNode;
import org.psyforge.compiler.ir.directives.RegionDirective;
import org.psyforge.compiler.ir.directives.TaskClauses;
import org.psyforge.compiler.ir.directives.TaskDirective;
import org.psyforge.compiler.ir.domain.KernelMarker;
import org.psyforge.compiler.symbols.ArgumentInterface;
import org.psyforge.compiler.symbols.ArrayDimension;
import org.psyforge.compiler.symbols.ArrayType;
import org.psyforge.compiler.symbols.BytePrecision;
import org.psyforge.compiler.symbols.ContainerSymbol;
import org.psyforge.compiler.symbols.DataSymbol;
import org.psyforge.compiler.symbols.DataType;
import org.psyforge.compiler.symbols.PrecisionSpec;
import org.psyforge.compiler.symbols.ScalarType;
import org.psyforge.compiler.symbols.Symbol;
import org.psyforge.compiler.symbols.SymbolPrecision;
import org.psyforge.compiler.symbols.SymbolTable;
import org.psyforge.compiler.symbols.TypeSymbol;
import org.psyforge.compiler.symbols.UnsupportedType;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders IR trees as Fortran source. Statements are written one per line with two spaces of
 * indentation per nesting level; expressions are parenthesised only where operator precedence
 * requires it.
 */
public class FortranWriter {

    private static final String INDENT = "  ";
    private static final String OMP_SENTINEL = "!$";
    private static final int ATOMIC = 10;

    /**
     * Renders a node. Statements and scopes produce newline-terminated lines, expressions produce
     * their text without a newline.
     *
     * @param node The root of the tree to write.
     * @return The Fortran text.
     */
    public String write(Node node) {
        if (isExpression(node)) {
            return expression(node);
        }
        StringBuilder out = new StringBuilder();
        statement(node, 0, out);
        return out.toString();
    }

    /**
     * @param table A symbol table.
     * @param indent The nesting level.
     * @return The {@code use} statements and declarations of the table, one per line.
     */
    public String writeDeclarations(SymbolTable table, int indent) {
        StringBuilder out = new StringBuilder();
        declarations(table, indent, out);
        return out.toString();
    }

    // ------------------------------------------------------------------ statements

    private void statement(Node node, int indent, StringBuilder out) {
        if (node instanceof Container container) {
            container(container, indent, out);
        } else if (node instanceof Routine routine) {
            routine(routine, indent, out);
        } else if (node instanceof Schedule schedule) {
            body(schedule, indent, out);
        } else if (node instanceof KernelMarker marker) {
            body(marker.getKernelBody(), indent, out);
        } else if (node instanceof Loop loop) {
            line(out, indent, "do " + loop.getVariable().getName() + " = " + expression(loop.getStart()) + ", "
                    + expression(loop.getStop()) + ", " + expression(loop.getStep()));
            body(loop.getLoopBody(), indent + 1, out);
            line(out, indent, "enddo");
        } else if (node instanceof IfBlock ifBlock) {
            ifBlock(ifBlock, indent, out, "if");
            line(out, indent, "end if");
        } else if (node instanceof Assignment assignment) {
            line(out, indent, expression(assignment.getLhs()) + " = " + expression(assignment.getRhs()));
        } else if (node instanceof Call call) {
            line(out, indent, "call " + call.getRoutine().getName() + "(" + arguments(call.getChildren()) + ")");
        } else if (node instanceof Return) {
            line(out, indent, "return");
        } else if (node instanceof CodeBlock block) {
            for (String text : block.getLines()) {
                line(out, indent, text);
            }
        } else if (node instanceof ProfileNode profile) {
            line(out, indent, profile.beginString());
            body(profile.getDirBody(), indent, out);
            line(out, indent, profile.endString());
        } else if (node instanceof RegionDirective directive) {
            String begin = directive instanceof TaskDirective task ? taskString(task) : directive.beginString();
            line(out, indent, OMP_SENTINEL + begin);
            body(directive.getDirBody(), indent + 1, out);
            line(out, indent, OMP_SENTINEL + directive.endString());
        } else {
            throw new InternalCompilerException("FortranWriter does not support nodes of type '"
                    + node.getClass().getSimpleName() + "'.");
        }
    }

    private void ifBlock(IfBlock block, int indent, StringBuilder out, String keyword) {
        line(out, indent, keyword + " (" + expression(block.getCondition()) + ") then");
        body(block.getIfBody(), indent + 1, out);
        block.getElseBody().ifPresent(elseBody -> {
            if (elseBody.getChildCount() == 1 && elseBody.getChild(0) instanceof IfBlock nested) {
                ifBlock(nested, indent, out, "else if");
            } else {
                line(out, indent, "else");
                body(elseBody, indent + 1, out);
            }
        });
    }

    private void body(Schedule schedule, int indent, StringBuilder out) {
        for (Node child : schedule.getChildren()) {
            statement(child, indent, out);
        }
    }

    private void container(Container container, int indent, StringBuilder out) {
        // the file container only groups its program units
        if (container.getParent() == null) {
            declarations(container.getSymbolTable(), indent, out);
            for (Node child : container.getChildren()) {
                statement(child, indent, out);
            }
            return;
        }
        line(out, indent, "module " + container.getName());
        declarations(container.getSymbolTable(), indent + 1, out);
        List<Node> units = container.getChildren();
        if (!units.isEmpty()) {
            out.append('\n');
            line(out, indent + 1, "contains");
            for (Node unit : units) {
                statement(unit, indent + 1, out);
                out.append('\n');
            }
        }
        line(out, indent, "end module " + container.getName());
    }

    private void routine(Routine routine, int indent, StringBuilder out) {
        SymbolTable table = routine.getSymbolTable();
        if (routine.isProgram()) {
            line(out, indent, "program " + routine.getName());
        } else {
            String arguments = table.getArgumentList().stream().map(Symbol::getName).collect(Collectors.joining(", "));
            line(out, indent, "subroutine " + routine.getName() + "(" + arguments + ")");
        }
        int header = out.length();
        declarations(table, indent + 1, out);
        if (out.length() > header && routine.getChildCount() > 0) {
            out.append('\n');
        }
        body(routine, indent + 1, out);
        line(out, indent, "end " + (routine.isProgram() ? "program " : "subroutine ") + routine.getName());
    }

    // ------------------------------------------------------------------ declarations

    private void declarations(SymbolTable table, int indent, StringBuilder out) {
        for (ContainerSymbol container : table.getContainerSymbols()) {
            if (container.hasWildcardImport()) {
                line(out, indent, "use " + container.getName());
            } else {
                String names = table.importsFrom(container).stream().map(Symbol::getName)
                        .collect(Collectors.joining(", "));
                line(out, indent, "use " + container.getName() + ", only: " + names);
            }
        }
        for (Symbol symbol : table.getSymbols()) {
            if (symbol instanceof TypeSymbol type && type.getDatatype() instanceof UnsupportedType definition
                    && !symbol.isImport()) {
                for (String text : definition.declaration().split("\n")) {
                    line(out, indent, text.strip());
                }
            }
        }
        for (Symbol symbol : table.getSymbols()) {
            if (symbol instanceof DataSymbol data && (data.isLocal() || data.isArgument())) {
                String declaration = declaration(data);
                if (declaration != null) {
                    line(out, indent, declaration);
                }
            }
        }
    }

    /**
     * @param symbol A local or argument data symbol.
     * @return Its declaration, or null if its type is not known.
     */
    public String declaration(DataSymbol symbol) {
        DataType type = symbol.getDatatype();
        StringBuilder text = new StringBuilder();
        if (type instanceof UnsupportedType unsupported) {
            text.append(unsupported.declaration());
        } else if (type instanceof ScalarType scalar) {
            text.append(typeSpec(scalar));
        } else if (type instanceof ArrayType array && array.getElementType() instanceof ScalarType element) {
            text.append(typeSpec(element));
            List<String> extents = new ArrayList<>();
            boolean allocatable = false;
            for (ArrayDimension dimension : array.getShape()) {
                if (dimension == ArrayType.Extent.DEFERRED || dimension == ArrayType.Extent.ATTRIBUTE) {
                    allocatable |= dimension == ArrayType.Extent.DEFERRED;
                    extents.add(":");
                } else {
                    extents.add(dimension.toString());
                }
            }
            text.append(", dimension(").append(String.join(",", extents)).append(')');
            if (allocatable) {
                text.append(", allocatable");
            }
        } else {
            return null;
        }
        if (!(type instanceof UnsupportedType)) {
            if (symbol.isConstant()) {
                text.append(", parameter");
            }
            if (symbol.getInterface() instanceof ArgumentInterface argument && argument.access().intent() != null) {
                text.append(", intent(").append(argument.access().intent()).append(')');
            }
        }
        text.append(" :: ").append(symbol.getName());
        if (symbol.getInitialValue() != null) {
            text.append(" = ").append(expression(symbol.getInitialValue()));
        }
        return text.toString();
    }

    private static String typeSpec(ScalarType scalar) {
        PrecisionSpec precision = scalar.getPrecision();
        String name = scalar.getIntrinsic().fortranName();
        if (precision == ScalarType.Precision.DOUBLE && scalar.getIntrinsic() == ScalarType.Intrinsic.REAL) {
            return "double precision";
        }
        if (precision instanceof BytePrecision || precision instanceof SymbolPrecision) {
            return name + "(kind=" + precision + ")";
        }
        return name;
    }

    // ------------------------------------------------------------------ expressions

    private static boolean isExpression(Node node) {
        return node instanceof Reference || node instanceof Literal || node instanceof BinaryOperation
                || node instanceof UnaryOperation || node instanceof IntrinsicCall || node instanceof Range
                || (node instanceof CodeBlock block && block.getStructure() == CodeBlock.Structure.EXPRESSION);
    }

    private String expression(Node node) {
        if (node instanceof Literal literal) {
            return literal(literal);
        }
        if (node instanceof ArrayReference array) {
            List<String> indices = new ArrayList<>();
            for (int i = 0; i < array.getChildCount(); i++) {
                indices.add(index(array, i));
            }
            return array.getName() + "(" + String.join(",", indices) + ")";
        }
        if (node instanceof StructureReference structure) {
            return structure.getName() + "%" + String.join("%", structure.getMemberNames());
        }
        if (node instanceof Reference reference) {
            return reference.getName();
        }
        if (node instanceof BinaryOperation operation) {
            return binary(operation);
        }
        if (node instanceof UnaryOperation operation) {
            String operand = expression(operation.getOperand());
            if (precedence(operation.getOperand()) <= operation.getOperator().precedence()) {
                operand = "(" + operand + ")";
            }
            String separator = operation.getOperator() == UnaryOperation.Operator.NOT ? " " : "";
            return operation.getOperator().fortran() + separator + operand;
        }
        if (node instanceof IntrinsicCall call) {
            return call.getIntrinsic().name() + "(" + arguments(call.getChildren()) + ")";
        }
        if (node instanceof Range range) {
            return expression(range.getStart()) + ":" + expression(range.getStop()) + ":" + expression(range.getStep());
        }
        if (node instanceof CodeBlock block) {
            return String.join(" ", block.getLines());
        }
        throw new InternalCompilerException("FortranWriter does not support expressions of type '"
                + node.getClass().getSimpleName() + "'.");
    }

    private String binary(BinaryOperation operation) {
        BinaryOperation.Operator operator = operation.getOperator();
        int own = operator.precedence();
        int lhsPrecedence = precedence(operation.getLhs());
        int rhsPrecedence = precedence(operation.getRhs());
        boolean relational = own == BinaryOperation.Operator.EQ.precedence();
        boolean power = operator == BinaryOperation.Operator.POW;
        String lhs = expression(operation.getLhs());
        String rhs = expression(operation.getRhs());
        if (lhsPrecedence < own || ((relational || power) && lhsPrecedence == own)) {
            lhs = "(" + lhs + ")";
        }
        if (rhsPrecedence < own || (!power && rhsPrecedence == own)) {
            rhs = "(" + rhs + ")";
        }
        return lhs + " " + operator.fortran() + " " + rhs;
    }

    private static int precedence(Node node) {
        if (node instanceof BinaryOperation operation) {
            return operation.getOperator().precedence();
        }
        if (node instanceof UnaryOperation operation && !(operation.getOperand() instanceof Literal)) {
            return operation.getOperator().precedence();
        }
        return ATOMIC;
    }

    private String index(ArrayReference array, int dimension) {
        Node index = array.getChild(dimension);
        if (!(index instanceof Range range)) {
            return expression(index);
        }
        String start = array.isLowerBound(dimension) ? "" : expression(range.getStart());
        String stop = array.isUpperBound(dimension) ? "" : expression(range.getStop());
        String text = start + ":" + stop;
        if (!(range.getStep() instanceof Literal step && step.isInteger() && step.integerValue() == 1)) {
            text += ":" + expression(range.getStep());
        }
        return text;
    }

    private String arguments(List<Node> arguments) {
        return arguments.stream().map(this::expression).collect(Collectors.joining(", "));
    }

    private static String literal(Literal literal) {
        ScalarType type = literal.getDatatype();
        String value = literal.getValue();
        return switch (type.getIntrinsic()) {
            case BOOLEAN -> "." + value + ".";
            case CHARACTER -> "'" + value.replace("'", "''") + "'";
            default -> {
                PrecisionSpec precision = type.getPrecision();
                if (precision instanceof BytePrecision || precision instanceof SymbolPrecision) {
                    yield value + "_" + precision;
                }
                yield value;
            }
        };
    }

    // ------------------------------------------------------------------ directives

    private String taskString(TaskDirective task) {
        TaskClauses clauses = task.getClauses();
        StringBuilder text = new StringBuilder(task.beginString());
        List<String> parts = new ArrayList<>();
        addSymbolClause(parts, "private", clauses.privateSymbols());
        addSymbolClause(parts, "firstprivate", clauses.firstprivateSymbols());
        addSymbolClause(parts, "shared", clauses.sharedSymbols());
        addDependClause(parts, "in", clauses.dependIn());
        addDependClause(parts, "out", clauses.dependOut());
        if (!parts.isEmpty()) {
            text.append(' ').append(String.join(", ", parts));
        }
        return text.toString();
    }

    private static void addSymbolClause(List<String> parts, String name, List<Symbol> symbols) {
        if (!symbols.isEmpty()) {
            parts.add(name + "(" + symbols.stream().map(Symbol::getName).collect(Collectors.joining(",")) + ")");
        }
    }

    private void addDependClause(List<String> parts, String kind, List<Node> entries) {
        if (!entries.isEmpty()) {
            parts.add("depend(" + kind + ": " + entries.stream().map(this::expression).collect(Collectors.joining(",")) + ")");
        }
    }

    private static void line(StringBuilder out, int indent, String text) {
        out.append(INDENT.repeat(indent)).append(text).append('\n');
    }
}
