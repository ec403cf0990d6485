package org.psyforge.compiler.metadata;

import org.psyforge.compiler.api.InternalCompilerException;
import org.psyforge.compiler.api.MetadataParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks a parsed metadata declaration against the rules of the kernel API and builds the
 * descriptor model from it. Every failure is a {@link MetadataParseException}.
 */
final class MetadataValidator {

    static final String META_ARGS = "meta_args";
    static final String ITERATES_OVER = "iterates_over";
    static final String INDEX_OFFSET = "index_offset";
    static final String DIMENSION = "dimension";
    static final String CODE = "code";

    private static final String[] ORDINALS = {"first", "second", "third", "fourth", "fifth"};

    private final MetadataVocabulary vocabulary;

    MetadataValidator(MetadataVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * @param declaration The syntax of the metadata.
     * @return The validated metadata.
     */
    KernelMetadata validate(MetadataDeclaration declaration) {
        List<ArgumentDescriptor> arguments = null;
        String iteratesOver = null;
        String indexOffset = null;
        Map<String, SourceTemplate.Span> spans = new LinkedHashMap<>();
        String components = declaration.componentText();

        for (MetadataDeclaration.Component component : declaration.components()) {
            switch (component.name()) {
                case META_ARGS -> {
                    if (arguments != null) {
                        throw duplicate(META_ARGS, components);
                    }
                    if (component.arguments() == null) {
                        throw new MetadataParseException(String.format(
                                "'meta_args' should be an array of arguments but found '%s'.", component.value().text()));
                    }
                    arguments = new ArrayList<>();
                    for (MetadataDeclaration.RawArgument raw : component.arguments()) {
                        arguments.add(toDescriptor(raw));
                    }
                    if (component.dimension() != null) {
                        int dimension = parseInteger(component.dimension().text(), "dimension of 'meta_args'");
                        if (dimension != arguments.size()) {
                            throw new MetadataParseException(String.format(
                                    "The dimension of 'meta_args' is %d but %d arguments were found.",
                                    dimension, arguments.size()));
                        }
                        spans.put(DIMENSION, span(component.dimension()));
                    }
                    spans.put(META_ARGS, new SourceTemplate.Span(component.argumentsStart(), component.argumentsEnd()));
                }
                case ITERATES_OVER -> {
                    if (iteratesOver != null) {
                        throw duplicate(ITERATES_OVER, components);
                    }
                    iteratesOver = checkProperty(ITERATES_OVER, vocabulary.iterationSpaces(), singleValue(component));
                    spans.put(ITERATES_OVER, span(component.value()));
                }
                case INDEX_OFFSET -> {
                    if (indexOffset != null) {
                        throw duplicate(INDEX_OFFSET, components);
                    }
                    indexOffset = checkProperty(INDEX_OFFSET, vocabulary.offsets(), singleValue(component));
                    spans.put(INDEX_OFFSET, span(component.value()));
                }
                default -> throw new MetadataParseException(String.format(
                        "Expecting metadata entries to be one of 'meta_args', 'iterates_over', or 'index_offset', "
                                + "but found '%s' in %s.", component.name(), components));
            }
        }
        if (arguments == null) {
            throw missing(META_ARGS, components);
        }
        if (iteratesOver == null) {
            throw missing(ITERATES_OVER, components);
        }
        if (indexOffset == null) {
            throw missing(INDEX_OFFSET, components);
        }
        if (!declaration.hasContains()) {
            throw new MetadataParseException(String.format(
                    "The metadata does not have a contains keyword (which is required to add the code metadata) in '%s'.",
                    declaration.typeName()));
        }
        if (declaration.bindings().size() != 1) {
            throw new MetadataParseException(String.format(
                    "Expecting a single entry after the 'contains' keyword but found %d.", declaration.bindings().size()));
        }
        MetadataToken target = declaration.bindings().get(0).target();
        spans.put(CODE, span(target));

        return new KernelMetadata(vocabulary, new SourceTemplate(declaration.source(), spans),
                declaration.typeName().toLowerCase(Locale.ROOT), arguments, iteratesOver, indexOffset,
                target.text().toLowerCase(Locale.ROOT));
    }

    /**
     * Converts one argument constructor; the category follows from the number of entries.
     */
    ArgumentDescriptor toDescriptor(MetadataDeclaration.RawArgument raw) {
        if (!raw.constructor().equalsIgnoreCase(vocabulary.argumentConstructor())) {
            throw new MetadataParseException(String.format(
                    "Expected kernel metadata arguments to be of the form '%s(...)' but found '%s'.",
                    vocabulary.argumentConstructor(), raw.text()));
        }
        List<MetadataDeclaration.Entry> entries = raw.entries();
        if (entries.size() != 2 && entries.size() != 3 && entries.size() != 5) {
            throw new MetadataParseException(String.format(
                    "Expected kernel metadata argument to have 2, 3 or 5 entries, but found %d in '%s'.",
                    entries.size(), raw.text()));
        }
        String access = checkEntry(0, "access descriptor", vocabulary.accessModes(), entries.get(0).text());
        switch (entries.size()) {
            case 2:
                return new GridPropertyArgument(access,
                        checkEntry(1, "grid property", vocabulary.gridProperties(), entries.get(1).text()));
            case 3: {
                MetadataDeclaration.Entry second = entries.get(1);
                Stencil stencil = toStencil(entries.get(2));
                if (second.multiplier() != null) {
                    String space = checkEntry(1, "function space", vocabulary.functionSpaces(), second.head());
                    return new FieldVectorArgument(access, space, vectorSize(second), stencil);
                }
                String value = lower(second.text());
                if (vocabulary.scalarDatatypes().contains(value)) {
                    return new ScalarArgument(access, value, stencil);
                }
                return new FieldArgument(access,
                        checkEntry(1, "function space", vocabulary.functionSpaces(), second.text()), stencil);
            }
            case 5:
                return new OperatorArgument(access,
                        checkEntry(1, "operator form", vocabulary.operatorForms(), entries.get(1).text()),
                        checkEntry(2, "datatype descriptor", vocabulary.operatorDatatypes(), entries.get(2).text()),
                        checkEntry(3, "function space", vocabulary.functionSpaces(), entries.get(3).text()),
                        checkEntry(4, "function space", vocabulary.functionSpaces(), entries.get(4).text()));
            default:
                throw new InternalCompilerException("Unchecked argument size " + entries.size());
        }
    }

    /**
     * Checks a descriptor built in code against the vocabulary.
     */
    void check(ArgumentDescriptor descriptor) {
        checkEntry(0, "access descriptor", vocabulary.accessModes(), descriptor.access());
        if (descriptor instanceof GridPropertyArgument grid) {
            checkEntry(1, "grid property", vocabulary.gridProperties(), grid.gridProperty());
        } else if (descriptor instanceof FieldArgument field) {
            checkEntry(1, "function space", vocabulary.functionSpaces(), field.functionSpace());
            checkStencil(field.stencil());
        } else if (descriptor instanceof FieldVectorArgument vector) {
            checkEntry(1, "function space", vocabulary.functionSpaces(), vector.functionSpace());
            checkStencil(vector.stencil());
        } else if (descriptor instanceof ScalarArgument scalar) {
            checkEntry(1, "scalar datatype", vocabulary.scalarDatatypes(), scalar.datatype());
            checkStencil(scalar.stencil());
        } else if (descriptor instanceof OperatorArgument operator) {
            checkEntry(1, "operator form", vocabulary.operatorForms(), operator.form());
            checkEntry(2, "datatype descriptor", vocabulary.operatorDatatypes(), operator.datatype());
            checkEntry(3, "function space", vocabulary.functionSpaces(), operator.toSpace());
            checkEntry(4, "function space", vocabulary.functionSpaces(), operator.fromSpace());
        }
    }

    /**
     * @return The value in lower case.
     * @throws MetadataParseException if the value is not one of {@code allowed}.
     */
    String checkProperty(String property, List<String> allowed, String value) {
        String lowered = lower(value);
        if (!allowed.contains(lowered)) {
            throw new MetadataParseException(String.format(
                    "The value of '%s' should be one of %s, but found '%s'.",
                    property, MetadataVocabulary.choices(allowed), value));
        }
        return lowered;
    }

    private Stencil toStencil(MetadataDeclaration.Entry entry) {
        if (entry.inner() != null && entry.head().equalsIgnoreCase(vocabulary.stencilConstructor())) {
            return Stencil.explicit(vocabulary.stencilConstructor(), entry.inner());
        }
        if (entry.inner() == null && entry.multiplier() == null && vocabulary.stencilNames().contains(lower(entry.head()))) {
            return Stencil.named(lower(entry.head()));
        }
        throw stencilError(entry.text());
    }

    private void checkStencil(Stencil stencil) {
        if (stencil.isExplicit()) {
            if (!stencil.name().equals(vocabulary.stencilConstructor())) {
                throw stencilError(stencil.toFortranString());
            }
            Stencil.explicit(stencil.name(), stencil.rows());
        } else if (!vocabulary.stencilNames().contains(stencil.name())) {
            throw stencilError(stencil.name());
        }
    }

    private MetadataParseException stencilError(String found) {
        return new MetadataParseException(String.format(
                "The third metadata entry for an argument should be a recognised stencil (one of %s) or '%s(...)', but found '%s'.",
                MetadataVocabulary.choices(vocabulary.stencilNames()), vocabulary.stencilConstructor(), found));
    }

    private static int vectorSize(MetadataDeclaration.Entry entry) {
        int size = parseInteger(entry.multiplier(), "vector size in '" + entry.text() + "'");
        if (size < 1) {
            throw new MetadataParseException(String.format(
                    "The vector size of a field vector argument must be a positive integer but found '%s'.", entry.text()));
        }
        return size;
    }

    private static int parseInteger(String text, String description) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new MetadataParseException(String.format(
                    "The %s must be an integer that fits in 32 bits but found '%s'.", description, text), e);
        }
    }

    private static String checkEntry(int position, String description, List<String> allowed, String value) {
        String lowered = lower(value);
        if (!allowed.contains(lowered)) {
            throw new MetadataParseException(String.format(
                    "The %s metadata entry for an argument should be a recognised %s (one of %s), but found '%s'.",
                    ORDINALS[position], description, MetadataVocabulary.choices(allowed), value));
        }
        return lowered;
    }

    private static String singleValue(MetadataDeclaration.Component component) {
        if (component.value() == null) {
            throw new MetadataParseException(String.format(
                    "The value of '%s' should be a single name but found an array.", component.name()));
        }
        return component.value().text();
    }

    private static MetadataParseException duplicate(String name, String components) {
        return new MetadataParseException(String.format(
                "'%s' should only be defined once in the metadata, but found %s.", name, components));
    }

    private static MetadataParseException missing(String name, String components) {
        return new MetadataParseException(String.format(
                "Expecting '%s' to be an entry in the metadata but it was not found in %s.", name, components));
    }

    private static SourceTemplate.Span span(MetadataToken token) {
        return new SourceTemplate.Span(token.start(), token.end());
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
