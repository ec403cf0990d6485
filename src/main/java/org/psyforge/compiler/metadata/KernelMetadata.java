package org.psyforge.compiler.metadata;

import org.psyforge.compiler.api.MetadataParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * The validated metadata of one kernel.
 * <p>
 * The declaration is parsed once. Setters validate the new value, update the model and mark the
 * text as stale; {@link #toFortranString()} then splices the current values into the original
 * text, so everything that was not changed is reproduced character for character.
 */
public final class KernelMetadata {

    private static final Logger LOG = LoggerFactory.getLogger(KernelMetadata.class);
    private static final Pattern FORTRAN_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final MetadataVocabulary vocabulary;
    private final MetadataValidator validator;
    private final SourceTemplate template;
    private final String name;
    private List<ArgumentDescriptor> arguments;
    private String iteratesOver;
    private String indexOffset;
    private String procedureName;
    private final Map<String, String> edits = new HashMap<>();
    private String text;

    KernelMetadata(MetadataVocabulary vocabulary, SourceTemplate template, String name,
                   List<ArgumentDescriptor> arguments, String iteratesOver, String indexOffset, String procedureName) {
        this.vocabulary = vocabulary;
        this.validator = new MetadataValidator(vocabulary);
        this.template = template;
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.iteratesOver = iteratesOver;
        this.indexOffset = indexOffset;
        this.procedureName = procedureName;
        this.text = template.text();
    }

    /**
     * Parses and validates a kernel metadata declaration.
     *
     * @param declaration The Fortran derived-type declaration.
     * @param vocabulary The value sets of the kernel API.
     * @return The metadata.
     * @throws MetadataParseException if the declaration is malformed or uses unknown values.
     */
    public static KernelMetadata parse(String declaration, MetadataVocabulary vocabulary) {
        KernelMetadata metadata = new MetadataValidator(vocabulary).validate(new MetadataParser(declaration).parse());
        LOG.debug("Parsed metadata of kernel '{}' with {} arguments", metadata.name, metadata.arguments.size());
        return metadata;
    }

    public String name() {
        return name;
    }

    public MetadataVocabulary vocabulary() {
        return vocabulary;
    }

    public List<ArgumentDescriptor> arguments() {
        return arguments;
    }

    /**
     * @return The mapping from call argument positions to {@code meta_args} indices for a call
     *         that passes only the metadata arguments.
     */
    public ArgumentIndexMap argumentIndexMap() {
        return ArgumentIndexMap.of(arguments);
    }

    public String iteratesOver() {
        return iteratesOver;
    }

    public String indexOffset() {
        return indexOffset;
    }

    /**
     * @return The name of the routine bound as the kernel's code.
     */
    public String procedureName() {
        return procedureName;
    }

    public void setIteratesOver(String value) {
        iteratesOver = validator.checkProperty(MetadataValidator.ITERATES_OVER, vocabulary.iterationSpaces(), value);
        edit(MetadataValidator.ITERATES_OVER, iteratesOver);
    }

    public void setIndexOffset(String value) {
        indexOffset = validator.checkProperty(MetadataValidator.INDEX_OFFSET, vocabulary.offsets(), value);
        edit(MetadataValidator.INDEX_OFFSET, indexOffset);
    }

    /**
     * @param value The name of the routine implementing the kernel.
     * @throws MetadataParseException if the value is not a Fortran name.
     */
    public void setProcedureName(String value) {
        if (value == null || !FORTRAN_NAME.matcher(value).matches()) {
            throw new MetadataParseException(String.format(
                    "The procedure name of the kernel metadata should be a valid Fortran name but found '%s'.", value));
        }
        procedureName = value.toLowerCase(Locale.ROOT);
        edit(MetadataValidator.CODE, procedureName);
    }

    /**
     * Replaces the argument list. A {@code dimension(N)} attribute is updated to the new count.
     *
     * @param newArguments At least one argument, each valid for the vocabulary.
     */
    public void setArguments(List<ArgumentDescriptor> newArguments) {
        if (newArguments == null || newArguments.isEmpty()) {
            throw new MetadataParseException("The kernel metadata requires at least one argument in 'meta_args'.");
        }
        newArguments.forEach(validator::check);
        arguments = List.copyOf(newArguments);
        List<String> rendered = arguments.stream()
                .map(argument -> argument.toFortranString(vocabulary.argumentConstructor()))
                .toList();
        edit(MetadataValidator.META_ARGS, " " + String.join(", ", rendered) + " ");
        if (template.hasSpan(MetadataValidator.DIMENSION)) {
            edit(MetadataValidator.DIMENSION, Integer.toString(arguments.size()));
        }
    }

    private void edit(String key, String value) {
        edits.put(key, value);
        text = null;
    }

    /**
     * @return The declaration text with the current values.
     */
    public String toFortranString() {
        if (text == null) {
            text = template.render(edits);
        }
        return text;
    }

    @Override
    public String toString() {
        return "KernelMetadata[" + name + ", args=" + arguments.size() + ", iterates_over=" + iteratesOver
                + ", index_offset=" + indexOffset + ", code=" + procedureName + "]";
    }
}
