package org.psyforge.compiler.metadata;

import org.psyforge.compiler.symbols.DataType;
import org.psyforge.compiler.symbols.TypeSymbol;
import org.psyforge.compiler.symbols.UnsupportedType;

import java.util.List;

/**
 * The symbol of a kernel metadata type. Its datatype is always the current declaration text.
 */
public class KernelMetadataSymbol extends TypeSymbol {

    private final KernelMetadata metadata;

    public KernelMetadataSymbol(String name, KernelMetadata metadata) {
        super(name, new UnsupportedType(metadata.toFortranString()));
        this.metadata = metadata;
    }

    /**
     * Parses a declaration into a new symbol named after the declared type.
     */
    public static KernelMetadataSymbol fromDeclaration(String declaration, MetadataVocabulary vocabulary) {
        KernelMetadata metadata = KernelMetadata.parse(declaration, vocabulary);
        return new KernelMetadataSymbol(metadata.name(), metadata);
    }

    public KernelMetadata getMetadata() {
        return metadata;
    }

    @Override
    public DataType getDatatype() {
        return new UnsupportedType(metadata.toFortranString());
    }

    public List<ArgumentDescriptor> arguments() {
        return metadata.arguments();
    }

    public String iteratesOver() {
        return metadata.iteratesOver();
    }

    public String indexOffset() {
        return metadata.indexOffset();
    }

    public String procedureName() {
        return metadata.procedureName();
    }

    public void setIteratesOver(String value) {
        metadata.setIteratesOver(value);
    }

    public void setIndexOffset(String value) {
        metadata.setIndexOffset(value);
    }

    public void setProcedureName(String value) {
        metadata.setProcedureName(value);
    }

    public void setArguments(List<ArgumentDescriptor> arguments) {
        metadata.setArguments(arguments);
    }
}
