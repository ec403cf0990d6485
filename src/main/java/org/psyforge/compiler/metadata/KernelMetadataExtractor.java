package org.psyforge.compiler.metadata;

import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.ir.Node;
import org.psyforge.compiler.ir.ScopingNode;
import org.psyforge.compiler.symbols.Symbol;
import org.psyforge.compiler.symbols.SymbolTable;
import org.psyforge.compiler.symbols.TypeSymbol;
import org.psyforge.compiler.symbols.UnsupportedType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Finds the kernel metadata types declared in a tree and replaces their plain type symbols by
 * {@link KernelMetadataSymbol}s parsed with one API's vocabulary.
 */
public class KernelMetadataExtractor {

    private static final Pattern KERNEL_TYPE = Pattern.compile(
            "^\\s*type\\s*,[^\\n]*\\bextends\\s*\\(\\s*kernel_type\\s*\\)", Pattern.CASE_INSENSITIVE);

    private final MetadataVocabulary vocabulary;

    /**
     * @param vocabulary The vocabulary metadata declarations are checked against.
     */
    public KernelMetadataExtractor(MetadataVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * @param declaration The text of a derived type definition.
     * @return True if the type extends {@code kernel_type}.
     */
    public static boolean isKernelMetadata(String declaration) {
        return KERNEL_TYPE.matcher(declaration).find();
    }

    /**
     * Replaces every kernel metadata type symbol below {@code root}, keeping its place in the table.
     *
     * @param root The root of the tree.
     * @return The new symbols, in tree order.
     * @throws org.psyforge.compiler.api.MetadataParseException if a declaration is not valid metadata.
     */
    public List<KernelMetadataSymbol> extract(Node root) {
        List<KernelMetadataSymbol> extracted = new ArrayList<>();
        for (ScopingNode scope : root.walk(ScopingNode.class)) {
            SymbolTable table = scope.getSymbolTable();
            for (Symbol symbol : table.getSymbols()) {
                if (symbol instanceof TypeSymbol type && !(symbol instanceof KernelMetadataSymbol)
                        && !symbol.isImport() && type.getDatatype() instanceof UnsupportedType definition
                        && isKernelMetadata(definition.declaration())) {
                    KernelMetadataSymbol metadata = KernelMetadataSymbol.fromDeclaration(definition.declaration(), vocabulary);
                    table.replace(type, metadata);
                    extracted.add(metadata);
                }
            }
        }
        CompilerLogger.debug("Extracted {} kernel metadata type(s) with the '{}' vocabulary", extracted.size(),
                vocabulary.api());
        return extracted;
    }
}
