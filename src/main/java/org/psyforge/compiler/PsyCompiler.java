package org.psyforge.compiler;

import org.psyforge.compiler.api.CompilationException;
import org.psyforge.compiler.api.ICompiler;
import org.psyforge.compiler.api.PsyirException;
import org.psyforge.compiler.backend.FortranWriter;
import org.psyforge.compiler.config.CompilerConfig;
import org.psyforge.compiler.config.LoggingConfigurator;
import org.psyforge.compiler.diagnostics.CompilerLogger;
import org.psyforge.compiler.diagnostics.DiagnosticsEngine;
import org.psyforge.compiler.frontend.FortranReader;
import org.psyforge.compiler.ir.Container;
import org.psyforge.compiler.metadata.KernelMetadataExtractor;
import org.psyforge.compiler.metadata.KernelMetadataSymbol;
import org.psyforge.compiler.metadata.MetadataVocabulary;
import org.psyforge.compiler.symbols.NameSpace;
import org.psyforge.compiler.symbols.families.TypeFamilyRegistry;
import org.psyforge.compiler.transformations.LoopSpecializationTrans;
import org.psyforge.compiler.transformations.ProfilingInstrumenter;

import java.util.List;
import java.util.Set;

/**
 * The main compiler implementation. It reads Fortran source, parses the kernel metadata it
 * declares, specialises the loops of the model domain, adds the configured profiling regions and
 * writes the result back as Fortran. It is not thread-safe.
 */
public class PsyCompiler implements ICompiler {

    /** Names of the LFRic kind parameters; generated names must not shadow them. */
    private static final Set<String> KIND_NAMES = Set.copyOf(TypeFamilyRegistry.lfric().kindSymbols().keySet());

    private final CompilerConfig config;
    private int verbosity = -1;
    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private NameSpace nameSpace;
    private List<KernelMetadataSymbol> kernelMetadata = List.of();

    /**
     * Creates a compiler with the configuration found by {@link CompilerConfig#load()}.
     */
    public PsyCompiler() {
        this(CompilerConfig.load());
    }

    /**
     * @param config The configuration to compile with.
     */
    public PsyCompiler(CompilerConfig config) {
        this.config = config;
        LoggingConfigurator.configure(config.raw());
    }

    /**
     * {@inheritDoc}
     * <p>
     * Every call is an independent run with its own diagnostics and name space.
     */
    @Override
    public String compile(List<String> sourceLines, String programName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        diagnostics = new DiagnosticsEngine();
        nameSpace = new NameSpace();
        kernelMetadata = List.of();
        KIND_NAMES.forEach(nameSpace::reserve);

        // Phase 1: Reading
        String source = String.join("\n", sourceLines) + "\n";
        Container tree;
        try {
            tree = new FortranReader(diagnostics, programName).psyirFromSource(source);
        } catch (PsyirException e) {
            throw new CompilationException("Failed to read " + programName + ": " + e.getMessage(), e);
        }
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }

        try {
            // Phase 2: Kernel metadata
            MetadataVocabulary vocabulary = MetadataVocabulary.fromConfig(config, config.getMetadataApi());
            kernelMetadata = List.copyOf(new KernelMetadataExtractor(vocabulary).extract(tree));

            // Phase 3: Loop specialisation
            if (config.isSpecializeLoops()) {
                new LoopSpecializationTrans(config.getLoopTypes()).apply(tree);
            }

            // Phase 4: Profiling
            if (!config.getProfilingOptions().options().isEmpty()) {
                new ProfilingInstrumenter(config.getProfilingOptions(), nameSpace).instrument(tree);
            }

            // Phase 5: Writing
            String output = new FortranWriter().write(tree);
            CompilerLogger.info("Compiled {} ({} line(s) in, {} line(s) out)", programName, sourceLines.size(),
                    output.lines().count());
            return output;
        } catch (PsyirException e) {
            throw new CompilationException("Failed to compile " + programName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    /**
     * @return The diagnostics of the last run, including warnings of a successful run.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The name space of the last run, or null before the first run.
     */
    public NameSpace getNameSpace() {
        return nameSpace;
    }

    /**
     * @return The kernel metadata types found by the last run, in tree order.
     */
    public List<KernelMetadataSymbol> getKernelMetadata() {
        return kernelMetadata;
    }
}
