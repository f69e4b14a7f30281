package org.dxworks.cobolscope.ingest;

import org.dxworks.cobolscope.CobolScopeConfig;
import org.dxworks.cobolscope.builder.ProgramModelBuilder;
import org.dxworks.cobolscope.dialect.DialectOptions;
import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.lexer.CobolLexer;
import org.dxworks.cobolscope.lexer.Token;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.parser.CobolParser;
import org.dxworks.cobolscope.parser.ast.CompilationUnitNode;
import org.dxworks.cobolscope.preprocessor.CobolPreprocessor;
import org.dxworks.cobolscope.preprocessor.CopybookRepository;
import org.dxworks.cobolscope.preprocessor.CopybookResolver;
import org.dxworks.cobolscope.preprocessor.PreprocessedSource;
import org.dxworks.cobolscope.source.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Preprocessor, lexer, parser and model builder chained for one unit. Instances only hold
 * read-only configuration and may be shared by concurrent ingestion threads.
 */
public class UnitPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(UnitPipeline.class);

    private final CobolPreprocessor preprocessor;
    private final DialectOptions dialect;
    private final CobolParser parser;
    private final ProgramModelBuilder builder = new ProgramModelBuilder();

    public UnitPipeline(CopybookResolver resolver, DialectOptions dialect) {
        this.preprocessor = new CobolPreprocessor(resolver, dialect);
        this.dialect = dialect;
        this.parser = new CobolParser(dialect);
    }

    public static UnitPipeline fromConfig(CobolScopeConfig config) {
        CopybookRepository repository = new CopybookRepository(config.getCopybookPaths(),
                config.getCopybookExtensions());
        LOG.info("Indexed {} copybooks from {} search path entries", repository.size(),
                config.getCopybookPaths().size());
        return new UnitPipeline(repository, config.getDialect());
    }

    public PreprocessedSource preprocess(SourceUnit unit, DiagnosticCollector diagnostics) {
        return preprocessor.process(unit, diagnostics);
    }

    public List<Token> tokenize(PreprocessedSource source, DiagnosticCollector diagnostics) {
        return new CobolLexer(source.getUnit().getId(), dialect, diagnostics).tokenize(source.getLines());
    }

    /**
     * Lexes, parses and builds the model of an already expanded unit.
     *
     * @throws org.dxworks.cobolscope.exception.UnitFailedException when the unit has no usable structure
     */
    public ProgramModel build(PreprocessedSource source, DiagnosticCollector diagnostics) {
        List<Token> tokens = tokenize(source, diagnostics);
        LOG.debug("Lexed {} into {} tokens", source.getUnit().getId(), tokens.size());
        CompilationUnitNode ast = parser.parse(source.getUnit(), tokens, diagnostics);
        return builder.build(ast, source, diagnostics);
    }

    public ProgramModel run(SourceUnit unit, DiagnosticCollector diagnostics) {
        return build(preprocess(unit, diagnostics), diagnostics);
    }
}
