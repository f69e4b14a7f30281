package org.dxworks.cobolscope.builder;

import org.dxworks.cobolscope.diagnostic.DiagnosticCollector;
import org.dxworks.cobolscope.model.Complexity;
import org.dxworks.cobolscope.model.DataItem;
import org.dxworks.cobolscope.model.DataItemTable;
import org.dxworks.cobolscope.model.FileControl;
import org.dxworks.cobolscope.model.FileDescriptor;
import org.dxworks.cobolscope.model.ProcedureNode;
import org.dxworks.cobolscope.model.ProgramMetrics;
import org.dxworks.cobolscope.model.ProgramModel;
import org.dxworks.cobolscope.model.StructureNode;
import org.dxworks.cobolscope.model.SymbolKind;
import org.dxworks.cobolscope.model.SymbolOccurrence;
import org.dxworks.cobolscope.model.SymbolRole;
import org.dxworks.cobolscope.parser.ast.CompilationUnitNode;
import org.dxworks.cobolscope.parser.ast.DivisionKind;
import org.dxworks.cobolscope.parser.ast.DivisionNode;
import org.dxworks.cobolscope.preprocessor.PreprocessedSource;
import org.dxworks.cobolscope.source.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the {@link ProgramModel} of one unit from its parse tree in two passes: the data
 * division first, so that the procedure division can resolve data names against the finished
 * item table.
 */
public class ProgramModelBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ProgramModelBuilder.class);

    public ProgramModel build(CompilationUnitNode ast, PreprocessedSource source, DiagnosticCollector diagnostics) {
        SourceUnit unit = source.getUnit();

        List<StructureNode> divisions = new ArrayList<>();
        StructureMirror mirror = new StructureMirror();
        for (DivisionNode division : ast.getDivisions()) {
            divisions.add(division.accept(mirror));
        }

        List<SymbolOccurrence> symbols = new ArrayList<>();
        ast.getProgramId().ifPresent(id -> {
            if (ast.getProgramIdRange() != null) {
                symbols.add(new SymbolOccurrence(id, ast.getProgramIdRange(), SymbolRole.DEFINITION,
                        SymbolKind.PROGRAM, DivisionKind.IDENTIFICATION.name() + "/PROGRAM-ID"));
            }
        });

        FileControlPass fileControlPass = new FileControlPass();
        List<FileControl> fileControls = fileControlPass.run(ast.division(DivisionKind.ENVIRONMENT));
        symbols.addAll(fileControlPass.getSymbols());

        DataDivisionPass dataPass = new DataDivisionPass(diagnostics, ast.isFragment());
        List<DataItem> dataItems = dataPass.run(ast.division(DivisionKind.DATA));
        List<FileDescriptor> fileDescriptors = dataPass.getFileDescriptors();
        symbols.addAll(dataPass.getSymbols());

        Set<String> fileNames = new HashSet<>();
        fileControls.forEach(fc -> fileNames.add(fc.getFileName()));
        fileDescriptors.forEach(fd -> fileNames.add(fd.getFileName()));
        Set<String> indexNames = new HashSet<>();
        for (DataItem item : dataItems) {
            if (item.getOccurs() != null) {
                indexNames.addAll(item.getOccurs().getIndexedBy());
            }
        }

        DataItemTable table = new DataItemTable(dataItems);
        ProcedureDivisionPass procedurePass = new ProcedureDivisionPass(table, fileNames, indexNames, diagnostics);
        List<ProcedureNode> procedures = procedurePass.run(ast.division(DivisionKind.PROCEDURE));
        symbols.addAll(procedurePass.getSymbols());
        symbols.sort((a, b) -> a.getRange().compareTo(b.getRange()));

        int lineCount = unit.getLines().size();
        int score = procedurePass.getDecisionPoints() + dataItems.size();
        ProgramMetrics metrics = new ProgramMetrics(lineCount, procedurePass.getStatementCount(),
                procedurePass.getDecisionPoints(), dataItems.size(), Complexity.of(score));

        Set<String> copybooks = new LinkedHashSet<>();
        for (String member : source.getCopyMembers()) {
            copybooks.add(member.toUpperCase(Locale.ROOT));
        }

        ProgramModel model = ProgramModel.builder()
                .unitId(unit.getId())
                .kind(unit.getKind())
                .programId(ast.getProgramId().orElse(null))
                .contentHash(source.getContentHash())
                .divisions(divisions)
                .dataItems(dataItems)
                .fileControls(fileControls)
                .fileDescriptors(fileDescriptors)
                .procedures(procedures)
                .copybooks(new ArrayList<>(copybooks))
                .procedureUsing(procedurePass.getUsing())
                .procedureReturning(procedurePass.getReturning())
                .execKinds(procedurePass.getExecKinds())
                .symbols(symbols)
                .diagnostics(diagnostics.all())
                .metrics(metrics)
                .build();
        LOG.debug("Built model for {}: {} data items, {} procedures, {} diagnostics", unit.getId(),
                dataItems.size(), procedures.size(), model.getDiagnostics().size());
        return model;
    }
}
