package org.dxworks.cobolscope.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import org.dxworks.cobolscope.diagnostic.Diagnostic;
import org.dxworks.cobolscope.diagnostic.DiagnosticCategory;
import org.dxworks.cobolscope.source.UnitKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The consolidated, immutable model of one source unit: its division tree, data item table,
 * procedures with their control edges, and the diagnostics raised while building it.
 */
@JsonDeserialize(builder = ProgramModel.Builder.class)
public final class ProgramModel {

    private final String unitId;
    private final UnitKind kind;
    private final String programId;
    private final String contentHash;
    private final List<StructureNode> divisions;
    private final List<DataItem> dataItems;
    private final List<FileControl> fileControls;
    private final List<FileDescriptor> fileDescriptors;
    private final List<ProcedureNode> procedures;
    private final List<String> copybooks;
    private final List<String> procedureUsing;
    private final String procedureReturning;
    private final List<String> execKinds;
    private final List<SymbolOccurrence> symbols;
    private final List<Diagnostic> diagnostics;
    private final ProgramMetrics metrics;

    private final DataItemTable dataItemTable;
    private final Map<String, ProcedureNode> proceduresById;

    private ProgramModel(Builder b) {
        this.unitId = b.unitId;
        this.kind = b.kind;
        this.programId = b.programId;
        this.contentHash = b.contentHash;
        this.divisions = List.copyOf(b.divisions);
        this.dataItems = List.copyOf(b.dataItems);
        this.fileControls = List.copyOf(b.fileControls);
        this.fileDescriptors = List.copyOf(b.fileDescriptors);
        this.procedures = List.copyOf(b.procedures);
        this.copybooks = List.copyOf(b.copybooks);
        this.procedureUsing = List.copyOf(b.procedureUsing);
        this.procedureReturning = b.procedureReturning;
        this.execKinds = List.copyOf(b.execKinds);
        this.symbols = List.copyOf(b.symbols);
        this.diagnostics = List.copyOf(b.diagnostics);
        this.metrics = b.metrics;

        this.dataItemTable = new DataItemTable(dataItems);
        Map<String, ProcedureNode> byId = new LinkedHashMap<>();
        for (ProcedureNode procedure : procedures) {
            byId.put(procedure.getId(), procedure);
        }
        this.proceduresById = Collections.unmodifiableMap(byId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getUnitId() {
        return unitId;
    }

    public UnitKind getKind() {
        return kind;
    }

    public String getProgramId() {
        return programId;
    }

    /**
     * SHA-256 of the expanded source the model was built from.
     */
    public String getContentHash() {
        return contentHash;
    }

    public List<StructureNode> getDivisions() {
        return divisions;
    }

    public List<DataItem> getDataItems() {
        return dataItems;
    }

    public List<FileControl> getFileControls() {
        return fileControls;
    }

    public List<FileDescriptor> getFileDescriptors() {
        return fileDescriptors;
    }

    public List<ProcedureNode> getProcedures() {
        return procedures;
    }

    /**
     * Member names of every COPY directive, resolved or not, in source order without repeats.
     */
    public List<String> getCopybooks() {
        return copybooks;
    }

    public List<String> getProcedureUsing() {
        return procedureUsing;
    }

    public String getProcedureReturning() {
        return procedureReturning;
    }

    /**
     * Kinds of embedded EXEC blocks (SQL, CICS, DLI ...), sorted.
     */
    public List<String> getExecKinds() {
        return execKinds;
    }

    public List<SymbolOccurrence> getSymbols() {
        return symbols;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public ProgramMetrics getMetrics() {
        return metrics;
    }

    @JsonIgnore
    public DataItemTable getDataItemTable() {
        return dataItemTable;
    }

    @JsonIgnore
    public List<Edge> getEdges() {
        return procedures.stream().flatMap(p -> p.getEdges().stream()).collect(Collectors.toList());
    }

    public Optional<ProcedureNode> procedure(String id) {
        return Optional.ofNullable(proceduresById.get(id));
    }

    public Optional<DataItem> dataItem(Integer index) {
        if (index == null || index < 0 || index >= dataItems.size()) {
            return Optional.empty();
        }
        return Optional.of(dataItems.get(index));
    }

    /**
     * The procedure control enters first when the program is called: the first procedure outside
     * DECLARATIVES.
     */
    public Optional<ProcedureNode> entryProcedure() {
        return procedures.stream().filter(p -> !p.isDeclarative()).findFirst();
    }

    /**
     * True when any non-informational diagnostic was recorded.
     */
    public boolean hasDiagnostics() {
        return diagnostics.stream().anyMatch(d -> d.getCategory() != DiagnosticCategory.INFORMATIONAL);
    }

    @Override
    public String toString() {
        return "ProgramModel{" + unitId + (programId != null ? ", " + programId : "") + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String unitId;
        private UnitKind kind = UnitKind.PROGRAM;
        private String programId;
        private String contentHash;
        private List<StructureNode> divisions = new ArrayList<>();
        private List<DataItem> dataItems = new ArrayList<>();
        private List<FileControl> fileControls = new ArrayList<>();
        private List<FileDescriptor> fileDescriptors = new ArrayList<>();
        private List<ProcedureNode> procedures = new ArrayList<>();
        private List<String> copybooks = new ArrayList<>();
        private List<String> procedureUsing = new ArrayList<>();
        private String procedureReturning;
        private List<String> execKinds = new ArrayList<>();
        private List<SymbolOccurrence> symbols = new ArrayList<>();
        private List<Diagnostic> diagnostics = new ArrayList<>();
        private ProgramMetrics metrics;

        public Builder unitId(String unitId) {
            this.unitId = unitId;
            return this;
        }

        public Builder kind(UnitKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder programId(String programId) {
            this.programId = programId;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder divisions(List<StructureNode> divisions) {
            this.divisions = new ArrayList<>(divisions);
            return this;
        }

        public Builder dataItems(List<DataItem> dataItems) {
            this.dataItems = new ArrayList<>(dataItems);
            return this;
        }

        public Builder fileControls(List<FileControl> fileControls) {
            this.fileControls = new ArrayList<>(fileControls);
            return this;
        }

        public Builder fileDescriptors(List<FileDescriptor> fileDescriptors) {
            this.fileDescriptors = new ArrayList<>(fileDescriptors);
            return this;
        }

        public Builder procedures(List<ProcedureNode> procedures) {
            this.procedures = new ArrayList<>(procedures);
            return this;
        }

        public Builder copybooks(List<String> copybooks) {
            this.copybooks = new ArrayList<>(copybooks);
            return this;
        }

        public Builder procedureUsing(List<String> procedureUsing) {
            this.procedureUsing = new ArrayList<>(procedureUsing);
            return this;
        }

        public Builder procedureReturning(String procedureReturning) {
            this.procedureReturning = procedureReturning;
            return this;
        }

        public Builder execKinds(List<String> execKinds) {
            this.execKinds = new ArrayList<>(execKinds);
            return this;
        }

        public Builder symbols(List<SymbolOccurrence> symbols) {
            this.symbols = new ArrayList<>(symbols);
            return this;
        }

        public Builder diagnostics(List<Diagnostic> diagnostics) {
            this.diagnostics = new ArrayList<>(diagnostics);
            return this;
        }

        public Builder metrics(ProgramMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public ProgramModel build() {
            return new ProgramModel(this);
        }
    }
}
