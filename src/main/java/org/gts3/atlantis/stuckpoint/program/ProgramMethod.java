package org.gts3.atlantis.stuckpoint.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A method of the analysed program together with its intraprocedural control-flow graph.
 *
 * Abstract and native methods, and methods whose body could not be loaded, have no statements and
 * no entry statements.
 */
public final class ProgramMethod {
    private final MethodSignature signature;
    private final boolean isStatic;
    private final boolean isAbstract;
    private final List<StmtRef> statements;
    private final List<List<StmtRef>> successors;
    private final List<StmtRef> entryStatements;

    ProgramMethod(MethodSignature signature, boolean isStatic, boolean isAbstract, ProgramModel.MethodBuilder body) {
        this.signature = signature;
        this.isStatic = isStatic;
        this.isAbstract = isAbstract;

        List<StmtRef> stmts = new ArrayList<>(body.spans.size());
        for (int i = 0; i < body.spans.size(); i++) {
            stmts.add(new StmtRef(this, i, body.spans.get(i), body.callSites.get(i), body.callees.get(i), body.texts.get(i)));
        }
        this.statements = Collections.unmodifiableList(stmts);

        List<List<StmtRef>> succs = new ArrayList<>(stmts.size());
        for (List<Integer> targets : body.successors) {
            List<StmtRef> resolved = new ArrayList<>(targets.size());
            for (int target : targets) {
                resolved.add(stmts.get(target));
            }
            succs.add(Collections.unmodifiableList(resolved));
        }
        this.successors = Collections.unmodifiableList(succs);

        List<StmtRef> entries = new ArrayList<>();
        if (body.entries.isEmpty() && !stmts.isEmpty()) {
            entries.add(stmts.get(0));
        }
        for (int entry : body.entries) {
            entries.add(stmts.get(entry));
        }
        this.entryStatements = Collections.unmodifiableList(entries);
    }

    public MethodSignature getSignature() {
        return signature;
    }

    public String getDeclaringClassName() {
        return signature.getDeclaringClass();
    }

    public String getName() {
        return signature.getName();
    }

    public boolean isStatic() {
        return isStatic;
    }

    /**
     * A method that cannot be executed directly, i.e. abstract or native.
     */
    public boolean isAbstract() {
        return isAbstract;
    }

    public List<StmtRef> getStatements() {
        return statements;
    }

    public List<StmtRef> getEntryStatements() {
        return entryStatements;
    }

    /**
     * Intraprocedural successors of a statement of this method.
     *
     * @throws IllegalArgumentException If the statement belongs to another method
     */
    public List<StmtRef> successorsOf(StmtRef stmt) {
        if (stmt.getOwner() != this) {
            throw new IllegalArgumentException(stmt + " does not belong to " + signature);
        }
        return successors.get(stmt.getIndex());
    }

    @Override
    public String toString() {
        return signature.toString();
    }
}
