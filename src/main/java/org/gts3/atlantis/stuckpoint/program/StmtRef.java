package org.gts3.atlantis.stuckpoint.program;

import java.util.List;

/**
 * A statement of a method body.
 *
 * Statements compare by identity: two statements on the same line of the same method are
 * different statements. They carry their source line span and the methods control may enter from
 * them, and know the method they belong to.
 */
public final class StmtRef {
    private final ProgramMethod owner;
    private final int index;
    private final LineSpan span;
    private final boolean callSite;
    private final List<MethodSignature> callees;
    private final String text;

    StmtRef(ProgramMethod owner, int index, LineSpan span, boolean callSite, List<MethodSignature> callees, String text) {
        this.owner = owner;
        this.index = index;
        this.span = span;
        this.callSite = callSite;
        this.callees = List.copyOf(callees);
        this.text = text;
    }

    public ProgramMethod getOwner() {
        return owner;
    }

    /**
     * Position of the statement in its method body.
     */
    public int getIndex() {
        return index;
    }

    public LineSpan getSpan() {
        return span;
    }

    /**
     * Signatures of the methods this statement may transfer control to, including static
     * initializers it triggers. Callees outside the program have no counterpart in the view.
     */
    public List<MethodSignature> getCallees() {
        return callees;
    }

    public boolean isCallSite() {
        return callSite;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return owner.getSignature() + "#" + index + span + " " + text;
    }
}
