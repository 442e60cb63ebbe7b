package org.gts3.atlantis.stuckpoint.icfg;

import java.util.List;

import org.gts3.atlantis.stuckpoint.callgraph.EntryPointSpec;
import org.gts3.atlantis.stuckpoint.program.LineSpan;
import org.gts3.atlantis.stuckpoint.program.ProgramMethod;
import org.gts3.atlantis.stuckpoint.program.ProgramModel;
import org.gts3.atlantis.stuckpoint.program.StmtRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.gts3.atlantis.stuckpoint.program.ProgramFixtures.body;
import static org.gts3.atlantis.stuckpoint.program.ProgramFixtures.voidMethod;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestInterproceduralCfg {
    private ProgramModel model;
    private InterproceduralCfg icfg;

    @BeforeEach
    public void setUp() throws Exception {
        ProgramModel.Builder program = ProgramModel.builder();
        ProgramModel.ClassBuilder main = program.addClass("demo.Main");
        ProgramModel.MethodBuilder entry = main.addMethod(voidMethod("demo.Main", "entry")).setStatic(true);
        body(entry).stmt(3).call(4, voidMethod("demo.Main", "callee")).stmt(LineSpan.of(5, 7));
        entry.addStatement(LineSpan.NO_POSITION, false, List.of(), "nop");
        entry.addEdge(2, 3);
        body(main.addMethod(voidMethod("demo.Main", "callee")).setStatic(true)).stmt(10).stmt(11);
        body(main.addMethod(voidMethod("demo.Main", "other")).setStatic(true)).stmt(6);
        model = program.build();

        icfg = InterproceduralCfg.of(model, EntryPointSpec.parse("demo.Main.entry"));
    }

    private ProgramMethod method(String name) {
        return model.findMethod(voidMethod("demo.Main", name));
    }

    @Test
    public void testIntraproceduralAndCallEdges() {
        List<StmtRef> stmts = method("entry").getStatements();
        ProgramMethod callee = method("callee");

        assertThat(icfg.successorsOf(stmts.get(0)), contains(stmts.get(1)));
        assertTrue(icfg.isCallSite(stmts.get(1)));
        assertFalse(icfg.isCallSite(stmts.get(0)));
        assertThat(icfg.calleesOf(stmts.get(1)), contains(callee));
        assertThat(icfg.entryStatementsOf(callee), contains(callee.getStatements().get(0)));
        assertSame(method("entry"), icfg.ownerOf(stmts.get(2)));
    }

    @Test
    public void testNoReturnEdgeFromCallee() {
        List<StmtRef> calleeStmts = method("callee").getStatements();
        assertThat(icfg.successorsOf(calleeStmts.get(1)), empty());
    }

    @Test
    public void testStatementsAtLineSpanMultipleMethodsAndLines() {
        StmtRef multiLine = method("entry").getStatements().get(2);
        StmtRef other = method("other").getStatements().get(0);

        assertThat(icfg.statementsAt("demo.Main", 5), contains(multiLine));
        assertThat(icfg.statementsAt("demo.Main", 6), containsInAnyOrder(multiLine, other));
        assertThat(icfg.statementsAt("demo.Main", 7), contains(multiLine));
        assertThat(icfg.statementsAt("demo.Main", 8), empty());
        assertThat(icfg.statementsAt("demo.Missing", 3), empty());
        assertThat(icfg.statementsAt("demo.Main", -1), empty());
    }
}
