package org.gts3.atlantis.stuckpoint.program;

import java.util.List;

/**
 * Shorthands for building small in-memory programs in tests.
 */
public final class ProgramFixtures {

    private ProgramFixtures() {
    }

    public static MethodSignature voidMethod(String className, String name) {
        return new MethodSignature(className, name, "void", List.of());
    }

    public static Body body(ProgramModel.MethodBuilder method) {
        return new Body(method);
    }

    /**
     * Appends statements with fall-through edges between consecutive statements.
     */
    public static final class Body {
        private final ProgramModel.MethodBuilder method;
        private int last = -1;

        private Body(ProgramModel.MethodBuilder method) {
            this.method = method;
        }

        public Body stmt(int line) {
            return add(LineSpan.single(line), false, List.of());
        }

        public Body stmt(LineSpan span) {
            return add(span, false, List.of());
        }

        /**
         * Appends a call site with already resolved callees. Without callees it stands for a call
         * into code outside the program.
         */
        public Body call(int line, MethodSignature... callees) {
            return add(LineSpan.single(line), true, List.of(callees));
        }

        /**
         * Appends a statement that does not fall through from the previous one.
         */
        public Body detached(int line) {
            last = -1;
            return stmt(line);
        }

        public int lastIndex() {
            return last;
        }

        private Body add(LineSpan span, boolean callSite, List<MethodSignature> callees) {
            int index = method.addStatement(span, callSite, callees, "stmt" + method.statementCount() + span);
            if (last >= 0) {
                method.addEdge(last, index);
            }
            last = index;
            return this;
        }
    }
}
