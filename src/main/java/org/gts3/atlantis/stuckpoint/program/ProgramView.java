package org.gts3.atlantis.stuckpoint.program;

import java.util.Collection;

/**
 * Read-only, whole-program view of the classes under analysis.
 *
 * Implementations must be immutable once handed out, since the call graph, the ICFG and all
 * scoring threads read from the same view concurrently.
 */
public interface ProgramView {

    /**
     * @param className Fully qualified, dot separated class name
     * @return The class, or null if it is not part of the program
     */
    ProgramClass findClass(String className);

    Collection<ProgramClass> getClasses();

    /**
     * Looks up a method by its exact signature.
     *
     * @return The method, or null if the declaring class does not declare it
     */
    default ProgramMethod findMethod(MethodSignature signature) {
        ProgramClass programClass = findClass(signature.getDeclaringClass());
        return programClass == null ? null : programClass.getMethod(signature.getSubSignature());
    }
}
