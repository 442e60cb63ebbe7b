package org.gts3.atlantis.stuckpoint.program.soot;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.gts3.atlantis.stuckpoint.AnalysisException;
import org.gts3.atlantis.stuckpoint.AnalyzerConfig;
import org.gts3.atlantis.stuckpoint.callgraph.EntryPointSpec;
import org.gts3.atlantis.stuckpoint.icfg.InterproceduralCfg;
import org.gts3.atlantis.stuckpoint.icfg.InterproceduralCfgFactory;
import org.gts3.atlantis.stuckpoint.program.LineSpan;
import org.gts3.atlantis.stuckpoint.program.MethodSignature;
import org.gts3.atlantis.stuckpoint.program.ProgramLoadException;
import org.gts3.atlantis.stuckpoint.program.ProgramMethod;
import org.gts3.atlantis.stuckpoint.program.ProgramModel;
import org.gts3.atlantis.stuckpoint.utils.FileUtils;
import org.objectweb.asm.ClassReader;
import soot.Body;
import soot.G;
import soot.Scene;
import soot.SootClass;
import soot.SootMethod;
import soot.Type;
import soot.Unit;
import soot.jimple.toolkits.callgraph.CHATransformer;
import soot.jimple.toolkits.callgraph.Edge;
import soot.jimple.toolkits.ide.icfg.JimpleBasedInterproceduralCFG;
import soot.options.Options;
import soot.tagkit.SourceLnPosTag;
import soot.tagkit.Tag;

import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_ERROR;
import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_WARN;

/**
 * Loads binaries with Soot, builds a CHA call graph from the entry point and snapshots Soot's
 * interprocedural CFG into an immutable {@link InterproceduralCfg}.
 *
 * Only application classes keep their bodies. All other classes are set to phantom before the
 * call graph is built, so calls into libraries are leaves. Soot keeps its state in process-wide
 * singletons, so loads are serialized and nothing of Soot escapes the returned graph.
 */
public class SootProgramLoader implements InterproceduralCfgFactory {
    private static final Object SOOT_LOCK = new Object();

    private final AnalyzerConfig config;

    public SootProgramLoader(AnalyzerConfig config) {
        this.config = config;
    }

    @Override
    public InterproceduralCfg load(List<Path> binaries, EntryPointSpec entryPoint) throws AnalysisException {
        List<String> processDirs = new ArrayList<>();
        Path stagingDir = null;
        int stagedClasses = 0;
        try {
            for (Path binary : binaries) {
                if (!Files.exists(binary)) {
                    System.err.println(LOG_WARN + "Skipping missing binary for static analysis: " + binary);
                } else if (isClassFile(binary)) {
                    if (stagingDir == null) {
                        stagingDir = Files.createTempDirectory("stuck-point-classes");
                    }
                    if (stageClassFile(binary, stagingDir)) {
                        stagedClasses++;
                    }
                } else {
                    processDirs.add(binary.toAbsolutePath().toString());
                }
            }
            if (stagedClasses > 0) {
                processDirs.add(stagingDir.toAbsolutePath().toString());
            }
            if (processDirs.isEmpty()) {
                throw new ProgramLoadException("None of the binaries can be loaded for static analysis: " + binaries);
            }
            return buildIcfg(processDirs, entryPoint);
        } catch (IOException e) {
            throw new ProgramLoadException("Failed to stage class files for static analysis", e);
        } finally {
            if (stagingDir != null) {
                FileUtils.deleteRecursively(stagingDir);
            }
        }
    }

    private InterproceduralCfg buildIcfg(List<String> processDirs, EntryPointSpec entryPoint) throws AnalysisException {
        synchronized (SOOT_LOCK) {
            long startTime = System.currentTimeMillis();
            try {
                setupSoot(processDirs);
                Scene.v().loadNecessaryClasses();

                List<SootClass> applicationClasses = retrieveApplicationBodies();
                setLibraryClassesAsPhantom();

                Map<MethodSignature, SootMethod> sootMethods = new HashMap<>();
                ProgramModel declarations = snapshot(applicationClasses, null, sootMethods);
                ProgramMethod entryMethod = entryPoint.resolve(declarations);
                System.out.println("Resolved entry point " + entryPoint + " to " + entryMethod.getSignature());

                Scene.v().setEntryPoints(Collections.singletonList(sootMethods.get(entryMethod.getSignature())));
                CHATransformer.v().transform();
                JimpleBasedInterproceduralCFG sootIcfg = new JimpleBasedInterproceduralCFG(false, false);

                ProgramModel model = snapshot(applicationClasses, sootIcfg, new HashMap<>());
                InterproceduralCfg icfg = InterproceduralCfg.of(model, EntryPointSpec.of(entryMethod.getSignature()));

                long endTime = System.currentTimeMillis();
                System.out.println("Loaded " + model.getClasses().size() + " classes (" + model.methodCount()
                        + " methods) and built the ICFG in " + ((endTime - startTime) / 1000.0) + " seconds");
                return icfg;
            } catch (RuntimeException e) {
                System.err.println(LOG_ERROR + "Soot failed to load the program: " + e.getMessage());
                throw new ProgramLoadException("Failed to load program from " + processDirs, e);
            } finally {
                G.reset();
            }
        }
    }

    private static boolean isClassFile(Path binary) {
        return Files.isRegularFile(binary) && binary.getFileName().toString().endsWith(".class");
    }

    /**
     * Copies a single class file below {@code stagingDir} at the path its class name implies, so
     * that Soot can load it as part of a class directory.
     *
     * @return false if the file is not a readable class file
     */
    private boolean stageClassFile(Path classFile, Path stagingDir) throws IOException {
        byte[] bytes = Files.readAllBytes(classFile);
        String internalName;
        try {
            internalName = new ClassReader(bytes).getClassName();
        } catch (RuntimeException e) {
            System.err.println(LOG_WARN + "Skipping unreadable class file for static analysis: " + classFile);
            return false;
        }
        Path target = stagingDir.resolve(internalName + ".class");
        Files.createDirectories(target.getParent());
        Files.write(target, bytes);
        if (config.isVerbose()) {
            System.out.println("Staged " + classFile + " as " + internalName.replace('/', '.'));
        }
        return true;
    }

    private void setupSoot(List<String> processDirs) {
        G.reset();

        Options.v().set_keep_line_number(true);
        Options.v().set_whole_program(true);
        Options.v().set_allow_phantom_refs(true);  // Allow unresolved classes
        Options.v().set_prepend_classpath(true);  // Prepend the soot classpath to the default class path
        Options.v().set_ignore_classpath_errors(true);
        Options.v().set_src_prec(Options.src_prec_only_class);
        Options.v().set_output_format(Options.output_format_none);
        Options.v().set_process_dir(processDirs);

        List<String> classpath = new ArrayList<>(processDirs);
        for (Path entry : config.getLibraryClasspath()) {
            if (Files.exists(entry)) {
                classpath.add(entry.toAbsolutePath().toString());
            } else {
                System.err.println(LOG_WARN + "Ignoring missing classpath entry: " + entry);
            }
        }
        Options.v().set_soot_classpath(String.join(File.pathSeparator, classpath));

        if (config.isVerbose()) {
            System.out.println("Soot process dirs: " + processDirs);
            System.out.println("Soot classpath: " + classpath);
        }
    }

    /**
     * Retrieves the bodies of all concrete application methods. This has to happen before library
     * classes become phantom.
     */
    private List<SootClass> retrieveApplicationBodies() {
        List<SootClass> applicationClasses = new ArrayList<>();
        int failedBodies = 0;
        for (SootClass sootClass : new ArrayList<>(Scene.v().getApplicationClasses())) {
            if (sootClass.isPhantom()) {
                continue;
            }
            applicationClasses.add(sootClass);
            for (SootMethod sootMethod : new ArrayList<>(sootClass.getMethods())) {
                if (!sootMethod.isConcrete() || sootMethod.hasActiveBody()) {
                    continue;
                }
                try {
                    sootMethod.retrieveActiveBody();
                } catch (RuntimeException e) {
                    failedBodies++;
                    if (config.isVerbose()) {
                        System.err.println(LOG_WARN + "Could not retrieve body of " + sootMethod.getSignature() + ": " + e.getMessage());
                    }
                }
            }
        }
        if (failedBodies > 0) {
            System.err.println(LOG_WARN + "Could not retrieve " + failedBodies + " method bodies, treating them as empty");
        }
        return applicationClasses;
    }

    private void setLibraryClassesAsPhantom() {
        int phantomCount = 0;
        for (SootClass sootClass : new ArrayList<>(Scene.v().getClasses())) {
            if (sootClass.isApplicationClass() || sootClass.isPhantom()) {
                continue;
            }
            try {
                sootClass.setPhantomClass();
                for (SootMethod sootMethod : sootClass.getMethods()) {
                    sootMethod.setPhantom(true);
                }
                phantomCount++;
            } catch (RuntimeException e) {
                System.err.println(LOG_WARN + "Error setting class " + sootClass.getName() + " as phantom: " + e.getMessage());
            }
        }
        if (config.isVerbose()) {
            System.out.println("Total library classes marked as phantom: " + phantomCount);
        }
    }

    /**
     * Copies the application classes into a model. Without an ICFG only declarations are copied,
     * which is enough to resolve the entry point.
     *
     * @param sootMethods Receives the Soot method behind every copied signature
     */
    private static ProgramModel snapshot(List<SootClass> applicationClasses, JimpleBasedInterproceduralCFG icfg,
                                         Map<MethodSignature, SootMethod> sootMethods) {
        ProgramModel.Builder builder = ProgramModel.builder();
        for (SootClass sootClass : applicationClasses) {
            ProgramModel.ClassBuilder classBuilder = builder.addClass(sootClass.getName());
            for (SootMethod sootMethod : new ArrayList<>(sootClass.getMethods())) {
                MethodSignature signature = signatureOf(sootMethod);
                sootMethods.put(signature, sootMethod);
                ProgramModel.MethodBuilder methodBuilder = classBuilder.addMethod(signature)
                        .setStatic(sootMethod.isStatic())
                        .setAbstract(!sootMethod.isConcrete());
                if (icfg != null && sootMethod.hasActiveBody()) {
                    addBody(methodBuilder, sootMethod, icfg);
                }
            }
        }
        return builder.build();
    }

    private static void addBody(ProgramModel.MethodBuilder methodBuilder, SootMethod sootMethod,
                                JimpleBasedInterproceduralCFG icfg) {
        // The ICFG only knows the owners of units in reachable methods
        icfg.initializeUnitToOwner(sootMethod);

        Body body = sootMethod.getActiveBody();
        Map<Unit, Integer> indices = new IdentityHashMap<>();
        for (Unit unit : body.getUnits()) {
            boolean callSite = icfg.isCallStmt(unit);
            indices.put(unit, methodBuilder.addStatement(spanOf(unit), callSite, calleesOf(unit, callSite, icfg), unit.toString()));
        }
        for (Unit unit : body.getUnits()) {
            int from = indices.get(unit);
            for (Unit successor : icfg.getSuccsOf(unit)) {
                methodBuilder.addEdge(from, indices.get(successor));
            }
        }
        for (Unit start : icfg.getStartPointsOf(sootMethod)) {
            methodBuilder.addEntry(indices.get(start));
        }
    }

    private static List<MethodSignature> calleesOf(Unit unit, boolean callSite, JimpleBasedInterproceduralCFG icfg) {
        Set<MethodSignature> callees = new LinkedHashSet<>();
        if (callSite) {
            for (SootMethod callee : icfg.getCalleesOfCallAt(unit)) {
                callees.add(signatureOf(callee));
            }
        }
        // Allocations and static field accesses are not calls but still run static initializers
        Iterator<Edge> edges = Scene.v().getCallGraph().edgesOutOf(unit);
        while (edges.hasNext()) {
            Edge edge = edges.next();
            if (edge.kind().isClinit() && !edge.tgt().isPhantom()) {
                callees.add(signatureOf(edge.tgt()));
            }
        }
        return new ArrayList<>(callees);
    }

    static LineSpan spanOf(Unit unit) {
        int firstLine = unit.getJavaSourceStartLineNumber();
        if (firstLine <= 0) {
            return LineSpan.NO_POSITION;
        }
        int lastLine = firstLine;
        Tag tag = unit.getTag("SourceLnPosTag");
        if (tag instanceof SourceLnPosTag) {
            lastLine = Math.max(firstLine, ((SourceLnPosTag) tag).endLn());
        }
        return LineSpan.of(firstLine, lastLine);
    }

    private static MethodSignature signatureOf(SootMethod sootMethod) {
        return new MethodSignature(sootMethod.getDeclaringClass().getName(), sootMethod.getName(),
                sootMethod.getReturnType().toString(), typeNames(sootMethod.getParameterTypes()));
    }

    private static List<String> typeNames(List<Type> types) {
        List<String> names = new ArrayList<>(types.size());
        for (Type type : types) {
            names.add(type.toString());
        }
        return names;
    }
}
