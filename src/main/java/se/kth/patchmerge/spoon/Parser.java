package se.kth.patchmerge.spoon;

import com.github.gumtreediff.tree.DefaultTree;
import com.github.gumtreediff.tree.Tree;
import com.github.gumtreediff.tree.TypeSet;
import gumtree.spoon.builder.SpoonGumTreeBuilder;
import org.eclipse.jdt.core.compiler.CategorizedProblem;
import se.kth.patchmerge.util.LazyLogger;
import se.kth.patchmerge.util.Trees;
import spoon.Launcher;
import spoon.SpoonException;
import spoon.SpoonModelBuilder;
import spoon.compiler.Environment;
import spoon.reflect.declaration.CtCompilationUnit;
import spoon.reflect.declaration.CtImport;
import spoon.reflect.declaration.CtPackage;
import spoon.reflect.declaration.CtType;
import spoon.support.compiler.VirtualFile;
import spoon.support.compiler.jdt.JDTBasedSpoonCompiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A class for parsing Java source code into GumTree trees, by way of Spoon.
 *
 * The root of a parsed tree is a {@code CompilationUnit} node. Its children are a {@code Package} node (absent for
 * the unnamed package), one {@code Import} node per import statement in source order, and then the declared types as
 * converted by gumtree-spoon-ast-diff's {@link SpoonGumTreeBuilder}.
 *
 * Spoon recovers from syntax errors in noclasspath mode, so the compiler's problems are checked after the model is
 * built and a source with any syntax error is rejected.
 */
public class Parser {
    public static final String COMPILATION_UNIT = "CompilationUnit";
    public static final String PACKAGE = "Package";
    public static final String IMPORT = "Import";

    private static final int COMPLIANCE_LEVEL = 17;

    private static final LazyLogger LOGGER = new LazyLogger(Parser.class);

    /**
     * Parse the contents of a single Java file, ignoring comments.
     *
     * @param source The contents of a single Java file.
     * @return The root of the tree, or null if the source is blank or cannot be parsed.
     */
    public static Tree parse(String source) {
        return parse(source, false);
    }

    /**
     * Parse the contents of a single Java file.
     *
     * @param source          The contents of a single Java file.
     * @param includeComments Whether to keep comments as tree nodes.
     * @return The root of the tree, or null if the source is blank, has syntax errors or cannot be parsed.
     */
    public static Tree parse(String source, boolean includeComments) {
        if (source == null || source.isBlank()) {
            LOGGER.error(() -> "Skipping parse: source is empty");
            return null;
        }

        Launcher launcher = new Launcher();
        Environment env = launcher.getEnvironment();
        env.setNoClasspath(true);
        env.setCommentEnabled(includeComments);
        env.setComplianceLevel(COMPLIANCE_LEVEL);
        launcher.addInputResource(new VirtualFile(source));

        try {
            launcher.buildModel();
        } catch (SpoonException e) {
            LOGGER.error(() -> "Failed to parse source: " + e.getMessage());
            LOGGER.debug(() -> "Parse failure", e);
            return null;
        }

        List<CategorizedProblem> syntaxErrors = syntaxErrors(launcher.getModelBuilder());
        if (!syntaxErrors.isEmpty()) {
            LOGGER.error(() -> "Failed to parse source: " + syntaxErrors.size() + " syntax error(s)");
            for (CategorizedProblem problem : syntaxErrors) {
                LOGGER.debug(() -> "line " + problem.getSourceLineNumber() + ": " + problem.getMessage());
            }
            return null;
        }

        Iterator<? extends CtCompilationUnit> units =
                launcher.getFactory().CompilationUnit().getMap().values().iterator();
        if (!units.hasNext()) {
            LOGGER.error(() -> "Failed to parse source: no compilation unit");
            return null;
        }

        Tree tree = toTree(units.next());
        LOGGER.debug(() -> "Parsed source into " + Trees.size(tree) + " nodes");
        return tree;
    }

    /**
     * Parse a Java file.
     *
     * @param javaFile        Path to a Java file.
     * @param includeComments Whether to keep comments as tree nodes.
     * @return The root of the tree, or null if the file cannot be read, is blank or cannot be parsed.
     */
    public static Tree parse(Path javaFile, boolean includeComments) {
        String source;
        try {
            source = read(javaFile);
        } catch (IOException e) {
            LOGGER.error(() -> "Failed to read " + javaFile + ": " + e.getMessage());
            return null;
        }
        return parse(source, includeComments);
    }

    /**
     * Read the contents of a file as UTF-8.
     *
     * @param path Path to a file.
     * @return The contents of the file.
     */
    public static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private static Tree toTree(CtCompilationUnit cu) {
        Tree root = new DefaultTree(TypeSet.type(COMPILATION_UNIT), "");

        CtPackage pkg = cu.getDeclaredPackage();
        if (pkg != null && !pkg.isUnnamedPackage()) {
            root.addChild(new DefaultTree(TypeSet.type(PACKAGE), pkg.getQualifiedName()));
        }

        for (CtImport imp : cu.getImports()) {
            root.addChild(new DefaultTree(TypeSet.type(IMPORT), importName(imp)));
        }

        for (CtType<?> type : cu.getDeclaredTypes()) {
            // the builder wraps each converted element in a synthetic root
            Tree wrapper = new SpoonGumTreeBuilder().getTree(type);
            for (Tree child : new ArrayList<>(wrapper.getChildren())) {
                root.addChild(child);
            }
        }
        return root;
    }

    private static List<CategorizedProblem> syntaxErrors(SpoonModelBuilder modelBuilder) {
        if (!(modelBuilder instanceof JDTBasedSpoonCompiler)) {
            return Collections.emptyList();
        }
        return ((JDTBasedSpoonCompiler) modelBuilder).getProblems().stream()
                .filter(problem -> problem.isError() && problem.getCategoryID() == CategorizedProblem.CAT_SYNTAX)
                .collect(Collectors.toList());
    }

    /**
     * @return The imported name, e.g. {@code java.util.List} or {@code static org.junit.Assert.*}.
     */
    private static String importName(CtImport imp) {
        String statement = imp.toString().trim();
        if (statement.startsWith("import ")) {
            statement = statement.substring("import ".length());
        }
        if (statement.endsWith(";")) {
            statement = statement.substring(0, statement.length() - 1);
        }
        return statement.trim();
    }
}
