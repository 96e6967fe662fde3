package se.kth.patchmerge.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.github.gumtreediff.tree.Tree;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import se.kth.patchmerge.matching.GumTreeMatcher;
import se.kth.patchmerge.merge.MergeConfig;
import se.kth.patchmerge.merge.MergeResult;
import se.kth.patchmerge.merge.PatchMerge;
import se.kth.patchmerge.merge.UnanchoredPolicy;
import se.kth.patchmerge.patch.PatchApplier;
import se.kth.patchmerge.render.TreeStringRenderer;
import se.kth.patchmerge.spoon.Parser;
import se.kth.patchmerge.util.LazyLogger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Command line interface for patchmerge.
 */
public class Cli {
    private static final LazyLogger LOGGER = new LazyLogger(Cli.class);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Merge()).execute(args);
        System.exit(exitCode);
    }

    @CommandLine.Command(
            name = "patchmerge",
            mixinStandardHelpOptions = true,
            description = "Merge a locally modified and a patched revision of a Java file with an AST-based "
                    + "three-way merge, and print the merged tree.",
            versionProvider = PatchMergeVersionProvider.class)
    static class Merge implements Callable<Integer> {
        @CommandLine.Parameters(
                index = "0",
                paramLabel = "BASELINE",
                description = "Path to the baseline revision")
        File baseline;

        @CommandLine.Parameters(
                index = "1",
                paramLabel = "MODIFIED",
                description = "Path to the locally modified revision")
        File modified;

        @CommandLine.Parameters(
                index = "2",
                arity = "0..1",
                paramLabel = "PATCHED",
                description = "Path to the patched revision. Required unless --patch is given.")
        File patched;

        @CommandLine.Option(
                names = {"-p", "--patch"},
                description = "Path to a unified diff to apply to BASELINE to obtain the patched revision.")
        File patch;

        @CommandLine.Option(
                names = {"-o", "--output"},
                description = "Path to the output file. Existing files are overwritten.")
        File out;

        @CommandLine.Option(
                names = {"--unanchored"},
                description = "What to do with new nodes that have no insertion point: ${COMPLETION-CANDIDATES}. "
                        + "Default: ${DEFAULT-VALUE}.",
                defaultValue = "REPORT")
        UnanchoredPolicy unanchoredPolicy;

        @CommandLine.Option(
                names = {"-m", "--matcher"},
                description = "Id of the GumTree matcher to use. Defaults to the classic GumTree matcher.")
        String matcherId;

        @CommandLine.Option(
                names = {"-c", "--comments"},
                description = "Keep comments as tree nodes")
        boolean comments;

        @CommandLine.Option(
                names = {"-r", "--show-revisions"},
                description = "Annotate merged nodes with the revision their content was taken from")
        boolean showRevisions;

        @CommandLine.Option(
                names = {"-l", "--logging"},
                description = "Enable logging output")
        boolean logging;

        @Override
        public Integer call() throws IOException {
            if (logging) {
                setLogLevel("DEBUG");
            }
            long start = System.nanoTime();

            MergeConfig config = MergeConfig.builder()
                    .unanchoredPolicy(unanchoredPolicy)
                    .matcherId(matcherId)
                    .includeComments(comments)
                    .build();
            LOGGER.debug(() -> "Using " + config);

            String baselineSource = Parser.read(baseline.toPath());
            String modifiedSource = Parser.read(modified.toPath());
            String patchedSource = readPatchedRevision(baselineSource);

            Tree baselineTree = Parser.parse(baselineSource, comments);
            Tree modifiedTree = Parser.parse(modifiedSource, comments);
            Tree patchedTree = Parser.parse(patchedSource, comments);

            PatchMerge merge = new PatchMerge(
                    GumTreeMatcher.fromId(matcherId), new TreeStringRenderer(showRevisions), config);
            MergeResult result = merge.mergeToTree(baselineTree, modifiedTree, patchedTree);
            String rendered = merge.render(result);

            if (out != null) {
                LOGGER.info(() -> "Writing merge to " + out);
                Files.write(
                        out.toPath(),
                        rendered.getBytes(StandardCharsets.UTF_8),
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING);
            } else {
                System.out.println(rendered);
            }

            result.getConflicts().forEach(conflict -> System.err.println("CONFLICT: " + conflict));
            result.getUnanchored().forEach(node -> System.err.println("UNANCHORED: " + node));

            LOGGER.info(() -> "Total time elapsed: " + (double) (System.nanoTime() - start) / 1e9 + " seconds");
            return (result.getConflicts().size() + result.getUnanchored().size()) % 127;
        }

        private String readPatchedRevision(String baselineSource) throws IOException {
            if (patch != null) {
                if (patched != null) {
                    throw new CommandLine.ParameterException(
                            new CommandLine(this), "PATCHED and --patch are mutually exclusive");
                }
                return PatchApplier.apply(baselineSource, Parser.read(patch.toPath()));
            } else if (patched == null) {
                throw new CommandLine.ParameterException(
                        new CommandLine(this), "Either PATCHED or --patch is required");
            }
            return Parser.read(patched.toPath());
        }
    }

    private static void setLogLevel(String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator jc = new JoranConfigurator();
        jc.setContext(context);
        context.reset();
        context.putProperty("root-level", level);
        try {
            jc.doConfigure(Objects.requireNonNull(Cli.class.getClassLoader().getResource("logback.xml")));
        } catch (JoranException e) {
            LOGGER.error(() -> "Failed to set log level", e);
        }
    }
}
