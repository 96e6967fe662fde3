package se.kth.patchmerge.patch;

import org.eclipse.jgit.api.ApplyResult;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.util.FileUtils;
import se.kth.patchmerge.exception.PatchException;
import se.kth.patchmerge.util.LazyLogger;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derives the patched revision of a file by applying a unified diff to its baseline revision.
 *
 * The diff is applied by JGit in a throwaway repository that holds the baseline as its only commit, so the usual
 * Git patch semantics (context matching, hunk offsets) apply.
 */
public class PatchApplier {
    private static final LazyLogger LOGGER = new LazyLogger(PatchApplier.class);

    private static final String TARGET_MARKER = "+++ b/";
    private static final String IDENTITY = "patchmerge";
    private static final Pattern HUNK_HEADER = Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@");

    /**
     * Apply a single-file unified diff to the baseline source. The target file is the one named on the diff's
     * {@code +++ b/} line.
     *
     * @param baselineSource The baseline revision of the file.
     * @param diffText       A unified diff that changes exactly one file.
     * @return The patched revision of the file.
     * @throws PatchException If the diff names no target file, names one outside the repository, or cannot be
     *                        applied.
     */
    public static String apply(String baselineSource, String diffText) {
        String target = targetPath(diffText);
        LOGGER.info(() -> "Applying patch to " + target);

        Path repoDir;
        try {
            repoDir = Files.createTempDirectory("patchmerge_repo_");
        } catch (IOException e) {
            throw new PatchException("Could not create temporary repository", e);
        }

        try (Git git = Git.init().setDirectory(repoDir.toFile()).call()) {
            Path targetFile = resolveInside(repoDir, target);
            Files.createDirectories(targetFile.getParent());
            Files.writeString(targetFile, normalizeLineEndings(baselineSource), StandardCharsets.UTF_8);

            git.add().addFilepattern(target).call();
            git.commit()
                    .setMessage("Baseline")
                    .setAuthor(IDENTITY, IDENTITY + "@localhost")
                    .setCommitter(IDENTITY, IDENTITY + "@localhost")
                    .setSign(false)
                    .call();

            ApplyResult result = git.apply()
                    .setPatch(new ByteArrayInputStream(diffText.getBytes(StandardCharsets.UTF_8)))
                    .call();
            if (result.getUpdatedFiles().isEmpty()) {
                logMismatch(baselineSource, diffText);
                throw new PatchException("Patch did not change " + target);
            }

            LOGGER.info(() -> "Patch applied");
            return Files.readString(targetFile, StandardCharsets.UTF_8);
        } catch (GitAPIException e) {
            logMismatch(baselineSource, diffText);
            throw new PatchException("Could not apply patch to " + target + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new PatchException("Could not apply patch to " + target + ": " + e.getMessage(), e);
        } finally {
            deleteRepository(repoDir.toFile());
        }
    }

    /**
     * @return The path of the file a unified diff changes, relative to the repository root.
     * @throws PatchException If the diff has no {@code +++ b/} line.
     */
    static String targetPath(String diffText) {
        return diffText.lines()
                .filter(line -> line.startsWith(TARGET_MARKER))
                .map(line -> line.substring(TARGET_MARKER.length()).trim())
                .filter(path -> !path.isEmpty())
                .findFirst()
                .orElseThrow(() -> new PatchException("Cannot extract target path from diff"));
    }

    /**
     * Resolve the diff's target path in the repository.
     *
     * @throws PatchException If the path leads outside the repository.
     */
    static Path resolveInside(Path repoDir, String target) {
        Path root = repoDir.toAbsolutePath().normalize();
        Path resolved = root.resolve(target).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new PatchException("Target path " + target + " is outside the repository");
        }
        return resolved;
    }

    /**
     * Describe how the first hunk of a diff lines up with the baseline: the hunk header, the hunk body, the baseline
     * lines the hunk expects and whether the hunk's baseline-side line count agrees with its header.
     *
     * @return The report, one entry per line.
     */
    static List<String> mismatchReport(String baselineSource, String diffText) {
        List<String> report = new ArrayList<>();
        List<String> diffLines = diffText.lines().collect(Collectors.toList());

        int headerIndex = -1;
        Matcher header = null;
        for (int i = 0; i < diffLines.size(); i++) {
            Matcher m = HUNK_HEADER.matcher(diffLines.get(i));
            if (m.find()) {
                headerIndex = i;
                header = m;
                break;
            }
        }
        if (header == null) {
            report.add("No hunk header found in diff");
            return report;
        }

        int baseStart = Integer.parseInt(header.group(1));
        int baseCount = header.group(2) == null ? 1 : Integer.parseInt(header.group(2));
        report.add("Hunk header: " + header.group());

        List<String> body = new ArrayList<>();
        for (String line : diffLines.subList(headerIndex + 1, diffLines.size())) {
            if (line.startsWith("@@") || line.startsWith("diff --git")) {
                break;
            }
            body.add(line);
        }
        report.add("Hunk body (" + body.size() + " lines):");
        for (int i = 0; i < body.size(); i++) {
            report.add("  diff line " + (i + 1) + ": " + body.get(i));
        }

        String[] baselineLines = normalizeLineEndings(baselineSource).split("\n", -1);
        report.add("Expected baseline context (lines " + baseStart + " to " + (baseStart + baseCount - 1) + "):");
        for (int i = baseStart - 1; i < baseStart - 1 + baseCount; i++) {
            String line = i >= 0 && i < baselineLines.length - 1 ? baselineLines[i] : "[missing]";
            report.add("  baseline line " + (i + 1) + ": " + line);
        }

        long baselineSide = body.stream().filter(line -> !line.startsWith("+") && !line.startsWith("\\")).count();
        if (baselineSide != baseCount) {
            report.add("Mismatch: hunk has " + baselineSide + " baseline lines, header expects " + baseCount);
        } else {
            report.add("Hunk baseline line count matches header (" + baseCount + ")");
        }
        return report;
    }

    private static void logMismatch(String baselineSource, String diffText) {
        LOGGER.info(() -> "Patch does not match the baseline, see debug log for the first hunk");
        for (String line : mismatchReport(baselineSource, diffText)) {
            LOGGER.debug(() -> line);
        }
    }

    /**
     * Replace CRLF and CR line endings with LF, and make sure the text ends with a newline.
     */
    static String normalizeLineEndings(String content) {
        String normalized = content.replace("\r\n", "\n").replace("\r", "\n");
        if (!normalized.endsWith("\n")) {
            normalized += "\n";
        }
        return normalized;
    }

    private static void deleteRepository(File repoDir) {
        try {
            FileUtils.delete(repoDir, FileUtils.RECURSIVE | FileUtils.RETRY);
        } catch (IOException e) {
            LOGGER.warn(() -> "Could not delete temporary repository " + repoDir + ": " + e.getMessage());
        }
    }
}
