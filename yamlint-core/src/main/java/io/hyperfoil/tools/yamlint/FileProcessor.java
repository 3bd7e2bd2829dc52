package io.hyperfoil.tools.yamlint;

import io.hyperfoil.tools.yamlint.config.LintConfig;
import io.hyperfoil.tools.yamlint.config.PathPatterns;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the yaml files of the command line arguments and lints or fixes each of them.
 */
public class FileProcessor {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final int PARALLEL_THRESHOLD = 3;
    public static final int PROGRESS_INTERVAL = 1000;

    private final Linter linter;
    private final Path workingDir;
    private final boolean fix;
    private final boolean showProgress;
    private final AtomicInteger progress;
    private final int threads;

    public FileProcessor(Linter linter, Path workingDir, boolean fix, boolean showProgress, AtomicInteger progress){
        this(linter, workingDir, fix, showProgress, progress, Runtime.getRuntime().availableProcessors());
    }

    public FileProcessor(Linter linter, Path workingDir, boolean fix, boolean showProgress, AtomicInteger progress, int threads){
        this.linter = linter;
        this.workingDir = workingDir.toAbsolutePath().normalize();
        this.fix = fix;
        this.showProgress = showProgress;
        this.progress = progress;
        this.threads = Math.max(1, threads);
    }

    /**
     * Expands files and directories into the files to lint. Files named directly are always kept unless ignored,
     * directories contribute the files matching the yaml-files patterns.
     * @param recursive when false only the files directly inside a directory are used
     */
    public List<Path> expand(List<Path> arguments, boolean recursive) throws IOException {
        LintConfig config = linter.getConfig();
        Set<Path> rtrn = new LinkedHashSet<>();
        for(Path argument : arguments){
            if(Files.isDirectory(argument)){
                PathPatterns gitignore = gitignore(argument);
                try (Stream<Path> walk = Files.walk(argument, recursive ? Integer.MAX_VALUE : 1)){
                    List<Path> found = walk
                            .filter(Files::isRegularFile)
                            .filter(path -> !isInGitDirectory(argument, path))
                            .filter(path -> !gitignore.matches(argument.relativize(path).toString()))
                            .filter(path -> config.isYamlFile(relative(path)))
                            .filter(path -> !config.isIgnored(relative(path)))
                            .sorted()
                            .collect(Collectors.toList());
                    logger.debugf("found %d yaml files in %s", found.size(), argument);
                    rtrn.addAll(found);
                }
            }else if(!config.isIgnored(relative(argument))){
                rtrn.add(argument);
            }
        }
        return new ArrayList<>(rtrn);
    }

    private static boolean isInGitDirectory(Path root, Path path){
        for(Path part : root.relativize(path)){
            if(".git".equals(part.toString())){
                return true;
            }
        }
        return false;
    }

    private static PathPatterns gitignore(Path directory) throws IOException {
        Path file = directory.resolve(".gitignore");
        if(!Files.isRegularFile(file)){
            return PathPatterns.NONE;
        }
        List<String> patterns = PathPatterns.lines(new String(Files.readAllBytes(file), StandardCharsets.UTF_8)).stream()
                .filter(pattern -> !pattern.startsWith("!"))
                .collect(Collectors.toList());
        return PathPatterns.files(patterns);
    }

    /**
     * @return the path relative to the working directory when it is inside it, otherwise the path as given
     */
    public String relative(Path path){
        Path absolute = path.toAbsolutePath().normalize();
        String rtrn = absolute.startsWith(workingDir) ? workingDir.relativize(absolute).toString() : path.toString();
        return PathPatterns.normalize(rtrn);
    }

    public LintSummary process(List<Path> files){
        List<LintResult> results = new ArrayList<>();
        List<FileError> errors = Collections.synchronizedList(new ArrayList<>());
        if(files.size() > PARALLEL_THRESHOLD && threads > 1){
            AtomicInteger threadCounter = new AtomicInteger(0);
            ThreadFactory factory = r -> {
                Thread rtrn = new Thread(r, "yamlint-file-" + threadCounter.getAndIncrement());
                rtrn.setDaemon(true);
                return rtrn;
            };
            ThreadPoolExecutor executor = new ThreadPoolExecutor(threads, threads, 30, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), factory);
            try {
                List<Future<LintResult>> futures = new ArrayList<>();
                for(Path file : files){
                    futures.add(executor.submit(() -> processFile(file, files.size(), errors)));
                }
                for(Future<LintResult> future : futures){
                    LintResult result = future.get();
                    if(result != null){
                        results.add(result);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while linting files", e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("failed to lint files", e.getCause());
            } finally {
                executor.shutdownNow();
            }
        }else{
            for(Path file : files){
                LintResult result = processFile(file, files.size(), errors);
                if(result != null){
                    results.add(result);
                }
            }
        }
        return new LintSummary(results, new ArrayList<>(errors));
    }

    /**
     * @return the result for the file, null when it could not be read or written
     */
    LintResult processFile(Path file, int total, List<FileError> errors){
        String path = relative(file);
        try {
            String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            LintResult result;
            if(fix){
                result = linter.fix(content, path);
                if(result.getFix().isChanged()){
                    Files.write(file, result.getFix().getContent().getBytes(StandardCharsets.UTF_8));
                    logger.infof("fixed %d issues in %s", result.getFix().getFixesApplied(), path);
                }
            }else{
                result = linter.check(content, path);
            }
            return result;
        } catch (IOException e) {
            logger.errorf("cannot process %s: %s", path, e.getMessage());
            errors.add(new FileError(path, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
            return null;
        } finally {
            int count = progress.incrementAndGet();
            if(showProgress && (count % PROGRESS_INTERVAL == 0 || count == total)){
                logger.infof("processed %d/%d files (%d%%)", count, total, count * 100 / total);
            }
        }
    }
}
