package io.hyperfoil.tools.yamlint.cli;

import io.hyperfoil.tools.yamlint.FileError;
import io.hyperfoil.tools.yamlint.FileProcessor;
import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.LintResult;
import io.hyperfoil.tools.yamlint.LintSummary;
import io.hyperfoil.tools.yamlint.Linter;
import io.hyperfoil.tools.yamlint.Severity;
import io.hyperfoil.tools.yamlint.config.ConfigException;
import io.hyperfoil.tools.yamlint.config.ConfigLoader;
import io.hyperfoil.tools.yamlint.config.LintConfig;
import io.hyperfoil.tools.yamlint.format.Formatter;
import io.hyperfoil.tools.yamlint.format.OutputFormat;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import org.jboss.logging.Logger;
import org.jboss.logmanager.formatters.ColorPatternFormatter;
import org.jboss.logmanager.formatters.PatternFormatter;
import org.jboss.logmanager.handlers.ConsoleHandler;
import picocli.AutoComplete;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.stream.Collectors;

@CommandLine.Command(name="yamlint", description = "lint yaml files", mixinStandardHelpOptions = true, versionProvider = YamlintPico.Version.class,
        subcommands={CommandLine.HelpCommand.class, AutoComplete.GenerateCompletion.class})
public class YamlintPico implements Callable<Integer> {

    static {
        // must be set before the first logger is created
        if(System.getProperty("java.util.logging.manager") == null){
            System.setProperty("java.util.logging.manager", "org.jboss.logmanager.LogManager");
        }
        if(System.getProperty("org.jboss.logging.provider") == null){
            System.setProperty("org.jboss.logging.provider", "jboss");
        }
    }

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final String LOG_FORMAT = "%d{HH:mm:ss.SSS} %-5p %m%n";
    public static final String STDIN = "-";

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERRORS = 1;
    public static final int EXIT_USAGE = 2;

    static class Version implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() throws Exception {
            String version = YamlintPico.class.getPackage().getImplementationVersion();
            return new String[]{"yamlint " + (version == null ? "unknown" : version)};
        }
    }

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-c","--config-file"}, description = "path to a configuration file", converter = PathConverter.class)
    Path configFile;
    @CommandLine.Option(names = {"-d","--config-data"}, description = "configuration yaml or the name of a preset (default, relaxed)")
    String configData;
    @CommandLine.Option(names = {"-f","--format"}, description = "output format: standard, colored, parsable or auto", defaultValue = "auto")
    String format;
    @CommandLine.Option(names = {"-r","--recursive"}, description = "include the yaml files of sub directories", defaultValue = "false")
    boolean recursive;
    @CommandLine.Option(names = {"--fix"}, description = "fix the issues that can be fixed and write the files back", defaultValue = "false")
    boolean fix;
    @CommandLine.Option(names = {"-s","--strict"}, description = "return a non-zero exit code when only warnings are found", defaultValue = "false")
    boolean strict;
    @CommandLine.Option(names = {"--no-warnings"}, description = "only output error level issues", defaultValue = "false")
    boolean noWarnings;
    @CommandLine.Option(names = {"--no-progress"}, description = "do not log progress", defaultValue = "false")
    boolean noProgress;
    @CommandLine.Option(names = {"--list-rules"}, description = "list the rules of the configuration and exit", defaultValue = "false")
    boolean listRules;
    @CommandLine.Option(names = {"-v","--verbose"}, description = "log debug messages", defaultValue = "false")
    boolean verbose;

    @CommandLine.Parameters(paramLabel = "FILE_OR_DIR", description = "files or directories to lint, - reads standard input", converter = PathConverter.class)
    List<Path> paths = new ArrayList<>();

    public static void main(String[] args){
        System.exit(execute(args));
    }

    public static int execute(String... args){
        CommandLine cmd = new CommandLine(new YamlintPico());
        CommandLine gen = cmd.getSubcommands().get("generate-completion");
        gen.getCommandSpec().usageMessage().hidden(true);
        return cmd.execute(args);
    }

    @Override
    public Integer call() throws Exception {
        boolean terminal = System.console() != null;
        configureLogging(terminal);

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        OutputFormat outputFormat = OutputFormat.from(format);
        if(outputFormat == null){
            err.printf("unknown format %s%n", format);
            return EXIT_USAGE;
        }

        Path workingDir = Paths.get(System.getProperty("user.dir"));
        LintConfig config;
        try {
            config = ConfigLoader.discover(configFile, configData, workingDir);
        } catch (ConfigException e) {
            err.printf("%s%n", e.getMessage());
            return EXIT_USAGE;
        }
        logger.debugf("configuration %s", config);

        if(listRules){
            for(RuleId id : RuleId.values()){
                RuleSettings settings = config.getSettings(id);
                out.printf("%-25s %-8s %s%n", id.getId(), settings.isEnabled() ? settings.getSeverity().getLabel() : "disabled", id.getDescription());
            }
            out.flush();
            return EXIT_OK;
        }
        if(paths.isEmpty()){
            err.printf("missing files or directories to lint%n");
            spec.commandLine().usage(err);
            return EXIT_USAGE;
        }

        Linter linter = new Linter(config);
        Formatter formatter = Formatter.create(outputFormat, terminal);
        FileProcessor processor = new FileProcessor(linter, workingDir, fix, !noProgress, new AtomicInteger(0));

        List<LintResult> results = new ArrayList<>();
        List<FileError> errors = new ArrayList<>();
        List<Path> files = paths.stream().filter(path -> !STDIN.equals(path.toString())).collect(Collectors.toList());
        LintResult stdinResult = null;
        if(files.size() != paths.size()){
            stdinResult = readStdin(linter);
            results.add(stdinResult);
        }
        if(!files.isEmpty()){
            List<Path> expanded = processor.expand(files, recursive);
            logger.debugf("linting %d files", expanded.size());
            LintSummary summary = processor.process(expanded);
            results.addAll(summary.getResults());
            errors.addAll(summary.getErrors());
        }
        LintSummary summary = new LintSummary(results, errors);

        for(LintResult result : summary.getResults()){
            LintResult shown = noWarnings ? errorsOnly(result) : result;
            // standard output already holds the fixed document
            PrintWriter report = fix && result == stdinResult ? err : out;
            report.print(formatter.format(shown));
        }
        for(FileError error : summary.getErrors()){
            err.printf("%s%n", error);
        }
        out.flush();
        err.flush();
        if(fix){
            logger.infof("applied %d fixes", summary.getFixesApplied());
        }
        return summary.getExitCode(strict);
    }

    private LintResult readStdin(Linter linter) throws IOException {
        InputStream in = System.in;
        String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        // fixed content of standard input goes to standard output
        if(fix){
            LintResult result = linter.fix(content, "stdin");
            spec.commandLine().getOut().print(result.getFix().getContent());
            return result;
        }
        return linter.check(content, "stdin");
    }

    private static LintResult errorsOnly(LintResult result){
        List<Issue> errors = result.getIssues().stream()
                .filter(issue -> Severity.ERROR.equals(issue.getSeverity()))
                .collect(Collectors.toList());
        return new LintResult(result.getPath(), errors, result.getFix());
    }

    private void configureLogging(boolean terminal){
        org.jboss.logmanager.Logger yamlintLogger = org.jboss.logmanager.Logger.getLogger("io.hyperfoil.tools.yamlint");
        if(yamlintLogger.getHandlers().length == 0){
            PatternFormatter formatter = terminal ? new ColorPatternFormatter(LOG_FORMAT) : new PatternFormatter(LOG_FORMAT);
            ConsoleHandler consoleHandler = new ConsoleHandler(ConsoleHandler.Target.SYSTEM_ERR, formatter);
            yamlintLogger.addHandler(consoleHandler);
            yamlintLogger.setUseParentHandlers(false);
        }
        yamlintLogger.setLevel(verbose ? Level.FINE : Level.INFO);
    }
}
