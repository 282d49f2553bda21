package com.alphaguard.lint;

import com.alphaguard.config.GovernanceProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * CLI command: isolation-gate alpha-path --root &lt;dir&gt;
 */
@Command(name = "alpha-path", mixinStandardHelpOptions = true,
        description = "Fail if alpha sources import or reference governance packages")
public class AlphaPathCommand implements Callable<Integer> {

    private static final GovernanceProperties.Lint DEFAULTS = new GovernanceProperties.Lint();

    @Spec
    CommandSpec spec;

    @Option(names = {"--root", "-r"}, required = true, description = "Source tree root")
    private Path root;

    @Option(names = {"--alpha-path", "-a"}, split = ",",
            description = "Alpha source directories relative to the root (default: ${DEFAULT-VALUE})")
    private List<String> alphaPaths = new ArrayList<>(DEFAULTS.getAlphaPaths());

    @Option(names = {"--forbidden", "-f"}, split = ",",
            description = "Packages alpha code must not use (default: ${DEFAULT-VALUE})")
    private List<String> forbiddenPackages = new ArrayList<>(DEFAULTS.getForbiddenPackages());

    @Override
    public Integer call() {
        if (!Files.isDirectory(root)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Not a directory: " + root);
        }
        LintResult result = new AlphaPathLint(alphaPaths, forbiddenPackages, Clock.systemUTC()).check(root);
        GateOutput.report(spec.commandLine().getOut(), "ALPHA_PATH", result);
        return result.passed() ? IsolationGateCommand.EXIT_PASSED : IsolationGateCommand.EXIT_VIOLATIONS;
    }
}
