package com.alphaguard.lint;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * CLI command: isolation-gate allowlist --config &lt;dir&gt;
 */
@Command(name = "allowlist", mixinStandardHelpOptions = true,
        description = "Fail if a constraint uses a non-allowlisted action field or a factor has no failure rule")
public class AllowlistCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"--config", "-c"}, required = true,
            description = "Governance config directory holding constraints/ and factors/")
    private Path configDir;

    @Override
    public Integer call() {
        if (!Files.isDirectory(configDir)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Not a directory: " + configDir);
        }
        LintResult result = new ActionAllowlistLint(Clock.systemUTC()).check(configDir);
        GateOutput.report(spec.commandLine().getOut(), "ALLOWLIST", result);
        return result.passed() ? IsolationGateCommand.EXIT_PASSED : IsolationGateCommand.EXIT_VIOLATIONS;
    }
}
