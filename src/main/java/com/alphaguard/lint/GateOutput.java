package com.alphaguard.lint;

import java.io.PrintWriter;
import picocli.CommandLine;

/**
 * ANSI-colored output for the isolation gate.
 */
final class GateOutput {

    private GateOutput() {
    }

    static void report(PrintWriter out, String check, LintResult result) {
        for (LintViolation violation : result.getViolations()) {
            out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red) x|@ " + violation.location() + " @|bold [" + violation.getKind() + "]|@ "
                            + violation.getMessage()));
        }
        if (result.passed()) {
            out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(green),bold [" + check + " PASSED]|@ " + result.getCheckedFiles() + " file(s) checked"));
        } else {
            out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(red),bold [" + check + " FAILED]|@ " + result.getViolations().size()
                            + " violation(s) in " + result.getCheckedFiles() + " file(s)"));
        }
        out.flush();
    }
}
