package com.alphaguard.lint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.Value;

@Value
public class LintResult {

    private static final Comparator<LintViolation> ORDER = Comparator.comparing(LintViolation::getPath)
            .thenComparingInt(LintViolation::getLine)
            .thenComparing(LintViolation::getSymbol, Comparator.nullsFirst(Comparator.naturalOrder()));

    List<LintViolation> violations;
    int checkedFiles;
    Instant checkedAt;

    public static LintResult of(List<LintViolation> violations, int checkedFiles, Instant checkedAt) {
        return new LintResult(violations.stream().sorted(ORDER).toList(), checkedFiles, checkedAt);
    }

    public boolean passed() {
        return violations.isEmpty();
    }

    public LintResult merge(LintResult other) {
        List<LintViolation> all = new ArrayList<>(violations);
        all.addAll(other.violations);
        Instant latest = checkedAt.isAfter(other.checkedAt) ? checkedAt : other.checkedAt;
        return of(all, checkedFiles + other.checkedFiles, latest);
    }
}
