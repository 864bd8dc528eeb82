package com.hubzone.designations.importer.source;

import java.util.List;
import java.util.function.Predicate;

public record FeedParseResult<T>(List<T> records, List<FeedProblem> problems) {
    public FeedParseResult {
        records = records == null ? List.of() : List.copyOf(records);
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public static <T> FeedParseResult<T> empty() {
        return new FeedParseResult<>(List.of(), List.of());
    }

    public FeedParseResult<T> filter(Predicate<T> recordFilter, Predicate<FeedProblem> problemFilter) {
        return new FeedParseResult<>(
            records.stream().filter(recordFilter).toList(),
            problems.stream().filter(problemFilter).toList()
        );
    }
}
