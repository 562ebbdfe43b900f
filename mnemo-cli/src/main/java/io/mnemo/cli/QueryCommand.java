package io.mnemo.cli;

import io.mnemo.core.atom.MemoryAtom;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.retrieval.MemoryQueryResult;
import io.mnemo.core.retrieval.QueryEvidence;
import io.mnemo.core.retrieval.QueryOptions;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "query", description = "Rank memories against a query with hybrid scoring")
public final class QueryCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Query text")
    String query;

    @Option(names = {"-s", "--session"}, description = "Session id recorded with the query")
    String sessionId;

    @Option(names = {"-n", "--limit"}, description = "Maximum results (1-50)")
    Integer limit;

    @Option(names = "--include-sensitive", description = "Also rank sensitive and hidden memories")
    boolean includeSensitive;

    @Option(names = "--no-graph", description = "Ignore the graph signal")
    boolean noGraph;

    @Option(names = "--lexical-weight", description = "Lexical signal weight")
    Double lexicalWeight;

    @Option(names = "--dense-weight", description = "Token overlap signal weight")
    Double denseWeight;

    @Option(names = "--graph-weight", description = "Graph signal weight")
    Double graphWeight;

    @Option(names = "--rerank-weight", description = "Exact match signal weight")
    Double rerankWeight;

    public QueryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoConfig config = context.configService().load(context.configPath());
            QueryOptions.Builder builder = config.retrieval().toQueryOptions()
                .includeSensitive(includeSensitive)
                .includeGraphExpansion(!noGraph);
            if (limit != null) {
                builder.limit(limit);
            }
            if (lexicalWeight != null) {
                builder.lexicalWeight(lexicalWeight);
            }
            if (denseWeight != null) {
                builder.denseWeight(denseWeight);
            }
            if (graphWeight != null) {
                builder.graphWeight(graphWeight);
            }
            if (rerankWeight != null) {
                builder.rerankWeight(rerankWeight);
            }

            MemoryQueryResult result = context.memoryService().deepQuery(sessionId, query, builder.build());
            System.out.println(String.format(
                Locale.ROOT,
                "Query %s: %d of %d candidates in %d ms",
                result.queryId(),
                result.atoms().size(),
                result.totalCandidates(),
                result.latencyMs()
            ));
            for (int i = 0; i < result.atoms().size(); i++) {
                MemoryAtom atom = result.atoms().get(i);
                QueryEvidence evidence = result.evidence().get(i);
                System.out.println(String.format(
                    Locale.ROOT,
                    "%.3f %s %s",
                    evidence.score(),
                    atom.id(),
                    String.join(" ", evidence.reasons())
                ));
                System.out.println("      " + atom.content());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Query failed: " + e.getMessage());
            return 1;
        }
    }
}
