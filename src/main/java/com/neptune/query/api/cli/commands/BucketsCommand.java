package com.neptune.query.api.cli.commands;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import com.neptune.query.api.buckets.TimeseriesBucket;
import com.neptune.query.api.cli.NeptuneQueryCliMain.GlobalConfig;
import com.neptune.query.api.clients.NeptuneApiClient;
import com.neptune.query.api.metrics.MetricBucketsFetcher;
import com.neptune.query.api.model.RunAttributeDefinition;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Fetches metrics and prints their bucket summaries.
 */
@Command(name = "buckets", description = "Summarize metric series into x buckets", mixinStandardHelpOptions = true)
public class BucketsCommand implements Callable<Integer> {

    @Option(names = {"-p", "--project"}, description = "Project as workspace/project")
    String project;

    @Option(names = {"-q", "--query"}, description = "Run filter expression")
    String runQuery;

    @Option(names = {"-l", "--limit"}, description = "Maximum number of runs")
    Integer runLimit;

    @Option(names = {"-m", "--metrics"}, description = "Metric names (comma-separated)", split = ",", required = true)
    List<String> metrics;

    @Option(names = {"-b", "--buckets"}, description = "Number of buckets (default: ${DEFAULT-VALUE})", defaultValue = "10")
    int bucketLimit;

    @Option(names = {"--from"}, description = "Start of the x range (default: smallest step)")
    Double from;

    @Option(names = {"--to"}, description = "End of the x range (default: largest step)")
    Double to;

    @Override
    public Integer call() {
        String projectIdentifier = GlobalConfig.getProject(project);
        if (projectIdentifier == null) {
            System.err.println("❌ Error: a project is required. Set --project or NEPTUNE_PROJECT");
            return 1;
        }
        if ((from == null) != (to == null)) {
            System.err.println("❌ Error: --from and --to must be given together");
            return 1;
        }

        double[] xRange = from != null ? new double[] {from, to} : null;
        try (NeptuneApiClient client = GlobalConfig.createClient()) {
            Map<RunAttributeDefinition, List<TimeseriesBucket>> buckets = new MetricBucketsFetcher(client)
                    .fetchMetricBuckets(projectIdentifier, runQuery, runLimit, metrics, bucketLimit, xRange);

            if (buckets.isEmpty()) {
                System.out.println("No series found");
                return 0;
            }
            for (Map.Entry<RunAttributeDefinition, List<TimeseriesBucket>> entry : buckets.entrySet()) {
                System.out.println(entry.getKey().getRunIdentifier().getSysId() + " "
                        + entry.getKey().getAttributeDefinition().getName() + ":");
                for (TimeseriesBucket bucket : entry.getValue()) {
                    System.out.println("  " + bucket);
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("❌ Error fetching metric buckets: " + e.getMessage());
            if (GlobalConfig.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }
}
