package com.neptune.query.api.cli.commands;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import com.neptune.query.api.cli.NeptuneQueryCliMain.GlobalConfig;
import com.neptune.query.api.clients.NeptuneApiClient;
import com.neptune.query.api.clients.SeriesQuery;
import com.neptune.query.api.metrics.MetricsFetcher;
import com.neptune.query.api.model.RunAttributeDefinition;
import com.neptune.query.api.model.SeriesPoint;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Fetches metrics of the matching runs and prints a line per series.
 */
@Command(name = "metrics", description = "Fetch metric series of runs", mixinStandardHelpOptions = true)
public class MetricsCommand implements Callable<Integer> {

    @Option(names = {"-p", "--project"}, description = "Project as workspace/project")
    String project;

    @Option(names = {"-q", "--query"}, description = "Run filter expression")
    String runQuery;

    @Option(names = {"-l", "--limit"}, description = "Maximum number of runs")
    Integer runLimit;

    @Option(names = {"-m", "--metrics"}, description = "Metric names (comma-separated)", split = ",", required = true)
    List<String> metrics;

    @Option(names = {"--tail"}, description = "Only the last N points of each series")
    Integer tailLimit;

    @Option(names = {"--step-from"}, description = "First step to include")
    Double stepFrom;

    @Option(names = {"--step-to"}, description = "Last step to include")
    Double stepTo;

    @Option(names = {"--lineage"}, description = "Include points inherited from ancestor runs")
    boolean lineageToTheRoot;

    @Option(names = {"--previews"}, description = "Include preview points")
    boolean includePointPreviews;

    @Override
    public Integer call() {
        String projectIdentifier = GlobalConfig.getProject(project);
        if (projectIdentifier == null) {
            System.err.println("❌ Error: a project is required. Set --project or NEPTUNE_PROJECT");
            return 1;
        }

        try (NeptuneApiClient client = GlobalConfig.createClient()) {
            SeriesQuery query = SeriesQuery.all().withStepRange(stepFrom, stepTo).withTailLimit(tailLimit)
                    .withLineageToTheRoot(lineageToTheRoot).withPointPreviews(includePointPreviews);
            Map<RunAttributeDefinition, List<SeriesPoint>> series = new MetricsFetcher(client)
                    .fetchMetrics(projectIdentifier, runQuery, runLimit, metrics, query);

            if (series.isEmpty()) {
                System.out.println("No series found");
                return 0;
            }
            System.out.println("Found " + series.size() + " series:");
            for (Map.Entry<RunAttributeDefinition, List<SeriesPoint>> entry : series.entrySet()) {
                System.out.println("  " + formatSeries(entry.getKey(), entry.getValue()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("❌ Error fetching metrics: " + e.getMessage());
            if (GlobalConfig.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    static String formatSeries(RunAttributeDefinition definition, List<SeriesPoint> points) {
        StringBuilder line = new StringBuilder()
                .append(definition.getRunIdentifier().getSysId())
                .append(' ')
                .append(definition.getAttributeDefinition().getName())
                .append(": ")
                .append(points.size())
                .append(" points");
        if (!points.isEmpty()) {
            SeriesPoint last = points.get(points.size() - 1);
            line.append(String.format(", steps %s..%s, last value %s", points.get(0).getX(), last.getX(), last.getY()));
        }
        return line.toString();
    }
}
