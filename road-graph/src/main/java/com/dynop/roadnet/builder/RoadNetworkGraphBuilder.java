package com.dynop.roadnet.builder;

import com.dynop.roadnet.RoadNetworkException;
import com.dynop.roadnet.RoadNetworkPipeline;
import com.dynop.roadnet.RoadNetworkPipeline.PipelineResult;
import com.dynop.roadnet.config.RoadNetworkConfiguration;
import com.dynop.roadnet.graph.EdgeCollisionPolicy;
import com.dynop.roadnet.graph.GraphMetadata;
import com.dynop.roadnet.graph.RoadGraph;
import com.dynop.roadnet.io.SegmentCsvLoader;
import com.dynop.roadnet.model.RawSegmentRecord;
import com.dynop.roadnet.schema.SchemaAdapterRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Offline CLI tool that builds a routable road graph from a segment CSV export and reports on it.
 * 
 * <p>The builder:
 * <ol>
 *   <li>Loads raw segment records from the CSV export</li>
 *   <li>Normalizes them with the adapter of the configured vintage</li>
 *   <li>Expands, assembles and reduces the graph to its largest strongly connected component</li>
 *   <li>Writes {@code build_summary.json} to the output directory</li>
 * </ol>
 * 
 * <h2>Usage</h2>
 * <pre>{@code
 * java -cp road-graph.jar com.dynop.roadnet.builder.RoadNetworkGraphBuilder \
 *     --input /data/multinet/segments.csv \
 *     --vintage 2021 \
 *     --output /data/graph-build \
 *     [--crs EPSG:4326] [--collision-policy reject] [--config build.yml]
 * }</pre>
 */
public class RoadNetworkGraphBuilder {
    
    private static final Logger LOGGER = Logger.getLogger(RoadNetworkGraphBuilder.class.getName());
    
    static final String SUMMARY_FILE = "build_summary.json";
    
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    
    private final RoadNetworkConfiguration configuration;
    private final SegmentCsvLoader loader;
    private final RoadNetworkPipeline pipeline;
    
    /**
     * @param configuration Validated build configuration
     */
    public RoadNetworkGraphBuilder(RoadNetworkConfiguration configuration) {
        this(configuration, new SegmentCsvLoader(),
            new RoadNetworkPipeline(SchemaAdapterRegistry.defaults(), configuration.getCollisionPolicy()));
    }
    
    RoadNetworkGraphBuilder(RoadNetworkConfiguration configuration, SegmentCsvLoader loader,
                            RoadNetworkPipeline pipeline) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    }
    
    /**
     * Build the road graph.
     * 
     * @return Summary of the build, also written to the output directory
     * @throws IOException          if reading the input or writing the summary fails
     * @throws RoadNetworkException if the records cannot be turned into a routable graph
     */
    public BuildSummary build() throws IOException {
        long startTime = System.currentTimeMillis();
        LOGGER.info("Starting road graph build...");
        
        Path input = configuration.getInputPath();
        LOGGER.info("Loading road segments from " + input);
        if (!Files.exists(input)) {
            throw new IOException("Segment file not found: " + input);
        }
        List<RawSegmentRecord> records = loader.load(input);
        
        PipelineResult result = pipeline.run(records, configuration.getVintage(), configuration.getCoordinateSystem());
        
        long buildDuration = System.currentTimeMillis() - startTime;
        BuildSummary summary = summarize(result, buildDuration);
        
        Path outputDir = configuration.getOutputPath();
        Files.createDirectories(outputDir);
        Path summaryPath = outputDir.resolve(SUMMARY_FILE);
        JSON.writeValue(summaryPath.toFile(), summary);
        LOGGER.info("Build summary saved to " + summaryPath);
        
        LOGGER.info(String.format("Road graph build completed in %d ms", buildDuration));
        return summary;
    }
    
    private BuildSummary summarize(PipelineResult result, long buildDuration) {
        RoadGraph graph = result.getGraph();
        GraphMetadata metadata = graph.getMetadata().orElseThrow();
        return new BuildSummary(
            result.getNormalization().getVintageTag(),
            metadata.getCrs().getCode(),
            result.getNormalization().getRawRecordCount(),
            result.getNormalization().getFilteredRecordCount(),
            result.getNormalization().getDefaultedSpeedRoadIds().size(),
            result.getAssembledNodeCount(),
            result.getAssembledEdgeCount(),
            graph.getNodeCount(),
            graph.getEdgeCount(),
            graph.getCollisionCount(),
            metadata.getDistanceKey(),
            metadata.getTimeKey(),
            metadata.getGeometryKey(),
            metadata.getRoadIdKey(),
            buildDuration,
            Instant.now().toString()
        );
    }
    
    /**
     * Resolve the configuration from command line arguments. A {@code --config} file is read first;
     * flags override its values.
     * 
     * @throws IOException              if the configuration file cannot be read
     * @throws IllegalArgumentException on unknown flags or an incomplete configuration
     */
    static RoadNetworkConfiguration parseArguments(String[] args) throws IOException {
        RoadNetworkConfiguration configuration = new RoadNetworkConfiguration();
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                configuration = RoadNetworkConfiguration.load(Path.of(args[i + 1]));
            }
        }
        
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String value = args[++i];
            switch (flag) {
                case "--config":
                    break;
                case "--input":
                    configuration.setInput(value);
                    break;
                case "--vintage":
                    configuration.setVintage(value);
                    break;
                case "--output":
                    configuration.setOutput(value);
                    break;
                case "--crs":
                    configuration.setCrs(value);
                    break;
                case "--collision-policy":
                    configuration.setCollisionPolicy(EdgeCollisionPolicy.valueOf(value.toUpperCase(Locale.ROOT)));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + flag);
            }
        }
        
        configuration.validate();
        return configuration;
    }
    
    // ========== Main entry point ==========
    
    public static void main(String[] args) {
        RoadNetworkConfiguration configuration;
        try {
            configuration = parseArguments(args);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Usage: RoadNetworkGraphBuilder --input <csv> --vintage <2017|2021> --output <dir> "
                + "[--crs <EPSG:code>] [--collision-policy <overwrite|reject>] [--config <yaml>]");
            System.exit(1);
            return;
        }
        
        try {
            BuildSummary summary = new RoadNetworkGraphBuilder(configuration).build();
            
            System.out.println("Build completed successfully!");
            System.out.println("  Nodes: " + summary.getNodeCount());
            System.out.println("  Edges: " + summary.getEdgeCount());
            System.out.println("  Duration: " + summary.getBuildDurationMs() + " ms");
            
        } catch (Exception e) {
            System.err.println("Build failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}
