package com.devicesim.dispatch.cli;

import com.devicesim.core.catalog.CatalogException;
import com.devicesim.core.engine.SimulationRequest;
import com.devicesim.core.graph.GraphStatistics;
import com.devicesim.core.graph.SimulationGraph;
import com.devicesim.core.model.ActionRequest;
import com.devicesim.io.DefinitionLoadException;
import com.devicesim.service.SimulationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: devsim simulate --device &lt;device&gt; &lt;action[:k=v,...]&gt;...
 * <p>
 * Runs the branching engine over the action sequence, prints the resulting tree and its
 * statistics and optionally saves the graph as YAML or JSON.
 */
@Command(name = "simulate", mixinStandardHelpOptions = true, description = "Run a branching simulation")
@Component
public class SimulateCommand implements Callable<Integer> {

    @Option(names = {"--device", "-D"}, required = true, description = "Device type name")
    private String deviceType;

    @Parameters(arity = "1..*", description = "Actions in order, e.g. turn_on or set_mode:mode=eco")
    private List<String> actions = new ArrayList<>();

    @Option(names = "--unknown", description = "Attribute path to start as unknown")
    private List<String> unknownAttributes = new ArrayList<>();

    @Option(names = "--set", description = "Initial attribute value path=value")
    private Map<String, String> initialValues = new LinkedHashMap<>();

    @Option(names = {"--out", "-o"}, description = "Write the graph to this .yaml or .json file")
    private String outputFile;

    @Option(names = "--id", description = "Simulation id (default: sim_<timestamp>)")
    private String simulationId;

    @Option(names = {"--defs", "-d"}, description = "Definition file or directory")
    private String definitionsPath;

    private final SimulationService simulationService;

    public SimulateCommand(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<ActionRequest> requests;
        try {
            requests = actions.stream().map(ActionRequest::parse).toList();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Simulating " + deviceType + ": "
                + String.join(" -> ", requests.stream().map(ActionRequest::describe).toList()));

        SimulationGraph graph;
        try {
            graph = simulationService.simulate(definitionsPath,
                    new SimulationRequest(deviceType, requests, initialValues, unknownAttributes, simulationId));
        } catch (DefinitionLoadException | CatalogException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Simulation failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        System.out.println();
        System.out.println("SIMULATION " + graph.simulationId());
        ConsoleOutput.tree(graph);
        ConsoleOutput.statistics(GraphStatistics.of(graph));

        if (outputFile != null) {
            try {
                var written = simulationService.save(graph, outputFile);
                ConsoleOutput.success("Graph written to " + written);
            } catch (RuntimeException e) {
                ConsoleOutput.error("Failed to write graph: " + ConsoleOutput.rootCauseMessage(e));
                return 1;
            }
        }
        return 0;
    }
}
