package com.devicesim.dispatch.cli;

import com.devicesim.core.graph.GraphStatistics;
import com.devicesim.core.graph.SimulationGraph;
import com.devicesim.core.graph.TreeNode;
import com.devicesim.core.model.ActionRequest;
import com.devicesim.service.SimulationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: devsim inspect &lt;file&gt; [--node ID]
 * <p>
 * Reads a saved graph and prints its statistics, or the details of one node: snapshot,
 * branch condition, changes and every parent it was reached from.
 */
@Command(name = "inspect", mixinStandardHelpOptions = true, description = "Inspect a saved simulation graph")
@Component
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Graph file (.yaml or .json)")
    private Path file;

    @Option(names = {"--node", "-n"}, description = "Node id to show in detail")
    private String nodeId;

    private final SimulationService simulationService;

    public InspectCommand(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        SimulationGraph graph;
        try {
            graph = simulationService.read(file);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        if (nodeId == null) {
            System.out.println();
            System.out.println("SIMULATION " + graph.simulationId() + " (" + graph.deviceType() + ")");
            System.out.println("Actions: " + String.join(" -> ",
                    graph.actions().stream().map(ActionRequest::describe).toList()));
            ConsoleOutput.tree(graph);
            ConsoleOutput.statistics(GraphStatistics.of(graph));
            return 0;
        }

        if (!graph.contains(nodeId)) {
            ConsoleOutput.error("Node " + nodeId + " not found in " + graph.simulationId());
            return 1;
        }
        printNode(graph, graph.node(nodeId));
        return 0;
    }

    private static void printNode(SimulationGraph graph, TreeNode node) {
        System.out.println();
        System.out.println("NODE " + node.id());
        System.out.println(ConsoleOutput.rule());
        System.out.println("  Action:    " + (node.actionName() != null ? node.actionName() : "-"));
        if (!node.parameters().isEmpty()) {
            System.out.println("  Params:    " + node.parameters());
        }
        System.out.println("  Status:    " + ConsoleOutput.status(node.status()));
        System.out.println("  Parents:   " + (node.parentIds().isEmpty() ? "none" : String.join(", ", node.parentIds())));
        System.out.println("  Children:  " + (graph.children(node.id()).isEmpty() ? "none"
                : String.join(", ", graph.children(node.id()))));
        System.out.println("  Condition: " + (node.branchCondition() != null ? node.branchCondition().describe() : "-"));
        if (node.error() != null) {
            System.out.println("  Error:     " + node.error());
        }
        System.out.println("  Hash:      " + node.snapshot().stateHash());

        if (!node.changes().isEmpty()) {
            System.out.println();
            System.out.println("  CHANGES:");
            node.changes().forEach(ConsoleOutput::change);
        }
        System.out.println();
        System.out.println("  STATE:");
        ConsoleOutput.snapshot(node.snapshot());

        for (var edge : node.incomingEdges()) {
            System.out.println();
            System.out.println("  ALSO REACHED FROM " + edge.parentId() + " via " + edge.actionName()
                    + " (" + edge.status().wireName() + ")"
                    + (edge.branchCondition() != null ? " when " + edge.branchCondition().describe() : ""));
            edge.changes().forEach(ConsoleOutput::change);
        }
    }
}
