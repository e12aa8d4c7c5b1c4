package com.devicesim.dispatch.cli;

import com.devicesim.core.graph.GraphStatistics;
import com.devicesim.core.graph.SimulationGraph;
import com.devicesim.core.graph.TreeNode;
import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.NodeStatus;
import com.devicesim.core.model.Trend;
import com.devicesim.core.snapshot.WorldSnapshot;
import picocli.CommandLine;

import java.util.HashSet;
import java.util.Set;

/**
 * ANSI-colored terminal output utilities for the devsim CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DEVSIM v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DEVSIM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void question(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [?]|@ " + message));
    }

    public static String status(NodeStatus status) {
        String color = switch (status) {
            case OK -> "fg(green)";
            case REJECTED -> "fg(yellow)";
            case CONSTRAINT_VIOLATED -> "fg(magenta)";
            case ERROR -> "fg(red)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status.wireName().toUpperCase() + "|@");
    }

    public static void change(AttributeChange change) {
        String symbol = switch (change.kind()) {
            case VALUE -> "~";
            case TREND -> "^";
            case NARROWING -> "?";
            case CONSTRAINT -> "!";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) " + symbol + "|@ " + change.describe()));
    }

    public static void snapshot(WorldSnapshot snapshot) {
        snapshot.attributes().forEach((path, state) -> System.out.println("  " + path + " = "
                + state.value().render() + (state.trend() == Trend.NONE ? "" : " (" + state.trend().wireName() + ")")));
    }

    /**
     * Prints the graph depth first. A node reached from several parents is expanded under its
     * first parent and referenced elsewhere.
     */
    public static void tree(SimulationGraph graph) {
        var root = graph.root();
        if (root == null) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + root.id() + "|@ [root]"));
        printChildren(graph, root, "", new HashSet<>());
    }

    private static void printChildren(SimulationGraph graph, TreeNode parent, String indent, Set<String> printed) {
        var children = graph.children(parent.id());
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            var child = graph.node(children.get(i));
            String branch = last ? "└── " : "├── ";
            String condition = child.branchCondition() != null ? " when " + child.branchCondition().describe() : "";
            if (!printed.add(child.id())) {
                System.out.println(indent + branch + child.id() + " (merged)" + condition);
                continue;
            }
            System.out.println(CommandLine.Help.Ansi.AUTO.string(indent + branch + "@|bold " + child.id() + "|@ "
                    + child.actionName() + " " + status(child.status()) + condition));
            String childIndent = indent + (last ? "    " : "│   ");
            if (child.error() != null) {
                System.out.println(childIndent + "  " + child.error());
            }
            printChildren(graph, child, childIndent, printed);
        }
    }

    public static void statistics(GraphStatistics stats) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Simulation Statistics|@"));
        System.out.println("  Nodes: " + stats.totalNodes() + " (" + stats.leafNodes() + " leaves, "
                + stats.mergedNodes() + " merged)");
        System.out.println("  Depth: " + stats.depth() + ", width: " + stats.width()
                + ", branch points: " + stats.branchPoints());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Actions: @|fg(green) " + stats.successfulActions() + " ok|@, @|fg(red) "
                        + stats.failedActions() + " not ok|@"));
        System.out.println("  Edges: " + stats.edgeCount());
    }

    public static String rule() {
        return RULE;
    }

    static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
