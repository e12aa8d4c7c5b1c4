package com.devicesim.dispatch.cli;

import com.devicesim.core.catalog.CatalogException;
import com.devicesim.core.engine.ClarificationResolver;
import com.devicesim.core.model.ActionRequest;
import com.devicesim.core.model.NodeStatus;
import com.devicesim.io.DefinitionLoadException;
import com.devicesim.service.SimulationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: devsim apply &lt;device&gt; &lt;action&gt; [-p key=value]... [--set path=value]...
 * <p>
 * Applies one action to a fresh device instance without branching. When a precondition reads
 * an unknown attribute the user is asked for its value on stdin and the action is retried.
 */
@Command(name = "apply", mixinStandardHelpOptions = true, description = "Apply one action with interactive clarification")
@Component
public class ApplyCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Device type name")
    private String deviceType;

    @Parameters(index = "1", description = "Action name")
    private String actionName;

    @Option(names = {"--param", "-p"}, description = "Action parameter key=value")
    private Map<String, String> parameters = new LinkedHashMap<>();

    @Option(names = "--set", description = "Initial attribute value path=value")
    private Map<String, String> initialValues = new LinkedHashMap<>();

    @Option(names = "--unknown", description = "Attribute path to start as unknown")
    private List<String> unknownAttributes = new ArrayList<>();

    @Option(names = {"--defs", "-d"}, description = "Definition file or directory")
    private String definitionsPath;

    private final SimulationService simulationService;

    public ApplyCommand(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        var request = new ActionRequest(actionName, parameters);
        var input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        SimulationService.ApplyResult result;
        try {
            result = simulationService.apply(definitionsPath, deviceType, request,
                    initialValues, unknownAttributes, stdinResolver(input));
        } catch (DefinitionLoadException | CatalogException | IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Apply failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        var outcome = result.outcome();
        System.out.println();
        System.out.println(request.describe() + " on " + deviceType + ": " + ConsoleOutput.status(outcome.status()));
        result.answers().forEach((path, value) -> ConsoleOutput.info("Answered " + path + " = " + value));
        if (outcome.message() != null) {
            if (outcome.status() == NodeStatus.OK) {
                ConsoleOutput.info(outcome.message());
            } else {
                ConsoleOutput.warn(outcome.message());
            }
        }
        if (!outcome.changes().isEmpty()) {
            System.out.println();
            System.out.println("  CHANGES:");
            outcome.changes().forEach(ConsoleOutput::change);
        }
        if (result.after() != null) {
            System.out.println();
            System.out.println("  STATE:");
            ConsoleOutput.snapshot(result.after());
        }
        return outcome.status() == NodeStatus.ERROR ? 1 : 0;
    }

    private static ClarificationResolver stdinResolver(BufferedReader input) {
        return (question, attribute, choices) -> {
            ConsoleOutput.question(question + " " + choices + " (blank to skip)");
            try {
                String line = input.readLine();
                return line == null || line.isBlank() ? Optional.empty() : Optional.of(line.trim());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read answer for " + attribute, e);
            }
        };
    }
}
