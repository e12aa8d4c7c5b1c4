package com.devicesim.dispatch.cli;

import com.devicesim.TestDefinitions;
import com.devicesim.config.SimulatorProperties;
import com.devicesim.core.catalog.CatalogException;
import com.devicesim.core.engine.ClarificationResolver;
import com.devicesim.core.engine.SimulationEngine;
import com.devicesim.core.engine.SimulationRequest;
import com.devicesim.core.graph.SimulationGraph;
import com.devicesim.core.metrics.SimulationMetrics;
import com.devicesim.core.model.ActionRequest;
import com.devicesim.io.DefinitionLoadException;
import com.devicesim.io.DefinitionLoader;
import com.devicesim.io.GraphSerializer;
import com.devicesim.service.SimulationService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Tests for the devsim CLI commands using picocli's programmatic API
 * with a mocked {@link SimulationService}.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private SimulationService mockService;

    @BeforeEach
    void setUp() {
        mockService = mock(SimulationService.class);
        when(mockService.resolveDefinitions(any())).thenReturn(TestDefinitions.path());
        when(mockService.catalog(any())).thenReturn(TestDefinitions.catalog());
    }

    private static SimulationGraph flashlightGraph() {
        var engine = new SimulationEngine(TestDefinitions.catalog(), new SimulationMetrics(new SimpleMeterRegistry()), 256);
        return engine.run(new SimulationRequest("flashlight", List.of(ActionRequest.parse("turn_on")),
                Map.of(), List.of("battery.level"), "sim_cli"));
    }

    /**
     * Custom picocli IFactory that hands the mocked service to every command.
     */
    private CommandLine.IFactory createFactory(SimulationService service) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(service);
                }
                if (cls == ShowCommand.class) {
                    return (K) new ShowCommand(service);
                }
                if (cls == ApplyCommand.class) {
                    return (K) new ApplyCommand(service);
                }
                if (cls == SimulateCommand.class) {
                    return (K) new SimulateCommand(service);
                }
                if (cls == InspectCommand.class) {
                    return (K) new InspectCommand(service);
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return executeWithInput("", args);
    }

    private CliResult executeWithInput(String stdin, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        InputStream originalIn = System.in;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        System.setIn(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
        try {
            CommandLine commandLine = new CommandLine(new DevSimCommand(), createFactory(mockService));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
            System.setIn(originalIn);
        }
    }

    // =====================================================================
    //  Help output tests
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            for (String sub : List.of("validate", "show", "apply", "simulate", "inspect", "help")) {
                assertTrue(output.contains(sub), "Help should list '" + sub + "' subcommand");
            }
            assertTrue(output.contains("Branching state simulator"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("devsim 0.1.0"));
        }

        @Test
        @DisplayName("simulate --help shows its options")
        void simulateHelpOutput() {
            CliResult result = execute("simulate", "--help");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("Run a branching simulation"));
            assertTrue(output.contains("--device"));
            assertTrue(output.contains("--unknown"));
            assertTrue(output.contains("--out"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("DEVSIM v0.1.0"));
            assertTrue(result.output().contains("Usage: devsim"));
        }
    }

    // =====================================================================
    //  Validate and show
    // =====================================================================

    @Nested
    @DisplayName("validate and show")
    class CatalogCommands {

        @Test
        @DisplayName("validate summarises the loaded definitions")
        void validateSummary() {
            CliResult result = execute("validate");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("7 domains, 1 capabilities, 2 device types, 8 actions"), output);
            assertTrue(output.contains("flashlight:"));
            assertTrue(output.contains("mixer:"));
        }

        @Test
        @DisplayName("validate reports a load error with exit code 1")
        void validateFailure() {
            when(mockService.catalog("broken")).thenThrow(
                    new DefinitionLoadException(Path.of("broken"), "no definition files found"));
            CliResult result = execute("validate", "--defs", "broken");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("no definition files found"));
        }

        @Test
        @DisplayName("show lists parts, constraints and actions")
        void showDevice() {
            CliResult result = execute("show", "flashlight");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("DEVICE flashlight"));
            assertTrue(output.contains("max_output"));
            assertTrue(output.contains("(read-only)"));
            assertTrue(output.contains("CONSTRAINTS:"));
            assertTrue(output.contains("turn_on - Switch the flashlight on"));
            assertTrue(output.contains("set_brightness"));
        }

        @Test
        @DisplayName("show rejects an unknown device type")
        void showUnknownDevice() {
            CliResult result = execute("show", "toaster");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Unknown device type: toaster"));
        }
    }

    // =====================================================================
    //  Apply
    // =====================================================================

    @Nested
    @DisplayName("apply")
    class ApplyTests {

        @Test
        @DisplayName("reads clarification answers from stdin")
        void answersFromStdin() {
            var properties = new SimulatorProperties();
            properties.setDefinitionsPath(TestDefinitions.path().toString());
            var realService = new SimulationService(new DefinitionLoader(), new GraphSerializer(), properties,
                    new SimulationMetrics(new SimpleMeterRegistry()));
            when(mockService.apply(isNull(), eq("flashlight"), any(ActionRequest.class), anyMap(), anyList(),
                    any(ClarificationResolver.class)))
                    .thenAnswer(inv -> realService.apply(null, inv.getArgument(1), inv.getArgument(2),
                            inv.getArgument(3), inv.getArgument(4), inv.getArgument(5)));

            CliResult result = executeWithInput("full\n", "apply", "flashlight", "turn_on", "--unknown", "battery.level");

            assertEquals(0, result.exitCode(), result.output());
            String output = result.output();
            assertTrue(output.contains("What is battery.level?"));
            assertTrue(output.contains("turn_on on flashlight: OK"));
            assertTrue(output.contains("Answered battery.level = full"));
            assertTrue(output.contains("bulb.brightness = high"));
        }

        @Test
        @DisplayName("unknown action exits with code 1")
        void unknownAction() {
            when(mockService.apply(any(), any(), any(), anyMap(), anyList(), any()))
                    .thenThrow(new CatalogException("Unknown action 'juggle' for device type flashlight"));
            CliResult result = execute("apply", "flashlight", "juggle");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Unknown action 'juggle'"));
        }

        @Test
        @DisplayName("missing action argument is a usage error")
        void missingAction() {
            CliResult result = execute("apply", "flashlight");
            assertEquals(2, result.exitCode());
        }
    }

    // =====================================================================
    //  Simulate and inspect
    // =====================================================================

    @Nested
    @DisplayName("simulate and inspect")
    class SimulationCommands {

        @Test
        @DisplayName("simulate prints the tree and statistics")
        void simulateTree() {
            when(mockService.simulate(isNull(), any(SimulationRequest.class))).thenReturn(flashlightGraph());

            CliResult result = execute("simulate", "--device", "flashlight", "--unknown", "battery.level", "turn_on");

            assertEquals(0, result.exitCode(), result.output());
            String output = result.output();
            assertTrue(output.contains("Simulating flashlight: turn_on"));
            assertTrue(output.contains("SIMULATION sim_cli"));
            assertTrue(output.contains("state0"));
            assertTrue(output.contains("REJECTED"));
            assertTrue(output.contains("Simulation Statistics"));
            assertTrue(output.contains("Nodes: 4"));
            verify(mockService, never()).save(any(), any());
        }

        @Test
        @DisplayName("simulate passes parsed actions and saves with --out")
        void simulateSaves() {
            var graph = flashlightGraph();
            when(mockService.simulate(isNull(), any(SimulationRequest.class))).thenReturn(graph);
            when(mockService.save(graph, "run.yaml")).thenReturn(Path.of("output", "run.yaml"));

            CliResult result = execute("simulate", "-D", "flashlight", "--id", "sim_cli",
                    "--set", "switch.position=off", "turn_on", "set_brightness:level=low", "-o", "run.yaml");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("Graph written to"));
            verify(mockService).simulate(isNull(), argThat(request ->
                    request.deviceType().equals("flashlight")
                            && request.simulationId().equals("sim_cli")
                            && request.initialValues().equals(Map.of("switch.position", "off"))
                            && request.actions().size() == 2
                            && request.actions().get(1).parameters().equals(Map.of("level", "low"))));
        }

        @Test
        @DisplayName("simulate without --device is a usage error")
        void simulateRequiresDevice() {
            CliResult result = execute("simulate", "turn_on");
            assertEquals(2, result.exitCode());
        }

        @Test
        @DisplayName("simulate reports catalog errors with exit code 1")
        void simulateCatalogError() {
            when(mockService.simulate(any(), any(SimulationRequest.class)))
                    .thenThrow(new CatalogException("Unknown device type: toaster. Known types: [flashlight, mixer]"));
            CliResult result = execute("simulate", "-D", "toaster", "turn_on");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Unknown device type: toaster"));
        }

        @Test
        @DisplayName("inspect shows a saved graph")
        void inspectGraph() {
            when(mockService.read(Path.of("run.yaml"))).thenReturn(flashlightGraph());

            CliResult result = execute("inspect", "run.yaml");

            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("SIMULATION sim_cli (flashlight)"));
            assertTrue(result.output().contains("Actions: turn_on"));
        }

        @Test
        @DisplayName("inspect --node shows one node in detail")
        void inspectNode() {
            when(mockService.read(Path.of("run.yaml"))).thenReturn(flashlightGraph());

            CliResult result = execute("inspect", "run.yaml", "--node", "state0");

            assertEquals(0, result.exitCode(), result.output());
            String output = result.output();
            assertTrue(output.contains("NODE state0"));
            assertTrue(output.contains("Parents:   none"));
            assertTrue(output.contains("battery.level = unknown"));
        }

        @Test
        @DisplayName("inspect reports a missing node with exit code 1")
        void inspectMissingNode() {
            when(mockService.read(Path.of("run.yaml"))).thenReturn(flashlightGraph());
            CliResult result = execute("inspect", "run.yaml", "--node", "state99");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Node state99 not found in sim_cli"));
        }
    }
}
