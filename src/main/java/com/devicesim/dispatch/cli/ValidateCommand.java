package com.devicesim.dispatch.cli;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.io.DefinitionLoadException;
import com.devicesim.service.SimulationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: devsim validate [--defs DIR]
 * <p>
 * Loads the definition files and reports what they declare, or the first load error.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Load and check definition files")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Option(names = {"--defs", "-d"}, description = "Definition file or directory (default: devicesim.definitions-path)")
    private String definitionsPath;

    private final SimulationService simulationService;

    public ValidateCommand(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Loading definitions from " + simulationService.resolveDefinitions(definitionsPath));

        DefinitionCatalog catalog;
        try {
            catalog = simulationService.catalog(definitionsPath);
        } catch (DefinitionLoadException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Validation failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        }

        ConsoleOutput.success(String.format("%d domains, %d capabilities, %d device types, %d actions",
                catalog.domains().size(), catalog.capabilities().size(),
                catalog.deviceTypes().size(), catalog.actionCount()));
        catalog.deviceTypes().values().forEach(type -> System.out.println("  " + type.name() + ": "
                + type.attributePaths().size() + " attributes, "
                + type.constraints().size() + " constraints, "
                + catalog.availableActions(type.name()).size() + " actions"));
        return 0;
    }
}
