package com.devicesim.dispatch.cli;

import com.devicesim.core.catalog.CatalogException;
import com.devicesim.core.model.AttributeSpec;
import com.devicesim.core.model.OrderedDomain;
import com.devicesim.io.DefinitionLoadException;
import com.devicesim.service.SimulationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: devsim show &lt;device&gt;
 * <p>
 * Prints a device type's parts, attributes with their domains and defaults, constraints and
 * the actions it can perform.
 */
@Command(name = "show", mixinStandardHelpOptions = true, description = "Describe a device type")
@Component
public class ShowCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Device type name")
    private String deviceType;

    @Option(names = {"--defs", "-d"}, description = "Definition file or directory")
    private String definitionsPath;

    private final SimulationService simulationService;

    public ShowCommand(SimulationService simulationService) {
        this.simulationService = simulationService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            var catalog = simulationService.catalog(definitionsPath);
            var type = catalog.requireDeviceType(deviceType);

            System.out.println();
            System.out.println("DEVICE " + type.name());
            System.out.println(ConsoleOutput.rule());
            type.parts().forEach((part, attributes) -> {
                System.out.println("  " + part);
                printAttributes(catalog.domains(), attributes, "    ");
            });
            if (!type.globals().isEmpty()) {
                System.out.println("  (global)");
                printAttributes(catalog.domains(), type.globals(), "    ");
            }
            if (!type.constraints().isEmpty()) {
                System.out.println();
                System.out.println("  CONSTRAINTS:");
                type.constraints().forEach(c -> System.out.println("    " + c.describe()));
            }
            System.out.println();
            System.out.println("  ACTIONS:");
            for (String name : catalog.availableActions(type.name())) {
                var action = catalog.resolveAction(type.name(), name).orElseThrow();
                String params = action.parameters().isEmpty() ? ""
                        : " " + action.parameters().stream().map(p -> p.name() + (p.choices().isEmpty() ? "" : p.choices().toString())).toList();
                System.out.println("    " + name + params + (action.description().isBlank() ? "" : " - " + action.description()));
            }
            return 0;
        } catch (DefinitionLoadException | CatalogException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private static void printAttributes(Map<String, OrderedDomain> domains,
                                        Map<String, AttributeSpec> attributes, String indent) {
        attributes.values().forEach(spec -> {
            var domain = domains.get(spec.domainId());
            System.out.println(indent + spec.name() + ": " + spec.domainId()
                    + (domain != null ? " " + domain.levels() : "")
                    + " default=" + spec.defaultValue()
                    + (spec.mutable() ? "" : " (read-only)"));
        });
    }
}
