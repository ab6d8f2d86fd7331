package org.spritegrid.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.spritegrid.atlas.AtlasInspector;
import org.spritegrid.atlas.AtlasInspector.AtlasStructure;
import org.spritegrid.atlas.model.Raster;
import org.spritegrid.io.PngRasterCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "inspect", description = "Shows the structure of an atlas image and its parts per cell.")
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "PNG image to inspect.")
    private Path image;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: summary, json (default: summary)"
    )
    private String format = "summary";

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Raster raster;
        try {
            raster = new PngRasterCodec().decode(image);
        } catch (IOException e) {
            err.println("Error reading image: " + e.getMessage());
            return 1;
        }

        final AtlasStructure structure = AtlasInspector.inspect(raster);
        final List<Integer> partsPerCell = AtlasInspector.partsPerCell(raster);

        switch (format.toLowerCase()) {
            case "json" -> {
                final Map<String, Object> json = new LinkedHashMap<>();
                json.put("width", structure.width());
                json.put("height", structure.height());
                json.put("channels", structure.channels());
                json.put("hasAlpha", structure.hasAlpha());
                json.put("tileSize", structure.tileSize());
                json.put("processable", structure.isProcessable());
                json.put("partsPerCell", partsPerCell);
                final Gson gson = new GsonBuilder().setPrettyPrinting().create();
                out.println(gson.toJson(json));
            }
            case "summary" -> {
                out.println("=== Atlas Structure ===");
                out.println("Size: " + structure.width() + "x" + structure.height());
                out.println("Channels: " + structure.channels() + (structure.hasAlpha() ? " (alpha)" : " (no alpha)"));
                out.printf("Tile size: %.2f%n", structure.tileSize());
                out.println("Processable: " + (structure.isProcessable() ? "yes" : "no"));
                out.println("Parts per cell:");
                for (int row = 0; row < 3; row++) {
                    out.printf("  %3d %3d %3d%n",
                        partsPerCell.get(row * 3), partsPerCell.get(row * 3 + 1), partsPerCell.get(row * 3 + 2));
                }
            }
            default -> {
                err.println("Unknown format: " + format + ". Supported formats: summary, json");
                return 1;
            }
        }
        return 0;
    }
}
