package org.spritegrid.cli.commands;

import com.typesafe.config.Config;
import org.spritegrid.atlas.AtlasProcessor;
import org.spritegrid.atlas.api.AlignmentMode;
import org.spritegrid.atlas.api.AtlasReport;
import org.spritegrid.atlas.api.AtlasResult;
import org.spritegrid.atlas.api.AtlasValidationException;
import org.spritegrid.atlas.model.Raster;
import org.spritegrid.cli.CommandLineInterface;
import org.spritegrid.io.PngRasterCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "process", description = "Re-centres the content of every cell of a 1024x1024 3x3 atlas.")
public class ProcessCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommand.class);
    static final String DEFAULT_MODE_PATH = "spritegrid.atlas.default-mode";

    @Option(names = {"-i", "--in"}, required = true, description = "Input PNG atlas.")
    private Path input;

    @Option(names = {"-o", "--out"}, required = true, description = "Output PNG file.")
    private Path output;

    @Option(names = {"-m", "--mode"},
        description = "Alignment mode: icon, silhouette or generic (default: spritegrid.atlas.default-mode).")
    private String mode;

    @Option(names = "--report", description = "Print a per-cell report after processing.")
    private boolean report;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private final AtlasProcessor processor;
    private final PngRasterCodec codec;

    public ProcessCommand() {
        this(new AtlasProcessor(), new PngRasterCodec());
    }

    ProcessCommand(AtlasProcessor processor, PngRasterCodec codec) {
        this.processor = processor;
        this.codec = codec;
    }

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        final Config config = parent.getConfig();

        try {
            final AlignmentMode alignment = AlignmentMode.fromName(
                mode != null ? mode : config.getString(DEFAULT_MODE_PATH));
            final Raster raster = codec.decode(input);
            final AtlasResult result = processor.processAtlasWithReport(raster, alignment);
            codec.write(result.raster(), output);

            final AtlasReport summary = result.report();
            log.info("Processed {} in {} mode: {} part(s), {} cell(s) filled, {} bridge cut(s)",
                input, alignment, summary.partsFound(), summary.filledCells(), summary.bridgeCuts());
            if (report) {
                printReport(out, summary);
            }
            out.println("Wrote " + output.toAbsolutePath());
            return 0;
        } catch (AtlasValidationException e) {
            err.println("Cannot process " + input + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        }
    }

    static void printReport(PrintWriter out, AtlasReport report) {
        out.println("=== Atlas Report ===");
        out.println("Mode: " + report.mode());
        out.println("Parts found: " + report.partsFound());
        out.printf("Rejected: %d (span %d, size %d, alignment %d)%n", report.rejectedTotal(),
            report.rejectedBySpan(), report.rejectedBySize(), report.rejectedByAlignment());
        out.printf("Bridge cuts: %d (%d pixels erased)%n", report.bridgeCuts(), report.erasedPixels());
        final List<Integer> perCell = report.approvedPerCell();
        for (int row = 0; row < 3; row++) {
            out.printf("  %3d %3d %3d%n", perCell.get(row * 3), perCell.get(row * 3 + 1), perCell.get(row * 3 + 2));
        }
    }
}
