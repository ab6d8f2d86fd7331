package org.spritegrid.cli.commands;

import com.typesafe.config.Config;
import org.spritegrid.texture.StexCodec;
import org.spritegrid.texture.StexCodec.ReplaceOptions;
import org.spritegrid.texture.StexCodec.StexReplacement;
import org.spritegrid.texture.StexFormatException;
import org.spritegrid.texture.StexImageFormat;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "replace", description = "Replaces the pixels of a STEX texture with a PNG image.")
public class TextureReplaceSubcommand implements Callable<Integer> {

    static final String DEFAULT_FORMAT_PATH = "spritegrid.texture.default-format";

    @Option(names = {"-s", "--stex"}, required = true, description = "Existing STEX file.")
    private Path stex;

    @Option(names = {"-i", "--image"}, required = true, description = "PNG image to inject.")
    private Path image;

    @Option(names = {"-f", "--format"},
        description = "Pixel format, e.g. RGBA8, RGB8, LA8 (default: spritegrid.texture.default-format).")
    private String format;

    @Option(names = {"-o", "--out"}, description = "Output file (default: overwrite the STEX file).")
    private Path output;

    @ParentCommand
    private TextureCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        final Config config = parent.getParent().getConfig();

        final String formatName = format != null ? format : config.getString(DEFAULT_FORMAT_PATH);
        final StexImageFormat imageFormat;
        try {
            imageFormat = StexImageFormat.valueOf(formatName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            err.println("Unknown pixel format: " + formatName);
            return 1;
        }

        try {
            final StexReplacement result = new StexCodec().replace(stex, image,
                ReplaceOptions.defaults().withFormat(imageFormat).withOutputPath(output));
            out.printf("Replaced %dx%d texture with %dx%d %s image (%d -> %d bytes): %s%n",
                result.originalWidth(), result.originalHeight(), result.newWidth(), result.newHeight(),
                result.format(), result.originalSize(), result.newSize(), result.outputPath());
            return 0;
        } catch (IOException | StexFormatException e) {
            err.println("Error replacing texture: " + e.getMessage());
            return 1;
        }
    }
}
