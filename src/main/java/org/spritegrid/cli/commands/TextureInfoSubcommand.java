package org.spritegrid.cli.commands;

import org.spritegrid.texture.StexCodec;
import org.spritegrid.texture.StexCodec.StexInfo;
import org.spritegrid.texture.StexFormatException;
import org.spritegrid.texture.StexHeader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "info", description = "Prints the header of a STEX texture.")
public class TextureInfoSubcommand implements Callable<Integer> {

    @Parameters(index = "0", description = "STEX file.")
    private Path stex;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        try {
            final StexInfo info = new StexCodec().info(stex);
            final StexHeader header = info.header();
            out.println("=== STEX Texture ===");
            out.println("File size: " + info.fileSize() + " bytes");
            out.println("Dimensions: " + header.widthA() + "x" + header.heightA());
            out.printf("Format: %s (0x%02X), %d byte(s) per pixel%n",
                info.formatName(), header.imageFormatId(), header.bytesPerPixel());
            out.println("Texture flags: " + info.textureFlagNames());
            out.println("Feature flags: " + info.featureFlagNames());
            out.println("Pixel data: " + info.pixelDataSize() + " bytes (top level expects "
                + header.expectedPixelDataSize() + ")");
            return 0;
        } catch (IOException | StexFormatException e) {
            spec.commandLine().getErr().println("Error reading texture: " + e.getMessage());
            return 1;
        }
    }
}
