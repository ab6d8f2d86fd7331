package org.spritegrid.cli.commands;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.spritegrid.atlas.model.Raster;
import org.spritegrid.cli.CommandLineInterface;
import org.spritegrid.cli.config.LoggingConfigurator;
import org.spritegrid.io.PngRasterCodec;
import org.spritegrid.texture.StexCodec;
import org.spritegrid.texture.StexFlags;
import org.spritegrid.texture.StexHeader;
import org.spritegrid.texture.StexImageFormat;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TextureCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path stex;
    private Path png;

    @BeforeEach
    void setUp() throws Exception {
        stex = tempDir.resolve("atlas.stex");
        Files.write(stex, StexCodec.encode(Raster.blank(16, 16, 4), StexImageFormat.RGBA8,
            StexFlags.FLAG_FILTER, StexFlags.HAS_MIPMAPS | StexFlags.DETECT_SRGB));
        png = tempDir.resolve("atlas.png");
        new PngRasterCodec().write(Raster.blank(8, 4, 4), png);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private int execute(String... args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void infoPrintsHeader() {
        final int exitCode = execute("texture", "info", stex.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Dimensions: 16x16")
            .contains("Format: RGBA8 (0x05), 4 byte(s) per pixel")
            .contains("Texture flags: [FILTER]")
            .contains("Feature flags: [HAS_MIPMAPS, DETECT_SRGB]")
            .contains("Pixel data: 1024 bytes");
    }

    @Test
    void infoRejectsNonTexture() throws Exception {
        final Path bogus = tempDir.resolve("bogus.stex");
        Files.write(bogus, new byte[]{1, 2, 3});

        final int exitCode = execute("texture", "info", bogus.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid STEX file: too small");
    }

    @Test
    void replaceUsesConfiguredDefaultFormat() throws Exception {
        final int exitCode = execute("texture", "replace", "--stex", stex.toString(), "--image", png.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Replaced 16x16 texture with 8x4 RGBA8 image");
        final StexHeader header = StexHeader.parse(Files.readAllBytes(stex));
        assertThat(header.widthA()).isEqualTo(8);
        assertThat(header.hasMipmaps()).isFalse();
        assertThat(header.featureFlags()).isEqualTo(StexFlags.DETECT_SRGB);
    }

    @Test
    void replaceWritesRequestedFormatToSeparateFile() throws Exception {
        final Path target = tempDir.resolve("converted.stex");

        final int exitCode = execute("texture", "replace", "-s", stex.toString(), "-i", png.toString(),
            "-f", "la8", "-o", target.toString());

        assertThat(exitCode).isZero();
        assertThat(StexHeader.parse(Files.readAllBytes(target)).formatName()).isEqualTo("LA8");
        assertThat(Files.size(target)).isEqualTo(StexHeader.SIZE + 8 * 4 * 2);
        assertThat(StexHeader.parse(Files.readAllBytes(stex)).widthA()).isEqualTo(16);
    }

    @Test
    void replaceRejectsUnknownFormat() {
        final int exitCode = execute("texture", "replace", "-s", stex.toString(), "-i", png.toString(),
            "-f", "DXT5");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown pixel format: DXT5");
    }

    @Test
    void replaceRejectsImageTooLargeForTexture() throws Exception {
        final Path wide = tempDir.resolve("wide.png");
        new PngRasterCodec().write(Raster.blank(StexHeader.MAX_DIMENSION + 1, 1, 4), wide);

        final int exitCode = execute("texture", "replace", "-s", stex.toString(), "-i", wide.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error replacing texture: Image is 65536x1");
        assertThat(StexHeader.parse(Files.readAllBytes(stex)).widthA()).isEqualTo(16);
    }
}
