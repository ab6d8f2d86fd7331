package org.spritegrid.cli.commands;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.spritegrid.atlas.AtlasProcessor;
import org.spritegrid.atlas.TestRasters;
import org.spritegrid.atlas.api.AlignmentMode;
import org.spritegrid.atlas.api.AtlasReport;
import org.spritegrid.atlas.api.AtlasResult;
import org.spritegrid.atlas.model.PixelBounds;
import org.spritegrid.atlas.model.Raster;
import org.spritegrid.cli.CommandLineInterface;
import org.spritegrid.cli.config.LoggingConfigurator;
import org.spritegrid.io.PngRasterCodec;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
class ProcessCommandTest {

    @TempDir
    Path tempDir;

    private final PngRasterCodec codec = new PngRasterCodec();
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path input;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        input = tempDir.resolve("atlas.png");
        output = tempDir.resolve("out/atlas.png");
        codec.write(TestRasters.fillRect(TestRasters.blankAtlas(), 0, 0, 49, 49), input);
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private int execute(CommandLine.IFactory factory, String... args) {
        final CommandLine commandLine = factory == null
            ? new CommandLine(new CommandLineInterface())
            : new CommandLine(new CommandLineInterface(), factory);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    void processesAtlasAndWritesPng() throws Exception {
        final int exitCode = execute(null, "process", "-i", input.toString(), "-o", output.toString(),
            "--mode", "icon", "--report");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Wrote " + output.toAbsolutePath())
            .contains("Mode: icon")
            .contains("Parts found: 1");
        final Raster written = codec.decode(output);
        assertThat(written.opaqueBounds(0, 0, 1024, 1024, 10)).isEqualTo(new PixelBounds(145, 194, 145, 194));
    }

    @Test
    void defaultModeComesFromConfiguration() throws Exception {
        final Path conf = tempDir.resolve("spritegrid.conf");
        Files.writeString(conf, "spritegrid.atlas.default-mode = \"silhouette\"\n");

        final int exitCode = execute(null, "--config", conf.toString(),
            "process", "-i", input.toString(), "-o", output.toString(), "--report");

        assertThat(exitCode).isZero();
        // The 50x50 square is too small for a silhouette.
        assertThat(out.toString()).contains("Mode: silhouette", "Rejected: 1 (span 0, size 1, alignment 0)");
        assertThat(codec.decode(output).countOpaque(10)).isZero();
    }

    @Test
    void aliasIsResolvedBeforeProcessing() throws Exception {
        final AtlasProcessor processor = mock(AtlasProcessor.class);
        final AtlasReport report = new AtlasReport(AlignmentMode.SILHOUETTE, 0,
            List.of(0, 0, 0, 0, 0, 0, 0, 0, 0), 0, 0, 0, 0, 0);
        when(processor.processAtlasWithReport(any(), eq(AlignmentMode.SILHOUETTE)))
            .thenReturn(new AtlasResult(TestRasters.blankAtlas(), report));
        final CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ProcessCommand.class) {
                    return cls.cast(new ProcessCommand(processor, codec));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };

        final int exitCode = execute(factory, "process", "-i", input.toString(), "-o", output.toString(),
            "-m", "faces");

        assertThat(exitCode).isZero();
        verify(processor).processAtlasWithReport(any(Raster.class), eq(AlignmentMode.SILHOUETTE));
        assertThat(Files.exists(output)).isTrue();
    }

    @Test
    void unknownModeFails() {
        final int exitCode = execute(null, "process", "-i", input.toString(), "-o", output.toString(),
            "-m", "sideways");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown alignment mode 'sideways'");
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void wrongSizedImageFails() throws Exception {
        final Path small = tempDir.resolve("small.png");
        codec.write(Raster.blank(512, 512, 4), small);

        final int exitCode = execute(null, "process", "-i", small.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Input image must be 1024x1024 pixels, got 512x512");
    }

    @Test
    void missingInputFails() {
        final int exitCode = execute(null, "process", "-i", tempDir.resolve("nope.png").toString(),
            "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("I/O error");
    }

    @Test
    void missingRequiredOptionIsAUsageError() {
        final int exitCode = execute(null, "process", "-i", input.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--out");
    }
}
