package org.spritegrid.atlas;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.spritegrid.atlas.api.AlignmentMode;
import org.spritegrid.atlas.api.AtlasReport;
import org.spritegrid.atlas.api.AtlasResult;
import org.spritegrid.atlas.api.InvalidAlignmentModeException;
import org.spritegrid.atlas.api.InvalidRasterShapeException;
import org.spritegrid.atlas.internal.BridgeSeparator;
import org.spritegrid.atlas.internal.CellOwnershipResolver;
import org.spritegrid.atlas.internal.PlacementCompositor;
import org.spritegrid.atlas.model.PixelBounds;
import org.spritegrid.atlas.model.Raster;
import org.spritegrid.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.spritegrid.atlas.TestRasters.blankAtlas;
import static org.spritegrid.atlas.TestRasters.fillRect;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AtlasProcessorTest {

    private static final int THRESHOLD = 10;

    private final AtlasProcessor processor = new AtlasProcessor();

    @Nested
    class Validation {

        @Test
        void rejectsWrongSizeInEveryMode() {
            final Raster small = Raster.blank(512, 512, 4);
            for (AlignmentMode mode : AlignmentMode.values()) {
                assertThatThrownBy(() -> processor.processAtlas(small, mode))
                    .isInstanceOf(InvalidRasterShapeException.class)
                    .hasMessage("Input image must be 1024x1024 pixels, got 512x512");
            }
        }

        @Test
        void rejectsRasterWithoutAlpha() {
            assertThatThrownBy(() -> processor.processAtlas(Raster.blank(1024, 1024, 3), AlignmentMode.ICON))
                .isInstanceOf(InvalidRasterShapeException.class)
                .hasMessageContaining("alpha channel")
                .satisfies(e -> assertThat(((InvalidRasterShapeException) e).getChannels()).isEqualTo(3));
        }

        @Test
        void rejectsUnknownModeName() {
            assertThatThrownBy(() -> processor.processAtlas(blankAtlas(), "diagonal"))
                .isInstanceOf(InvalidAlignmentModeException.class)
                .hasMessageContaining("diagonal");
        }

        @Test
        void rejectsMissingMode() {
            assertThatThrownBy(() -> processor.processAtlas(blankAtlas(), (AlignmentMode) null))
                .isInstanceOf(InvalidAlignmentModeException.class);
        }

        @Test
        void acceptsModeAliases() throws Exception {
            final Raster input = fillRect(blankAtlas(), 0, 0, 49, 49);

            assertThat(processor.processAtlas(input, "Faces")
                .contentEquals(processor.processAtlas(input, AlignmentMode.SILHOUETTE))).isTrue();
            assertThat(processor.processAtlas(input, " center ")
                .contentEquals(processor.processAtlas(input, AlignmentMode.GENERIC))).isTrue();
        }
    }

    @Nested
    class Properties {

        @ParameterizedTest
        @EnumSource(AlignmentMode.class)
        void outputKeepsDimensionsAndChannels(AlignmentMode mode) throws Exception {
            final Raster input = new Raster(1024, 1024, 5, new byte[1024 * 1024 * 5]);

            final Raster output = processor.processAtlas(input, mode);

            assertThat(output.getWidth()).isEqualTo(1024);
            assertThat(output.getHeight()).isEqualTo(1024);
            assertThat(output.getChannels()).isEqualTo(5);
        }

        @ParameterizedTest
        @EnumSource(AlignmentMode.class)
        void processingIsDeterministic(AlignmentMode mode) throws Exception {
            final Raster input = TestRasters.fusedPair();
            fillRect(input, 400, 500, 600, 640);
            fillRect(input, 700, 900, 1000, 1000);

            final Raster first = processor.processAtlas(input, mode);
            final Raster second = processor.processAtlas(input, mode);

            assertThat(second.contentEquals(first)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(AlignmentMode.class)
        void inputIsNeverModified(AlignmentMode mode) throws Exception {
            final Raster input = TestRasters.fusedPair();
            final Raster snapshot = input.copy();

            processor.processAtlas(input, mode);

            assertThat(input.contentEquals(snapshot)).isTrue();
        }

        @Test
        @DisplayName("A cluster at the exact centre of a cell stays where it is")
        void centredClusterIsConserved() throws Exception {
            final Raster input = fillRect(blankAtlas(), 510, 510, 512, 512);

            final Raster output = processor.processAtlas(input, AlignmentMode.ICON);

            assertThat(output.contentEquals(input)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(AlignmentMode.class)
        void noiseIsRemoved(AlignmentMode mode) throws Exception {
            final Raster input = blankAtlas();
            fillRect(input, 100, 100, 102, 100);
            input.setPixel(800, 800, 255, 255, 255, 255);

            final Raster output = processor.processAtlas(input, mode);

            assertThat(output.countOpaque(THRESHOLD)).isZero();
        }

        @Test
        void iconModeDropsPartsAcrossThreeCells() throws Exception {
            final Raster input = fillRect(blankAtlas(), 0, 100, 1023, 105);

            assertThat(processor.processAtlas(input, AlignmentMode.ICON).countOpaque(THRESHOLD)).isZero();
            // Generic keeps it; centred in a 342 pixel cell, its right 341 columns fall off the raster.
            assertThat(processor.processAtlas(input, AlignmentMode.GENERIC).countOpaque(THRESHOLD))
                .isEqualTo(683 * 6);
        }

        @Test
        void modesProduceDifferentOutput() throws Exception {
            final Raster input = TestRasters.fusedPair();

            final Raster icon = processor.processAtlas(input, AlignmentMode.ICON);
            final Raster silhouette = processor.processAtlas(input, AlignmentMode.SILHOUETTE);

            assertThat(icon.contentEquals(silhouette)).isFalse();
        }
    }

    @Nested
    class Scenarios {

        @Test
        @DisplayName("A 50x50 square in the top-left corner is centred in its cell")
        void squareInCornerIsCentred() throws Exception {
            final Raster input = fillRect(blankAtlas(), 0, 0, 49, 49);

            final Raster output = processor.processAtlas(input, "icon");

            assertThat(output.opaqueBounds(0, 0, 1024, 1024, THRESHOLD))
                .isEqualTo(new PixelBounds(145, 194, 145, 194));
            assertThat(output.countOpaque(THRESHOLD)).isEqualTo(2500);
            assertThat(output.sample(145, 145, 0)).isEqualTo(input.sample(0, 0, 0));
        }

        @Test
        @DisplayName("Fused silhouettes are severed and stand on the bottom of their own cells")
        void fusedSilhouettesAreSeparated() throws Exception {
            final Raster input = TestRasters.fusedPair();
            final int inputOpaque = input.countOpaque(THRESHOLD);

            final AtlasResult result = processor.processAtlasWithReport(input, AlignmentMode.SILHOUETTE);
            final Raster output = result.raster();

            assertThat(output.opaqueBounds(0, 0, 341, 1024, THRESHOLD))
                .isEqualTo(new PixelBounds(20, 320, 80, 340));
            assertThat(output.opaqueBounds(341, 0, 1024, 1024, THRESHOLD))
                .isEqualTo(new PixelBounds(361, 660, 80, 340));
            assertThat(output.countOpaque(THRESHOLD)).isEqualTo(inputOpaque - 5);

            final AtlasReport report = result.report();
            assertThat(report.bridgeCuts()).isEqualTo(1);
            assertThat(report.erasedPixels()).isEqualTo(5);
            assertThat(report.partsFound()).isEqualTo(2);
            assertThat(report.approvedPerCell()).containsExactly(1, 1, 0, 0, 0, 0, 0, 0, 0);
            assertThat(report.filledCells()).isEqualTo(2);
        }

        @Test
        void threeFusedSilhouettesAreSeparatedIntoTheirOwnCells() throws Exception {
            final Raster input = TestRasters.fusedTriple();
            final int inputOpaque = input.countOpaque(THRESHOLD);

            final AtlasResult result = processor.processAtlasWithReport(input, AlignmentMode.SILHOUETTE);
            final Raster output = result.raster();

            assertThat(output.opaqueBounds(0, 0, 341, 1024, THRESHOLD))
                .isEqualTo(new PixelBounds(13, 326, 80, 340));
            assertThat(output.opaqueBounds(341, 0, 682, 1024, THRESHOLD))
                .isEqualTo(new PixelBounds(355, 667, 80, 340));
            assertThat(output.opaqueBounds(682, 0, 1024, 1024, THRESHOLD))
                .isEqualTo(new PixelBounds(696, 1009, 80, 340));
            assertThat(output.countOpaque(THRESHOLD)).isEqualTo(inputOpaque - 10);

            final AtlasReport report = result.report();
            assertThat(report.bridgeCuts()).isEqualTo(2);
            assertThat(report.erasedPixels()).isEqualTo(10);
            assertThat(report.partsFound()).isEqualTo(3);
            assertThat(report.approvedPerCell()).containsExactly(1, 1, 1, 0, 0, 0, 0, 0, 0);
            assertThat(report.rejectedTotal()).isZero();
        }

        @Test
        void reportCountsRejections() throws Exception {
            final Raster input = blankAtlas();
            fillRect(input, 0, 100, 1023, 105);
            fillRect(input, 400, 400, 450, 450);

            final AtlasReport report = processor.processAtlasWithReport(input, AlignmentMode.ICON).report();

            assertThat(report.mode()).isEqualTo(AlignmentMode.ICON);
            assertThat(report.partsFound()).isEqualTo(2);
            assertThat(report.rejectedBySpan()).isEqualTo(1);
            assertThat(report.rejectedTotal()).isEqualTo(1);
            assertThat(report.approvedPerCell().get(4)).isEqualTo(1);
            assertThat(report.bridgeCuts()).isZero();
        }
    }

    @Test
    void bridgeSeparatorOnlyRunsInSilhouetteMode() throws Exception {
        final BridgeSeparator separator = mock(BridgeSeparator.class);
        final AtlasProcessor withMock = new AtlasProcessor(separator, new CellOwnershipResolver(),
            new PlacementCompositor());

        withMock.processAtlas(TestRasters.fusedPair(), AlignmentMode.ICON);
        withMock.processAtlas(TestRasters.fusedPair(), AlignmentMode.GENERIC);
        verify(separator, never()).separate(any(), any());

        withMock.processAtlas(TestRasters.fusedPair(), AlignmentMode.SILHOUETTE);
        verify(separator).separate(any(), any());
    }
}
