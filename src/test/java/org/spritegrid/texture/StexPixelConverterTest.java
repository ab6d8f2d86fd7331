package org.spritegrid.texture;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.spritegrid.atlas.model.Raster;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class StexPixelConverterTest {

    private static Raster onePixel(int r, int g, int b, int a) {
        final Raster raster = Raster.blank(1, 1, 4);
        raster.setPixel(0, 0, r, g, b, a);
        return raster;
    }

    @Test
    void outputLengthFollowsBytesPerPixel() {
        final Raster raster = Raster.blank(5, 3, 4);
        for (StexImageFormat format : StexImageFormat.values()) {
            assertThat(StexPixelConverter.convert(raster, format)).hasSize(15 * format.bytesPerPixel());
        }
    }

    @Test
    void luminanceUsesRec709Weights() {
        assertThat(StexPixelConverter.luminance(255, 255, 255)).isEqualTo(255);
        assertThat(StexPixelConverter.luminance(0, 0, 0)).isZero();
        assertThat(StexPixelConverter.luminance(255, 0, 0)).isEqualTo(54);
        assertThat(StexPixelConverter.luminance(0, 255, 0)).isEqualTo(182);
        assertThat(StexPixelConverter.luminance(0, 0, 255)).isEqualTo(18);
    }

    @Test
    void la8KeepsAlpha() {
        final byte[] data = StexPixelConverter.convert(onePixel(0, 255, 0, 77), StexImageFormat.LA8);
        assertThat(data).containsExactly(182, 77);
    }

    @Test
    void rgbDropsAlphaAndRgbaKeepsIt() {
        final Raster raster = onePixel(1, 2, 3, 4);
        assertThat(StexPixelConverter.convert(raster, StexImageFormat.RGB8)).containsExactly(1, 2, 3);
        assertThat(StexPixelConverter.convert(raster, StexImageFormat.RGBA8)).containsExactly(1, 2, 3, 4);
        assertThat(StexPixelConverter.convert(raster, StexImageFormat.RG8)).containsExactly(1, 2);
    }

    @Test
    void packedFormatsAreLittleEndian() {
        final Raster white = onePixel(255, 255, 255, 255);
        assertThat(StexPixelConverter.convert(white, StexImageFormat.RGB565)).containsExactly(0xFF, 0xFF);

        final Raster red = onePixel(255, 0, 0, 0);
        // 0xF800
        assertThat(StexPixelConverter.convert(red, StexImageFormat.RGB565)).containsExactly(0x00, 0xF8);
        // 0xF000
        assertThat(StexPixelConverter.convert(red, StexImageFormat.RGBA4444)).containsExactly(0x00, 0xF0);
        // 0xF800, alpha bit clear
        assertThat(StexPixelConverter.convert(red, StexImageFormat.RGBA5551)).containsExactly(0x00, 0xF8);
    }

    @Test
    void rgbRasterIsTreatedAsOpaque() {
        final Raster rgb = Raster.blank(1, 1, 3);
        rgb.setPixel(0, 0, 9, 8, 7);
        assertThat(StexPixelConverter.convert(rgb, StexImageFormat.RGBA8)).containsExactly(9, 8, 7, 255);
    }
}
