package org.spritegrid.texture;

import java.util.ArrayList;
import java.util.List;

/**
 * Bit masks of the two STEX flag fields.
 * <p>
 * Feature flags live in the upper 24 bits of the format word, texture flags in their own word.
 */
public final class StexFlags {

    private StexFlags() {
    }

    public static final int HAS_MIPMAPS = 0x0001_0000;
    public static final int STREAM = 0x0002_0000;
    public static final int DETECT_3D = 0x0004_0000;
    public static final int DETECT_SRGB = 0x0008_0000;
    public static final int DETECT_NORMAL = 0x0010_0000;

    /** Mask of the feature flag bits within the format word. */
    public static final int FEATURE_MASK = 0xFFFF_FF00;

    /** Mask of the image format id within the format word. */
    public static final int IMAGE_FORMAT_MASK = 0xFF;

    public static final int FLAG_MIPMAPS = 0x01;
    public static final int FLAG_REPEAT = 0x02;
    public static final int FLAG_FILTER = 0x04;
    public static final int FLAG_ANISOTROPIC_FILTER = 0x08;
    public static final int FLAG_CONVERT_TO_LINEAR = 0x10;
    public static final int FLAG_MIRRORED_REPEAT = 0x20;
    public static final int FLAG_VIDEO_SURFACE = 0x40;

    private static final String[] FEATURE_NAMES = {"HAS_MIPMAPS", "STREAM", "DETECT_3D", "DETECT_SRGB", "DETECT_NORMAL"};
    private static final int[] FEATURE_BITS = {HAS_MIPMAPS, STREAM, DETECT_3D, DETECT_SRGB, DETECT_NORMAL};

    private static final String[] TEXTURE_NAMES = {"MIPMAPS", "REPEAT", "FILTER", "ANISOTROPIC_FILTER",
        "CONVERT_TO_LINEAR", "MIRRORED_REPEAT", "VIDEO_SURFACE"};
    private static final int[] TEXTURE_BITS = {FLAG_MIPMAPS, FLAG_REPEAT, FLAG_FILTER, FLAG_ANISOTROPIC_FILTER,
        FLAG_CONVERT_TO_LINEAR, FLAG_MIRRORED_REPEAT, FLAG_VIDEO_SURFACE};

    /**
     * Names of the feature flags set in {@code featureFlags}.
     */
    public static List<String> describeFeatures(int featureFlags) {
        return describe(featureFlags, FEATURE_NAMES, FEATURE_BITS);
    }

    /**
     * Names of the texture flags set in {@code textureFlags}.
     */
    public static List<String> describeTexture(int textureFlags) {
        return describe(textureFlags, TEXTURE_NAMES, TEXTURE_BITS);
    }

    private static List<String> describe(int value, String[] names, int[] bits) {
        final List<String> set = new ArrayList<>();
        for (int i = 0; i < bits.length; i++) {
            if ((value & bits[i]) != 0) {
                set.add(names[i]);
            }
        }
        return set;
    }
}
