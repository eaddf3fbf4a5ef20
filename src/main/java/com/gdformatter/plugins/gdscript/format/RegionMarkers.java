package com.gdformatter.plugins.gdscript.format;

/**
 * Recognizes {@code #region} and {@code #endregion} folding markers.
 */
final class RegionMarkers {

    private RegionMarkers() {
    }

    static boolean opensRegion(String text) {
        return text != null && text.strip().startsWith("#region");
    }

    static boolean closesRegion(String text) {
        return text != null && text.strip().startsWith("#endregion");
    }
}
