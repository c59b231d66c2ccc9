package com.pixperfect.assets.common.model;

/**
 * Overlay metadata stored for an asset produced by a transform. Centered
 * position, neutral scale and opacity, empty text.
 */
public final class OverlayDefaults {

    public static final String OVERLAY_PROPS =
            "{\"x\":50,\"y\":50,\"scale\":1,\"opacity\":1.0,\"dragging\":false}";

    public static final String TEXT_OVERLAY =
            "{\"content\":\"\",\"font\":\"Arial\",\"size\":20,\"color\":\"#ffffff\","
                    + "\"x\":50,\"y\":50,\"opacity\":1.0,\"dragging\":false}";

    private OverlayDefaults() {
    }
}
