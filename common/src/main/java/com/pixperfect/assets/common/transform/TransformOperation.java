package com.pixperfect.assets.common.transform;

import java.awt.Dimension;
import java.awt.image.BufferedImage;

/**
 * A named, parameterised image operation. Implementations never touch storage.
 */
public interface TransformOperation {

    /**
     * Short name used in logs and in the suggested name of the produced blob.
     */
    String getName();

    /**
     * Size of the canvas {@link #applyTo} allocates for a source of the given size.
     */
    Dimension outputSize(int width, int height);

    BufferedImage applyTo(BufferedImage source);
}
