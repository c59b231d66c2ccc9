package com.pixperfect.assets.common.transform;

import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

public final class Mirror implements TransformOperation {

    private final MirrorAxis axis;

    public Mirror(MirrorAxis axis) {
        this.axis = axis;
    }

    public static Mirror parse(String rawAxis) {
        return new Mirror(MirrorAxis.parse(rawAxis));
    }

    public MirrorAxis getAxis() {
        return axis;
    }

    @Override
    public String getName() {
        return "flipped";
    }

    @Override
    public Dimension outputSize(int width, int height) {
        return new Dimension(width, height);
    }

    @Override
    public BufferedImage applyTo(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage mirrored = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = mirrored.createGraphics();
        try {
            if (axis == MirrorAxis.HORIZONTAL) {
                // top row becomes bottom row
                g2d.drawImage(source, 0, 0, width, height, 0, height, width, 0, null);
            } else {
                g2d.drawImage(source, 0, 0, width, height, width, 0, 0, height, null);
            }
        } finally {
            g2d.dispose();
        }
        return mirrored;
    }

    @Override
    public String toString() {
        return "mirror(" + axis.getValue() + ")";
    }
}
