package com.pixperfect.assets.common.transform;

import com.pixperfect.assets.common.exception.InvalidParameterException;

import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Rotates an image clockwise by a whole number of degrees. Angles that are not
 * a multiple of 90 grow the canvas to the rotated bounding box and leave the
 * uncovered corners transparent.
 */
public final class Rotation implements TransformOperation {

    public static final int MIN_DEGREES = -360;
    public static final int MAX_DEGREES = 360;

    private final int degrees;

    public Rotation(int degrees) {
        if (degrees < MIN_DEGREES || degrees > MAX_DEGREES) {
            throw new InvalidParameterException("Rotation out of range: " + degrees);
        }
        this.degrees = degrees;
    }

    /**
     * Parses caller input such as {@code "90"} or {@code "-45"}.
     */
    public static Rotation parse(String rawDegrees) {
        if (rawDegrees == null || rawDegrees.isBlank()) {
            throw new InvalidParameterException("Rotation degrees are required");
        }
        try {
            return new Rotation(Integer.parseInt(rawDegrees.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("Rotation degrees must be an integer: " + rawDegrees, e);
        }
    }

    public int getDegrees() {
        return degrees;
    }

    @Override
    public String getName() {
        return "rotated";
    }

    @Override
    public Dimension outputSize(int width, int height) {
        if (degrees % 90 == 0) {
            boolean swap = Math.abs(degrees / 90) % 2 == 1;
            return swap ? new Dimension(height, width) : new Dimension(width, height);
        }
        double theta = Math.toRadians(degrees);
        double sin = Math.abs(Math.sin(theta));
        double cos = Math.abs(Math.cos(theta));
        return new Dimension(
                Math.max(1, (int) Math.round(width * cos + height * sin)),
                Math.max(1, (int) Math.round(width * sin + height * cos)));
    }

    @Override
    public BufferedImage applyTo(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        boolean rightAngle = degrees % 90 == 0;
        double theta = Math.toRadians(degrees);
        Dimension target = outputSize(width, height);
        int targetWidth = target.width;
        int targetHeight = target.height;

        BufferedImage rotated = new BufferedImage(targetWidth, targetHeight, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = rotated.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, rightAngle
                    ? RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR
                    : RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.translate(targetWidth / 2.0, targetHeight / 2.0);
            g2d.rotate(theta);
            g2d.translate(-width / 2.0, -height / 2.0);
            g2d.drawImage(source, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return rotated;
    }

    @Override
    public String toString() {
        return "rotate(" + degrees + ")";
    }
}
