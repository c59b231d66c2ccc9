package com.pixperfect.assets.common.transform;

import com.pixperfect.assets.common.exception.UnprocessableAssetException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Decodes an image, applies a {@link TransformOperation} and encodes the result
 * as PNG. Stateless and safe to share between requests.
 *
 * <p>Both the declared source size and the canvas the operation would allocate
 * must stay within {@code assets.transform.max-pixels}. The source size is read
 * from the image header, so oversized images are refused before any pixel data
 * is decoded.
 */
@Slf4j
@Component
public class ImageTransformer {

    public static final String OUTPUT_FORMAT = "png";
    public static final String OUTPUT_CONTENT_TYPE = "image/png";
    public static final long DEFAULT_MAX_PIXELS = 25_000_000L;

    private final long maxPixels;

    public ImageTransformer() {
        this(DEFAULT_MAX_PIXELS);
    }

    @Autowired
    public ImageTransformer(@Value("${assets.transform.max-pixels:25000000}") long maxPixels) {
        if (maxPixels <= 0) {
            throw new IllegalArgumentException("assets.transform.max-pixels must be positive");
        }
        this.maxPixels = maxPixels;
    }

    public long getMaxPixels() {
        return maxPixels;
    }

    public byte[] apply(TransformOperation operation, byte[] input) {
        BufferedImage source = decode(operation, input);
        log.debug("Applying {} to {}x{} image", operation, source.getWidth(), source.getHeight());

        BufferedImage result = operation.applyTo(source);

        ByteArrayOutputStream outputStream = new ByteArrayOutputStream(Math.max(1024, input.length));
        try {
            if (!ImageIO.write(result, OUTPUT_FORMAT, outputStream)) {
                throw new UnprocessableAssetException("No " + OUTPUT_FORMAT + " writer available");
            }
        } catch (IOException e) {
            throw new UnprocessableAssetException("Could not encode transformed image", e);
        }
        return outputStream.toByteArray();
    }

    private BufferedImage decode(TransformOperation operation, byte[] input) {
        if (input == null || input.length == 0) {
            throw new UnprocessableAssetException("Image is empty");
        }
        try (ImageInputStream stream = ImageIO.createImageInputStream(new ByteArrayInputStream(input))) {
            Iterator<ImageReader> readers = stream == null ? null : ImageIO.getImageReaders(stream);
            if (readers == null || !readers.hasNext()) {
                throw new UnprocessableAssetException("Unsupported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(stream, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                checkBudget("Image", width, height);
                Dimension target = operation.outputSize(width, height);
                checkBudget("Transformed image", target.width, target.height);

                BufferedImage image = reader.read(0);
                if (image == null) {
                    throw new UnprocessableAssetException("Unsupported image format");
                }
                return image;
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof UnprocessableAssetException) {
                throw (UnprocessableAssetException) e;
            }
            // corrupt streams surface from some readers as unchecked exceptions
            throw new UnprocessableAssetException("Could not read image", e);
        }
    }

    private void checkBudget(String what, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new UnprocessableAssetException(what + " has no pixels: " + width + "x" + height);
        }
        long pixels = (long) width * height;
        if (pixels > maxPixels) {
            throw new UnprocessableAssetException(
                    what + " too large: " + width + "x" + height + " exceeds " + maxPixels + " pixels");
        }
    }
}
