package era.rank.building;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.apache.commons.io.FileUtils;

public class FaceCropper {
    private FaceCropper() {}

    /**
     * @return the clamped face region, or null when the box falls outside the image
     */
    public static BufferedImage crop(BufferedImage image, BoundingBox box) {
        int[] region = box.clampedPixels(image.getWidth(), image.getHeight());
        if (region == null) {
            return null;
        }
        BufferedImage cropped = new BufferedImage(region[2], region[3], BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < region[3]; y++) {
            for (int x = 0; x < region[2]; x++) {
                cropped.setRGB(x, y, image.getRGB(region[0] + x, region[1] + y));
            }
        }
        return cropped;
    }

    public static BufferedImage resizeSquare(BufferedImage image, int size) {
        if (image.getWidth() == size && image.getHeight() == size) {
            return image;
        }
        BufferedImage resized = new BufferedImage(size, size, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(image, 0, 0, size, size, null);
        } finally {
            g.dispose();
        }
        return resized;
    }

    /**
     * Writes a square JPEG thumbnail of the face. Returns false when the box is empty.
     */
    public static boolean writeCrop(BufferedImage image, BoundingBox box, int size, File target) throws IOException {
        BufferedImage cropped = crop(image, box);
        if (cropped == null) {
            return false;
        }
        FileUtils.forceMkdirParent(target);
        if (!ImageIO.write(resizeSquare(cropped, size), "jpg", target)) {
            throw new IOException("No JPEG writer available for " + target.getAbsolutePath());
        }
        return true;
    }
}
