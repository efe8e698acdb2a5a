package era.rank.building;

import java.awt.image.BufferedImage;

public interface EmotionProvider {
    /**
     * Happiness of the face shown in the crop, in [0, 1].
     */
    double happiness(BufferedImage faceCrop) throws DetectionException;
}
