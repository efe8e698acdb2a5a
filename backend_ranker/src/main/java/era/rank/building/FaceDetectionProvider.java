package era.rank.building;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Face detection and embedding model. Implementations are supplied by the host and may be slow;
 * calls for one image are the dominant cost of a sync.
 */
public interface FaceDetectionProvider {
    /**
     * @throws ModelUnavailableException when the model can not run at all
     * @throws DetectionException when only this image failed
     */
    List<DetectedFace> detect(BufferedImage image) throws DetectionException;
}
