package era.rank.building;

import era.rank.base.Embeddings;
import era.rank.base.NoFaceFoundException;
import era.rank.base.RankerConfiguration;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns one decoded image into its cached quality signals: blur for the whole image, and for
 * every face large enough to be trusted its embedding, facing score, confidence and smile.
 */
public class QualitySignalExtractor {
    private static final Logger logger = LogManager.getLogger(QualitySignalExtractor.class);
    private static final double PROFILE_ANGLE_DEG = 90.0;

    private final RankerConfiguration configuration;
    private final FaceDetectionProvider detectionProvider;
    private final EmotionProvider emotionProvider;

    public QualitySignalExtractor(
        RankerConfiguration configuration,
        FaceDetectionProvider detectionProvider,
        EmotionProvider emotionProvider) {
        this.configuration = configuration;
        this.detectionProvider = detectionProvider;
        this.emotionProvider = emotionProvider;
    }

    public RankerConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Filename and fingerprint are left empty, the caller owns them. A detection failure on this
     * image gives a failed entry with no faces; only an unavailable model is thrown.
     */
    public ImageMetadata extract(BufferedImage image) throws ModelUnavailableException {
        double blur = BlurDetector.laplacianVariance(image);
        List<DetectedFace> detections;
        try {
            detections = detectionProvider.detect(image);
        } catch (ModelUnavailableException e) {
            throw e;
        } catch (DetectionException e) {
            return ImageMetadata.builder()
                .blurScore(blur)
                .failed(true)
                .failureMessage(e.getMessage())
                .retryable(true)
                .build();
        }

        ImageMetadata.ImageMetadataBuilder builder = ImageMetadata.builder().blurScore(blur);
        int faceIndex = 0;
        for (DetectedFace detection : detections) {
            if (!isLargeEnough(detection)) {
                continue;
            }
            builder.face(FaceRecord.builder()
                .faceIndex(faceIndex)
                .boundingBox(detection.getBoundingBox())
                .embedding(Embeddings.l2Normalize(detection.getEmbedding()))
                .facingScore(facingScore(detection.pose()))
                .confidence(detection.getConfidence())
                .sizePx((int) Math.floor(detection.getBoundingBox().shorterSide()))
                .smileScore(smileScore(image, detection.getBoundingBox()))
                .build());
            faceIndex++;
        }
        return builder.build();
    }

    /**
     * Embedding of the most prominent (largest) face, used as a "find person" query.
     */
    public float[] largestFaceEmbedding(BufferedImage image) throws DetectionException, NoFaceFoundException {
        List<DetectedFace> detections = detectionProvider.detect(image);
        DetectedFace largest = null;
        for (DetectedFace detection : detections) {
            if (!isLargeEnough(detection)) {
                continue;
            }
            if (largest == null || detection.getBoundingBox().area() > largest.getBoundingBox().area()) {
                largest = detection;
            }
        }
        if (largest == null) {
            throw new NoFaceFoundException("No face found in query image");
        }
        return Embeddings.l2Normalize(largest.getEmbedding());
    }

    /**
     * 1.0 when pitch and yaw are inside the configured limits, decaying linearly to 0.0 for a
     * profile view. Models without pose get the neutral fallback.
     */
    public double facingScore(Optional<HeadPose> pose) {
        if (pose.isEmpty()) {
            return configuration.getFacingFallbackScore();
        }
        double pitchExcess = excess(Math.abs(pose.get().getPitch()), configuration.getPosePitchMaxDeg());
        double yawExcess = excess(Math.abs(pose.get().getYaw()), configuration.getPoseYawMaxDeg());
        return 1.0 - Math.max(pitchExcess, yawExcess);
    }

    private static double excess(double angle, double limit) {
        if (angle <= limit) {
            return 0.0;
        }
        if (limit >= PROFILE_ANGLE_DEG) {
            return 1.0;
        }
        return Math.min(1.0, (angle - limit) / (PROFILE_ANGLE_DEG - limit));
    }

    private boolean isLargeEnough(DetectedFace detection) {
        return detection.getBoundingBox() != null
            && detection.getEmbedding() != null
            && detection.getBoundingBox().shorterSide() >= configuration.getMinFaceSizePx();
    }

    // Scored on the face crop only, so a smiling neighbour in a group does not count
    private double smileScore(BufferedImage image, BoundingBox box) {
        if (emotionProvider == null) {
            return 0.0;
        }
        BufferedImage crop = FaceCropper.crop(image, box);
        if (crop == null) {
            return 0.0;
        }
        try {
            double happiness = emotionProvider.happiness(crop);
            if (Double.isNaN(happiness)) {
                return 0.0;
            }
            return Math.max(0.0, Math.min(1.0, happiness));
        } catch (DetectionException e) {
            logger.warn("Emotion model failed for face {}, smile set to 0: {}", box, e.getMessage());
            return 0.0;
        }
    }
}
