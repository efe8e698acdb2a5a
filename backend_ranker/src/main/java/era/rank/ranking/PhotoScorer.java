package era.rank.ranking;

import era.rank.base.RankerConfiguration;
import era.rank.building.FaceRecord;
import era.rank.building.ImageMetadata;

/**
 * Turns cached signals into one quality score per photo. Photos with fewer than
 * {@code groupMinFaces} faces are scored on the target face alone, bigger ones on the share of
 * good faces.
 */
public class PhotoScorer {
    private final RankerConfiguration configuration;

    public PhotoScorer(RankerConfiguration configuration) {
        this.configuration = configuration;
    }

    public double normalizedBlur(double blurScore) {
        double divisor = configuration.getBlurNormalizeDivisor();
        if (divisor <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, blurScore / divisor));
    }

    public boolean isGroup(ImageMetadata image) {
        return image.faceCount() >= configuration.getGroupMinFaces();
    }

    public boolean isGoodFace(FaceRecord face) {
        return face.getFacingScore() > configuration.getGoodFaceMinFacing()
            && face.getConfidence() > configuration.getGoodFaceMinConfidence();
    }

    public double singleScore(FaceRecord target, double blurScore) {
        return configuration.getWeightSingleSmile() * target.getSmileScore()
            + configuration.getWeightSingleFacing() * target.getFacingScore()
            + configuration.getWeightSingleSharpness() * normalizedBlur(blurScore);
    }

    public double groupScore(ImageMetadata image) {
        int good = 0;
        for (FaceRecord face : image.getFaces()) {
            if (isGoodFace(face)) {
                good++;
            }
        }
        double fraction = image.faceCount() == 0 ? 0.0 : (double) good / image.faceCount();
        return configuration.getWeightGroupQuality() * fraction
            + configuration.getWeightGroupSharpness() * normalizedBlur(image.getBlurScore());
    }

    /**
     * @param target the face of the ranked person in this image
     */
    public double score(ImageMetadata image, FaceRecord target) {
        if (isGroup(image)) {
            return groupScore(image);
        }
        return singleScore(target, image.getBlurScore());
    }
}
