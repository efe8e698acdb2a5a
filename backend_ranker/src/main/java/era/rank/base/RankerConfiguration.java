package era.rank.base;

import java.util.Properties;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
public class RankerConfiguration {
    public static final String PROPERTIES_RESOURCE = "application.properties";

    // Extraction
    @Builder.Default
    private final int minFaceSizePx = 30;
    @Builder.Default
    private final double poseYawMaxDeg = 15.0;
    @Builder.Default
    private final double posePitchMaxDeg = 15.0;
    @Builder.Default
    private final double facingFallbackScore = 0.5;
    @Builder.Default
    private final int faceCropSize = 256;

    // Identity
    @Builder.Default
    private final double clusterSimilarityThreshold = 0.45;
    @Builder.Default
    private final double linkSimilarityThreshold = 0.55;
    @Builder.Default
    private final double findSimilarityThreshold = 0.45;
    @Builder.Default
    private final int findTopK = 3;

    // Scoring
    @Builder.Default
    private final double blurNormalizeDivisor = 500.0;
    @Builder.Default
    private final int groupMinFaces = 2;
    @Builder.Default
    private final double goodFaceMinFacing = 0.4;
    @Builder.Default
    private final double goodFaceMinConfidence = 0.7;
    @Builder.Default
    private final double weightSingleSmile = 0.4;
    @Builder.Default
    private final double weightSingleFacing = 0.3;
    @Builder.Default
    private final double weightSingleSharpness = 0.3;
    @Builder.Default
    private final double weightGroupQuality = 0.7;
    @Builder.Default
    private final double weightGroupSharpness = 0.3;
    @Builder.Default
    private final int rankTopK = 200;

    public static RankerConfiguration defaults() {
        return RankerConfiguration.builder().build();
    }

    public static RankerConfiguration load() {
        Properties properties = Util.loadClasspathProperties(PROPERTIES_RESOURCE);
        if (properties == null) {
            return defaults();
        }
        return fromProperties(properties);
    }

    public static RankerConfiguration fromProperties(Properties p) {
        RankerConfiguration d = defaults();
        return RankerConfiguration.builder()
            .minFaceSizePx(intValue(p, "face.min.size.px", d.minFaceSizePx))
            .poseYawMaxDeg(doubleValue(p, "pose.yaw.max.deg", d.poseYawMaxDeg))
            .posePitchMaxDeg(doubleValue(p, "pose.pitch.max.deg", d.posePitchMaxDeg))
            .facingFallbackScore(doubleValue(p, "facing.fallback.score", d.facingFallbackScore))
            .faceCropSize(intValue(p, "face.crop.size", d.faceCropSize))
            .clusterSimilarityThreshold(doubleValue(p, "cluster.similarity.threshold", d.clusterSimilarityThreshold))
            .linkSimilarityThreshold(doubleValue(p, "link.similarity.threshold", d.linkSimilarityThreshold))
            .findSimilarityThreshold(doubleValue(p, "find.similarity.threshold", d.findSimilarityThreshold))
            .findTopK(intValue(p, "find.top.k", d.findTopK))
            .blurNormalizeDivisor(doubleValue(p, "blur.normalize.divisor", d.blurNormalizeDivisor))
            .groupMinFaces(intValue(p, "group.min.faces", d.groupMinFaces))
            .goodFaceMinFacing(doubleValue(p, "good.face.min.facing", d.goodFaceMinFacing))
            .goodFaceMinConfidence(doubleValue(p, "good.face.min.confidence", d.goodFaceMinConfidence))
            .weightSingleSmile(doubleValue(p, "weight.single.smile", d.weightSingleSmile))
            .weightSingleFacing(doubleValue(p, "weight.single.facing", d.weightSingleFacing))
            .weightSingleSharpness(doubleValue(p, "weight.single.sharpness", d.weightSingleSharpness))
            .weightGroupQuality(doubleValue(p, "weight.group.quality", d.weightGroupQuality))
            .weightGroupSharpness(doubleValue(p, "weight.group.sharpness", d.weightGroupSharpness))
            .rankTopK(intValue(p, "rank.top.k", d.rankTopK))
            .build();
    }

    private static int intValue(Properties p, String key, int defaultValue) {
        String value = p.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad integer for " + key + ": " + value, e);
        }
    }

    private static double doubleValue(Properties p, String key, double defaultValue) {
        String value = p.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad number for " + key + ": " + value, e);
        }
    }
}
