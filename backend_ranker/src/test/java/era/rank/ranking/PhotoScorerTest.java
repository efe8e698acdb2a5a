package era.rank.ranking;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import era.rank.base.RankerConfiguration;
import era.rank.building.FaceRecord;
import era.rank.building.ImageMetadata;
import era.rank.building.FaceFixtures;
import org.junit.Test;

public class PhotoScorerTest {
    private final RankerConfiguration c = RankerConfiguration.defaults();
    private final PhotoScorer scorer = new PhotoScorer(c);

    private static FaceRecord face(int index, double facing, double confidence, double smile) {
        return FaceFixtures.record(index, FaceFixtures.square(index * 60, 0, 50), FaceFixtures.axis(index), facing, confidence, smile);
    }

    @Test
    public void groupScoreCountsGoodFaces() {
        ImageMetadata image = FaceFixtures.metadata("group.jpg", 100.0,
            face(0, 0.9, 0.95, 0),
            face(1, 0.8, 0.9, 0),
            face(2, 1.0, 0.99, 0),
            face(3, 0.2, 0.95, 0));

        double expected = 0.75 * c.getWeightGroupQuality() + 0.2 * c.getWeightGroupSharpness();
        assertTrue(scorer.isGroup(image));
        assertEquals(expected, scorer.score(image, image.face(3)), 1e-9);
        assertEquals(0.585, scorer.groupScore(image), 1e-9);
    }

    @Test
    public void goodFaceThresholdsAreStrict() {
        assertFalse(scorer.isGoodFace(face(0, 0.4, 0.99, 0)));
        assertFalse(scorer.isGoodFace(face(0, 0.99, 0.7, 0)));
        assertTrue(scorer.isGoodFace(face(0, 0.41, 0.71, 0)));
    }

    @Test
    public void singleScoreUsesTheTargetFace() {
        ImageMetadata image = FaceFixtures.metadata("solo.jpg", 1000.0, face(0, 1.0, 0.9, 0.8));
        assertFalse(scorer.isGroup(image));
        assertEquals(0.4 * 0.8 + 0.3 * 1.0 + 0.3 * 1.0, scorer.score(image, image.face(0)), 1e-9);
    }

    @Test
    public void blurIsNormalizedAndCapped() {
        assertEquals(0.5, scorer.normalizedBlur(250.0), 1e-9);
        assertEquals(1.0, scorer.normalizedBlur(5000.0), 1e-9);
        assertEquals(0.0, scorer.normalizedBlur(0.0), 1e-9);
        PhotoScorer broken = new PhotoScorer(c.toBuilder().blurNormalizeDivisor(0).build());
        assertEquals(0.0, broken.normalizedBlur(250.0), 1e-9);
    }

    @Test
    public void groupSizeComesFromConfiguration() {
        ImageMetadata pair = FaceFixtures.metadata("pair.jpg", 0.0, face(0, 1.0, 0.9, 1.0), face(1, 1.0, 0.9, 1.0));
        PhotoScorer relaxed = new PhotoScorer(c.toBuilder().groupMinFaces(3).build());
        assertTrue(scorer.isGroup(pair));
        assertFalse(relaxed.isGroup(pair));
        assertEquals(0.4 + 0.3, relaxed.score(pair, pair.face(0)), 1e-9);
    }
}
