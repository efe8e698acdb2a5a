package era.rank.building;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import era.rank.base.RankerConfiguration;
import era.rank.mining.IdentityClusterer;
import era.rank.mining.PersonCluster;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import javax.imageio.ImageIO;
import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MetadataStoreTest {
    private static final int PERSON_IMAGES = 7;
    private static final int EMPTY_IMAGES = 3;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private FakeFaceDetectionProvider detection;
    private QualitySignalExtractor extractor;
    private InMemoryImageSource source;
    private File cacheFile;

    private static String personImage(int i) {
        return String.format("person_%02d.jpg", i);
    }

    private static int personColor(int i) {
        return 0x100000 + i;
    }

    @Before
    public void setUp() throws Exception {
        detection = new FakeFaceDetectionProvider();
        extractor = new QualitySignalExtractor(RankerConfiguration.defaults(), detection, crop -> 0.25);
        source = new InMemoryImageSource();
        for (int i = 0; i < PERSON_IMAGES; i++) {
            detection.withFaces(personColor(i),
                FaceFixtures.detected(FaceFixtures.square(10, 10, 80), FaceFixtures.near(0, 1 + i, 0.9), null, 0.95));
            source.put(personImage(i), FaceFixtures.solidImage(personColor(i), 120, 120));
        }
        for (int i = 0; i < EMPTY_IMAGES; i++) {
            source.put("landscape_" + i + ".png", FaceFixtures.solidImage(0x200000 + i, 120, 120));
        }
        cacheFile = new File(folder.getRoot(), MetadataStore.CACHE_FILENAME);
    }

    @Test
    public void newAlbumSyncExtractsEverythingAndClustersOnePerson() throws Exception {
        MetadataStore store = new MetadataStore(cacheFile);
        SyncReport report = store.sync(source, extractor);

        assertEquals(10, report.getUpdated().size());
        assertEquals(0, report.getRemoved().size());
        assertEquals(0, report.getFailed().size());
        assertTrue(cacheFile.isFile());

        SortedMap<String, ImageMetadata> entries = store.entries();
        assertEquals(10, entries.size());
        assertEquals(0, entries.get("landscape_0.png").faceCount());
        assertEquals(1, entries.get(personImage(3)).faceCount());

        List<PersonCluster> clusters = new IdentityClusterer(0.45).cluster(entries);
        assertEquals(1, clusters.size());
        assertEquals(PERSON_IMAGES, clusters.get(0).size());
    }

    @Test
    public void secondSyncReusesEverythingAndKeepsTheFileByteIdentical() throws Exception {
        new MetadataStore(cacheFile).sync(source, extractor);
        byte[] before = Files.readAllBytes(cacheFile.toPath());
        int callsBefore = detection.getCalls();

        SyncReport report = new MetadataStore(cacheFile).sync(source, extractor);

        assertEquals(0, report.getUpdated().size());
        assertEquals(10, report.getReused());
        assertFalse(report.hasChanges());
        assertEquals(callsBefore, detection.getCalls());
        assertArrayEquals(before, Files.readAllBytes(cacheFile.toPath()));
    }

    @Test
    public void onlyChangedAndRemovedImagesAreTouched() throws Exception {
        MetadataStore store = new MetadataStore(cacheFile);
        store.sync(source, extractor);
        int callsBefore = detection.getCalls();

        source.touch(personImage(2));
        source.remove(personImage(5));
        SyncReport report = store.sync(source, extractor);

        assertEquals(Set.of(personImage(2)), report.getUpdated());
        assertEquals(Set.of(personImage(5)), report.getRemoved());
        assertEquals(8, report.getReused());
        assertEquals(callsBefore + 1, detection.getCalls());
        assertEquals(9, store.entries().size());
        assertFalse(store.entries().containsKey(personImage(5)));
        assertEquals(9, new MetadataStore(cacheFile).load().size());
    }

    @Test
    public void cachedEntriesSurviveReload() throws Exception {
        MetadataStore store = new MetadataStore(cacheFile);
        store.sync(source, extractor);
        ImageMetadata original = store.entries().get(personImage(0));

        ImageMetadata reloaded = new MetadataStore(cacheFile).load().get(personImage(0));

        assertEquals(original.getFingerprint(), reloaded.getFingerprint());
        FaceRecord a = original.face(0);
        FaceRecord b = reloaded.face(0);
        assertEquals(a.getBoundingBox(), b.getBoundingBox());
        assertArrayEquals(a.getEmbedding(), b.getEmbedding(), 1e-6f);
        assertEquals(a.getSmileScore(), b.getSmileScore(), 1e-9);
        assertEquals(a.getSizePx(), b.getSizePx());
    }

    @Test
    public void failedImageIsRetriedOnNextSync() throws Exception {
        detection.failOn(personColor(4));
        MetadataStore store = new MetadataStore(cacheFile);
        SyncReport first = store.sync(source, extractor);
        assertEquals(Set.of(personImage(4)), first.getFailed());
        assertTrue(store.entries().get(personImage(4)).isFailed());
        assertTrue(new MetadataStore(cacheFile).load().get(personImage(4)).isRetryable());

        detection.recover(personColor(4));
        SyncReport second = store.sync(source, extractor);

        assertEquals(Set.of(personImage(4)), second.getUpdated());
        assertTrue(second.getFailed().isEmpty());
        assertFalse(store.entries().get(personImage(4)).isFailed());
        assertEquals(1, store.entries().get(personImage(4)).faceCount());
    }

    @Test
    public void undecodableFileIsNotExtractedAgainWhileUnchanged() throws Exception {
        File album = folder.newFolder("album");
        ImageIO.write(FaceFixtures.solidImage(personColor(0), 120, 120), "png", new File(album, "ok.png"));
        FileUtils.writeStringToFile(new File(album, "broken.jpg"), "definitely not a jpeg", StandardCharsets.UTF_8);
        DirectoryImageSource directory = new DirectoryImageSource(album);
        MetadataStore store = MetadataStore.forAlbum(album);

        SyncReport first = store.sync(directory, extractor);
        assertEquals(Set.of("broken.jpg"), first.getFailed());
        assertFalse(store.entries().get("broken.jpg").isRetryable());
        byte[] before = Files.readAllBytes(store.getCacheFile().toPath());
        int calls = detection.getCalls();

        SyncReport second = MetadataStore.forAlbum(album).sync(directory, extractor);
        assertTrue(second.getUpdated().isEmpty());
        assertTrue(second.getFailed().isEmpty());
        assertEquals(calls, detection.getCalls());
        assertArrayEquals(before, Files.readAllBytes(store.getCacheFile().toPath()));
    }

    @Test
    public void corruptCacheIsDiscardedAndRebuilt() throws Exception {
        FileUtils.writeStringToFile(cacheFile, "{ this is not json", StandardCharsets.UTF_8);
        MetadataStore store = new MetadataStore(cacheFile);
        assertTrue(store.load().isEmpty());

        SyncReport report = store.sync(source, extractor);
        assertEquals(10, report.getUpdated().size());
        assertEquals(10, new MetadataStore(cacheFile).load().size());
    }

    @Test
    public void wrongVersionIsTreatedAsEmpty() throws Exception {
        FileUtils.writeStringToFile(cacheFile,
            "{\"format\": \"" + MetadataStore.FORMAT + "\", \"version\": 99, \"images\": {}}", StandardCharsets.UTF_8);
        assertTrue(new MetadataStore(cacheFile).load().isEmpty());
    }

    @Test
    public void unavailableModelLeavesCommittedCacheUntouched() throws Exception {
        new MetadataStore(cacheFile).sync(source, extractor);
        byte[] before = Files.readAllBytes(cacheFile.toPath());

        source.touch(personImage(1));
        detection.setUnavailable(true);
        MetadataStore store = new MetadataStore(cacheFile);
        try {
            store.sync(source, extractor);
            fail("sync must abort when the model is unavailable");
        } catch (ModelUnavailableException expected) {
            assertEquals("face model not loaded", expected.getMessage());
        }
        assertArrayEquals(before, Files.readAllBytes(cacheFile.toPath()));
        assertEquals(10, store.entries().size());
    }

    @Test
    public void unreadableAlbumLeavesCommittedCacheUntouched() throws Exception {
        new MetadataStore(cacheFile).sync(source, extractor);
        byte[] before = Files.readAllBytes(cacheFile.toPath());
        source.setBroken(true);
        try {
            new MetadataStore(cacheFile).sync(source, extractor);
            fail("sync must abort when the album can not be listed");
        } catch (java.io.IOException expected) {
            assertArrayEquals(before, Files.readAllBytes(cacheFile.toPath()));
        }
    }

    @Test
    public void emptyAlbumStillWritesAValidCache() throws Exception {
        MetadataStore store = new MetadataStore(cacheFile);
        SyncReport report = store.sync(new InMemoryImageSource(), extractor);
        assertFalse(report.hasChanges());
        assertTrue(cacheFile.isFile());
        assertTrue(new MetadataStore(cacheFile).load().isEmpty());
    }
}
