package era.rank.album;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import era.rank.base.RankerConfiguration;
import era.rank.building.FakeFaceDetectionProvider;
import era.rank.building.MetadataStore;
import era.rank.building.QualitySignalExtractor;
import era.rank.building.FaceFixtures;
import era.rank.mining.FaceRef;
import era.rank.mining.GlobalPerson;
import era.rank.mining.GlobalPersonRegistry;
import era.rank.mining.MatchResult;
import era.rank.mining.PersonNotFoundException;
import era.rank.mining.PersonRef;
import era.rank.ranking.RankedPhoto;
import java.io.File;
import java.nio.file.Files;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import javax.imageio.ImageIO;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AlbumProcessorTest {
    private static final int P1 = 0x0a0001;
    private static final int P2 = 0x0a0002;
    private static final int P3 = 0x0a0003;
    private static final int GROUP = 0x0a0004;
    private static final int Q1 = 0x0b0001;
    private static final int Q2 = 0x0b0002;
    private static final int QUERY = 0x0c0001;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private File albumsRoot;
    private File registryDirectory;
    private RankerConfiguration configuration;
    private FakeFaceDetectionProvider detection;
    private AlbumProcessor processor;

    private void writeImage(String album, String filename, int color) throws Exception {
        File directory = new File(albumsRoot, album);
        FileUtils.forceMkdir(directory);
        ImageIO.write(FaceFixtures.solidImage(color, 200, 200), "png", new File(directory, filename));
    }

    private AlbumProcessor newProcessor() {
        QualitySignalExtractor extractor = new QualitySignalExtractor(configuration, detection, null);
        return new AlbumProcessor(albumsRoot, extractor, new GlobalPersonRegistry(registryDirectory, 64), 2);
    }

    @Before
    public void setUp() throws Exception {
        albumsRoot = folder.newFolder("albums");
        registryDirectory = folder.newFolder("registry");
        configuration = RankerConfiguration.defaults().toBuilder().faceCropSize(64).build();
        detection = new FakeFaceDetectionProvider()
            .withFaces(P1, FaceFixtures.detected(FaceFixtures.square(10, 10, 80), FaceFixtures.axis(0), null, 0.95))
            .withFaces(P2, FaceFixtures.detected(FaceFixtures.square(10, 10, 70), FaceFixtures.near(0, 1, 0.9), null, 0.95))
            .withFaces(P3, FaceFixtures.detected(FaceFixtures.square(10, 10, 80), FaceFixtures.axis(3), null, 0.95))
            .withFaces(GROUP,
                FaceFixtures.detected(FaceFixtures.square(10, 10, 60), FaceFixtures.near(0, 2, 0.9), null, 0.95),
                FaceFixtures.detected(FaceFixtures.square(100, 10, 60), FaceFixtures.near(3, 4, 0.9), null, 0.95))
            .withFaces(Q1, FaceFixtures.detected(FaceFixtures.square(10, 10, 80), FaceFixtures.near(0, 5, 0.9), null, 0.95))
            .withFaces(Q2, FaceFixtures.detected(FaceFixtures.square(10, 10, 80), FaceFixtures.axis(6), null, 0.95))
            .withFaces(QUERY, FaceFixtures.detected(FaceFixtures.square(10, 10, 100), FaceFixtures.axis(0), null, 0.95));
        writeImage("trip", "p1.png", P1);
        writeImage("trip", "p2.png", P2);
        writeImage("trip", "p3.png", P3);
        writeImage("trip", "g.png", GROUP);
        writeImage("party", "q1.png", Q1);
        writeImage("party", "q2.png", Q2);
        FileUtils.forceMkdir(new File(albumsRoot, ".trash"));
        processor = newProcessor();
    }

    @After
    public void tearDown() {
        processor.shutdown();
    }

    @Test
    public void albumsAreTheVisibleSubdirectories() {
        assertEquals(List.of("party", "trip"), processor.listAlbums());
    }

    @Test
    public void unprocessedAlbumIsPending() {
        assertEquals(AlbumStatus.PENDING, processor.status("trip").getStatus());
        assertTrue(processor.listPeople("trip").isEmpty());
    }

    @Test
    public void processingFindsPeopleAndWritesCrops() throws Exception {
        processor.process("trip");

        assertEquals(AlbumStatus.DONE, processor.status("trip").getStatus());
        List<AlbumPerson> people = processor.listPeople("trip");
        assertEquals(2, people.size());

        AlbumPerson first = people.get(0);
        assertEquals(PersonRef.album("trip", 0), first.getPersonRef());
        assertEquals("Person 1", first.getDisplayName());
        assertEquals(new FaceRef("p1.png", 0), first.getRepresentative());
        assertEquals(3, first.getPhotoCount());
        assertEquals(new FaceRef("p3.png", 0), people.get(1).getRepresentative());
        assertEquals(2, people.get(1).getPhotoCount());

        File crop = new File(new File(new File(albumsRoot, "trip"), AlbumProcessor.FACES_DIRECTORY), "p1.png_0.jpg");
        assertTrue(crop.isFile());
        assertEquals(64, ImageIO.read(crop).getWidth());
        assertTrue(new File(new File(albumsRoot, "trip"), MetadataStore.CACHE_FILENAME).isFile());
        assertTrue(AlbumState.stateFile(new File(albumsRoot, "trip")).isFile());
    }

    @Test
    public void facesInPhotoNameTheirPeople() throws Exception {
        processor.process("trip");

        List<PhotoFace> faces = processor.facesInPhoto("trip", "g.png");

        assertEquals(2, faces.size());
        assertEquals(PersonRef.album("trip", 0), faces.get(0).getPersonRef());
        assertEquals(PersonRef.album("trip", 1), faces.get(1).getPersonRef());
        assertEquals("Person 2", faces.get(1).getDisplayName());
    }

    @Test
    public void renamedPersonIsSharedAcrossAlbums() throws Exception {
        processor.process("trip");
        GlobalPerson xavier = processor.renamePerson("album:trip:0", "Xavier");
        processor.process("party");

        PersonRef global = PersonRef.global(xavier.getId());
        assertEquals(global, processor.listPeople("trip").get(0).getPersonRef());
        assertEquals("Xavier", processor.listPeople("party").get(0).getDisplayName());

        SortedMap<String, SortedSet<String>> photos = processor.resolvePersonRef(global.toString());
        assertEquals(new TreeSet<>(List.of("q1.png")), photos.get("party"));
        assertEquals(new TreeSet<>(List.of("g.png", "p1.png", "p2.png")), photos.get("trip"));

        SortedMap<String, List<RankedPhoto>> ranked = processor.rankedPhotos(global.toString(), 2);
        assertEquals(2, ranked.size());
        assertEquals(2, ranked.get("trip").size());
        assertEquals(1, ranked.get("party").size());
    }

    @Test
    public void linksSurviveARestart() throws Exception {
        processor.process("trip");
        GlobalPerson xavier = processor.renamePerson("album:trip:0", "Xavier");
        processor.shutdown();

        processor = newProcessor();
        AlbumPerson person = processor.listPeople("trip").get(0);
        assertEquals(PersonRef.global(xavier.getId()), person.getPersonRef());
        assertEquals("Xavier", person.getDisplayName());

        processor.process("trip");
        assertEquals("Xavier", processor.listPeople("trip").get(0).getDisplayName());
    }

    @Test
    public void findByPhotoLooksAtEveryAlbum() throws Exception {
        processor.process("trip");
        processor.process("party");

        MatchResult result = processor.findPersonByPhoto(FaceFixtures.solidImage(QUERY, 200, 200));

        assertTrue(result.isMatched());
        assertEquals(PersonRef.album("trip", 0), result.best().get().getPersonRef());
        assertEquals(PersonRef.album("party", 0), result.getCandidates().get(1).getPersonRef());
        assertEquals(configuration.getFindTopK(), result.getCandidates().size());
    }

    @Test
    public void rankedPhotosOfAnAlbumPerson() throws Exception {
        processor.process("trip");

        List<RankedPhoto> ranked = processor.rankedPhotos("album:trip:1", 0).get("trip");

        // g.png is a group photo with two good faces, p3.png a single one with no smile
        assertEquals("g.png", ranked.get(0).getFilename());
        assertEquals("p3.png", ranked.get(1).getFilename());
    }

    @Test
    public void rankedPhotosDefaultToConfiguredTopK() throws Exception {
        processor.shutdown();
        configuration = configuration.toBuilder().rankTopK(1).build();
        processor = newProcessor();
        processor.process("trip");

        List<RankedPhoto> ranked = processor.rankedPhotos("album:trip:1").get("trip");

        assertEquals(1, ranked.size());
        assertEquals("g.png", ranked.get(0).getFilename());
    }

    @Test
    public void hiddenPersonDisappearsFromTheAlbum() throws Exception {
        processor.process("trip");
        processor.hidePerson("trip", 1);

        assertEquals(1, processor.listPeople("trip").size());
        assertNull(processor.facesInPhoto("trip", "g.png").get(1).getPersonRef());
        try {
            processor.resolvePersonRef("album:trip:1");
            fail("hidden person must not resolve");
        } catch (PersonNotFoundException expected) {
            assertTrue(expected.getMessage().contains("album:trip:1"));
        }

        processor.process("trip");
        assertEquals(1, processor.listPeople("trip").size());
        processor.shutdown();
        processor = newProcessor();
        assertEquals(1, processor.listPeople("trip").size());
    }

    @Test
    public void secondTriggerIsRejectedWhileRunning() throws Exception {
        CountDownLatch gate = detection.block();

        assertTrue(processor.trigger("trip"));
        assertFalse(processor.trigger("trip"));
        assertTrue(processor.trigger("party"));
        assertEquals(AlbumStatus.PROCESSING, processor.status("trip").getStatus());

        gate.countDown();
        assertTrue(processor.awaitIdle("trip", 10, TimeUnit.SECONDS));
        assertTrue(processor.awaitIdle("party", 10, TimeUnit.SECONDS));
        assertEquals(AlbumStatus.DONE, processor.status("trip").getStatus());
        assertEquals(AlbumStatus.DONE, processor.status("party").getStatus());
        assertTrue(processor.trigger("trip"));
        assertTrue(processor.awaitIdle("trip", 10, TimeUnit.SECONDS));
    }

    @Test
    public void directProcessIsRejectedWhileTriggeredPipelineRuns() throws Exception {
        CountDownLatch gate = detection.block();
        assertTrue(processor.trigger("trip"));
        long deadline = System.currentTimeMillis() + 10_000L;
        while (detection.getCalls() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(detection.getCalls() > 0);

        try {
            processor.process("trip");
            fail("a second pipeline must not run on the same album");
        } catch (AlbumBusyException expected) {
            assertTrue(expected.getMessage().contains("trip"));
        }
        assertEquals(AlbumStatus.PROCESSING, processor.status("trip").getStatus());

        gate.countDown();
        assertTrue(processor.awaitIdle("trip", 10, TimeUnit.SECONDS));
        assertEquals(AlbumStatus.DONE, processor.status("trip").getStatus());
        assertFalse(processor.isRunning("trip"));
        processor.process("trip");
    }

    @Test
    public void unavailableModelMovesAlbumToErrorAndKeepsCache() throws Exception {
        processor.process("trip");
        File cache = new File(new File(albumsRoot, "trip"), MetadataStore.CACHE_FILENAME);
        byte[] before = Files.readAllBytes(cache.toPath());
        File p2 = new File(new File(albumsRoot, "trip"), "p2.png");
        assertTrue(p2.setLastModified(p2.lastModified() - 60_000L));
        detection.setUnavailable(true);

        assertTrue(processor.trigger("trip"));
        assertTrue(processor.awaitIdle("trip", 10, TimeUnit.SECONDS));

        AlbumState state = processor.status("trip");
        assertEquals(AlbumStatus.ERROR, state.getStatus());
        assertTrue(state.getError().contains("face model not loaded"));
        assertArrayEquals(before, Files.readAllBytes(cache.toPath()));
        assertEquals(2, processor.listPeople("trip").size());

        detection.setUnavailable(false);
        processor.process("trip");
        assertEquals(AlbumStatus.DONE, processor.status("trip").getStatus());
        assertNull(processor.status("trip").getError());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownAlbumIsRejected() {
        processor.trigger("nowhere");
    }

    @Test(expected = IllegalArgumentException.class)
    public void pathLikeAlbumIdIsRejected() {
        processor.status("../registry");
    }
}
