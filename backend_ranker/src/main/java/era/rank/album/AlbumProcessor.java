package era.rank.album;

import era.rank.base.NoFaceFoundException;
import era.rank.base.RankerConfiguration;
import era.rank.base.Util;
import era.rank.building.DetectionException;
import era.rank.building.DirectoryImageSource;
import era.rank.building.FaceCropper;
import era.rank.building.FaceRecord;
import era.rank.building.ImageMetadata;
import era.rank.building.MetadataStore;
import era.rank.building.ModelUnavailableException;
import era.rank.building.QualitySignalExtractor;
import era.rank.building.SyncReport;
import era.rank.mining.FaceRef;
import era.rank.mining.GlobalPerson;
import era.rank.mining.GlobalPersonRegistry;
import era.rank.mining.IdentityClusterer;
import era.rank.mining.IdentityMatcher;
import era.rank.mining.MatchResult;
import era.rank.mining.PersonCluster;
import era.rank.mining.PersonNotFoundException;
import era.rank.mining.PersonRef;
import era.rank.ranking.PhotoRanker;
import era.rank.ranking.PhotoScorer;
import era.rank.ranking.RankedPhoto;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.UnaryOperator;
import javax.imageio.ImageIO;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Host facing entry point over a root directory holding one sub-directory per album. Runs the
 * sync, cluster and link pipeline in the background (one at a time per album) and answers read
 * queries from the last committed album snapshots.
 */
public class AlbumProcessor {
    private static final Logger logger = LogManager.getLogger(AlbumProcessor.class);
    public static final String FACES_DIRECTORY = ".photo_ranker_faces";

    private final File albumsRoot;
    private final RankerConfiguration configuration;
    private final QualitySignalExtractor extractor;
    private final IdentityClusterer clusterer;
    private final IdentityMatcher matcher;
    private final PhotoRanker ranker;
    private final ExecutorService executorService;

    private final Map<String, FutureTask<AlbumSnapshot>> running = new ConcurrentHashMap<>();
    private final Map<String, AlbumSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, AlbumState> states = new ConcurrentHashMap<>();
    private final Map<String, Object> albumLocks = new ConcurrentHashMap<>();

    public AlbumProcessor(
        File albumsRoot,
        QualitySignalExtractor extractor,
        GlobalPersonRegistry registry,
        int numberOfWorkers) {
        this.albumsRoot = albumsRoot;
        this.configuration = extractor.getConfiguration();
        this.extractor = extractor;
        this.clusterer = new IdentityClusterer(configuration.getClusterSimilarityThreshold());
        this.matcher = new IdentityMatcher(registry, configuration.getLinkSimilarityThreshold());
        this.ranker = new PhotoRanker(new PhotoScorer(configuration), clusterer);
        ThreadFactory threadFactory = Util.buildThreadFactory("AlbumPipeline[%03d]");
        this.executorService = Executors.newFixedThreadPool(Math.max(1, numberOfWorkers), threadFactory);
    }

    public IdentityMatcher getMatcher() {
        return matcher;
    }

    public List<String> listAlbums() {
        List<String> albums = new ArrayList<>();
        File[] children = albumsRoot.listFiles();
        if (children == null) {
            return albums;
        }
        for (File child : children) {
            if (child.isDirectory() && !child.getName().startsWith(".")) {
                albums.add(child.getName());
            }
        }
        Collections.sort(albums);
        return albums;
    }

    /**
     * Starts the album pipeline in the background.
     *
     * @return false when a pipeline for this album is already running
     */
    public boolean trigger(String albumId) {
        File albumDirectory = albumDirectory(albumId);
        FutureTask<AlbumSnapshot> task = new FutureTask<>(() -> {
            try {
                return runPipeline(albumId, albumDirectory);
            } catch (PipelineException e) {
                logger.error("Album {} pipeline failed: {}", albumId, e.getMessage());
                return null;
            } finally {
                running.remove(albumId);
            }
        });
        if (running.putIfAbsent(albumId, task) != null) {
            logger.info("Album {} is already being processed, trigger ignored", albumId);
            return false;
        }
        updateState(albumId, albumDirectory, state -> state.withStatus(AlbumStatus.PROCESSING, null));
        executorService.execute(task);
        return true;
    }

    public boolean isRunning(String albumId) {
        return running.containsKey(albumId);
    }

    /**
     * Waits for the running pipeline of an album, if any.
     *
     * @return true when no pipeline is running anymore
     */
    public boolean awaitIdle(String albumId, long timeout, TimeUnit unit) throws InterruptedException {
        FutureTask<AlbumSnapshot> task = running.get(albumId);
        if (task == null) {
            return true;
        }
        try {
            task.get(timeout, unit);
        } catch (ExecutionException e) {
            logger.error("Album {} pipeline task ended abnormally", albumId, e.getCause());
        } catch (TimeoutException e) {
            return false;
        }
        return true;
    }

    /**
     * Runs the album pipeline on the calling thread: sync the metadata cache, cluster the faces,
     * restore and extend global links, write representative crops and publish the new snapshot.
     * On failure the album goes to ERROR and the committed cache stays as it was.
     *
     * @throws AlbumBusyException when a pipeline for this album is already running
     */
    public AlbumSnapshot process(String albumId) throws PipelineException {
        File albumDirectory = albumDirectory(albumId);
        FutureTask<AlbumSnapshot> claim = new FutureTask<>(() -> null);
        if (running.putIfAbsent(albumId, claim) != null) {
            throw new AlbumBusyException(albumId);
        }
        try {
            return runPipeline(albumId, albumDirectory);
        } finally {
            running.remove(albumId);
            claim.run();
        }
    }

    private AlbumSnapshot runPipeline(String albumId, File albumDirectory) throws PipelineException {
        Date start = new Date();
        logger.info("= PROCESSING ALBUM {} =", albumId);
        updateState(albumId, albumDirectory, state -> state.withStatus(AlbumStatus.PROCESSING, null));
        try {
            DirectoryImageSource source = new DirectoryImageSource(albumDirectory);
            MetadataStore store = MetadataStore.forAlbum(albumDirectory);
            SyncReport report = store.sync(source, extractor);
            report.print();

            SortedMap<String, ImageMetadata> metadata = store.entries();
            List<PersonCluster> clusters = clusterer.cluster(metadata);
            writeRepresentativeCrops(albumDirectory, source, clusters, report);

            AlbumSnapshot snapshot;
            synchronized (albumLock(albumId)) {
                AlbumState state = currentState(albumId, albumDirectory);
                restoreLinks(albumId, clusters, state);
                matcher.link(albumId, clusters);
                SortedSet<FaceRef> hidden = retainedHidden(clusters, state.getHidden());
                AlbumState done = state.toBuilder()
                    .status(AlbumStatus.DONE)
                    .error(null)
                    .links(linksOf(clusters))
                    .hidden(hidden)
                    .build();
                saveState(albumId, albumDirectory, done);
                snapshot = new AlbumSnapshot(albumId, metadata, clusters, hidden);
                snapshots.put(albumId, snapshot);
            }
            logger.info("Album {} done: {} images, {} people", albumId, metadata.size(), clusters.size());
            Util.reportDeltaTime(start, new Date());
            return snapshot;
        } catch (IOException | ModelUnavailableException | RuntimeException e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            updateState(albumId, albumDirectory, state -> state.withStatus(AlbumStatus.ERROR, message));
            throw new PipelineException("Album " + albumId + " failed: " + message, e);
        }
    }

    public AlbumState status(String albumId) {
        return currentState(albumId, albumDirectory(albumId));
    }

    /**
     * Last committed snapshot. An album never processed by this instance is rebuilt from its cache
     * and state files, without running any model.
     */
    public AlbumSnapshot snapshot(String albumId) {
        File albumDirectory = albumDirectory(albumId);
        AlbumSnapshot snapshot = snapshots.get(albumId);
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (albumLock(albumId)) {
            snapshot = snapshots.get(albumId);
            if (snapshot == null) {
                SortedMap<String, ImageMetadata> metadata = MetadataStore.forAlbum(albumDirectory).load();
                List<PersonCluster> clusters = clusterer.cluster(metadata);
                AlbumState state = currentState(albumId, albumDirectory);
                restoreLinks(albumId, clusters, state);
                snapshot = new AlbumSnapshot(albumId, metadata, clusters, retainedHidden(clusters, state.getHidden()));
                snapshots.put(albumId, snapshot);
            }
            return snapshot;
        }
    }

    public List<AlbumPerson> listPeople(String albumId) {
        AlbumSnapshot snapshot = snapshot(albumId);
        List<AlbumPerson> people = new ArrayList<>();
        for (PersonCluster cluster : snapshot.visibleClusters()) {
            SortedSet<String> photos = new TreeSet<>();
            for (FaceRef ref : cluster.getMembers()) {
                photos.add(ref.getFilename());
            }
            people.add(AlbumPerson.builder()
                .personRef(personRefOf(albumId, cluster))
                .displayName(displayNameOf(cluster))
                .clusterIndex(cluster.getClusterIndex())
                .representative(cluster.getRepresentative())
                .cropName(cluster.getRepresentative().cropName())
                .photoCount(photos.size())
                .faceCount(cluster.size())
                .build());
        }
        return people;
    }

    public GlobalPerson renamePerson(String personRef, String name) throws IOException, PersonNotFoundException {
        PersonRef ref = PersonRef.parse(personRef);
        if (ref.isGlobal()) {
            return matcher.rename(ref, name, allAlbumClusters(), null);
        }
        File albumDirectory = albumDirectory(ref.getAlbumId());
        SortedMap<String, List<PersonCluster>> albumClusters = allAlbumClusters();
        synchronized (albumLock(ref.getAlbumId())) {
            GlobalPerson person = matcher.rename(ref, name, albumClusters, this::loadRepresentativeCrop);
            AlbumSnapshot snapshot = snapshot(ref.getAlbumId());
            AlbumState state = currentState(ref.getAlbumId(), albumDirectory);
            saveState(ref.getAlbumId(), albumDirectory, state.toBuilder().links(linksOf(snapshot.getClusters())).build());
            logger.info("Album {} person {} is now [{}]", ref.getAlbumId(), ref.getClusterIndex(), person.getName());
            return person;
        }
    }

    /**
     * Ranked photos of a person in every album where it appears. A global person is ranked in
     * each album holding a cluster linked to it.
     */
    public SortedMap<String, List<RankedPhoto>> rankedPhotos(String personRef) throws PersonNotFoundException {
        return rankedPhotos(personRef, configuration.getRankTopK());
    }

    public SortedMap<String, List<RankedPhoto>> rankedPhotos(String personRef, int topK) throws PersonNotFoundException {
        SortedMap<String, List<PersonCluster>> targets = clustersOf(PersonRef.parse(personRef));
        SortedMap<String, List<RankedPhoto>> rankings = new TreeMap<>();
        for (Map.Entry<String, List<PersonCluster>> entry : targets.entrySet()) {
            AlbumSnapshot snapshot = snapshot(entry.getKey());
            Map<String, RankedPhoto> best = new HashMap<>();
            for (PersonCluster cluster : entry.getValue()) {
                for (RankedPhoto photo : ranker.rank(snapshot.getMetadata(), cluster, 0)) {
                    RankedPhoto current = best.get(photo.getFilename());
                    if (current == null || photo.getScore() > current.getScore()) {
                        best.put(photo.getFilename(), photo);
                    }
                }
            }
            List<RankedPhoto> ranked = new ArrayList<>(best.values());
            Collections.sort(ranked);
            if (topK > 0 && ranked.size() > topK) {
                ranked = new ArrayList<>(ranked.subList(0, topK));
            }
            if (!ranked.isEmpty()) {
                rankings.put(entry.getKey(), ranked);
            }
        }
        return rankings;
    }

    public MatchResult findPersonByPhoto(BufferedImage image) throws DetectionException, NoFaceFoundException {
        return matcher.findByPhoto(extractor, image, configuration.getFindSimilarityThreshold(),
            configuration.getFindTopK(), allAlbumClusters());
    }

    /**
     * Albums and photos where the referenced person appears.
     */
    public SortedMap<String, SortedSet<String>> resolvePersonRef(String personRef) throws PersonNotFoundException {
        SortedMap<String, SortedSet<String>> photos = new TreeMap<>();
        for (Map.Entry<String, List<PersonCluster>> entry : clustersOf(PersonRef.parse(personRef)).entrySet()) {
            SortedSet<String> filenames = new TreeSet<>();
            for (PersonCluster cluster : entry.getValue()) {
                for (FaceRef ref : cluster.getMembers()) {
                    filenames.add(ref.getFilename());
                }
            }
            photos.put(entry.getKey(), filenames);
        }
        return photos;
    }

    public List<PhotoFace> facesInPhoto(String albumId, String filename) {
        AlbumSnapshot snapshot = snapshot(albumId);
        ImageMetadata image = snapshot.getMetadata().get(filename);
        if (image == null) {
            throw new IllegalArgumentException("No photo " + filename + " in album " + albumId);
        }
        List<PhotoFace> faces = new ArrayList<>();
        for (FaceRecord record : image.getFaces()) {
            FaceRef ref = new FaceRef(filename, record.getFaceIndex());
            PersonCluster cluster = snapshot.clusterOf(ref);
            PhotoFace.PhotoFaceBuilder face = PhotoFace.builder().face(ref).record(record);
            if (cluster != null && !snapshot.isHidden(cluster)) {
                face.personRef(personRefOf(albumId, cluster)).displayName(displayNameOf(cluster));
            }
            faces.add(face.build());
        }
        return faces;
    }

    /**
     * Removes a person from the album listings. The faces stay in the cache; the global person,
     * if any, is untouched.
     */
    public void hidePerson(String albumId, int clusterIndex) throws IOException, PersonNotFoundException {
        File albumDirectory = albumDirectory(albumId);
        synchronized (albumLock(albumId)) {
            AlbumSnapshot snapshot = snapshot(albumId);
            PersonCluster cluster = snapshot.cluster(clusterIndex);
            if (cluster == null) {
                throw new PersonNotFoundException("No person " + PersonRef.album(albumId, clusterIndex));
            }
            SortedSet<FaceRef> hidden = new TreeSet<>(snapshot.getHidden());
            hidden.add(cluster.getRepresentative());
            AlbumState state = currentState(albumId, albumDirectory);
            saveState(albumId, albumDirectory, state.toBuilder().hidden(Collections.unmodifiableSortedSet(hidden)).build());
            snapshots.put(albumId, new AlbumSnapshot(albumId, snapshot.getMetadata(), snapshot.getClusters(), hidden));
            logger.info("Album {} person {} hidden", albumId, clusterIndex);
        }
    }

    public File representativeCropFile(String albumId, PersonCluster cluster) {
        return new File(new File(albumDirectory(albumId), FACES_DIRECTORY), cluster.getRepresentative().cropName());
    }

    public void shutdown() {
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.warn("Album pipelines still running at shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private SortedMap<String, List<PersonCluster>> allAlbumClusters() {
        SortedMap<String, List<PersonCluster>> clusters = new TreeMap<>();
        for (String albumId : listAlbums()) {
            clusters.put(albumId, snapshot(albumId).visibleClusters());
        }
        return clusters;
    }

    private SortedMap<String, List<PersonCluster>> clustersOf(PersonRef ref) throws PersonNotFoundException {
        SortedMap<String, List<PersonCluster>> result = new TreeMap<>();
        if (!ref.isGlobal()) {
            AlbumSnapshot snapshot = snapshot(ref.getAlbumId());
            PersonCluster cluster = snapshot.cluster(ref.getClusterIndex());
            if (cluster == null || snapshot.isHidden(cluster)) {
                throw new PersonNotFoundException("No person " + ref);
            }
            result.put(ref.getAlbumId(), List.of(cluster));
            return result;
        }
        if (!matcher.getRegistry().contains(ref.getGlobalId())) {
            throw new PersonNotFoundException("No global person " + ref.getGlobalId());
        }
        for (Map.Entry<String, List<PersonCluster>> entry : allAlbumClusters().entrySet()) {
            List<PersonCluster> linked = new ArrayList<>();
            for (PersonCluster cluster : entry.getValue()) {
                if (ref.getGlobalId().equals(cluster.getGlobalId())) {
                    linked.add(cluster);
                }
            }
            if (!linked.isEmpty()) {
                result.put(entry.getKey(), linked);
            }
        }
        return result;
    }

    private PersonRef personRefOf(String albumId, PersonCluster cluster) {
        Optional<String> globalId = cluster.globalId();
        if (globalId.isPresent() && matcher.getRegistry().contains(globalId.get())) {
            return PersonRef.global(globalId.get());
        }
        return PersonRef.album(albumId, cluster.getClusterIndex());
    }

    private String displayNameOf(PersonCluster cluster) {
        Optional<GlobalPerson> person = cluster.globalId().flatMap(matcher.getRegistry()::get);
        return person.isPresent() ? person.get().getName() : IdentityMatcher.displayName(cluster);
    }

    private void restoreLinks(String albumId, List<PersonCluster> clusters, AlbumState state) {
        for (PersonCluster cluster : clusters) {
            String globalId = state.getLinks().get(cluster.getRepresentative());
            if (globalId != null) {
                cluster.linkTo(globalId);
            }
        }
        matcher.dropDanglingLinks(albumId, clusters);
    }

    private static SortedMap<FaceRef, String> linksOf(List<PersonCluster> clusters) {
        SortedMap<FaceRef, String> links = new TreeMap<>();
        for (PersonCluster cluster : clusters) {
            cluster.globalId().ifPresent(id -> links.put(cluster.getRepresentative(), id));
        }
        return Collections.unmodifiableSortedMap(links);
    }

    private static SortedSet<FaceRef> retainedHidden(List<PersonCluster> clusters, SortedSet<FaceRef> hidden) {
        SortedSet<FaceRef> retained = new TreeSet<>();
        for (PersonCluster cluster : clusters) {
            if (hidden.contains(cluster.getRepresentative())) {
                retained.add(cluster.getRepresentative());
            }
        }
        return Collections.unmodifiableSortedSet(retained);
    }

    private void writeRepresentativeCrops(File albumDirectory, DirectoryImageSource source, List<PersonCluster> clusters, SyncReport report) {
        File facesDirectory = new File(albumDirectory, FACES_DIRECTORY);
        for (PersonCluster cluster : clusters) {
            FaceRef representative = cluster.getRepresentative();
            File target = new File(facesDirectory, representative.cropName());
            if (target.exists() && !report.getUpdated().contains(representative.getFilename())) {
                continue;
            }
            try {
                BufferedImage image = source.read(representative.getFilename());
                if (image == null) {
                    logger.warn("Can not decode {} for its face crop", representative.getFilename());
                    continue;
                }
                FaceCropper.writeCrop(image, cluster.getRepresentativeFace().getBoundingBox(),
                    configuration.getFaceCropSize(), target);
            } catch (IOException e) {
                logger.warn("Can not write face crop {}: {}", target.getAbsolutePath(), e.getMessage());
            }
        }
    }

    private BufferedImage loadRepresentativeCrop(String albumId, PersonCluster cluster) throws IOException {
        File crop = representativeCropFile(albumId, cluster);
        if (crop.isFile()) {
            BufferedImage image = ImageIO.read(crop);
            if (image != null) {
                return image;
            }
        }
        DirectoryImageSource source = new DirectoryImageSource(albumDirectory(albumId));
        BufferedImage image = source.read(cluster.getRepresentative().getFilename());
        if (image == null) {
            return null;
        }
        return FaceCropper.crop(image, cluster.getRepresentativeFace().getBoundingBox());
    }

    private AlbumState currentState(String albumId, File albumDirectory) {
        AlbumState state = states.get(albumId);
        return state != null ? state : AlbumState.load(albumDirectory);
    }

    private void updateState(String albumId, File albumDirectory, UnaryOperator<AlbumState> change) {
        synchronized (albumLock(albumId)) {
            AlbumState next = change.apply(currentState(albumId, albumDirectory));
            try {
                saveState(albumId, albumDirectory, next);
            } catch (IOException e) {
                logger.error("Can not persist state of album {}: {}", albumId, e.getMessage());
                states.put(albumId, next);
            }
        }
    }

    private void saveState(String albumId, File albumDirectory, AlbumState state) throws IOException {
        state.save(albumDirectory);
        states.put(albumId, state);
    }

    private Object albumLock(String albumId) {
        return albumLocks.computeIfAbsent(albumId, key -> new Object());
    }

    private File albumDirectory(String albumId) {
        if (albumId == null || albumId.isEmpty() || albumId.startsWith(".")
            || albumId.contains("/") || albumId.contains("\\")) {
            throw new IllegalArgumentException("Invalid album id [" + albumId + "]");
        }
        File directory = new File(albumsRoot, albumId);
        if (!directory.isDirectory()) {
            throw new IllegalArgumentException("Unknown album [" + albumId + "] in " + albumsRoot.getAbsolutePath()
                + ", known: " + Arrays.toString(listAlbums().toArray()));
        }
        return directory;
    }
}
