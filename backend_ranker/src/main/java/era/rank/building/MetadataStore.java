package era.rank.building;

import era.rank.base.Util;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * Incremental per-album cache of {@link ImageMetadata}, keyed by filename. This is the only place
 * images get decoded; clustering, matching and ranking read the committed entries.
 */
public class MetadataStore {
    private static final Logger logger = LogManager.getLogger(MetadataStore.class);
    public static final String CACHE_FILENAME = ".photo_ranker_metadata.json";
    public static final String FORMAT = "photo-ranker-album-cache";
    public static final int VERSION = 1;
    private static final int PROGRESS_REPORT_EVERY = 100;
    static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .indent(true)
        .build();

    private final File cacheFile;
    private volatile SortedMap<String, ImageMetadata> committed = Collections.emptySortedMap();
    private volatile boolean liveFileValid;

    public MetadataStore(File cacheFile) {
        this.cacheFile = cacheFile;
    }

    public static MetadataStore forAlbum(File albumDirectory) {
        return new MetadataStore(new File(albumDirectory, CACHE_FILENAME));
    }

    public File getCacheFile() {
        return cacheFile;
    }

    /**
     * Last committed entries, sorted by filename. Never a half-synced view.
     */
    public SortedMap<String, ImageMetadata> entries() {
        return committed;
    }

    /**
     * Reads the live cache file. A missing, unreadable, malformed or incompatible file is logged
     * and gives an empty cache that the next sync rebuilds.
     */
    public SortedMap<String, ImageMetadata> load() {
        SortedMap<String, ImageMetadata> loaded = new TreeMap<>();
        liveFileValid = false;
        if (!cacheFile.isFile()) {
            committed = Collections.unmodifiableSortedMap(loaded);
            return committed;
        }
        try {
            String json = FileUtils.readFileToString(cacheFile, StandardCharsets.UTF_8);
            Document root = Document.parse(json);
            if (!FORMAT.equals(root.getString("format"))) {
                throw new IllegalArgumentException("unknown format " + root.get("format"));
            }
            Object version = root.get("version");
            if (!(version instanceof Number) || ((Number) version).intValue() != VERSION) {
                throw new IllegalArgumentException("unsupported version " + version);
            }
            Object imagesObject = root.get("images");
            if (!(imagesObject instanceof Document)) {
                throw new IllegalArgumentException("no images section");
            }
            Document images = (Document) imagesObject;
            for (Map.Entry<String, Object> entry : images.entrySet()) {
                if (!(entry.getValue() instanceof Document)) {
                    throw new IllegalArgumentException("bad entry " + entry.getKey());
                }
                Document entryDocument = (Document) entry.getValue();
                loaded.put(entry.getKey(), ImageMetadata.fromDocument(entry.getKey(), entryDocument));
            }
            liveFileValid = true;
        } catch (IOException | RuntimeException e) {
            logger.warn("Discarding unusable metadata cache {} ({}), it will be rebuilt",
                cacheFile.getAbsolutePath(), e.getMessage());
            loaded.clear();
        }
        committed = Collections.unmodifiableSortedMap(loaded);
        return committed;
    }

    public void save(SortedMap<String, ImageMetadata> entries) throws IOException {
        Document images = new Document();
        for (Map.Entry<String, ImageMetadata> entry : entries.entrySet()) {
            images.append(entry.getKey(), entry.getValue().toDocument());
        }
        Document root = new Document("format", FORMAT)
            .append("version", VERSION)
            .append("images", images);
        Util.writeFileAtomically(cacheFile, root.toJson(JSON_SETTINGS) + "\n");
        committed = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
        liveFileValid = true;
    }

    /**
     * Brings the cache in line with the image source. Unchanged images are reused as they are,
     * new or modified ones (and retryable failures) are extracted again, vanished ones are
     * dropped. Nothing is persisted when the source can not be listed or the model is
     * unavailable, so the committed cache survives a failed pipeline.
     */
    public SyncReport sync(ImageSource source, QualitySignalExtractor extractor)
        throws IOException, ModelUnavailableException {
        SortedMap<String, ImageMetadata> previous = load();
        SortedMap<String, ImageMetadata> next = new TreeMap<>();
        SyncReport report = new SyncReport();

        List<String> filenames = source.listImages();
        int n = 0;
        for (String filename : filenames) {
            n++;
            if (n % PROGRESS_REPORT_EVERY == 0) {
                logger.info("Images checked for metadata: {} of {}", n, filenames.size());
            }

            ImageFingerprint fingerprint;
            try {
                fingerprint = source.fingerprint(filename);
            } catch (IOException e) {
                logger.warn("Image {} vanished during sync: {}", filename, e.getMessage());
                continue;
            }

            ImageMetadata existing = previous.get(filename);
            if (existing != null && !existing.isRetryable() && fingerprint.equals(existing.getFingerprint())) {
                next.put(filename, existing);
                report.markReused();
                continue;
            }

            ImageMetadata extracted = extractOne(source, extractor, filename)
                .toBuilder()
                .filename(filename)
                .fingerprint(fingerprint)
                .build();
            if (extracted.isFailed()) {
                logger.warn("Extraction failed for {}: {}", filename, extracted.getFailureMessage());
                report.markFailed(filename);
            }
            next.put(filename, extracted);
            report.markUpdated(filename);
        }

        for (String filename : previous.keySet()) {
            if (!next.containsKey(filename)) {
                report.markRemoved(filename);
            }
        }

        if (report.hasChanges() || !liveFileValid) {
            save(next);
        }
        return report;
    }

    private static ImageMetadata extractOne(ImageSource source, QualitySignalExtractor extractor, String filename)
        throws ModelUnavailableException {
        BufferedImage image;
        try {
            image = source.read(filename);
        } catch (IOException e) {
            return failedEntry("can not read image: " + e.getMessage());
        }
        if (image == null) {
            return failedEntry("not a decodable image");
        }
        return extractor.extract(image);
    }

    private static ImageMetadata failedEntry(String message) {
        return ImageMetadata.builder()
            .blurScore(0.0)
            .failed(true)
            .failureMessage(message)
            .build();
    }
}
