package era.rank.album;

import era.rank.base.Util;
import era.rank.mining.FaceRef;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * Persisted per album state: pipeline status, global links and hidden people. Links and hidden
 * people are keyed by the representative face, which survives re-clustering while cluster
 * indexes do not.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class AlbumState {
    private static final Logger logger = LogManager.getLogger(AlbumState.class);
    public static final String STATE_FILENAME = ".photo_ranker_album.json";
    public static final String FORMAT = "photo-ranker-album-state";
    public static final int VERSION = 1;
    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .indent(true)
        .build();

    @Builder.Default
    private final AlbumStatus status = AlbumStatus.PENDING;
    private final String error;
    @Builder.Default
    private final SortedMap<FaceRef, String> links = Collections.emptySortedMap();
    @Builder.Default
    private final SortedSet<FaceRef> hidden = Collections.emptySortedSet();

    public static File stateFile(File albumDirectory) {
        return new File(albumDirectory, STATE_FILENAME);
    }

    public AlbumState withStatus(AlbumStatus newStatus, String newError) {
        return toBuilder().status(newStatus).error(newError).build();
    }

    public Document toDocument() {
        List<Document> linkDocuments = new ArrayList<>();
        for (Map.Entry<FaceRef, String> link : links.entrySet()) {
            linkDocuments.add(link.getKey().toDocument().append("global", link.getValue()));
        }
        List<Document> hiddenDocuments = new ArrayList<>();
        for (FaceRef ref : hidden) {
            hiddenDocuments.add(ref.toDocument());
        }
        Document document = new Document("format", FORMAT)
            .append("version", VERSION)
            .append("status", status.name());
        if (error != null) {
            document.append("error", error);
        }
        return document
            .append("links", linkDocuments)
            .append("hidden", hiddenDocuments);
    }

    public static AlbumState fromDocument(Document source) {
        Object version = source.get("version");
        if (!FORMAT.equals(source.getString("format"))
            || !(version instanceof Number) || ((Number) version).intValue() != VERSION) {
            throw new IllegalArgumentException("incompatible album state format");
        }
        SortedMap<FaceRef, String> links = new TreeMap<>();
        for (Document link : source.getList("links", Document.class, List.of())) {
            links.put(FaceRef.fromDocument(link), link.getString("global"));
        }
        SortedSet<FaceRef> hidden = new TreeSet<>();
        for (Document ref : source.getList("hidden", Document.class, List.of())) {
            hidden.add(FaceRef.fromDocument(ref));
        }
        return AlbumState.builder()
            .status(AlbumStatus.valueOf(source.getString("status")))
            .error(source.getString("error"))
            .links(Collections.unmodifiableSortedMap(links))
            .hidden(Collections.unmodifiableSortedSet(hidden))
            .build();
    }

    /**
     * Reads the album state; a missing or unusable file gives a fresh PENDING state.
     */
    public static AlbumState load(File albumDirectory) {
        File file = stateFile(albumDirectory);
        if (!file.isFile()) {
            return AlbumState.builder().build();
        }
        try {
            return fromDocument(Document.parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8)));
        } catch (IOException | RuntimeException e) {
            logger.warn("Discarding unusable album state {} ({})", file.getAbsolutePath(), e.getMessage());
            return AlbumState.builder().build();
        }
    }

    public void save(File albumDirectory) throws IOException {
        Util.writeFileAtomically(stateFile(albumDirectory), toDocument().toJson(JSON_SETTINGS) + "\n");
    }
}
