package era.rank.mining;

import era.rank.base.Embeddings;
import era.rank.base.Util;
import era.rank.building.FaceCropper;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import javax.imageio.ImageIO;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

/**
 * Process wide store of {@link GlobalPerson} entries. It is the only owner of the registry file:
 * writes are serialized and committed atomically, reads use the last committed snapshot without
 * taking the lock. List order is creation order.
 */
public class GlobalPersonRegistry {
    private static final Logger logger = LogManager.getLogger(GlobalPersonRegistry.class);
    public static final String REGISTRY_FILENAME = "global_people.json";
    public static final String CROP_DIRECTORY = "faces";
    public static final String FORMAT = "photo-ranker-global-people";
    public static final int VERSION = 1;
    public static final String UNNAMED = "Unnamed";
    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .indent(true)
        .build();

    private final File directory;
    private final int cropSize;
    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile List<GlobalPerson> snapshot = Collections.emptyList();

    public GlobalPersonRegistry(File directory, int cropSize) {
        this.directory = directory;
        this.cropSize = cropSize;
        this.snapshot = readFromDisk();
    }

    public File getRegistryFile() {
        return new File(directory, REGISTRY_FILENAME);
    }

    public File cropFile(GlobalPerson person) {
        return person.getCropRef() == null ? null : new File(directory, person.getCropRef());
    }

    public List<GlobalPerson> list() {
        return snapshot;
    }

    public Optional<GlobalPerson> get(String id) {
        for (GlobalPerson person : snapshot) {
            if (person.getId().equals(id)) {
                return Optional.of(person);
            }
        }
        return Optional.empty();
    }

    public boolean contains(String id) {
        return get(id).isPresent();
    }

    /**
     * Creation position of the person, used to break similarity ties. -1 when unknown.
     */
    public int creationOrder(String id) {
        List<GlobalPerson> people = snapshot;
        for (int i = 0; i < people.size(); i++) {
            if (people.get(i).getId().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @param faceCrop representative face pixels, stored as the crop thumbnail; may be null
     */
    public GlobalPerson add(String name, float[] embedding, BufferedImage faceCrop) throws IOException {
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("embedding required");
        }
        writeLock.lock();
        try {
            String id = UUID.randomUUID().toString();
            String cropRef = null;
            if (faceCrop != null) {
                cropRef = CROP_DIRECTORY + "/" + id + ".jpg";
                File target = new File(directory, cropRef);
                FileUtils.forceMkdirParent(target);
                if (!ImageIO.write(FaceCropper.resizeSquare(faceCrop, cropSize), "jpg", target)) {
                    logger.warn("No JPEG writer, global person {} stored without crop", id);
                    cropRef = null;
                }
            }
            GlobalPerson person = GlobalPerson.builder()
                .id(id)
                .name(cleanName(name))
                .representativeEmbedding(Embeddings.l2Normalize(embedding))
                .cropRef(cropRef)
                .build();
            List<GlobalPerson> next = new ArrayList<>(snapshot);
            next.add(person);
            commit(next);
            logger.info("Global person {} created as [{}]", id, person.getName());
            return person;
        } finally {
            writeLock.unlock();
        }
    }

    public GlobalPerson rename(String id, String name) throws IOException, PersonNotFoundException {
        writeLock.lock();
        try {
            List<GlobalPerson> next = new ArrayList<>(snapshot);
            for (int i = 0; i < next.size(); i++) {
                if (next.get(i).getId().equals(id)) {
                    GlobalPerson renamed = next.get(i).toBuilder().name(cleanName(name)).build();
                    next.set(i, renamed);
                    commit(next);
                    return renamed;
                }
            }
            throw new PersonNotFoundException("Global person " + id + " not found");
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Direct removal, the only way a global person goes away.
     */
    public boolean remove(String id) throws IOException {
        writeLock.lock();
        try {
            List<GlobalPerson> next = new ArrayList<>(snapshot);
            GlobalPerson removed = null;
            for (GlobalPerson person : next) {
                if (person.getId().equals(id)) {
                    removed = person;
                    break;
                }
            }
            if (removed == null) {
                return false;
            }
            next.remove(removed);
            commit(next);
            File crop = cropFile(removed);
            if (crop != null && crop.exists() && !crop.delete()) {
                logger.warn("Can not delete crop {}", crop.getAbsolutePath());
            }
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    static String cleanName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return UNNAMED;
        }
        return name.trim();
    }

    private void commit(List<GlobalPerson> people) throws IOException {
        List<Document> documents = new ArrayList<>();
        for (GlobalPerson person : people) {
            documents.add(person.toDocument());
        }
        Document root = new Document("format", FORMAT)
            .append("version", VERSION)
            .append("people", documents);
        Util.writeFileAtomically(getRegistryFile(), root.toJson(JSON_SETTINGS) + "\n");
        snapshot = Collections.unmodifiableList(people);
    }

    private List<GlobalPerson> readFromDisk() {
        File file = getRegistryFile();
        if (!file.isFile()) {
            return Collections.emptyList();
        }
        try {
            Document root = Document.parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
            Object version = root.get("version");
            if (!FORMAT.equals(root.getString("format"))
                || !(version instanceof Number) || ((Number) version).intValue() != VERSION) {
                throw new IllegalArgumentException("incompatible registry format");
            }
            List<GlobalPerson> people = new ArrayList<>();
            for (Document document : root.getList("people", Document.class, List.of())) {
                people.add(GlobalPerson.fromDocument(document));
            }
            return Collections.unmodifiableList(people);
        } catch (IOException | RuntimeException e) {
            logger.error("Can not read global registry {} ({}), starting empty", file.getAbsolutePath(), e.getMessage());
            return Collections.emptyList();
        }
    }
}
