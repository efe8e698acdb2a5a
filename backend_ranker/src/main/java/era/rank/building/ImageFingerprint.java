package era.rank.building;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.bson.Document;

@Getter
@ToString
@EqualsAndHashCode
public class ImageFingerprint implements Comparable<ImageFingerprint> {
    private final long size;
    private final long lastModified;

    public ImageFingerprint(long size, long lastModified) {
        this.size = size;
        this.lastModified = lastModified;
    }

    public Document toDocument() {
        return new Document("size", size).append("mtime", lastModified);
    }

    public static ImageFingerprint fromDocument(Document source) {
        return new ImageFingerprint(
            ((Number) source.get("size")).longValue(),
            ((Number) source.get("mtime")).longValue());
    }

    @Override
    public int compareTo(ImageFingerprint other) {
        if (this.size > other.size) {
            return 1;
        } else if (this.size < other.size) {
            return -1;
        }

        if (this.lastModified > other.lastModified) {
            return 1;
        } else if (this.lastModified < other.lastModified) {
            return -1;
        }

        return 0;
    }
}
