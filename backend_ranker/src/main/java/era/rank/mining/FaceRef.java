package era.rank.mining;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.bson.Document;

@Getter
@EqualsAndHashCode
public class FaceRef implements Comparable<FaceRef> {
    private final String filename;
    private final int faceIndex;

    public FaceRef(String filename, int faceIndex) {
        this.filename = filename;
        this.faceIndex = faceIndex;
    }

    @Override
    public int compareTo(FaceRef other) {
        int status = this.filename.compareTo(other.filename);
        if (status != 0) {
            return status;
        }
        return Integer.compare(this.faceIndex, other.faceIndex);
    }

    public Document toDocument() {
        return new Document("file", filename).append("face", faceIndex);
    }

    public static FaceRef fromDocument(Document source) {
        return new FaceRef(source.getString("file"), ((Number) source.get("face")).intValue());
    }

    /**
     * File name friendly key, used for representative crop files.
     */
    public String cropName() {
        return filename + "_" + faceIndex + ".jpg";
    }

    @Override
    public String toString() {
        return filename + "#" + faceIndex;
    }
}
