package era.rank.building;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import org.bson.Document;

@Getter
@Builder(toBuilder = true)
@ToString
public class ImageMetadata {
    private final String filename;
    private final ImageFingerprint fingerprint;
    private final double blurScore;
    @Singular
    private final List<FaceRecord> faces;
    private final boolean failed;
    private final String failureMessage;
    // detection model failures are extracted again on the next sync, unreadable files are not
    private final boolean retryable;

    public int faceCount() {
        return faces.size();
    }

    public FaceRecord face(int faceIndex) {
        for (FaceRecord face : faces) {
            if (face.getFaceIndex() == faceIndex) {
                return face;
            }
        }
        return null;
    }

    public Document toDocument() {
        List<Document> faceDocuments = new ArrayList<>();
        for (FaceRecord face : faces) {
            faceDocuments.add(face.toDocument());
        }
        Document document = new Document("fingerprint", fingerprint.toDocument())
            .append("blur", blurScore)
            .append("faces", faceDocuments);
        if (failed) {
            document.append("failed", true);
            document.append("error", failureMessage == null ? "" : failureMessage);
            document.append("retry", retryable);
        }
        return document;
    }

    public static ImageMetadata fromDocument(String filename, Document source) {
        Object fingerprintObject = source.get("fingerprint");
        if (!(fingerprintObject instanceof Document)) {
            throw new IllegalArgumentException("Entry " + filename + " has no fingerprint");
        }
        Document fingerprintDocument = (Document) fingerprintObject;
        return ImageMetadata.builder()
            .filename(filename)
            .fingerprint(ImageFingerprint.fromDocument(fingerprintDocument))
            .blurScore(FaceRecord.number(source, "blur"))
            .faces(FaceRecord.fromDocuments(source.getList("faces", Document.class, List.of())))
            .failed(source.getBoolean("failed", false))
            .failureMessage(source.getString("error"))
            .retryable(source.getBoolean("retry", false))
            .build();
    }
}
