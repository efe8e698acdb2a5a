package era.rank.building;

import era.rank.base.Embeddings;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.bson.Document;

@Getter
@Builder
@ToString(exclude = "embedding")
public class FaceRecord {
    private final int faceIndex;
    private final BoundingBox boundingBox;
    private final float[] embedding;
    private final double facingScore;
    private final double confidence;
    private final int sizePx;
    private final double smileScore;

    public float[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    public Document toDocument() {
        return new Document("i", faceIndex)
            .append("bbox", boundingBox.toList())
            .append("embedding", Embeddings.toList(embedding))
            .append("facing", facingScore)
            .append("confidence", confidence)
            .append("size", sizePx)
            .append("smile", smileScore);
    }

    public static FaceRecord fromDocument(Document source) {
        return FaceRecord.builder()
            .faceIndex(source.getInteger("i"))
            .boundingBox(BoundingBox.fromList(source.getList("bbox", Number.class)))
            .embedding(Embeddings.fromList(source.getList("embedding", Number.class)))
            .facingScore(number(source, "facing"))
            .confidence(number(source, "confidence"))
            .sizePx(((Number) source.get("size")).intValue())
            .smileScore(number(source, "smile"))
            .build();
    }

    static double number(Document source, String key) {
        Object value = source.get(key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Missing numeric field " + key);
        }
        return ((Number) value).doubleValue();
    }

    public static class FaceRecordBuilder {
        public FaceRecordBuilder embedding(float[] embedding) {
            this.embedding = embedding == null ? null : embedding.clone();
            return this;
        }
    }

    static List<FaceRecord> fromDocuments(List<Document> documents) {
        return documents.stream().map(FaceRecord::fromDocument).toList();
    }
}
