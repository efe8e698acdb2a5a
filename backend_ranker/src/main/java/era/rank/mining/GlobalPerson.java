package era.rank.mining;

import era.rank.base.Embeddings;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.bson.Document;

@Getter
@Builder(toBuilder = true)
@ToString(exclude = "representativeEmbedding")
public class GlobalPerson {
    private final String id;
    private final String name;
    private final float[] representativeEmbedding;
    private final String cropRef;

    public float[] getRepresentativeEmbedding() {
        return representativeEmbedding == null ? null : representativeEmbedding.clone();
    }

    public Document toDocument() {
        Document document = new Document("id", id)
            .append("name", name)
            .append("embedding", Embeddings.toList(representativeEmbedding));
        if (cropRef != null) {
            document.append("crop", cropRef);
        }
        return document;
    }

    public static GlobalPerson fromDocument(Document source) {
        String id = source.getString("id");
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("Global person without id");
        }
        return GlobalPerson.builder()
            .id(id)
            .name(source.getString("name"))
            .representativeEmbedding(Embeddings.fromList(source.getList("embedding", Number.class)))
            .cropRef(source.getString("crop"))
            .build();
    }

    public static class GlobalPersonBuilder {
        public GlobalPersonBuilder representativeEmbedding(float[] representativeEmbedding) {
            this.representativeEmbedding = representativeEmbedding == null ? null : representativeEmbedding.clone();
            return this;
        }
    }
}
